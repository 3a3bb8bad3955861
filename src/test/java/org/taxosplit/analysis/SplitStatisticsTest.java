/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2024 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package org.taxosplit.analysis;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

/**
 * Tests for {@link SplitStatistics} and {@link ClassSplits}
 */
public class SplitStatisticsTest {

	private final double precision = 0.0001;
	private ClassSplits splits;
	private Map<String, Integer> counts;

	@Before
	public void setUp() {
		splits = new ClassSplits(Arrays.asList("b", "a"), Collections.singleton("c"), Collections.singleton("d"));
		counts = new HashMap<>();
		counts.put("a", 10);
		counts.put("b", 30);
		counts.put("c", 40);
		counts.put("d", 20);
	}

	@Test
	public void testClassSplits() {
		assertEquals(Arrays.asList("a", "b"), Arrays.asList(splits.get(Split.TRAIN).toArray()));
		assertEquals(4, splits.size());
		assertEquals(Split.TEST, splits.getSplitOf("d"));
		assertEquals(Arrays.asList("a", "b", "c", "d"), Arrays.asList(splits.getAllIds().toArray()));
		assertEquals("train: 2, valid: 1, test: 1 classes", splits.toString());
	}

	@Test(expected = UnsupportedOperationException.class)
	public void testClassSplitsAreImmutable() {
		splits.get(Split.VALID).add("e");
	}

	@Test
	public void testStatistics() {
		final SplitStatistics stats = new SplitStatistics(splits, counts);
		assertEquals(2, stats.getNumClasses(Split.TRAIN));
		assertEquals(40, stats.getNumImages(Split.TRAIN));
		assertEquals(20, stats.getSummary(Split.TRAIN).getMean(), precision);
		assertEquals(0.4, stats.getImageFraction(Split.TRAIN), precision);
		assertEquals(0.4, stats.getImageFraction(Split.VALID), precision);
		assertEquals(0.2, stats.getImageFraction(Split.TEST), precision);
		assertTrue(stats.toString().startsWith("train: 2 classes, 40 images"));
	}

	@Test
	public void testEmptySplit() {
		final SplitStatistics stats = new SplitStatistics(
				new ClassSplits(Collections.emptyList(), Collections.singleton("c"), Collections.singleton("d")),
				counts);
		assertEquals(0, stats.getNumClasses(Split.TRAIN));
		assertEquals(0, stats.getImageFraction(Split.TRAIN), precision);
		assertTrue(stats.toString().contains("train: 0 classes"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingCount() {
		counts.remove("c");
		new SplitStatistics(splits, counts);
	}

	@Test
	public void testSplitKeys() {
		assertEquals(Split.VALID, Split.fromString("valid"));
		assertEquals("test", Split.TEST.toString());
		assertEquals("valid", Split.VALID.key());
		try {
			Split.fromString("holdout");
			fail("Unknown split accepted");
		} catch (final IllegalArgumentException e) {
			// expected
		}
	}

}
