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
package org.taxosplit.analysis.graph;

import org.jgrapht.GraphType;
import org.jgrapht.graph.AbstractBaseGraph;
import org.jgrapht.graph.DefaultEdge;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Base class of directed taxonomy graphs that can hold a numeric value per
 * vertex (e.g., the number of images spanned by a synset).
 */
public abstract class TaxonomyGraph<V, E extends DefaultEdge> extends AbstractBaseGraph<V, E> {

	private static final long serialVersionUID = 3350871604917212381L;

	private final Map<V, Double> vertexValueMap;

	protected TaxonomyGraph(final Supplier<V> vertexSupplier, final Supplier<E> edgeSupplier, final GraphType type) {
		super(vertexSupplier, edgeSupplier, type);
		vertexValueMap = new HashMap<>();
	}

	public void setVertexValue(final V vertex, final double value) {
		if (containsVertex(vertex)) {
			vertexValueMap.put(vertex, value);
		}
	}

	public double getVertexValue(final V vertex) {
		final Double value = vertexValueMap.get(vertex);
		if (value == null) {
			throw new IllegalArgumentException("No value assigned to " + vertex);
		}
		return value;
	}

	public boolean hasVertexValue(final V vertex) {
		return vertexValueMap.containsKey(vertex);
	}

	@Override
	public boolean removeVertex(final V v) {
		final boolean removed = super.removeVertex(v);
		if (removed) {
			vertexValueMap.remove(v);
		}
		return removed;
	}
}
