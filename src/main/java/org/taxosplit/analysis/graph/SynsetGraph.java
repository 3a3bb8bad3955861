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

import org.jgrapht.Graphs;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DefaultGraphType;
import org.jgrapht.graph.EdgeReversedGraph;
import org.jgrapht.traverse.BreadthFirstIterator;
import org.jgrapht.util.SupplierUtil;

import org.taxosplit.TaxoSplitUtils;
import org.taxosplit.analysis.SplitException;
import org.taxosplit.taxonomy.Synset;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Class for accessing a WordNet taxonomy as a directed acyclic graph. Edges
 * point from parent (hypernym) to child (hyponym) synsets, and a synset may
 * have multiple parents. The graph indexes its synsets by WordNet id, so ids
 * are unique within a graph instance.
 * <p>
 * Most operations act on a sub-set of the graph's vertices (a "node set"),
 * mirroring how sampling graphs are carved out of the full taxonomy: the node
 * set is first {@link #isolate(Set) isolated} from the rest of the universe
 * and then {@link #collapse(Set) collapsed}.
 * </p>
 */
public class SynsetGraph extends TaxonomyGraph<Synset, DefaultEdge> {

	private static final long serialVersionUID = 1L;
	private final Map<String, Synset> idMap;

	public SynsetGraph() {
		super(null, SupplierUtil.createSupplier(DefaultEdge.class), new DefaultGraphType.Builder()
				.directed().allowMultipleEdges(false).allowSelfLoops(false).allowCycles(false).weighted(false)
				.modifiable(true)
				.build());
		idMap = new HashMap<>();
	}

	/**
	 * Adds a synset to this graph.
	 *
	 * @param synset the synset to be added
	 * @return true if the synset was added, false if it was already present
	 * @throws IllegalArgumentException if a different synset with the same id
	 *                                  already exists in this graph
	 */
	@Override
	public boolean addVertex(final Synset synset) {
		final Synset existing = idMap.get(synset.id());
		if (existing != null && existing != synset) {
			throw new IllegalArgumentException("Graph already contains a synset with id " + synset.id());
		}
		final boolean added = super.addVertex(synset);
		if (added) {
			idMap.put(synset.id(), synset);
		}
		return added;
	}

	@Override
	public boolean removeVertex(final Synset synset) {
		final boolean removed = super.removeVertex(synset);
		if (removed && idMap.get(synset.id()) == synset) {
			idMap.remove(synset.id());
		}
		return removed;
	}

	/**
	 * Retrieves the synset with the specified id, creating it if it does not
	 * exist.
	 *
	 * @param id    the WordNet id
	 * @param label the label used if a new synset needs to be created
	 * @return the synset of this graph with the specified id
	 */
	public Synset addSynset(final String id, final String label) {
		final Synset existing = idMap.get(id);
		if (existing != null) {
			return existing;
		}
		final Synset synset = new Synset(id, label);
		addVertex(synset);
		return synset;
	}

	/**
	 * Links a parent synset to a child synset. Adding a link that already exists
	 * is a no-op.
	 *
	 * @param parent the parent (hypernym)
	 * @param child  the child (hyponym)
	 * @return true if a new link was created
	 */
	public boolean addLink(final Synset parent, final Synset child) {
		if (parent == child) {
			throw new IllegalArgumentException("Synset cannot be its own parent: " + parent);
		}
		return addEdge(parent, child) != null;
	}

	/**
	 * Gets the synset with the specified id.
	 *
	 * @param id the WordNet id
	 * @return the synset or null if no synset in this graph has such id
	 */
	public Synset getSynset(final String id) {
		return idMap.get(id);
	}

	/**
	 * Gets the synsets with the specified ids.
	 *
	 * @param ids the WordNet ids
	 * @return the map of ids to synsets
	 * @throws SplitException if any of the ids could not be found
	 */
	public Map<String, Synset> getSynsets(final Collection<String> ids) {
		return findByIds(ids, vertexSet());
	}

	/** @return the direct children (hyponyms) of {@code synset} */
	public List<Synset> getChildren(final Synset synset) {
		return Graphs.successorListOf(this, synset);
	}

	/** @return the direct parents (hypernyms) of {@code synset} */
	public List<Synset> getParents(final Synset synset) {
		return Graphs.predecessorListOf(this, synset);
	}

	/**
	 * Gets the leaves of the graph, i.e., the synsets without children.
	 *
	 * @return the list of leaves, sorted by id
	 */
	public List<Synset> getLeaves() {
		return getLeaves(vertexSet());
	}

	/**
	 * Gets the synsets of a node set that have no children.
	 *
	 * @param nodes the node set
	 * @return the list of leaves, sorted by id
	 */
	public List<Synset> getLeaves(final Collection<Synset> nodes) {
		return nodes.stream().filter(n -> outDegreeOf(n) == 0).sorted(Synset.comparator())
				.collect(Collectors.toList());
	}

	/**
	 * Gets the synsets without parents.
	 *
	 * @return the list of roots, sorted by id
	 */
	public List<Synset> getRoots() {
		return vertexSet().stream().filter(v -> inDegreeOf(v) == 0).sorted(Synset.comparator())
				.collect(Collectors.toList());
	}

	/**
	 * Gets all the strict ancestors of a synset, i.e., the synsets reachable
	 * through repeated parent traversal, excluding the synset itself.
	 *
	 * @param synset the synset
	 * @return the ancestors, in breadth-first visiting order
	 */
	public Set<Synset> getAncestors(final Synset synset) {
		if (!containsVertex(synset)) {
			throw new IllegalArgumentException("Synset not contained in graph: " + synset);
		}
		final Set<Synset> ancestors = new LinkedHashSet<>();
		final BreadthFirstIterator<Synset, DefaultEdge> iter = new BreadthFirstIterator<>(
				new EdgeReversedGraph<>(this), synset);
		iter.next(); // the synset itself
		while (iter.hasNext()) {
			ancestors.add(iter.next());
		}
		return ancestors;
	}

	/**
	 * Gets the union of the strict ancestors of a collection of synsets.
	 *
	 * @param synsets the synsets
	 * @return the ancestors set
	 */
	public Set<Synset> getAncestors(final Collection<Synset> synsets) {
		final Set<Synset> ancestors = new LinkedHashSet<>();
		for (final Synset synset : synsets) {
			ancestors.addAll(getAncestors(synset));
		}
		return ancestors;
	}

	/**
	 * Removes all the links between the synsets of {@code nodes} and synsets
	 * outside of it. Following the children/parents of any member of the
	 * isolated set can only lead to other members of the set.
	 *
	 * @param nodes the node set to be isolated
	 */
	public void isolate(final Set<Synset> nodes) {
		final Set<DefaultEdge> crossing = new LinkedHashSet<>();
		for (final Synset node : nodes) {
			for (final DefaultEdge edge : edgesOf(node)) {
				if (!nodes.contains(getEdgeSource(edge)) || !nodes.contains(getEdgeTarget(edge))) {
					crossing.add(edge);
				}
			}
		}
		removeAllEdges(crossing);
	}

	/**
	 * Detaches a synset from all of its parents and children. The synset
	 * remains a vertex of this graph.
	 *
	 * @param synset the synset to be detached
	 */
	public void excise(final Synset synset) {
		removeAllEdges(new ArrayList<>(edgesOf(synset)));
	}

	/**
	 * Collapses the synsets of a node set that have a single child: the synset is
	 * removed and its child attached to the synset's parent(s). Passes are
	 * repeated until no synset is collapsed.
	 *
	 * @param nodes the node set (typically already {@link #isolate(Set) isolated})
	 * @return the synsets of {@code nodes} that were not collapsed
	 */
	public Set<Synset> collapse(final Set<Synset> nodes) {
		Set<Synset> survivors = new LinkedHashSet<>(nodes);
		int pass = 0;
		int numCollapsed;
		do {
			numCollapsed = 0;
			final Set<Synset> nonCollapsed = new LinkedHashSet<>();
			final List<Synset> sorted = survivors.stream().sorted(Synset.comparator()).collect(Collectors.toList());
			for (final Synset node : sorted) {
				if (outDegreeOf(node) == 1) {
					final Synset child = getChildren(node).get(0);
					for (final Synset parent : getParents(node)) {
						addLink(parent, child);
					}
					excise(node);
					numCollapsed++;
				} else {
					nonCollapsed.add(node);
				}
			}
			if (survivors.size() - nonCollapsed.size() != numCollapsed) {
				throw new IllegalStateException("Collapse bookkeeping mismatch: " + survivors.size() + " nodes, "
						+ nonCollapsed.size() + " survivors, " + numCollapsed + " collapsed");
			}
			survivors = nonCollapsed;
			TaxoSplitUtils.log("Collapse pass " + (++pass) + ": " + numCollapsed + " synset(s) collapsed");
		} while (numCollapsed > 0);
		return survivors;
	}

	/**
	 * Removes from this graph every synset that is not part of {@code nodes}.
	 *
	 * @param nodes the synsets to be kept
	 */
	public void retainAll(final Collection<Synset> nodes) {
		final Set<Synset> keep = (nodes instanceof Set) ? (Set<Synset>) nodes : new HashSet<>(nodes);
		final List<Synset> toRemove = vertexSet().stream().filter(v -> !keep.contains(v))
				.collect(Collectors.toList());
		removeAllVertices(toRemove);
	}

	/**
	 * Creates a copy of a node set. A new synset is created for each member of
	 * {@code nodes}, and the parent/child links among members are re-created
	 * between the new synsets.
	 *
	 * @param nodes an isolated node set of this graph
	 * @return the new graph. Use {@link #getSynset(String)} to retrieve the copy
	 *         of a specific synset
	 * @throws IllegalArgumentException if {@code nodes} is not isolated, i.e., if
	 *                                  any of its members is linked to a synset
	 *                                  outside of it
	 */
	public SynsetGraph copy(final Collection<Synset> nodes) {
		final SynsetGraph copy = new SynsetGraph();
		final Map<Synset, Synset> copies = new HashMap<>();
		for (final Synset node : nodes) {
			final Synset duplicate = node.duplicate();
			copy.addVertex(duplicate);
			copies.put(node, duplicate);
		}
		for (final Synset node : nodes) {
			for (final Synset parent : getParents(node)) {
				if (!copies.containsKey(parent)) {
					throw new IllegalArgumentException(
							"Cannot copy non-isolated node set: parent " + parent + " of " + node + " is not a member");
				}
			}
			for (final Synset child : getChildren(node)) {
				final Synset childCopy = copies.get(child);
				if (childCopy == null) {
					throw new IllegalArgumentException(
							"Cannot copy non-isolated node set: child " + child + " of " + node + " is not a member");
				}
				copy.addLink(copies.get(node), childCopy);
			}
		}
		return copy;
	}

	/**
	 * Gets all the upward paths from {@code start}. Since the taxonomy is not a
	 * tree, there may be more than one such path. Each path is ordered from
	 * {@code start} upwards.
	 *
	 * @param start the first synset of every path
	 * @param end   the last synset of every path. If null, paths end at the
	 *              first synset without parents
	 * @return the list of paths. Empty if {@code end} is not null and
	 *         {@code start} has no parents
	 * @throws IllegalArgumentException if {@code end} is not null and does not
	 *                                  belong to this graph
	 */
	public List<List<Synset>> getUpwardPaths(final Synset start, final Synset end) {
		if (end != null && !containsVertex(end)) {
			throw new IllegalArgumentException("End synset not contained in graph: " + end);
		}
		final List<List<Synset>> paths = new ArrayList<>();
		if (end != null && inDegreeOf(start) == 0) {
			return paths;
		}
		final int maxLength = vertexSet().size();
		final Deque<List<Synset>> stack = new ArrayDeque<>();
		stack.push(Collections.singletonList(start));
		while (!stack.isEmpty()) {
			final List<Synset> path = stack.pop();
			final Synset last = path.get(path.size() - 1);
			if ((end != null && last == end) || (end == null && inDegreeOf(last) == 0)) {
				paths.add(path);
				continue;
			}
			final List<Synset> parents = getParents(last);
			if (parents.isEmpty()) continue; // dead end: end is not an ancestor along this path
			if (path.size() >= maxLength) {
				throw new IllegalStateException("Upward path from " + start + " exceeds graph size. Cyclic graph?");
			}
			// push in reverse so that paths are returned in parent order
			for (int i = parents.size() - 1; i >= 0; i--) {
				final List<Synset> extended = new ArrayList<>(path.size() + 1);
				extended.addAll(path);
				extended.add(parents.get(i));
				stack.push(extended);
			}
		}
		return paths;
	}

	/**
	 * Gets all the upward paths from {@code start} to a synset without parents.
	 *
	 * @param start the first synset of every path
	 * @return the list of paths
	 */
	public List<List<Synset>> getUpwardPaths(final Synset start) {
		return getUpwardPaths(start, null);
	}

	/**
	 * Assesses if a synset is a descendant of another. A synset is never a
	 * descendant of itself.
	 *
	 * @param descendant the putative descendant
	 * @param ancestor   the putative ancestor
	 * @return true if an upward path of length two or more leads from
	 *         {@code descendant} to {@code ancestor}
	 */
	public boolean isDescendant(final Synset descendant, final Synset ancestor) {
		if (descendant == ancestor) {
			return false;
		}
		return getAncestors(descendant).contains(ancestor);
	}

	/**
	 * Checks that this graph is acyclic.
	 *
	 * @throws IllegalStateException if a cycle is found
	 */
	public void validate() throws IllegalStateException {
		final CycleDetector<Synset, DefaultEdge> detector = new CycleDetector<>(this);
		if (detector.detectCycles()) {
			final List<String> ids = detector.findCycles().stream().map(Synset::id).sorted()
					.collect(Collectors.toList());
			throw new IllegalStateException("Taxonomy is not acyclic. Synsets involved in cycles: " + ids);
		}
	}

	/**
	 * Gets the synset of a node set with the specified id.
	 *
	 * @param id    the WordNet id
	 * @param nodes the node set to be searched
	 * @return the synset or null if not found
	 */
	public static Synset findById(final String id, final Collection<Synset> nodes) {
		for (final Synset node : nodes) {
			if (node.id().equals(id)) {
				return node;
			}
		}
		return null;
	}

	/**
	 * Gets the synsets of a node set with the specified ids.
	 *
	 * @param ids   the WordNet ids
	 * @param nodes the node set to be searched
	 * @return a map of ids to synsets, in the iteration order of {@code ids}
	 * @throws SplitException if any of {@code ids} is not found. The exception
	 *                        lists every missing id
	 */
	public static Map<String, Synset> findByIds(final Collection<String> ids, final Collection<Synset> nodes) {
		final Map<String, Synset> byId = new HashMap<>();
		for (final Synset node : nodes) {
			byId.put(node.id(), node);
		}
		final Map<String, Synset> found = new LinkedHashMap<>();
		final SortedSet<String> missing = new TreeSet<>();
		for (final String id : ids) {
			final Synset synset = byId.get(id);
			if (synset == null) {
				missing.add(id);
			} else {
				found.put(id, synset);
			}
		}
		if (!missing.isEmpty()) {
			throw SplitException.missingIds(missing);
		}
		return found;
	}

}
