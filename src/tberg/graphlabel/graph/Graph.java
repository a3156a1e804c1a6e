package tberg.graphlabel.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Undirected graph whose nodes and edges both carry a value of type V. Each
 * edge is recorded on both of its endpoints and the two records share the
 * same edge value.
 */
public class Graph<V> {

	public static class Neighbor<V> {
		private final int index;
		private final V edge;

		Neighbor(int index, V edge) {
			this.index = index;
			this.edge = edge;
		}

		public int index() {
			return index;
		}

		public V edge() {
			return edge;
		}
	}

	public static class Node<V> {
		private final V data;
		private final List<Neighbor<V>> neighbors;

		Node(V data) {
			this.data = data;
			this.neighbors = new ArrayList<Neighbor<V>>();
		}

		public V data() {
			return data;
		}

		public int numberOfNeighbors() {
			return neighbors.size();
		}

		public Neighbor<V> neighbor(int n) {
			return neighbors.get(n);
		}

		public List<Neighbor<V>> neighbors() {
			return Collections.unmodifiableList(neighbors);
		}
	}

	private final List<Node<V>> nodes = new ArrayList<Node<V>>();

	public int addNode(V data) {
		nodes.add(new Node<V>(data));
		return nodes.size() - 1;
	}

	/**
	 * Adds an undirected edge. An edge from a node to itself is stored once and
	 * makes {@link #containsLengthOneCycle()} true.
	 */
	public void addEdge(int i, int j, V edge) {
		checkIndex(i);
		checkIndex(j);
		nodes.get(i).neighbors.add(new Neighbor<V>(j, edge));
		if (i != j) nodes.get(j).neighbors.add(new Neighbor<V>(i, edge));
	}

	public boolean hasEdge(int i, int j) {
		checkIndex(i);
		for (Neighbor<V> neighbor : nodes.get(i).neighbors) {
			if (neighbor.index == j) return true;
		}
		return false;
	}

	public int numberOfNodes() {
		return nodes.size();
	}

	public Node<V> node(int i) {
		return nodes.get(i);
	}

	public boolean containsLengthOneCycle() {
		for (int i = 0; i < nodes.size(); ++i) {
			if (hasEdge(i, i)) return true;
		}
		return false;
	}

	private void checkIndex(int i) {
		if (i < 0 || i >= nodes.size()) throw new IndexOutOfBoundsException("Node " + i + " not in graph of " + nodes.size() + " nodes");
	}

}
