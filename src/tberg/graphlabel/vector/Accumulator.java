package tberg.graphlabel.vector;

public interface Accumulator<V> {

	/**
	 * Adds a node vector into the psi vector, shifted by offset.
	 */
	public void addNode(V nodeVector, int offset);

	public void subtractEdge(V edgeVector);

	public V result();

}
