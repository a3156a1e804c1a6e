package tberg.graphlabel.vector;

import org.jblas.DoubleMatrix;

/**
 * The operations the graph labeling code needs from a feature vector
 * representation. One implementation exists per representation, so that the
 * validator, dimension resolution, psi construction and the oracle are
 * written once.
 */
public interface VectorKind<V> {

	public boolean isDense();

	/**
	 * Number of stored entries: the length of a dense vector, the entry count of
	 * a sparse one.
	 */
	public int size(V vector);

	public int maxIndexPlusOne(V vector);

	public double min(V vector);

	/**
	 * Dot product of vector with the block w[offset, offset + length). Sparse
	 * entries with an index of length or more fall outside the block and
	 * contribute nothing.
	 */
	public double dot(DoubleMatrix w, int offset, int length, V vector);

	public void addTo(DoubleMatrix target, int offset, double scale, V vector);

	public Accumulator<V> newAccumulator(int numDimensions);

}
