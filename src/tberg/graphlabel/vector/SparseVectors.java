package tberg.graphlabel.vector;

import org.jblas.DoubleMatrix;

public final class SparseVectors implements VectorKind<SparseVector> {

	public static final SparseVectors INSTANCE = new SparseVectors();

	private SparseVectors() {
	}

	public boolean isDense() {
		return false;
	}

	public int size(SparseVector vector) {
		return vector.size();
	}

	public int maxIndexPlusOne(SparseVector vector) {
		return vector.maxIndexPlusOne();
	}

	public double min(SparseVector vector) {
		return vector.min();
	}

	public double dot(DoubleMatrix w, int offset, int length, SparseVector vector) {
		return vector.dot(w, offset, length);
	}

	public void addTo(DoubleMatrix target, int offset, double scale, SparseVector vector) {
		for (int i = 0; i < vector.size(); ++i) {
			target.data[offset + vector.index(i)] += scale * vector.value(i);
		}
	}

	public Accumulator<SparseVector> newAccumulator(int numDimensions) {
		return new SparseAccumulator();
	}

	// appends only; duplicate indices are summed by whoever reads the vector
	private static class SparseAccumulator implements Accumulator<SparseVector> {
		private final SparseVector psi = new SparseVector();

		public void addNode(SparseVector nodeVector, int offset) {
			for (int i = 0; i < nodeVector.size(); ++i) {
				psi.append(nodeVector.index(i) + offset, nodeVector.value(i));
			}
		}

		public void subtractEdge(SparseVector edgeVector) {
			for (int i = 0; i < edgeVector.size(); ++i) {
				psi.append(edgeVector.index(i), -edgeVector.value(i));
			}
		}

		public SparseVector result() {
			return psi;
		}
	}

}
