package tberg.graphlabel.vector;

import org.jblas.DoubleMatrix;

public final class DenseVectors implements VectorKind<DoubleMatrix> {

	public static final DenseVectors INSTANCE = new DenseVectors();

	private DenseVectors() {
	}

	public static DoubleMatrix vector(double... values) {
		return new DoubleMatrix(values);
	}

	public boolean isDense() {
		return true;
	}

	public int size(DoubleMatrix vector) {
		return vector.length;
	}

	public int maxIndexPlusOne(DoubleMatrix vector) {
		return vector.length;
	}

	public double min(DoubleMatrix vector) {
		double result = Double.POSITIVE_INFINITY;
		for (int i = 0; i < vector.length; ++i) {
			result = Math.min(result, vector.data[i]);
		}
		return result;
	}

	public double dot(DoubleMatrix w, int offset, int length, DoubleMatrix vector) {
		if (vector.length != length || offset + length > w.length) {
			throw new IllegalArgumentException("Vector of length " + vector.length + " does not match weight block [" + offset + ", " + (offset + length) + ") of " + w.length);
		}
		double result = 0.0;
		for (int i = 0; i < vector.length; ++i) {
			result += w.data[offset + i] * vector.data[i];
		}
		return result;
	}

	public void addTo(DoubleMatrix target, int offset, double scale, DoubleMatrix vector) {
		for (int i = 0; i < vector.length; ++i) {
			target.data[offset + i] += scale * vector.data[i];
		}
	}

	public Accumulator<DoubleMatrix> newAccumulator(int numDimensions) {
		return new DenseAccumulator(numDimensions);
	}

	private static class DenseAccumulator implements Accumulator<DoubleMatrix> {
		private final DoubleMatrix psi;

		public DenseAccumulator(int numDimensions) {
			this.psi = DoubleMatrix.zeros(numDimensions);
		}

		public void addNode(DoubleMatrix nodeVector, int offset) {
			for (int i = 0; i < nodeVector.length; ++i) {
				psi.data[offset + i] += nodeVector.data[i];
			}
		}

		public void subtractEdge(DoubleMatrix edgeVector) {
			for (int i = 0; i < edgeVector.length; ++i) {
				psi.data[i] -= edgeVector.data[i];
			}
		}

		public DoubleMatrix result() {
			return psi;
		}
	}

}
