package tberg.graphlabel.vector;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

import org.jblas.DoubleMatrix;

/**
 * Append-only list of (index, value) entries. The same index may appear more
 * than once; every reader treats the vector as the sum of its entries.
 */
public final class SparseVector {

	private int[] indices;

	private double[] values;

	private int size = 0;

	public SparseVector() {
		this(8);
	}

	public SparseVector(int initCapacity) {
		indices = new int[Math.max(1, initCapacity)];
		values = new double[Math.max(1, initCapacity)];
	}

	public static SparseVector of(int[] indices, double[] values) {
		if (indices.length != values.length) throw new IllegalArgumentException("Index and value arrays differ in length: " + indices.length + " vs " + values.length);
		SparseVector result = new SparseVector(indices.length);
		for (int i = 0; i < indices.length; ++i) {
			result.append(indices[i], values[i]);
		}
		return result;
	}

	public void append(int index, double value) {
		if (index < 0) throw new IllegalArgumentException("Negative feature index: " + index);
		if (size == indices.length) {
			indices = Arrays.copyOf(indices, indices.length * 2);
			values = Arrays.copyOf(values, values.length * 2);
		}
		indices[size] = index;
		values[size] = value;
		size++;
	}

	public int size() {
		return size;
	}

	public int index(int i) {
		return indices[i];
	}

	public double value(int i) {
		return values[i];
	}

	public int maxIndexPlusOne() {
		int result = 0;
		for (int i = 0; i < size; ++i) {
			result = Math.max(result, indices[i] + 1);
		}
		return result;
	}

	/**
	 * Smallest stored value, or 0 for an empty vector (every unstored entry is 0).
	 */
	public double min() {
		double result = Double.POSITIVE_INFINITY;
		for (int i = 0; i < size; ++i) {
			result = Math.min(result, values[i]);
		}
		return size == 0 ? 0.0 : result;
	}

	public double dot(DoubleMatrix w, int offset, int length) {
		if (offset + length > w.length) throw new IllegalArgumentException("Block [" + offset + ", " + (offset + length) + ") overruns weights of length " + w.length);
		double result = 0.0;
		for (int i = 0; i < size; ++i) {
			if (indices[i] < length) result += w.data[offset + indices[i]] * values[i];
		}
		return result;
	}

	/**
	 * Sums duplicate indices, dropping nothing (explicit zeros survive).
	 */
	public Map<Integer,Double> flatten() {
		Map<Integer,Double> result = new TreeMap<Integer,Double>();
		for (int i = 0; i < size; ++i) {
			Double prev = result.get(indices[i]);
			result.put(indices[i], (prev == null ? 0.0 : prev) + values[i]);
		}
		return result;
	}

	public DoubleMatrix toDense(int length) {
		DoubleMatrix result = DoubleMatrix.zeros(length);
		for (int i = 0; i < size; ++i) {
			if (indices[i] >= length) throw new IllegalArgumentException("Index " + indices[i] + " does not fit in a vector of length " + length);
			result.data[indices[i]] += values[i];
		}
		return result;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		for (int i = 0; i < size; ++i) {
			if (i > 0) sb.append(", ");
			sb.append(indices[i]).append(':').append(values[i]);
		}
		return sb.append('}').toString();
	}

}
