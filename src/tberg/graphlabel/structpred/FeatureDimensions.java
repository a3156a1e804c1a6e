package tberg.graphlabel.structpred;

import java.util.List;

import tberg.graphlabel.graph.Graph;
import tberg.graphlabel.vector.VectorKind;

/**
 * Sizes of the edge and node blocks of the weight vector. Each is one past the
 * largest feature index seen anywhere in the training set, so sparse feature
 * spaces that skip indices are still covered.
 */
public final class FeatureDimensions {

	private final int nodeDims;

	private final int edgeDims;

	public FeatureDimensions(int nodeDims, int edgeDims) {
		this.nodeDims = nodeDims;
		this.edgeDims = edgeDims;
	}

	public static <V> FeatureDimensions resolve(List<Graph<V>> samples, VectorKind<V> kind) {
		int nodeDims = 0;
		int edgeDims = 0;
		for (Graph<V> sample : samples) {
			for (int j = 0; j < sample.numberOfNodes(); ++j) {
				Graph.Node<V> node = sample.node(j);
				nodeDims = Math.max(nodeDims, kind.maxIndexPlusOne(node.data()));
				for (int n = 0; n < node.numberOfNeighbors(); ++n) {
					edgeDims = Math.max(edgeDims, kind.maxIndexPlusOne(node.neighbor(n).edge()));
				}
			}
		}
		return new FeatureDimensions(nodeDims, edgeDims);
	}

	public int nodeDims() {
		return nodeDims;
	}

	public int edgeDims() {
		return edgeDims;
	}

	/**
	 * Length of w and psi: the edge block followed by the node block.
	 */
	public int total() {
		return edgeDims + nodeDims;
	}

	@Override
	public String toString() {
		return "FeatureDimensions(edge=" + edgeDims + ", node=" + nodeDims + ")";
	}

}
