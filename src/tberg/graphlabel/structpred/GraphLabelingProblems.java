package tberg.graphlabel.structpred;

import java.util.List;

import tberg.graphlabel.graph.Graph;
import tberg.graphlabel.vector.VectorKind;

/**
 * Structural checks a training set has to pass before a {@link GraphLabelingProblem}
 * can be built from it:
 * <ul>
 * <li>samples and labels form a learning problem (same non-zero count)</li>
 * <li>no graph has an edge from a node to itself</li>
 * <li>every graph has exactly one label per node</li>
 * <li>every edge vector holds only values {@code >= 0}</li>
 * <li>for dense vectors: every vector is non-empty, all node vectors share one
 * length and all edge vectors share one length (the two lengths may differ)</li>
 * </ul>
 */
public class GraphLabelingProblems {

	private GraphLabelingProblems() {
	}

	public static boolean isLearningProblem(List<?> samples, List<?> labels) {
		return samples != null && labels != null && samples.size() == labels.size() && samples.size() > 0;
	}

	public static <V> boolean isGraphLabelingProblem(List<Graph<V>> samples, List<boolean[]> labels, VectorKind<V> kind) {
		return explainProblem(samples, labels, kind) == null;
	}

	/**
	 * @return a description of the first check that fails, or null if the
	 *         training set is a valid graph labeling problem
	 */
	public static <V> String explainProblem(List<Graph<V>> samples, List<boolean[]> labels, VectorKind<V> kind) {
		if (!isLearningProblem(samples, labels)) {
			return "samples and labels must be non-empty and of equal size";
		}

		final boolean dense = kind.isDense();

		// -1 until the first vector of each kind is seen
		int nodeDims = -1;
		int edgeDims = -1;

		for (int i = 0; i < samples.size(); ++i) {
			Graph<V> sample = samples.get(i);
			boolean[] label = labels.get(i);
			if (sample == null || label == null) return "sample " + i + " or its labels are missing";
			if (sample.numberOfNodes() != label.length) {
				return "sample " + i + " has " + sample.numberOfNodes() + " nodes but " + label.length + " labels";
			}
			if (sample.containsLengthOneCycle()) return "sample " + i + " contains an edge from a node to itself";

			for (int j = 0; j < sample.numberOfNodes(); ++j) {
				Graph.Node<V> node = sample.node(j);
				if (dense) {
					int size = kind.size(node.data());
					if (size == 0) return "sample " + i + " node " + j + " has an empty vector";
					if (nodeDims == -1) nodeDims = size;
					if (size != nodeDims) return "sample " + i + " node " + j + " has a vector of length " + size + ", expected " + nodeDims;
				}

				for (int n = 0; n < node.numberOfNeighbors(); ++n) {
					V edge = node.neighbor(n).edge();
					int size = kind.size(edge);
					if (dense && size == 0) return "sample " + i + " edge (" + j + ", " + node.neighbor(n).index() + ") has an empty vector";
					if (size > 0 && kind.min(edge) < 0) {
						return "sample " + i + " edge (" + j + ", " + node.neighbor(n).index() + ") has a negative entry";
					}
					if (dense) {
						if (edgeDims == -1) edgeDims = size;
						if (size != edgeDims) return "sample " + i + " edge (" + j + ", " + node.neighbor(n).index() + ") has a vector of length " + size + ", expected " + edgeDims;
					}
				}
			}
		}
		return null;
	}

}
