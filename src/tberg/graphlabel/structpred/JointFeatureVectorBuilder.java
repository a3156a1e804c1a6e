package tberg.graphlabel.structpred;

import tberg.graphlabel.graph.Graph;
import tberg.graphlabel.vector.Accumulator;
import tberg.graphlabel.vector.VectorKind;

/**
 * psi(x, y) for a graph x and labeling y. Node vectors of nodes labelled on are
 * added into the node block; edge vectors of edges whose endpoints disagree are
 * subtracted from the edge block.
 */
public class JointFeatureVectorBuilder<V> {

	private final VectorKind<V> kind;

	private final FeatureDimensions dims;

	public JointFeatureVectorBuilder(VectorKind<V> kind, FeatureDimensions dims) {
		this.kind = kind;
		this.dims = dims;
	}

	public V build(Graph<V> sample, boolean[] labeling) {
		Accumulator<V> psi = kind.newAccumulator(dims.total());
		for (int i = 0; i < sample.numberOfNodes(); ++i) {
			Graph.Node<V> node = sample.node(i);
			final boolean labelI = labeling[i];

			if (labelI) psi.addNode(node.data(), dims.edgeDims());

			for (int n = 0; n < node.numberOfNeighbors(); ++n) {
				final int j = node.neighbor(n).index();
				// each edge once, and only where the labels disagree
				if (i < j && labelI != labeling[j]) {
					psi.subtractEdge(node.neighbor(n).edge());
				}
			}
		}
		return psi.result();
	}

	public FeatureDimensions getDimensions() {
		return dims;
	}

}
