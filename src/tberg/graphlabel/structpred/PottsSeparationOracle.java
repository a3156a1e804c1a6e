package tberg.graphlabel.structpred;

import org.jblas.DoubleMatrix;

import tberg.graphlabel.graph.Graph;
import tberg.graphlabel.graphcut.PottsGraph;
import tberg.graphlabel.graphcut.PottsMinimizer;
import tberg.graphlabel.vector.VectorKind;

/**
 * Finds the most violated labeling of a sample under the current weights.
 * <p>
 * The sample is turned into a Potts model whose node scores are
 * {@code w_node . x_i}, shifted down by the loss weight for nodes that are on in
 * the truth and up for nodes that are off, and whose edge weights are
 * {@code w_edge . e_ij}. Maximizing that model gives the labeling maximizing
 * model score plus Hamming loss. Instances hold no mutable state and may be
 * shared across threads.
 */
public class PottsSeparationOracle<V> {

	private final VectorKind<V> kind;

	private final FeatureDimensions dims;

	private final JointFeatureVectorBuilder<V> psiBuilder;

	private final PottsMinimizer minimizer;

	public PottsSeparationOracle(VectorKind<V> kind, FeatureDimensions dims, PottsMinimizer minimizer) {
		this.kind = kind;
		this.dims = dims;
		this.psiBuilder = new JointFeatureVectorBuilder<V>(kind, dims);
		this.minimizer = minimizer;
	}

	public SeparationResult<V> evaluate(Graph<V> sample, boolean[] truth, DoubleMatrix w) {
		PottsGraph g = buildPottsGraph(sample, w, truth, 1.0);
		boolean[] labeling = minimizer.findMaxLabeling(g);
		double loss = hammingLoss(truth, labeling);
		return new SeparationResult<V>(loss, labeling, psiBuilder.build(sample, labeling));
	}

	/**
	 * @param truth may be null when lossWeight is 0
	 */
	public PottsGraph buildPottsGraph(Graph<V> sample, DoubleMatrix w, boolean[] truth, double lossWeight) {
		if (w.length != dims.total()) {
			throw new IllegalArgumentException("Weight vector has length " + w.length + ", expected " + dims.total());
		}
		final int edgeDims = dims.edgeDims();
		PottsGraph g = new PottsGraph(sample.numberOfNodes());
		for (int i = 0; i < sample.numberOfNodes(); ++i) {
			Graph.Node<V> node = sample.node(i);
			double score = kind.dot(w, edgeDims, dims.nodeDims(), node.data());
			if (lossWeight != 0.0) {
				score += truth[i] ? -lossWeight : lossWeight;
			}
			g.setNodeScore(i, score);

			for (int n = 0; n < node.numberOfNeighbors(); ++n) {
				final int j = node.neighbor(n).index();
				if (i < j) {
					g.addEdge(i, j, kind.dot(w, 0, edgeDims, node.neighbor(n).edge()));
				}
			}
		}
		return g;
	}

	public static int hammingLoss(boolean[] truth, boolean[] labeling) {
		if (truth.length != labeling.length) {
			throw new IllegalArgumentException("Labelings differ in length: " + truth.length + " vs " + labeling.length);
		}
		int loss = 0;
		for (int i = 0; i < truth.length; ++i) {
			if (truth[i] != labeling[i]) ++loss;
		}
		return loss;
	}

	public JointFeatureVectorBuilder<V> getPsiBuilder() {
		return psiBuilder;
	}

	public FeatureDimensions getDimensions() {
		return dims;
	}

}
