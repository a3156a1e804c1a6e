package tberg.graphlabel.structpred;

import java.util.Arrays;

import org.jblas.DoubleMatrix;

import tberg.graphlabel.graph.Graph;
import tberg.graphlabel.graphcut.MaxFlowPottsMinimizer;
import tberg.graphlabel.graphcut.PottsGraph;
import tberg.graphlabel.graphcut.PottsMinimizer;
import tberg.graphlabel.vector.VectorKind;

/**
 * A learned graph labeling function: labels every node of a graph by
 * maximizing the Potts model the weights induce on it.
 */
public class GraphLabeler<V> {

	private final DoubleMatrix weights;

	private final FeatureDimensions dims;

	private final PottsSeparationOracle<V> scorer;

	private final PottsMinimizer minimizer;

	public GraphLabeler(VectorKind<V> kind, DoubleMatrix weights, int numEdgeWeights) {
		this(kind, weights, numEdgeWeights, new MaxFlowPottsMinimizer());
	}

	public GraphLabeler(VectorKind<V> kind, DoubleMatrix weights, int numEdgeWeights, PottsMinimizer minimizer) {
		if (numEdgeWeights < 0 || numEdgeWeights > weights.length) {
			throw new IllegalArgumentException("numEdgeWeights " + numEdgeWeights + " outside [0, " + weights.length + "]");
		}
		for (int i = 0; i < numEdgeWeights; ++i) {
			if (weights.data[i] < 0) throw new IllegalArgumentException("Edge weight " + i + " is negative: " + weights.data[i]);
		}
		this.weights = new DoubleMatrix(weights.data.clone());
		this.dims = new FeatureDimensions(weights.length - numEdgeWeights, numEdgeWeights);
		this.scorer = new PottsSeparationOracle<V>(kind, dims, minimizer);
		this.minimizer = minimizer;
	}

	public boolean[] label(Graph<V> graph) {
		PottsGraph g = scorer.buildPottsGraph(graph, weights, null, 0.0);
		return minimizer.findMaxLabeling(g);
	}

	public DoubleMatrix getEdgeWeights() {
		return new DoubleMatrix(Arrays.copyOfRange(weights.data, 0, dims.edgeDims()));
	}

	public DoubleMatrix getNodeWeights() {
		return new DoubleMatrix(Arrays.copyOfRange(weights.data, dims.edgeDims(), dims.total()));
	}

}
