package tberg.graphlabel.structpred;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jblas.DoubleMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tberg.graphlabel.graph.Graph;
import tberg.graphlabel.graphcut.MaxFlowPottsMinimizer;
import tberg.graphlabel.graphcut.PottsMinimizer;
import tberg.graphlabel.threading.BetterThreader;
import tberg.graphlabel.vector.VectorKind;

/**
 * Structural SVM problem for learning to label graph nodes on or off.
 * <p>
 * The weight and psi vectors start with the edge block followed by the node
 * block. A solver using this problem must keep the first
 * {@link #numEdgeWeights()} weights non-negative: the separation oracle can only
 * be solved exactly when every edge weight it derives is non-negative.
 * <p>
 * The sample and label lists are held, not copied. Callers must not modify
 * them while the problem is in use.
 */
public class GraphLabelingProblem<V> implements StructuralSvmProblem<V> {

	private static final Logger logger = LoggerFactory.getLogger(GraphLabelingProblem.class);

	public static final int DEFAULT_NUM_THREADS = 2;

	private final List<Graph<V>> samples;

	private final List<boolean[]> labels;

	private final VectorKind<V> kind;

	private final FeatureDimensions dims;

	private final PottsSeparationOracle<V> oracle;

	private final int numThreads;

	public GraphLabelingProblem(List<Graph<V>> samples, List<boolean[]> labels, VectorKind<V> kind) {
		this(samples, labels, kind, DEFAULT_NUM_THREADS);
	}

	public GraphLabelingProblem(List<Graph<V>> samples, List<boolean[]> labels, VectorKind<V> kind, int numThreads) {
		this(samples, labels, kind, numThreads, new MaxFlowPottsMinimizer());
	}

	/**
	 * @throws IllegalArgumentException if samples and labels are not a valid graph
	 *           labeling problem, see {@link GraphLabelingProblems}
	 */
	public GraphLabelingProblem(List<Graph<V>> samples, List<boolean[]> labels, VectorKind<V> kind, int numThreads, PottsMinimizer minimizer) {
		String problem = GraphLabelingProblems.explainProblem(samples, labels, kind);
		if (problem != null) {
			throw new IllegalArgumentException("Invalid graph labeling problem: " + problem);
		}
		if (numThreads < 1) throw new IllegalArgumentException("numThreads must be positive, got " + numThreads);
		this.samples = samples;
		this.labels = labels;
		this.kind = kind;
		this.numThreads = numThreads;
		this.dims = FeatureDimensions.resolve(samples, kind);
		this.oracle = new PottsSeparationOracle<V>(kind, dims, minimizer);
		logger.debug("Graph labeling problem with {} samples, {}", samples.size(), dims);
	}

	/**
	 * Length of the edge block at the front of the weight vector.
	 */
	public int numEdgeWeights() {
		return dims.edgeDims();
	}

	public int numDimensions() {
		return dims.total();
	}

	public int numSamples() {
		return samples.size();
	}

	public V getTruthJointFeatureVector(int idx) {
		return oracle.getPsiBuilder().build(samples.get(idx), labels.get(idx));
	}

	public SeparationResult<V> separationOracle(int idx, DoubleMatrix currentSolution) {
		return oracle.evaluate(samples.get(idx), labels.get(idx), currentSolution);
	}

	public List<SeparationResult<V>> separationOracleBatch(final DoubleMatrix currentSolution) {
		final List<SeparationResult<V>> results = new ArrayList<SeparationResult<V>>(Collections.<SeparationResult<V>>nCopies(samples.size(), null));
		BetterThreader.Function<Integer,Object> func = new BetterThreader.Function<Integer,Object>() {
			public void call(Integer idx, Object ignored) {
				results.set(idx, separationOracle(idx, currentSolution));
			}
		};
		BetterThreader<Integer,Object> threader = new BetterThreader<Integer,Object>(func, Math.min(numThreads, samples.size()));
		for (int i = 0; i < samples.size(); ++i) threader.addFunctionArgument(i);
		threader.run();
		logger.debug("Separation oracle ran on {} samples with {} threads", samples.size(), threader.numThreads());
		return results;
	}

	public VectorKind<V> vectorKind() {
		return kind;
	}

	public FeatureDimensions getDimensions() {
		return dims;
	}

	public PottsSeparationOracle<V> getOracle() {
		return oracle;
	}

	public int numThreads() {
		return numThreads;
	}

}
