package tberg.graphlabel.structpred;

import java.util.List;

import org.jblas.DoubleMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tberg.graphlabel.graph.Graph;
import tberg.graphlabel.graphcut.MaxFlowPottsMinimizer;
import tberg.graphlabel.graphcut.PottsMinimizer;
import tberg.graphlabel.vector.VectorKind;

/**
 * Trains a {@link GraphLabeler} from labelled example graphs. The edge block of
 * the learned weights is kept non-negative so the labeler's Potts models stay
 * exactly solvable.
 */
public class GraphLabelingTrainer<V> {

	private static final Logger logger = LoggerFactory.getLogger(GraphLabelingTrainer.class);

	private final VectorKind<V> kind;

	private final StructuralSvmLearner learner;

	private final PottsMinimizer minimizer;

	private int numThreads = GraphLabelingProblem.DEFAULT_NUM_THREADS;

	public GraphLabelingTrainer(VectorKind<V> kind) {
		this(kind, new SubgradientSVMLearner());
	}

	public GraphLabelingTrainer(VectorKind<V> kind, StructuralSvmLearner learner) {
		this(kind, learner, new MaxFlowPottsMinimizer());
	}

	public GraphLabelingTrainer(VectorKind<V> kind, StructuralSvmLearner learner, PottsMinimizer minimizer) {
		this.kind = kind;
		this.learner = learner;
		this.minimizer = minimizer;
	}

	public void setNumThreads(int numThreads) {
		if (numThreads < 1) throw new IllegalArgumentException("numThreads must be positive, got " + numThreads);
		this.numThreads = numThreads;
	}

	public int getNumThreads() {
		return numThreads;
	}

	/**
	 * @throws IllegalArgumentException if samples and labels are not a valid graph
	 *           labeling problem
	 */
	public GraphLabeler<V> train(List<Graph<V>> samples, List<boolean[]> labels) {
		GraphLabelingProblem<V> problem = new GraphLabelingProblem<V>(samples, labels, kind, numThreads, minimizer);
		logger.info("Training graph labeler on {} samples, {}", problem.numSamples(), problem.getDimensions());
		DoubleMatrix weights = learner.train(DoubleMatrix.zeros(problem.numDimensions()), problem, problem.numEdgeWeights());
		return new GraphLabeler<V>(kind, weights, problem.numEdgeWeights(), minimizer);
	}

}
