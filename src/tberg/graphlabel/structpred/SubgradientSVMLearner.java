package tberg.graphlabel.structpred;

import java.util.ArrayList;
import java.util.List;

import org.jblas.DoubleMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tberg.graphlabel.vector.VectorKind;

/**
 * Minimizes the L2 regularized structured hinge loss
 *
 * <pre>
 *   regConstant * |w|^2 + sum_i max(0, loss_i + w . (psi(guess_i) - psi(gold_i)))
 * </pre>
 *
 * with full batch AdaGrad steps. Each epoch makes one batched separation
 * oracle call. After every step the first numNonNegative weights are clipped
 * at zero.
 */
public class SubgradientSVMLearner implements StructuralSvmLearner {

	private static final Logger logger = LoggerFactory.getLogger(SubgradientSVMLearner.class);

	public static class Opts {
		public double eta = 0.5;

		public double delta = 1e-2;

		public double regConstant = 1e-3;

		public int epochs = 100;

		/**
		 * Stop as soon as an epoch's oracle calls find no violated constraint.
		 */
		public boolean stopWhenSeparable = true;

		public boolean verbose = false;
	}

	private final Opts opts;

	public SubgradientSVMLearner() {
		this(new Opts());
	}

	public SubgradientSVMLearner(Opts opts) {
		this.opts = opts;
	}

	public <F> DoubleMatrix train(DoubleMatrix initWeights, StructuralSvmProblem<F> problem, int numNonNegative) {
		final int dim = problem.numDimensions();
		if (initWeights.length != dim) throw new IllegalArgumentException("Initial weights have length " + initWeights.length + ", problem has " + dim + " dimensions");
		final VectorKind<F> kind = problem.vectorKind();

		List<F> truth = new ArrayList<F>();
		for (int i = 0; i < problem.numSamples(); ++i) {
			truth.add(problem.getTruthJointFeatureVector(i));
		}

		double[] guess = initWeights.data.clone();
		project(guess, numNonNegative);
		double[] sqrGradSum = new double[dim];
		for (int epoch = 0; epoch < opts.epochs; ++epoch) {
			DoubleMatrix w = new DoubleMatrix(guess.clone());
			List<SeparationResult<F>> results = problem.separationOracleBatch(w);

			double val = 0.0;
			int numViolated = 0;
			DoubleMatrix grad = DoubleMatrix.zeros(dim);
			for (int i = 0; i < results.size(); ++i) {
				SeparationResult<F> result = results.get(i);
				DoubleMatrix delta = DoubleMatrix.zeros(dim);
				kind.addTo(delta, 0, 1.0, result.psi);
				kind.addTo(delta, 0, -1.0, truth.get(i));
				double sampleVal = result.loss + innerProd(guess, delta.data);
				if (sampleVal > 0.0) {
					val += sampleVal;
					numViolated++;
					for (int k = 0; k < dim; ++k) grad.data[k] += delta.data[k];
				}
			}

			if (opts.verbose) {
				logger.info(String.format("Epoch %d: objective %.6f, %d of %d samples violated", epoch, val + opts.regConstant * innerProd(guess, guess), numViolated, results.size()));
			}
			if (numViolated == 0 && opts.stopWhenSeparable) {
				logger.debug("No violated constraints after {} epochs", epoch);
				break;
			}

			for (int k = 0; k < dim; ++k) {
				sqrGradSum[k] += grad.data[k] * grad.data[k];
				if (sqrGradSum[k] == 0.0) continue;
				double s = Math.sqrt(sqrGradSum[k]);
				guess[k] = (s * guess[k] - opts.eta * grad.data[k]) / (opts.eta * opts.regConstant + opts.delta + s);
			}
			project(guess, numNonNegative);
		}
		return new DoubleMatrix(guess);
	}

	static void project(double[] weights, int numNonNegative) {
		for (int k = 0; k < numNonNegative; ++k) {
			if (weights[k] < 0.0) weights[k] = 0.0;
		}
	}

	static double innerProd(double[] x, double[] y) {
		double result = 0.0;
		for (int i = 0; i < x.length; ++i) {
			result += x[i] * y[i];
		}
		return result;
	}

}
