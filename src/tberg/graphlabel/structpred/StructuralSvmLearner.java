package tberg.graphlabel.structpred;

import org.jblas.DoubleMatrix;

public interface StructuralSvmLearner {

	/**
	 * @param numNonNegative how many leading weights must stay {@code >= 0}
	 */
	public <F> DoubleMatrix train(DoubleMatrix initWeights, StructuralSvmProblem<F> problem, int numNonNegative);

}
