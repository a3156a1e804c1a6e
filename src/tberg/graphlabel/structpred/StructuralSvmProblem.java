package tberg.graphlabel.structpred;

import java.util.List;

import org.jblas.DoubleMatrix;

import tberg.graphlabel.vector.VectorKind;

/**
 * What a cutting plane or subgradient structural SVM solver needs from a
 * problem: its size, the joint feature vector of each sample's true labeling,
 * and a separation oracle returning the most violated labeling of a sample
 * under the solver's current weights.
 * <p>
 * Implementations must tolerate concurrent oracle calls for different samples
 * against the same weight vector, and must never write to that vector.
 */
public interface StructuralSvmProblem<F> {

	public int numDimensions();

	public int numSamples();

	public F getTruthJointFeatureVector(int idx);

	public SeparationResult<F> separationOracle(int idx, DoubleMatrix currentSolution);

	/**
	 * Oracle results for every sample in index order, all computed against the
	 * same currentSolution.
	 */
	public List<SeparationResult<F>> separationOracleBatch(DoubleMatrix currentSolution);

	public VectorKind<F> vectorKind();

}
