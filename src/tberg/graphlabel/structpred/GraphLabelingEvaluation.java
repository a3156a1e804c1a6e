package tberg.graphlabel.structpred;

import java.util.List;

import tberg.graphlabel.graph.Graph;

public class GraphLabelingEvaluation {

	private GraphLabelingEvaluation() {
	}

	/**
	 * Labels every sample and compares against the truth.
	 *
	 * @return {fraction of on nodes labelled on, fraction of off nodes labelled
	 *         off}; a class with no nodes scores 1
	 */
	public static <V> double[] test(GraphLabeler<V> labeler, List<Graph<V>> samples, List<boolean[]> labels) {
		if (!GraphLabelingProblems.isLearningProblem(samples, labels)) {
			throw new IllegalArgumentException("samples and labels must be non-empty and of equal size");
		}
		int numPos = 0;
		int numPosCorrect = 0;
		int numNeg = 0;
		int numNegCorrect = 0;
		for (int i = 0; i < samples.size(); ++i) {
			boolean[] truth = labels.get(i);
			boolean[] guess = labeler.label(samples.get(i));
			if (guess.length != truth.length) throw new IllegalArgumentException("Sample " + i + " has " + guess.length + " nodes but " + truth.length + " labels");
			for (int j = 0; j < truth.length; ++j) {
				if (truth[j]) {
					numPos++;
					if (guess[j]) numPosCorrect++;
				} else {
					numNeg++;
					if (!guess[j]) numNegCorrect++;
				}
			}
		}
		double posAccuracy = numPos == 0 ? 1.0 : numPosCorrect / (double) numPos;
		double negAccuracy = numNeg == 0 ? 1.0 : numNegCorrect / (double) numNeg;
		return new double[] {posAccuracy, negAccuracy};
	}

}
