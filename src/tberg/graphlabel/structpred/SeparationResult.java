package tberg.graphlabel.structpred;

public class SeparationResult<V> {

	public final double loss;

	public final boolean[] labeling;

	public final V psi;

	public SeparationResult(double loss, boolean[] labeling, V psi) {
		this.loss = loss;
		this.labeling = labeling;
		this.psi = psi;
	}

}
