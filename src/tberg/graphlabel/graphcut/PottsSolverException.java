package tberg.graphlabel.graphcut;

public class PottsSolverException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public PottsSolverException(String message) {
		super(message);
	}

}
