package tberg.graphlabel.graphcut;

/**
 * Exact optimizer for binary Potts models with non-negative edge weights.
 * Finding the highest scoring labeling is the same problem as finding the
 * minimum energy one, with energy the negated {@link PottsGraph#score}.
 */
public interface PottsMinimizer {

	/**
	 * @return a labeling maximizing {@link PottsGraph#score}, one entry per node
	 * @throws PottsSolverException if some edge weight is negative or not finite
	 */
	public boolean[] findMaxLabeling(PottsGraph graph);

}
