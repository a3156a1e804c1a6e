package tberg.graphlabel.graphcut;

import java.util.Arrays;

/**
 * A binary Potts model. Node i contributes its score when labelled on; every
 * edge whose endpoints disagree costs its weight. The score of a labeling is
 *
 * <pre>
 *   sum_{i on} nodeScore(i) - sum_{(i,j) : on(i) != on(j)} edgeWeight(i,j)
 * </pre>
 */
public class PottsGraph {

	private final double[] nodeScores;

	private int[] edgeFrom;

	private int[] edgeTo;

	private double[] edgeWeights;

	private int numEdges = 0;

	public PottsGraph(int numNodes) {
		this.nodeScores = new double[numNodes];
		this.edgeFrom = new int[4];
		this.edgeTo = new int[4];
		this.edgeWeights = new double[4];
	}

	public int numberOfNodes() {
		return nodeScores.length;
	}

	public int numberOfEdges() {
		return numEdges;
	}

	public void setNodeScore(int i, double score) {
		nodeScores[i] = score;
	}

	public double nodeScore(int i) {
		return nodeScores[i];
	}

	public void addEdge(int i, int j, double weight) {
		if (i == j) throw new IllegalArgumentException("Potts graph cannot hold an edge from node " + i + " to itself");
		if (i < 0 || j < 0 || i >= nodeScores.length || j >= nodeScores.length) throw new IndexOutOfBoundsException("Edge (" + i + ", " + j + ") not in graph of " + nodeScores.length + " nodes");
		if (numEdges == edgeFrom.length) {
			edgeFrom = Arrays.copyOf(edgeFrom, numEdges * 2);
			edgeTo = Arrays.copyOf(edgeTo, numEdges * 2);
			edgeWeights = Arrays.copyOf(edgeWeights, numEdges * 2);
		}
		edgeFrom[numEdges] = i;
		edgeTo[numEdges] = j;
		edgeWeights[numEdges] = weight;
		numEdges++;
	}

	public int edgeFrom(int e) {
		return edgeFrom[e];
	}

	public int edgeTo(int e) {
		return edgeTo[e];
	}

	public double edgeWeight(int e) {
		return edgeWeights[e];
	}

	public double score(boolean[] labeling) {
		if (labeling.length != nodeScores.length) throw new IllegalArgumentException("Labeling has " + labeling.length + " entries for " + nodeScores.length + " nodes");
		double result = 0.0;
		for (int i = 0; i < nodeScores.length; ++i) {
			if (labeling[i]) result += nodeScores[i];
		}
		for (int e = 0; e < numEdges; ++e) {
			if (labeling[edgeFrom[e]] != labeling[edgeTo[e]]) result -= edgeWeights[e];
		}
		return result;
	}

}
