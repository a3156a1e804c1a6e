package tberg.graphlabel.structpred;

import static org.junit.jupiter.api.Assertions.*;
import static tberg.graphlabel.structpred.TestGraphs.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.jblas.DoubleMatrix;
import org.junit.jupiter.api.Test;

import tberg.graphlabel.graph.Graph;
import tberg.graphlabel.vector.DenseVectors;
import tberg.graphlabel.vector.SparseVector;
import tberg.graphlabel.vector.SparseVectors;

public class GraphLabelingTrainerTest {

	/**
	 * Nodes look like [1,0] when on and [0,1] when off; edges only join nodes
	 * with the same label, and nodes 0 and 2 are always joined when they agree.
	 */
	private static Graph<DoubleMatrix> blockGraph(boolean[] truth, Random rand) {
		Graph<DoubleMatrix> g = new Graph<DoubleMatrix>();
		for (boolean on : truth) {
			g.addNode(on ? vec(1, 0) : vec(0, 1));
		}
		for (int i = 0; i < truth.length; ++i) {
			for (int j = i + 1; j < truth.length; ++j) {
				if (truth[i] == truth[j] && (rand.nextBoolean() || (i == 0 && j == 2))) g.addEdge(i, j, vec(1));
			}
		}
		return g;
	}

	@Test
	public void testLearnsSeparableProblem() {
		Random rand = new Random(0);
		List<Graph<DoubleMatrix>> samples = new ArrayList<Graph<DoubleMatrix>>();
		List<boolean[]> truths = new ArrayList<boolean[]>();
		for (int s = 0; s < 6; ++s) {
			boolean[] truth = new boolean[5];
			for (int i = 0; i < truth.length; ++i) truth[i] = rand.nextBoolean();
			truth[0] = true;
			truth[1] = false;
			truth[2] = true;
			samples.add(blockGraph(truth, rand));
			truths.add(truth);
		}

		GraphLabelingTrainer<DoubleMatrix> trainer = new GraphLabelingTrainer<DoubleMatrix>(DenseVectors.INSTANCE);
		trainer.setNumThreads(3);
		GraphLabeler<DoubleMatrix> labeler = trainer.train(samples, truths);

		assertTrue(labeler.getEdgeWeights().data[0] >= 0.0);
		assertTrue(labeler.getNodeWeights().data[0] > 0.0);
		assertTrue(labeler.getNodeWeights().data[1] < 0.0);

		double[] accuracy = GraphLabelingEvaluation.test(labeler, samples, truths);
		assertArrayEquals(new double[] {1.0, 1.0}, accuracy, 0.0);

		boolean[] unseen = labels(1, 1, 0, 0, 1, 0, 1);
		assertArrayEquals(unseen, labeler.label(blockGraph(unseen, rand)));
	}

	@Test
	public void testEdgeWeightsStayNonNegative() {
		// edges join disagreeing nodes, so the unconstrained optimum would push them negative
		List<Graph<DoubleMatrix>> samples = new ArrayList<Graph<DoubleMatrix>>();
		List<boolean[]> truths = new ArrayList<boolean[]>();
		for (int s = 0; s < 3; ++s) {
			Graph<DoubleMatrix> g = new Graph<DoubleMatrix>();
			g.addNode(vec(1, 0));
			g.addNode(vec(0, 1));
			g.addNode(vec(1, 0));
			g.addEdge(0, 1, vec(1, 0.5));
			g.addEdge(1, 2, vec(0.5, 1));
			samples.add(g);
			truths.add(labels(1, 0, 1));
		}
		SubgradientSVMLearner.Opts opts = new SubgradientSVMLearner.Opts();
		opts.epochs = 30;
		opts.stopWhenSeparable = false;
		GraphLabelingProblem<DoubleMatrix> problem = new GraphLabelingProblem<DoubleMatrix>(samples, truths, DenseVectors.INSTANCE);
		DoubleMatrix w = new SubgradientSVMLearner(opts).train(DoubleMatrix.zeros(problem.numDimensions()), problem, problem.numEdgeWeights());
		assertEquals(4, w.length);
		for (int k = 0; k < problem.numEdgeWeights(); ++k) {
			assertTrue(w.data[k] >= 0.0, "edge weight " + k + " = " + w.data[k]);
		}
	}

	@Test
	public void testUntouchedWeightsKeepTheirStart() {
		// the third node feature is always zero, so its weight never sees a gradient
		Graph<DoubleMatrix> g = new Graph<DoubleMatrix>();
		g.addNode(vec(1, 0, 0));
		g.addNode(vec(0, 1, 0));
		g.addEdge(0, 1, vec(1));
		GraphLabelingProblem<DoubleMatrix> problem = new GraphLabelingProblem<DoubleMatrix>(Collections.singletonList(g), Collections.singletonList(labels(1, 0)), DenseVectors.INSTANCE, 1);
		SubgradientSVMLearner.Opts opts = new SubgradientSVMLearner.Opts();
		opts.epochs = 5;
		opts.stopWhenSeparable = false;
		DoubleMatrix w = new SubgradientSVMLearner(opts).train(vec(0, 0, 0, 0.7), problem, problem.numEdgeWeights());
		assertEquals(0.7, w.data[3], 0.0);
		assertTrue(w.data[1] > 0.0);
		assertTrue(w.data[2] < 0.0);
	}

	@Test
	public void testSparseTraining() {
		List<Graph<SparseVector>> samples = new ArrayList<Graph<SparseVector>>();
		List<boolean[]> truths = new ArrayList<boolean[]>();
		for (int s = 0; s < 4; ++s) {
			Graph<SparseVector> g = new Graph<SparseVector>();
			// feature 3 marks on nodes, feature 8 off nodes
			g.addNode(sparse(new int[] {3}, new double[] {1}));
			g.addNode(sparse(new int[] {8}, new double[] {1}));
			g.addNode(sparse(new int[] {3, 8}, new double[] {1, 0.25}));
			g.addEdge(0, 2, sparse(new int[] {1}, new double[] {1}));
			samples.add(g);
			truths.add(labels(1, 0, 1));
		}
		GraphLabeler<SparseVector> labeler = new GraphLabelingTrainer<SparseVector>(SparseVectors.INSTANCE).train(samples, truths);
		assertArrayEquals(new double[] {1.0, 1.0}, GraphLabelingEvaluation.test(labeler, samples, truths), 0.0);
		assertEquals(2, labeler.getEdgeWeights().length);
		assertEquals(9, labeler.getNodeWeights().length);
	}

	@Test
	public void testLabelerRejectsNegativeEdgeWeights() {
		assertThrows(IllegalArgumentException.class, () -> new GraphLabeler<DoubleMatrix>(DenseVectors.INSTANCE, vec(-0.1, 1, 1), 1));
		assertThrows(IllegalArgumentException.class, () -> new GraphLabeler<DoubleMatrix>(DenseVectors.INSTANCE, vec(1, 1), 3));
	}

	@Test
	public void testEvaluationCountsEachClass() {
		GraphLabeler<DoubleMatrix> allOn = new GraphLabeler<DoubleMatrix>(DenseVectors.INSTANCE, vec(0, 1, 1), 1);
		List<Graph<DoubleMatrix>> samples = new ArrayList<Graph<DoubleMatrix>>();
		List<boolean[]> truths = new ArrayList<boolean[]>();
		samples.add(densePath());
		truths.add(labels(1, 0, 0));
		assertArrayEquals(new double[] {1.0, 0.0}, GraphLabelingEvaluation.test(allOn, samples, truths), 0.0);

		truths.set(0, labels(1, 1, 1));
		assertArrayEquals(new double[] {1.0, 1.0}, GraphLabelingEvaluation.test(allOn, samples, truths), 0.0);
	}

}
