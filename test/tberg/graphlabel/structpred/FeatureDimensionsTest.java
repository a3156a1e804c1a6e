package tberg.graphlabel.structpred;

import static org.junit.jupiter.api.Assertions.*;
import static tberg.graphlabel.structpred.TestGraphs.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import tberg.graphlabel.graph.Graph;
import tberg.graphlabel.vector.DenseVectors;
import tberg.graphlabel.vector.SparseVector;
import tberg.graphlabel.vector.SparseVectors;

public class FeatureDimensionsTest {

	@Test
	public void testDenseDimensionsAreVectorLengths() {
		FeatureDimensions dims = FeatureDimensions.resolve(Collections.singletonList(densePath()), DenseVectors.INSTANCE);
		assertEquals(2, dims.nodeDims());
		assertEquals(1, dims.edgeDims());
		assertEquals(3, dims.total());
	}

	@Test
	public void testSparseDimensionsCoverLargestIndex() {
		Graph<SparseVector> a = sparsePath();
		Graph<SparseVector> b = new Graph<SparseVector>();
		b.addNode(sparse(new int[] {9}, new double[] {1}));
		b.addNode(sparse(new int[] {}, new double[] {}));
		b.addEdge(0, 1, sparse(new int[] {2, 5}, new double[] {1, 1}));
		FeatureDimensions dims = FeatureDimensions.resolve(Arrays.asList(a, b), SparseVectors.INSTANCE);
		assertEquals(10, dims.nodeDims());
		assertEquals(6, dims.edgeDims());
		assertEquals(16, dims.total());
	}

	@Test
	public void testGraphWithoutEdgesHasNoEdgeDimensions() {
		Graph<SparseVector> g = new Graph<SparseVector>();
		g.addNode(sparse(new int[] {3}, new double[] {1}));
		FeatureDimensions dims = FeatureDimensions.resolve(Collections.singletonList(g), SparseVectors.INSTANCE);
		assertEquals(4, dims.nodeDims());
		assertEquals(0, dims.edgeDims());
	}

}
