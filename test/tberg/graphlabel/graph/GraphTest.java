package tberg.graphlabel.graph;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class GraphTest {

	@Test
	public void testEdgesAreRecordedOnBothEnds() {
		Graph<String> g = new Graph<String>();
		assertEquals(0, g.addNode("a"));
		assertEquals(1, g.addNode("b"));
		g.addNode("c");
		g.addEdge(0, 2, "ac");

		assertTrue(g.hasEdge(0, 2));
		assertTrue(g.hasEdge(2, 0));
		assertFalse(g.hasEdge(0, 1));
		assertEquals(1, g.node(2).numberOfNeighbors());
		assertEquals(0, g.node(2).neighbor(0).index());
		assertSame(g.node(0).neighbor(0).edge(), g.node(2).neighbor(0).edge());
		assertFalse(g.containsLengthOneCycle());
	}

	@Test
	public void testSelfLoopIsReported() {
		Graph<String> g = new Graph<String>();
		g.addNode("a");
		g.addEdge(0, 0, "aa");
		assertEquals(1, g.node(0).numberOfNeighbors());
		assertTrue(g.containsLengthOneCycle());
	}

	@Test
	public void testBadIndex() {
		Graph<String> g = new Graph<String>();
		g.addNode("a");
		assertThrows(IndexOutOfBoundsException.class, () -> g.addEdge(0, 1, "x"));
		assertThrows(UnsupportedOperationException.class, () -> g.node(0).neighbors().clear());
	}

}
