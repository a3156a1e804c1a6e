package tberg.graphlabel.graphcut;

import java.util.ArrayDeque;
import java.util.Arrays;

/**
 * Solves a binary Potts model as a minimum s-t cut. Nodes with positive score
 * are tied to the source, nodes with negative score to the sink, and every
 * Potts edge becomes a pair of opposing arcs carrying its weight. The flow
 * itself is pushed with Dinic's blocking flows.
 * <p>
 * After the flow is maximal a node is labelled on exactly when it is still
 * reachable from the source in the residual network, so a node that is free
 * to take either label comes out off.
 */
public class MaxFlowPottsMinimizer implements PottsMinimizer {

	public boolean[] findMaxLabeling(PottsGraph graph) {
		FlowNetwork net = buildNetwork(graph);
		net.maxFlow();
		boolean[] reachable = net.reachableFromSource();
		return Arrays.copyOf(reachable, graph.numberOfNodes());
	}

	static FlowNetwork buildNetwork(PottsGraph graph) {
		final int n = graph.numberOfNodes();
		FlowNetwork net = new FlowNetwork(n + 2, n, n + 1, 2 * (n + graph.numberOfEdges()));
		for (int i = 0; i < n; ++i) {
			double score = graph.nodeScore(i);
			if (Double.isNaN(score) || Double.isInfinite(score)) throw new PottsSolverException("Node " + i + " has non-finite score " + score);
			// cutting source->i labels i off and forfeits its score; cutting i->sink labels it on
			if (score > 0) net.addArcPair(net.source, i, score, 0.0);
			else if (score < 0) net.addArcPair(i, net.sink, -score, 0.0);
		}
		for (int e = 0; e < graph.numberOfEdges(); ++e) {
			double weight = graph.edgeWeight(e);
			if (!(weight >= 0) || Double.isInfinite(weight)) {
				throw new PottsSolverException("Edge (" + graph.edgeFrom(e) + ", " + graph.edgeTo(e) + ") has weight " + weight + "; min cut needs finite non-negative edge weights");
			}
			if (weight > 0) net.addArcPair(graph.edgeFrom(e), graph.edgeTo(e), weight, weight);
		}
		return net;
	}

	/**
	 * Residual network. Arc a and its partner a^1 are stored next to each other.
	 */
	static class FlowNetwork {
		final int source;
		final int sink;
		private final int numVertices;
		private int[] head;
		private int[] next;
		private int[] to;
		private double[] residual;
		private int numArcs = 0;

		FlowNetwork(int numVertices, int source, int sink, int arcCapacity) {
			this.numVertices = numVertices;
			this.source = source;
			this.sink = sink;
			this.head = new int[numVertices];
			Arrays.fill(head, -1);
			int cap = Math.max(2, arcCapacity);
			this.next = new int[cap];
			this.to = new int[cap];
			this.residual = new double[cap];
		}

		void addArcPair(int u, int v, double capUV, double capVU) {
			if (numArcs + 2 > to.length) {
				int cap = to.length * 2;
				next = Arrays.copyOf(next, cap);
				to = Arrays.copyOf(to, cap);
				residual = Arrays.copyOf(residual, cap);
			}
			addArc(u, v, capUV);
			addArc(v, u, capVU);
		}

		private void addArc(int u, int v, double cap) {
			to[numArcs] = v;
			residual[numArcs] = cap;
			next[numArcs] = head[u];
			head[u] = numArcs;
			numArcs++;
		}

		/**
		 * Dinic: repeated breadth first level graphs, each drained by a blocking
		 * flow found with an explicit path stack.
		 */
		double maxFlow() {
			double flow = 0.0;
			int[] level = new int[numVertices];
			int[] iter = new int[numVertices];
			int[] pathArcs = new int[numVertices];
			while (buildLevels(level)) {
				System.arraycopy(head, 0, iter, 0, numVertices);
				flow += blockingFlow(level, iter, pathArcs);
			}
			return flow;
		}

		private boolean buildLevels(int[] level) {
			Arrays.fill(level, -1);
			ArrayDeque<Integer> queue = new ArrayDeque<Integer>();
			queue.add(source);
			level[source] = 0;
			while (!queue.isEmpty()) {
				int u = queue.poll();
				for (int a = head[u]; a != -1; a = next[a]) {
					int v = to[a];
					if (level[v] == -1 && residual[a] > 0) {
						level[v] = level[u] + 1;
						queue.add(v);
					}
				}
			}
			return level[sink] != -1;
		}

		private double blockingFlow(int[] level, int[] iter, int[] pathArcs) {
			double flow = 0.0;
			int depth = 0;
			int u = source;
			while (true) {
				if (u == sink) {
					double bottleneck = Double.POSITIVE_INFINITY;
					for (int k = 0; k < depth; ++k) {
						bottleneck = Math.min(bottleneck, residual[pathArcs[k]]);
					}
					for (int k = 0; k < depth; ++k) {
						int a = pathArcs[k];
						// the bottleneck arc lands on exactly zero, so each round saturates one arc
						residual[a] = (residual[a] == bottleneck) ? 0.0 : residual[a] - bottleneck;
						residual[a ^ 1] += bottleneck;
					}
					flow += bottleneck;
					depth = 0;
					u = source;
					continue;
				}
				int a = iter[u];
				while (a != -1 && !(residual[a] > 0 && level[to[a]] == level[u] + 1)) a = next[a];
				iter[u] = a;
				if (a != -1) {
					pathArcs[depth++] = a;
					u = to[a];
				} else {
					if (u == source) break;
					// dead end, drop it from this level graph
					level[u] = -1;
					u = to[pathArcs[--depth] ^ 1];
					iter[u] = next[iter[u]];
				}
			}
			return flow;
		}

		boolean[] reachableFromSource() {
			boolean[] seen = new boolean[numVertices];
			ArrayDeque<Integer> queue = new ArrayDeque<Integer>();
			queue.add(source);
			seen[source] = true;
			while (!queue.isEmpty()) {
				int u = queue.poll();
				for (int a = head[u]; a != -1; a = next[a]) {
					if (!seen[to[a]] && residual[a] > 0) {
						seen[to[a]] = true;
						queue.add(to[a]);
					}
				}
			}
			return seen;
		}
	}

}
