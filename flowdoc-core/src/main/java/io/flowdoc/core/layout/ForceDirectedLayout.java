package io.flowdoc.core.layout;

import io.flowdoc.core.document.Position;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/// Spring-embedder layout (Fruchterman-Reingold).
///
/// Nodes start at seeded random points in the unit square. Each iteration every
/// pair of nodes repels with force `k²/d` and every connected pair attracts with
/// `d²/k`, where `k = sqrt(1/n)`; displacement is capped by a temperature that
/// cools linearly to zero. Edges act in both directions. The result is centered
/// on its mean, normalized so the largest coordinate magnitude is 1, then
/// multiplied by `scale`.
///
/// The same graph with the same seed always produces the same positions.
///
/// @implNote Quadratic in the node count per iteration, which is fine for
/// document-sized graphs.
public final class ForceDirectedLayout implements LayoutStrategy {

    private static final double MIN_DISTANCE = 0.01;
    private static final double CONVERGENCE_THRESHOLD = 1e-4;

    private final int iterations;
    private final double scale;
    private final long seed;

    /// @param iterations maximum simulation steps, positive
    /// @param scale factor applied to the normalized coordinates
    /// @param seed seed of the initial placement
    public ForceDirectedLayout(int iterations, double scale, long seed) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        this.iterations = iterations;
        this.scale = scale;
        this.seed = seed;
    }

    /// @throws LayoutException if the simulation produces non-finite coordinates
    @Override
    public Map<String, Position> place(DirectedGraph graph) {
        List<String> nodes = graph.nodes();
        int n = nodes.size();
        Map<String, Position> positions = new LinkedHashMap<>();
        if (n == 0) {
            return positions;
        }
        if (n == 1) {
            positions.put(nodes.get(0), new Position(0.0, 0.0));
            return positions;
        }

        boolean[][] adjacent = adjacency(graph, nodes);
        double[][] pos = initialPositions(n);
        simulate(pos, adjacent);
        rescale(pos);

        for (int i = 0; i < n; i++) {
            double x = pos[i][0] * scale;
            double y = pos[i][1] * scale;
            if (!Double.isFinite(x) || !Double.isFinite(y)) {
                throw new LayoutException("Force simulation diverged at node " + nodes.get(i));
            }
            positions.put(nodes.get(i), new Position(x, y));
        }
        return positions;
    }

    private static boolean[][] adjacency(DirectedGraph graph, List<String> nodes) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i), i);
        }
        boolean[][] adjacent = new boolean[nodes.size()][nodes.size()];
        for (String node : nodes) {
            int from = index.get(node);
            for (String next : graph.successors(node)) {
                int to = index.get(next);
                if (from != to) {
                    adjacent[from][to] = true;
                    adjacent[to][from] = true;
                }
            }
        }
        return adjacent;
    }

    private double[][] initialPositions(int n) {
        Random random = new Random(seed);
        double[][] pos = new double[n][2];
        for (int i = 0; i < n; i++) {
            pos[i][0] = random.nextDouble();
            pos[i][1] = random.nextDouble();
        }
        return pos;
    }

    private void simulate(double[][] pos, boolean[][] adjacent) {
        int n = pos.length;
        double k = Math.sqrt(1.0 / n);
        double temperature = 0.1 * Math.max(extent(pos, 0), extent(pos, 1));
        double cooling = temperature / (iterations + 1);

        for (int iteration = 0; iteration < iterations; iteration++) {
            double[][] displacement = new double[n][2];
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    if (i == j) {
                        continue;
                    }
                    double dx = pos[i][0] - pos[j][0];
                    double dy = pos[i][1] - pos[j][1];
                    double distance = Math.max(MIN_DISTANCE, Math.hypot(dx, dy));
                    double force = k * k / (distance * distance);
                    if (adjacent[i][j]) {
                        force -= distance / k;
                    }
                    displacement[i][0] += dx * force;
                    displacement[i][1] += dy * force;
                }
            }

            double moved = 0.0;
            for (int i = 0; i < n; i++) {
                double length = Math.hypot(displacement[i][0], displacement[i][1]);
                if (length < MIN_DISTANCE) {
                    length = 0.1;
                }
                double stepX = displacement[i][0] * temperature / length;
                double stepY = displacement[i][1] * temperature / length;
                pos[i][0] += stepX;
                pos[i][1] += stepY;
                moved += Math.hypot(stepX, stepY);
            }

            temperature -= cooling;
            if (moved / n < CONVERGENCE_THRESHOLD) {
                break;
            }
        }
    }

    private static double extent(double[][] pos, int axis) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] p : pos) {
            min = Math.min(min, p[axis]);
            max = Math.max(max, p[axis]);
        }
        return max - min;
    }

    private static void rescale(double[][] pos) {
        int n = pos.length;
        double meanX = 0.0;
        double meanY = 0.0;
        for (double[] p : pos) {
            meanX += p[0] / n;
            meanY += p[1] / n;
        }

        double limit = 0.0;
        for (double[] p : pos) {
            p[0] -= meanX;
            p[1] -= meanY;
            limit = Math.max(limit, Math.max(Math.abs(p[0]), Math.abs(p[1])));
        }

        if (limit > 0.0) {
            for (double[] p : pos) {
                p[0] /= limit;
                p[1] /= limit;
            }
        }
    }
}
