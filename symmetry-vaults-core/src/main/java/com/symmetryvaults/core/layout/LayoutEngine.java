package com.symmetryvaults.core.layout;

import com.symmetryvaults.core.symmetry.CayleyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Computes the 2-D room map of a group from its Cayley table.
 *
 * <p>Elements are layered by their BFS distance from the identity, where every
 * non-identity element is a step {@code v -> table[v][k]}. Each layer starts
 * on an arc of a concentric ring and a fixed number of force relaxation
 * rounds (pairwise inverse-square repulsion plus a radial spring toward the
 * layer radius) spreads the nodes. The identity stays at the panel centre and
 * every other node is clamped inside the margin. The computation is
 * deterministic and reads the table only.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RoomLayout layout = new LayoutEngine(LayoutSettings.defaults()).compute(table);
 * layout.positions().get(0);   // identity at (200, 200)
 * }</pre>
 */
public class LayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutSettings settings;

    public LayoutEngine(LayoutSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public RoomLayout compute(CayleyTable table) {
        int n = table.order();
        int[] layer = bfsLayers(table);

        Map<Integer, List<Integer>> layers = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            layers.computeIfAbsent(layer[i], k -> new ArrayList<>()).add(i);
        }
        int layerCount = layers.size();
        double cx = settings.width() / 2.0;
        double cy = settings.height() / 2.0;
        double maxRadius = Math.min(settings.width(), settings.height()) * settings.radiusFactor();

        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            int d = layer[i];
            if (d == 0) {
                x[i] = cx;
                y[i] = cy;
                continue;
            }
            List<Integer> members = layers.get(d);
            int position = members.indexOf(i);
            int count = members.size();
            double r = ringRadius(d, layerCount, maxRadius);
            double angle;
            if (count == 1) {
                angle = -Math.PI / 2.0;
            } else {
                double span = Math.min(2 * Math.PI, count * 0.6);
                double start = -Math.PI / 2.0 - span / 2.0 + d * 0.4;
                angle = start + ((double) position / (count - 1)) * span;
            }
            x[i] = cx + r * Math.cos(angle);
            y[i] = cy + r * Math.sin(angle);
        }

        relax(x, y, layer, layerCount, maxRadius, cx, cy);

        List<NodePosition> positions = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            positions.add(new NodePosition(i, table.id(i), layer[i], x[i], y[i]));
        }
        log.debug("Laid out {} rooms in {} layers", n, layerCount);
        return new RoomLayout(settings.width(), settings.height(), nodeSize(n), positions);
    }

    private void relax(double[] x, double[] y, int[] layer, int layerCount, double maxRadius,
                       double cx, double cy) {
        int n = x.length;
        for (int round = 0; round < settings.iterations(); round++) {
            double[] fx = new double[n];
            double[] fy = new double[n];
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    double dx = x[j] - x[i];
                    double dy = y[j] - y[i];
                    double dist = Math.max(1.0, Math.sqrt(dx * dx + dy * dy));
                    double force = settings.repulsion() / (dist * dist);
                    double px = dx / dist * force;
                    double py = dy / dist * force;
                    fx[i] -= px;
                    fy[i] -= py;
                    fx[j] += px;
                    fy[j] += py;
                }
                if (layer[i] > 0) {
                    double targetRadius = ringRadius(layer[i], layerCount, maxRadius);
                    double dx = x[i] - cx;
                    double dy = y[i] - cy;
                    double radius = Math.sqrt(dx * dx + dy * dy);
                    if (radius > 0) {
                        double diff = radius - targetRadius;
                        fx[i] -= dx / radius * diff * settings.springStrength();
                        fy[i] -= dy / radius * diff * settings.springStrength();
                    }
                }
            }
            // index 0 is the identity and stays pinned
            for (int i = 1; i < n; i++) {
                x[i] = clamp(x[i] + fx[i] * settings.step(), settings.margin(), settings.width() - settings.margin());
                y[i] = clamp(y[i] + fy[i] * settings.step(), settings.margin(), settings.height() - settings.margin());
            }
        }
    }

    private static double ringRadius(int layer, int layerCount, double maxRadius) {
        return ((double) layer / Math.max(1, layerCount - 1)) * maxRadius;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * BFS distance of every element from the identity, stepping by every
     * non-identity element.
     *
     * @param table Cayley table
     * @return distance per element index
     */
    public static int[] bfsLayers(CayleyTable table) {
        int n = table.order();
        int[] distance = new int[n];
        Arrays.fill(distance, -1);
        distance[table.identityIndex()] = 0;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(table.identityIndex());
        while (!queue.isEmpty()) {
            int v = queue.poll();
            for (int k = 0; k < n; k++) {
                if (k == table.identityIndex()) {
                    continue;
                }
                int next = table.multiply(v, k);
                if (distance[next] < 0) {
                    distance[next] = distance[v] + 1;
                    queue.add(next);
                }
            }
        }
        return distance;
    }

    /**
     * Node radius by number of rooms.
     *
     * @param elementCount group order
     * @return 11 up to 12 rooms, 9 up to 16, 7 above
     */
    public static double nodeSize(int elementCount) {
        if (elementCount > 16) {
            return 7.0;
        }
        if (elementCount > 12) {
            return 9.0;
        }
        return 11.0;
    }
}
