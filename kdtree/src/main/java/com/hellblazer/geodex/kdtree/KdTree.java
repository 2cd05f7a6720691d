/**
 * Copyright (C) 2023 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Affero General Public License as published by the Free
 * Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
 * FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.geodex.kdtree;

import com.hellblazer.geodex.common.IndexException.ConfigurationException;
import com.hellblazer.geodex.common.PointSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.function.IntConsumer;

/**
 * A k-d tree over a static point set.
 * <p>
 * Nodes live in an arena of parallel int arrays and refer to their children by arena slot, {@link #NO_CHILD} marking
 * an absent child. Slot 0 is the root. A node at depth k splits on axis {@code k mod D}: its left subtree holds
 * points strictly less on that axis, its right subtree points greater or equal.
 * <p>
 * The tree is not explicitly balanced. Survey geometry usually arrives sorted along a coordinate, which would
 * degrade a naive tree into a few long branches, so by default points are inserted in a {@link InsertionOrder#DISPERSED
 * dispersed} order whose first elements are far apart.
 * <p>
 * The arena is immutable once built and the tree never modifies the point set, so any number of threads may query
 * it concurrently.
 *
 * @author hal.hildebrand
 */
public final class KdTree {

    public enum InsertionOrder {
        /** Hop through the points in shrinking strides so near-root nodes are well separated */
        DISPERSED,
        /** Insert points in their element order */
        SEQUENTIAL
    }

    public static final int NO_CHILD = -1;

    private static final Logger log = LoggerFactory.getLogger(KdTree.class);

    private final int      dimensions;
    private final int[]    element;
    private final int      height;
    private final int[]    left;
    private final double[] lowerBounds;
    private final PointSet points;
    private final int[]    right;
    private final double[] upperBounds;

    private KdTree(PointSet points, int[] order) {
        this.points = points;
        this.dimensions = points.dimensions();
        this.element = order;
        this.left = new int[order.length];
        this.right = new int[order.length];
        Arrays.fill(left, NO_CHILD);
        Arrays.fill(right, NO_CHILD);
        this.lowerBounds = new double[dimensions];
        this.upperBounds = new double[dimensions];
        this.height = connect();
        computeBounds();
    }

    /**
     * Build a tree over all points of the set.
     *
     * @param points the point set, which must not change while the tree is in use
     * @param order  dispersed or sequential insertion
     * @return the tree
     */
    public static KdTree build(PointSet points, InsertionOrder order) {
        validate(points);
        var n = points.size();
        var sequence = switch (order) {
            case DISPERSED -> dispersedOrder(n);
            case SEQUENTIAL -> sequentialOrder(n);
        };
        var tree = new KdTree(points, sequence);
        log.debug("Built {} tree over {} points in {} dimensions, height {}", order, n, tree.dimensions,
                  tree.height);
        return tree;
    }

    /**
     * Build a tree inserting the points in a caller specified sequence.
     *
     * @param points the point set
     * @param order  a permutation of the element ids 0 until {@code points.size()}
     * @return the tree
     * @throws ConfigurationException if the order is not such a permutation
     */
    public static KdTree build(PointSet points, int[] order) {
        validate(points);
        var n = points.size();
        if (order.length != n) {
            throw new ConfigurationException(
            String.format("Insertion order has %d entries, point set has %d", order.length, n));
        }
        var seen = new boolean[n];
        for (var e : order) {
            if (e < 0 || e >= n) {
                throw new ConfigurationException("Insertion order element out of range: " + e);
            }
            if (seen[e]) {
                throw new ConfigurationException("Insertion order repeats element " + e);
            }
            seen[e] = true;
        }
        var tree = new KdTree(points, order.clone());
        log.debug("Built tree in supplied order over {} points in {} dimensions, height {}", n, tree.dimensions,
                  tree.height);
        return tree;
    }

    /**
     * Build a dispersed tree, the usual choice for survey geometry
     */
    public static KdTree build(PointSet points) {
        return build(points, InsertionOrder.DISPERSED);
    }

    /**
     * The dispersed insertion sequence for n points.
     * <p>
     * A stride {@code nrat} starts at n and shrinks by a factor of 0.6 (truncating) until it reaches zero. For each
     * stride, indices from {@code nd + nrat/2} stepping by {@code nd + nrat} are taken unless already taken, where
     * {@code nd} is {@code floor(sqrt(nrat))} for strides above 6 and 0 otherwise. The last stride is always 1, so
     * every index appears exactly once.
     *
     * @param n number of points
     * @return a permutation of 0 until n
     */
    static int[] dispersedOrder(int n) {
        var order = new int[n];
        var taken = new boolean[n];
        int m = 0;
        for (long nrat = n; nrat > 0; nrat = (long) (nrat * 0.6)) {
            long nd = nrat > 6 ? (long) Math.sqrt((double) nrat) : 0;
            for (long i = nd + nrat / 2; i < n; i += nd + nrat) {
                if (!taken[(int) i]) {
                    taken[(int) i] = true;
                    order[m++] = (int) i;
                }
            }
        }
        if (m != n) {
            throw new IllegalStateException("Dispersed order covered " + m + " of " + n + " elements");
        }
        return order;
    }

    private static int[] sequentialOrder(int n) {
        var order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        return order;
    }

    private static void validate(PointSet points) {
        if (points == null) {
            throw new ConfigurationException("Point set must not be null");
        }
        if (points.dimensions() <= 0) {
            throw new ConfigurationException("Dimension count must be positive: " + points.dimensions());
        }
    }

    /**
     * @return the splitting coordinate of a node on the given axis
     */
    public double coordinate(int node, int axis) {
        return points.coordinate(axis, element[node]);
    }

    public int dimensions() {
        return dimensions;
    }

    /**
     * @return the element id held by the arena slot
     */
    public int element(int node) {
        return element[node];
    }

    /**
     * @return number of levels, 0 for an empty tree
     */
    public int height() {
        return height;
    }

    public boolean isEmpty() {
        return element.length == 0;
    }

    public int left(int node) {
        return left[node];
    }

    /**
     * The smallest coordinate of any indexed point in the dimension, +inf for an empty tree
     */
    public double lowerBound(int dimension) {
        return lowerBounds[dimension];
    }

    public PointSet points() {
        return points;
    }

    public int right(int node) {
        return right[node];
    }

    /**
     * @return the root slot, or {@link #NO_CHILD} if the tree is empty
     */
    public int root() {
        return element.length == 0 ? NO_CHILD : 0;
    }

    public int size() {
        return element.length;
    }

    @Override
    public String toString() {
        return "KdTree[dimensions=" + dimensions + ", size=" + element.length + ", height=" + height + "]";
    }

    /**
     * The largest coordinate of any indexed point in the dimension, -inf for an empty tree
     */
    public double upperBound(int dimension) {
        return upperBounds[dimension];
    }

    private void computeBounds() {
        Arrays.fill(lowerBounds, Double.POSITIVE_INFINITY);
        Arrays.fill(upperBounds, Double.NEGATIVE_INFINITY);
        for (int e = 0; e < element.length; e++) {
            for (int d = 0; d < dimensions; d++) {
                var c = points.coordinate(d, e);
                if (c < lowerBounds[d]) {
                    lowerBounds[d] = c;
                }
                if (c > upperBounds[d]) {
                    upperBounds[d] = c;
                }
            }
        }
    }

    /**
     * Link slots 1.. under the root in arena order, descending from the root for each one.
     *
     * @return the resulting tree height
     */
    private int connect() {
        if (element.length == 0) {
            return 0;
        }
        int levels = 1;
        for (int m = 1; m < element.length; m++) {
            var e = element[m];
            int node = 0;
            int axis = 0;
            int depth = 1;
            while (true) {
                var goLeft = points.coordinate(axis, e) < points.coordinate(axis, element[node]);
                var next = goLeft ? left[node] : right[node];
                if (next == NO_CHILD) {
                    if (goLeft) {
                        left[node] = m;
                    } else {
                        right[node] = m;
                    }
                    break;
                }
                node = next;
                axis = nextAxis(axis);
                depth++;
            }
            levels = Math.max(levels, depth + 1);
        }
        return levels;
    }

    /**
     * Visit, depth first, every node whose subtree can hold a point of the box {@code [min, max)}. The left subtree of
     * a node is strictly below its split, the right subtree at or above it.
     * <p>
     * The descent keeps its own stack, so a chain of coincident points as deep as the point set is searched without
     * exhausting the thread stack. Pending entries are at most one per depth plus a sibling pair, bounded by the
     * height plus one.
     *
     * @param visitor receives each candidate node; containment is the visitor's test
     */
    void descend(double[] min, double[] max, IntConsumer visitor) {
        if (isEmpty()) {
            return;
        }
        var nodes = new int[height + 1];
        var axes = new int[height + 1];
        int top = 0;
        nodes[top] = 0;
        axes[top++] = 0;
        while (top > 0) {
            top--;
            var node = nodes[top];
            var axis = axes[top];
            visitor.accept(node);
            var split = coordinate(node, axis);
            var next = nextAxis(axis);
            // right first, so the left subtree is visited first
            if (split < max[axis] && right[node] != NO_CHILD) {
                nodes[top] = right[node];
                axes[top++] = next;
            }
            if (split >= min[axis] && left[node] != NO_CHILD) {
                nodes[top] = left[node];
                axes[top++] = next;
            }
        }
    }

    int nextAxis(int axis) {
        return axis + 1 == dimensions ? 0 : axis + 1;
    }
}
