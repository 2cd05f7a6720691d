/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Geodex.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.geodex.kdtree;

import com.hellblazer.geodex.common.Extent;
import com.hellblazer.geodex.common.IndexException.ConfigurationException;
import com.hellblazer.geodex.common.PointSet;

import java.util.Arrays;

/**
 * Nearest point search restricted to an extent.
 * <p>
 * Only dimensions flagged as participating contribute to the squared distance, but every dimension restricts the
 * search through the extent. A dimension such as station number can therefore limit which part of a
 * self-intersecting profile is eligible without affecting which eligible point is nearest.
 * <p>
 * The descent visits the same nodes as {@link RangeSearch}; instead of collecting matches it keeps the best
 * candidate. Equal squared distances are ties: they are counted and the largest element id among them wins.
 *
 * @author hal.hildebrand
 */
public class NearestSearch {

    /**
     * Running best candidate for one search
     */
    static final class Candidate {
        private int    element         = -1;
        private int    found           = 0;
        private double squaredDistance = Double.POSITIVE_INFINITY;

        void offer(int element, double squaredDistance) {
            if (found == 0 || squaredDistance < this.squaredDistance) {
                this.found = 1;
                this.element = element;
                this.squaredDistance = squaredDistance;
            } else if (squaredDistance == this.squaredDistance) {
                found++;
                if (element > this.element) {
                    this.element = element;
                }
            }
        }

        NearestResult result(int cycles) {
            return found == 0 ? NearestResult.empty(cycles) : new NearestResult(element, squaredDistance, found,
                                                                                  cycles);
        }
    }

    /**
     * Nearest point anywhere, using every dimension for distance
     */
    public static NearestResult findNear(KdTree tree, double[] target) {
        var participating = new boolean[tree.dimensions()];
        Arrays.fill(participating, true);
        return findNear(tree, Extent.unbounded(tree.dimensions()), target, participating);
    }

    /**
     * Find the nearest point inside the extent.
     *
     * @param tree          the tree
     * @param extent        [min, max) per dimension restricting eligible points
     * @param target        the location to measure from
     * @param participating per dimension, whether it contributes to the squared distance
     * @return the nearest point, or an empty result if no point lies inside the extent
     */
    public static NearestResult findNear(KdTree tree, Extent extent, double[] target, boolean[] participating) {
        validate(tree.dimensions(), target, participating);
        extent.requireDimensions(tree.dimensions());
        var min = new double[tree.dimensions()];
        var max = new double[tree.dimensions()];
        for (int d = 0; d < min.length; d++) {
            min[d] = extent.min(d);
            max[d] = extent.max(d);
        }
        return search(tree, min, max, target, participating, 1);
    }

    /**
     * Search between raw bounds. Arguments are assumed validated.
     */
    static NearestResult search(KdTree tree, double[] min, double[] max, double[] target, boolean[] participating,
                                int cycles) {
        var best = new Candidate();
        var points = tree.points();
        tree.descend(min, max, node -> {
            var element = tree.element(node);
            if (inside(points, element, min, max)) {
                best.offer(element, squaredDistance(points, element, target, participating));
            }
        });
        return best.result(cycles);
    }

    static double squaredDistance(PointSet points, int element, double[] target, boolean[] participating) {
        double sum = 0.0;
        for (int d = 0; d < target.length; d++) {
            if (participating[d]) {
                var delta = target[d] - points.coordinate(d, element);
                sum += delta * delta;
            }
        }
        return sum;
    }

    static void validate(int dimensions, double[] target, boolean[] participating) {
        if (target == null || target.length != dimensions) {
            throw new ConfigurationException(
            String.format("Target must have %d coordinates, got %s", dimensions,
                          target == null ? "null" : String.valueOf(target.length)));
        }
        if (participating == null || participating.length != dimensions) {
            throw new ConfigurationException(
            String.format("Distance participation flags must have %d entries, got %s", dimensions,
                          participating == null ? "null" : String.valueOf(participating.length)));
        }
        for (int d = 0; d < dimensions; d++) {
            if (Double.isNaN(target[d])) {
                throw new ConfigurationException("Target coordinate " + d + " is NaN");
            }
        }
    }

    private static boolean inside(PointSet points, int element, double[] min, double[] max) {
        for (int d = 0; d < min.length; d++) {
            var c = points.coordinate(d, element);
            if (c < min[d] || c >= max[d]) {
                return false;
            }
        }
        return true;
    }
}
