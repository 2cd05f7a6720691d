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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Nearest point search that starts with a small window around the target and grows it until the answer is provably
 * the same as a search over the whole universe extent.
 * <p>
 * Consecutive traces along a survey line land near each other, so a window of roughly the previous nearest distance
 * usually finds the answer on the first pass and touches only a handful of nodes.
 * <p>
 * Each pass searches the square window {@code [t - R, t + R)} in every participating dimension, clamped to the
 * universe. Non-participating dimensions always use the universe bounds. Then:
 * <ul>
 * <li>nothing found: stop with an empty result if the window already spans the universe on every side, otherwise
 * multiply R by the growth multiplier and search again;</li>
 * <li>found at distance r &gt;= R: a nearer or equally near point could sit outside the square, or on its exclusive
 * upper edge, but inside the circle of radius r, so search again with R = 1.001 r (unless the window already spans
 * everything);</li>
 * <li>otherwise the answer is final.</li>
 * </ul>
 * A window side that already reaches past every indexed point in its dimension counts as spanning, which bounds the
 * number of passes even when the universe is unbounded.
 *
 * @author hal.hildebrand
 */
public class ExpandingRadiusSearch {

    /**
     * Margin applied when the window must grow to the current nearest distance, to avoid losing the current point to
     * the exclusive upper bound through rounding.
     */
    public static final double RADIUS_MARGIN = 1.001;

    private static final Logger log = LoggerFactory.getLogger(ExpandingRadiusSearch.class);

    /**
     * Expanding search over an unbounded universe with every dimension participating
     */
    public static NearestResult cycleForNear(KdTree tree, double[] target, double initialRadius,
                                             double multiplier) {
        var participating = new boolean[tree.dimensions()];
        Arrays.fill(participating, true);
        return cycleForNear(tree, Extent.unbounded(tree.dimensions()), target, participating, initialRadius,
                            multiplier);
    }

    /**
     * Find the nearest point inside the universe extent by expanding a search window.
     *
     * @param tree          the tree
     * @param universe      [min, max) per dimension restricting eligible points
     * @param target        the location to measure from
     * @param participating per dimension, whether it contributes to the squared distance
     * @param initialRadius half width of the first window, positive
     * @param multiplier    growth factor applied when a window finds nothing, greater than 1
     * @return the same element, squared distance and tie count as
     * {@link NearestSearch#findNear(KdTree, Extent, double[], boolean[])} over the universe, with the number of
     * passes in {@link NearestResult#cycles()}
     * @throws ConfigurationException if the radius is not positive or the multiplier cannot grow the window
     */
    public static NearestResult cycleForNear(KdTree tree, Extent universe, double[] target, boolean[] participating,
                                             double initialRadius, double multiplier) {
        var dimensions = tree.dimensions();
        NearestSearch.validate(dimensions, target, participating);
        universe.requireDimensions(dimensions);
        if (!(initialRadius > 0.0)) {
            throw new ConfigurationException("Initial search radius must be positive: " + initialRadius);
        }
        if (!(multiplier > 1.0)) {
            throw new ConfigurationException("Search radius multiplier must be greater than 1: " + multiplier);
        }

        var min = new double[dimensions];
        var max = new double[dimensions];
        int fixedSides = 0;
        for (int d = 0; d < dimensions; d++) {
            if (!participating[d]) {
                min[d] = universe.min(d);
                max[d] = universe.max(d);
                fixedSides += 2;
            }
        }

        var radius = initialRadius;
        int cycles = 0;
        while (true) {
            cycles++;
            int spanned = fixedSides;
            for (int d = 0; d < dimensions; d++) {
                if (!participating[d]) {
                    continue;
                }
                min[d] = target[d] - radius;
                max[d] = target[d] + radius;
                if (min[d] <= universe.min(d)) {
                    min[d] = universe.min(d);
                    spanned++;
                } else if (min[d] <= tree.lowerBound(d)) {
                    spanned++;
                }
                if (max[d] >= universe.max(d)) {
                    max[d] = universe.max(d);
                    spanned++;
                } else if (max[d] > tree.upperBound(d)) {
                    spanned++;
                }
            }
            var complete = spanned == 2 * dimensions;
            var result = NearestSearch.search(tree, min, max, target, participating, cycles);
            if (result.isEmpty()) {
                if (complete) {
                    log.trace("No point in universe after {} cycles, radius {}", cycles, radius);
                    return result;
                }
                radius *= multiplier;
                continue;
            }
            if (result.squaredDistance() >= radius * radius && !complete) {
                radius = result.distance() * RADIUS_MARGIN;
                continue;
            }
            log.trace("Found element {} at distance {} after {} cycles", result.element(), result.distance(),
                      cycles);
            return result;
        }
    }
}
