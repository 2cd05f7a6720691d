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
import com.hellblazer.geodex.common.IntArrayList;
import com.hellblazer.geodex.common.PointSet;

/**
 * Linear scan counterparts of the tree searches, with identical extent and tie semantics. Faster than the tree for a
 * handful of points, and the reference the tree searches are verified against.
 *
 * @author hal.hildebrand
 */
public class BruteForceSearch {

    /**
     * @return the element ids inside the extent, in ascending order
     */
    public static IntArrayList findIn(PointSet points, Extent extent) {
        extent.requireDimensions(points.dimensions());
        var found = new IntArrayList();
        for (int e = 0; e < points.size(); e++) {
            if (extent.contains(points, e)) {
                found.addInt(e);
            }
        }
        return found;
    }

    /**
     * Scan every point for the nearest one inside the extent
     *
     * @see NearestSearch#findNear(KdTree, Extent, double[], boolean[])
     */
    public static NearestResult findNear(PointSet points, Extent extent, double[] target, boolean[] participating) {
        NearestSearch.validate(points.dimensions(), target, participating);
        extent.requireDimensions(points.dimensions());
        var best = new NearestSearch.Candidate();
        for (int e = 0; e < points.size(); e++) {
            if (extent.contains(points, e)) {
                best.offer(e, NearestSearch.squaredDistance(points, e, target, participating));
            }
        }
        return best.result(1);
    }
}
