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

/**
 * Axis-aligned box search over a {@link KdTree}.
 *
 * @author hal.hildebrand
 */
public class RangeSearch {

    /**
     * Find every point inside the extent.
     * <p>
     * An extent that is empty in some dimension is not an error, it simply yields no elements.
     *
     * @param tree   the tree
     * @param extent box with one [min, max) range per tree dimension
     * @return the element ids inside the box, each once, in no particular order
     */
    public static IntArrayList findIn(KdTree tree, Extent extent) {
        extent.requireDimensions(tree.dimensions());
        var min = new double[tree.dimensions()];
        var max = new double[tree.dimensions()];
        for (int d = 0; d < min.length; d++) {
            min[d] = extent.min(d);
            max[d] = extent.max(d);
        }
        var points = tree.points();
        var found = new IntArrayList();
        tree.descend(min, max, node -> {
            var element = tree.element(node);
            if (extent.contains(points, element)) {
                found.addInt(element);
            }
        });
        return found;
    }
}
