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
package com.hellblazer.geodex.common;

/**
 * Random access to N points in D dimensions, addressed by element id in [0, N).
 * <p>
 * Implementations must not change their coordinates while an index built over them is in use. Indices only read
 * coordinates, they never copy or modify them.
 *
 * @author hal.hildebrand
 */
public interface PointSet {

    /**
     * Largest supported dimension count.
     */
    int MAX_DIMENSIONS = 9;

    /**
     * @param dimension the dimension, 0 until {@link #dimensions()}
     * @param element   the element id, 0 until {@link #size()}
     * @return the coordinate of the element on the dimension
     */
    double coordinate(int dimension, int element);

    int dimensions();

    int size();

    /**
     * Copy the coordinates of an element into a new array
     */
    default double[] point(int element) {
        var point = new double[dimensions()];
        for (int d = 0; d < point.length; d++) {
            point[d] = coordinate(d, element);
        }
        return point;
    }
}
