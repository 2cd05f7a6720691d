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

import com.hellblazer.geodex.common.IndexException.ConfigurationException;

/**
 * A point set stored as one contiguous coordinate array per dimension. The columns are referenced, not copied.
 *
 * @author hal.hildebrand
 */
public final class ColumnPointSet implements PointSet {

    private final double[][] columns;
    private final int        size;

    private ColumnPointSet(double[][] columns, int size) {
        this.columns = columns;
        this.size = size;
    }

    /**
     * Wrap parallel coordinate columns.
     *
     * @param columns one array per dimension, all of the same length
     * @return the point set
     * @throws ConfigurationException if there are no columns, more than {@link PointSet#MAX_DIMENSIONS}, a null
     *                                column, or columns of differing length
     */
    public static ColumnPointSet of(double[]... columns) {
        if (columns == null || columns.length == 0) {
            throw new ConfigurationException("At least 1 dimension must be specified");
        }
        if (columns.length > MAX_DIMENSIONS) {
            throw new ConfigurationException(
            "Maximum of " + MAX_DIMENSIONS + " dimensions can be specified, got " + columns.length);
        }
        for (int d = 0; d < columns.length; d++) {
            if (columns[d] == null) {
                throw new ConfigurationException("Coordinate column " + d + " is null");
            }
            if (columns[d].length != columns[0].length) {
                throw new ConfigurationException(
                String.format("Coordinate column %d has length %d, expected %d", d, columns[d].length,
                              columns[0].length));
            }
        }
        return new ColumnPointSet(columns.clone(), columns[0].length);
    }

    /**
     * Build column storage from row-ordered points, e.g. {@code {{x0, y0}, {x1, y1}}}.
     *
     * @param dimensions number of coordinates per point
     * @param points     the points
     * @return the point set
     */
    public static ColumnPointSet fromRows(int dimensions, double[]... points) {
        if (dimensions <= 0) {
            throw new ConfigurationException("Dimension count must be positive: " + dimensions);
        }
        var columns = new double[dimensions][points.length];
        for (int i = 0; i < points.length; i++) {
            if (points[i].length != dimensions) {
                throw new ConfigurationException(
                String.format("Point %d has %d coordinates, expected %d", i, points[i].length, dimensions));
            }
            for (int d = 0; d < dimensions; d++) {
                columns[d][i] = points[i][d];
            }
        }
        return of(columns);
    }

    @Override
    public double coordinate(int dimension, int element) {
        return columns[dimension][element];
    }

    @Override
    public int dimensions() {
        return columns.length;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public String toString() {
        return "ColumnPointSet[dimensions=" + columns.length + ", size=" + size + "]";
    }
}
