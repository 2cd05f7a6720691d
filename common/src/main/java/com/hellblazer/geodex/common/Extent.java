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

import java.util.Arrays;

/**
 * An axis-aligned box with one [min, max) range per dimension. The minimum is inclusive and the maximum exclusive.
 * <p>
 * A box whose minimum is not below its maximum in some dimension is legal and contains nothing.
 *
 * @author hal.hildebrand
 */
public final class Extent {

    private final double[] min;
    private final double[] max;

    private Extent(double[] min, double[] max) {
        this.min = min;
        this.max = max;
    }

    /**
     * Create an extent from per-dimension bounds. The arrays are copied.
     */
    public static Extent of(double[] min, double[] max) {
        if (min == null || max == null) {
            throw new ConfigurationException("Extent bounds must not be null");
        }
        if (min.length == 0) {
            throw new ConfigurationException("Extent must have at least 1 dimension");
        }
        if (min.length != max.length) {
            throw new ConfigurationException(
            String.format("Extent minimum has %d dimensions but maximum has %d", min.length, max.length));
        }
        for (int d = 0; d < min.length; d++) {
            if (Double.isNaN(min[d]) || Double.isNaN(max[d])) {
                throw new ConfigurationException("Extent bound in dimension " + d + " is NaN");
            }
        }
        return new Extent(min.clone(), max.clone());
    }

    /**
     * The extent which contains every finite point, (-inf, +inf) in each dimension.
     */
    public static Extent unbounded(int dimensions) {
        if (dimensions <= 0) {
            throw new ConfigurationException("Dimension count must be positive: " + dimensions);
        }
        var min = new double[dimensions];
        var max = new double[dimensions];
        Arrays.fill(min, Double.NEGATIVE_INFINITY);
        Arrays.fill(max, Double.POSITIVE_INFINITY);
        return new Extent(min, max);
    }

    public boolean contains(double[] point) {
        for (int d = 0; d < min.length; d++) {
            if (point[d] < min[d] || point[d] >= max[d]) {
                return false;
            }
        }
        return true;
    }

    public boolean contains(PointSet points, int element) {
        for (int d = 0; d < min.length; d++) {
            var c = points.coordinate(d, element);
            if (c < min[d] || c >= max[d]) {
                return false;
            }
        }
        return true;
    }

    public int dimensions() {
        return min.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Extent other)) {
            return false;
        }
        return Arrays.equals(min, other.min) && Arrays.equals(max, other.max);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(min) + Arrays.hashCode(max);
    }

    /**
     * @return true if no point can lie inside this extent
     */
    public boolean isEmpty() {
        for (int d = 0; d < min.length; d++) {
            if (!(min[d] < max[d])) {
                return true;
            }
        }
        return false;
    }

    public double max(int dimension) {
        return max[dimension];
    }

    public double min(int dimension) {
        return min[dimension];
    }

    @Override
    public String toString() {
        var buf = new StringBuilder("Extent[");
        for (int d = 0; d < min.length; d++) {
            if (d > 0) {
                buf.append(" x ");
            }
            buf.append('[').append(min[d]).append(", ").append(max[d]).append(')');
        }
        return buf.append(']').toString();
    }

    /**
     * Verify this extent spans the expected number of dimensions
     *
     * @throws ConfigurationException on mismatch
     */
    public Extent requireDimensions(int dimensions) {
        if (min.length != dimensions) {
            throw new ConfigurationException(
            String.format("Extent has %d dimensions, expected %d", min.length, dimensions));
        }
        return this;
    }
}
