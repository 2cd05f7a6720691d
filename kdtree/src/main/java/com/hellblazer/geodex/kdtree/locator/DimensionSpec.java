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
package com.hellblazer.geodex.kdtree.locator;

import com.hellblazer.geodex.common.IndexException.ConfigurationException;

/**
 * How one dimension takes part in a located search.
 * <p>
 * A participating dimension adds its squared difference to the distance. A non-participating dimension only
 * restricts which points are eligible, which is how a station number can keep a trace on the right leg of a profile
 * that crosses itself.
 *
 * @param participating whether the dimension contributes to the squared distance
 * @param mode          whether {@code min} and {@code max} are absolute or relative to each query's target
 * @param min           inclusive lower bound
 * @param max           exclusive upper bound, strictly greater than {@code min}
 * @author hal.hildebrand
 */
public record DimensionSpec(boolean participating, ExtentMode mode, double min, double max) {

    public enum ExtentMode {
        /** The range is used as given */
        ABSOLUTE,
        /** The query target's coordinate is added to both ends of the range */
        RELATIVE
    }

    public DimensionSpec {
        if (mode == null) {
            throw new ConfigurationException("Extent mode must be specified");
        }
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new ConfigurationException("Extent range bounds cannot be NaN");
        }
        if (!(min < max)) {
            throw new ConfigurationException(String.format("Extent range min %s must be less than max %s", min, max));
        }
    }

    /**
     * A participating dimension without any range restriction
     */
    public static DimensionSpec distance() {
        return new DimensionSpec(true, ExtentMode.ABSOLUTE, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    /**
     * A non-participating dimension restricted to a fixed range
     */
    public static DimensionSpec filter(double min, double max) {
        return new DimensionSpec(false, ExtentMode.ABSOLUTE, min, max);
    }

    /**
     * A non-participating dimension restricted to a range around each query's target
     */
    public static DimensionSpec relativeFilter(double min, double max) {
        return new DimensionSpec(false, ExtentMode.RELATIVE, min, max);
    }

    double lower(double target) {
        return mode == ExtentMode.RELATIVE ? target + min : min;
    }

    double upper(double target) {
        return mode == ExtentMode.RELATIVE ? target + max : max;
    }
}
