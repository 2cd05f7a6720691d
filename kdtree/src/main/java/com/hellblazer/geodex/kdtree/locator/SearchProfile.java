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
 * Search tuning for a {@link NearestLocator}. None of these settings change which point is found, only how much work
 * it takes, except {@code distanceLimit}.
 *
 * @param function      which search algorithm answers each query
 * @param radiusPolicy  how the first window of an expanding search is sized
 * @param initialRadius fixed first radius, or the increment added to the previous distance; positive
 * @param multiplier    window growth factor for expanding searches, greater than 1
 * @param verify        re-run every query by linear scan and report disagreements
 * @param distanceLimit results farther than this are reported as empty; +inf for no limit
 * @author hal.hildebrand
 */
public record SearchProfile(SearchFunction function, RadiusPolicy radiusPolicy, double initialRadius,
                            double multiplier, boolean verify, double distanceLimit) {

    public enum RadiusPolicy {
        /** Every query starts at the initial radius */
        FIXED,
        /** Each query starts at the initial radius plus the previous query's nearest distance */
        CARRY_OVER
    }

    public enum SearchFunction {
        /** Linear scan of every point; competitive only for small point sets */
        BRUTE,
        /** Single descent bounded by the query extent */
        DIRECT,
        /** Windowed descents growing from the target; usually fastest for streamed queries */
        EXPANDING
    }

    public static final double DEFAULT_INITIAL_RADIUS = 100.0;
    public static final double DEFAULT_MULTIPLIER     = 2.0;

    public SearchProfile {
        if (function == null) {
            throw new ConfigurationException("Search function must be specified");
        }
        if (radiusPolicy == null) {
            throw new ConfigurationException("Radius policy must be specified");
        }
        if (!(initialRadius > 0.0) || Double.isInfinite(initialRadius)) {
            throw new ConfigurationException("Initial search radius must be positive and finite: " + initialRadius);
        }
        if (!(multiplier > 1.0)) {
            throw new ConfigurationException("Search radius multiplier must be greater than 1: " + multiplier);
        }
        if (!(distanceLimit >= 0.0)) {
            throw new ConfigurationException("Distance limit cannot be negative: " + distanceLimit);
        }
    }

    /**
     * Expanding search carrying the previous distance over, radius 100, multiplier 2, no verification, no limit
     */
    public static SearchProfile defaults() {
        return new SearchProfile(SearchFunction.EXPANDING, RadiusPolicy.CARRY_OVER, DEFAULT_INITIAL_RADIUS,
                                 DEFAULT_MULTIPLIER, false, Double.POSITIVE_INFINITY);
    }

    public boolean hasDistanceLimit() {
        return distanceLimit != Double.POSITIVE_INFINITY;
    }

    public SearchProfile withDistanceLimit(double limit) {
        return new SearchProfile(function, radiusPolicy, initialRadius, multiplier, verify, limit);
    }

    public SearchProfile withFunction(SearchFunction function) {
        return new SearchProfile(function, radiusPolicy, initialRadius, multiplier, verify, distanceLimit);
    }

    public SearchProfile withRadius(RadiusPolicy policy, double radius) {
        return new SearchProfile(function, policy, radius, multiplier, verify, distanceLimit);
    }

    public SearchProfile withMultiplier(double multiplier) {
        return new SearchProfile(function, radiusPolicy, initialRadius, multiplier, verify, distanceLimit);
    }

    public SearchProfile withVerification(boolean verify) {
        return new SearchProfile(function, radiusPolicy, initialRadius, multiplier, verify, distanceLimit);
    }
}
