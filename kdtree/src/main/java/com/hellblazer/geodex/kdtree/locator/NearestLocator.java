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

import com.hellblazer.geodex.common.Extent;
import com.hellblazer.geodex.common.IndexException.ConfigurationException;
import com.hellblazer.geodex.kdtree.BruteForceSearch;
import com.hellblazer.geodex.kdtree.ExpandingRadiusSearch;
import com.hellblazer.geodex.kdtree.KdTree;
import com.hellblazer.geodex.kdtree.NearestResult;
import com.hellblazer.geodex.kdtree.NearestSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Answers a stream of nearest point queries against one reference tree, such as the nearest profile point for each
 * trace midpoint, or the nearest source, receiver or cdp location for each trace.
 * <p>
 * Each query builds its extent from the {@link DimensionSpec}s, runs the search function chosen by the
 * {@link SearchProfile}, optionally checks the answer by linear scan, and applies the distance limit. With the
 * {@link SearchProfile.RadiusPolicy#CARRY_OVER carry over} policy the previous answer's distance seeds the next
 * expanding search, which suits acquisition-ordered input.
 * <p>
 * Not thread safe: the locator keeps the previous distance and its counters. Use one locator per input stream; the
 * tree itself may be shared.
 *
 * @author hal.hildebrand
 */
public class NearestLocator {
    private static final Logger log = LoggerFactory.getLogger(NearestLocator.class);

    private final List<DimensionSpec> dimensions;
    private final boolean[]           participating;
    private final SearchProfile       profile;
    private final KdTree              tree;

    private long   beyondLimit;
    private long   cycles;
    private long   empty;
    private long   mismatches;
    private double previousDistance = 0.0;
    private long   queries;

    public NearestLocator(KdTree tree, SearchProfile profile, List<DimensionSpec> dimensions) {
        if (tree == null || profile == null || dimensions == null) {
            throw new ConfigurationException("Tree, profile and dimensions are required");
        }
        if (dimensions.size() != tree.dimensions()) {
            throw new ConfigurationException(
            String.format("%d dimension specs for a %d dimensional tree", dimensions.size(), tree.dimensions()));
        }
        this.tree = tree;
        this.profile = profile;
        this.dimensions = Collections.unmodifiableList(new ArrayList<>(dimensions));
        this.participating = new boolean[dimensions.size()];
        for (int d = 0; d < participating.length; d++) {
            participating[d] = dimensions.get(d).participating();
        }
    }

    /**
     * A locator where every dimension participates and nothing restricts the search
     */
    public static NearestLocator of(KdTree tree, SearchProfile profile) {
        var specs = new ArrayList<DimensionSpec>();
        for (int d = 0; d < tree.dimensions(); d++) {
            specs.add(DimensionSpec.distance());
        }
        return new NearestLocator(tree, profile, specs);
    }

    /**
     * The extent a query at the target is restricted to
     */
    public Extent extentFor(double[] target) {
        var min = new double[dimensions.size()];
        var max = new double[dimensions.size()];
        for (int d = 0; d < min.length; d++) {
            var spec = dimensions.get(d);
            min[d] = spec.lower(target[d]);
            max[d] = spec.upper(target[d]);
        }
        return Extent.of(min, max);
    }

    /**
     * Find the nearest eligible point to the target.
     *
     * @param target coordinates, one per tree dimension
     * @return the nearest point, or an empty result if no point is eligible or the nearest is beyond the distance
     * limit
     */
    public NearestResult locate(double[] target) {
        if (target == null || target.length != tree.dimensions()) {
            throw new ConfigurationException("Target must have " + tree.dimensions() + " coordinates");
        }
        var extent = extentFor(target);
        var result = switch (profile.function()) {
            case BRUTE -> BruteForceSearch.findNear(tree.points(), extent, target, participating);
            case DIRECT -> NearestSearch.findNear(tree, extent, target, participating);
            case EXPANDING -> ExpandingRadiusSearch.cycleForNear(tree, extent, target, participating,
                                                                 initialRadius(), profile.multiplier());
        };
        queries++;
        cycles += result.cycles();

        if (profile.verify()) {
            verify(target, extent, result);
        }
        if (result.isEmpty()) {
            empty++;
            return result;
        }
        previousDistance = result.distance();
        if (result.distance() > profile.distanceLimit()) {
            beyondLimit++;
            return NearestResult.empty(result.cycles());
        }
        return result;
    }

    public void logSummary() {
        var stats = statistics();
        log.info("Located {} queries: {} without eligible point, {} beyond distance limit, {} average cycles",
                 stats.queries(), stats.empty(), stats.beyondLimit(), String.format("%.2f", stats.averageCycles()));
        if (profile.verify()) {
            log.info("There were {} queries where the linear scan disagreed with the {} search", stats.mismatches(),
                     profile.function());
        }
    }

    public SearchProfile profile() {
        return profile;
    }

    public LocatorStatistics statistics() {
        return new LocatorStatistics(queries, empty, beyondLimit, cycles, mismatches);
    }

    double initialRadius() {
        return switch (profile.radiusPolicy()) {
            case FIXED -> profile.initialRadius();
            case CARRY_OVER -> profile.initialRadius() + previousDistance;
        };
    }

    private void verify(double[] target, Extent extent, NearestResult result) {
        var reference = BruteForceSearch.findNear(tree.points(), extent, target, participating);
        if (!reference.sameAnswer(result)) {
            mismatches++;
            log.warn("Linear scan disagrees with {} search at {}: expected {} got {}", profile.function(),
                     Arrays.toString(target), reference, result);
        }
    }
}
