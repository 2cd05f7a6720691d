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

import com.hellblazer.geodex.common.ColumnPointSet;
import com.hellblazer.geodex.common.IndexException.ConfigurationException;
import com.hellblazer.geodex.kdtree.KdTree;
import com.hellblazer.geodex.kdtree.PointFixtures;
import com.hellblazer.geodex.kdtree.locator.SearchProfile.RadiusPolicy;
import com.hellblazer.geodex.kdtree.locator.SearchProfile.SearchFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class NearestLocatorTest {

    private KdTree square;

    @BeforeEach
    void setUp() {
        square = KdTree.build(PointFixtures.square());
    }

    @ParameterizedTest
    @EnumSource(SearchFunction.class)
    void testEverySearchFunctionAgrees(SearchFunction function) {
        var locator = NearestLocator.of(square, SearchProfile.defaults()
                                                             .withFunction(function)
                                                             .withRadius(RadiusPolicy.FIXED, 1.0));
        var result = locator.locate(new double[] { 4, 4 });
        assertEquals(4, result.element());
        assertEquals(2.0, result.squaredDistance());
        assertEquals(1, locator.statistics().queries());
    }

    @Test
    void testCarryOverRadius() {
        var profile = SearchProfile.defaults().withRadius(RadiusPolicy.CARRY_OVER, 1.0);
        var locator = NearestLocator.of(square, profile);
        assertEquals(1.0, locator.initialRadius());
        locator.locate(new double[] { 4, 4 });
        assertEquals(1.0 + Math.sqrt(2.0), locator.initialRadius(), 1e-12);
        locator.locate(new double[] { 10, 10 });
        assertEquals(1.0, locator.initialRadius());
    }

    @Test
    void testFixedRadius() {
        var locator = NearestLocator.of(square, SearchProfile.defaults().withRadius(RadiusPolicy.FIXED, 3.0));
        locator.locate(new double[] { 4, 4 });
        assertEquals(3.0, locator.initialRadius());
    }

    @Test
    void testDistanceLimit() {
        var locator = NearestLocator.of(square, SearchProfile.defaults().withDistanceLimit(1.0));
        assertTrue(locator.profile().hasDistanceLimit());
        assertTrue(locator.locate(new double[] { 4, 4 }).isEmpty());
        var near = locator.locate(new double[] { 5, 5.5 });
        assertEquals(4, near.element());
        var stats = locator.statistics();
        assertEquals(2, stats.queries());
        assertEquals(1, stats.beyondLimit());
        assertEquals(0, stats.empty());
    }

    @Test
    void testRelativeFilter() {
        // x, y, and an offset that must lie within 5 of the target's
        var points = ColumnPointSet.fromRows(3, new double[] { 0, 0, 100 }, new double[] { 1, 1, 10 },
                                             new double[] { 8, 8, 12 });
        var tree = KdTree.build(points);
        var specs = List.of(DimensionSpec.distance(), DimensionSpec.distance(), DimensionSpec.relativeFilter(-5, 5));
        var locator = new NearestLocator(tree, SearchProfile.defaults().withRadius(RadiusPolicy.FIXED, 0.5), specs);

        var extent = locator.extentFor(new double[] { 0, 0, 11 });
        assertEquals(6.0, extent.min(2));
        assertEquals(16.0, extent.max(2));

        assertEquals(1, locator.locate(new double[] { 0, 0, 11 }).element());
        assertEquals(2, locator.locate(new double[] { 0, 0, 16.5 }).element());
        assertEquals(0, locator.locate(new double[] { 0, 0, 100 }).element());
        assertTrue(locator.locate(new double[] { 0, 0, 50 }).isEmpty());
        assertEquals(1, locator.statistics().empty());
    }

    @Test
    void testAbsoluteFilter() {
        var specs = List.of(DimensionSpec.distance(), DimensionSpec.filter(5, 11));
        var locator = new NearestLocator(square, SearchProfile.defaults(), specs);
        var result = locator.locate(new double[] { 1, 1 });
        assertEquals(4, result.element());
        assertEquals(32.0, result.squaredDistance());
    }

    @Test
    void testVerificationFindsNoMismatch() {
        var random = new Random(23);
        var tree = KdTree.build(PointFixtures.random(random, 2, 2000, 500.0));
        for (var function : SearchFunction.values()) {
            var locator = NearestLocator.of(tree, SearchProfile.defaults()
                                                               .withFunction(function)
                                                               .withRadius(RadiusPolicy.CARRY_OVER, 2.0)
                                                               .withVerification(true));
            var x = 0.0;
            for (int q = 0; q < 200; q++) {
                // walk along a line the way consecutive traces do
                x += random.nextDouble() * 5;
                locator.locate(new double[] { x, 250 + random.nextDouble() * 10 });
            }
            var stats = locator.statistics();
            assertEquals(200, stats.queries());
            assertEquals(0, stats.mismatches(), function.toString());
            assertTrue(stats.averageCycles() >= 1.0);
            locator.logSummary();
        }
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(ConfigurationException.class,
                     () -> new NearestLocator(square, SearchProfile.defaults(), List.of(DimensionSpec.distance())));
        assertThrows(ConfigurationException.class, () -> new NearestLocator(null, SearchProfile.defaults(), List.of()));
        var locator = NearestLocator.of(square, SearchProfile.defaults());
        assertThrows(ConfigurationException.class, () -> locator.locate(new double[] { 1, 2, 3 }));
        assertThrows(ConfigurationException.class, () -> DimensionSpec.filter(5, 5));
        assertThrows(ConfigurationException.class, () -> DimensionSpec.filter(Double.NaN, 5));
        assertThrows(ConfigurationException.class,
                     () -> new DimensionSpec(true, null, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY));
    }
}
