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

import com.hellblazer.geodex.common.ColumnPointSet;
import com.hellblazer.geodex.common.Extent;
import com.hellblazer.geodex.common.IndexException.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class NearestSearchTest {

    private static final boolean[] BOTH = { true, true };

    private KdTree square;

    @BeforeEach
    void setUp() {
        square = KdTree.build(PointFixtures.square());
    }

    @Test
    void testSquareScenario() {
        var result = NearestSearch.findNear(square, new double[] { 4, 4 });
        assertEquals(4, result.element());
        assertEquals(2.0, result.squaredDistance());
        assertEquals(1, result.found());
        assertFalse(result.isEmpty());
    }

    @Test
    void testTiesReportLargestElement() {
        // (0,0), (10,0) and (5,5) are all 25 away from (5,0)
        var result = NearestSearch.findNear(square, new double[] { 5, 0 });
        assertEquals(4, result.element());
        assertEquals(25.0, result.squaredDistance());
        assertEquals(3, result.found());

        var corners = NearestSearch.findNear(square, new double[] { 5, 5.5 });
        assertEquals(4, corners.element());
        assertEquals(1, corners.found());
    }

    @Test
    void testNonParticipatingDimensionIgnored() {
        var result = NearestSearch.findNear(square, Extent.unbounded(2), new double[] { 4, 100 },
                                            new boolean[] { true, false });
        assertEquals(4, result.element());
        assertEquals(1.0, result.squaredDistance());
    }

    @Test
    void testExtentFilters() {
        var bottomRow = Extent.of(new double[] { Double.NEGATIVE_INFINITY, 0 },
                                  new double[] { Double.POSITIVE_INFINITY, 1 });
        var result = NearestSearch.findNear(square, bottomRow, new double[] { 9, 20 }, new boolean[] { true, false });
        assertEquals(1, result.element());
        assertEquals(1.0, result.squaredDistance());

        var nothing = Extent.of(new double[] { 1, 1 }, new double[] { 4, 4 });
        var empty = NearestSearch.findNear(square, nothing, new double[] { 2, 2 }, BOTH);
        assertTrue(empty.isEmpty());
        assertEquals(-1, empty.element());
        assertEquals(Double.POSITIVE_INFINITY, empty.squaredDistance());
    }

    @Test
    void testCoincidentPoints() {
        var n = 20_000;
        var tree = KdTree.build(ColumnPointSet.of(new double[n], new double[n]));
        var result = NearestSearch.findNear(tree, new double[] { 3, 4 });
        assertEquals(n - 1, result.element());
        assertEquals(n, result.found());
        assertEquals(25.0, result.squaredDistance());
    }

    @Test
    void testEmptyTree() {
        var tree = KdTree.build(ColumnPointSet.of(new double[0], new double[0]));
        assertTrue(NearestSearch.findNear(tree, new double[] { 0, 0 }).isEmpty());
    }

    @Test
    void testTargetValidation() {
        assertThrows(ConfigurationException.class, () -> NearestSearch.findNear(square, new double[] { 1 }));
        assertThrows(ConfigurationException.class,
                     () -> NearestSearch.findNear(square, new double[] { 1, Double.NaN }));
        assertThrows(ConfigurationException.class,
                     () -> NearestSearch.findNear(square, Extent.unbounded(2), new double[] { 1, 1 },
                                                  new boolean[] { true }));
        assertThrows(ConfigurationException.class,
                     () -> NearestSearch.findNear(square, Extent.unbounded(3), new double[] { 1, 1 }, BOTH));
    }

    @ParameterizedTest
    @ValueSource(longs = { 5, 77, 2024 })
    void testMatchesLinearScan(long seed) {
        var random = new Random(seed);
        var points = PointFixtures.random(random, 3, 2000, 100.0);
        var tree = KdTree.build(points);
        for (int q = 0; q < 200; q++) {
            var target = new double[] { random.nextDouble() * 120 - 10, random.nextDouble() * 120 - 10,
                                        random.nextDouble() * 120 - 10 };
            var participating = new boolean[] { true, random.nextBoolean(), true };
            var lo = random.nextDouble() * 100;
            var extent = Extent.of(new double[] { Double.NEGATIVE_INFINITY, lo, Double.NEGATIVE_INFINITY },
                                   new double[] { Double.POSITIVE_INFINITY, lo + 20, Double.POSITIVE_INFINITY });
            var expected = BruteForceSearch.findNear(points, extent, target, participating);
            var actual = NearestSearch.findNear(tree, extent, target, participating);
            assertTrue(expected.sameAnswer(actual), expected + " != " + actual);
        }
    }

    @Test
    void testLatticeTiesMatchLinearScan() {
        var random = new Random(11);
        var points = PointFixtures.lattice(random, 2, 500, 15);
        var tree = KdTree.build(points);
        var everywhere = Extent.unbounded(2);
        for (int q = 0; q < 200; q++) {
            var target = new double[] { random.nextInt(17) - 1, random.nextInt(17) - 1 };
            var expected = BruteForceSearch.findNear(points, everywhere, target, BOTH);
            var actual = NearestSearch.findNear(tree, everywhere, target, BOTH);
            assertEquals(expected.element(), actual.element());
            assertEquals(expected.found(), actual.found());
            assertEquals(expected.squaredDistance(), actual.squaredDistance());
        }
    }
}
