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
import com.hellblazer.geodex.common.IntArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class RangeSearchTest {

    private KdTree square;

    @BeforeEach
    void setUp() {
        square = KdTree.build(PointFixtures.square());
    }

    @Test
    void testSquareScenario() {
        var found = RangeSearch.findIn(square, Extent.of(new double[] { 0, 0 }, new double[] { 6, 6 }));
        assertArrayEquals(new int[] { 0, 4 }, sorted(found));
    }

    @Test
    void testUpperBoundExclusive() {
        var found = RangeSearch.findIn(square, Extent.of(new double[] { 0, 0 }, new double[] { 10, 10 }));
        assertArrayEquals(new int[] { 0, 4 }, sorted(found));
        found = RangeSearch.findIn(square, Extent.of(new double[] { 10, 10 }, new double[] { 11, 11 }));
        assertArrayEquals(new int[] { 3 }, sorted(found));
    }

    @Test
    void testUnboundedReturnsAll() {
        var found = RangeSearch.findIn(square, Extent.unbounded(2));
        assertArrayEquals(new int[] { 0, 1, 2, 3, 4 }, sorted(found));
    }

    @Test
    void testEmptyResults() {
        assertTrue(RangeSearch.findIn(square, Extent.of(new double[] { 1, 1 }, new double[] { 4, 4 })).isEmpty());
        assertTrue(RangeSearch.findIn(square, Extent.of(new double[] { 6, 6 }, new double[] { 0, 0 })).isEmpty());
        var empty = KdTree.build(ColumnPointSet.of(new double[0], new double[0]));
        assertTrue(RangeSearch.findIn(empty, Extent.unbounded(2)).isEmpty());
    }

    @Test
    void testDegenerateTrees() {
        var n = 20_000;
        var coincident = KdTree.build(ColumnPointSet.of(new double[n], new double[n]));
        assertEquals(n, coincident.height());
        var unitBox = Extent.of(new double[] { 0, 0 }, new double[] { 1, 1 });
        assertEquals(n, RangeSearch.findIn(coincident, unitBox).size());
        assertTrue(RangeSearch.findIn(coincident, Extent.of(new double[] { 0, 1 }, new double[] { 1, 2 })).isEmpty());

        var xs = new double[n];
        for (int i = 0; i < n; i++) {
            xs[i] = i;
        }
        var chain = KdTree.build(ColumnPointSet.of(xs), KdTree.InsertionOrder.SEQUENTIAL);
        assertEquals(n, chain.height());
        var found = RangeSearch.findIn(chain, Extent.of(new double[] { n - 10.5 }, new double[] { n }));
        assertArrayEquals(new int[] { n - 10, n - 9, n - 8, n - 7, n - 6, n - 5, n - 4, n - 3, n - 2, n - 1 },
                          sorted(found));
    }

    @Test
    void testDimensionMismatch() {
        assertThrows(ConfigurationException.class, () -> RangeSearch.findIn(square, Extent.unbounded(3)));
    }

    @ParameterizedTest
    @ValueSource(longs = { 3, 99, 12345 })
    void testMatchesLinearScan(long seed) {
        var random = new Random(seed);
        for (var points : new ColumnPointSet[] { PointFixtures.random(random, 2, 3000, 100.0),
                                                 PointFixtures.random(random, 4, 1000, 100.0),
                                                 PointFixtures.lattice(random, 3, 2000, 10) }) {
            var tree = KdTree.build(points);
            for (int q = 0; q < 50; q++) {
                var min = new double[points.dimensions()];
                var max = new double[points.dimensions()];
                for (int d = 0; d < min.length; d++) {
                    var a = random.nextDouble() * 110.0 - 5.0;
                    var b = random.nextDouble() * 110.0 - 5.0;
                    if (random.nextInt(4) == 0) {
                        // bounds on lattice values exercise the half open edges
                        a = random.nextInt(12) - 1;
                        b = a + random.nextInt(4);
                    }
                    min[d] = Math.min(a, b);
                    max[d] = Math.max(a, b);
                }
                var extent = Extent.of(min, max);
                assertArrayEquals(sorted(BruteForceSearch.findIn(points, extent)),
                                  sorted(RangeSearch.findIn(tree, extent)), extent.toString());
            }
        }
    }

    static int[] sorted(IntArrayList list) {
        var elements = list.toArray();
        Arrays.sort(elements);
        return elements;
    }
}
