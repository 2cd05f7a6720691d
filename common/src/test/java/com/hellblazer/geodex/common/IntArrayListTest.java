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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class IntArrayListTest {

    @Test
    void testGrowsPastInitialCapacity() {
        var list = new IntArrayList(2);
        for (int i = 0; i < 100; i++) {
            list.addInt(99 - i);
        }
        assertEquals(100, list.size());
        assertEquals(99, list.getInt(0));
        assertTrue(list.contains(42));
        assertEquals(57, list.indexOf(42));
        list.sort();
        assertEquals(0, list.getInt(0));
        assertEquals(4950, list.stream().sum());
    }

    @Test
    void testEqualityAndClear() {
        var a = new IntArrayList();
        var b = new IntArrayList(1);
        a.addInt(4);
        a.addInt(0);
        b.addInt(4);
        b.addInt(0);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertArrayEquals(new int[] { 4, 0 }, a.toArray());
        assertEquals("[4, 0]", a.toString());
        a.clear();
        assertTrue(a.isEmpty());
        assertNotEquals(a, b);
        assertEquals(-1, a.indexOf(4));
    }

    @Test
    void testIndexOutOfRange() {
        var list = new IntArrayList();
        list.addInt(1);
        assertThrows(IndexOutOfBoundsException.class, () -> list.getInt(1));
        assertThrows(IndexOutOfBoundsException.class, () -> list.getInt(-1));
        assertThrows(IllegalArgumentException.class, () -> new IntArrayList(-1));
    }
}
