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

import java.util.Comparator;

/**
 * Lexicographic ordering of fixed-length coordinate tuples. The number of fields compared is part of the comparator,
 * so differently shaped keys each get their own instance.
 * <p>
 * Fields are compared with the primitive {@code <} and {@code >} operators; the first differing field decides.
 * Equality is therefore exact, with no tolerance.
 *
 * @author hal.hildebrand
 */
public final class LexicographicComparator implements Comparator<double[]> {

    private final int arity;

    public LexicographicComparator(int arity) {
        if (arity <= 0) {
            throw new ConfigurationException("Key arity must be positive: " + arity);
        }
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }

    @Override
    public int compare(double[] a, double[] b) {
        for (int i = 0; i < arity; i++) {
            if (a[i] < b[i]) {
                return -1;
            }
            if (a[i] > b[i]) {
                return 1;
            }
        }
        return 0;
    }

    public boolean equal(double[] a, double[] b) {
        return compare(a, b) == 0;
    }
}
