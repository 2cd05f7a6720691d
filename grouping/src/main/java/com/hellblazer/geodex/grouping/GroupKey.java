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
package com.hellblazer.geodex.grouping;

import com.hellblazer.geodex.common.IndexException.ConfigurationException;

import java.util.Arrays;

/**
 * An immutable composite key: an ordered tuple of doubles.
 * <p>
 * Keys are equal when every field is exactly equal. Negative zero is stored as zero and NaN is rejected, so equality,
 * hashing and lexicographic ordering always agree. A key remembers the {@link KeyQuantizer} that produced it, so an
 * index can refuse raw fields that skipped its canonicalization.
 *
 * @author hal.hildebrand
 */
public final class GroupKey {

    private final KeyQuantizer quantizer;
    private final double[]     values;

    private GroupKey(double[] values, KeyQuantizer quantizer) {
        this.values = values;
        this.quantizer = quantizer;
    }

    /**
     * @param values the key fields, copied
     * @throws ConfigurationException if there are no fields or a field is NaN
     */
    public static GroupKey of(double... values) {
        return canonical(values, null);
    }

    /**
     * A key whose fields were produced by the quantizer. The quantizer is not part of the key's value.
     */
    static GroupKey canonical(double[] values, KeyQuantizer quantizer) {
        if (values == null || values.length == 0) {
            throw new ConfigurationException("Group key must have at least 1 field");
        }
        var copy = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                throw new ConfigurationException("Group key field " + i + " is NaN");
            }
            copy[i] = values[i] == 0.0 ? 0.0 : values[i];
        }
        return new GroupKey(copy, quantizer);
    }

    public int arity() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof GroupKey other && Arrays.equals(values, other.values);
    }

    public double get(int field) {
        return values[field];
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }

    public double[] values() {
        return values.clone();
    }

    double[] fields() {
        return values;
    }

    /**
     * @return the quantizer that produced the fields, or null for a key built from raw fields
     */
    KeyQuantizer quantizer() {
        return quantizer;
    }
}
