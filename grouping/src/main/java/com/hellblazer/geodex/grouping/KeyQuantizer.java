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

/**
 * Canonicalizes raw key fields before they are compared exactly by a {@link GroupIndex}. Every key of an index passes
 * through the same quantizer, so records meant to share a group produce bitwise identical keys.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface KeyQuantizer {

    /**
     * Fields are used unchanged
     */
    KeyQuantizer EXACT = values -> values.clone();

    static KeyQuantizer exact() {
        return EXACT;
    }

    /**
     * {@code floor(value / divisor)} per field, e.g. to bin cdp numbers into super cdps
     *
     * @param divisors one positive divisor per field
     */
    static KeyQuantizer flooring(double... divisors) {
        var copy = positive(divisors, "divisor");
        return values -> {
            requireArity(values, copy.length);
            var quantized = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                quantized[i] = Math.floor(values[i] / copy[i]);
            }
            return quantized;
        };
    }

    /**
     * Round each field to the nearest multiple of its step
     *
     * @param steps one positive step per field
     */
    static KeyQuantizer rounding(double... steps) {
        var copy = positive(steps, "step");
        return values -> {
            requireArity(values, copy.length);
            var quantized = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                quantized[i] = Math.rint(values[i] / copy[i]) * copy[i];
            }
            return quantized;
        };
    }

    private static double[] positive(double[] factors, String name) {
        if (factors == null || factors.length == 0) {
            throw new ConfigurationException("At least 1 " + name + " must be specified");
        }
        for (int i = 0; i < factors.length; i++) {
            if (!(factors[i] > 0.0) || Double.isInfinite(factors[i])) {
                throw new ConfigurationException(
                String.format("Quantizing %s %d must be positive and finite: %s", name, i, factors[i]));
            }
        }
        return factors.clone();
    }

    private static void requireArity(double[] values, int arity) {
        if (values.length != arity) {
            throw new ConfigurationException(
            String.format("Key has %d fields, quantizer expects %d", values.length, arity));
        }
    }

    /**
     * @param values raw key fields, not modified
     * @return canonical key fields
     */
    double[] quantize(double[] values);
}
