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

import java.util.Arrays;

/**
 * Sealed exception hierarchy for the spatial and grouping indices.
 * <p>
 * Both permitted types are fatal for the run that raised them:
 * <ul>
 * <li>{@link ConfigurationException} - invalid construction or query parameters, detected before any search runs</li>
 * <li>{@link CapacityExceededException} - a grouping index was asked to hold more distinct keys than declared</li>
 * </ul>
 * An empty search result is not an exception; searches report it through their result objects.
 *
 * @author hal.hildebrand
 */
public sealed class IndexException extends RuntimeException
    permits IndexException.ConfigurationException, IndexException.CapacityExceededException {

    /**
     * Constructs a new index exception with the specified detail message.
     *
     * @param message the detail message
     */
    public IndexException(String message) {
        super(message);
    }

    /**
     * Constructs a new index exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Invalid configuration.
     * <p>
     * Thrown for non-positive dimension counts, mismatched coordinate array lengths, growth multipliers that
     * cannot grow a search window, zero search radii and similar parameter errors.
     */
    public static final class ConfigurationException extends IndexException {

        /**
         * Constructs a new configuration exception with the specified detail message.
         *
         * @param message the detail message
         */
        public ConfigurationException(String message) {
            super(message);
        }

        /**
         * Constructs a new configuration exception with the specified detail message and cause.
         *
         * @param message the detail message
         * @param cause   the cause
         */
        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Capacity exceeded.
     * <p>
     * Thrown when inserting a new distinct key would grow an index past its declared maximum. Aggregation must
     * stop rather than silently drop the key.
     */
    public static final class CapacityExceededException extends IndexException {
        private final int      capacity;
        private final double[] key;

        /**
         * Constructs a new capacity exceeded exception.
         *
         * @param capacity the declared maximum number of distinct keys
         * @param key      the key that could not be inserted
         */
        public CapacityExceededException(int capacity, double[] key) {
            super(String.format("Number of distinct keys would exceed the declared capacity of %,d at key %s",
                                capacity, Arrays.toString(key)));
            this.capacity = capacity;
            this.key = key.clone();
        }

        /**
         * Gets the declared capacity.
         *
         * @return maximum number of distinct keys
         */
        public int getCapacity() {
            return capacity;
        }

        /**
         * Gets the key that was rejected.
         *
         * @return a copy of the rejected key values
         */
        public double[] getKey() {
            return key.clone();
        }
    }
}
