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

/**
 * Outcome of a nearest point search.
 * <p>
 * When several points are equally near, {@code found} counts them and {@code element} is the largest of their element
 * ids. A {@code found} of zero means no point satisfied the search extent; callers must branch on {@link #isEmpty()}.
 *
 * @param element         element id of the nearest point, -1 if none was found
 * @param squaredDistance squared distance over the participating dimensions, +inf if none was found
 * @param found           number of points at that distance
 * @param cycles          number of search passes used, informational only
 * @author hal.hildebrand
 */
public record NearestResult(int element, double squaredDistance, int found, int cycles) {

    public static NearestResult empty(int cycles) {
        return new NearestResult(-1, Double.POSITIVE_INFINITY, 0, cycles);
    }

    public double distance() {
        return Math.sqrt(squaredDistance);
    }

    public boolean isEmpty() {
        return found == 0;
    }

    /**
     * @return true if both results name the same point at the same distance with the same tie count
     */
    public boolean sameAnswer(NearestResult other) {
        return element == other.element && found == other.found
        && Double.compare(squaredDistance, other.squaredDistance) == 0;
    }

    NearestResult withCycles(int cycles) {
        return new NearestResult(element, squaredDistance, found, cycles);
    }
}
