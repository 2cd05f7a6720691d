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

/**
 * Counters accumulated by a {@link NearestLocator}.
 *
 * @param queries     queries answered
 * @param empty       queries with no eligible point
 * @param beyondLimit queries whose nearest point was farther than the distance limit
 * @param cycles      total search passes
 * @param mismatches  verified queries whose answer differed from the linear scan
 * @author hal.hildebrand
 */
public record LocatorStatistics(long queries, long empty, long beyondLimit, long cycles, long mismatches) {

    public double averageCycles() {
        return queries == 0 ? 0.0 : (double) cycles / queries;
    }
}
