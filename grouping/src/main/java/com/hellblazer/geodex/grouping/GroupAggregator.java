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

import com.hellblazer.geodex.common.IndexException.CapacityExceededException;
import com.hellblazer.geodex.common.IndexException.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Folds a stream of records into one payload per distinct key, e.g. summing traces into a stack per cdp, or
 * cataloguing unique source locations.
 * <p>
 * The caller supplies how to extract the raw key fields from a record, how to start a payload from the first record of
 * a group, and how to merge each later record into the payload.
 *
 * @param <R> record type
 * @param <P> payload type
 * @author hal.hildebrand
 */
public class GroupAggregator<R, P> {
    private static final Logger log = LoggerFactory.getLogger(GroupAggregator.class);

    private final GroupIndex<P>                                        index;
    private final BiFunction<? super GroupKey, ? super R, ? extends P> initializer;
    private final Function<? super R, double[]>                        keyExtractor;
    private final BiFunction<P, ? super R, P>                          merger;

    private long records;

    /**
     * @param index        the index holding the groups
     * @param keyExtractor raw key fields of a record, canonicalized by the index's quantizer
     * @param initializer  payload of a new group from its key and first record
     * @param merger       payload after merging a further record
     */
    public GroupAggregator(GroupIndex<P> index, Function<? super R, double[]> keyExtractor,
                           BiFunction<? super GroupKey, ? super R, ? extends P> initializer,
                           BiFunction<P, ? super R, P> merger) {
        if (index == null || keyExtractor == null || initializer == null || merger == null) {
            throw new ConfigurationException("Index, key extractor, initializer and merger are required");
        }
        this.index = index;
        this.keyExtractor = keyExtractor;
        this.initializer = initializer;
        this.merger = merger;
    }

    /**
     * Fold one record into its group.
     *
     * @return the group's position and whether it was created
     * @throws CapacityExceededException if the record starts a group beyond the index capacity
     */
    public GroupIndex.Slot accept(R record) {
        records++;
        var key = index.keyOf(keyExtractor.apply(record));
        try {
            return index.findOrCreate(key, k -> initializer.apply(k, record), p -> merger.apply(p, record));
        } catch (CapacityExceededException e) {
            log.error("At input record {} number of distinct keys is greater than capacity {}", records,
                      index.capacity());
            throw e;
        }
    }

    public void acceptAll(Iterable<? extends R> input) {
        for (R record : input) {
            accept(record);
        }
    }

    /**
     * @return the groups in ascending key order
     */
    public List<GroupIndex.Group<P>> groups() {
        return index.groups();
    }

    public GroupIndex<P> index() {
        return index;
    }

    public void logSummary() {
        log.info("Number of records input={}  Number of groups output={}", records, index.size());
    }

    public long recordCount() {
        return records;
    }
}
