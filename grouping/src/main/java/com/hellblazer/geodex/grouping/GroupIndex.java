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
import com.hellblazer.geodex.common.LexicographicComparator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Assigns one aggregate payload to each distinct composite key of a record stream.
 * <p>
 * Groups are held in strictly increasing lexicographic key order without duplicates. A new key is inserted at its
 * {@link #upperBound(GroupKey) upper bound}, shifting later groups up by one position, so positions are stable only
 * until the next insertion. Lookup is a binary search; insertion is linear in the number of groups, which stays cheap
 * because acquisition-ordered input mostly repeats the key it just saw.
 * <p>
 * Keys are compared exactly. Any tolerance must be expressed by the index's {@link KeyQuantizer}, applied by
 * {@link #keyOf(double...)}. An index with a quantizer other than {@link KeyQuantizer#exact()} only accepts keys made
 * by its own {@code keyOf}.
 * <p>
 * The index never grows beyond its declared capacity: inserting one key too many throws
 * {@link CapacityExceededException} instead of dropping the key. Not thread safe; guard it with a single lock or use
 * one index per input stream.
 *
 * @param <P> the aggregate payload type
 * @author hal.hildebrand
 */
public class GroupIndex<P> implements Iterable<GroupIndex.Group<P>> {

    /**
     * A group: its key and current payload
     */
    public static final class Group<P> {
        private final GroupKey key;
        private       P        payload;

        private Group(GroupKey key, P payload) {
            this.key = key;
            this.payload = payload;
        }

        public GroupKey key() {
            return key;
        }

        public P payload() {
            return payload;
        }

        @Override
        public String toString() {
            return key + "=" + payload;
        }
    }

    /**
     * Where {@link #findOrCreate} left the key
     *
     * @param index   position of the group
     * @param created true if the key was new
     */
    public record Slot(int index, boolean created) {
    }

    private final int                     arity;
    private final int                     capacity;
    private final LexicographicComparator comparator;
    private final List<Group<P>>          groups;
    private final KeyQuantizer            quantizer;

    public GroupIndex(int arity, int capacity) {
        this(arity, capacity, KeyQuantizer.exact());
    }

    /**
     * @param arity     number of fields in every key
     * @param capacity  maximum number of distinct keys
     * @param quantizer canonicalization applied by {@link #keyOf(double...)}
     */
    public GroupIndex(int arity, int capacity, KeyQuantizer quantizer) {
        if (capacity <= 0) {
            throw new ConfigurationException("Group capacity must be positive: " + capacity);
        }
        if (quantizer == null) {
            throw new ConfigurationException("Key quantizer must not be null");
        }
        this.comparator = new LexicographicComparator(arity);
        this.arity = arity;
        this.capacity = capacity;
        this.quantizer = quantizer;
        this.groups = new ArrayList<>(Math.min(capacity, 1024));
    }

    public int arity() {
        return arity;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Find the group of the key, creating it if the key is new.
     *
     * @param key         the canonical key
     * @param initializer creates the payload of a new group
     * @param merge       updates the payload of an existing group
     * @return the group's position and whether it was created
     * @throws CapacityExceededException if the key is new and the index is full
     * @throws ConfigurationException    if the key has the wrong arity or skipped this index's quantizer
     */
    public Slot findOrCreate(GroupKey key, Function<? super GroupKey, ? extends P> initializer,
                             UnaryOperator<P> merge) {
        var idx = upperBound(key);
        if (idx > 0 && comparator.equal(key.fields(), groups.get(idx - 1).key.fields())) {
            var existing = groups.get(idx - 1);
            existing.payload = merge.apply(existing.payload);
            return new Slot(idx - 1, false);
        }
        if (groups.size() >= capacity) {
            throw new CapacityExceededException(capacity, key.values());
        }
        groups.add(idx, new Group<>(key, initializer.apply(key)));
        return new Slot(idx, true);
    }

    /**
     * Find the group of the key, creating it without touching an existing payload
     */
    public Slot findOrCreate(GroupKey key, Function<? super GroupKey, ? extends P> initializer) {
        return findOrCreate(key, initializer, UnaryOperator.identity());
    }

    public Group<P> get(int index) {
        return groups.get(index);
    }

    /**
     * @return an unmodifiable view of the groups in ascending key order
     */
    public List<Group<P>> groups() {
        return Collections.unmodifiableList(groups);
    }

    /**
     * @return the position of the group with exactly this key, or -1
     */
    public int indexOf(GroupKey key) {
        var idx = upperBound(key);
        return idx > 0 && comparator.equal(key.fields(), groups.get(idx - 1).key.fields()) ? idx - 1 : -1;
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    @Override
    public Iterator<Group<P>> iterator() {
        return groups().iterator();
    }

    public GroupKey keyAt(int index) {
        return groups.get(index).key;
    }

    /**
     * Canonicalize raw fields into a key of this index.
     *
     * @throws ConfigurationException if the field count does not match the index arity
     */
    public GroupKey keyOf(double... values) {
        if (values == null || values.length != arity) {
            throw new ConfigurationException(
            String.format("Key must have %d fields, got %s", arity, values == null ? "null" : values.length));
        }
        return GroupKey.canonical(quantizer.quantize(values), quantizer);
    }

    public P payloadAt(int index) {
        return groups.get(index).payload;
    }

    public void setPayload(int index, P payload) {
        groups.get(index).payload = payload;
    }

    public int size() {
        return groups.size();
    }

    public Stream<Group<P>> stream() {
        return groups().stream();
    }

    @Override
    public String toString() {
        return "GroupIndex[arity=" + arity + ", groups=" + groups.size() + ", capacity=" + capacity + "]";
    }

    /**
     * Binary search for the first group whose key is strictly greater than the key.
     *
     * @return the insertion position of the key; one past the key's position if present
     */
    public int upperBound(GroupKey key) {
        requireKey(key);
        int low = 0;
        int high = groups.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (comparator.compare(key.fields(), groups.get(mid).key.fields()) >= 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private void requireKey(GroupKey key) {
        if (key == null || key.arity() != arity) {
            throw new ConfigurationException(
            String.format("Key must have %d fields, got %s", arity, key == null ? "null" : key.arity()));
        }
        if (quantizer != KeyQuantizer.EXACT && key.quantizer() != quantizer) {
            throw new ConfigurationException("Key " + key + " was not canonicalized by this index, use keyOf");
        }
    }
}
