/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.topologicaloutlier.store;

import static com.amazon.topologicaloutlier.CommonUtils.checkArgument;
import static com.amazon.topologicaloutlier.CommonUtils.checkNotNull;
import static com.amazon.topologicaloutlier.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * A write-once store of the per-item representations used in pairwise
 * comparisons (posterior snapshots, per-series diagrams). Each slot is filled
 * at most once, possibly from a worker thread, during the population phase;
 * after {@link #seal()} the store is read-only and only the filled slots are
 * visible, in their original order.
 *
 * @param <R> type of the representation
 */
public class RepresentationStore<R> {

    private final String[] keys;
    private final AtomicReferenceArray<R> slots;
    private List<Integer> filled;

    public RepresentationStore(List<String> keys) {
        checkNotNull(keys, "keys must not be null");
        this.keys = keys.toArray(new String[0]);
        this.slots = new AtomicReferenceArray<>(this.keys.length);
    }

    /**
     * number of slots, filled or not
     *
     * @return the capacity
     */
    public int capacity() {
        return keys.length;
    }

    public String getKey(int slot) {
        return keys[slot];
    }

    /**
     * Publishes the representation of one item.
     *
     * @param slot           the item
     * @param representation its representation
     * @throws IllegalStateException if the store is sealed or the slot is taken
     */
    public void put(int slot, R representation) {
        checkNotNull(representation, "representation must not be null");
        checkState(filled == null, "store is sealed");
        checkArgument(slot >= 0 && slot < keys.length, "slot out of range");
        checkState(slots.compareAndSet(slot, null, representation), "representation of " + keys[slot]
                + " was already stored");
    }

    public boolean isFilled(int slot) {
        return slots.get(slot) != null;
    }

    /**
     * Ends the population phase.
     */
    public void seal() {
        checkState(filled == null, "store is already sealed");
        List<Integer> list = new ArrayList<>();
        for (int i = 0; i < keys.length; i++) {
            if (slots.get(i) != null) {
                list.add(i);
            }
        }
        filled = Collections.unmodifiableList(list);
    }

    public boolean isSealed() {
        return filled != null;
    }

    /**
     * @return the number of stored representations
     */
    public int size() {
        checkState(filled != null, "store is not sealed");
        return filled.size();
    }

    /**
     * @param index position among the stored representations
     * @return the representation
     */
    public R get(int index) {
        checkState(filled != null, "store is not sealed");
        return slots.get(filled.get(index));
    }

    /**
     * @param index position among the stored representations
     * @return the key of the representation
     */
    public String getStoredKey(int index) {
        checkState(filled != null, "store is not sealed");
        return keys[filled.get(index)];
    }

    /**
     * @return keys of the slots that were never filled, in original order
     */
    public List<String> getMissingKeys() {
        checkState(filled != null, "store is not sealed");
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < keys.length; i++) {
            if (slots.get(i) == null) {
                missing.add(keys[i]);
            }
        }
        return missing;
    }
}
