/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.sketch;

import java.util.Arrays;
import java.util.function.IntConsumer;

/**
 * Open-addressing hash set of sparse keys, used to buffer insertions before they are merged
 * into a {@link CompressedList}.
 * <p>
 * Slots use 0 as the empty marker; the key 0 itself is tracked separately.
 * </p>
 */
final class SparseSet {

    private static final int MIN_CAPACITY = 16;

    private int[] slots;
    private int mask;
    private int size;
    private boolean containsZero;

    SparseSet() {
        this(MIN_CAPACITY);
    }

    SparseSet(int expectedSize) {
        int capacity = MIN_CAPACITY;
        while (capacity * 3 / 4 < expectedSize) {
            capacity <<= 1;
        }
        this.slots = new int[capacity];
        this.mask = capacity - 1;
    }

    private SparseSet(SparseSet other) {
        this.slots = other.slots.clone();
        this.mask = other.mask;
        this.size = other.size;
        this.containsZero = other.containsZero;
    }

    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    /**
     * Adds a key.
     *
     * @return true if the key was not present before
     */
    boolean add(int key) {
        if (key == 0) {
            if (containsZero) {
                return false;
            }
            containsZero = true;
            size++;
            return true;
        }

        int slot = mix(key) & mask;
        while (slots[slot] != 0) {
            if (slots[slot] == key) {
                return false;
            }
            slot = (slot + 1) & mask;
        }
        slots[slot] = key;
        size++;
        if (size * 4 > slots.length * 3) {
            grow();
        }
        return true;
    }

    void addAll(SparseSet other) {
        other.forEach(this::add);
    }

    void forEach(IntConsumer action) {
        if (containsZero) {
            action.accept(0);
        }
        for (int key : slots) {
            if (key != 0) {
                action.accept(key);
            }
        }
    }

    /**
     * Returns the keys sorted as unsigned integers.
     */
    int[] toSortedArray() {
        int[] keys = new int[size];
        int[] index = {0};
        forEach(key -> keys[index[0]++] = key ^ Integer.MIN_VALUE);
        Arrays.sort(keys);
        for (int i = 0; i < keys.length; i++) {
            keys[i] ^= Integer.MIN_VALUE;
        }
        return keys;
    }

    SparseSet copy() {
        return new SparseSet(this);
    }

    private void grow() {
        int[] old = slots;
        slots = new int[old.length * 2];
        mask = slots.length - 1;
        for (int key : old) {
            if (key != 0) {
                int slot = mix(key) & mask;
                while (slots[slot] != 0) {
                    slot = (slot + 1) & mask;
                }
                slots[slot] = key;
            }
        }
    }

    private static int mix(int key) {
        int h = key * 0x9E3779B9;
        return h ^ (h >>> 16);
    }
}
