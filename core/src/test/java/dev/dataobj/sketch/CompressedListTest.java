/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.sketch;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompressedListTest {

    @Test
    void testKeysAreUnsignedAscending() throws Exception {
        CompressedList list = new CompressedList();
        int[] keys = { 0, 1, 300, 70_000, Integer.MAX_VALUE, Integer.MIN_VALUE, -1 };
        for (int key : keys) {
            list.append(key);
        }
        assertThat(list.size()).isEqualTo(keys.length);
        assertThat(toList(list)).containsExactly(0, 1, 300, 70_000, Integer.MAX_VALUE, Integer.MIN_VALUE, -1);

        byte[] out = new byte[list.serializedSize()];
        assertThat(list.writeTo(out, 0)).isEqualTo(out.length);
        assertThat(toList(CompressedList.readFrom(out, 0))).isEqualTo(toList(list));
    }

    @Test
    void testAppendOutOfOrder() {
        CompressedList list = new CompressedList();
        list.append(-1);

        assertThatThrownBy(() -> list.append(5)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> list.append(-1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testCopyIsIndependent() {
        CompressedList list = new CompressedList();
        list.append(10);
        CompressedList copy = list.copy();
        copy.append(20);

        assertThat(toList(list)).containsExactly(10);
        assertThat(toList(copy)).containsExactly(10, 20);
    }

    @Test
    void testInconsistentHeader() {
        CompressedList list = new CompressedList();
        list.append(10);
        list.append(20);
        byte[] out = new byte[list.serializedSize()];
        list.writeTo(out, 0);

        byte[] wrongCount = out.clone();
        CompressedList.putInt(wrongCount, 0, 3);
        assertThatThrownBy(() -> CompressedList.readFrom(wrongCount, 0)).isInstanceOf(IOException.class);

        byte[] wrongLast = out.clone();
        CompressedList.putInt(wrongLast, 4, 21);
        assertThatThrownBy(() -> CompressedList.readFrom(wrongLast, 0)).isInstanceOf(IOException.class);

        byte[] wrongLength = out.clone();
        CompressedList.putInt(wrongLength, 8, 99);
        assertThatThrownBy(() -> CompressedList.readFrom(wrongLength, 0)).isInstanceOf(SketchTooShortException.class);
    }

    private static List<Integer> toList(CompressedList list) {
        List<Integer> keys = new ArrayList<>();
        for (CompressedList.Iterator it = list.iterator(); it.hasNext();) {
            keys.add(it.next());
        }
        return keys;
    }
}
