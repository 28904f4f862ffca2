/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.sketch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import dev.dataobj.metadata.UnsupportedVersionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HyperLogLogTest {

    @ParameterizedTest
    @ValueSource(ints = { 0, 1, 7, 100, 1000 })
    void testExactAtLowCardinality(int n) {
        HyperLogLog sketch = HyperLogLog.create();
        for (int i = 1; i <= n; i++) {
            // Distinct 25-bit indices, inserted twice to check duplicates are ignored
            sketch.insertHash((long) i << 39);
            sketch.insertHash((long) i << 39);
        }

        assertThat(sketch.estimate()).isEqualTo(n);
        assertThat(sketch.isSparse()).isTrue();
    }

    @Test
    void testDistinctStrings() {
        HyperLogLog sketch = HyperLogLog.create();
        for (String s : new String[]{ "a", "b", "c", "b", "a" }) {
            sketch.insert(s.getBytes(StandardCharsets.UTF_8));
        }

        assertThat(sketch.estimate()).isEqualTo(3);
    }

    @Test
    void testPromotionToDense() {
        HyperLogLog sketch = HyperLogLog.create();
        for (int i = 0; i < 40_000; i++) {
            sketch.insert(bytes(i));
        }

        assertThat(sketch.isSparse()).isFalse();
        assertThat((double) sketch.estimate()).isCloseTo(40_000, within(40_000 * 0.05));
    }

    @Test
    void testDenseAccuracy() {
        HyperLogLog sketch = HyperLogLog.createDense();
        for (int i = 0; i < 100_000; i++) {
            sketch.insert(bytes(i));
        }

        assertThat(sketch.isSparse()).isFalse();
        assertThat((double) sketch.estimate()).isCloseTo(100_000, within(100_000 * 0.05));
    }

    @Test
    void testDenseAccuracyAtOtherPrecision() {
        HyperLogLog sketch = HyperLogLog.create(12, false);
        for (int i = 0; i < 100_000; i++) {
            sketch.insert(bytes(i));
        }

        assertThat((double) sketch.estimate()).isCloseTo(100_000, within(100_000 * 0.08));
    }

    @ParameterizedTest
    @CsvSource({ "12, 2.0", "14, 3.0", "16, 0.5", "16, 3.0", "18, 1.0" })
    void testDenseEstimateUsesBetaAtEveryPrecision(int precision, double registersFactor) {
        HyperLogLog sketch = HyperLogLog.create(precision, false);
        int m = 1 << precision;
        int n = (int) (m * registersFactor);
        for (int i = 0; i < n; i++) {
            sketch.insertHash(mix(i));
        }

        byte[] registers = Arrays.copyOfRange(sketch.toByteArray(), 8, 8 + m);
        double sum = 0;
        int zeros = 0;
        for (byte register : registers) {
            zeros += register == 0 ? 1 : 0;
            sum += Math.pow(2, -register);
        }
        assertThat(zeros).isPositive();
        long expected = Math.round(HyperLogLogMath.alpha(m) * m * (m - zeros)
                / (sum + HyperLogLogMath.beta(precision, zeros)));

        assertThat(sketch.estimate()).isEqualTo(expected);
        assertThat((double) sketch.estimate()).isCloseTo(n, within(n * 0.02));
    }

    @Test
    void testDenseAtLowCardinality() {
        HyperLogLog sketch = HyperLogLog.createDense();
        for (int i = 0; i < 100; i++) {
            sketch.insert(bytes(i));
        }

        assertThat((double) sketch.estimate()).isCloseTo(100, within(5.0));
    }

    @Test
    void testEmptySketches() {
        assertThat(HyperLogLog.create().estimate()).isZero();
        assertThat(HyperLogLog.createDense().estimate()).isZero();
        assertThat(HyperLogLog.create(8, false).estimate()).isZero();
    }

    @Test
    void testSparseMergeEqualsUnion() {
        HyperLogLog a = HyperLogLog.create();
        HyperLogLog b = HyperLogLog.create();
        HyperLogLog union = HyperLogLog.create();
        for (int i = 0; i < 1500; i++) {
            if (i < 1000) {
                a.insert(bytes(i));
            }
            if (i >= 500) {
                b.insert(bytes(i));
            }
            union.insert(bytes(i));
        }

        HyperLogLog ab = a.copy();
        ab.merge(b);
        HyperLogLog ba = b.copy();
        ba.merge(a);

        assertThat(ab.isSparse()).isTrue();
        assertThat(ab.estimate()).isEqualTo(union.estimate());
        assertThat(ba.estimate()).isEqualTo(union.estimate());
    }

    @Test
    void testSparseMergeIndependentOfInsertionOrder() {
        // Two ranks for the 25-bit index 2048, and an unflagged key sorting between them
        long lowRank = (2048L << 39) | (1L << 38);
        long highRank = (2048L << 39) | (1L << 37);
        long between = 131074L << 39;

        HyperLogLog a = HyperLogLog.create();
        a.insertHash(lowRank);
        a.insertHash(highRank);
        assertThat(a.estimate()).isEqualTo(1);
        HyperLogLog b = HyperLogLog.create();
        b.insertHash(between);
        HyperLogLog merged = a.copy();
        merged.merge(b);

        HyperLogLog direct = HyperLogLog.create();
        direct.insertHash(lowRank);
        direct.insertHash(between);
        direct.insertHash(highRank);

        HyperLogLog staged = HyperLogLog.create();
        staged.insertHash(highRank);
        staged.estimate();
        staged.insertHash(between);
        staged.estimate();
        staged.insertHash(lowRank);

        assertThat(merged.estimate()).isEqualTo(2);
        assertThat(direct.estimate()).isEqualTo(2);
        assertThat(staged.estimate()).isEqualTo(2);

        HyperLogLog dense = HyperLogLog.createDense();
        dense.insertHash(lowRank);
        dense.insertHash(highRank);
        dense.insertHash(between);
        HyperLogLog folded = HyperLogLog.createDense();
        folded.merge(merged);
        assertThat(folded.toByteArray()).isEqualTo(dense.toByteArray());
    }

    @Test
    void testMixedMergeEqualsDenseUnion() {
        HyperLogLog dense = HyperLogLog.createDense();
        HyperLogLog sparse = HyperLogLog.create();
        HyperLogLog union = HyperLogLog.createDense();
        for (int i = 0; i < 3000; i++) {
            if (i % 2 == 0) {
                dense.insert(bytes(i));
            }
            else {
                sparse.insert(bytes(i));
            }
            union.insert(bytes(i));
        }

        HyperLogLog sparseIntoDense = dense.copy();
        sparseIntoDense.merge(sparse);
        HyperLogLog denseIntoSparse = sparse.copy();
        denseIntoSparse.merge(dense);

        assertThat(denseIntoSparse.isSparse()).isFalse();
        assertThat(sparseIntoDense.toByteArray()).isEqualTo(union.toByteArray());
        assertThat(denseIntoSparse.toByteArray()).isEqualTo(union.toByteArray());
    }

    @Test
    void testMergeLeavesOtherUntouched() {
        HyperLogLog a = HyperLogLog.create();
        HyperLogLog b = HyperLogLog.create();
        a.insert(bytes(1));
        b.insert(bytes(2));
        b.insert(bytes(3));

        a.merge(b);
        a.merge(null);

        assertThat(a.estimate()).isEqualTo(3);
        assertThat(b.estimate()).isEqualTo(2);
    }

    @Test
    void testPrecisionMismatch() {
        HyperLogLog a = HyperLogLog.create();

        assertThatThrownBy(() -> a.merge(HyperLogLog.create16()))
                .isInstanceOf(PrecisionMismatchException.class)
                .hasMessageContaining("14")
                .hasMessageContaining("16");
    }

    @Test
    void testInvalidPrecision() {
        assertThatThrownBy(() -> HyperLogLog.create(3, true)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HyperLogLog.create(19, false)).isInstanceOf(IllegalArgumentException.class);
        assertThat(HyperLogLog.create16().precision()).isEqualTo(16);
    }

    @Test
    void testCopyIsIndependent() {
        HyperLogLog original = HyperLogLog.create();
        original.insert(bytes(1));
        HyperLogLog copy = original.copy();
        copy.insert(bytes(2));

        assertThat(original.estimate()).isEqualTo(1);
        assertThat(copy.estimate()).isEqualTo(2);

        HyperLogLog dense = HyperLogLog.createDense();
        HyperLogLog denseCopy = dense.copy();
        denseCopy.insert(bytes(1));
        assertThat(dense.estimate()).isZero();
        assertThat(denseCopy.estimate()).isEqualTo(1);
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 50, 500, 5000 })
    void testSparseSerialization(int n) throws Exception {
        HyperLogLog sketch = HyperLogLog.create();
        for (int i = 0; i < n; i++) {
            sketch.insert(bytes(i));
        }
        byte[] data = sketch.toByteArray();
        assertThat(data[0]).isEqualTo((byte) 2);
        assertThat(data[1]).isEqualTo((byte) 14);
        assertThat(data[3]).isEqualTo((byte) 1);

        HyperLogLog restored = HyperLogLog.fromByteArray(data);
        assertThat(restored.isSparse()).isTrue();
        assertThat(restored.precision()).isEqualTo(14);
        assertThat(restored.estimate()).isEqualTo(sketch.estimate());

        // The restored sketch keeps working after a round trip
        restored.insert(bytes(-1));
        sketch.insert(bytes(-1));
        assertThat(restored.estimate()).isEqualTo(sketch.estimate());
    }

    @Test
    void testDenseSerialization() throws Exception {
        HyperLogLog sketch = HyperLogLog.create(10, false);
        for (int i = 0; i < 5000; i++) {
            sketch.insert(bytes(i));
        }
        byte[] data = sketch.toByteArray();
        assertThat(data).hasSize(8 + 1024);

        HyperLogLog restored = HyperLogLog.fromByteArray(data);
        assertThat(restored.isSparse()).isFalse();
        assertThat(restored.precision()).isEqualTo(10);
        assertThat(restored.toByteArray()).isEqualTo(data);
        assertThat(restored.estimate()).isEqualTo(sketch.estimate());
    }

    @Test
    void testLegacyDenseFormat() throws Exception {
        // Version 1, precision 4, base 1: each byte packs two registers as nibbles offset by the base
        byte[] legacy = new byte[8 + 8];
        legacy[0] = 1;
        legacy[1] = 4;
        legacy[2] = 1;
        legacy[3] = 0;
        Arrays.fill(legacy, 8, 16, (byte) 0x12);

        HyperLogLog sketch = HyperLogLog.fromByteArray(legacy);
        assertThat(sketch.isSparse()).isFalse();
        assertThat(sketch.precision()).isEqualTo(4);

        byte[] expected = new byte[8 + 16];
        expected[0] = 2;
        expected[1] = 4;
        expected[7] = 16;
        for (int i = 0; i < 16; i++) {
            expected[8 + i] = (byte) (i % 2 == 0 ? 2 : 3);
        }
        assertThat(sketch.toByteArray()).isEqualTo(expected);
    }

    @Test
    void testLegacyDenseWithWrongRegisterCount() {
        byte[] legacy = new byte[8 + 5];
        legacy[0] = 1;
        legacy[1] = 4;

        assertThatThrownBy(() -> HyperLogLog.fromByteArray(legacy))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Legacy");
    }

    @Test
    void testUnsupportedVersion() {
        byte[] data = HyperLogLog.create().toByteArray();
        data[0] = 3;

        assertThatThrownBy(() -> HyperLogLog.fromByteArray(data))
                .isInstanceOf(UnsupportedVersionException.class)
                .satisfies(e -> assertThat(((UnsupportedVersionException) e).getVersion()).isEqualTo(3));
    }

    @Test
    void testTooShort() {
        assertThatThrownBy(() -> HyperLogLog.fromByteArray(new byte[5]))
                .isInstanceOf(SketchTooShortException.class);

        HyperLogLog sketch = HyperLogLog.create();
        sketch.insert(bytes(1));
        byte[] sparse = sketch.toByteArray();
        assertThatThrownBy(() -> HyperLogLog.fromByteArray(Arrays.copyOf(sparse, sparse.length - 1)))
                .isInstanceOf(SketchTooShortException.class);

        byte[] dense = HyperLogLog.createDense().toByteArray();
        assertThatThrownBy(() -> HyperLogLog.fromByteArray(Arrays.copyOf(dense, dense.length - 1)))
                .isInstanceOf(SketchTooShortException.class);
    }

    @Test
    void testInvalidSerializedPrecision() {
        byte[] data = HyperLogLog.create().toByteArray();
        data[1] = 30;

        assertThatThrownBy(() -> HyperLogLog.fromByteArray(data))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("precision");
    }

    private static long mix(long i) {
        long z = i * 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    private static byte[] bytes(int i) {
        return ("item-" + i).getBytes(StandardCharsets.UTF_8);
    }
}
