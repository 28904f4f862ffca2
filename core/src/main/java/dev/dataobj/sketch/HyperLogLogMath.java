/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.sketch;

/**
 * Bit manipulation and bias correction shared by the sparse and dense sketch representations.
 * <p>
 * Sparse entries are 32-bit keys, compared as unsigned integers. A hash is reduced to a 25-bit
 * index ({@link #SPARSE_PRECISION}); when the bits of that index below the sketch's own precision
 * are all zero the rank cannot be recovered from the index alone, so the key also stores it:
 * </p>
 * <pre>
 * flagged:   index(25) | rank(6) | 1
 * unflagged: index(25) << 1      | 0
 * </pre>
 */
final class HyperLogLogMath {

    static final int SPARSE_PRECISION = 25;
    static final int SPARSE_REGISTERS = 1 << SPARSE_PRECISION;

    private HyperLogLogMath() {
    }

    static long bextr(long v, int start, int length) {
        return (v >>> start) & ((1L << length) - 1);
    }

    static int bextr32(int v, int start, int length) {
        return (int) ((Integer.toUnsignedLong(v) >>> start) & ((1L << length) - 1));
    }

    /**
     * Encodes a hash as a sparse key at {@link #SPARSE_PRECISION}.
     */
    static int encodeHash(long x, int p) {
        int index = (int) bextr(x, 64 - SPARSE_PRECISION, SPARSE_PRECISION);
        if (bextr(x, 64 - SPARSE_PRECISION, SPARSE_PRECISION - p) == 0) {
            long rest = (bextr(x, 0, 64 - SPARSE_PRECISION) << SPARSE_PRECISION) | ((1L << SPARSE_PRECISION) - 1);
            int zeros = Long.numberOfLeadingZeros(rest) + 1;
            return index << 7 | zeros << 1 | 1;
        }
        return index << 1;
    }

    /**
     * Register index at precision {@code p} of a sparse key.
     */
    static int decodeIndex(int key, int p) {
        if ((key & 1) == 1) {
            return bextr32(key, 32 - p, p);
        }
        return bextr32(key, SPARSE_PRECISION - p + 1, p);
    }

    /**
     * Rank at precision {@code p} of a sparse key.
     */
    static int decodeRank(int key, int p) {
        if ((key & 1) == 1) {
            return bextr32(key, 1, 6) + SPARSE_PRECISION - p;
        }
        long shifted = Integer.toUnsignedLong(key << (32 - SPARSE_PRECISION + p - 1));
        return Long.numberOfLeadingZeros(shifted) - 31;
    }

    /**
     * Dense register index of a hash at precision {@code p}.
     */
    static int registerIndex(long x, int p) {
        return (int) bextr(x, 64 - p, p);
    }

    /**
     * Rank of the first set bit after the index bits, counting from 1.
     */
    static int registerRank(long x, int p) {
        long w = x << p | 1L << (p - 1);
        return Long.numberOfLeadingZeros(w) + 1;
    }

    static double linearCount(long m, long empty) {
        return m * Math.log1p((double) (m - empty) / empty);
    }

    static double alpha(double m) {
        if (m == 16) {
            return 0.673;
        }
        if (m == 32) {
            return 0.697;
        }
        if (m == 64) {
            return 0.709;
        }
        return 0.7213 / (1 + 1.079 / m);
    }

    /**
     * LogLog-Beta coefficients per precision, starting at precision 4. Each row holds the factor of
     * {@code ez} followed by the factors of {@code ln(ez + 1)} raised to the powers 1 to 7.
     * Precision 14 carries the published coefficients; the other rows are least-squares fits of
     * the same polynomial against simulated sketches.
     */
    private static final double[][] BETA = {
            { -88.58919980198732, 84.43882701878364, 57.309300656034594, -5.578134910857784, 19.726147158086807, -6.073193572992245, 1.5687585074154808, -0.09209792558645652 },
            { 233.4890527956719, -240.4967171502091, -91.48116671674431, -79.04772747048257, 22.868817038149995, -16.518283333312837, 3.1602263026672635, -0.42325186604029685 },
            { 45.387128914416365, -47.74776869773622, -16.441548689886908, -16.675486456688215, 5.034013071671763, -3.3565225126508897, 0.6293741469518099, -0.08282902747273524 },
            { -0.2859367015480462, -0.5476618737452649, 0.6998635548790548, -0.35300942384487305, 0.12896553344104922, -0.03477121529332477, 0.00649757336195007, -0.0005843910648543583 },
            { -1.6169861157683074, 0.9698388221941596, 0.7075994706463538, 0.8148829584191488, -0.45447791255358033, 0.21256597234940894, -0.03787025063445011, 0.003658725755918352 },
            { -1.4900720305340953, 1.5812835110885561, -1.5176543090485015, 3.1420269326049284, -1.6774974513921148, 0.5393922501010617, -0.08171100293462699, 0.005885309741241675 },
            { -0.9167003789607021, 1.3727969194755978, -2.8395024723173994, 3.9963345316136367, -2.0461443067227916, 0.5774531752964478, -0.0790573647041434, 0.0048116777978690324 },
            { -0.1824823405434105, -2.057295704400046, 4.558982708449792, -4.192307374135468, 1.9406334645366743, -0.46769484555931873, 0.05677302234115085, -0.0028371795618366076 },
            { -0.444643040990061, 2.0781423364503464, -4.773472840651277, 4.388420028570659, -1.7713348688157708, 0.3843432893321652, -0.04137122944456555, 0.0019397699323398284 },
            { -0.39494088802861044, 3.62345997114137, -6.230825763590995, 4.584962782782708, -1.6055481577431217, 0.3089837861676454, -0.029870183925183563, 0.0013037022679349174 },
            { -0.370393911, 0.070471823, 0.17393686, 0.16339839, -0.09237745, 0.03738027, -0.005384159, 0.00042419 },
            { -0.3434021647354333, 6.067134434169476, -8.804904821086069, 4.755703149014422, -1.0953038132516424, 0.1196797119889905, -0.004986360625280739, 0.00016962586637194705 },
            { -0.3829465654046443, 5.401567285286485, -8.888155544255389, 7.906187976439663, -3.197120721345277, 0.6562166471714759, -0.06555212661135033, 0.0027788397264776263 },
            { -0.35164224894489937, -34.66713043201525, 46.96713856871561, -28.011465043531903, 7.90927803697545, -1.0827702326752857, 0.0681400321685365, -0.001257675432289296 },
            { -0.3800233478221938, 29.201265987937827, -71.5969155369725, 49.477237754879, -15.552392165032803, 2.5342395613239947, -0.2090650381713446, 0.0072366379789391404 },
    };

    /**
     * LogLog-Beta bias correction as a function of the number of empty registers.
     */
    static double beta(int p, double ez) {
        double[] c = BETA[p - HyperLogLog.MIN_PRECISION];
        double zl = Math.log(ez + 1);
        double result = c[0] * ez;
        double power = 1;
        for (int i = 1; i < c.length; i++) {
            power *= zl;
            result += c[i] * power;
        }
        return result;
    }

    /**
     * Estimates the cardinality from dense registers with the LogLog-Beta estimator.
     */
    static long estimateDense(byte[] registers, int p) {
        double m = registers.length;
        double sum = 0;
        int zeros = 0;
        for (byte register : registers) {
            if (register == 0) {
                zeros++;
            }
            sum += Math.scalb(1.0, -register);
        }
        return Math.round(alpha(m) * m * (m - zeros) / (sum + beta(p, zeros)));
    }
}
