/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.sketch;

import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;

import dev.dataobj.metadata.UnsupportedVersionException;
import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;

import static dev.dataobj.sketch.HyperLogLogMath.SPARSE_REGISTERS;

/**
 * HyperLogLog cardinality sketch with a sparse representation for low cardinalities.
 * <p>
 * A sketch of precision {@code p} has {@code m = 2^p} registers. It starts sparse: inserted hashes
 * are encoded at 25-bit precision, buffered in a temporary set and periodically merged into a
 * sorted, delta-compressed list. Sparse estimates use linear counting over {@code 2^25} slots and
 * are exact for small cardinalities. Once the list holds more than {@code m} keys the sketch is
 * promoted to a dense array of {@code m} one-byte registers; promotion is irreversible.
 * </p>
 * <p>
 * Instances are not thread-safe.
 * </p>
 *
 * <h2>Binary format</h2>
 * <pre>
 * version(1) | precision(1) | base(1) | sparse flag(1)
 * sparse: temp set size(4) | temp set keys(4 each) | list count(4) | list last(4) | list length(4) | list bytes
 * dense:  register count(4) | registers(1 each)
 * </pre>
 * Integers are big-endian. Version 1 sketches stored dense registers as nibbles, two per byte,
 * offset by {@code base}; they are expanded when read and never written.
 */
public final class HyperLogLog {

    static final int VERSION = 2;
    static final int LEGACY_VERSION = 1;

    public static final int MIN_PRECISION = 4;
    public static final int MAX_PRECISION = 18;
    public static final int DEFAULT_PRECISION = 14;

    private static final int HEADER_SIZE = 8;
    private static final long HASH_SEED = 1337;

    private static final Logger LOG = System.getLogger(HyperLogLog.class.getName());

    private static final XXHash64 HASH = XXHashFactory.fastestInstance().hash64();

    private final int p;
    private final int m;
    private State state;

    private sealed interface State permits Sparse, Dense {
    }

    private static final class Sparse implements State {
        private SparseSet tmpSet;
        private CompressedList list;

        Sparse(SparseSet tmpSet, CompressedList list) {
            this.tmpSet = tmpSet;
            this.list = list;
        }
    }

    private static final class Dense implements State {
        private final byte[] registers;

        Dense(byte[] registers) {
            this.registers = registers;
        }
    }

    private HyperLogLog(int p, State state) {
        this.p = p;
        this.m = 1 << p;
        this.state = state;
    }

    /**
     * Creates a sparse sketch with precision 14.
     */
    public static HyperLogLog create() {
        return create(DEFAULT_PRECISION, true);
    }

    /**
     * Creates a sparse sketch with precision 16.
     */
    public static HyperLogLog create16() {
        return create(16, true);
    }

    /**
     * Creates a dense sketch with precision 14.
     */
    public static HyperLogLog createDense() {
        return create(DEFAULT_PRECISION, false);
    }

    /**
     * Creates a sketch.
     *
     * @param precision number of index bits, between {@value #MIN_PRECISION} and {@value #MAX_PRECISION}
     * @param sparse whether to start with the sparse representation
     * @throws IllegalArgumentException if the precision is out of range
     */
    public static HyperLogLog create(int precision, boolean sparse) {
        checkPrecision(precision);
        State state = sparse
                ? new Sparse(new SparseSet(), new CompressedList())
                : new Dense(new byte[1 << precision]);
        return new HyperLogLog(precision, state);
    }

    private static void checkPrecision(int precision) {
        if (precision < MIN_PRECISION || precision > MAX_PRECISION) {
            throw new IllegalArgumentException(
                    "Precision must be between " + MIN_PRECISION + " and " + MAX_PRECISION + ": " + precision);
        }
    }

    public int precision() {
        return p;
    }

    public boolean isSparse() {
        return state instanceof Sparse;
    }

    /**
     * Hashes the bytes with XXH64 and inserts the hash.
     */
    public void insert(byte[] data) {
        insert(data, 0, data.length);
    }

    public void insert(byte[] data, int offset, int length) {
        insertHash(HASH.hash(data, offset, length, HASH_SEED));
    }

    public void insertHash(long x) {
        if (state instanceof Sparse sparse) {
            if (sparse.tmpSet.add(HyperLogLogMath.encodeHash(x, p))) {
                maybePromote(sparse);
            }
            return;
        }
        byte[] registers = ((Dense) state).registers;
        updateRegister(registers, HyperLogLogMath.registerIndex(x, p), HyperLogLogMath.registerRank(x, p));
    }

    /**
     * Returns the estimated number of distinct inserted hashes.
     * <p>
     * In sparse mode this merges pending insertions into the sorted list first.
     * </p>
     */
    public long estimate() {
        if (state instanceof Sparse sparse) {
            mergeSparse(sparse);
            long empty = SPARSE_REGISTERS - (long) sparse.list.size();
            return (long) HyperLogLogMath.linearCount(SPARSE_REGISTERS, empty);
        }
        return HyperLogLogMath.estimateDense(((Dense) state).registers, p);
    }

    /**
     * Merges another sketch into this one. {@code other} is not modified.
     * <p>
     * Two sparse sketches stay sparse, subject to the usual promotion check. If either sketch is
     * dense, this sketch is promoted and the other's observations are folded in by per-register maximum.
     * </p>
     *
     * @throws PrecisionMismatchException if the precisions differ
     */
    public void merge(HyperLogLog other) {
        if (other == null) {
            return;
        }
        if (p != other.p) {
            throw new PrecisionMismatchException(p, other.p);
        }

        if (state instanceof Sparse sparse && other.state instanceof Sparse otherSparse) {
            sparse.tmpSet.addAll(otherSparse.tmpSet);
            for (CompressedList.Iterator it = otherSparse.list.iterator(); it.hasNext();) {
                sparse.tmpSet.add(it.next());
            }
            maybePromote(sparse);
            return;
        }

        if (state instanceof Sparse sparse) {
            state = toDense(sparse);
        }
        byte[] registers = ((Dense) state).registers;

        if (other.state instanceof Sparse otherSparse) {
            foldSparse(otherSparse, registers);
        }
        else {
            byte[] otherRegisters = ((Dense) other.state).registers;
            for (int i = 0; i < registers.length; i++) {
                if (otherRegisters[i] > registers[i]) {
                    registers[i] = otherRegisters[i];
                }
            }
        }
    }

    /**
     * Returns a deep copy that shares no mutable state with this sketch.
     */
    public HyperLogLog copy() {
        State copied;
        if (state instanceof Sparse sparse) {
            copied = new Sparse(sparse.tmpSet.copy(), sparse.list.copy());
        }
        else {
            copied = new Dense(((Dense) state).registers.clone());
        }
        return new HyperLogLog(p, copied);
    }

    private void maybePromote(Sparse sparse) {
        if ((long) sparse.tmpSet.size() * 100 > m) {
            mergeSparse(sparse);
            if (sparse.list.size() > m) {
                LOG.log(Level.DEBUG, "Promoting sketch of precision {0} to dense after {1} sparse entries",
                        p, sparse.list.size());
                state = toDense(sparse);
            }
        }
    }

    /**
     * Merges the temporary set into the sorted list. Flagged keys sharing a 25-bit index are
     * collapsed into the one with the highest rank. It sorts last among them, although unflagged
     * keys of neighbouring indices may sort in between.
     */
    private static void mergeSparse(Sparse sparse) {
        if (sparse.tmpSet.isEmpty()) {
            return;
        }

        int[] keys = sparse.tmpSet.toSortedArray();
        int[] union = new int[keys.length + sparse.list.size()];
        int count = 0;
        CompressedList.Iterator it = sparse.list.iterator();

        boolean hasListKey = it.hasNext();
        int listKey = hasListKey ? it.next() : 0;
        int i = 0;
        while (hasListKey || i < keys.length) {
            if (!hasListKey || (i < keys.length && Integer.compareUnsigned(keys[i], listKey) < 0)) {
                union[count++] = keys[i++];
            }
            else {
                if (i < keys.length && keys[i] == listKey) {
                    i++;
                }
                union[count++] = listKey;
                hasListKey = it.hasNext();
                listKey = hasListKey ? it.next() : 0;
            }
        }

        // Walk backwards so the highest ranked flagged key of each index is seen first
        boolean[] dropped = new boolean[count];
        boolean hasFlagged = false;
        int flaggedIndex = 0;
        for (int k = count - 1; k >= 0; k--) {
            int key = union[k];
            if ((key & 1) == 1) {
                if (hasFlagged && key >>> 7 == flaggedIndex) {
                    dropped[k] = true;
                }
                else {
                    hasFlagged = true;
                    flaggedIndex = key >>> 7;
                }
            }
        }

        CompressedList merged = new CompressedList(4 * count);
        for (int k = 0; k < count; k++) {
            if (!dropped[k]) {
                merged.append(union[k]);
            }
        }

        sparse.list = merged;
        sparse.tmpSet = new SparseSet();
    }

    private Dense toDense(Sparse sparse) {
        byte[] registers = new byte[m];
        foldSparse(sparse, registers);
        return new Dense(registers);
    }

    private void foldSparse(Sparse sparse, byte[] registers) {
        sparse.tmpSet.forEach(key -> updateRegister(registers,
                HyperLogLogMath.decodeIndex(key, p), HyperLogLogMath.decodeRank(key, p)));
        for (CompressedList.Iterator it = sparse.list.iterator(); it.hasNext();) {
            int key = it.next();
            updateRegister(registers, HyperLogLogMath.decodeIndex(key, p), HyperLogLogMath.decodeRank(key, p));
        }
    }

    private static void updateRegister(byte[] registers, int index, int rank) {
        if (rank > registers[index]) {
            registers[index] = (byte) rank;
        }
    }

    /**
     * Serializes the sketch in the current format version.
     */
    public byte[] toByteArray() {
        if (state instanceof Sparse sparse) {
            byte[] out = new byte[HEADER_SIZE + 4 * sparse.tmpSet.size() + sparse.list.serializedSize()];
            writeHeader(out, true);
            int[] offset = {CompressedList.putInt(out, 4, sparse.tmpSet.size())};
            sparse.tmpSet.forEach(key -> offset[0] = CompressedList.putInt(out, offset[0], key));
            sparse.list.writeTo(out, offset[0]);
            return out;
        }

        byte[] registers = ((Dense) state).registers;
        byte[] out = new byte[HEADER_SIZE + registers.length];
        writeHeader(out, false);
        CompressedList.putInt(out, 4, registers.length);
        System.arraycopy(registers, 0, out, HEADER_SIZE, registers.length);
        return out;
    }

    private void writeHeader(byte[] out, boolean sparse) {
        out[0] = VERSION;
        out[1] = (byte) p;
        out[2] = 0;
        out[3] = (byte) (sparse ? 1 : 0);
    }

    /**
     * Deserializes a sketch written by {@link #toByteArray()} or by the legacy version 1 format.
     *
     * @throws UnsupportedVersionException if the version byte is unknown
     * @throws SketchTooShortException if the data ends before its declared content
     * @throws IOException if the data is otherwise malformed
     */
    public static HyperLogLog fromByteArray(byte[] data) throws IOException {
        if (data.length < HEADER_SIZE) {
            throw new SketchTooShortException("header", HEADER_SIZE, data.length);
        }

        int version = data[0] & 0xFF;
        if (version != VERSION && version != LEGACY_VERSION) {
            throw new UnsupportedVersionException("sketch version", version);
        }
        int precision = data[1] & 0xFF;
        int base = data[2] & 0xFF;
        boolean sparse = data[3] == 1;
        if (precision < MIN_PRECISION || precision > MAX_PRECISION) {
            throw new IOException("Invalid sketch precision: " + precision);
        }

        if (sparse) {
            return new HyperLogLog(precision, readSparse(data));
        }
        if (version == LEGACY_VERSION) {
            return new HyperLogLog(precision, new Dense(expandLegacyRegisters(data, base, 1 << precision)));
        }

        int count = CompressedList.getInt(data, 4);
        if (count != 1 << precision) {
            throw new IOException("Dense sketch of precision " + precision + " declares " + count + " registers");
        }
        if (data.length - HEADER_SIZE < count) {
            throw new SketchTooShortException("registers", count, data.length - HEADER_SIZE);
        }
        byte[] registers = new byte[count];
        System.arraycopy(data, HEADER_SIZE, registers, 0, count);
        return new HyperLogLog(precision, new Dense(registers));
    }

    private static Sparse readSparse(byte[] data) throws IOException {
        long tmpSize = Integer.toUnsignedLong(CompressedList.getInt(data, 4));
        long tmpEnd = HEADER_SIZE + tmpSize * 4;
        if (tmpEnd > data.length) {
            throw new SketchTooShortException("temporary set", (int) Math.min(Integer.MAX_VALUE, tmpSize * 4),
                    data.length - HEADER_SIZE);
        }

        SparseSet tmpSet = new SparseSet((int) tmpSize);
        for (int offset = HEADER_SIZE; offset < tmpEnd; offset += 4) {
            tmpSet.add(CompressedList.getInt(data, offset));
        }
        CompressedList list = CompressedList.readFrom(data, (int) tmpEnd);
        return new Sparse(tmpSet, list);
    }

    /**
     * Expands version 1 dense registers, stored as two 4-bit values per byte offset by {@code base}.
     */
    private static byte[] expandLegacyRegisters(byte[] data, int base, int m) throws IOException {
        int packed = data.length - HEADER_SIZE;
        if (packed * 2 != m) {
            throw new IOException("Legacy sketch holds " + (packed * 2) + " registers, precision requires " + m);
        }
        byte[] registers = new byte[m];
        for (int i = 0; i < packed; i++) {
            int v = data[HEADER_SIZE + i] & 0xFF;
            registers[i * 2] = (byte) ((v >>> 4) + base);
            registers[i * 2 + 1] = (byte) ((v & 0x0F) + base);
        }
        return registers;
    }

    @Override
    public String toString() {
        return "HyperLogLog[precision=" + p + ", " + (isSparse() ? "sparse" : "dense") + "]";
    }
}
