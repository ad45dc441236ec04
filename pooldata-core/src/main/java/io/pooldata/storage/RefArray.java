package io.pooldata.storage;

import io.pooldata.core.RefWidth;
import io.pooldata.kernel.References;

import java.util.Arrays;

/**
 * Mutable reference array backed by a primitive array of the configured width.
 * <p>
 * Values are unsigned: a {@link RefWidth#UINT8} array stores 0..255 in a
 * {@code byte[]}, a {@link RefWidth#UINT16} array stores 0..65535 in a
 * {@code short[]}. Callers are responsible for only storing references the width
 * can hold; the pool capacity check guarantees that.
 */
abstract class RefArray implements References {

    static RefArray allocate(RefWidth width, int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative: " + size);
        }
        return switch (width) {
            case UINT8 -> new Uint8(new byte[size]);
            case UINT16 -> new Uint16(new short[size]);
            case INT32 -> new Int32(new int[size]);
        };
    }

    static RefArray fromInts(RefWidth width, int[] refs) {
        var array = allocate(width, refs.length);
        for (var i = 0; i < refs.length; i++) {
            array.set(i, refs[i]);
        }
        return array;
    }

    abstract RefWidth width();

    abstract void set(int index, int reference);

    abstract RefArray copy();

    /**
     * New array of the same width holding the references at the given positions.
     */
    RefArray select(int[] indices) {
        var result = allocate(width(), indices.length);
        for (var i = 0; i < indices.length; i++) {
            result.set(i, get(indices[i]));
        }
        return result;
    }

    /**
     * Repoint every occurrence of {@code from} to {@code to}.
     *
     * @return number of positions changed
     */
    int replaceAll(int from, int to) {
        if (from == to) {
            return 0;
        }
        var changed = 0;
        for (var i = 0; i < size(); i++) {
            if (get(i) == from) {
                set(i, to);
                changed++;
            }
        }
        return changed;
    }

    @Override
    public int[] toIntArray() {
        var result = new int[size()];
        for (var i = 0; i < result.length; i++) {
            result[i] = get(i);
        }
        return result;
    }

    /**
     * Read-only view that cannot be cast back to a mutable array.
     */
    References view() {
        var self = this;
        return new References() {
            @Override
            public int size() {
                return self.size();
            }

            @Override
            public int get(int index) {
                return self.get(index);
            }

            @Override
            public int[] toIntArray() {
                return self.toIntArray();
            }

            @Override
            public int max() {
                return self.max();
            }

            @Override
            public int count(int reference) {
                return self.count(reference);
            }
        };
    }

    private static final class Uint8 extends RefArray {
        private final byte[] refs;

        private Uint8(byte[] refs) {
            this.refs = refs;
        }

        @Override
        RefWidth width() {
            return RefWidth.UINT8;
        }

        @Override
        public int size() {
            return refs.length;
        }

        @Override
        public int get(int index) {
            return Byte.toUnsignedInt(refs[index]);
        }

        @Override
        void set(int index, int reference) {
            refs[index] = (byte) reference;
        }

        @Override
        RefArray copy() {
            return new Uint8(Arrays.copyOf(refs, refs.length));
        }
    }

    private static final class Uint16 extends RefArray {
        private final short[] refs;

        private Uint16(short[] refs) {
            this.refs = refs;
        }

        @Override
        RefWidth width() {
            return RefWidth.UINT16;
        }

        @Override
        public int size() {
            return refs.length;
        }

        @Override
        public int get(int index) {
            return Short.toUnsignedInt(refs[index]);
        }

        @Override
        void set(int index, int reference) {
            refs[index] = (short) reference;
        }

        @Override
        RefArray copy() {
            return new Uint16(Arrays.copyOf(refs, refs.length));
        }
    }

    private static final class Int32 extends RefArray {
        private final int[] refs;

        private Int32(int[] refs) {
            this.refs = refs;
        }

        @Override
        RefWidth width() {
            return RefWidth.INT32;
        }

        @Override
        public int size() {
            return refs.length;
        }

        @Override
        public int get(int index) {
            return refs[index];
        }

        @Override
        void set(int index, int reference) {
            refs[index] = reference;
        }

        @Override
        RefArray copy() {
            return new Int32(Arrays.copyOf(refs, refs.length));
        }

        @Override
        public int[] toIntArray() {
            return Arrays.copyOf(refs, refs.length);
        }
    }
}
