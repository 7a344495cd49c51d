package com.github.ylgrgyq.ucm.io;

import com.github.ylgrgyq.ucm.FormatException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.DoubleBuffer;
import java.nio.FloatBuffer;
import java.nio.IntBuffer;
import java.nio.ShortBuffer;
import java.nio.charset.Charset;
import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * Reads the primitive fields of a ucm frame from an {@link InputStream} in a fixed byte order.
 * <p>
 * Every multi-byte field is decoded with the byte order given at construction. A stream
 * which ends in the middle of a field, a negative length or a length above the configured
 * limits is reported as a {@link FormatException} carrying the offset of the field. Errors
 * from the underlying stream are propagated as they are.
 * <p>
 * This class does not own the stream and never closes it.
 */
public final class FrameInput {
    static final int CHUNK_SIZE = 8192;

    private final InputStream in;
    private final ByteOrder order;
    private final Charset charset;
    private final int maxStringLength;
    private final int maxVectorLength;
    private final ByteBuffer buffer;
    private long position;

    public FrameInput(InputStream in, ByteOrder order, Charset charset, int maxStringLength, int maxVectorLength) {
        requireNonNull(in, "in");
        requireNonNull(order, "order");
        requireNonNull(charset, "charset");
        if (maxStringLength < 0) {
            throw new IllegalArgumentException("maxStringLength: " + maxStringLength + " (expected: >= 0)");
        }
        if (maxVectorLength < 0) {
            throw new IllegalArgumentException("maxVectorLength: " + maxVectorLength + " (expected: >= 0)");
        }

        this.in = in;
        this.order = order;
        this.charset = charset;
        this.maxStringLength = maxStringLength;
        this.maxVectorLength = maxVectorLength;
        this.buffer = ByteBuffer.allocate(CHUNK_SIZE).order(order);
    }

    /**
     * Returns a {@link FrameInput} which goes on reading the same stream from the current
     * position, decoding multi-byte fields in {@code order}. Used once the byte order of a
     * frame has been detected from its magic number.
     *
     * @param order byte order of every following multi-byte field
     * @return a {@link FrameInput} positioned where this one stopped
     */
    public FrameInput withOrder(ByteOrder order) {
        requireNonNull(order, "order");

        final FrameInput input = new FrameInput(in, order, charset, maxStringLength, maxVectorLength);
        input.position = position;
        return input;
    }

    public ByteOrder order() {
        return order;
    }

    /**
     * Returns the number of bytes consumed so far.
     *
     * @return offset of the next field to read
     */
    public long position() {
        return position;
    }

    /**
     * Read {@code length} bytes as they are on the wire, without any byte order applied.
     *
     * @param length number of bytes to read
     * @return the bytes read
     */
    public byte[] readBytes(int length) throws IOException, FormatException {
        final byte[] bytes = new byte[length];
        readFully(bytes, 0, length);
        return bytes;
    }

    public int readUnsignedByte() throws IOException, FormatException {
        return fill(Byte.BYTES).get() & 0xFF;
    }

    public int readUnsignedShort() throws IOException, FormatException {
        return fill(Short.BYTES).getShort() & 0xFFFF;
    }

    public int readInt() throws IOException, FormatException {
        return fill(Integer.BYTES).getInt();
    }

    public long readUnsignedInt() throws IOException, FormatException {
        return fill(Integer.BYTES).getInt() & 0xFFFFFFFFL;
    }

    public float readFloat() throws IOException, FormatException {
        return fill(Float.BYTES).getFloat();
    }

    public double readDouble() throws IOException, FormatException {
        return fill(Double.BYTES).getDouble();
    }

    /**
     * Read an int32 which counts something and so must not be negative.
     *
     * @param what  name of the counted thing, used in the error message
     * @param limit maximum accepted count
     * @return the count
     * @throws FormatException if the count is negative or larger than {@code limit}
     */
    public int readCount(String what, int limit) throws IOException, FormatException {
        final long start = position;
        final int count = readInt();
        if (count < 0 || count > limit) {
            throw new FormatException("invalid " + what + ": " + count + " (expected: [0, " + limit + "])", start);
        }
        return count;
    }

    /**
     * Read a string stored as an int32 byte count followed by that many bytes, without terminator.
     *
     * @return the decoded string
     */
    public String readString() throws IOException, FormatException {
        final int length = readCount("string length", maxStringLength);
        final byte[] bytes = new byte[length];
        readFully(bytes, 0, length);
        return new String(bytes, charset);
    }

    public double[] readDoubleVector() throws IOException, FormatException {
        final int count = readCount("vector length", maxVectorLength);
        final int step = CHUNK_SIZE / Double.BYTES;
        double[] values = new double[Math.min(count, step)];
        int done = 0;
        while (done < count) {
            final int n = Math.min(step, count - done);
            if (values.length < done + n) {
                values = Arrays.copyOf(values, grownLength(values.length, done + n, count));
            }
            final DoubleBuffer src = fill(n * Double.BYTES).asDoubleBuffer();
            src.get(values, done, n);
            done += n;
        }
        return values;
    }

    public int[] readIntVector() throws IOException, FormatException {
        final int count = readCount("vector length", maxVectorLength);
        final int step = CHUNK_SIZE / Integer.BYTES;
        int[] values = new int[Math.min(count, step)];
        int done = 0;
        while (done < count) {
            final int n = Math.min(step, count - done);
            if (values.length < done + n) {
                values = Arrays.copyOf(values, grownLength(values.length, done + n, count));
            }
            final IntBuffer src = fill(n * Integer.BYTES).asIntBuffer();
            src.get(values, done, n);
            done += n;
        }
        return values;
    }

    public float[] readFloatVector() throws IOException, FormatException {
        return readFloats(readCount("vector length", maxVectorLength));
    }

    /**
     * Read {@code count} consecutive float32 values. No count prefix is read.
     * <p>
     * The returned array grows with the bytes actually read, so a corrupt count on a short
     * stream fails before the whole array is allocated.
     *
     * @param count number of values to read
     * @return the values read
     */
    public float[] readFloats(int count) throws IOException, FormatException {
        checkNonNegative(count);

        final int step = CHUNK_SIZE / Float.BYTES;
        float[] values = new float[Math.min(count, step)];
        int done = 0;
        while (done < count) {
            final int n = Math.min(step, count - done);
            if (values.length < done + n) {
                values = Arrays.copyOf(values, grownLength(values.length, done + n, count));
            }
            final FloatBuffer src = fill(n * Float.BYTES).asFloatBuffer();
            src.get(values, done, n);
            done += n;
        }
        return values;
    }

    /**
     * Read {@code count} consecutive uint16 values, each widened to a float. No count prefix
     * is read. The returned array grows like the one of {@link #readFloats(int)}.
     *
     * @param count number of values to read
     * @return the values read
     */
    public float[] readUnsignedShortsAsFloats(int count) throws IOException, FormatException {
        checkNonNegative(count);

        final int step = CHUNK_SIZE / Short.BYTES;
        float[] values = new float[Math.min(count, step)];
        int done = 0;
        while (done < count) {
            final int n = Math.min(step, count - done);
            if (values.length < done + n) {
                values = Arrays.copyOf(values, grownLength(values.length, done + n, count));
            }
            final ShortBuffer src = fill(n * Short.BYTES).asShortBuffer();
            for (int i = 0; i < n; i++) {
                values[done + i] = src.get() & 0xFFFF;
            }
            done += n;
        }
        return values;
    }

    // doubles the capacity until it reaches the final length
    private static int grownLength(int capacity, int needed, int count) {
        return (int) Math.min(count, Math.max(needed, 2L * capacity));
    }

    private static void checkNonNegative(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count: " + count + " (expected: >= 0)");
        }
    }

    private ByteBuffer fill(int length) throws IOException, FormatException {
        assert length <= CHUNK_SIZE : "length: " + length;

        buffer.clear();
        readFully(buffer.array(), 0, length);
        buffer.limit(length);
        return buffer;
    }

    private void readFully(byte[] dest, int offset, int length) throws IOException, FormatException {
        int read = 0;
        while (read < length) {
            final int n = in.read(dest, offset + read, length - read);
            if (n < 0) {
                throw new FormatException("truncated stream: need " + length + " bytes, found " + read, position);
            }
            read += n;
        }
        position += length;
    }
}
