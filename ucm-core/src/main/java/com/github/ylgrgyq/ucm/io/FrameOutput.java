package com.github.ylgrgyq.ucm.io;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;

import static java.util.Objects.requireNonNull;

/**
 * Writes the primitive fields of a ucm frame to an {@link OutputStream} in a fixed byte order.
 * It is the mirror of {@link FrameInput}.
 * <p>
 * Fields are cumulated in an internal buffer which is written to the stream when it is full
 * and on {@link #flush()}. This class does not own the stream and never closes it.
 */
public final class FrameOutput {
    private final OutputStream out;
    private final ByteOrder order;
    private final Charset charset;
    private final ByteBuffer buffer;
    private long position;

    public FrameOutput(OutputStream out, ByteOrder order, Charset charset) {
        requireNonNull(out, "out");
        requireNonNull(order, "order");
        requireNonNull(charset, "charset");

        this.out = out;
        this.order = order;
        this.charset = charset;
        this.buffer = ByteBuffer.allocate(FrameInput.CHUNK_SIZE).order(order);
    }

    public ByteOrder order() {
        return order;
    }

    /**
     * Returns the number of bytes written so far, including those still held in the buffer.
     *
     * @return offset of the next field to write
     */
    public long position() {
        return position;
    }

    public void writeUnsignedByte(int value) throws IOException {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("value: " + value + " (expected: [0, 255])");
        }
        ensureRemaining(Byte.BYTES).put((byte) value);
    }

    public void writeUnsignedShort(int value) throws IOException {
        if (value < 0 || value > 0xFFFF) {
            throw new IllegalArgumentException("value: " + value + " (expected: [0, 65535])");
        }
        ensureRemaining(Short.BYTES).putShort((short) value);
    }

    public void writeInt(int value) throws IOException {
        ensureRemaining(Integer.BYTES).putInt(value);
    }

    public void writeUnsignedInt(long value) throws IOException {
        if (value < 0 || value > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("value: " + value + " (expected: [0, 4294967295])");
        }
        ensureRemaining(Integer.BYTES).putInt((int) value);
    }

    public void writeFloat(float value) throws IOException {
        ensureRemaining(Float.BYTES).putFloat(value);
    }

    public void writeDouble(double value) throws IOException {
        ensureRemaining(Double.BYTES).putDouble(value);
    }

    /**
     * Write {@code value} as an int32 byte count followed by the encoded bytes.
     *
     * @param value the string to write
     * @throws IllegalArgumentException if {@code value} has a character the charset of this
     *                                  output can not encode
     */
    public void writeString(String value) throws IOException {
        final byte[] bytes = encodeString(value, charset);
        writeInt(bytes.length);
        writeBytes(bytes);
    }

    /**
     * Encode {@code value} in {@code charset}, failing on any character the charset can not
     * represent instead of replacing it.
     *
     * @param value   the string to encode
     * @param charset the charset to encode with
     * @return the encoded bytes
     * @throws IllegalArgumentException if {@code value} can not be encoded exactly
     */
    public static byte[] encodeString(String value, Charset charset) {
        requireNonNull(value, "value");
        requireNonNull(charset, "charset");

        final CharsetEncoder encoder = charset.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            final ByteBuffer encoded = encoder.encode(CharBuffer.wrap(value));
            final byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException ex) {
            throw new IllegalArgumentException("value: \"" + value + "\" (expected: a string encodable in " +
                    charset + ")", ex);
        }
    }

    /**
     * Write {@code bytes} as they are, without any byte order applied.
     *
     * @param bytes the bytes to write
     */
    public void writeBytes(byte[] bytes) throws IOException {
        int done = 0;
        while (done < bytes.length) {
            final int n = Math.min(buffer.capacity(), bytes.length - done);
            ensureRemaining(n).put(bytes, done, n);
            done += n;
        }
    }

    public void writeDoubleVector(double[] values) throws IOException {
        writeInt(values.length);
        for (double v : values) {
            writeDouble(v);
        }
    }

    public void writeIntVector(int[] values) throws IOException {
        writeInt(values.length);
        for (int v : values) {
            writeInt(v);
        }
    }

    public void writeFloatVector(float[] values) throws IOException {
        writeInt(values.length);
        writeFloats(values);
    }

    /**
     * Write every value in {@code values} as float32, without a count prefix.
     *
     * @param values the values to write
     */
    public void writeFloats(float[] values) throws IOException {
        for (float v : values) {
            writeFloat(v);
        }
    }

    /**
     * Write all the buffered bytes to the underlying stream and flush it.
     */
    public void flush() throws IOException {
        drain();
        out.flush();
    }

    private ByteBuffer ensureRemaining(int length) throws IOException {
        assert length <= buffer.capacity() : "length: " + length;

        if (buffer.remaining() < length) {
            drain();
        }
        position += length;
        return buffer;
    }

    private void drain() throws IOException {
        if (buffer.position() > 0) {
            out.write(buffer.array(), 0, buffer.position());
            buffer.clear();
        }
    }
}
