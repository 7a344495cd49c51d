package com.github.ylgrgyq.ucm.codec;

import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static java.util.Objects.requireNonNull;

/**
 * A builder to build {@link FrameCodec}.
 */
public final class FrameCodecBuilder {
    /**
     * Create a new {@link FrameCodecBuilder} instance with default settings.
     *
     * @return the new {@link FrameCodecBuilder} instance
     */
    public static FrameCodecBuilder newBuilder() {
        return new FrameCodecBuilder();
    }

    private ByteOrder byteOrder = ByteOrder.nativeOrder();
    private Charset charset = StandardCharsets.ISO_8859_1;
    private boolean appendFileSuffix = true;
    private int maxStringLength = Constant.kDefaultMaxStringLength;
    private int maxVectorLength = Constant.kDefaultMaxVectorLength;
    private int maxWindowPixels = Constant.kDefaultMaxWindowPixels;

    private FrameCodecBuilder() {}

    /**
     * Set the byte order used to write frames. Reading always detects the byte order of a
     * frame from its magic number, whatever is set here.
     * <p>
     * The default value is the native byte order of this machine.
     *
     * @param byteOrder the byte order of written frames
     * @return this
     */
    public FrameCodecBuilder byteOrder(ByteOrder byteOrder) {
        requireNonNull(byteOrder, "byteOrder");

        this.byteOrder = byteOrder;
        return this;
    }

    /**
     * Set the charset used to encode and decode header names, comments and string values.
     * The length written before a string is its length in bytes in this charset.
     * <p>
     * The default value is ISO-8859-1, which maps every byte to one character and back.
     *
     * @param charset the charset of header strings
     * @return this
     */
    public FrameCodecBuilder charset(Charset charset) {
        requireNonNull(charset, "charset");

        this.charset = charset;
        return this;
    }

    /**
     * If set, {@link FrameCodec#write(com.github.ylgrgyq.ucm.Frame, java.nio.file.Path)}
     * appends ".ucm" to file names which do not already end with it.
     * {@link FrameCodec#read(java.nio.file.Path)} always opens the name it is given.
     * <p>
     * The default value is true.
     *
     * @param appendFileSuffix true to append the ".ucm" suffix when it is missing
     * @return this
     */
    public FrameCodecBuilder appendFileSuffix(boolean appendFileSuffix) {
        this.appendFileSuffix = appendFileSuffix;
        return this;
    }

    /**
     * Set the maximum length in bytes accepted for a string when reading a frame. A longer
     * length is reported as a malformed frame instead of being allocated. Writing a frame
     * with a longer string fails, so everything written can be read back.
     * <p>
     * The default value is 1 MiB.
     *
     * @param maxStringLength maximum string length in bytes
     * @return this
     */
    public FrameCodecBuilder maxStringLength(int maxStringLength) {
        if (maxStringLength < 0) {
            throw new IllegalArgumentException("maxStringLength: " + maxStringLength + " (expected: >= 0)");
        }

        this.maxStringLength = maxStringLength;
        return this;
    }

    /**
     * Set the maximum number of elements accepted for a vector header value when reading
     * a frame. Writing a frame with a longer vector fails.
     * <p>
     * The default value is 16 Mi elements.
     *
     * @param maxVectorLength maximum number of elements of a vector value
     * @return this
     */
    public FrameCodecBuilder maxVectorLength(int maxVectorLength) {
        if (maxVectorLength < 0) {
            throw new IllegalArgumentException("maxVectorLength: " + maxVectorLength + " (expected: >= 0)");
        }

        this.maxVectorLength = maxVectorLength;
        return this;
    }

    /**
     * Set the maximum number of pixels, {@code nx * ny}, accepted for a window when reading
     * a frame. Writing a frame with a larger window fails.
     * <p>
     * The default value is 64 Mi pixels.
     *
     * @param maxWindowPixels maximum number of pixels of a window
     * @return this
     */
    public FrameCodecBuilder maxWindowPixels(int maxWindowPixels) {
        if (maxWindowPixels < 0) {
            throw new IllegalArgumentException("maxWindowPixels: " + maxWindowPixels + " (expected: >= 0)");
        }

        this.maxWindowPixels = maxWindowPixels;
        return this;
    }

    /**
     * Create a new instance of {@link FrameCodec}.
     *
     * @return a new instance of {@link FrameCodec}
     */
    public FrameCodec build() {
        return new FrameCodec(this);
    }

    ByteOrder getByteOrder() {
        return byteOrder;
    }

    Charset getCharset() {
        return charset;
    }

    boolean appendFileSuffix() {
        return appendFileSuffix;
    }

    int getMaxStringLength() {
        return maxStringLength;
    }

    int getMaxVectorLength() {
        return maxVectorLength;
    }

    int getMaxWindowPixels() {
        return maxWindowPixels;
    }
}
