package com.github.ylgrgyq.ucm.codec;

import com.github.ylgrgyq.ucm.FormatException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Finds the byte order of a ucm file from its magic number. The magic number is tried in
 * the native byte order of this machine first, then in the swapped one.
 */
final class ByteOrderDetector {
    private ByteOrderDetector() {}

    static ByteOrder detect(byte[] magic) throws FormatException {
        if (magic.length != Integer.BYTES) {
            throw new IllegalArgumentException("magic length: " + magic.length + " (expected: " + Integer.BYTES + ")");
        }

        final ByteOrder nativeOrder = ByteOrder.nativeOrder();
        if (ByteBuffer.wrap(magic).order(nativeOrder).getInt() == Constant.kMagicNumber) {
            return nativeOrder;
        }

        final ByteOrder swappedOrder = swap(nativeOrder);
        if (ByteBuffer.wrap(magic).order(swappedOrder).getInt() == Constant.kMagicNumber) {
            return swappedOrder;
        }

        throw new FormatException("not a recognized frame file: bad magic number " + toHex(magic), 0);
    }

    static ByteOrder swap(ByteOrder order) {
        return order == ByteOrder.BIG_ENDIAN ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN;
    }

    private static String toHex(byte[] bytes) {
        final StringBuilder builder = new StringBuilder("0x");
        for (byte b : bytes) {
            builder.append(String.format("%02x", b & 0xFF));
        }
        return builder.toString();
    }
}
