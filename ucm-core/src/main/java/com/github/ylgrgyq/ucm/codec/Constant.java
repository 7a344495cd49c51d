package com.github.ylgrgyq.ucm.codec;

final class Constant {
    // First 4 bytes of every ucm file, in the byte order of the whole file
    static final int kMagicNumber = 47561009;

    // Values of the per window "iout" field which tells how pixels are stored
    static final int kFloatPixels = 0;
    static final int kUnsignedShortPixels = 1;

    static final String kFileSuffix = ".ucm";

    static final int kDefaultMaxStringLength = 1024 * 1024;
    static final int kDefaultMaxVectorLength = 16 * 1024 * 1024;
    static final int kDefaultMaxWindowPixels = 64 * 1024 * 1024;
}
