package com.github.ylgrgyq.ucm.header;

import com.github.ylgrgyq.ucm.UcmException;
import com.github.ylgrgyq.ucm.UnsupportedTypeException;
import com.github.ylgrgyq.ucm.io.FrameInput;

import javax.annotation.Nullable;
import java.io.IOException;

/**
 * The closed set of header item types of the ucm format, with their codes on the wire.
 * <p>
 * Every constant reads its own payload, so a constant without a reader does not compile.
 * Types marked as unsupported are reserved by the format but have no known payload layout;
 * reading or writing them fails with {@link UnsupportedTypeException}.
 */
public enum HeaderType {
    DOUBLE(0, true) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws IOException, UcmException {
            return HeaderValue.ofDouble(in.readDouble());
        }
    },

    CHAR(1, false) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws UnsupportedTypeException {
            throw new UnsupportedTypeException(this);
        }
    },

    INT(2, true) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws IOException, UcmException {
            return HeaderValue.ofInt(in.readInt());
        }
    },

    UINT(3, true) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws IOException, UcmException {
            return HeaderValue.ofUnsignedInt(in.readUnsignedInt());
        }
    },

    LINT(4, false) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws UnsupportedTypeException {
            throw new UnsupportedTypeException(this);
        }
    },

    ULINT(5, false) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws UnsupportedTypeException {
            throw new UnsupportedTypeException(this);
        }
    },

    FLOAT(6, true) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws IOException, UcmException {
            return HeaderValue.ofFloat(in.readFloat());
        }
    },

    STRING(7, true) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws IOException, UcmException {
            return HeaderValue.ofString(in.readString());
        }
    },

    BOOL(8, true) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws IOException, UcmException {
            return HeaderValue.ofBool(in.readUnsignedByte() != 0);
        }
    },

    // a directory has no payload, it only groups the items named under it
    DIR(9, true) {
        @Override
        public HeaderValue readPayload(FrameInput in) {
            return HeaderValue.directory();
        }
    },

    DATE(10, false) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws UnsupportedTypeException {
            throw new UnsupportedTypeException(this);
        }
    },

    TIME(11, true) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws IOException, UcmException {
            final int mjd = in.readInt();
            final double hour = in.readDouble();
            return HeaderValue.ofTime(mjd, hour);
        }
    },

    POSITION(12, false) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws UnsupportedTypeException {
            throw new UnsupportedTypeException(this);
        }
    },

    DVECTOR(13, true) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws IOException, UcmException {
            return HeaderValue.ofDoubleVector(in.readDoubleVector());
        }
    },

    UCHAR(14, true) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws IOException, UcmException {
            return HeaderValue.ofUnsignedChar(in.readUnsignedByte());
        }
    },

    TELESCOPE(15, false) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws UnsupportedTypeException {
            throw new UnsupportedTypeException(this);
        }
    },

    USINT(16, true) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws IOException, UcmException {
            return HeaderValue.ofUnsignedShort(in.readUnsignedShort());
        }
    },

    IVECTOR(17, true) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws IOException, UcmException {
            return HeaderValue.ofIntVector(in.readIntVector());
        }
    },

    FVECTOR(18, true) {
        @Override
        public HeaderValue readPayload(FrameInput in) throws IOException, UcmException {
            return HeaderValue.ofFloatVector(in.readFloatVector());
        }
    };

    private static final HeaderType[] typesByCode;

    static {
        final HeaderType[] types = values();
        typesByCode = new HeaderType[types.length];
        for (HeaderType type : types) {
            assert typesByCode[type.code] == null : "duplicate code: " + type.code;
            typesByCode[type.code] = type;
        }
    }

    private final int code;
    private final boolean supported;

    HeaderType(int code, boolean supported) {
        this.code = code;
        this.supported = supported;
    }

    public int getCode() {
        return code;
    }

    public boolean isSupported() {
        return supported;
    }

    /**
     * Read the payload of an item of this type. The name, type code and comment of the item
     * must have been consumed already.
     *
     * @param in the input positioned at the start of the payload
     * @return the value of the item
     * @throws UnsupportedTypeException if this type is reserved but not supported
     */
    public abstract HeaderValue readPayload(FrameInput in) throws IOException, UcmException;

    @Nullable
    public static HeaderType getTypeByCode(int code) {
        if (code < 0 || code >= typesByCode.length) {
            return null;
        }
        return typesByCode[code];
    }
}
