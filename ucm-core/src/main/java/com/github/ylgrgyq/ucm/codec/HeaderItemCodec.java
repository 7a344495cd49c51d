package com.github.ylgrgyq.ucm.codec;

import com.github.ylgrgyq.ucm.FormatException;
import com.github.ylgrgyq.ucm.UcmException;
import com.github.ylgrgyq.ucm.UnsupportedTypeException;
import com.github.ylgrgyq.ucm.header.HeaderItem;
import com.github.ylgrgyq.ucm.header.HeaderType;
import com.github.ylgrgyq.ucm.io.FrameInput;
import com.github.ylgrgyq.ucm.io.FrameOutput;

import java.io.IOException;

/**
 * The schema of a header item is:
 * <p>
 * Name: String
 * TypeCode: Int32
 * Comment: String
 * Payload: depends on TypeCode, see {@link HeaderType}
 * <p>
 * A String is an Int32 byte count followed by that many bytes.
 */
final class HeaderItemCodec {
    private HeaderItemCodec() {}

    static HeaderItem read(FrameInput in) throws IOException, UcmException {
        final String name = in.readString();

        final long typeCodePosition = in.position();
        final int typeCode = in.readInt();
        final HeaderType type = HeaderType.getTypeByCode(typeCode);
        if (type == null) {
            throw new FormatException("unknown type code: " + typeCode + " for header item: \"" + name + "\"",
                    typeCodePosition);
        }

        final String comment = in.readString();
        if (!type.isSupported()) {
            throw new UnsupportedTypeException(type, "header item: \"" + name + "\" at byte offset: " +
                    typeCodePosition + " has unsupported type: " + type + " (code: " + typeCode + ")");
        }

        return new HeaderItem(name, comment, type.readPayload(in));
    }

    static void write(FrameOutput out, HeaderItem item) throws IOException, UnsupportedTypeException {
        checkSupported(item);

        out.writeString(item.getName());
        out.writeInt(item.getType().getCode());
        out.writeString(item.getComment());
        item.getValue().writePayload(out);
    }

    static void checkSupported(HeaderItem item) throws UnsupportedTypeException {
        final HeaderType type = item.getType();
        if (!type.isSupported()) {
            throw new UnsupportedTypeException(type, "header item: \"" + item.getName() +
                    "\" has unsupported type: " + type + " (code: " + type.getCode() + ")");
        }
    }
}
