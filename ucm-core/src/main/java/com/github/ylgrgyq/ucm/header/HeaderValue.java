package com.github.ylgrgyq.ucm.header;

import com.github.ylgrgyq.ucm.UnsupportedTypeException;
import com.github.ylgrgyq.ucm.io.FrameOutput;

import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * The typed value of a header item. There is one concrete class for each supported
 * {@link HeaderType} and every instance knows its type, so a value can never be written
 * with the payload layout of another type.
 * <p>
 * Unsigned types are widened to the next larger Java type and checked against the range of
 * their wire representation on construction. Vector values copy the arrays they are given
 * and hand out copies.
 */
public abstract class HeaderValue {
    HeaderValue() {}

    public static HeaderValue ofDouble(double value) {
        return new DoubleValue(value);
    }

    public static HeaderValue ofInt(int value) {
        return new IntValue(value);
    }

    public static HeaderValue ofUnsignedInt(long value) {
        return new UnsignedIntValue(value);
    }

    public static HeaderValue ofFloat(float value) {
        return new FloatValue(value);
    }

    public static HeaderValue ofString(String value) {
        return new StringValue(value);
    }

    public static HeaderValue ofBool(boolean value) {
        return new BoolValue(value);
    }

    public static HeaderValue directory() {
        return DirectoryValue.INSTANCE;
    }

    /**
     * Create a time value.
     *
     * @param mjd  integer Modified Julian Day number
     * @param hour hour of the day, normally in [0, 24)
     * @return the new value
     */
    public static HeaderValue ofTime(int mjd, double hour) {
        return new TimeValue(mjd, hour);
    }

    public static HeaderValue ofDoubleVector(double[] values) {
        return new DoubleVectorValue(values);
    }

    public static HeaderValue ofIntVector(int[] values) {
        return new IntVectorValue(values);
    }

    public static HeaderValue ofFloatVector(float[] values) {
        return new FloatVectorValue(values);
    }

    public static HeaderValue ofUnsignedChar(int value) {
        return new UnsignedCharValue(value);
    }

    public static HeaderValue ofUnsignedShort(int value) {
        return new UnsignedShortValue(value);
    }

    /**
     * Create a placeholder for an item of a type reserved by the format but not supported
     * here. It can be stored in a {@link Header}, but writing it fails with
     * {@link UnsupportedTypeException}.
     *
     * @param type an unsupported type
     * @return the placeholder value
     */
    public static HeaderValue reserved(HeaderType type) {
        requireNonNull(type, "type");
        if (type.isSupported()) {
            throw new IllegalArgumentException("type: " + type + " (expected: an unsupported type)");
        }
        return new ReservedValue(type);
    }

    public abstract HeaderType type();

    /**
     * Write the payload of this value, without the name, type code and comment of its item.
     *
     * @param out the output to write to
     * @throws UnsupportedTypeException if the type of this value can not be written
     */
    public abstract void writePayload(FrameOutput out) throws IOException, UnsupportedTypeException;

    public static final class DoubleValue extends HeaderValue {
        private final double value;

        DoubleValue(double value) {
            this.value = value;
        }

        public double value() {
            return value;
        }

        @Override
        public HeaderType type() {
            return HeaderType.DOUBLE;
        }

        @Override
        public void writePayload(FrameOutput out) throws IOException {
            out.writeDouble(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final DoubleValue that = (DoubleValue) o;
            return Double.compare(value, that.value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return "DoubleValue{" + value + '}';
        }
    }

    public static final class IntValue extends HeaderValue {
        private final int value;

        IntValue(int value) {
            this.value = value;
        }

        public int value() {
            return value;
        }

        @Override
        public HeaderType type() {
            return HeaderType.INT;
        }

        @Override
        public void writePayload(FrameOutput out) throws IOException {
            out.writeInt(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final IntValue that = (IntValue) o;
            return value == that.value;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(value);
        }

        @Override
        public String toString() {
            return "IntValue{" + value + '}';
        }
    }

    public static final class UnsignedIntValue extends HeaderValue {
        private final long value;

        UnsignedIntValue(long value) {
            if (value < 0 || value > 0xFFFFFFFFL) {
                throw new IllegalArgumentException("value: " + value + " (expected: [0, 4294967295])");
            }
            this.value = value;
        }

        public long value() {
            return value;
        }

        @Override
        public HeaderType type() {
            return HeaderType.UINT;
        }

        @Override
        public void writePayload(FrameOutput out) throws IOException {
            out.writeUnsignedInt(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final UnsignedIntValue that = (UnsignedIntValue) o;
            return value == that.value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return "UnsignedIntValue{" + value + '}';
        }
    }

    public static final class FloatValue extends HeaderValue {
        private final float value;

        FloatValue(float value) {
            this.value = value;
        }

        public float value() {
            return value;
        }

        @Override
        public HeaderType type() {
            return HeaderType.FLOAT;
        }

        @Override
        public void writePayload(FrameOutput out) throws IOException {
            out.writeFloat(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final FloatValue that = (FloatValue) o;
            return Float.compare(value, that.value) == 0;
        }

        @Override
        public int hashCode() {
            return Float.hashCode(value);
        }

        @Override
        public String toString() {
            return "FloatValue{" + value + '}';
        }
    }

    public static final class StringValue extends HeaderValue {
        private final String value;

        StringValue(String value) {
            this.value = requireNonNull(value, "value");
        }

        public String value() {
            return value;
        }

        @Override
        public HeaderType type() {
            return HeaderType.STRING;
        }

        @Override
        public void writePayload(FrameOutput out) throws IOException {
            out.writeString(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final StringValue that = (StringValue) o;
            return value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "StringValue{'" + value + "'}";
        }
    }

    public static final class BoolValue extends HeaderValue {
        private final boolean value;

        BoolValue(boolean value) {
            this.value = value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public HeaderType type() {
            return HeaderType.BOOL;
        }

        @Override
        public void writePayload(FrameOutput out) throws IOException {
            out.writeUnsignedByte(value ? 1 : 0);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final BoolValue that = (BoolValue) o;
            return value == that.value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return "BoolValue{" + value + '}';
        }
    }

    public static final class DirectoryValue extends HeaderValue {
        static final DirectoryValue INSTANCE = new DirectoryValue();

        private DirectoryValue() {}

        @Override
        public HeaderType type() {
            return HeaderType.DIR;
        }

        @Override
        public void writePayload(FrameOutput out) {
            // directories have no payload
        }

        @Override
        public String toString() {
            return "DirectoryValue{}";
        }
    }

    public static final class TimeValue extends HeaderValue {
        private final int mjd;
        private final double hour;

        TimeValue(int mjd, double hour) {
            this.mjd = mjd;
            this.hour = hour;
        }

        public int mjd() {
            return mjd;
        }

        public double hour() {
            return hour;
        }

        @Override
        public HeaderType type() {
            return HeaderType.TIME;
        }

        @Override
        public void writePayload(FrameOutput out) throws IOException {
            out.writeInt(mjd);
            out.writeDouble(hour);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final TimeValue that = (TimeValue) o;
            return mjd == that.mjd &&
                    Double.compare(hour, that.hour) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(mjd, hour);
        }

        @Override
        public String toString() {
            return "TimeValue{" +
                    "mjd=" + mjd +
                    ", hour=" + hour +
                    '}';
        }
    }

    public static final class DoubleVectorValue extends HeaderValue {
        private final double[] values;

        DoubleVectorValue(double[] values) {
            this.values = requireNonNull(values, "values").clone();
        }

        public double[] values() {
            return values.clone();
        }

        public int size() {
            return values.length;
        }

        @Override
        public HeaderType type() {
            return HeaderType.DVECTOR;
        }

        @Override
        public void writePayload(FrameOutput out) throws IOException {
            out.writeDoubleVector(values);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final DoubleVectorValue that = (DoubleVectorValue) o;
            return Arrays.equals(values, that.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "DoubleVectorValue{" + Arrays.toString(values) + '}';
        }
    }

    public static final class IntVectorValue extends HeaderValue {
        private final int[] values;

        IntVectorValue(int[] values) {
            this.values = requireNonNull(values, "values").clone();
        }

        public int[] values() {
            return values.clone();
        }

        public int size() {
            return values.length;
        }

        @Override
        public HeaderType type() {
            return HeaderType.IVECTOR;
        }

        @Override
        public void writePayload(FrameOutput out) throws IOException {
            out.writeIntVector(values);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final IntVectorValue that = (IntVectorValue) o;
            return Arrays.equals(values, that.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "IntVectorValue{" + Arrays.toString(values) + '}';
        }
    }

    public static final class FloatVectorValue extends HeaderValue {
        private final float[] values;

        FloatVectorValue(float[] values) {
            this.values = requireNonNull(values, "values").clone();
        }

        public float[] values() {
            return values.clone();
        }

        public int size() {
            return values.length;
        }

        @Override
        public HeaderType type() {
            return HeaderType.FVECTOR;
        }

        @Override
        public void writePayload(FrameOutput out) throws IOException {
            out.writeFloatVector(values);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final FloatVectorValue that = (FloatVectorValue) o;
            return Arrays.equals(values, that.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "FloatVectorValue{" + Arrays.toString(values) + '}';
        }
    }

    public static final class UnsignedCharValue extends HeaderValue {
        private final int value;

        UnsignedCharValue(int value) {
            if (value < 0 || value > 0xFF) {
                throw new IllegalArgumentException("value: " + value + " (expected: [0, 255])");
            }
            this.value = value;
        }

        public int value() {
            return value;
        }

        @Override
        public HeaderType type() {
            return HeaderType.UCHAR;
        }

        @Override
        public void writePayload(FrameOutput out) throws IOException {
            out.writeUnsignedByte(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final UnsignedCharValue that = (UnsignedCharValue) o;
            return value == that.value;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(value);
        }

        @Override
        public String toString() {
            return "UnsignedCharValue{" + value + '}';
        }
    }

    public static final class UnsignedShortValue extends HeaderValue {
        private final int value;

        UnsignedShortValue(int value) {
            if (value < 0 || value > 0xFFFF) {
                throw new IllegalArgumentException("value: " + value + " (expected: [0, 65535])");
            }
            this.value = value;
        }

        public int value() {
            return value;
        }

        @Override
        public HeaderType type() {
            return HeaderType.USINT;
        }

        @Override
        public void writePayload(FrameOutput out) throws IOException {
            out.writeUnsignedShort(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final UnsignedShortValue that = (UnsignedShortValue) o;
            return value == that.value;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(value);
        }

        @Override
        public String toString() {
            return "UnsignedShortValue{" + value + '}';
        }
    }

    public static final class ReservedValue extends HeaderValue {
        private final HeaderType type;

        ReservedValue(HeaderType type) {
            this.type = type;
        }

        @Override
        public HeaderType type() {
            return type;
        }

        @Override
        public void writePayload(FrameOutput out) throws UnsupportedTypeException {
            throw new UnsupportedTypeException(type);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final ReservedValue that = (ReservedValue) o;
            return type == that.type;
        }

        @Override
        public int hashCode() {
            return type.hashCode();
        }

        @Override
        public String toString() {
            return "ReservedValue{" + type + '}';
        }
    }
}
