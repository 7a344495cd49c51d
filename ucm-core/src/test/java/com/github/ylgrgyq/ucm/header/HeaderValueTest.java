package com.github.ylgrgyq.ucm.header;

import com.github.ylgrgyq.ucm.UnsupportedTypeException;
import com.github.ylgrgyq.ucm.io.FrameInput;
import com.github.ylgrgyq.ucm.io.FrameOutput;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HeaderValueTest {
    private static HeaderValue writeThenRead(HeaderValue value, ByteOrder order) throws Exception {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final FrameOutput output = new FrameOutput(bytes, order, StandardCharsets.ISO_8859_1);
        value.writePayload(output);
        output.flush();

        final FrameInput input = new FrameInput(new ByteArrayInputStream(bytes.toByteArray()), order,
                StandardCharsets.ISO_8859_1, 1024, 1024);
        final HeaderValue read = value.type().readPayload(input);
        assertThat(input.position()).isEqualTo(bytes.size());
        return read;
    }

    @Test
    public void testEveryPayloadReadsBack() throws Exception {
        final List<HeaderValue> values = Arrays.asList(
                HeaderValue.ofDouble(30.0),
                HeaderValue.ofInt(-7),
                HeaderValue.ofUnsignedInt(4294967295L),
                HeaderValue.ofFloat(2.5f),
                HeaderValue.ofString("ULTRACAM"),
                HeaderValue.ofBool(true),
                HeaderValue.ofBool(false),
                HeaderValue.directory(),
                HeaderValue.ofTime(55000, 12.5),
                HeaderValue.ofDoubleVector(new double[]{1.0, -1.0}),
                HeaderValue.ofUnsignedChar(255),
                HeaderValue.ofUnsignedShort(65535),
                HeaderValue.ofIntVector(new int[]{Integer.MIN_VALUE, 0}),
                HeaderValue.ofFloatVector(new float[0]));

        for (HeaderValue value : values) {
            assertThat(writeThenRead(value, ByteOrder.BIG_ENDIAN)).isEqualTo(value);
            assertThat(writeThenRead(value, ByteOrder.LITTLE_ENDIAN)).isEqualTo(value);
        }
    }

    @Test
    public void testTimeValue() {
        final HeaderValue.TimeValue time = (HeaderValue.TimeValue) HeaderValue.ofTime(55000, 23.75);
        assertThat(time.type()).isEqualTo(HeaderType.TIME);
        assertThat(time.mjd()).isEqualTo(55000);
        assertThat(time.hour()).isEqualTo(23.75);
    }

    @Test
    public void testVectorValuesAreCopied() {
        final double[] source = {1.0, 2.0};
        final HeaderValue.DoubleVectorValue value = (HeaderValue.DoubleVectorValue) HeaderValue.ofDoubleVector(source);
        source[0] = 100.0;
        assertThat(value.values()).containsExactly(1.0, 2.0);

        value.values()[1] = 100.0;
        assertThat(value.values()).containsExactly(1.0, 2.0);
        assertThat(value.size()).isEqualTo(2);
    }

    @Test
    public void testUnsignedRanges() {
        assertThatThrownBy(() -> HeaderValue.ofUnsignedChar(256))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HeaderValue.ofUnsignedChar(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HeaderValue.ofUnsignedShort(65536))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HeaderValue.ofUnsignedInt(-1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("value: -1 (expected: [0, 4294967295])");
    }

    @Test
    public void testEquality() {
        assertThat(HeaderValue.ofDouble(1.0)).isEqualTo(HeaderValue.ofDouble(1.0));
        assertThat(HeaderValue.ofDouble(Double.NaN)).isEqualTo(HeaderValue.ofDouble(Double.NaN));
        assertThat(HeaderValue.ofInt(1)).isNotEqualTo(HeaderValue.ofUnsignedInt(1));
        assertThat(HeaderValue.ofFloatVector(new float[]{1f}))
                .isEqualTo(HeaderValue.ofFloatVector(new float[]{1f}))
                .hasSameHashCodeAs(HeaderValue.ofFloatVector(new float[]{1f}));
    }

    @Test
    public void testReservedValue() throws Exception {
        final HeaderValue reserved = HeaderValue.reserved(HeaderType.POSITION);
        assertThat(reserved.type()).isEqualTo(HeaderType.POSITION);

        final FrameOutput output = new FrameOutput(new ByteArrayOutputStream(), ByteOrder.BIG_ENDIAN,
                StandardCharsets.ISO_8859_1);
        assertThatThrownBy(() -> reserved.writePayload(output))
                .isInstanceOf(UnsupportedTypeException.class);
        assertThat(output.position()).isZero();

        assertThatThrownBy(() -> HeaderValue.reserved(HeaderType.DOUBLE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
