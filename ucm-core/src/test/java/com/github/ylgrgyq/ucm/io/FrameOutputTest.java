package com.github.ylgrgyq.ucm.io;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FrameOutputTest {
    @Test
    public void testWriteInBigEndian() throws Exception {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final FrameOutput output = new FrameOutput(bytes, ByteOrder.BIG_ENDIAN, StandardCharsets.ISO_8859_1);
        output.writeInt(0x01020304);
        output.writeUnsignedShort(0xABCD);
        output.writeUnsignedByte(0xEF);
        output.flush();

        assertThat(bytes.toByteArray())
                .containsExactly(0x01, 0x02, 0x03, 0x04, 0xAB, 0xCD, 0xEF);
    }

    @Test
    public void testWriteInLittleEndian() throws Exception {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final FrameOutput output = new FrameOutput(bytes, ByteOrder.LITTLE_ENDIAN, StandardCharsets.ISO_8859_1);
        output.writeInt(0x01020304);
        output.writeUnsignedInt(0xFFFFFFFEL);
        output.flush();

        assertThat(bytes.toByteArray())
                .containsExactly(0x04, 0x03, 0x02, 0x01, 0xFE, 0xFF, 0xFF, 0xFF);
    }

    @Test
    public void testNothingWrittenBeforeFlush() throws Exception {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final FrameOutput output = new FrameOutput(bytes, ByteOrder.BIG_ENDIAN, StandardCharsets.ISO_8859_1);
        output.writeDouble(1.0);

        assertThat(bytes.size()).isZero();
        assertThat(output.position()).isEqualTo(Double.BYTES);

        output.flush();
        assertThat(bytes.size()).isEqualTo(Double.BYTES);
    }

    @Test
    public void testWriteString() throws Exception {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final FrameOutput output = new FrameOutput(bytes, ByteOrder.BIG_ENDIAN, StandardCharsets.UTF_8);
        output.writeString("été");
        output.flush();

        final ByteBuffer written = ByteBuffer.wrap(bytes.toByteArray());
        // the prefix counts bytes, not chars
        assertThat(written.getInt()).isEqualTo(5);
        assertThat(written.remaining()).isEqualTo(5);
    }

    @Test
    public void testUnencodableString() throws Exception {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final FrameOutput output = new FrameOutput(bytes, ByteOrder.BIG_ENDIAN, StandardCharsets.ISO_8859_1);
        assertThatThrownBy(() -> output.writeString("α Cen → B"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ISO-8859-1");
        output.flush();

        assertThat(output.position()).isZero();
        assertThat(bytes.size()).isZero();
        assertThat(FrameOutput.encodeString("α Cen → B", StandardCharsets.UTF_8)).hasSize(12);
    }

    @Test
    public void testWriteMoreThanBuffer() throws Exception {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final FrameOutput output = new FrameOutput(bytes, ByteOrder.BIG_ENDIAN, StandardCharsets.ISO_8859_1);
        final float[] values = new float[FrameInput.CHUNK_SIZE];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        final byte[] raw = new byte[FrameInput.CHUNK_SIZE * 2 + 1];
        raw[raw.length - 1] = 42;

        output.writeFloatVector(values);
        output.writeBytes(raw);
        output.flush();

        final ByteBuffer written = ByteBuffer.wrap(bytes.toByteArray());
        assertThat(written.remaining()).isEqualTo(Integer.BYTES + values.length * Float.BYTES + raw.length);
        assertThat(written.getInt()).isEqualTo(values.length);
        for (float v : values) {
            assertThat(written.getFloat()).isEqualTo(v);
        }
        assertThat(written.get(written.limit() - 1)).isEqualTo((byte) 42);
        assertThat(output.position()).isEqualTo(bytes.size());
    }

    @Test
    public void testOutOfRangeUnsignedValues() {
        final FrameOutput output = new FrameOutput(new ByteArrayOutputStream(), ByteOrder.BIG_ENDIAN,
                StandardCharsets.ISO_8859_1);
        assertThatThrownBy(() -> output.writeUnsignedByte(256))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("value: 256 (expected: [0, 255])");
        assertThatThrownBy(() -> output.writeUnsignedShort(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("value: -1 (expected: [0, 65535])");
        assertThatThrownBy(() -> output.writeUnsignedInt(1L << 32))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testRoundTripWithFrameInput() throws Exception {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final FrameOutput output = new FrameOutput(bytes, ByteOrder.LITTLE_ENDIAN, StandardCharsets.ISO_8859_1);
        output.writeString("Run.Number");
        output.writeIntVector(new int[]{3, 2, 1});
        output.writeDoubleVector(new double[]{0.125});
        output.flush();

        final FrameInput input = new FrameInput(new ByteArrayInputStream(bytes.toByteArray()),
                ByteOrder.LITTLE_ENDIAN, StandardCharsets.ISO_8859_1, 1024, 1024);
        assertThat(input.readString()).isEqualTo("Run.Number");
        assertThat(input.readIntVector()).containsExactly(3, 2, 1);
        assertThat(input.readDoubleVector()).containsExactly(0.125);
    }
}
