package com.github.ylgrgyq.ucm.codec;

import com.github.ylgrgyq.ucm.FormatException;
import org.junit.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ByteOrderDetectorTest {
    private static byte[] magic(ByteOrder order) {
        return ByteBuffer.allocate(4).order(order).putInt(Constant.kMagicNumber).array();
    }

    @Test
    public void testDetectBothOrders() throws Exception {
        assertThat(ByteOrderDetector.detect(magic(ByteOrder.BIG_ENDIAN))).isEqualTo(ByteOrder.BIG_ENDIAN);
        assertThat(ByteOrderDetector.detect(magic(ByteOrder.LITTLE_ENDIAN))).isEqualTo(ByteOrder.LITTLE_ENDIAN);
    }

    @Test
    public void testNativeOrderFirst() throws Exception {
        assertThat(ByteOrderDetector.detect(magic(ByteOrder.nativeOrder()))).isEqualTo(ByteOrder.nativeOrder());
    }

    @Test
    public void testBadMagic() {
        assertThatThrownBy(() -> ByteOrderDetector.detect(new byte[]{0x01, 0x02, 0x03, 0x04}))
                .isInstanceOf(FormatException.class)
                .hasMessageContaining("bad magic number 0x01020304");
    }

    @Test
    public void testWrongLength() {
        assertThatThrownBy(() -> ByteOrderDetector.detect(new byte[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testSwap() {
        assertThat(ByteOrderDetector.swap(ByteOrder.BIG_ENDIAN)).isEqualTo(ByteOrder.LITTLE_ENDIAN);
        assertThat(ByteOrderDetector.swap(ByteOrder.LITTLE_ENDIAN)).isEqualTo(ByteOrder.BIG_ENDIAN);
    }
}
