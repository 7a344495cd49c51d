package com.github.ylgrgyq.ucm;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class WindowTest {
    @Test
    public void testRowMajorLayout() {
        final Window window = Window.fromRows(10, 20, new float[][]{
                {1f, 2f, 3f},
                {4f, 5f, 6f}
        });
        assertThat(window.nx()).isEqualTo(3);
        assertThat(window.ny()).isEqualTo(2);
        assertThat(window.llx()).isEqualTo(10);
        assertThat(window.lly()).isEqualTo(20);
        assertThat(window.offset()).isEqualTo(new WindowOffset(10, 20));
        assertThat(window.get(2, 0)).isEqualTo(3f);
        assertThat(window.get(0, 1)).isEqualTo(4f);
        assertThat(window.data()).containsExactly(1f, 2f, 3f, 4f, 5f, 6f);
    }

    @Test
    public void testSetWritesThrough() {
        final float[] data = new float[6];
        final Window window = new Window(0, 0, 3, 2, data);
        window.set(1, 1, 7f);
        assertThat(data[4]).isEqualTo(7f);

        data[0] = -1f;
        assertThat(window.get(0, 0)).isEqualTo(-1f);
    }

    @Test
    public void testOutOfBounds() {
        final Window window = new Window(0, 0, 3, 2);
        assertThatThrownBy(() -> window.get(3, 0))
                .isInstanceOf(IndexOutOfBoundsException.class)
                .hasMessage("x: 3 (expected: [0, 3))");
        assertThatThrownBy(() -> window.set(0, -1, 1f))
                .isInstanceOf(IndexOutOfBoundsException.class)
                .hasMessage("y: -1 (expected: [0, 2))");
    }

    @Test
    public void testInvalidShape() {
        assertThatThrownBy(() -> new Window(0, 0, -1, 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("nx: -1 (expected: >= 0)");
        assertThatThrownBy(() -> new Window(0, 0, 2, 2, new float[3]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("data length: 3 (expected: 2 * 2)");
        assertThatThrownBy(() -> Window.fromRows(0, 0, new float[][]{{1f, 2f}, {3f}}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("row 1 length: 1 (expected: 2)");
    }

    @Test
    public void testMinMax() {
        final Window window = Window.fromRows(0, 0, new float[][]{{3f, -2f}, {8.5f, 0f}});
        assertThat(window.min()).isEqualTo(-2f);
        assertThat(window.max()).isEqualTo(8.5f);
    }

    @Test
    public void testEmptyWindow() {
        final Window window = new Window(5, 5, 0, 4);
        assertThat(window.isEmpty()).isTrue();
        assertThat(window.size()).isZero();
        assertThatThrownBy(window::min).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testSameFormat() {
        final Window window = new Window(10, 20, 3, 2);
        assertThat(window.sameFormat(new Window(10, 20, 3, 2, new float[]{1f, 1f, 1f, 1f, 1f, 1f}))).isTrue();
        assertThat(window.sameFormat(new Window(10, 21, 3, 2))).isFalse();
        assertThat(window.sameFormat(new Window(10, 20, 2, 3))).isFalse();
    }
}
