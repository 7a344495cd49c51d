package com.github.ylgrgyq.ucm;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CcdTest {
    @Test
    public void testMinMaxOverWindows() {
        final Ccd ccd = new Ccd(Arrays.asList(
                Window.fromRows(0, 0, new float[][]{{1f, 5f}}),
                new Window(10, 0, 0, 0),
                Window.fromRows(20, 0, new float[][]{{-3f}, {2f}})));
        assertThat(ccd.min()).isEqualTo(-3f);
        assertThat(ccd.max()).isEqualTo(5f);
    }

    @Test
    public void testNoWindowGivesZero() {
        final Ccd ccd = new Ccd(Collections.<Window>emptyList());
        assertThat(ccd.windowCount()).isZero();
        assertThat(ccd.min()).isZero();
        assertThat(ccd.max()).isZero();
    }

    @Test
    public void testOnlyEmptyWindowsGivesZero() {
        final Ccd ccd = new Ccd(Collections.singletonList(new Window(1, 1, 0, 3)));
        assertThat(ccd.min()).isZero();
        assertThat(ccd.max()).isZero();
    }

    @Test
    public void testWindowsAreCopiedAndReadOnly() {
        final List<Window> windows = new ArrayList<>();
        windows.add(new Window(0, 0, 1, 1));
        final Ccd ccd = new Ccd(windows);
        windows.add(new Window(1, 1, 1, 1));

        assertThat(ccd.windowCount()).isEqualTo(1);
        assertThatThrownBy(() -> ccd.windows().add(new Window(2, 2, 1, 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
