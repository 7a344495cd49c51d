package com.github.ylgrgyq.ucm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The windows read out from one CCD of a frame, in file order. A CCD may have no window.
 */
public final class Ccd {
    private final List<Window> windows;

    public Ccd(List<Window> windows) {
        requireNonNull(windows, "windows");
        for (Window window : windows) {
            requireNonNull(window, "window");
        }

        this.windows = Collections.unmodifiableList(new ArrayList<>(windows));
    }

    public int windowCount() {
        return windows.size();
    }

    public Window window(int index) {
        return windows.get(index);
    }

    public List<Window> windows() {
        return windows;
    }

    /**
     * Returns the minimum pixel value over all the windows of this CCD, or 0 if no window
     * has any pixel.
     *
     * @return the minimum pixel value
     */
    public float min() {
        boolean found = false;
        float min = 0f;
        for (Window window : windows) {
            if (window.isEmpty()) {
                continue;
            }
            min = found ? Math.min(min, window.min()) : window.min();
            found = true;
        }
        return min;
    }

    /**
     * Returns the maximum pixel value over all the windows of this CCD, or 0 if no window
     * has any pixel.
     *
     * @return the maximum pixel value
     */
    public float max() {
        boolean found = false;
        float max = 0f;
        for (Window window : windows) {
            if (window.isEmpty()) {
                continue;
            }
            max = found ? Math.max(max, window.max()) : window.max();
            found = true;
        }
        return max;
    }

    boolean sameFormat(Ccd other) {
        if (windows.size() != other.windows.size()) {
            return false;
        }

        for (int i = 0; i < windows.size(); i++) {
            if (!windows.get(i).sameFormat(other.windows.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Ccd{" +
                "windows=" + windows +
                '}';
    }
}
