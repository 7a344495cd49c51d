package com.github.ylgrgyq.ucm;

import java.util.Objects;

/**
 * Position of the lower-left pixel of a {@link Window} on its CCD.
 */
public final class WindowOffset {
    private final int llx;
    private final int lly;

    public WindowOffset(int llx, int lly) {
        this.llx = llx;
        this.lly = lly;
    }

    public int getLlx() {
        return llx;
    }

    public int getLly() {
        return lly;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final WindowOffset that = (WindowOffset) o;
        return llx == that.llx &&
                lly == that.lly;
    }

    @Override
    public int hashCode() {
        return Objects.hash(llx, lly);
    }

    @Override
    public String toString() {
        return "(" + llx + ", " + lly + ")";
    }
}
