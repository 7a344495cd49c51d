package com.github.ylgrgyq.ucm;

import com.github.ylgrgyq.ucm.header.Header;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An ULTRACAM frame: a header plus the windows of each of its CCDs.
 * <p>
 * The binning factors and the total extent are the same for every window of a frame. The
 * number of CCDs, of windows and the window shapes are fixed once a frame is built, while
 * pixel values and header items can be changed in place.
 * <p>
 * {@link #equals(Object)} is identity. Use {@link #sameFormat(Frame)} to check that two
 * frames share the same layout.
 */
public final class Frame {
    private final Header header;
    private final List<Ccd> ccds;
    private final int xbin;
    private final int ybin;
    private final int nxtot;
    private final int nytot;

    /**
     * Create a frame. Neither the header nor the windows are copied.
     *
     * @param header the header of the frame
     * @param ccds   the CCDs of the frame, in file order
     * @param xbin   binning factor in X
     * @param ybin   binning factor in Y
     * @param nxtot  total number of unbinned columns of a CCD
     * @param nytot  total number of unbinned rows of a CCD
     */
    public Frame(Header header, List<Ccd> ccds, int xbin, int ybin, int nxtot, int nytot) {
        requireNonNull(header, "header");
        requireNonNull(ccds, "ccds");
        for (Ccd ccd : ccds) {
            requireNonNull(ccd, "ccd");
        }
        checkPositive("xbin", xbin);
        checkPositive("ybin", ybin);
        checkPositive("nxtot", nxtot);
        checkPositive("nytot", nytot);

        this.header = header;
        this.ccds = Collections.unmodifiableList(new ArrayList<>(ccds));
        this.xbin = xbin;
        this.ybin = ybin;
        this.nxtot = nxtot;
        this.nytot = nytot;
    }

    public Header header() {
        return header;
    }

    public List<Ccd> ccds() {
        return ccds;
    }

    public Ccd ccd(int ccd) {
        return ccds.get(ccd);
    }

    public int ccdCount() {
        return ccds.size();
    }

    public int windowCount(int ccd) {
        return ccds.get(ccd).windowCount();
    }

    public Window window(int ccd, int index) {
        return ccds.get(ccd).window(index);
    }

    public WindowOffset offset(int ccd, int index) {
        return window(ccd, index).offset();
    }

    public int getXbin() {
        return xbin;
    }

    public int getYbin() {
        return ybin;
    }

    public int getNxtot() {
        return nxtot;
    }

    public int getNytot() {
        return nytot;
    }

    /**
     * Returns the minimum pixel value of a CCD, or 0 if it has no pixel.
     *
     * @param ccd index of the CCD, starting from 0
     * @return the minimum pixel value
     */
    public float min(int ccd) {
        return ccds.get(ccd).min();
    }

    /**
     * Returns the maximum pixel value of a CCD, or 0 if it has no pixel.
     *
     * @param ccd index of the CCD, starting from 0
     * @return the maximum pixel value
     */
    public float max(int ccd) {
        return ccds.get(ccd).max();
    }

    /**
     * Returns true if {@code other} has the same layout as this frame: the same number of
     * CCDs, the same number of windows on each CCD, windows of the same shape at the same
     * offsets, and the same binning factors and total extent. Headers and pixel values are
     * not compared.
     *
     * @param other the frame to compare with
     * @return true if both frames have the same layout
     */
    public boolean sameFormat(Frame other) {
        requireNonNull(other, "other");

        if (xbin != other.xbin || ybin != other.ybin) {
            return false;
        }
        if (nxtot != other.nxtot || nytot != other.nytot) {
            return false;
        }
        if (ccds.size() != other.ccds.size()) {
            return false;
        }

        for (int i = 0; i < ccds.size(); i++) {
            if (!ccds.get(i).sameFormat(other.ccds.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Frame{" +
                "headerItems=" + header.count() +
                ", ccds=" + ccds.size() +
                ", xbin=" + xbin +
                ", ybin=" + ybin +
                ", nxtot=" + nxtot +
                ", nytot=" + nytot +
                '}';
    }

    private static void checkPositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + ": " + value + " (expected: > 0)");
        }
    }
}
