package com.github.ylgrgyq.ucm;

import static java.util.Objects.requireNonNull;

/**
 * A rectangular region of pixels read out from a CCD.
 * <p>
 * Pixels are held row by row in a {@code float[]} of {@code ny * nx} elements, so the
 * pixel at column {@code x} and row {@code y} is at index {@code y * nx + x}. The shape of
 * a window is fixed at construction, its pixel values can be changed in place.
 */
public final class Window {
    private final WindowOffset offset;
    private final int nx;
    private final int ny;
    private final float[] data;

    /**
     * Create a window with all its pixels set to zero.
     *
     * @param llx X of the lower-left pixel
     * @param lly Y of the lower-left pixel
     * @param nx  number of columns
     * @param ny  number of rows
     */
    public Window(int llx, int lly, int nx, int ny) {
        this(llx, lly, nx, ny, new float[checkedSize(nx, ny)]);
    }

    /**
     * Create a window backed by {@code data}. The array is not copied, changes made to it
     * are visible through this window.
     *
     * @param llx  X of the lower-left pixel
     * @param lly  Y of the lower-left pixel
     * @param nx   number of columns
     * @param ny   number of rows
     * @param data the pixels, row by row
     */
    public Window(int llx, int lly, int nx, int ny, float[] data) {
        requireNonNull(data, "data");
        if (data.length != checkedSize(nx, ny)) {
            throw new IllegalArgumentException("data length: " + data.length + " (expected: " + nx + " * " + ny + ")");
        }

        this.offset = new WindowOffset(llx, lly);
        this.nx = nx;
        this.ny = ny;
        this.data = data;
    }

    /**
     * Create a window from an array of rows, all of the same length. The pixels are copied.
     *
     * @param llx  X of the lower-left pixel
     * @param lly  Y of the lower-left pixel
     * @param rows {@code rows[y][x]} is the pixel at column x and row y
     * @return the new window
     */
    public static Window fromRows(int llx, int lly, float[][] rows) {
        requireNonNull(rows, "rows");

        final int ny = rows.length;
        final int nx = ny == 0 ? 0 : rows[0].length;
        final float[] data = new float[checkedSize(nx, ny)];
        for (int y = 0; y < ny; y++) {
            if (rows[y].length != nx) {
                throw new IllegalArgumentException("row " + y + " length: " + rows[y].length + " (expected: " + nx + ")");
            }
            System.arraycopy(rows[y], 0, data, y * nx, nx);
        }
        return new Window(llx, lly, nx, ny, data);
    }

    public int nx() {
        return nx;
    }

    public int ny() {
        return ny;
    }

    public int llx() {
        return offset.getLlx();
    }

    public int lly() {
        return offset.getLly();
    }

    public WindowOffset offset() {
        return offset;
    }

    public int size() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    public float get(int x, int y) {
        return data[index(x, y)];
    }

    public void set(int x, int y, float value) {
        data[index(x, y)] = value;
    }

    /**
     * Returns the array backing this window, row by row. Writes to it change the window.
     *
     * @return the pixels of this window
     */
    public float[] data() {
        return data;
    }

    /**
     * Returns true if {@code other} has the same shape and the same offset as this window.
     * Pixel values are not compared.
     *
     * @param other the window to compare with
     * @return true if both windows cover the same region
     */
    public boolean sameFormat(Window other) {
        requireNonNull(other, "other");
        return nx == other.nx &&
                ny == other.ny &&
                offset.equals(other.offset);
    }

    public float min() {
        if (isEmpty()) {
            throw new IllegalStateException("window has no pixels");
        }

        float min = data[0];
        for (int i = 1; i < data.length; i++) {
            min = Math.min(min, data[i]);
        }
        return min;
    }

    public float max() {
        if (isEmpty()) {
            throw new IllegalStateException("window has no pixels");
        }

        float max = data[0];
        for (int i = 1; i < data.length; i++) {
            max = Math.max(max, data[i]);
        }
        return max;
    }

    @Override
    public String toString() {
        return "Window{" +
                "offset=" + offset +
                ", nx=" + nx +
                ", ny=" + ny +
                '}';
    }

    private int index(int x, int y) {
        if (x < 0 || x >= nx) {
            throw new IndexOutOfBoundsException("x: " + x + " (expected: [0, " + nx + "))");
        }
        if (y < 0 || y >= ny) {
            throw new IndexOutOfBoundsException("y: " + y + " (expected: [0, " + ny + "))");
        }
        return y * nx + x;
    }

    private static int checkedSize(int nx, int ny) {
        if (nx < 0) {
            throw new IllegalArgumentException("nx: " + nx + " (expected: >= 0)");
        }
        if (ny < 0) {
            throw new IllegalArgumentException("ny: " + ny + " (expected: >= 0)");
        }

        final long size = (long) nx * ny;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("nx * ny: " + size + " (expected: <= " + Integer.MAX_VALUE + ")");
        }
        return (int) size;
    }
}
