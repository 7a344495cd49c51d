package com.github.ylgrgyq.ucm.codec;

import com.github.ylgrgyq.ucm.Ccd;
import com.github.ylgrgyq.ucm.FormatException;
import com.github.ylgrgyq.ucm.Frame;
import com.github.ylgrgyq.ucm.UcmException;
import com.github.ylgrgyq.ucm.Window;
import com.github.ylgrgyq.ucm.header.Header;
import com.github.ylgrgyq.ucm.header.HeaderItem;
import com.github.ylgrgyq.ucm.header.HeaderValue;
import com.github.ylgrgyq.ucm.io.FrameInput;
import com.github.ylgrgyq.ucm.io.FrameOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Reads and writes ULTRACAM frames in the ucm binary format.
 * <p>
 * The layout of a frame is, with every multi-byte field in the byte order of the frame:
 * <pre>
 * Magic: Int32 (47561009)
 * HeaderItemCount: Int32
 * HeaderItems: HeaderItemCount items, see {@link HeaderItemCodec}
 * CcdCount: Int32
 * for each CCD:
 *     WindowCount: Int32
 *     for each window:
 *         llx, lly, nx, ny, xbin, ybin, nxtot, nytot: Int32 each
 *         iout: Int32 (0 for float32 pixels, 1 for uint16 pixels)
 *         Pixels: nx * ny pixels, row by row
 * </pre>
 * The byte order of a frame is found from its magic number when reading. Binning factors and
 * total extent are repeated in every window on the wire but held once per {@link Frame}; the
 * values of the last window read are kept. Frames are always written with float32 pixels.
 * <p>
 * Any error aborts the whole operation, no partially read frame is ever returned. Methods
 * taking a stream never close it, methods taking a {@link Path} always close the file they
 * open. A {@link FrameCodec} has no mutable state and can be shared between threads.
 */
public final class FrameCodec {
    private static final Logger logger = LoggerFactory.getLogger(FrameCodec.class);
    private static final FrameCodec defaultCodec = FrameCodecBuilder.newBuilder().build();

    /**
     * Returns a {@link FrameCodec} with the default settings of {@link FrameCodecBuilder}.
     *
     * @return the default {@link FrameCodec}
     */
    public static FrameCodec defaultCodec() {
        return defaultCodec;
    }

    private final ByteOrder byteOrder;
    private final Charset charset;
    private final boolean appendFileSuffix;
    private final int maxStringLength;
    private final int maxVectorLength;
    private final int maxWindowPixels;

    FrameCodec(FrameCodecBuilder builder) {
        this.byteOrder = builder.getByteOrder();
        this.charset = builder.getCharset();
        this.appendFileSuffix = builder.appendFileSuffix();
        this.maxStringLength = builder.getMaxStringLength();
        this.maxVectorLength = builder.getMaxVectorLength();
        this.maxWindowPixels = builder.getMaxWindowPixels();
    }

    /**
     * Read a frame from a file.
     *
     * @param path the file to read, opened by its name as given
     * @return the frame read
     * @throws FormatException if the file is not a well formed ucm frame
     * @throws com.github.ylgrgyq.ucm.UnsupportedTypeException if the header has an item of
     *                                                         an unsupported type
     * @throws IOException if the file can not be read
     */
    public Frame read(Path path) throws IOException, UcmException {
        requireNonNull(path, "path");

        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            final Frame frame = decode(in);
            logger.debug("Read {} from {}", frame, path);
            return frame;
        }
    }

    /**
     * Write a frame to a file, replacing the file if it exists.
     *
     * @param frame the frame to write
     * @param path  the file to write. ".ucm" is appended to its name if needed and if
     *              {@link FrameCodecBuilder#appendFileSuffix(boolean)} is set
     * @return the path of the written file
     * @throws com.github.ylgrgyq.ucm.UnsupportedTypeException if the header has an item of
     *                                                         an unsupported type, in which
     *                                                         case the file is not touched
     * @throws IllegalArgumentException if the frame can not be read back by this codec, see
     *                                  {@link #encode(Frame, OutputStream)}. The file is not
     *                                  touched either
     * @throws IOException if the file can not be written
     */
    public Path write(Frame frame, Path path) throws IOException, UcmException {
        requireNonNull(frame, "frame");
        requireNonNull(path, "path");

        checkEncodable(frame);

        final Path target = resolve(path);
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target))) {
            encode(frame, out);
        }
        logger.debug("Wrote {} to {}", frame, target);
        return target;
    }

    public Frame decode(byte[] bytes) throws IOException, UcmException {
        requireNonNull(bytes, "bytes");
        return decode(new ByteArrayInputStream(bytes));
    }

    /**
     * Read a frame from {@code in}. The stream is read up to the end of the frame and is not
     * closed.
     *
     * @param in the stream to read
     * @return the frame read
     * @throws FormatException if the stream is not a well formed ucm frame
     * @throws com.github.ylgrgyq.ucm.UnsupportedTypeException if the header has an item of
     *                                                         an unsupported type
     * @throws IOException if the stream fails
     */
    public Frame decode(InputStream in) throws IOException, UcmException {
        requireNonNull(in, "in");

        final FrameInput magicInput = new FrameInput(in, ByteOrder.nativeOrder(), charset,
                maxStringLength, maxVectorLength);
        final ByteOrder order = ByteOrderDetector.detect(magicInput.readBytes(Integer.BYTES));
        final FrameInput input = magicInput.withOrder(order);

        final Header header = readHeader(input);
        final WindowReader reader = new WindowReader(input);
        final List<Ccd> ccds = reader.readCcds();
        final Frame frame = reader.newFrame(header, ccds);

        logger.debug("Decoded {} in {} byte order from {} bytes", frame, order, input.position());
        return frame;
    }

    public byte[] encode(Frame frame) throws IOException, UcmException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        encode(frame, out);
        return out.toByteArray();
    }

    /**
     * Write a frame to {@code out} and flush it. The stream is not closed.
     * <p>
     * Only frames this codec can decode again are written: every string must be encodable in
     * the configured charset and every string, vector and window must be within the limits
     * set on {@link FrameCodecBuilder}. Everything is checked before the first byte is
     * written.
     *
     * @param frame the frame to write
     * @param out   the stream to write to
     * @throws com.github.ylgrgyq.ucm.UnsupportedTypeException if the header has an item of
     *                                                         an unsupported type, in which
     *                                                         case nothing is written
     * @throws IllegalArgumentException if a string can not be encoded exactly or if a string,
     *                                  a vector or a window exceeds its limit, in which case
     *                                  nothing is written
     * @throws IOException if the stream fails
     */
    public void encode(Frame frame, OutputStream out) throws IOException, UcmException {
        requireNonNull(frame, "frame");
        requireNonNull(out, "out");

        final Header header = frame.header();
        checkEncodable(frame);

        final FrameOutput output = new FrameOutput(out, byteOrder, charset);
        output.writeInt(Constant.kMagicNumber);

        output.writeInt(header.count());
        for (HeaderItem item : header.items()) {
            HeaderItemCodec.write(output, item);
        }

        output.writeInt(frame.ccdCount());
        for (Ccd ccd : frame.ccds()) {
            output.writeInt(ccd.windowCount());
            for (Window window : ccd.windows()) {
                output.writeInt(window.llx());
                output.writeInt(window.lly());
                output.writeInt(window.nx());
                output.writeInt(window.ny());
                output.writeInt(frame.getXbin());
                output.writeInt(frame.getYbin());
                output.writeInt(frame.getNxtot());
                output.writeInt(frame.getNytot());
                output.writeInt(Constant.kFloatPixels);
                output.writeFloats(window.data());
            }
        }
        output.flush();

        logger.debug("Encoded {} in {} byte order to {} bytes", frame, byteOrder, output.position());
    }

    private Header readHeader(FrameInput input) throws IOException, UcmException {
        final int count = input.readCount("header item count", Integer.MAX_VALUE);
        final Header header = new Header();
        for (int i = 0; i < count; i++) {
            final long itemPosition = input.position();
            final HeaderItem item = HeaderItemCodec.read(input);
            if (header.set(item) != null) {
                logger.warn("Header item \"{}\" at byte offset {} replaces a previous item with the same name.",
                        item.getName(), itemPosition);
            }
        }
        return header;
    }

    private void checkEncodable(Frame frame) throws UcmException {
        for (HeaderItem item : frame.header().items()) {
            HeaderItemCodec.checkSupported(item);
            checkString(item, "name", item.getName());
            checkString(item, "comment", item.getComment());

            final HeaderValue value = item.getValue();
            if (value instanceof HeaderValue.StringValue) {
                checkString(item, "value", ((HeaderValue.StringValue) value).value());
            } else if (value instanceof HeaderValue.DoubleVectorValue) {
                checkVector(item, ((HeaderValue.DoubleVectorValue) value).size());
            } else if (value instanceof HeaderValue.IntVectorValue) {
                checkVector(item, ((HeaderValue.IntVectorValue) value).size());
            } else if (value instanceof HeaderValue.FloatVectorValue) {
                checkVector(item, ((HeaderValue.FloatVectorValue) value).size());
            }
        }

        for (int nc = 0; nc < frame.ccdCount(); nc++) {
            for (int nw = 0; nw < frame.windowCount(nc); nw++) {
                final Window window = frame.window(nc, nw);
                if (window.size() > maxWindowPixels) {
                    throw new IllegalArgumentException("window " + nw + " of CCD " + nc + " pixels: " +
                            window.size() + " (expected: <= " + maxWindowPixels + ")");
                }
            }
        }
    }

    private void checkString(HeaderItem item, String what, String value) {
        final int length;
        try {
            length = FrameOutput.encodeString(value, charset).length;
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("header item: \"" + item.getName() + "\" has a " + what +
                    " which can not be encoded in " + charset, ex);
        }
        if (length > maxStringLength) {
            throw new IllegalArgumentException("header item: \"" + item.getName() + "\" " + what + " length: " +
                    length + " (expected: <= " + maxStringLength + ")");
        }
    }

    private void checkVector(HeaderItem item, int size) {
        if (size > maxVectorLength) {
            throw new IllegalArgumentException("header item: \"" + item.getName() + "\" vector length: " + size +
                    " (expected: <= " + maxVectorLength + ")");
        }
    }

    private Path resolve(Path path) {
        final Path fileName = path.getFileName();
        if (!appendFileSuffix || fileName == null || fileName.toString().endsWith(Constant.kFileSuffix)) {
            return path;
        }
        return path.resolveSibling(fileName.toString() + Constant.kFileSuffix);
    }

    /**
     * Reads the CCD and window part of a frame, remembering the binning of the last window.
     */
    private final class WindowReader {
        private final FrameInput input;
        @Nullable
        private Binning binning;
        private long binningPosition = -1;
        private boolean binningMismatchLogged;

        WindowReader(FrameInput input) {
            this.input = input;
        }

        List<Ccd> readCcds() throws IOException, FormatException {
            final int ccdCount = input.readCount("CCD count", Integer.MAX_VALUE);
            final List<Ccd> ccds = new ArrayList<>();
            for (int nc = 0; nc < ccdCount; nc++) {
                final int windowCount = input.readCount("window count", Integer.MAX_VALUE);
                final List<Window> windows = new ArrayList<>();
                for (int nw = 0; nw < windowCount; nw++) {
                    windows.add(readWindow(nc, nw));
                }
                ccds.add(new Ccd(windows));
            }
            return ccds;
        }

        Frame newFrame(Header header, List<Ccd> ccds) throws FormatException {
            if (binning == null) {
                // no window on the wire, so no binning either
                return new Frame(header, ccds, 1, 1, 1, 1);
            }

            if (binning.xbin <= 0 || binning.ybin <= 0 || binning.nxtot <= 0 || binning.nytot <= 0) {
                throw new FormatException("invalid binning: " + binning + " (expected: all > 0)", binningPosition);
            }
            return new Frame(header, ccds, binning.xbin, binning.ybin, binning.nxtot, binning.nytot);
        }

        private Window readWindow(int nc, int nw) throws IOException, FormatException {
            final long windowPosition = input.position();
            final int llx = input.readInt();
            final int lly = input.readInt();
            final int nx = input.readCount("window nx", Integer.MAX_VALUE);
            final int ny = input.readCount("window ny", Integer.MAX_VALUE);
            final Binning windowBinning = new Binning(input.readInt(), input.readInt(), input.readInt(), input.readInt());
            updateBinning(windowBinning, windowPosition, nc, nw);

            final long pixels = (long) nx * ny;
            if (pixels > maxWindowPixels) {
                throw new FormatException("too many pixels in window " + nw + " of CCD " + nc + ": " + nx + " * " + ny +
                        " (expected: <= " + maxWindowPixels + ")", windowPosition);
            }

            final long ioutPosition = input.position();
            final int iout = input.readInt();
            final float[] data;
            switch (iout) {
                case Constant.kFloatPixels:
                    data = input.readFloats((int) pixels);
                    break;
                case Constant.kUnsignedShortPixels:
                    data = input.readUnsignedShortsAsFloats((int) pixels);
                    break;
                default:
                    throw new FormatException("unrecognised pixel encoding iout: " + iout + " in window " + nw +
                            " of CCD " + nc, ioutPosition);
            }

            return new Window(llx, lly, nx, ny, data);
        }

        private void updateBinning(Binning windowBinning, long windowPosition, int nc, int nw) {
            if (binning != null && !binning.equals(windowBinning) && !binningMismatchLogged) {
                logger.warn("Window {} of CCD {} has binning {} but a previous window has {}. " +
                        "Binning of the last window is kept.", nw, nc, windowBinning, binning);
                binningMismatchLogged = true;
            }
            binning = windowBinning;
            binningPosition = windowPosition;
        }
    }

    private static final class Binning {
        private final int xbin;
        private final int ybin;
        private final int nxtot;
        private final int nytot;

        Binning(int xbin, int ybin, int nxtot, int nytot) {
            this.xbin = xbin;
            this.ybin = ybin;
            this.nxtot = nxtot;
            this.nytot = nytot;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final Binning that = (Binning) o;
            return xbin == that.xbin &&
                    ybin == that.ybin &&
                    nxtot == that.nxtot &&
                    nytot == that.nytot;
        }

        @Override
        public int hashCode() {
            return Objects.hash(xbin, ybin, nxtot, nytot);
        }

        @Override
        public String toString() {
            return "{xbin=" + xbin +
                    ", ybin=" + ybin +
                    ", nxtot=" + nxtot +
                    ", nytot=" + nytot +
                    '}';
        }
    }
}
