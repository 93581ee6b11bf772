package io.github.chirino.checkin.archive;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Iterator;
import java.util.Optional;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;

/**
 * Decodes an image with ImageIO and re-encodes it as a JPEG no larger than a bounding box. Images
 * are only ever shrunk, transparency is flattened onto white, and images whose header declares
 * more than {@code maxPixels} are refused before any pixel data is decoded.
 */
public class ImageRenderer {

    public static final String DATA_URI_PREFIX = "data:image/jpeg;base64,";

    static final long DEFAULT_MAX_PIXELS = 40_000_000L;

    private final long maxPixels;

    public ImageRenderer() {
        this(DEFAULT_MAX_PIXELS);
    }

    public ImageRenderer(long maxPixels) {
        this.maxPixels = maxPixels;
    }

    /** Returns whether ImageIO can decode {@code data} at all. */
    public boolean isDecodable(byte[] data) {
        try {
            return decode(data) != null;
        } catch (IOException | RuntimeException e) {
            return false;
        }
    }

    /** Decodable by ImageIO, or a RIFF/WEBP container (which ImageIO cannot decode). */
    public boolean isImage(byte[] data) {
        return isWebp(data) || isDecodable(data);
    }

    static boolean isWebp(byte[] data) {
        return data.length >= 12
                && data[0] == 'R'
                && data[1] == 'I'
                && data[2] == 'F'
                && data[3] == 'F'
                && data[8] == 'W'
                && data[9] == 'E'
                && data[10] == 'B'
                && data[11] == 'P';
    }

    /** Renders {@code data} as a JPEG fitting {@code maxDim}x{@code maxDim}. */
    public Optional<byte[]> renderJpeg(byte[] data, int maxDim, float quality) {
        try {
            BufferedImage source = decode(data);
            if (source == null) {
                return Optional.empty();
            }
            return Optional.of(encodeJpeg(scale(source, maxDim), quality));
        } catch (IOException | RuntimeException e) {
            return Optional.empty();
        }
    }

    public Optional<String> renderDataUri(byte[] data, int maxDim, float quality) {
        return renderJpeg(data, maxDim, quality).map(ImageRenderer::toDataUri);
    }

    public static String toDataUri(byte[] jpeg) {
        return DATA_URI_PREFIX + Base64.getEncoder().encodeToString(jpeg);
    }

    private BufferedImage decode(byte[] data) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            if (in == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                long pixels = (long) reader.getWidth(0) * reader.getHeight(0);
                if (pixels <= 0 || pixels > maxPixels) {
                    throw new IOException("Image dimensions out of range");
                }
                return reader.read(0);
            } finally {
                reader.dispose();
            }
        }
    }

    private static BufferedImage scale(BufferedImage source, int maxDim) {
        int width = source.getWidth();
        int height = source.getHeight();
        double ratio = Math.min(1.0, Math.min((double) maxDim / width, (double) maxDim / height));
        int targetWidth = Math.max(1, (int) Math.round(width * ratio));
        int targetHeight = Math.max(1, (int) Math.round(height * ratio));

        BufferedImage target =
                new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(
                    RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, targetWidth, targetHeight);
            g.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    private static byte[] encodeJpeg(BufferedImage image, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }
}
