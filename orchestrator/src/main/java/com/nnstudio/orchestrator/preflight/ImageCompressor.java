package com.nnstudio.orchestrator.preflight;

import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;

/**
 * Re-encodes reference images as JPEG with the longest edge capped,
 * so reference bytes sent with every batch item stay small.
 */
@Component
public class ImageCompressor {

    public static final int   DEFAULT_MAX_EDGE = 1024;
    public static final float DEFAULT_QUALITY  = 0.75f;

    private static final Set<String> COMPRESSIBLE = Set.of("jpg", "jpeg", "png", "webp");

    private final int   maxEdge;
    private final float quality;

    public ImageCompressor() {
        this(DEFAULT_MAX_EDGE, DEFAULT_QUALITY);
    }

    public ImageCompressor(int maxEdge, float quality) {
        this.maxEdge = maxEdge;
        this.quality = quality;
    }

    public static boolean isCompressible(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && COMPRESSIBLE.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * @return JPEG bytes of the resized image
     * @throws IOException if the file cannot be decoded (e.g. WebP without a plugin)
     */
    public byte[] compress(Path path) throws IOException {
        BufferedImage source = ImageIO.read(path.toFile());
        if (source == null) {
            throw new IOException("No image reader for " + path.getFileName());
        }
        BufferedImage scaled = scale(source);

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
            writer.write(null, new IIOImage(scaled, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    // JPEG has no alpha; always redraw onto an RGB canvas
    private BufferedImage scale(BufferedImage source) {
        int w = source.getWidth();
        int h = source.getHeight();
        double factor = Math.min(1.0, (double) maxEdge / Math.max(w, h));
        int tw = Math.max(1, (int) Math.round(w * factor));
        int th = Math.max(1, (int) Math.round(h * factor));

        BufferedImage target = new BufferedImage(tw, th, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(source, 0, 0, tw, th, null);
        } finally {
            g.dispose();
        }
        return target;
    }
}
