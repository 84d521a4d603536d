package com.nnstudio.orchestrator.styleguard;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.BitSet;

/**
 * Average-luminance hash: downscale to an N×N grayscale grid and set one
 * bit per cell that is brighter than the grid mean.
 *
 * Two images with the same composition produce hashes with a small
 * Hamming distance regardless of palette or fine texture.
 */
public final class PerceptualHash {

    private final BitSet bits;
    private final int    length;

    private PerceptualHash(BitSet bits, int length) {
        this.bits   = bits;
        this.length = length;
    }

    public static PerceptualHash of(BufferedImage image, int gridSize) {
        BufferedImage small = new BufferedImage(gridSize, gridSize, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = small.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, gridSize, gridSize, null);
        } finally {
            g.dispose();
        }

        int n = gridSize * gridSize;
        double[] luma = new double[n];
        double sum = 0;
        for (int y = 0; y < gridSize; y++) {
            for (int x = 0; x < gridSize; x++) {
                int rgb = small.getRGB(x, y);
                int r = (rgb >> 16) & 0xff;
                int gr = (rgb >> 8) & 0xff;
                int b = rgb & 0xff;
                double l = 0.299 * r + 0.587 * gr + 0.114 * b;   // Rec. 601
                luma[y * gridSize + x] = l;
                sum += l;
            }
        }
        double mean = sum / n;

        BitSet bits = new BitSet(n);
        for (int i = 0; i < n; i++) {
            if (luma[i] > mean) bits.set(i);
        }
        return new PerceptualHash(bits, n);
    }

    /** Number of differing bits. Hashes must come from the same grid size. */
    public int distance(PerceptualHash other) {
        if (other.length != length) {
            throw new IllegalArgumentException("hash lengths differ: " + length + " vs " + other.length);
        }
        BitSet diff = (BitSet) bits.clone();
        diff.xor(other.bits);
        return diff.cardinality();
    }

    public int length() { return length; }
}
