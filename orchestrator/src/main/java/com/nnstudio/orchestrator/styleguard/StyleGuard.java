package com.nnstudio.orchestrator.styleguard;

import com.nnstudio.orchestrator.model.PromptRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rejects generated images that copy the layout of a style reference.
 *
 * A generated image fails when its {@link PerceptualHash} is within
 * {@code hammingMax} bits of ANY reference. Style references are meant to
 * transfer palette and texture, never composition.
 */
@Component
public class StyleGuard {

    private static final Logger log = LoggerFactory.getLogger(StyleGuard.class);

    public static final int DEFAULT_GRID_SIZE   = 32;
    public static final int DEFAULT_HAMMING_MAX = 240;

    /** Prepended to prompts sent with style references. */
    public static final String STYLE_ONLY_PREFIX =
            "Use reference images strictly for style, palette, texture, and mood. "
            + "Do NOT copy subject geometry, pose, or layout. "
            + "Prioritize user text for subject and composition.";

    private static final List<String> COPY_PHRASES = List.of(
            "exact copy", "exact same", "exactly like", "replicate", "duplicate",
            "mirror", "clone", "identical", "same as");

    private final int gridSize;
    private final int hammingMax;

    public StyleGuard() {
        this(DEFAULT_GRID_SIZE, DEFAULT_HAMMING_MAX);
    }

    @Autowired
    public StyleGuard(@Value("${nn.style-guard.grid-size:32}") int gridSize,
                      @Value("${nn.style-guard.hamming-max:240}") int hammingMax) {
        if (gridSize < 2) throw new IllegalArgumentException("gridSize must be >= 2");
        this.gridSize   = gridSize;
        this.hammingMax = hammingMax;
    }

    /**
     * @param generated encoded image bytes
     * @param styleRefs encoded reference images; unreadable ones are skipped
     * @return true when the image is far enough from every reference
     */
    public boolean passesStyleGuard(byte[] generated, List<byte[]> styleRefs) {
        if (styleRefs == null || styleRefs.isEmpty()) {
            return true;
        }
        PerceptualHash genHash;
        try {
            genHash = hash(generated);
        } catch (IOException e) {
            // an output we cannot inspect is not allowed through
            log.warn("Style guard could not decode generated image: {}", e.getMessage());
            return false;
        }

        for (int i = 0; i < styleRefs.size(); i++) {
            PerceptualHash refHash;
            try {
                refHash = hash(styleRefs.get(i));
            } catch (IOException e) {
                log.warn("Skipping unreadable style reference #{}: {}", i, e.getMessage());
                continue;
            }
            int distance = genHash.distance(refHash);
            if (distance <= hammingMax) {
                log.info("Style guard rejected image: distance {} to reference #{} (max {})",
                        distance, i, hammingMax);
                return false;
            }
        }
        return true;
    }

    /** Reads reference files, skipping any that are missing or unreadable. */
    public List<byte[]> loadReferences(List<Path> paths) {
        List<byte[]> refs = new ArrayList<>();
        for (Path p : paths) {
            try {
                refs.add(Files.readAllBytes(p));
            } catch (IOException e) {
                log.warn("Style reference {} not readable: {}", p, e.getMessage());
            }
        }
        return refs;
    }

    /** Flags prompt wording that asks the model to copy a reference. */
    public Compliance checkPromptCompliance(String prompt) {
        String lower = prompt == null ? "" : prompt.toLowerCase(Locale.ROOT);
        List<String> found = COPY_PHRASES.stream().filter(lower::contains).toList();
        return new Compliance(found.isEmpty(), found);
    }

    /**
     * Logs a warning for every row whose prompt asks to copy a reference.
     *
     * @return the flagged rows, in input order
     */
    public List<PromptRow> flagCopyWording(List<PromptRow> rows) {
        List<PromptRow> flagged = new ArrayList<>();
        for (PromptRow row : rows) {
            Compliance c = checkPromptCompliance(row.prompt());
            if (!c.compliant()) {
                log.warn("Prompt asks to copy a style reference {}: {}", c.flaggedPhrases(), row.prompt());
                flagged.add(row);
            }
        }
        return flagged;
    }

    public static String withStyleOnlyPrefix(String prompt) {
        return STYLE_ONLY_PREFIX + "\n\n" + prompt;
    }

    public int hammingMax() { return hammingMax; }

    private PerceptualHash hash(byte[] data) throws IOException {
        if (data == null || data.length == 0) {
            throw new IOException("empty image");
        }
        BufferedImage img = ImageIO.read(new ByteArrayInputStream(data));
        if (img == null) {
            throw new IOException("unsupported image format");
        }
        return PerceptualHash.of(img, gridSize);
    }

    public record Compliance(boolean compliant, List<String> flaggedPhrases) {}
}
