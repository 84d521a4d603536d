package com.nnstudio.orchestrator.preflight;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.nnstudio.orchestrator.model.ReferencePack;
import com.nnstudio.orchestrator.problem.Problem;
import com.nnstudio.orchestrator.problem.ProblemException;
import com.nnstudio.orchestrator.problem.ProblemTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads a {@link ReferencePack} from a JSON or YAML file, or builds a
 * style-only pack from a flat directory of images.
 *
 * Shorthand accepted in pack files:
 * <pre>
 *   style:   [ "a.png", "b.jpg" ]          # bare paths
 *   props:   { hat: "hat.png" }            # label → path
 *   subject: { alice: "alice_face.jpg" }   # name  → face
 * </pre>
 * Relative paths resolve against the pack file's directory.
 */
@Component
public class ReferencePackLoader {

    private static final Logger log = LoggerFactory.getLogger(ReferencePackLoader.class);

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "webp");

    private final ObjectMapper json;
    private final ObjectMapper yaml;

    public ReferencePackLoader(ObjectMapper objectMapper) {
        this.json = objectMapper;
        this.yaml = objectMapper.copyWith(new YAMLFactory());
    }

    /**
     * @throws ProblemException 400 {@code refs/load-error} when the file is
     *         missing, unparseable or names no references
     */
    public ReferencePack load(Path source) {
        try {
            if (Files.isDirectory(source)) {
                return loadDirectory(source);
            }
            String name = source.getFileName().toString().toLowerCase(Locale.ROOT);
            ObjectMapper mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? yaml : json;
            JsonNode root = mapper.readTree(source.toFile());
            if (root == null || !root.isObject()) {
                throw loadError(source, "expected an object at the top level");
            }
            ObjectNode normalized = normalize((ObjectNode) root, source.toAbsolutePath().getParent());
            ReferencePack pack = json.treeToValue(normalized, ReferencePack.class);
            if (pack.totalRefCount() == 0) {
                throw loadError(source, "pack contains no references");
            }
            log.info("Loaded reference pack {} (modes: {}, {} refs, digest {})",
                    source.getFileName(), pack.activeModes(), pack.totalRefCount(), pack.digest());
            return pack;
        } catch (ProblemException e) {
            throw e;
        } catch (IOException | IllegalArgumentException e) {
            throw loadError(source, e.getMessage());
        }
    }

    /** Legacy layout: every image in the directory is a style reference. */
    private ReferencePack loadDirectory(Path dir) throws IOException {
        List<String> paths;
        try (Stream<Path> files = Files.list(dir)) {
            paths = files.filter(Files::isRegularFile)
                    .filter(ReferencePackLoader::isImage)
                    .sorted()
                    .map(Path::toString)
                    .toList();
        }
        if (paths.isEmpty()) {
            throw loadError(dir, "no images found in directory");
        }
        log.info("Loaded {} style references from directory {}", paths.size(), dir);
        return ReferencePack.ofStyle(paths);
    }

    // ------------------------------------------------------------------
    // Shorthand normalization
    // ------------------------------------------------------------------

    private ObjectNode normalize(ObjectNode root, Path baseDir) {
        ObjectNode out = root.deepCopy();
        out.set("style",       expandList(root.get("style"),       "path", baseDir));
        out.set("pose",        expandList(root.get("pose"),        "path", baseDir));
        out.set("environment", expandList(root.get("environment"), "path", baseDir));
        out.set("props",       expandMap(root.get("props"),   "label", "path", baseDir));
        out.set("subject",     expandMap(root.get("subject"), "name",  "face", baseDir));
        return out;
    }

    /** ["a.png"] → [{path: "a.png"}]; object entries pass through with resolved paths. */
    private ArrayNode expandList(JsonNode node, String pathField, Path baseDir) {
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        if (node == null || node.isNull()) return out;
        if (!node.isArray()) {
            throw new IllegalArgumentException("expected a list, got " + node.getNodeType());
        }
        for (JsonNode item : node) {
            ObjectNode entry = toEntry(item, pathField);
            resolve(entry, pathField, baseDir);
            out.add(entry);
        }
        return out;
    }

    /** {key: "x.png"} → [{keyField: key, pathField: "x.png"}]; arrays go through expandList. */
    private ArrayNode expandMap(JsonNode node, String keyField, String pathField, Path baseDir) {
        if (node == null || node.isNull() || node.isArray()) {
            return expandList(node, pathField, baseDir);
        }
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            ObjectNode entry = toEntry(f.getValue(), pathField);
            entry.put(keyField, f.getKey());
            resolve(entry, pathField, baseDir);
            out.add(entry);
        }
        return out;
    }

    private static ObjectNode toEntry(JsonNode item, String pathField) {
        if (item.isTextual()) {
            return JsonNodeFactory.instance.objectNode().put(pathField, item.asText());
        }
        if (item.isObject()) {
            return ((ObjectNode) item).deepCopy();
        }
        throw new IllegalArgumentException("unsupported reference entry: " + item);
    }

    private void resolve(ObjectNode entry, String pathField, Path baseDir) {
        JsonNode p = entry.get(pathField);
        if (p == null || !p.isTextual() || p.asText().isBlank()) {
            throw new IllegalArgumentException("reference entry is missing '" + pathField + "'");
        }
        Path path = Path.of(p.asText());
        if (!path.isAbsolute() && baseDir != null) {
            entry.put(pathField, baseDir.resolve(path).normalize().toString());
        }
    }

    private static boolean isImage(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static ProblemException loadError(Path source, String detail) {
        return new ProblemException(Problem.of(ProblemTypes.REFS_LOAD_ERROR,
                "Failed to load reference pack", source + ": " + detail, 400));
    }
}
