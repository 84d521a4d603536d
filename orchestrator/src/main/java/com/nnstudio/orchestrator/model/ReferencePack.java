package com.nnstudio.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.nnstudio.orchestrator.util.Hashing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Versioned bag of reference images grouped by role.
 *
 * style       - palette, texture, mood only
 * props       - object presence without composition
 * subject     - identity (face) preservation
 * pose        - posture / gesture
 * environment - ambience / architecture without foreground
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ReferencePack(
        String            version,
        List<Style>       style,
        List<Prop>        props,
        List<Subject>     subject,
        List<Pose>        pose,
        List<Environment> environment,
        Map<String, Object> metadata
) {
    public ReferencePack {
        if (version == null || version.isBlank()) version = "1.0";
        style       = style       == null ? List.of() : List.copyOf(style);
        props       = props       == null ? List.of() : List.copyOf(props);
        subject     = subject     == null ? List.of() : List.copyOf(subject);
        pose        = pose        == null ? List.of() : List.copyOf(pose);
        environment = environment == null ? List.of() : List.copyOf(environment);
    }

    public static ReferencePack ofStyle(List<String> paths) {
        return new ReferencePack("1.0",
                paths.stream().map(p -> new Style(p, 1.0)).toList(),
                null, null, null, null, null);
    }

    /** Every reference path across all roles, in role order, duplicates kept. */
    @JsonIgnore
    public List<String> allPaths() {
        List<String> paths = new ArrayList<>();
        style.forEach(s -> paths.add(s.path()));
        props.forEach(p -> paths.add(p.path()));
        subject.forEach(s -> paths.add(s.face()));
        pose.forEach(p -> paths.add(p.path()));
        environment.forEach(e -> paths.add(e.path()));
        return paths;
    }

    @JsonIgnore
    public List<String> stylePaths() {
        return style.stream().map(Style::path).toList();
    }

    @JsonIgnore
    public int totalRefCount() {
        return style.size() + props.size() + subject.size() + pose.size() + environment.size();
    }

    @JsonIgnore
    public List<String> activeModes() {
        List<String> modes = new ArrayList<>();
        if (!style.isEmpty())       modes.add("style");
        if (!props.isEmpty())       modes.add("props");
        if (!subject.isEmpty())     modes.add("subject");
        if (!pose.isEmpty())        modes.add("pose");
        if (!environment.isEmpty()) modes.add("environment");
        return modes;
    }

    /**
     * Short stable digest (12 hex chars) over the sorted role paths.
     * Two packs naming the same files in a different order share a digest.
     */
    public String digest() {
        String stable = String.join("|",
                "v=" + version,
                "style=" + sorted(style.stream().map(Style::path)),
                "props=" + sorted(props.stream().map(p -> p.label() + ":" + p.path())),
                "subject=" + sorted(subject.stream().map(s -> s.name() + ":" + s.face())),
                "pose=" + sorted(pose.stream().map(Pose::path)),
                "environment=" + sorted(environment.stream().map(Environment::path)));
        return Hashing.sha256Hex(stable).substring(0, 12);
    }

    private static String sorted(Stream<String> values) {
        return String.join(",", values.sorted().toList());
    }

    // ------------------------------------------------------------------
    // Role entries
    // ------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Style(String path, Double weight) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Prop(String label, String path, Double weight, Boolean required) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Subject(String name, String face, String description) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Pose(String path, String description) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Environment(String path, String scene, List<String> preserve) {}
}
