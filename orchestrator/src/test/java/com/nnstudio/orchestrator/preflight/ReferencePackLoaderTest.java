package com.nnstudio.orchestrator.preflight;

import com.nnstudio.orchestrator.model.ReferencePack;
import com.nnstudio.orchestrator.problem.ProblemException;
import com.nnstudio.orchestrator.problem.ProblemTypes;
import com.nnstudio.orchestrator.support.TestImages;
import com.nnstudio.orchestrator.support.TestJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferencePackLoaderTest {

    @TempDir Path dir;

    ReferencePackLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ReferencePackLoader(TestJson.mapper());
    }

    @Test
    void load_yamlShorthand_expandsAndResolvesPaths() throws Exception {
        Path file = Files.writeString(dir.resolve("refs.yaml"), """
                version: "2.0"
                style:
                  - style/a.png
                  - path: style/b.png
                    weight: 0.5
                props:
                  hat: props/hat.png
                subject:
                  alice: faces/alice.jpg
                pose: [pose/wave.png]
                """);

        ReferencePack pack = loader.load(file);

        assertThat(pack.version()).isEqualTo("2.0");
        assertThat(pack.stylePaths()).containsExactly(
                dir.resolve("style/a.png").toString(), dir.resolve("style/b.png").toString());
        assertThat(pack.style().get(1).weight()).isEqualTo(0.5);
        assertThat(pack.props()).singleElement().satisfies(p -> {
            assertThat(p.label()).isEqualTo("hat");
            assertThat(p.path()).isEqualTo(dir.resolve("props/hat.png").toString());
        });
        assertThat(pack.subject()).singleElement().satisfies(s -> assertThat(s.name()).isEqualTo("alice"));
        assertThat(pack.activeModes()).containsExactly("style", "props", "subject", "pose");
        assertThat(pack.totalRefCount()).isEqualTo(5);
    }

    @Test
    void load_json_defaultsVersion() throws Exception {
        Path file = Files.writeString(dir.resolve("refs.json"),
                "{\"style\": [\"/abs/a.png\"], \"environment\": [{\"path\": \"/abs/room.png\", \"scene\": \"kitchen\"}]}");

        ReferencePack pack = loader.load(file);

        assertThat(pack.version()).isEqualTo("1.0");
        assertThat(pack.allPaths()).containsExactly("/abs/a.png", "/abs/room.png");
        assertThat(pack.environment().get(0).scene()).isEqualTo("kitchen");
    }

    @Test
    void load_directory_treatsImagesAsStyleRefs() {
        TestImages.write(dir.resolve("b.png"), TestImages.splitVertical(8));
        TestImages.write(dir.resolve("a.jpg"), TestImages.splitVertical(8));
        TestImages.write(dir.resolve("notes.txt"), new byte[]{1});

        ReferencePack pack = loader.load(dir);

        assertThat(pack.stylePaths()).containsExactly(
                dir.resolve("a.jpg").toString(), dir.resolve("b.png").toString());
    }

    @Test
    void load_emptyPack_isLoadError() throws Exception {
        Path file = Files.writeString(dir.resolve("refs.json"), "{\"version\": \"1.0\"}");

        assertLoadError(file);
    }

    @Test
    void load_missingFile_isLoadError() {
        assertLoadError(dir.resolve("nope.yaml"));
    }

    @Test
    void load_malformedEntry_isLoadError() throws Exception {
        Path file = Files.writeString(dir.resolve("refs.json"), "{\"style\": [42]}");

        assertLoadError(file);
    }

    @Test
    void digest_ignoresOrder() {
        ReferencePack one = ReferencePack.ofStyle(List.of("/x/a.png", "/x/b.png"));
        ReferencePack two = ReferencePack.ofStyle(List.of("/x/b.png", "/x/a.png"));

        assertThat(one.digest()).hasSize(12).isEqualTo(two.digest());
        assertThat(ReferencePack.ofStyle(List.of("/x/c.png")).digest()).isNotEqualTo(one.digest());
    }

    private void assertLoadError(Path source) {
        assertThatThrownBy(() -> loader.load(source))
                .isInstanceOf(ProblemException.class)
                .satisfies(e -> {
                    ProblemException pe = (ProblemException) e;
                    assertThat(pe.problem().type()).isEqualTo(ProblemTypes.REFS_LOAD_ERROR);
                    assertThat(pe.status()).isEqualTo(400);
                });
    }
}
