package com.nnstudio.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobManifestTest {

    static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    @Test
    void recordStatus_consecutiveDuplicate_skipped() {
        JobManifest m = new JobManifest("j", "gemini-batch", T0, 1);

        assertThat(m.recordStatus(T0, JobStatus.PENDING, 0, 1)).isTrue();
        assertThat(m.recordStatus(T0.plusSeconds(1), JobStatus.PENDING, 0, 1)).isFalse();
        assertThat(m.recordStatus(T0.plusSeconds(2), JobStatus.RUNNING, 0, 1)).isTrue();

        assertThat(m.getStatusHistory()).hasSize(2);
        assertThat(m.currentStatus()).contains(JobStatus.RUNNING);
    }

    @Test
    void recordStatus_clockGoesBack_timestampClamped() {
        JobManifest m = new JobManifest("j", "gemini-batch", T0, 1);
        m.recordStatus(T0.plusSeconds(10), JobStatus.PENDING, 0, 1);

        m.recordStatus(T0, JobStatus.RUNNING, 0, 1);

        assertThat(m.lastEntry()).get().extracting(StatusEntry::timestamp).isEqualTo(T0.plusSeconds(10));
    }

    @Test
    void history_notModifiableFromOutside() {
        JobManifest m = new JobManifest("j", "gemini-batch", T0, 1);

        assertThatThrownBy(() -> m.getStatusHistory().add(StatusEntry.of(T0, JobStatus.FAILED)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(m.currentStatus()).isEmpty();
    }

    @Test
    void jobStatus_wireNames() {
        assertThat(JobStatus.fromWire("succeeded")).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(JobStatus.fromWire("Cancelled")).isEqualTo(JobStatus.CANCELED);
        assertThat(JobStatus.CANCELED.wireName()).isEqualTo("canceled");
        assertThat(JobStatus.RUNNING.isTerminal()).isFalse();
        assertThat(JobStatus.FAILED.isTerminal()).isTrue();
    }

    @Test
    void promptRow_validity() {
        assertThat(PromptRow.of("a cat").isValid()).isTrue();
        assertThat(PromptRow.of(" ").isValid()).isFalse();
        assertThat(PromptRow.of("x".repeat(PromptRow.MAX_PROMPT_LENGTH + 1)).isValid()).isFalse();
    }
}
