package com.nnstudio.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.nnstudio.orchestrator.problem.Problem;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Persisted record of one async batch job.
 *
 * Stored as {@code {outDir}/jobs/{jobId}.json} by JobManifestStore and
 * re-read by every poll/fetch/cancel, so any of them can run from a fresh
 * process after a crash.
 *
 * statusHistory is append-only: entries are only added through
 * {@link #recordStatus}, which refuses consecutive duplicates and never
 * lets a timestamp go backwards.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobManifest {

    private String            jobId;
    private String            provider;
    private Instant           submittedAt;
    private int               estCount;
    private String            promptsHash;
    private String            styleRefsHash;
    private List<String>      styleRefs = new ArrayList<>();
    private ChunkInfo         chunk;
    private PreflightSummary  preflight;
    private List<StatusEntry> statusHistory = new ArrayList<>();
    private List<Problem>     problems = new ArrayList<>();
    private FetchSummary      lastFetch;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected JobManifest() {}   // required by Jackson

    public JobManifest(String jobId, String provider, Instant submittedAt, int estCount) {
        this.jobId       = jobId;
        this.provider    = provider;
        this.submittedAt = submittedAt;
        this.estCount    = estCount;
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    /**
     * Append a status entry if it differs from the last recorded one.
     *
     * @return true when an entry was appended
     */
    public boolean recordStatus(Instant now, JobStatus status, Integer completed, Integer total) {
        Optional<StatusEntry> last = lastEntry();
        if (last.isPresent() && last.get().status() == status) {
            return false;
        }
        Instant at = now;
        if (last.isPresent() && now.isBefore(last.get().timestamp())) {
            at = last.get().timestamp();
        }
        statusHistory.add(new StatusEntry(at, status, completed, total));
        return true;
    }

    @JsonIgnore
    public Optional<StatusEntry> lastEntry() {
        return statusHistory.isEmpty()
                ? Optional.empty()
                : Optional.of(statusHistory.get(statusHistory.size() - 1));
    }

    @JsonIgnore
    public Optional<JobStatus> currentStatus() {
        return lastEntry().map(StatusEntry::status);
    }

    public void addProblems(List<Problem> more) {
        problems.addAll(more);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String            getJobId()         { return jobId; }
    public String            getProvider()      { return provider; }
    public Instant           getSubmittedAt()   { return submittedAt; }
    public int               getEstCount()      { return estCount; }
    public String            getPromptsHash()   { return promptsHash; }
    public String            getStyleRefsHash() { return styleRefsHash; }
    public List<String>      getStyleRefs()     { return styleRefs; }
    public ChunkInfo         getChunk()         { return chunk; }
    public PreflightSummary  getPreflight()     { return preflight; }
    public FetchSummary      getLastFetch()     { return lastFetch; }

    public List<StatusEntry> getStatusHistory() { return Collections.unmodifiableList(statusHistory); }
    public List<Problem>     getProblems()      { return Collections.unmodifiableList(problems); }

    public void setPromptsHash(String v)          { this.promptsHash = v; }
    public void setStyleRefsHash(String v)        { this.styleRefsHash = v; }
    public void setChunk(ChunkInfo v)             { this.chunk = v; }
    public void setPreflight(PreflightSummary v)  { this.preflight = v; }
    public void setLastFetch(FetchSummary v)      { this.lastFetch = v; }

    public void setStyleRefs(List<String> v) {
        this.styleRefs = v == null ? new ArrayList<>() : new ArrayList<>(v);
    }

    // Jackson only; callers go through recordStatus / addProblems.
    @JsonSetter("statusHistory")
    void setStatusHistory(List<StatusEntry> v) {
        this.statusHistory = v == null ? new ArrayList<>() : new ArrayList<>(v);
    }

    @JsonSetter("problems")
    void setProblems(List<Problem> v) {
        this.problems = v == null ? new ArrayList<>() : new ArrayList<>(v);
    }

    // ------------------------------------------------------------------
    // Nested value types
    // ------------------------------------------------------------------

    public record ChunkInfo(int index, int count) {}

    public record PreflightSummary(int chunks, int uniqueRefs, long bytesBefore, long bytesAfter) {}

    public record FetchSummary(Instant timestamp, int saved, int failed) {}
}
