package com.nnstudio.orchestrator.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nnstudio.orchestrator.model.JobManifest;
import com.nnstudio.orchestrator.problem.Problem;
import com.nnstudio.orchestrator.problem.ProblemException;
import com.nnstudio.orchestrator.problem.ProblemTypes;
import com.nnstudio.orchestrator.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One pretty-printed JSON file per job under {@code {outDir}/jobs/}.
 *
 * Writes are atomic (temp file + rename). There is no file locking:
 * a given jobId is expected to have a single writer at a time.
 */
@Component
public class JobManifestStore {

    private static final Logger log = LoggerFactory.getLogger(JobManifestStore.class);

    static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path         jobsDir;
    private final ObjectMapper json;

    public JobManifestStore(Path jobsDir, ObjectMapper objectMapper) {
        this.jobsDir = jobsDir;
        this.json    = objectMapper;
    }

    @Autowired
    public JobManifestStore(@Value("${nn.out-dir}") String outDir, ObjectMapper objectMapper) {
        this(Path.of(outDir).resolve("jobs"), objectMapper);
    }

    public Path pathFor(String jobId) {
        if (jobId == null || !SAFE_ID.matcher(jobId).matches()) {
            throw new ProblemException(Problem.of(ProblemTypes.REQUEST_INVALID,
                    "Invalid job id", "Job id '" + jobId + "' is not a safe file name", 400));
        }
        return jobsDir.resolve(jobId + ".json");
    }

    public boolean exists(String jobId) {
        return Files.isRegularFile(pathFor(jobId));
    }

    /**
     * @return the manifest, or empty when no file exists
     * @throws UncheckedIOException when the file exists but cannot be parsed
     */
    public Optional<JobManifest> load(String jobId) {
        Path path = pathFor(jobId);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(json.readValue(path.toFile(), JobManifest.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Manifest " + path + " unreadable", e);
        }
    }

    public void save(JobManifest manifest) {
        Path path = pathFor(manifest.getJobId());
        try {
            AtomicFiles.write(path, json.writerWithDefaultPrettyPrinter().writeValueAsBytes(manifest));
            log.debug("Saved manifest {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write manifest " + path, e);
        }
    }

    public Path jobsDir() { return jobsDir; }
}
