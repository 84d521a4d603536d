package com.nnstudio.orchestrator.probe;

import com.nnstudio.orchestrator.client.RemoteCallException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/** Source of OAuth bearer tokens for Google Cloud calls. */
@FunctionalInterface
public interface AccessTokenProvider {

    String accessToken();

    static AccessTokenProvider fixed(String token) {
        return () -> token;
    }

    /**
     * Shells out to {@code gcloud auth print-access-token} (application
     * default credentials), giving up after 5 seconds.
     */
    static AccessTokenProvider gcloud() {
        return () -> {
            Process process = null;
            try {
                process = new ProcessBuilder("gcloud", "auth", "print-access-token")
                        .redirectErrorStream(false)
                        .start();
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    throw new RemoteCallException(0, "gcloud auth print-access-token timed out");
                }
                String out;
                try (InputStream in = process.getInputStream()) {
                    out = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
                }
                if (process.exitValue() != 0 || out.isEmpty()) {
                    throw new RemoteCallException(0, "Unable to get ADC access token (exit " + process.exitValue() + ")");
                }
                return out;
            } catch (IOException e) {
                throw new RemoteCallException(0, "Unable to get ADC access token", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteCallException(0, "Interrupted while getting access token", e);
            } finally {
                if (process != null && process.isAlive()) {
                    process.destroyForcibly();
                }
            }
        };
    }
}
