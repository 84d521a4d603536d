package com.nnstudio.orchestrator.batch;

import java.nio.file.Path;

public record SavedImage(String id, String prompt, Path path) {}
