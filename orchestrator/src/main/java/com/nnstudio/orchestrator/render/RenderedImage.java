package com.nnstudio.orchestrator.render;

import java.nio.file.Path;

public record RenderedImage(String id, String prompt, Path path) {}
