package com.project.image.depix.model;

public record ResolvedBlock(Block block, Resolution resolution) {}
