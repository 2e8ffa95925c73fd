package com.slidemaker.orchestrator.model;

public record Size(int width, int height) {
}
