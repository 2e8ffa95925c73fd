package com.slidemaker.orchestrator.model;

public record Position(int x, int y) {
}
