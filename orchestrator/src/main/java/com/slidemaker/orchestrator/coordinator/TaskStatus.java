package com.slidemaker.orchestrator.coordinator;

/** PENDING until the task body returns; a result never leaves SUCCESS or FAILED. */
public enum TaskStatus { PENDING, SUCCESS, FAILED }
