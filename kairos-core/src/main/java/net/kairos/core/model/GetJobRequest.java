package net.kairos.core.model;

public record GetJobRequest(String name) {
}
