package net.kairos.core.model;

public record RunJobRequest(String name) {
}
