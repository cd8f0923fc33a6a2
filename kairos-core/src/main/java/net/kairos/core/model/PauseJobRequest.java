package net.kairos.core.model;

public record PauseJobRequest(String name) {
}
