package net.kairos.core.model;

public record DeleteJobRequest(String name) {
}
