package net.kairos.core.model;

public record ResumeJobRequest(String name) {
}
