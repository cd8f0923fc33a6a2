package net.kairos.core.model;

/** parent 형식: projects/{project}/locations/{location} */
public record CreateJobRequest(String parent, Job job) {
}
