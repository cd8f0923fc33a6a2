package net.kairos.core.model;

import java.util.List;

/** updateMask: 갱신할 필드 경로(snake_case). 비어 있으면 전체 갱신 */
public record UpdateJobRequest(Job job, List<String> updateMask) {
    public UpdateJobRequest {
        updateMask = updateMask == null ? List.of() : List.copyOf(updateMask);
    }

    public static UpdateJobRequest of(Job job) {
        return new UpdateJobRequest(job, List.of());
    }
}
