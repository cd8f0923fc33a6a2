package net.kairos.core.model;

import java.util.List;

/** nextPageToken 이 비어 있으면 마지막 페이지 */
public record ListJobsResponse(List<Job> jobs, String nextPageToken) {
    public ListJobsResponse {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
        nextPageToken = nextPageToken == null ? "" : nextPageToken;
    }

    public boolean hasNextPage() {
        return !nextPageToken.isEmpty();
    }
}
