package net.kairos.core.model;

/** pageSize 0 이면 서버 기본값, pageToken 은 이전 응답의 nextPageToken */
public record ListJobsRequest(String parent, int pageSize, String pageToken) {
    public static ListJobsRequest firstPage(String parent, int pageSize) {
        return new ListJobsRequest(parent, pageSize, null);
    }

    public ListJobsRequest nextPage(String token) {
        return new ListJobsRequest(parent, pageSize, token);
    }
}
