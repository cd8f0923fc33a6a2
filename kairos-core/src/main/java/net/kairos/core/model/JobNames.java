package net.kairos.core.model;

import java.util.Objects;

/** 리소스 이름 조립/분해 헬퍼 */
public final class JobNames {
    private JobNames() {}

    public static String parent(String project, String location) {
        Objects.requireNonNull(project, "project"); Objects.requireNonNull(location, "location");
        return "projects/" + project + "/locations/" + location;
    }

    public static String job(String parent, String jobId) {
        Objects.requireNonNull(parent, "parent"); Objects.requireNonNull(jobId, "jobId");
        return parent + "/jobs/" + jobId;
    }

    public static String job(String project, String location, String jobId) {
        return job(parent(project, location), jobId);
    }

    /** ".../jobs/{jobId}" 의 parent 부분. 형식이 다르면 null */
    public static String parentOf(String jobName) {
        if (jobName == null) return null;
        int idx = jobName.lastIndexOf("/jobs/");
        return idx <= 0 ? null : jobName.substring(0, idx);
    }
}
