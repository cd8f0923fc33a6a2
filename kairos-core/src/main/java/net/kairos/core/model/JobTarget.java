package net.kairos.core.model;

/** Job 실행 대상. 구현: {@link HttpTarget}, {@link PubsubTarget} */
public interface JobTarget {
}
