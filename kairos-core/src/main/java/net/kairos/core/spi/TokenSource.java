package net.kairos.core.spi;

import java.util.Objects;

/** 호출마다 bearer 토큰을 공급. 캐시/갱신은 구현 책임 */
@FunctionalInterface
public interface TokenSource {
    String token() throws Exception;

    /**
     * audience (예: https://cloudscheduler.googleapis.com/) 에 묶인 토큰.
     * self-signed JWT 처럼 audience 가 필요한 구현만 재정의한다.
     */
    default String tokenFor(String audience) throws Exception {
        return token();
    }

    /** 고정 토큰 */
    static TokenSource fixed(String token) {
        Objects.requireNonNull(token, "token");
        return () -> token;
    }
}
