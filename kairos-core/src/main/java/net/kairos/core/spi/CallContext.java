package net.kairos.core.spi;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * 호출 단위 메타데이터.
 * routingParams 는 x-goog-request-params 헤더 값 ("parent=projects%2Fp%2Flocations%2Fl").
 */
public record CallContext(String routingParams) {
    public static final String ROUTING_HEADER = "x-goog-request-params";

    public static CallContext empty() {
        return new CallContext("");
    }

    /** key=value, value 는 URL 인코딩 (슬래시 포함) */
    public static CallContext routing(String key, String value) {
        if (value == null || value.isEmpty()) return empty();
        return new CallContext(key + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
    }

    public boolean hasRouting() {
        return routingParams != null && !routingParams.isEmpty();
    }
}
