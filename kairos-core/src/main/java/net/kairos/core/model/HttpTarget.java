package net.kairos.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public record HttpTarget(
        String uri,
        Method httpMethod,
        Map<String, String> headers,
        byte[] body
) implements JobTarget {
    public enum Method {
        UNSPECIFIED, POST, GET, HEAD, PUT, DELETE, PATCH, OPTIONS;

        public static Method from(String s) {
            if (s == null || s.isBlank()) return POST;
            try { return Method.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNSPECIFIED; }
        }
    }

    public HttpTarget {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body.clone();
    }

    public static HttpTarget of(String uri, Method method) {
        return new HttpTarget(uri, method, Map.of(), null);
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    // record 기본 equals 는 배열을 참조로 비교하므로 내용 비교로 바꾼다
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpTarget that)) return false;
        return Objects.equals(uri, that.uri)
                && httpMethod == that.httpMethod
                && headers.equals(that.headers)
                && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(uri, httpMethod, headers) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "HttpTarget[uri=" + uri + ", httpMethod=" + httpMethod
                + ", headers=" + headers + ", body=" + body.length + " bytes]";
    }
}
