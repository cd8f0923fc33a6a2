package net.kairos.adapter.grpc;

import io.grpc.CallCredentials;
import io.grpc.Metadata;
import io.grpc.Status;
import net.kairos.core.spi.TokenSource;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * 호출마다 TokenSource 에서 토큰을 받아 authorization 헤더로 붙인다.
 * audience 가 없으면 호출 authority 로 "https://{authority}/" 를 만든다.
 */
public final class BearerTokenCallCredentials extends CallCredentials {
    static final Metadata.Key<String> AUTHORIZATION =
            Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);

    private final TokenSource tokens;
    private final String audience;

    public BearerTokenCallCredentials(TokenSource tokens) {
        this(tokens, null);
    }

    public BearerTokenCallCredentials(TokenSource tokens, String audience) {
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.audience = audience == null || audience.isBlank() ? null : audience;
    }

    @Override
    public void applyRequestMetadata(RequestInfo requestInfo, Executor appExecutor, MetadataApplier applier) {
        appExecutor.execute(() -> {
            try {
                String aud = audience != null ? audience : "https://" + requestInfo.getAuthority() + "/";
                String token = tokens.tokenFor(aud);
                if (token == null || token.isBlank()) {
                    applier.fail(Status.UNAUTHENTICATED.withDescription("token source returned no token"));
                    return;
                }
                Metadata headers = new Metadata();
                headers.put(AUTHORIZATION, "Bearer " + token);
                applier.apply(headers);
            } catch (Exception e) {
                applier.fail(Status.UNAUTHENTICATED.withDescription("failed to obtain token").withCause(e));
            }
        });
    }

    @Override
    public void thisUsesUnstableApi() {
    }
}
