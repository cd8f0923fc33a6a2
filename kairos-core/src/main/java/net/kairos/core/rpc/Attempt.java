package net.kairos.core.rpc;

import java.util.concurrent.CompletionStage;

/**
 * 재시도 단위 작업. 현재 핸들을 받아 한 번 호출하고 결과(실패 시 다음에 쓸 핸들 포함)를 돌려준다.
 */
@FunctionalInterface
public interface Attempt<H, T> {
    CompletionStage<AttemptResult<T, H>> call(H handle);
}
