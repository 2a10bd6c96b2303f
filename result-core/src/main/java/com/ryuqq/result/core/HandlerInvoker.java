package com.ryuqq.result.core;

import java.util.function.Function;

/**
 * 부수효과 핸들러 실행기.
 *
 * <p>onSuccess, onFailure, always 핸들러가 던진 {@link Exception}을 잡아
 * faultMapper를 통해 새 실패 Result로 변환합니다. 선언 없이 던져진 checked 예외도 포함되며,
 * Error는 잡지 않습니다.</p>
 *
 * @author Result Team
 * @since 1.0.0
 */
final class HandlerInvoker {

    private HandlerInvoker() {
    }

    static <S, F> Result<S, F> invoke(String operation,
                                      Runnable invocation,
                                      Function<? super HandlerFault, ? extends F> faultMapper,
                                      Result<S, F> self) {
        Preconditions.checkNotNull(faultMapper, "faultMapper");
        try {
            invocation.run();
        } catch (Exception e) {
            F failure = faultMapper.apply(new HandlerFault(operation, e));
            return new Failure<>(Preconditions.checkNotNull(failure, "faultMapper result"));
        }
        return self;
    }
}
