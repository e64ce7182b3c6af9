package com.ryuqq.stadio.core.fp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 예외를 던지는 코드를 {@link Result}로 감싸는 어댑터.
 *
 * <p>{@link Option#fromNullable(Object)}, {@link Option#fromTuple(Object, boolean)}이
 * null이나 boolean 플래그로 부재를 알리는 API를 감싸듯, 이 클래스는 예외로 실패를 알리는
 * API를 감쌉니다.</p>
 *
 * <p><strong>포착 범위:</strong></p>
 * <ul>
 *   <li>{@link Exception} (checked, unchecked 모두) → Err</li>
 *   <li>{@link Error} → 포착하지 않고 그대로 전파</li>
 *   <li>{@link InterruptedException} → 스레드 인터럽트 플래그를 복원한 뒤 Err</li>
 * </ul>
 *
 * @author Stadio Team
 * @since 1.0.0
 */
public final class Results {

    private static final Logger log = LoggerFactory.getLogger(Results.class);

    /**
     * 의미 있는 값 없이 성공/실패만 나타내는 공유 Ok 인스턴스.
     */
    public static final Result<Object> OK_ANY = Result.ok(null);

    private Results() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Supplier를 실행하여 결과를 Result로 반환.
     *
     * @param supplier 실행할 코드
     * @param <T> 결과 타입
     * @return Ok(supplier 결과) 또는 Err(발생한 예외)
     * @throws IllegalArgumentException supplier가 null인 경우
     */
    public static <T> Result<T> attempt(ThrowingSupplier<T> supplier) {
        if (supplier == null) {
            throw new IllegalArgumentException("supplier cannot be null");
        }
        try {
            return Result.ok(supplier.get());
        } catch (Exception e) {
            return capture(e);
        }
    }

    /**
     * 반환값 없는 코드를 실행하여 Result로 반환.
     *
     * @param runnable 실행할 코드
     * @return okZero() 또는 Err(발생한 예외)
     * @throws IllegalArgumentException runnable이 null인 경우
     */
    public static Result<Void> attemptRun(ThrowingRunnable runnable) {
        if (runnable == null) {
            throw new IllegalArgumentException("runnable cannot be null");
        }
        try {
            runnable.run();
            return Result.okZero();
        } catch (Exception e) {
            return capture(e);
        }
    }

    private static <T> Result<T> capture(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        log.debug("Captured {} as Err: {}", e.getClass().getName(), e.getMessage());
        return Result.err(e);
    }
}
