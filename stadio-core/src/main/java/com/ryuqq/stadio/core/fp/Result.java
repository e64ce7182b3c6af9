package com.ryuqq.stadio.core.fp;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 성공 값 또는 오류를 담는 연산 결과.
 *
 * <p>Result는 두 가지 상태 중 정확히 하나입니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공, 값을 담음 (값이 {@code null}일 수 있음)</li>
 *   <li>{@link Err}: 실패, {@link Throwable} 오류를 담음 (null 불가)</li>
 * </ul>
 *
 * <p>이 인터페이스에는 {@link Ok}, {@link Err}를 생성하는 상수 필드를 선언하지 않습니다 (클래스 초기화 순환).
 * 공유 Ok 인스턴스는 {@link Results#OK_ANY}를 사용하십시오.</p>
 *
 * <p>예상 가능한 실패를 예외 대신 반환값으로 표현합니다. 재시도나 자동 복구는 하지 않으며,
 * 호출자가 이미 결정한 결과를 전달할 뿐입니다.</p>
 *
 * <p><strong>비대칭 주의:</strong></p>
 * <ul>
 *   <li>{@link #mapOr(Object, Function)}, {@link #mapOrElse(Function, Function)}는 항상 Ok를 반환합니다.
 *       Err 상태는 기본값 또는 오류 핸들러 결과로 흡수됩니다.</li>
 *   <li>{@link #andThen(Supplier)}는 현재 값을 받지 않는 Supplier로 독립된 다음 단계를 연결합니다.</li>
 * </ul>
 *
 * @param <T> 성공 값 타입
 *
 * @author Stadio Team
 * @since 1.0.0
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    /**
     * 성공 상태.
     *
     * @param value 성공 값 (null 허용)
     * @param <T> 값 타입
     */
    record Ok<T>(T value) implements Result<T> {
    }

    /**
     * 실패 상태.
     *
     * @param error 오류
     * @param <T> 값 타입
     */
    record Err<T>(Throwable error) implements Result<T> {

        /**
         * Compact Constructor.
         *
         * @throws IllegalArgumentException error가 null인 경우
         */
        public Err {
            if (error == null) {
                throw new IllegalArgumentException("error cannot be null");
            }
        }
    }

    /**
     * {@link #unwrap()}의 반환값.
     *
     * <p>Ok이면 {@code error}가 null, Err이면 {@code value}가 null입니다.</p>
     *
     * @param value 성공 값
     * @param error 오류
     * @param <T> 값 타입
     */
    record Unwrapped<T>(T value, Throwable error) {
    }

    // ========== 생성 ==========

    /**
     * 성공 Result 생성.
     *
     * @param value 성공 값
     * @param <T> 값 타입
     * @return Ok 인스턴스
     */
    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * 값 없는 성공 Result 생성 (값은 null).
     *
     * @param <T> 값 타입
     * @return Ok 인스턴스
     */
    static <T> Result<T> okZero() {
        return new Ok<>(null);
    }

    /**
     * 실패 Result 생성.
     *
     * @param error 오류
     * @param <T> 값 타입
     * @return Err 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <T> Result<T> err(Throwable error) {
        return new Err<>(error);
    }

    // ========== 조회 ==========

    /**
     * 성공 여부.
     *
     * @return Ok이면 true
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 실패 여부.
     *
     * @return Err이면 true
     */
    default boolean isErr() {
        return this instanceof Err;
    }

    // ========== 추출 ==========

    /**
     * 값과 오류를 함께 추출. 실패하지 않습니다.
     *
     * @return Ok이면 (value, null), Err이면 (null, error)
     */
    default Unwrapped<T> unwrap() {
        if (this instanceof Err<T> err) {
            return new Unwrapped<>(null, err.error());
        }
        return new Unwrapped<>(((Ok<T>) this).value(), null);
    }

    /**
     * 값을 강제로 추출.
     *
     * <p>예외 메시지에 원래 오류의 설명이 포함되며, 원래 오류는 cause로 연결됩니다.</p>
     *
     * @return 성공 값
     * @throws UnwrapException Err인 경우 (프로그래밍 오류)
     */
    default T unwrapUnsafe() {
        if (this instanceof Err<T> err) {
            throw new UnwrapException("result is error: " + err.error(), err.error());
        }
        return ((Ok<T>) this).value();
    }

    /**
     * 값 또는 기본값 반환.
     *
     * @param other Err일 때 반환할 값
     * @return 성공 값 또는 other
     */
    default T unwrapOr(T other) {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        return other;
    }

    /**
     * 값 또는 Supplier가 계산한 값 반환.
     *
     * @param supplier Err일 때만 호출됨
     * @return 성공 값 또는 supplier 결과
     */
    default T unwrapOrElse(Supplier<? extends T> supplier) {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        return supplier.get();
    }

    /**
     * 값 또는 {@code null} 반환.
     *
     * @return 성공 값, Err이면 null
     */
    default T unwrapOrDefault() {
        return unwrapOr(null);
    }

    // ========== 조합 ==========

    /**
     * Ok이면 자신, Err이면 other 반환.
     *
     * @param other 대체 Result
     * @return 자신 또는 other
     */
    default Result<T> or(Result<T> other) {
        if (isOk()) {
            return this;
        }
        return other;
    }

    /**
     * Ok이면 자신, Err이면 Supplier가 만든 Result 반환.
     *
     * @param supplier Err일 때만 호출됨
     * @return 자신 또는 supplier 결과
     */
    default Result<T> orElse(Supplier<? extends Result<T>> supplier) {
        if (isOk()) {
            return this;
        }
        return supplier.get();
    }

    /**
     * Ok이면 other, Err이면 원래 오류를 그대로 반환.
     *
     * @param other 다음 Result
     * @param <U> 다음 값 타입
     * @return other 또는 자신(Err)
     */
    @SuppressWarnings("unchecked")
    default <U> Result<U> and(Result<U> other) {
        if (isOk()) {
            return other;
        }
        return (Result<U>) (Result<?>) this;
    }

    /**
     * Ok이면 Supplier 결과를 Ok로 감싸 반환, Err이면 Supplier를 호출하지 않고 자신을 반환.
     *
     * <p>Supplier는 현재 값을 받지 않습니다. 현재 값을 변환하려면 {@link #map(Function)}을 사용하십시오.</p>
     *
     * @param supplier Ok일 때만 호출됨
     * @param <U> 다음 값 타입
     * @return Ok(supplier()) 또는 자신(Err)
     */
    @SuppressWarnings("unchecked")
    default <U> Result<U> andThen(Supplier<? extends U> supplier) {
        if (isOk()) {
            return ok(supplier.get());
        }
        return (Result<U>) (Result<?>) this;
    }

    /**
     * 성공 값을 변환. Err이면 fn을 호출하지 않고 자신을 반환.
     *
     * @param fn 변환 함수
     * @param <U> 변환 결과 타입
     * @return Ok(fn(value)) 또는 자신(Err)
     */
    @SuppressWarnings("unchecked")
    default <U> Result<U> map(Function<? super T, ? extends U> fn) {
        if (this instanceof Ok<T> ok) {
            return ok(fn.apply(ok.value()));
        }
        return (Result<U>) (Result<?>) this;
    }

    /**
     * 성공 값을 변환하거나 기본값을 사용. 결과는 항상 Ok입니다.
     *
     * @param other Err일 때 Ok로 감쌀 값
     * @param fn 변환 함수
     * @param <U> 결과 타입
     * @return Ok(fn(value)) 또는 Ok(other)
     */
    default <U> Result<U> mapOr(U other, Function<? super T, ? extends U> fn) {
        if (this instanceof Ok<T> ok) {
            return ok(fn.apply(ok.value()));
        }
        return ok(other);
    }

    /**
     * 성공 값 또는 오류를 변환. 결과는 항상 Ok입니다.
     *
     * @param errHandler Err일 때 오류와 함께 호출됨
     * @param okHandler Ok일 때 값과 함께 호출됨
     * @param <U> 결과 타입
     * @return Ok(okHandler(value)) 또는 Ok(errHandler(error))
     */
    default <U> Result<U> mapOrElse(
        Function<? super Throwable, ? extends U> errHandler,
        Function<? super T, ? extends U> okHandler
    ) {
        if (this instanceof Ok<T> ok) {
            return ok(okHandler.apply(ok.value()));
        }
        return ok(errHandler.apply(((Err<T>) this).error()));
    }

    /**
     * 상태에 맞는 핸들러로 분기. 두 핸들러 모두 Result를 반환합니다.
     *
     * @param okHandler Ok일 때 값과 함께 호출됨
     * @param errHandler Err일 때 오류와 함께 호출됨
     * @param <U> 결과 값 타입
     * @return 선택된 핸들러의 결과
     */
    default <U> Result<U> match(
        Function<? super T, Result<U>> okHandler,
        Function<? super Throwable, Result<U>> errHandler
    ) {
        if (this instanceof Ok<T> ok) {
            return okHandler.apply(ok.value());
        }
        return errHandler.apply(((Err<T>) this).error());
    }
}
