package com.ryuqq.stadio.core.fp;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 있을 수도, 없을 수도 있는 값.
 *
 * <p>Option은 두 가지 상태 중 정확히 하나입니다:</p>
 * <ul>
 *   <li>{@link Some}: 값이 존재함 (값이 {@code null}이어도 존재하는 값으로 취급)</li>
 *   <li>{@link None}: 값이 없음</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 상태가 닫혀 있습니다. sentinel 값(예: {@code null}, 0)에
 * 의존하지 않으므로, 모든 값이 유효한 타입에서도 "값 없음"과 구분됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 상태와 값이 바뀌지 않으며, 모든 변환은 새 Option을 반환합니다.
 * 잠금 없이 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * <p><strong>지연 평가:</strong> {@code *OrElse} 계열의 Supplier는 해당 분기가 선택된 경우에만,
 * 호출 스레드에서 정확히 한 번 호출됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Option&lt;User&gt; user = Option.fromNullable(repository.find(id));
 * String name = user.mapOr("anonymous", User::name);
 * Result&lt;User&gt; required = user.okOr(new NoSuchElementException(id));
 * </pre>
 *
 * @param <T> 값 타입
 *
 * @author Stadio Team
 * @since 1.0.0
 */
public sealed interface Option<T> permits Option.Some, Option.None {

    /**
     * 값이 존재하는 상태.
     *
     * @param value 담긴 값 (null 허용)
     * @param <T> 값 타입
     */
    record Some<T>(T value) implements Option<T> {
    }

    /**
     * 값이 없는 상태.
     *
     * @param <T> 값 타입
     */
    record None<T>() implements Option<T> {

        private static final None<?> INSTANCE = new None<>();
    }

    /**
     * {@link #unwrap()}의 반환값.
     *
     * <p>None이면 {@code value}는 {@code null}, {@code present}는 false입니다.
     * 호출자는 반드시 {@code present}를 먼저 확인해야 합니다.</p>
     *
     * @param value 담긴 값
     * @param present 값 존재 여부
     * @param <T> 값 타입
     */
    record Unwrapped<T>(T value, boolean present) {
    }

    // ========== 생성 ==========

    /**
     * 값을 담은 Option 생성.
     *
     * @param value 값 (null 허용, 존재하는 값으로 취급)
     * @param <T> 값 타입
     * @return Some 인스턴스
     */
    static <T> Option<T> some(T value) {
        return new Some<>(value);
    }

    /**
     * 빈 Option 반환.
     *
     * @param <T> 값 타입
     * @return 공유 None 인스턴스
     */
    @SuppressWarnings("unchecked")
    static <T> Option<T> none() {
        return (Option<T>) None.INSTANCE;
    }

    /**
     * (값, 존재 여부) 쌍으로 Option 생성.
     *
     * <p>별도의 boolean 플래그로 부재를 알리는 API를 감쌀 때 사용합니다.</p>
     *
     * @param value 값
     * @param present 존재 여부
     * @param <T> 값 타입
     * @return present가 true면 Some, 아니면 None
     */
    static <T> Option<T> fromTuple(T value, boolean present) {
        if (present) {
            return some(value);
        }
        return none();
    }

    /**
     * nullable 참조로 Option 생성.
     *
     * @param value 값 (null이면 None)
     * @param <T> 값 타입
     * @return null이면 None, 아니면 Some
     */
    static <T> Option<T> fromNullable(T value) {
        if (value == null) {
            return none();
        }
        return some(value);
    }

    /**
     * zero 값을 None으로 간주하여 Option 생성.
     *
     * <p>{@code null}, 수치 0, {@code false}, {@code '\0'}, 빈 문자열을 None으로 바꿉니다.
     * "명시적으로 없음"과 "zero 값과 같음"을 구분하지 못하는 손실 있는 편의 메서드입니다.
     * zero 값이 유효한 값일 수 있다면 {@link #fromTuple(Object, boolean)}을 사용하십시오.</p>
     *
     * @param value 값
     * @param <T> 값 타입
     * @return zero 값이면 None, 아니면 Some
     */
    static <T> Option<T> fromZero(T value) {
        if (ZeroValues.isZero(value)) {
            return none();
        }
        return some(value);
    }

    /**
     * 지정한 zero 값과 같으면 None으로 간주하여 Option 생성.
     *
     * @param value 값
     * @param zero 해당 타입에서 zero로 취급할 값
     * @param <T> 값 타입
     * @return value가 zero와 같으면 None, 아니면 Some
     */
    static <T> Option<T> fromZero(T value, T zero) {
        if (Objects.equals(value, zero)) {
            return none();
        }
        return some(value);
    }

    /**
     * {@link Optional}로 Option 생성.
     *
     * @param optional JDK Optional
     * @param <T> 값 타입
     * @return 값이 있으면 Some, 비어 있으면 None
     * @throws IllegalArgumentException optional이 null인 경우
     */
    static <T> Option<T> fromOptional(Optional<T> optional) {
        if (optional == null) {
            throw new IllegalArgumentException("optional cannot be null");
        }
        return optional.map(Option::some).orElseGet(Option::none);
    }

    // ========== 조회 ==========

    /**
     * 값이 존재하는지 확인.
     *
     * @return Some이면 true
     */
    default boolean isSome() {
        return this instanceof Some;
    }

    /**
     * 값이 없는지 확인.
     *
     * @return None이면 true
     */
    default boolean isNone() {
        return this instanceof None;
    }

    // ========== 추출 ==========

    /**
     * 값과 존재 여부를 함께 추출. 실패하지 않습니다.
     *
     * @return Some이면 (value, true), None이면 (null, false)
     */
    default Unwrapped<T> unwrap() {
        if (this instanceof Some<T> some) {
            return new Unwrapped<>(some.value(), true);
        }
        return new Unwrapped<>(null, false);
    }

    /**
     * 값 또는 기본값 반환.
     *
     * @param other None일 때 반환할 값
     * @return 담긴 값 또는 other
     */
    default T unwrapOr(T other) {
        if (this instanceof Some<T> some) {
            return some.value();
        }
        return other;
    }

    /**
     * 값 또는 Supplier가 계산한 값 반환.
     *
     * @param supplier None일 때만 호출됨
     * @return 담긴 값 또는 supplier 결과
     */
    default T unwrapOrElse(Supplier<? extends T> supplier) {
        if (this instanceof Some<T> some) {
            return some.value();
        }
        return supplier.get();
    }

    /**
     * 값 또는 {@code null} 반환.
     *
     * @return 담긴 값, None이면 null
     */
    default T unwrapOrDefault() {
        return unwrapOr(null);
    }

    /**
     * 값을 강제로 추출.
     *
     * <p>값이 반드시 존재한다고 확신할 때만 사용하십시오.</p>
     *
     * @return 담긴 값
     * @throws UnwrapException None인 경우 (프로그래밍 오류)
     */
    default T unwrapUnsafe() {
        if (this instanceof Some<T> some) {
            return some.value();
        }
        throw new UnwrapException("option is none");
    }

    // ========== 조합 ==========

    /**
     * Some이면 자신, None이면 other 반환.
     *
     * @param other 대체 Option
     * @return 자신 또는 other
     */
    default Option<T> or(Option<T> other) {
        if (isSome()) {
            return this;
        }
        return other;
    }

    /**
     * Some이면 자신, None이면 Supplier가 만든 Option 반환.
     *
     * @param supplier None일 때만 호출됨
     * @return 자신 또는 supplier 결과
     */
    default Option<T> orElse(Supplier<? extends Option<T>> supplier) {
        if (isSome()) {
            return this;
        }
        return supplier.get();
    }

    /**
     * 담긴 값을 변환.
     *
     * <p>None이면 fn을 호출하지 않고 동일한 None을 반환합니다.</p>
     *
     * @param fn 변환 함수
     * @param <U> 변환 결과 타입
     * @return Some(fn(value)) 또는 None
     */
    @SuppressWarnings("unchecked")
    default <U> Option<U> map(Function<? super T, ? extends U> fn) {
        if (this instanceof Some<T> some) {
            return some(fn.apply(some.value()));
        }
        return (Option<U>) (Option<?>) this;
    }

    /**
     * 담긴 값을 변환하거나 기본값 반환.
     *
     * <p>{@link #map(Function)}과 달리 Option으로 감싸지 않은 값을 반환합니다.</p>
     *
     * @param other None일 때 반환할 값
     * @param fn 변환 함수
     * @param <U> 결과 타입
     * @return fn(value) 또는 other
     */
    default <U> U mapOr(U other, Function<? super T, ? extends U> fn) {
        if (this instanceof Some<T> some) {
            return fn.apply(some.value());
        }
        return other;
    }

    /**
     * 담긴 값을 변환하거나 Supplier로 기본값 계산.
     *
     * @param noneHandler None일 때만 호출됨
     * @param someHandler Some일 때만 호출됨
     * @param <U> 결과 타입
     * @return someHandler(value) 또는 noneHandler()
     */
    default <U> U mapOrElse(Supplier<? extends U> noneHandler, Function<? super T, ? extends U> someHandler) {
        if (this instanceof Some<T> some) {
            return someHandler.apply(some.value());
        }
        return noneHandler.get();
    }

    /**
     * 상태에 맞는 핸들러로 분기. 두 핸들러 모두 Option을 반환합니다.
     *
     * @param someHandler Some일 때 값과 함께 호출됨
     * @param noneHandler None일 때 호출됨
     * @param <U> 결과 값 타입
     * @return 선택된 핸들러의 결과
     */
    default <U> Option<U> match(Function<? super T, Option<U>> someHandler, Supplier<Option<U>> noneHandler) {
        if (this instanceof Some<T> some) {
            return someHandler.apply(some.value());
        }
        return noneHandler.get();
    }

    // ========== 변환 ==========

    /**
     * Result로 변환.
     *
     * @param error None일 때 담을 오류
     * @return Ok(value) 또는 Err(error)
     * @throws IllegalArgumentException None이고 error가 null인 경우
     */
    default Result<T> okOr(Throwable error) {
        if (this instanceof Some<T> some) {
            return Result.ok(some.value());
        }
        return Result.err(error);
    }

    /**
     * Result로 변환. 오류는 None일 때만 계산됩니다.
     *
     * @param errorSupplier None일 때만 호출됨
     * @return Ok(value) 또는 Err(errorSupplier())
     */
    default Result<T> okOrElse(Supplier<? extends Throwable> errorSupplier) {
        if (this instanceof Some<T> some) {
            return Result.ok(some.value());
        }
        return Result.err(errorSupplier.get());
    }

    /**
     * {@link Optional}로 변환.
     *
     * <p>Optional은 null을 담을 수 없으므로 {@code Some(null)}은 빈 Optional이 됩니다.</p>
     *
     * @return JDK Optional
     */
    default Optional<T> toOptional() {
        if (this instanceof Some<T> some) {
            return Optional.ofNullable(some.value());
        }
        return Optional.empty();
    }
}
