package com.ryuqq.stadio.collections;

import com.ryuqq.stadio.core.fp.Option;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * {@link Option}을 사용하는 List 헬퍼.
 *
 * <p>모든 메서드는 입력 List를 변경하지 않고 새 List 또는 Option을 반환합니다.</p>
 *
 * @author Stadio Team
 * @since 1.0.0
 */
public final class Slices {

    private Slices() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 필터와 변환을 한 번에 수행.
     *
     * <p>각 원소에 fn을 적용하여 Some인 결과만 순서대로 모읍니다.</p>
     *
     * <pre>
     * Slices.filterMap(List.of(1, 2, 3), x -&gt; x % 2 == 0 ? Option.some(x * x) : Option.none());
     * // [4]
     * </pre>
     *
     * @param list 입력 List
     * @param fn 원소별 변환 함수 (None이면 제외)
     * @param <T> 입력 원소 타입
     * @param <U> 결과 원소 타입
     * @return Some 결과를 담은 새 List
     * @throws IllegalArgumentException list 또는 fn이 null인 경우
     */
    public static <T, U> List<U> filterMap(List<T> list, Function<? super T, Option<U>> fn) {
        requireArgs(list, fn);

        List<U> result = new ArrayList<>();
        for (T item : list) {
            Option.Unwrapped<U> unwrapped = fn.apply(item).unwrap();
            if (unwrapped.present()) {
                result.add(unwrapped.value());
            }
        }
        return result;
    }

    /**
     * 조건을 만족하는 첫 원소를 찾음.
     *
     * @param list 입력 List
     * @param predicate 조건
     * @param <T> 원소 타입
     * @return 첫 일치 원소, 없으면 None
     * @throws IllegalArgumentException list 또는 predicate가 null인 경우
     */
    public static <T> Option<T> find(List<T> list, Predicate<? super T> predicate) {
        requireArgs(list, predicate);

        for (T item : list) {
            if (predicate.test(item)) {
                return Option.some(item);
            }
        }
        return Option.none();
    }

    /**
     * 인덱스로 원소 조회.
     *
     * @param list 입력 List
     * @param index 인덱스
     * @param <T> 원소 타입
     * @return 원소, 범위를 벗어나면 (음수 포함) None
     * @throws IllegalArgumentException list가 null인 경우
     */
    public static <T> Option<T> get(List<T> list, int index) {
        if (list == null) {
            throw new IllegalArgumentException("list cannot be null");
        }
        if (index < 0 || index >= list.size()) {
            return Option.none();
        }
        return Option.some(list.get(index));
    }

    private static void requireArgs(List<?> list, Object fn) {
        if (list == null) {
            throw new IllegalArgumentException("list cannot be null");
        }
        if (fn == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
    }
}
