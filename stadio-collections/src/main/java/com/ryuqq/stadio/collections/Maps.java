package com.ryuqq.stadio.collections;

import com.ryuqq.stadio.core.fp.Option;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * {@link Option}을 사용하는 Map 헬퍼.
 *
 * <p>입력 Map은 변경하지 않습니다.</p>
 *
 * @author Stadio Team
 * @since 1.0.0
 */
public final class Maps {

    private Maps() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 엔트리 필터와 키/값 변환을 한 번에 수행.
     *
     * <p>fn이 Some(entry)를 반환한 엔트리만 결과에 포함됩니다. 변환된 키가 겹치면
     * 입력 Map의 순회 순서상 나중 엔트리가 남습니다.</p>
     *
     * @param map 입력 Map
     * @param fn (key, value) → Option(새 엔트리)
     * @param <K1> 입력 키 타입
     * @param <V1> 입력 값 타입
     * @param <K2> 결과 키 타입
     * @param <V2> 결과 값 타입
     * @return 입력 순회 순서를 유지하는 새 Map
     * @throws IllegalArgumentException map 또는 fn이 null인 경우
     */
    public static <K1, V1, K2, V2> Map<K2, V2> filterMap(
        Map<K1, V1> map,
        BiFunction<? super K1, ? super V1, Option<Map.Entry<K2, V2>>> fn
    ) {
        if (map == null) {
            throw new IllegalArgumentException("map cannot be null");
        }
        if (fn == null) {
            throw new IllegalArgumentException("function cannot be null");
        }

        Map<K2, V2> result = new LinkedHashMap<>();
        for (Map.Entry<K1, V1> entry : map.entrySet()) {
            Option.Unwrapped<Map.Entry<K2, V2>> unwrapped = fn.apply(entry.getKey(), entry.getValue()).unwrap();
            if (unwrapped.present()) {
                result.put(unwrapped.value().getKey(), unwrapped.value().getValue());
            }
        }
        return result;
    }

    /**
     * 키로 값 조회.
     *
     * <p>키가 존재하면 값이 null이어도 Some(null)을 반환합니다. null 키를 허용하지 않는 Map
     * ({@code Map.of}, 자연 순서 {@code TreeMap}, {@code ConcurrentHashMap} 등)에 null 키로
     * 조회하면 None을 반환합니다.</p>
     *
     * @param map 입력 Map
     * @param key 키
     * @param <K> 키 타입
     * @param <V> 값 타입
     * @return 키가 있으면 Some(value), 없으면 None
     * @throws IllegalArgumentException map이 null인 경우
     */
    public static <K, V> Option<V> get(Map<K, V> map, K key) {
        if (map == null) {
            throw new IllegalArgumentException("map cannot be null");
        }
        if (key == null) {
            return getNullKey(map);
        }
        V value = map.get(key);
        return Option.fromTuple(value, value != null || map.containsKey(key));
    }

    private static <K, V> Option<V> getNullKey(Map<K, V> map) {
        try {
            return Option.fromTuple(map.get(null), map.containsKey(null));
        } catch (NullPointerException e) {
            // null 키를 허용하지 않는 Map
            return Option.none();
        }
    }
}
