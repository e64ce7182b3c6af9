package com.ryuqq.stadio.core.fp;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 런타임 타입별 zero 값 판정.
 *
 * <p>{@link Option#fromZero(Object)}가 사용합니다. 다음 값을 zero로 간주합니다:</p>
 * <ul>
 *   <li>{@code null}</li>
 *   <li>수치 0 ({@code Integer}, {@code Long}, {@code Short}, {@code Byte},
 *       {@code Double}, {@code Float}, {@code BigInteger}, {@code BigDecimal})</li>
 *   <li>{@code Boolean.FALSE}</li>
 *   <li>{@code '\0'}</li>
 *   <li>빈 문자열 {@code ""}</li>
 * </ul>
 *
 * <p>그 외 타입은 {@code null}일 때만 zero입니다.</p>
 *
 * @author Stadio Team
 * @since 1.0.0
 */
final class ZeroValues {

    private ZeroValues() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 값이 해당 타입의 zero 값인지 확인.
     *
     * @param value 검사할 값 (null 허용)
     * @return zero 값이면 true
     */
    static boolean isZero(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue() == 0L;
        }
        if (value instanceof Double || value instanceof Float) {
            // -0.0 == 0.0, NaN은 zero 아님
            return ((Number) value).doubleValue() == 0.0;
        }
        if (value instanceof BigInteger bigInteger) {
            return bigInteger.signum() == 0;
        }
        if (value instanceof BigDecimal bigDecimal) {
            return bigDecimal.signum() == 0;
        }
        if (value instanceof Boolean bool) {
            return !bool;
        }
        if (value instanceof Character character) {
            return character == '\0';
        }
        if (value instanceof String string) {
            return string.isEmpty();
        }
        return false;
    }
}
