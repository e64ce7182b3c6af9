package com.ryuqq.stadio.core.fp;

/**
 * checked 예외를 던질 수 있는 Supplier.
 *
 * @param <T> 결과 타입
 * @see Results#attempt(ThrowingSupplier)
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {

    T get() throws Exception;
}
