package com.ryuqq.stadio.core.fp;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.Arrays;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Result 테스트.
 *
 * <p>Ok/Err 상태 조회, 추출, 조합과 다음 비대칭 동작을 검증합니다:</p>
 * <ul>
 *   <li>mapOr, mapOrElse는 Err에서도 항상 Ok를 반환</li>
 *   <li>andThen은 현재 값을 받지 않는 Supplier로 다음 단계를 연결</li>
 * </ul>
 *
 * @author Stadio Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ResultTest {

    private static final IOException ERROR = new IOException("disk full");

    @Mock
    private Supplier<Integer> supplier;

    @Mock
    private Function<Integer, Integer> fn;

    // ========== 생성 / 조회 ==========

    @Test
    void ok_IsOk() {
        // Given
        Result<Integer> result = Result.ok(1);

        // When & Then
        assertTrue(result.isOk());
        assertFalse(result.isErr());
        assertEquals(new Result.Unwrapped<>(1, null), result.unwrap());
    }

    @Test
    void err_IsErr() {
        // Given
        Result<Integer> result = Result.err(ERROR);

        // When & Then
        assertFalse(result.isOk());
        assertTrue(result.isErr());
        assertEquals(new Result.Unwrapped<Integer>(null, ERROR), result.unwrap());
    }

    @Test
    void err_NullError_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Result.err(null)
        );
        assertTrue(exception.getMessage().contains("error cannot be null"));
    }

    @Test
    void okZero_IsOkWithNullValue() {
        // When
        Result<String> result = Result.okZero();

        // Then
        assertTrue(result.isOk());
        assertNull(result.unwrapUnsafe());
    }

    @Test
    void sealedInterfaces_DeclareNoConstantFields() {
        // 상수 필드는 Results.OK_ANY처럼 별도 클래스에 둠 (인터페이스 ↔ record 초기화 순환)
        assertThat(Arrays.stream(Result.class.getDeclaredFields()).filter(f -> !f.isSynthetic())).isEmpty();
        assertThat(Arrays.stream(Option.class.getDeclaredFields()).filter(f -> !f.isSynthetic())).isEmpty();
    }

    // ========== 추출 ==========

    @Test
    void unwrapUnsafe_Ok_ReturnsValue() {
        assertEquals(1, Result.ok(1).unwrapUnsafe());
    }

    @Test
    void unwrapUnsafe_Err_ThrowsWithErrorText() {
        // Given
        Result<Integer> result = Result.err(ERROR);

        // When & Then
        assertThatThrownBy(result::unwrapUnsafe)
            .isInstanceOf(UnwrapException.class)
            .hasMessageContaining("result is error")
            .hasMessageContaining("disk full")
            .hasCause(ERROR);
    }

    @Test
    void unwrapOr_Err_ReturnsDefault() {
        assertEquals(9, Result.<Integer>err(ERROR).unwrapOr(9));
        assertEquals(1, Result.ok(1).unwrapOr(9));
    }

    @Test
    void unwrapOrElse_Ok_DoesNotInvokeSupplier() {
        // When
        Integer value = Result.ok(1).unwrapOrElse(supplier);

        // Then
        assertEquals(1, value);
        verify(supplier, never()).get();
    }

    @Test
    void unwrapOrElse_Err_InvokesSupplierOnce() {
        // Given
        when(supplier.get()).thenReturn(9);

        // When
        Integer value = Result.<Integer>err(ERROR).unwrapOrElse(supplier);

        // Then
        assertEquals(9, value);
        verify(supplier, times(1)).get();
    }

    @Test
    void unwrapOrDefault_Err_ReturnsNull() {
        assertNull(Result.<Integer>err(ERROR).unwrapOrDefault());
    }

    // ========== 조합 ==========

    @Test
    void or_OkReturnsSelf_ErrReturnsOther() {
        // Given
        Result<Integer> ok = Result.ok(1);
        Result<Integer> fallback = Result.ok(2);

        // When & Then
        assertSame(ok, ok.or(fallback));
        assertSame(fallback, Result.<Integer>err(ERROR).or(fallback));
    }

    @Test
    void orElse_Ok_DoesNotInvokeSupplier() {
        // Given
        int[] calls = {0};
        Supplier<Result<Integer>> fallback = () -> {
            calls[0]++;
            return Result.ok(2);
        };

        // When
        Result<Integer> fromOk = Result.ok(1).orElse(fallback);
        Result<Integer> fromErr = Result.<Integer>err(ERROR).orElse(fallback);

        // Then
        assertEquals(Result.ok(1), fromOk);
        assertEquals(Result.ok(2), fromErr);
        assertEquals(1, calls[0]);
    }

    @Test
    void and_Ok_ReturnsOther() {
        assertEquals(2, Result.ok(1).and(Result.ok(2)).unwrapUnsafe());
    }

    @Test
    void and_Err_PreservesOriginalError() {
        // When
        Result<Integer> result = Result.<Integer>err(ERROR).and(Result.ok(2));

        // Then
        assertTrue(result.isErr());
        assertSame(ERROR, result.unwrap().error());
    }

    @Test
    void andThen_Ok_WrapsSupplierResultIgnoringCurrentValue() {
        // Given
        when(supplier.get()).thenReturn(42);

        // When
        Result<Integer> result = Result.ok(1).andThen(supplier);

        // Then
        assertEquals(Result.ok(42), result);
        verify(supplier, times(1)).get();
    }

    @Test
    void andThen_Err_DoesNotInvokeSupplier() {
        // Given
        Result<Integer> err = Result.err(ERROR);

        // When
        Result<Integer> result = err.andThen(supplier);

        // Then
        assertSame(err, result);
        verifyNoInteractions(supplier);
    }

    @Test
    void map_Ok_AppliesFunction() {
        // Given
        when(fn.apply(2)).thenReturn(4);

        // When & Then
        assertEquals(Result.ok(4), Result.ok(2).map(fn));
    }

    @Test
    void map_Err_ReturnsSelfWithoutInvokingFunction() {
        // Given
        Result<Integer> err = Result.err(ERROR);

        // When
        Result<Integer> mapped = err.map(fn);

        // Then
        assertSame(err, mapped);
        verifyNoInteractions(fn);
    }

    @Test
    void mapOr_Err_CollapsesToOkWithDefault() {
        // Given
        Result<Integer> err = Result.err(ERROR);

        // When
        Result<Integer> mapped = err.mapOr(1, x -> x * 10);

        // Then
        // Option.mapOr는 값을 그대로 반환하지만 Result.mapOr는 Ok로 감싸 반환
        assertTrue(mapped.isOk());
        assertEquals(new Result.Unwrapped<>(1, null), mapped.unwrap());
    }

    @Test
    void mapOr_Ok_AppliesFunction() {
        assertEquals(Result.ok(30), Result.ok(3).mapOr(1, x -> x * 10));
    }

    @Test
    void mapOrElse_Err_CollapsesToOkWithHandlerResult() {
        // When
        Result<String> mapped = Result.<Integer>err(ERROR)
            .mapOrElse(Throwable::getMessage, String::valueOf);

        // Then
        assertTrue(mapped.isOk());
        assertEquals("disk full", mapped.unwrapUnsafe());
    }

    @Test
    void mapOrElse_Ok_InvokesOkHandler() {
        // When
        Result<String> mapped = Result.ok(7).mapOrElse(Throwable::getMessage, String::valueOf);

        // Then
        assertEquals(Result.ok("7"), mapped);
    }

    @Test
    void match_DispatchesToMatchingHandler() {
        // Given
        Function<Integer, Result<Integer>> onOk = x -> Result.ok(x + 1);
        Function<Throwable, Result<Integer>> onErr = e -> Result.ok(-1);

        // When
        Result<Integer> fromOk = Result.ok(1).match(onOk, onErr);
        Result<Integer> fromErr = Result.<Integer>err(ERROR).match(onOk, onErr);

        // Then
        assertThat(fromOk).isEqualTo(Result.ok(2));
        assertThat(fromErr).isEqualTo(Result.ok(-1));
    }

    @Test
    void match_ErrHandlerCanStayInErr() {
        // Given
        IllegalStateException wrapped = new IllegalStateException("wrapped", ERROR);

        // When
        Result<Integer> result = Result.<Integer>err(ERROR).match(Result::ok, e -> Result.err(wrapped));

        // Then
        assertThat(result.unwrap().error()).isSameAs(wrapped);
    }

    // ========== 불변성 ==========

    @Test
    void repeatedQueries_SameInstance_ReturnIdenticalResults() {
        // Given
        Result<Integer> ok = Result.ok(8);
        Result<Integer> err = Result.err(ERROR);

        // When & Then
        for (int i = 0; i < 3; i++) {
            assertEquals(new Result.Unwrapped<>(8, null), ok.unwrap());
            assertEquals(8, ok.unwrapOr(0));
            assertTrue(err.isErr());
            assertSame(ERROR, err.unwrap().error());
            assertEquals(0, err.unwrapOr(0));
        }
    }
}
