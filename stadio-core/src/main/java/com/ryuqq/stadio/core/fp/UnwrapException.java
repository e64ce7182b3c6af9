package com.ryuqq.stadio.core.fp;

/**
 * 값이 없는 상태에서 강제 추출을 시도했을 때 발생하는 예외.
 *
 * <p>{@link Option#unwrapUnsafe()}를 None에 대해, {@link Result#unwrapUnsafe()}를
 * Err에 대해 호출한 경우에만 발생합니다. 데이터 오류가 아니라 프로그래밍 오류를 나타내므로
 * <strong>catch하지 마십시오.</strong> 호출 지점에서 버그가 드러나도록 그대로 전파되어야 합니다.</p>
 *
 * <p>값이 없을 수 있는 경우에는 {@code unwrapOr}, {@code unwrapOrElse},
 * {@code unwrap} 등 실패하지 않는 추출 연산을 사용하십시오.</p>
 *
 * @author Stadio Team
 * @since 1.0.0
 */
public class UnwrapException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 메시지로 생성.
     *
     * @param message 오류 메시지
     */
    public UnwrapException(String message) {
        super(message);
    }

    /**
     * 메시지와 원인으로 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인 (Err에 담겨 있던 오류)
     */
    public UnwrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
