package com.ryuqq.stadio.core.fp;

/**
 * checked 예외를 던질 수 있는 Runnable.
 *
 * @see Results#attemptRun(ThrowingRunnable)
 */
@FunctionalInterface
public interface ThrowingRunnable {

    void run() throws Exception;
}
