/**
 * Monadic value wrappers for optional and fallible values.
 *
 * <p>This package defines two closed, immutable sum types that replace null references
 * and exception-based control flow for expected absence and failure.</p>
 *
 * <h2>Sealed Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stadio.core.fp.Option} - Sealed interface (permits Some, None)</li>
 *   <li>{@link com.ryuqq.stadio.core.fp.Result} - Sealed interface (permits Ok, Err)</li>
 * </ul>
 *
 * <h2>Adapters</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stadio.core.fp.Results} - Wraps exception-throwing code into a Result</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Result&lt;Config&gt; config = Option.fromNullable(System.getenv("APP_CONFIG"))
 *     .okOr(new IllegalStateException("APP_CONFIG not set"))
 *     .match(
 *         path -&gt; Results.attempt(() -&gt; Config.load(path)),
 *         Result::err
 *     );
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Closed States:</strong> Each type has exactly two states, never a nullable field</li>
 *   <li><strong>Immutability:</strong> Every combinator returns a new instance (or the receiver)</li>
 *   <li><strong>Laziness:</strong> Supplier arguments run only on the branch that needs them</li>
 *   <li><strong>Loud Faults:</strong> Only {@code unwrapUnsafe()} throws, with {@link com.ryuqq.stadio.core.fp.UnwrapException}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Stadio Team
 */
package com.ryuqq.stadio.core.fp;
