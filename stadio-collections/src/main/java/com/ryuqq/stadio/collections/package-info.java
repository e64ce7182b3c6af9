/**
 * Option-aware helpers over {@code java.util} collections.
 *
 * <ul>
 *   <li>{@link com.ryuqq.stadio.collections.Slices} - filterMap, find, get over {@link java.util.List}</li>
 *   <li>{@link com.ryuqq.stadio.collections.Maps} - filterMap, get over {@link java.util.Map}</li>
 * </ul>
 *
 * <p>Inputs are never mutated; every operation returns a new collection or an
 * {@link com.ryuqq.stadio.core.fp.Option}.</p>
 *
 * @since 1.0.0
 * @author Stadio Team
 */
package com.ryuqq.stadio.collections;
