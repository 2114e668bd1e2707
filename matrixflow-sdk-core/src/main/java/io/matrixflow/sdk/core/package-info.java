/**
 * Protocol-centric core for the MatrixFlow SDK.
 *
 * <p>This module is framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and the exception hierarchy</li>
 *   <li>Lightweight utilities (header lookup, lexicographic query ordering)</li>
 *   <li>The Server-Sent Events reader used by the data-analysis stream: an idle-timeout
 *       {@link io.matrixflow.sdk.core.TimeoutInputStream}, an unbounded
 *       {@link io.matrixflow.sdk.core.LineReader} and the {@link io.matrixflow.sdk.core.SseParser}</li>
 * </ul>
 *
 * <p>HTTP and JSON bindings live in other modules.
 */
package io.matrixflow.sdk.core;
