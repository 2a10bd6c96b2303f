/**
 * Core Result type.
 *
 * <p>This package defines the sealed {@link com.ryuqq.result.core.Result} hierarchy used to
 * return either a value or a typed failure from a fallible operation.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.result.core.Result} - Sealed interface (permits Success, Failure)</li>
 *   <li>{@link com.ryuqq.result.core.Success} - Holds the value of a successful operation</li>
 *   <li>{@link com.ryuqq.result.core.Failure} - Holds the reason an operation did not produce a value</li>
 * </ul>
 *
 * <h2>Supporting Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.result.core.HandlerFault} - Exception thrown by a side-effect handler</li>
 *   <li>{@link com.ryuqq.result.core.Displayable} - String rendering capability of a failure</li>
 *   <li>{@link com.ryuqq.result.core.ResultFailureException} - Thrown by getOrThrow() on a failure</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Every combinator returns a new Result</li>
 *   <li><strong>Exclusivity:</strong> A Result is exactly one of Success or Failure, never null inside</li>
 *   <li><strong>Failure as data:</strong> Only getOrThrow() raises; handler exceptions become failures</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Result Team
 */
package com.ryuqq.result.core;
