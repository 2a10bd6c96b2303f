/**
 * Async bridging between Result and CompletionStage.
 *
 * <p>This package lifts Results whose success value is a pending computation into futures of
 * Results, and aggregates element-wise asynchronous Results.</p>
 *
 * <h2>Entry Point</h2>
 * <ul>
 *   <li>{@link com.ryuqq.result.async.ResultFutures} - liftFuture, liftNestedFuture, lift, forEachFuture</li>
 * </ul>
 *
 * <h2>Module Position</h2>
 * <pre>
 * result-async (ResultFutures)
 *   ↓ depends on
 * result-core (Result, Results)
 * </pre>
 *
 * @author Result Team
 * @since 1.0.0
 */
package com.ryuqq.result.async;
