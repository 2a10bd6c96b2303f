/**
 * Aggregation of Result lists into a single Result.
 *
 * <p>{@link com.ryuqq.result.core.aggregate.Results} offers the all-or-nothing policy
 * (fromAll, forEachResult, forEachElement), the best-effort policy (fromAny) and a
 * failure-collecting left fold (reduceToResult).</p>
 *
 * @since 1.0.0
 * @author Result Team
 */
package com.ryuqq.result.core.aggregate;
