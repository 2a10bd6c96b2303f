/**
 * Presence/absence wrapper without a failure payload.
 *
 * @since 1.0.0
 * @author Result Team
 */
package com.ryuqq.result.core.optional;
