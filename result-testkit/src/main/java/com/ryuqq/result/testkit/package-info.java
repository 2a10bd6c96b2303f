/**
 * Testkit - AssertJ assertions for Result SDK types.
 *
 * <p>Downstream test suites use these assertions to verify Result and Optional values
 * without unwrapping them by hand.</p>
 *
 * <h2>Assertions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.result.testkit.ResultAssertions} - Static entry point</li>
 *   <li>{@link com.ryuqq.result.testkit.ResultAssert} - Success/failure state and payload checks</li>
 *   <li>{@link com.ryuqq.result.testkit.OptionalAssert} - Presence and value checks</li>
 * </ul>
 *
 * @author Result Team
 * @since 1.0.0
 */
package com.ryuqq.result.testkit;
