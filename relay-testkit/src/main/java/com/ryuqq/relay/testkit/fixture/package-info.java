/**
 * Deterministic test doubles: clock, sleeper, providers and event listener.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.testkit.fixture;
