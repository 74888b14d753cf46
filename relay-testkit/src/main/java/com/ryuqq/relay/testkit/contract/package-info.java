/**
 * Reusable contract tests for protection and SPI implementations.
 *
 * <p>Adapters extend the abstract classes here and supply a factory method;
 * the inherited {@code @Test} methods then run against the adapter.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.testkit.contract;
