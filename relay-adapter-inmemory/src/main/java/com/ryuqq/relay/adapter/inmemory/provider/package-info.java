/**
 * Simulated delivery providers for demos and tests.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.inmemory.provider;
