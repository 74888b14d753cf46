/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide concrete functionality for the Core SDK.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.spi.IdempotencyGuard} - Completed requestId tracking</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., relay-adapter-inmemory) are responsible for providing
 * concrete implementations of these SPIs.</p>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.core.spi;
