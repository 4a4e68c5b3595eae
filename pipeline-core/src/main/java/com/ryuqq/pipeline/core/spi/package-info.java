/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Collaborators the engine consumes through interfaces only. Adapter modules provide
 * the implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.spi.ModelClient} - model serving (prompt in, text and usage out)</li>
 *   <li>{@link com.ryuqq.pipeline.core.spi.HttpTransport} - outbound HTTP</li>
 *   <li>{@link com.ryuqq.pipeline.core.spi.CodeSandbox} - sandboxed snippet execution</li>
 *   <li>{@link com.ryuqq.pipeline.core.spi.EventChannel} - ordered, replayable event log per execution</li>
 *   <li>{@link com.ryuqq.pipeline.core.spi.ExecutionStore} - hand-off of terminal execution records</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> in-memory implementations for tests, network-backed ones for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.spi;
