/**
 * Typed execution events.
 *
 * <p>Events are plain records; wire encoding (SSE, WebSocket) belongs to a transport adapter.
 * Within one execution, events are published by a single coordinator thread, so their
 * sequence numbers reflect the order of state transitions.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.event;
