/**
 * In-memory event channel.
 *
 * <h2>Delivery</h2>
 * <ul>
 *   <li><strong>Ordering:</strong> per execution, in publish order</li>
 *   <li><strong>At-least-once:</strong> subscribers may replay from any sequence</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.adapter.inmemory.event;
