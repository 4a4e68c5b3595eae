/**
 * In-memory execution registry.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.adapter.inmemory.registry;
