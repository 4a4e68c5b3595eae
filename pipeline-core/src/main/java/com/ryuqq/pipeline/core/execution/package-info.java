/**
 * Run-level and step-level execution records.
 *
 * <p>Records are created and mutated by the orchestrator only. Readers on other threads
 * (registry lookups, transport adapters) see consistent values through synchronized accessors.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.execution;
