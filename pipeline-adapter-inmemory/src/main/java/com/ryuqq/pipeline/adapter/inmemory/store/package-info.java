/**
 * In-memory store for terminal execution records.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.adapter.inmemory.store;
