/**
 * Dependency graph over the steps of one definition, shared by the validator and the orchestrator.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.graph;
