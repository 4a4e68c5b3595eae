/**
 * Structural validation of pipeline definitions before execution.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.validation;
