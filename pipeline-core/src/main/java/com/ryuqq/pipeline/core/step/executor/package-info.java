/**
 * Built-in step executors: model call, code, HTTP, transform, condition and merge.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.step.executor;
