/**
 * Pipeline runner adapter.
 *
 * <p>Drives executions over the step dependency graph on a thread-per-run coordinator.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.DefaultPipelineEngine}: validate, execute, cancel, lookup and eviction</li>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.DagPipelineRunner}: coordinator, step and attempt thread pools</li>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.StepAttemptRunner}: per-attempt timeout and fixed-backoff retries</li>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.ExecutionReaper}: eviction of finished executions past retention</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>Every event of an execution is published by its coordinator thread, so subscribers see
 * events in dispatch order. Step output is merged into the execution context on the same thread.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.runner;
