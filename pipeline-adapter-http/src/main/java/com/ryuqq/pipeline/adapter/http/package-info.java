/**
 * HTTP adapter.
 *
 * <p>{@code java.net.http} implementations of the outbound SPIs plus the SSE wire encoder.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.adapter.http.JdkHttpTransport}: transport for the HTTP step</li>
 *   <li>{@link com.ryuqq.pipeline.adapter.http.OllamaModelClient}: model client for the model-call step</li>
 *   <li>{@link com.ryuqq.pipeline.adapter.http.SseEventEncoder}: {@code data: {json}} frames for event streams</li>
 * </ul>
 *
 * <p>JSON handling uses Jackson {@code ObjectMapper}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.http;
