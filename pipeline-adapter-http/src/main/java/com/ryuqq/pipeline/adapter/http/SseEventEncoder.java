package com.ryuqq.pipeline.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.pipeline.core.event.ExecutionEvent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Server-Sent Events 인코더.
 *
 * <p>이벤트 하나를 {@code data: {json}\n\n} 프레임으로 변환합니다. 키는 snake_case이며
 * 값이 없는 필드는 생략됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * data: {"type":"step_completed","execution_id":"...","sequence":3,"step_id":"summarize",...}
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SseEventEncoder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * SSE 프레임 생성.
     *
     * @param event 발행된 이벤트
     * @return {@code data: ...\n\n} 문자열
     * @throws IllegalArgumentException event가 null이거나 결과를 JSON으로 변환할 수 없는 경우
     */
    public String encode(ExecutionEvent event) {
        return "data: " + toJson(event) + "\n\n";
    }

    /**
     * 이벤트 JSON 본문.
     */
    public String toJson(ExecutionEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        try {
            return MAPPER.writeValueAsString(toFields(event));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 전송 필드 맵 (snake_case, null 생략).
     */
    public Map<String, Object> toFields(ExecutionEvent event) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", event.type().wireName());
        fields.put("execution_id", event.executionId().getValue());
        fields.put("sequence", event.sequence());
        fields.put("timestamp", event.timestamp().toString());
        putIfPresent(fields, "pipeline_id", event.pipelineId());
        putIfPresent(fields, "step_id", event.stepId());
        putIfPresent(fields, "step_name", event.stepName());
        putIfPresent(fields, "step_index", event.stepIndex());
        putIfPresent(fields, "total_steps", event.totalSteps());
        putIfPresent(fields, "result", event.result());
        putIfPresent(fields, "execution_time", event.executionTime());
        putIfPresent(fields, "cost", event.cost());
        putIfPresent(fields, "tokens_used", event.tokensUsed());
        putIfPresent(fields, "error", event.error());
        putIfPresent(fields, "final_output", event.finalOutput());
        putIfPresent(fields, "total_cost", event.totalCost());
        putIfPresent(fields, "total_tokens", event.totalTokens());
        putIfPresent(fields, "steps_completed", event.stepsCompleted());
        putIfPresent(fields, "debug", event.debug());
        return fields;
    }

    private static void putIfPresent(Map<String, Object> fields, String key, Object value) {
        if (value != null) {
            fields.put(key, value);
        }
    }
}
