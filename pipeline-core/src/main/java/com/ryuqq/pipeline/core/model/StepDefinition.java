package com.ryuqq.pipeline.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 파이프라인을 구성하는 단일 Step 정의 (불변 record).
 *
 * <p><strong>기본값:</strong> retryCount=0, timeout=300초, enabled=true</p>
 *
 * <pre>
 * StepDefinition step = StepDefinition.builder("summarize", StepType.MODEL_CALL)
 *     .name("Summarize")
 *     .config(Map.of("model_id", "llama3", "prompt", "Summarize {{text}}"))
 *     .dependsOn("fetch")
 *     .outputs("summary")
 *     .retryCount(2)
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id 파이프라인 내 고유 ID
 * @param name 표시 이름
 * @param type Step 종류
 * @param config 종류별 설정
 * @param dependsOn upstream Step ID 목록
 * @param inputs 선언된 입력 이름
 * @param outputs 선언된 출력 이름
 * @param retryCount 실패 후 재시도 횟수 (0 이상)
 * @param timeout 시도 1회당 타임아웃 (양수)
 * @param enabled 비활성화 시 SKIPPED로 처리
 */
public record StepDefinition(
    String id,
    String name,
    StepType type,
    StepConfig config,
    List<String> dependsOn,
    List<String> inputs,
    List<String> outputs,
    int retryCount,
    Duration timeout,
    boolean enabled
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

    public StepDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException(
                "retryCount must not be negative (current: " + retryCount + ")"
            );
        }
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        name = (name == null || name.isBlank()) ? id : name;
        config = config == null ? StepConfig.empty() : config;
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public static Builder builder(String id, StepType type) {
        return new Builder(id, type);
    }

    /**
     * StepDefinition 빌더.
     */
    public static final class Builder {

        private final String id;
        private final StepType type;
        private String name;
        private StepConfig config = StepConfig.empty();
        private final List<String> dependsOn = new ArrayList<>();
        private final List<String> inputs = new ArrayList<>();
        private final List<String> outputs = new ArrayList<>();
        private int retryCount;
        private Duration timeout = DEFAULT_TIMEOUT;
        private boolean enabled = true;

        private Builder(String id, StepType type) {
            this.id = id;
            this.type = type;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder config(Map<String, ?> config) {
            this.config = StepConfig.of(config);
            return this;
        }

        public Builder config(StepConfig config) {
            this.config = config;
            return this;
        }

        public Builder dependsOn(String... stepIds) {
            this.dependsOn.addAll(List.of(stepIds));
            return this;
        }

        public Builder inputs(String... names) {
            this.inputs.addAll(List.of(names));
            return this;
        }

        public Builder outputs(String... names) {
            this.outputs.addAll(List.of(names));
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(id, name, type, config, dependsOn, inputs, outputs,
                retryCount, timeout, enabled);
        }
    }
}
