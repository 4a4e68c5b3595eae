package com.ryuqq.pipeline.core.context;

import com.ryuqq.pipeline.core.error.ExecutionCancelledException;
import com.ryuqq.pipeline.core.model.ExecutionId;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 실행(run) 단위의 가변 저장소.
 *
 * <p>변수, Step 출력, 메타데이터와 진행 정보(현재 Step 인덱스, 전체 Step 수, 시작 시각)를
 * 보관하며 하나의 실행 안의 모든 Step에 공유됩니다. 서로 다른 실행은 컨텍스트를
 * 공유하지 않습니다.</p>
 *
 * <p><strong>동시성 규칙:</strong></p>
 * <ul>
 *   <li>동시에 실행되는 Step은 자유롭게 읽을 수 있음 (read lock)</li>
 *   <li>쓰기는 Step이 종료된 뒤 Orchestrator가 수행 ({@link #recordStepOutput}, {@link #set})</li>
 *   <li>잠금은 단일 연산 동안만 유지되며 Step 실행 중에는 잡지 않음</li>
 * </ul>
 *
 * <p><strong>조회 우선순위:</strong> 변수 → Step ID별 출력.
 * {@code {{fetch.response.items.0}}}은 변수에 {@code fetch}가 없으면 Step {@code fetch}의 출력에서 찾습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ExecutionContext {

    private final ExecutionId executionId;
    private final String pipelineId;
    private final int totalSteps;
    private final Instant startedAt;
    private final boolean debugMode;

    private final Map<String, Object> variables = new LinkedHashMap<>();
    private final Map<String, Object> stepOutputs = new LinkedHashMap<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean cancellationRequested = new AtomicBoolean(false);

    private volatile int currentStepIndex;

    public ExecutionContext(
        ExecutionId executionId,
        String pipelineId,
        Map<String, Object> initialVariables,
        int totalSteps,
        boolean debugMode
    ) {
        if (executionId == null) {
            throw new IllegalArgumentException("executionId cannot be null");
        }
        if (pipelineId == null) {
            throw new IllegalArgumentException("pipelineId cannot be null");
        }
        if (totalSteps < 0) {
            throw new IllegalArgumentException("totalSteps must not be negative (current: " + totalSteps + ")");
        }
        this.executionId = executionId;
        this.pipelineId = pipelineId;
        this.totalSteps = totalSteps;
        this.debugMode = debugMode;
        this.startedAt = Instant.now();
        if (initialVariables != null) {
            this.variables.putAll(initialVariables);
        }
    }

    public ExecutionId getExecutionId() {
        return executionId;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public int getTotalSteps() {
        return totalSteps;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public int getCurrentStepIndex() {
        return currentStepIndex;
    }

    public void setCurrentStepIndex(int currentStepIndex) {
        this.currentStepIndex = currentStepIndex;
    }

    public Object get(String name) {
        lock.readLock().lock();
        try {
            return variables.get(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void set(String name, Object value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        lock.writeLock().lock();
        try {
            variables.put(name, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Step 출력 기록 (Orchestrator 전용).
     *
     * @param stepId 종료된 Step ID
     * @param output Step의 원본 출력
     */
    public void recordStepOutput(String stepId, Object output) {
        lock.writeLock().lock();
        try {
            stepOutputs.put(stepId, output);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Object> stepOutput(String stepId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(stepOutputs.get(stepId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasStepOutput(String stepId) {
        lock.readLock().lock();
        try {
            return stepOutputs.containsKey(stepId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 점 경로 조회.
     *
     * @param path 예: {@code user.name}, {@code fetch.response.0}
     * @return 값 (없으면 empty)
     */
    public Optional<Object> lookup(String path) {
        PathLookup.Match match = match(path);
        return match.found() ? Optional.ofNullable(match.value()) : Optional.empty();
    }

    /**
     * Step 입력을 우선 조회하고, 없으면 컨텍스트에서 조회.
     *
     * @param path 점 경로
     * @param inputs Step에 바인딩된 입력
     * @return 값 (없으면 empty)
     */
    public Optional<Object> lookup(String path, Map<String, Object> inputs) {
        PathLookup.Match match = match(path, inputs);
        return match.found() ? Optional.ofNullable(match.value()) : Optional.empty();
    }

    /**
     * 점 경로 조회 (null로 저장된 값도 찾은 것으로 반환).
     *
     * <p>조회 순서: 변수 → Step 출력</p>
     */
    public PathLookup.Match match(String path) {
        if (path == null || path.isBlank()) {
            return PathLookup.Match.NONE;
        }
        String[] segments = PathLookup.split(path);
        lock.readLock().lock();
        try {
            PathLookup.Match fromVariables = PathLookup.match(variables, segments);
            if (fromVariables.found()) {
                return fromVariables;
            }
            return PathLookup.match(stepOutputs, segments);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Step 입력 → 변수 → Step 출력 순서의 점 경로 조회.
     */
    public PathLookup.Match match(String path, Map<String, Object> inputs) {
        if (inputs != null && !inputs.isEmpty()) {
            PathLookup.Match fromInputs = PathLookup.match(inputs, path);
            if (fromInputs.found()) {
                return fromInputs;
            }
        }
        return match(path);
    }

    /**
     * 템플릿 해석.
     *
     * @param template 문자열, Map, List 등
     * @return 해석된 값
     * @throws com.ryuqq.pipeline.core.error.InputBindingException 해석 불가 placeholder가 있는 경우
     */
    public Object interpolate(Object template) {
        return TemplateResolver.resolve(template, this::match);
    }

    public String interpolateString(String template) {
        return TemplateResolver.resolveToString(template, this::match);
    }

    /**
     * Step 입력을 포함한 템플릿 해석.
     */
    public Object interpolate(Object template, Map<String, Object> inputs) {
        return TemplateResolver.resolve(template, path -> match(path, inputs));
    }

    public String interpolateString(String template, Map<String, Object> inputs) {
        return TemplateResolver.resolveToString(template, path -> match(path, inputs));
    }

    /**
     * 변수 Map의 읽기 전용 복사본.
     */
    public Map<String, Object> snapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, Object> stepOutputsSnapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(stepOutputs));
        } finally {
            lock.readLock().unlock();
        }
    }

    public void putMetadata(String key, Object value) {
        lock.writeLock().lock();
        try {
            metadata.put(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Map<String, Object> getMetadata() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        } finally {
            lock.readLock().unlock();
        }
    }

    public void requestCancellation() {
        cancellationRequested.set(true);
    }

    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }

    /**
     * 협력적 취소 체크포인트.
     *
     * <p>실행기는 I/O 경계(모델 호출, HTTP 호출, 샌드박스 호출) 직전에 호출합니다.</p>
     *
     * @throws ExecutionCancelledException 취소가 요청된 경우
     */
    public void checkpoint() {
        if (cancellationRequested.get() || Thread.currentThread().isInterrupted()) {
            throw new ExecutionCancelledException(executionId.getValue());
        }
    }
}
