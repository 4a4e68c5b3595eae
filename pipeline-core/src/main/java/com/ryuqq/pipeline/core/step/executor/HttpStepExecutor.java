package com.ryuqq.pipeline.core.step.executor;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.error.InputBindingException;
import com.ryuqq.pipeline.core.error.StepExecutionException;
import com.ryuqq.pipeline.core.model.StepConfig;
import com.ryuqq.pipeline.core.model.StepDefinition;
import com.ryuqq.pipeline.core.model.StepType;
import com.ryuqq.pipeline.core.spi.HttpCall;
import com.ryuqq.pipeline.core.spi.HttpReply;
import com.ryuqq.pipeline.core.spi.HttpTransport;
import com.ryuqq.pipeline.core.step.StepExecutor;
import com.ryuqq.pipeline.core.step.StepResult;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * HTTP-Call Step 실행기.
 *
 * <p><strong>설정 필드:</strong></p>
 * <ul>
 *   <li>url (필수, http:// 또는 https:// 또는 템플릿)</li>
 *   <li>method: GET, POST, PUT, DELETE, PATCH, HEAD, OPTIONS (기본 GET)</li>
 *   <li>headers, body (객체는 JSON, 문자열은 그대로 전송)</li>
 *   <li>timeout: 호출 1회의 초 단위 제한 (기본 30), Step 타임아웃과 별개</li>
 *   <li>auth: {type: bearer | basic | api_key, token | username, password | api_key, header_name}</li>
 *   <li>accept_status: 실패로 보지 않을 2xx 외 상태 코드 목록</li>
 * </ul>
 *
 * <p>출력: {@code {response, status_code, headers, url}}</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class HttpStepExecutor implements StepExecutor {

    static final int DEFAULT_TIMEOUT_SECONDS = 30;
    static final String DEFAULT_API_KEY_HEADER = "X-API-Key";
    private static final int ERROR_BODY_LIMIT = 500;

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS");
    private static final Set<String> AUTH_TYPES = Set.of("bearer", "basic", "api_key");

    private final HttpTransport transport;

    public HttpStepExecutor(HttpTransport transport) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        this.transport = transport;
    }

    @Override
    public StepType type() {
        return StepType.HTTP;
    }

    @Override
    public List<String> validate(StepDefinition step) {
        List<String> errors = new ArrayList<>();
        StepConfig config = step.config();

        String url = config.getString("url");
        if (url == null || url.isBlank()) {
            errors.add("url is required");
        } else if (!url.startsWith("http://") && !url.startsWith("https://") && !url.startsWith("{{")) {
            errors.add("url must start with http://, https:// or a template placeholder (current: " + url + ")");
        }

        String method = config.getString("method", "GET").toUpperCase();
        if (!METHODS.contains(method)) {
            errors.add("Unsupported HTTP method: " + method);
        }

        try {
            if (config.getInt("timeout", DEFAULT_TIMEOUT_SECONDS) <= 0) {
                errors.add("timeout must be positive (current: " + config.get("timeout") + ")");
            }
            config.getMap("headers");
            config.getList("accept_status");
            validateAuth(config.getMap("auth"), errors);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        return errors;
    }

    @Override
    public StepResult run(StepConfig config, Map<String, Object> inputs, ExecutionContext context) {
        try {
            // 1. 요청 구성
            HttpCall call = buildCall(config, inputs, context);

            // 2. I/O 경계 체크포인트 후 호출
            context.checkpoint();
            HttpReply reply = transport.send(call);

            // 3. 상태 코드 판정
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("response", reply.content());
            output.put("status_code", reply.statusCode());
            output.put("headers", reply.headers());
            output.put("url", call.url());

            Map<String, Object> metadata = Map.of("method", call.method(), "status_code", reply.statusCode());
            if (!reply.isSuccessful() && !isTolerated(config, reply.statusCode())) {
                return new StepResult(false, output, "HTTP " + reply.statusCode() + ": " + truncate(reply.body()),
                    0.0, 0, null, metadata, null);
            }
            return StepResult.success(output, 0.0, 0, metadata);

        } catch (InputBindingException | StepExecutionException e) {
            return StepResult.failure(e.getMessage());
        }
    }

    @Override
    public StepResult dryRun(StepConfig config, Map<String, Object> inputs, ExecutionContext context) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("response", Map.of("dry_run", true));
        output.put("status_code", 200);
        output.put("headers", Map.of());
        output.put("url", config.getString("url", ""));
        return StepResult.success(output, 0.0, 0, Map.of("method", config.getString("method", "GET").toUpperCase(), "dry_run", true));
    }

    private HttpCall buildCall(StepConfig config, Map<String, Object> inputs, ExecutionContext context) {
        String url = context.interpolateString(config.getString("url"), inputs);
        String method = config.getString("method", "GET").toUpperCase();

        Map<String, String> headers = new LinkedHashMap<>();
        Object resolvedHeaders = context.interpolate(config.getMap("headers"), inputs);
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) resolvedHeaders).entrySet()) {
            headers.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
        }
        applyAuth(context.interpolate(config.getMap("auth"), inputs), headers);

        Object body = config.contains("body") ? context.interpolate(config.get("body"), inputs) : null;
        Duration timeout = Duration.ofSeconds(config.getInt("timeout", DEFAULT_TIMEOUT_SECONDS));
        return new HttpCall(method, url, headers, body, timeout);
    }

    private static void applyAuth(Object authValue, Map<String, String> headers) {
        if (!(authValue instanceof Map) || ((Map<?, ?>) authValue).isEmpty()) {
            return;
        }
        Map<?, ?> auth = (Map<?, ?>) authValue;
        String type = String.valueOf(auth.get("type"));
        switch (type) {
            case "bearer" -> headers.put("Authorization", "Bearer " + auth.get("token"));
            case "basic" -> {
                String credentials = auth.get("username") + ":" + auth.get("password");
                headers.put("Authorization", "Basic "
                    + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
            }
            case "api_key" -> {
                Object headerName = auth.get("header_name");
                headers.put(headerName == null ? DEFAULT_API_KEY_HEADER : headerName.toString(),
                    String.valueOf(auth.get("api_key")));
            }
            default -> throw new StepExecutionException("Unsupported auth type: " + type);
        }
    }

    private static void validateAuth(Map<String, Object> auth, List<String> errors) {
        if (auth.isEmpty()) {
            return;
        }
        Object type = auth.get("type");
        if (type == null || !AUTH_TYPES.contains(type.toString())) {
            errors.add("auth.type must be one of " + AUTH_TYPES + " (current: " + type + ")");
            return;
        }
        switch (type.toString()) {
            case "bearer" -> requireField(auth, "token", errors);
            case "basic" -> {
                requireField(auth, "username", errors);
                requireField(auth, "password", errors);
            }
            default -> requireField(auth, "api_key", errors);
        }
    }

    private static void requireField(Map<String, Object> auth, String field, List<String> errors) {
        if (auth.get(field) == null) {
            errors.add("auth." + field + " is required");
        }
    }

    private static boolean isTolerated(StepConfig config, int statusCode) {
        for (Object accepted : config.getList("accept_status")) {
            if (ValueComparisons.equalsLoosely(accepted, statusCode)) {
                return true;
            }
        }
        return false;
    }

    private static String truncate(String body) {
        return body.length() <= ERROR_BODY_LIMIT ? body : body.substring(0, ERROR_BODY_LIMIT) + "...";
    }
}
