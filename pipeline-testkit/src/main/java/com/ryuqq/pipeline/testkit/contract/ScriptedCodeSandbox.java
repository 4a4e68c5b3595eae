package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.spi.CodeOutcome;
import com.ryuqq.pipeline.core.spi.CodeRequest;
import com.ryuqq.pipeline.core.spi.CodeSandbox;
import com.ryuqq.pipeline.core.spi.SandboxSession;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Code sandbox double for contract tests.
 *
 * <p>Runs the configured function instead of interpreting code and tracks session open/close
 * so tests can check that every session is released.</p>
 */
public class ScriptedCodeSandbox implements CodeSandbox {

    private final List<CodeRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger openSessions = new AtomicInteger();
    private volatile Function<CodeRequest, CodeOutcome> behavior =
        request -> CodeOutcome.success(request.inputs(), "");

    @Override
    public SandboxSession open(String language) {
        openSessions.incrementAndGet();
        return new SandboxSession() {
            private boolean closed;

            @Override
            public CodeOutcome run(CodeRequest request) {
                requests.add(request);
                return behavior.apply(request);
            }

            @Override
            public void close() {
                if (!closed) {
                    closed = true;
                    openSessions.decrementAndGet();
                }
            }
        };
    }

    @Override
    public Set<String> supportedLanguages() {
        return Set.of("python", "javascript");
    }

    public ScriptedCodeSandbox behave(Function<CodeRequest, CodeOutcome> behavior) {
        this.behavior = behavior;
        return this;
    }

    public List<CodeRequest> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    public int openSessions() {
        return openSessions.get();
    }

    public void clear() {
        requests.clear();
    }
}
