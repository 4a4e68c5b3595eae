package com.ryuqq.pipeline.core.graph;

import com.ryuqq.pipeline.core.model.Connection;
import com.ryuqq.pipeline.core.model.PipelineDefinition;
import com.ryuqq.pipeline.core.model.StepDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Step 의존 그래프.
 *
 * <p><strong>간선 (upstream → downstream):</strong></p>
 * <ul>
 *   <li>{@code depends_on}: 의존 대상 → Step</li>
 *   <li>Connection: source Step → target Step</li>
 *   <li>분기: Condition Step → true_branch / false_branch 대상</li>
 * </ul>
 *
 * <p>정의에 없는 Step ID를 가리키는 간선은 무시됩니다 (검증기가 따로 보고).
 * 모든 순회 결과는 선언 순서를 따르므로 결정적입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DependencyGraph {

    private final List<String> stepIds;
    private final Map<String, Integer> order;
    private final Map<String, Set<String>> upstreams;
    private final Map<String, Set<String>> downstreams;

    private DependencyGraph(List<String> stepIds, Map<String, Set<String>> upstreams, Map<String, Set<String>> downstreams) {
        this.stepIds = List.copyOf(stepIds);
        this.order = new HashMap<>();
        for (int i = 0; i < stepIds.size(); i++) {
            order.putIfAbsent(stepIds.get(i), i);
        }
        this.upstreams = upstreams;
        this.downstreams = downstreams;
    }

    /**
     * 정의로부터 그래프 생성.
     *
     * @param definition 파이프라인 정의
     * @param branchTargets Step별 분기 대상 조회 함수 (Condition 외에는 빈 목록)
     * @return 의존 그래프
     */
    public static DependencyGraph of(PipelineDefinition definition, Function<StepDefinition, List<String>> branchTargets) {
        List<String> ids = new ArrayList<>();
        Map<String, Set<String>> up = new LinkedHashMap<>();
        Map<String, Set<String>> down = new LinkedHashMap<>();
        for (StepDefinition step : definition.steps()) {
            if (!up.containsKey(step.id())) {
                ids.add(step.id());
                up.put(step.id(), new LinkedHashSet<>());
                down.put(step.id(), new LinkedHashSet<>());
            }
        }

        for (StepDefinition step : definition.steps()) {
            for (String dependency : step.dependsOn()) {
                link(dependency, step.id(), up, down);
            }
            for (String target : branchTargets.apply(step)) {
                link(step.id(), target, up, down);
            }
        }
        for (Connection connection : definition.connections()) {
            link(connection.sourceStepId(), connection.targetStepId(), up, down);
        }

        DependencyGraph graph = new DependencyGraph(ids, up, down);
        graph.sortAdjacency();
        return graph;
    }

    private static void link(String from, String to, Map<String, Set<String>> up, Map<String, Set<String>> down) {
        if (!up.containsKey(from) || !up.containsKey(to)) {
            return;
        }
        up.get(to).add(from);
        down.get(from).add(to);
    }

    private void sortAdjacency() {
        Comparator<String> byOrder = Comparator.comparingInt(order::get);
        for (String id : stepIds) {
            upstreams.put(id, sorted(upstreams.get(id), byOrder));
            downstreams.put(id, sorted(downstreams.get(id), byOrder));
        }
    }

    private static Set<String> sorted(Set<String> ids, Comparator<String> comparator) {
        List<String> list = new ArrayList<>(ids);
        list.sort(comparator);
        return Collections.unmodifiableSet(new LinkedHashSet<>(list));
    }

    public List<String> stepIds() {
        return stepIds;
    }

    public Set<String> upstreamsOf(String stepId) {
        return upstreams.getOrDefault(stepId, Set.of());
    }

    public Set<String> downstreamsOf(String stepId) {
        return downstreams.getOrDefault(stepId, Set.of());
    }

    /**
     * 선언 순서상의 위치.
     */
    public int orderOf(String stepId) {
        Integer index = order.get(stepId);
        if (index == null) {
            throw new IllegalArgumentException("Unknown step: " + stepId);
        }
        return index;
    }

    /**
     * 깊이 우선 탐색으로 순환 탐지.
     *
     * <p>방문 중(visiting) 집합에 있는 Step을 다시 만나면 순환입니다.
     * 결과 경로는 시작 Step으로 끝납니다 (예: A, B, C, A).</p>
     *
     * @return 첫 번째로 발견된 순환 경로 (없으면 empty)
     */
    public Optional<List<String>> findCycle() {
        Set<String> visited = new HashSet<>();
        Set<String> visiting = new HashSet<>();
        Deque<String> path = new ArrayDeque<>();

        for (String id : stepIds) {
            if (!visited.contains(id)) {
                Optional<List<String>> cycle = visit(id, visited, visiting, path);
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<List<String>> visit(String id, Set<String> visited, Set<String> visiting, Deque<String> path) {
        visiting.add(id);
        path.addLast(id);

        for (String next : downstreamsOf(id)) {
            if (visiting.contains(next)) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String onPath : path) {
                    if (onPath.equals(next)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycle.add(onPath);
                    }
                }
                cycle.add(next);
                return Optional.of(cycle);
            }
            if (!visited.contains(next)) {
                Optional<List<String>> cycle = visit(next, visited, visiting, path);
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
        }

        path.removeLast();
        visiting.remove(id);
        visited.add(id);
        return Optional.empty();
    }

    /**
     * Kahn 알고리즘으로 위상 계층 계산.
     *
     * <p>각 계층은 이전 계층들에만 의존하는 Step들이며, 계층 내부는 선언 순서입니다.</p>
     *
     * @return 계층 목록
     * @throws IllegalStateException 순환이 있는 경우
     */
    public List<List<String>> layers() {
        Map<String, Integer> inDegree = new HashMap<>();
        for (String id : stepIds) {
            inDegree.put(id, upstreamsOf(id).size());
        }

        List<List<String>> layers = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String id : stepIds) {
            if (inDegree.get(id) == 0) {
                current.add(id);
            }
        }

        int placed = 0;
        while (!current.isEmpty()) {
            layers.add(List.copyOf(current));
            placed += current.size();
            List<String> next = new ArrayList<>();
            for (String id : current) {
                for (String downstream : downstreamsOf(id)) {
                    int remaining = inDegree.merge(downstream, -1, Integer::sum);
                    if (remaining == 0) {
                        next.add(downstream);
                    }
                }
            }
            next.sort(Comparator.comparingInt(order::get));
            current = next;
        }

        if (placed != stepIds.size()) {
            throw new IllegalStateException("Dependency graph contains a cycle");
        }
        return Collections.unmodifiableList(layers);
    }
}
