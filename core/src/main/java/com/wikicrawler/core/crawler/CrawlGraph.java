package com.wikicrawler.core.crawler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 크롤 중 발견한 간선을 모으는 인접 구조 (스레드 세이프).
 * 키가 있으면 "확장됨 또는 확장 선점됨". 간선은 추가만 된다.
 * 내부 컨테이너는 밖으로 내보내지 않는다.
 */
public final class CrawlGraph {

    private final ConcurrentHashMap<String, Set<String>> adjacency = new ConcurrentHashMap<>();
    private final AtomicLong edges = new AtomicLong(0);

    /** 이 노드가 확장(또는 선점)되었는지 */
    public boolean hasEntry(String node) {
        return adjacency.containsKey(node);
    }

    /**
     * 확장 선점: 아직 키가 없을 때만 빈 간선 집합을 등록하고 true.
     * 검사와 표시가 한 번에 일어나므로 같은 노드를 두 워커가 동시에 확장하지 않는다.
     */
    public boolean claim(String node) {
        return adjacency.putIfAbsent(node, ConcurrentHashMap.newKeySet()) == null;
    }

    /** source → target 간선 기록. 같은 간선을 다시 넣으면 아무 일도 없다. */
    public void addEdge(String source, String target) {
        Set<String> out = adjacency.computeIfAbsent(source, k -> ConcurrentHashMap.newKeySet());
        if (out.add(target)) edges.incrementAndGet();
    }

    /** 기록된 이웃 (읽기 전용). 없으면 빈 집합. */
    public Set<String> neighbors(String node) {
        Set<String> out = adjacency.get(node);
        return (out == null) ? Set.of() : Collections.unmodifiableSet(out);
    }

    /** 지금까지 기록된 간선 수 (단조 증가) */
    public long edgeCount() {
        return edges.get();
    }

    /** 키(확장/선점된 노드) 수 */
    public int nodeCount() {
        return adjacency.size();
    }

    /** 현재 시점 복사본. 테스트/리포트용. */
    public Map<String, Set<String>> snapshot() {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        adjacency.forEach((k, v) -> copy.put(k, Set.copyOf(v)));
        return copy;
    }
}
