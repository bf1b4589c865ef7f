package com.wikicrawler.core.crawler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 기록된 간선만으로 BFS 최단 경로(간선 수 기준)를 복원한다.
 * <p>
 * 결과는 "크롤이 멈춘 시점까지 기록된 그래프 안에서의" 최단 경로다.
 * 탐색 순서가 우선순위/스케줄링에 좌우되므로 실제 전역 최단 경로와 다를 수 있다.
 * 같은 레벨의 선행 노드가 여럿이면 이웃 집합의 순회 순서가 승자를 정한다.
 */
public final class PathFinder {
    private PathFinder() {}

    /** @return [start, ..., target], 도달 불가면 빈 목록 */
    public static List<String> shortestPath(CrawlGraph graph, String start, String target) {
        if (start.equals(target)) return List.of(start);

        Map<String, String> parent = new HashMap<>();
        parent.put(start, null);
        Deque<String> q = new ArrayDeque<>();
        q.addLast(start);

        while (!q.isEmpty()) {
            String at = q.pollFirst();
            for (String next : graph.neighbors(at)) {
                if (parent.containsKey(next)) continue; // 먼저 도달한 경로 유지
                parent.put(next, at);
                if (next.equals(target)) return unwind(parent, target);
                q.addLast(next);
            }
        }
        return List.of();
    }

    private static List<String> unwind(Map<String, String> parent, String target) {
        List<String> path = new ArrayList<>();
        for (String at = target; at != null; at = parent.get(at)) {
            path.add(at);
        }
        Collections.reverse(path);
        return List.copyOf(path);
    }
}
