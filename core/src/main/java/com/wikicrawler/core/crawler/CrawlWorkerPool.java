package com.wikicrawler.core.crawler;

import com.wikicrawler.core.model.CrawlStats;
import com.wikicrawler.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 크기 워커 풀.
 * 각 워커: 신호가 꺼져 있는 동안 frontier에서 꺼내 확장. 이미 선점된 노드는 건너뜀.
 * run()은 모든 워커가 빠져나올 때까지 대기한다(목표 발견 또는 고갈).
 */
final class CrawlWorkerPool {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlWorkerPool.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlWorkerPool.class);

    private final int workers;
    private final Frontier frontier;
    private final CrawlGraph graph;
    private final TerminationSignal signal;
    private final PageExpander expander;
    private final CrawlStats stats;

    CrawlWorkerPool(int workers, Frontier frontier, CrawlGraph graph, TerminationSignal signal,
                    PageExpander expander, CrawlStats stats) {
        this.workers = Math.max(1, workers);
        this.frontier = frontier;
        this.graph = graph;
        this.signal = signal;
        this.expander = expander;
        this.stats = stats;
    }

    void run() {
        ExecutorService exec = Executors.newFixedThreadPool(workers, new NamedThreadFactory("crawl-worker"));
        List<Future<?>> futures = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            futures.add(exec.submit(() -> {
                work();
                return null;
            }));
        }
        exec.shutdown();

        Throwable failure = null;
        try {
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    if (failure == null) failure = cause;
                    else failure.addSuppressed(cause);
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            frontier.close();
            exec.shutdownNow();
            throw new CrawlException("Interrupted while waiting for crawl workers", ie);
        } finally {
            awaitQuietly(exec);
        }

        if (failure != null) {
            throw new CrawlException("Crawl worker failed: " + failure, failure);
        }
    }

    private void work() throws InterruptedException {
        try {
            while (!signal.isSet()) {
                Frontier.Entry next = frontier.take();
                if (next == null || signal.isSet()) break;

                if (!graph.claim(next.url())) {
                    stats.duplicateSkipped();
                    continue;
                }
                expander.expand(next.url());
            }
        } catch (InterruptedException ie) {
            // 나머지 워커도 새 dequeue 없이 빠져나오게 한다
            frontier.close();
            throw ie;
        } catch (RuntimeException e) {
            // 예상 밖 협력 객체 실패 → 전체 중단
            LOG.warn("Crawl worker failed: {}", e.toString());
            SLOG.error("worker-failed", e);
            frontier.close();
            throw e;
        } finally {
            frontier.retire();
        }
    }

    private static void awaitQuietly(ExecutorService exec) {
        try {
            if (!exec.awaitTermination(30, TimeUnit.SECONDS)) {
                exec.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            exec.shutdownNow();
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
