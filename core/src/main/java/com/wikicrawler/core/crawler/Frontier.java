package com.wikicrawler.core.crawler;

import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 확장 대기 노드의 우선순위 큐 (무제한, 스레드 세이프).
 * <p>
 * put/take 만 노출한다. take()는 항목이 생기거나 닫힐 때까지 대기하며, 닫힌 뒤에는 null.
 * 닫히는 경우:
 * <ul>
 *   <li>{@link #close()} 명시 호출 (목표 발견, 워커 실패)</li>
 *   <li>고갈: 살아있는 소비자 전원이 take()에서 대기 중이고 큐가 비었을 때.
 *       생산자는 곧 소비자이므로 더 이상 항목이 들어올 수 없다.</li>
 * </ul>
 * 같은 우선순위는 삽입 순서대로 나간다(한 생산자 안에서만 의미 있음).
 */
public final class Frontier {

    /** (priority, url) 항목. priority 값이 작을수록 먼저. */
    public record Entry(int priority, String url, long seq) {}

    private static final Comparator<Entry> ORDER =
            Comparator.comparingInt(Entry::priority).thenComparingLong(Entry::seq);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);

    // 아래 필드는 모두 lock 보호
    private int consumers;
    private int waiting = 0;
    private long seq = 0;
    private boolean closed = false;
    private boolean exhausted = false;

    /** @param consumers take()를 호출할 워커 수 (고갈 판정 기준) */
    public Frontier(int consumers) {
        if (consumers < 1) throw new IllegalArgumentException("consumers must be >= 1");
        this.consumers = consumers;
    }

    /** 항목 추가. 이미 닫혔으면 버리고 false. */
    public boolean put(int priority, String url) {
        lock.lock();
        try {
            if (closed) return false;
            queue.add(new Entry(priority, url, seq++));
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 가장 낮은 priority 항목을 꺼낸다. 비어 있으면 대기.
     * @return 다음 항목, 닫혔으면 null
     */
    public Entry take() throws InterruptedException {
        lock.lock();
        try {
            waiting++;
            try {
                while (!closed && queue.isEmpty()) {
                    if (waiting >= consumers) {
                        // 모두 대기 중 + 빈 큐 → 생산자 없음
                        exhausted = true;
                        closeLocked();
                        break;
                    }
                    notEmpty.await();
                }
            } finally {
                waiting--;
            }
            return closed ? null : queue.poll();
        } finally {
            lock.unlock();
        }
    }

    /** 소비자 하나가 루프를 떠남. 남은 소비자 기준으로 고갈을 다시 판정한다. */
    public void retire() {
        lock.lock();
        try {
            consumers = Math.max(0, consumers - 1);
            if (!closed && queue.isEmpty() && consumers > 0 && waiting >= consumers) {
                exhausted = true;
                closeLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    /** 명시적 종료. 대기 중인 take()를 모두 깨운다. 멱등. */
    public void close() {
        lock.lock();
        try {
            closeLocked();
        } finally {
            lock.unlock();
        }
    }

    private void closeLocked() {
        if (closed) return;
        closed = true;
        notEmpty.signalAll();
    }

    public boolean isClosed() {
        lock.lock();
        try { return closed; } finally { lock.unlock(); }
    }

    /** 고갈(생산자 없음)로 닫혔는지 */
    public boolean isExhausted() {
        lock.lock();
        try { return exhausted; } finally { lock.unlock(); }
    }

    public int size() {
        lock.lock();
        try { return queue.size(); } finally { lock.unlock(); }
    }
}
