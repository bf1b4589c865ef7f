package com.wikicrawler.core.crawler;

import java.util.concurrent.CountDownLatch;

/** "목표 도달" 1회성 신호. set 이후의 isSet()은 모든 스레드에서 true. */
public final class TerminationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    /** @return 이번 호출이 신호를 켰으면 true (이미 켜져 있었으면 false) */
    public boolean set() {
        synchronized (latch) {
            if (latch.getCount() == 0) return false;
            latch.countDown();
            return true;
        }
    }

    public boolean isSet() {
        return latch.getCount() == 0;
    }
}
