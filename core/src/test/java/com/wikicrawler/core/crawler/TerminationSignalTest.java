package com.wikicrawler.core.crawler;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TerminationSignalTest {

    @Test
    void only_first_set_reports_true() {
        TerminationSignal s = new TerminationSignal();
        assertThat(s.isSet()).isFalse();

        assertThat(s.set()).isTrue();
        assertThat(s.set()).isFalse();
        assertThat(s.isSet()).isTrue();
    }

    @Test
    void concurrent_setters_have_exactly_one_winner() throws Exception {
        TerminationSignal s = new TerminationSignal();
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    go.await();
                    return s.set();
                }));
            }
            go.countDown();

            int winners = 0;
            for (Future<Boolean> f : results) if (f.get(5, TimeUnit.SECONDS)) winners++;
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void set_is_visible_from_other_threads() throws Exception {
        TerminationSignal s = new TerminationSignal();
        s.set();

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            assertThat(pool.submit(s::isSet).get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }
}
