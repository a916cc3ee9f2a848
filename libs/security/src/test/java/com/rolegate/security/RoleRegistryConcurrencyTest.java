package com.rolegate.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Stress test: readers racing against redefinitions must only ever observe one of the
 * complete permission sets of a role.
 */
@DisplayName("RoleRegistry under concurrent redefinition")
class RoleRegistryConcurrencyTest {

    private static final Set<String> OLD = Set.of("old-1", "old-2", "old-3", "old-4");
    private static final Set<String> NEW = Set.of("new-1", "new-2", "new-3", "new-4", "new-5");

    @Test
    @DisplayName("readers never see a mixed permission set")
    void readersNeverSeeMixedSet() throws Exception {
        var registry = new RoleRegistry();
        registry.define("admin", OLD);
        var engine = new DecisionEngine(registry);
        var principal = Principal.of("1", "admin").withRole("admin");

        int readers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(readers + 2);
        var running = new AtomicBoolean(true);
        var start = new CountDownLatch(1);
        var violations = new ConcurrentLinkedQueue<Set<String>>();
        List<Future<?>> tasks = new ArrayList<>();

        try {
            for (int w = 0; w < 2; w++) {
                tasks.add(pool.submit(() -> {
                    await(start);
                    for (int i = 0; i < 20_000; i++) {
                        registry.define("admin", i % 2 == 0 ? NEW : OLD);
                    }
                }));
            }
            for (int r = 0; r < readers; r++) {
                tasks.add(pool.submit(() -> {
                    await(start);
                    while (running.get()) {
                        Set<String> seen = registry.permissionsOf("admin");
                        if (!seen.equals(OLD) && !seen.equals(NEW)) {
                            violations.add(Set.copyOf(seen));
                        }
                        Set<String> effective = engine.effectivePermissions(principal);
                        if (!effective.equals(OLD) && !effective.equals(NEW)) {
                            violations.add(Set.copyOf(effective));
                        }
                    }
                }));
            }

            start.countDown();
            tasks.get(0).get(30, TimeUnit.SECONDS);
            tasks.get(1).get(30, TimeUnit.SECONDS);
            running.set(false);
            for (Future<?> task : tasks) {
                task.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(violations).isEmpty();
        assertThat(registry.permissionsOf("admin")).isIn(OLD, NEW);
    }

    @Test
    @DisplayName("concurrent definitions of distinct roles are all kept")
    void concurrentDistinctDefinitions() throws Exception {
        var registry = new RoleRegistry();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> tasks = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int base = t * 100;
                tasks.add(pool.submit(() -> {
                    for (int i = 0; i < 100; i++) {
                        registry.define("role-" + (base + i), Set.of("p-" + (base + i)));
                    }
                }));
            }
            for (Future<?> task : tasks) {
                task.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.size()).isEqualTo(800);
        assertThat(registry.permissionsOf("role-417")).containsExactly("p-417");
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
