package com.example.mmocore;

import com.example.mmocore.util.TickService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TickService Tests")
class TickServiceTest {

    private TickService ticks;

    @BeforeEach
    void setUp() {
        ticks = new TickService();
    }

    @AfterEach
    void tearDown() {
        ticks.shutdown();
    }

    @Test
    @DisplayName("Inbound work runs on the tick thread")
    void executeOnTickThread() throws InterruptedException {
        AtomicReference<String> thread = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        ticks.execute(() -> {
            thread.set(Thread.currentThread().getName());
            done.countDown();
        });

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals("mmocore-tick", thread.get());
    }

    @Test
    @DisplayName("Rescheduling a key replaces the pending task")
    void keyedReplace() throws InterruptedException {
        AtomicBoolean first = new AtomicBoolean();
        CountDownLatch second = new CountDownLatch(1);

        ticks.schedule("revive:a", () -> first.set(true), 300);
        ticks.schedule("revive:a", second::countDown, 50);

        assertTrue(second.await(2, TimeUnit.SECONDS));
        Thread.sleep(400);
        assertFalse(first.get());
    }

    @Test
    @DisplayName("Cancelled tasks never run")
    void cancel() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean();
        ticks.schedule("respawn:m1", () -> ran.set(true), 150);

        assertTrue(ticks.cancel("respawn:m1"));
        assertFalse(ticks.cancel("respawn:m1"));
        Thread.sleep(300);
        assertFalse(ran.get());
    }

    @Test
    @DisplayName("A failing periodic task keeps its schedule")
    void failingPeriodicSurvives() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch three = new CountDownLatch(3);

        ticks.scheduleAtFixedRate("monster-ai", () -> {
            three.countDown();
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
        }, 10, 10);

        assertTrue(three.await(2, TimeUnit.SECONDS));
    }
}
