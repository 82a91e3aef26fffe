package com.chicu.opsdash.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RefreshSchedulerImplTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock private ScheduledExecutorService executor;
    @Mock private ScheduledFuture<Object> future;

    private RefreshSchedulerImpl scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new RefreshSchedulerImpl(executor, Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().doReturn(future).when(executor)
                .scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
    }

    private Runnable capturedCycle() {
        ArgumentCaptor<Runnable> cycle = ArgumentCaptor.forClass(Runnable.class);
        verify(executor, atLeastOnce()).scheduleAtFixedRate(cycle.capture(), anyLong(), anyLong(), any(TimeUnit.class));
        return cycle.getValue();
    }

    @Test
    void firstRunImmediatelyThenEveryInterval() {
        scheduler.activate("alert-feed", () -> { }, Duration.ofSeconds(15));

        verify(executor).scheduleAtFixedRate(any(Runnable.class), eq(0L), eq(15_000L), eq(TimeUnit.MILLISECONDS));
        assertTrue(scheduler.isActive("alert-feed"));
        assertEquals(NOW, scheduler.getStartedAt("alert-feed").orElseThrow());
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.activate("x", () -> { }, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.activate("x", () -> { }, null));
    }

    @Test
    void failingCycleDoesNotEscape() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.activate("boom", handle -> {
            runs.incrementAndGet();
            throw new IllegalStateException("upstream down");
        }, Duration.ofSeconds(1));

        Runnable cycle = capturedCycle();
        assertDoesNotThrow(cycle::run);
        assertDoesNotThrow(cycle::run);
        assertEquals(2, runs.get());
        assertTrue(scheduler.isActive("boom"));
    }

    @Test
    void deactivateKillsHandleAndCancelsFuture() {
        AtomicInteger runs = new AtomicInteger();
        RefreshHandle handle = scheduler.activate("regime", h -> runs.incrementAndGet(), Duration.ofSeconds(30));
        Runnable cycle = capturedCycle();

        scheduler.deactivate("regime");
        scheduler.deactivate("regime");

        assertFalse(handle.isAlive());
        assertFalse(scheduler.isActive("regime"));
        assertTrue(scheduler.getStartedAt("regime").isEmpty());
        verify(future, times(1)).cancel(false);

        // уже запланированный запуск ничего не делает
        cycle.run();
        assertEquals(0, runs.get());
    }

    @Test
    void reactivationReplacesPreviousTask() {
        RefreshHandle first = scheduler.activate("heatmap", () -> { }, Duration.ofSeconds(30));
        RefreshHandle second = scheduler.activate("heatmap", () -> { }, Duration.ofSeconds(10));

        assertFalse(first.isAlive());
        assertTrue(second.isAlive());
        assertTrue(scheduler.isActive("heatmap"));
    }

    @Test
    void deactivateAllStopsEverything() {
        RefreshHandle a = scheduler.activate("a", () -> { }, Duration.ofSeconds(1));
        RefreshHandle b = scheduler.activate("b", () -> { }, Duration.ofSeconds(1));

        scheduler.shutdown();

        assertFalse(a.isAlive());
        assertFalse(b.isAlive());
        assertFalse(scheduler.isActive("a"));
    }
}
