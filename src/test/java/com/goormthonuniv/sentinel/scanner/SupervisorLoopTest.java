package com.goormthonuniv.sentinel.scanner;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.testutil.InMemoryCrisisStore;
import com.goormthonuniv.sentinel.testutil.MutableClock;
import com.goormthonuniv.sentinel.util.Sleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SupervisorLoopTest {

    private final MutableClock clock = MutableClock.startingAt("2024-07-01T08:00:00Z");
    private final InMemoryCrisisStore store = new InMemoryCrisisStore(clock);
    private final ThreatDiscoveryStage discovery = mock(ThreatDiscoveryStage.class);
    private final PrioritySelectionStage selection = mock(PrioritySelectionStage.class);
    private final DeepGatheringScheduler gathering = mock(DeepGatheringScheduler.class);

    private SupervisorLoop loop(Boolean enabled) {
        return loop(enabled, clock.sleeper());
    }

    private SupervisorLoop loop(Boolean enabled, Sleeper sleeper) {
        SentinelProperties props = new SentinelProperties(null, null, null, null, null,
                new SentinelProperties.Cycle(enabled, Duration.ofHours(1), Duration.ofMinutes(2),
                        Duration.ofSeconds(30), Duration.ofSeconds(5), Duration.ofHours(24), 4),
                null);
        return new SupervisorLoop(discovery, selection, gathering, store,
                new SupervisedTaskSet(Runnable::run, 4), props, clock, sleeper);
    }

    @Test
    void cycleRunsStagesWithinBudget() throws Exception {
        SupervisorLoop loop = loop(false);

        loop.runCycle();

        verify(discovery).run();
        verify(selection).run();
        verify(gathering).run(Duration.ofMinutes(57).plusSeconds(30));
        assertEquals(List.of(Duration.ofMinutes(2), Duration.ofSeconds(5)), clock.sleeps());
        assertEquals(1, loop.cycles());
    }

    @Test
    void failingStageDoesNotStopTheCycle() throws Exception {
        when(discovery.run()).thenThrow(new IllegalStateException("feeds down"));
        doThrow(new IllegalStateException("db locked")).when(selection).run();
        when(gathering.run(any())).thenThrow(new IllegalStateException("pool closed"));
        store.createCrisis("old rumor", "", "old", 50, "X");
        clock.advance(Duration.ofHours(25));
        store.createCrisis("fresh rumor", "", "fresh", 50, "X");
        SupervisorLoop loop = loop(false);

        loop.runCycle();

        verify(gathering).run(any());
        assertEquals(1, store.crisisCount());
        assertEquals("fresh rumor", store.listCrises(10).get(0).getName());
        assertEquals(1, loop.cycles());
    }

    @Test
    void interruptionEndsTheCycle() throws Exception {
        when(gathering.run(any())).thenThrow(new InterruptedException());
        SupervisorLoop loop = loop(false);

        assertThrows(InterruptedException.class, loop::runCycle);
        assertEquals(0, loop.cycles());
    }

    @Test
    void runRepeatsCyclesUntilInterrupted() throws Exception {
        List<Duration> sleeps = new ArrayList<>();
        Sleeper interruptOnSecondCooldown = d -> {
            sleeps.add(d);
            if (d.equals(Duration.ofSeconds(5)) && sleeps.size() == 4) throw new InterruptedException();
        };
        SupervisorLoop loop = loop(true, interruptOnSecondCooldown);

        loop.run();

        assertTrue(Thread.interrupted());
        assertEquals(2, loop.cycles());
        verify(discovery, times(2)).run();
        verify(gathering, times(2)).run(Duration.ofMinutes(57).plusSeconds(30));
        assertEquals(List.of(Duration.ofMinutes(2), Duration.ofSeconds(5), Duration.ofMinutes(2), Duration.ofSeconds(5)), sleeps);
    }

    @Test
    void disabledLoopDoesNotStart() {
        SupervisorLoop loop = loop(false);

        loop.start();

        assertFalse(loop.isRunning());
        loop.stop();
    }
}
