package com.goormthonuniv.sentinel.service;

import com.goormthonuniv.sentinel.agent.EvidenceAgent;
import com.goormthonuniv.sentinel.dto.EvidenceItem;
import com.goormthonuniv.sentinel.dto.Verdict;
import com.goormthonuniv.sentinel.entity.SourceRef;
import com.goormthonuniv.sentinel.entity.TimelineItem;
import com.goormthonuniv.sentinel.enums.EvidenceKind;
import com.goormthonuniv.sentinel.enums.VerificationStatus;
import com.goormthonuniv.sentinel.exception.NotFoundException;
import com.goormthonuniv.sentinel.store.CrisisStore;
import com.goormthonuniv.sentinel.testutil.InMemoryCrisisStore;
import com.goormthonuniv.sentinel.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class VerificationOrchestratorTest {

    private static final Verdict VERDICT = new Verdict(VerificationStatus.DEBUNKED, "Old footage", 85, "trace",
            List.of(new SourceRef("Fact check", "https://factly.in/1")));

    private final MutableClock clock = MutableClock.startingAt("2024-07-01T08:00:00Z");
    private final InMemoryCrisisStore store = new InMemoryCrisisStore(clock);
    private final VerdictSynthesizer synthesizer = mock(VerdictSynthesizer.class);
    private final ExecutorService agentPool = Executors.newFixedThreadPool(3);

    /** 고정 증거 1건을 돌려주는 에이전트 */
    private static EvidenceAgent agent(EvidenceKind kind) {
        return new EvidenceAgent() {
            @Override public EvidenceKind kind() { return kind; }
            @Override public List<EvidenceItem> gather(String claimText) {
                return List.of(new EvidenceItem(kind, kind + " title", "https://" + kind.name().toLowerCase() + ".test", ""));
            }
        };
    }

    private VerificationOrchestrator orchestrator(List<EvidenceAgent> agents) {
        return new VerificationOrchestrator(agents, synthesizer, store, agentPool, clock);
    }

    @AfterEach
    void tearDown() {
        agentPool.shutdownNow();
    }

    @Test
    @SuppressWarnings("unchecked")
    void recordsVerdictWithEvidenceInAgentOrder() {
        when(synthesizer.synthesize(anyString(), anyString(), anyList())).thenReturn(VERDICT);
        UUID crisisId = store.createCrisis("Dam rumor", "d", "dam", 80, "Pune").getId();
        VerificationOrchestrator o = orchestrator(List.of(
                agent(EvidenceKind.DEBUNK), agent(EvidenceKind.OFFICIAL), agent(EvidenceKind.MEDIA)));

        Optional<TimelineItem> item = o.run("  Dam burst in Pune  ", "Pune", crisisId);

        assertTrue(item.isPresent());
        assertEquals("Dam burst in Pune", item.get().getClaimText());
        assertEquals(crisisId, item.get().getCrisisId());
        assertEquals(VerificationStatus.DEBUNKED, item.get().getStatus());
        assertEquals(85, item.get().getConfidenceScore());
        assertEquals(clock.instant(), item.get().getTimestamp());

        ArgumentCaptor<List<EvidenceItem>> evidence = ArgumentCaptor.forClass(List.class);
        verify(synthesizer).synthesize(eq("Dam burst in Pune"), eq("Pune"), evidence.capture());
        assertEquals(List.of(EvidenceKind.OFFICIAL, EvidenceKind.MEDIA, EvidenceKind.DEBUNK),
                evidence.getValue().stream().map(EvidenceItem::kind).toList());
    }

    @Test
    void sameClaimIsVerifiedOncePerScope() {
        when(synthesizer.synthesize(anyString(), anyString(), anyList())).thenReturn(VERDICT);
        UUID crisisId = store.createCrisis("Dam rumor", "d", "dam", 80, "Pune").getId();
        VerificationOrchestrator o = orchestrator(List.of(agent(EvidenceKind.OFFICIAL)));

        assertTrue(o.run("Dam burst in Pune", "Pune", crisisId).isPresent());
        assertTrue(o.run("Dam burst in Pune ", "Pune", crisisId).isEmpty());
        assertTrue(o.run("Dam burst in Pune", "Pune", null).isPresent());

        assertEquals(2, store.allTimelineItems().size());
        verify(synthesizer, times(2)).synthesize(anyString(), anyString(), anyList());
    }

    @Test
    void concurrentDuplicateIsSkippedWhileFirstIsInFlight() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        EvidenceAgent slow = new EvidenceAgent() {
            @Override public EvidenceKind kind() { return EvidenceKind.OFFICIAL; }
            @Override public List<EvidenceItem> gather(String claimText) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(EvidenceItem.none(EvidenceKind.OFFICIAL, "none"));
            }
        };
        when(synthesizer.synthesize(anyString(), anyString(), anyList())).thenReturn(VERDICT);
        VerificationOrchestrator o = orchestrator(List.of(slow));
        ExecutorService callers = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<TimelineItem>> first = callers.submit(() -> o.run("Bridge collapsed", "X", null));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertTrue(o.run("Bridge collapsed", "X", null).isEmpty());

            release.countDown();
            assertTrue(first.get(5, TimeUnit.SECONDS).isPresent());
        } finally {
            callers.shutdownNow();
        }
        assertEquals(1, store.allTimelineItems().size());
    }

    @Test
    void verdictIsDroppedWhenCrisisWasPrunedMidRun() {
        UUID pruned = store.createCrisis("Dam rumor", "d", "dam", 60, "Pune").getId();
        UUID kept = store.createCrisis("Metro fire", "d", "metro", 95, "Delhi").getId();
        when(synthesizer.synthesize(anyString(), anyString(), anyList())).thenAnswer(inv -> {
            store.retainOnly(Set.of(kept));
            return VERDICT;
        });
        VerificationOrchestrator o = orchestrator(List.of(agent(EvidenceKind.OFFICIAL)));

        assertTrue(o.run("Dam burst in Pune", "Pune", pruned).isEmpty());

        assertTrue(store.allTimelineItems().isEmpty());
    }

    @Test
    void verdictIsDroppedWhenStoreRejectsUnknownCrisis() {
        UUID crisisId = store.createCrisis("Dam rumor", "d", "dam", 60, "Pune").getId();
        CrisisStore racing = spy(store);
        doThrow(new NotFoundException("Crisis not found: " + crisisId))
                .doCallRealMethod()
                .when(racing).createTimelineItem(any());
        when(synthesizer.synthesize(anyString(), anyString(), anyList())).thenReturn(VERDICT);
        VerificationOrchestrator o = new VerificationOrchestrator(
                List.of(agent(EvidenceKind.OFFICIAL)), synthesizer, racing, agentPool, clock);

        assertTrue(o.run("Dam burst in Pune", "Pune", crisisId).isEmpty());
        assertTrue(store.allTimelineItems().isEmpty());
        // 진행 중 표시가 풀려 다음 실행에서 다시 검증된다
        assertTrue(o.run("Dam burst in Pune", "Pune", crisisId).isPresent());
    }

    @Test
    void blankClaimIsRejected() {
        VerificationOrchestrator o = orchestrator(List.of(agent(EvidenceKind.OFFICIAL)));

        assertThrows(IllegalArgumentException.class, () -> o.run("   ", "X", null));
        verifyNoInteractions(synthesizer);
    }

    @Test
    void longClaimsAreTruncated() {
        assertEquals(2000, VerificationOrchestrator.normalizeClaim("a".repeat(2500)).length());
        assertEquals("", VerificationOrchestrator.normalizeClaim(null));
    }
}
