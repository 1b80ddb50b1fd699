package com.goormthonuniv.sentinel.service;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.CrisisConclusion;
import com.goormthonuniv.sentinel.dto.EvidenceItem;
import com.goormthonuniv.sentinel.dto.Verdict;
import com.goormthonuniv.sentinel.entity.Crisis;
import com.goormthonuniv.sentinel.entity.TimelineItem;
import com.goormthonuniv.sentinel.enums.CrisisVerdict;
import com.goormthonuniv.sentinel.enums.EvidenceKind;
import com.goormthonuniv.sentinel.enums.VerificationStatus;
import com.goormthonuniv.sentinel.testutil.InMemoryCrisisStore;
import com.goormthonuniv.sentinel.testutil.MutableClock;
import com.goormthonuniv.sentinel.testutil.ScriptedLlmClient;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class VerdictSynthesizerTest {

    private final MutableClock clock = MutableClock.startingAt("2024-07-01T08:00:00Z");
    private final InMemoryCrisisStore store = new InMemoryCrisisStore(clock);

    private static final List<EvidenceItem> EVIDENCE = List.of(
            new EvidenceItem(EvidenceKind.OFFICIAL, "NDMA advisory", "https://ndma.gov.in/a", "No dam breach"),
            EvidenceItem.none(EvidenceKind.MEDIA, "No trusted media coverage found."),
            new EvidenceItem(EvidenceKind.DEBUNK, "Old video", "https://factly.in/b", "2019 footage"));

    @Test
    void fillsSourcesFromEvidenceWhenModelCitesNone() {
        ScriptedLlmClient client = ScriptedLlmClient.always(
                "{\"status\":\"DEBUNKED\",\"summary\":\"Old footage\",\"confidence\":90,\"sources\":[]}");
        VerdictSynthesizer synth = new VerdictSynthesizer(client.gateway(), store, SentinelProperties.defaults());

        Verdict v = synth.synthesize("Dam burst in Pune", "Pune", EVIDENCE);

        assertEquals(VerificationStatus.DEBUNKED, v.status());
        assertEquals(List.of("https://ndma.gov.in/a", "https://factly.in/b"),
                v.sources().stream().map(s -> s.url()).toList());
        String prompt = client.prompts().get(0);
        assertTrue(prompt.contains("[OFFICIAL] NDMA advisory (https://ndma.gov.in/a) - No dam breach"));
        assertTrue(prompt.contains("[MEDIA] No trusted media coverage found."));
    }

    @Test
    void keepsModelCitations() {
        ScriptedLlmClient client = ScriptedLlmClient.always(
                "{\"status\":\"VERIFIED\",\"summary\":\"ok\",\"confidence\":70,"
                        + "\"sources\":[{\"title\":\"Reuters\",\"url\":\"https://reuters.com/z\"}]}");
        VerdictSynthesizer synth = new VerdictSynthesizer(client.gateway(), store, SentinelProperties.defaults());

        Verdict v = synth.synthesize("claim text", "Pune", EVIDENCE);

        assertEquals(1, v.sources().size());
        assertEquals("Reuters", v.sources().get(0).title());
    }

    @Test
    void crisisConclusionUpdatesCrisis() {
        Crisis crisis = store.createCrisis("Pune Dam Rumor", "desc", "dam, pune", 80, "Pune");
        store.createTimelineItem(TimelineItem.builder()
                .crisisId(crisis.getId())
                .claimText("Dam burst in Pune")
                .summary("Old footage")
                .status(VerificationStatus.DEBUNKED)
                .confidenceScore(90)
                .build());
        ScriptedLlmClient client = ScriptedLlmClient.always(
                "{\"verdictStatus\":\"DEBUNKED\",\"verdictSummary\":\"Circulating video is from 2019\"}");
        VerdictSynthesizer synth = new VerdictSynthesizer(client.gateway(), store, SentinelProperties.defaults());

        Optional<CrisisConclusion> c = synth.synthesizeCrisisConclusion(crisis.getId());

        assertTrue(c.isPresent());
        Crisis updated = store.findCrisis(crisis.getId()).orElseThrow();
        assertEquals(CrisisVerdict.DEBUNKED, updated.getVerdictStatus());
        assertEquals("Circulating video is from 2019", updated.getVerdictSummary());
    }

    @Test
    void crisisConclusionSkipsEmptyTimelineAndUnknownCrisis() {
        ScriptedLlmClient client = ScriptedLlmClient.always("{}");
        VerdictSynthesizer synth = new VerdictSynthesizer(client.gateway(), store, SentinelProperties.defaults());
        Crisis crisis = store.createCrisis("Quiet", "desc", "quiet", 40, "X");

        assertTrue(synth.synthesizeCrisisConclusion(crisis.getId()).isEmpty());
        assertTrue(synth.synthesizeCrisisConclusion(UUID.randomUUID()).isEmpty());
        assertTrue(client.prompts().isEmpty());
        assertEquals(CrisisVerdict.PENDING, store.findCrisis(crisis.getId()).orElseThrow().getVerdictStatus());
    }
}
