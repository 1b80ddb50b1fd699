package com.goormthonuniv.sentinel.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityServiceTest {

    private final SimilarityService service = new SimilarityService();

    @Test
    void overlappingSentencesScoreAboveZero() {
        double score = service.jaccard("aliens landed in city", "no aliens landed in city");

        assertEquals(0.8, score, 1e-9);
    }

    @Test
    void isSymmetric() {
        String a = "Dam burst in Pune, 50 dead";
        String b = "Viral video of dam burst is old";

        assertEquals(service.jaccard(a, b), service.jaccard(b, a), 1e-12);
    }

    @Test
    void emptySideScoresZero() {
        assertEquals(0.0, service.jaccard("", "anything"));
        assertEquals(0.0, service.jaccard("!!!", "anything"));
    }

    @Test
    void identicalTextScoresOne() {
        assertEquals(1.0, service.jaccard("Flood, in Mumbai", "flood in mumbai"));
    }
}
