package com.goormthonuniv.sentinel.llm;

/**
 * 판정 서비스 프롬프트 모음. 모든 응답은 단일 JSON 객체로 요구한다.
 */
public final class Prompts {

    private Prompts() {}

    static String nn(String s) { return s == null ? "" : s; }

    public static String discovery(String currentDate, String digest) {
        return """
        You are a misinformation threat intelligence agent.
        CURRENT DATE: %s

        Analyze these headlines. Identify POTENTIAL RUMORS AND CRISES.

        OUTPUT JSON FORMAT:
        {
          "threats": [
            {
              "name": "Short title (e.g. 'Rumor: Bio-Leak in Hyderabad')",
              "description": "Summary of what the rumor/claim says.",
              "keywords": "viral, video, leak, virus",
              "severity": 85,
              "location": "City, Country"
            }
          ]
        }

        SEVERITY SCORING:
        - 90-100: LETHAL (medical advice, riots, nuclear panic).
        - 70-89: DANGEROUS (fake accidents, collapse rumors).
        - 50-69: DISRUPTIVE.

        HEADLINES:
        %s
        """.formatted(nn(currentDate), nn(digest));
    }

    public static String selection(int total, int cap, int realTier, int viralTier, String candidates) {
        return """
        You are the crisis supervisor. We have detected %d potential threats.

        YOUR MISSION: select exactly %d items to track for the next cycle.

        SELECTION CRITERIA:
        1. Select TOP %d "CATASTROPHIC/REAL" events (real disasters, verified attacks).
        2. Select TOP %d "VIRAL RUMORS/MISINFORMATION" (hoaxes, fake news, panic triggers).

        PRIORITIZE UNIQUE LOCATIONS AND HIGH SEVERITY.

        CANDIDATES:
        %s

        OUTPUT JSON:
        { "selected_ids": ["id-1", "id-2"] }
        """.formatted(total, cap, realTier, viralTier, nn(candidates));
    }

    public static String extraction(String currentDate, String text) {
        return """
        You are an intelligence analyst. Process a raw user report or news snippet and extract structured claims.

        CURRENT DATE: %s

        INPUT TEXT:
        "%s"

        OBJECTIVES:
        1. Ignore conversational context such as "my uncle forwarded this" or "is this true?". Focus on the event or claim.
        2. Extract the core rumor: what exactly is being alleged.
        3. Pinpoint the city, district or region. If vague, use "Unknown".
        4. If the text implies immediate danger (death, fire, mob), the claim must reflect that.

        OUTPUT JSON:
        { "claims": [ { "text": "Specific rumor text", "location": "City, Country" } ] }
        """.formatted(nn(currentDate), nn(text));
    }

    public static String verdict(String claim, String location, String evidence) {
        return """
        You are the verdict synthesizer of a crisis verification desk.

        CLAIM: %s
        LOCATION: %s

        EVIDENCE (official, media, fact-check archives; lines starting with [KIND]):
        %s

        RULES:
        - VERIFIED only when an official source or at least two mainstream outlets confirm the claim.
        - DEBUNKED when a fact-check or an official source explicitly refutes it.
        - Otherwise UNCONFIRMED.
        - confidence is 0-100 and must be low when evidence is thin.
        - Cite only URLs that appear in the evidence.

        OUTPUT JSON:
        {
          "status": "VERIFIED | DEBUNKED | UNCONFIRMED",
          "summary": "One or two sentences for the public.",
          "confidence": 0,
          "reasoning": "Step-by-step reasoning trace.",
          "sources": [ { "title": "...", "url": "..." } ]
        }
        """.formatted(nn(claim), nn(location), nn(evidence));
    }

    public static String crisisConclusion(String crisisName, String timeline) {
        return """
        You are the crisis analyst. Summarize the verification timeline of one tracked crisis.

        CRISIS: %s

        TIMELINE (newest first; STATUS | confidence | claim):
        %s

        OUTPUT JSON:
        {
          "verdictStatus": "VERIFIED | DEBUNKED | UNCONFIRMED | MIXED",
          "verdictSummary": "Two or three sentences describing what is confirmed and what is false."
        }
        """.formatted(nn(crisisName), nn(timeline));
    }
}
