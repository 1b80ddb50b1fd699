package com.goormthonuniv.sentinel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Sentinel 전체 설정. 모든 하위 레코드는 누락된 값을 기본값으로 채운다.
 * 테스트에서는 {@link #defaults()} 또는 생성자로 작은 목록/짧은 윈도우를 직접 주입한다.
 */
@ConfigurationProperties(prefix = "sentinel")
public record SentinelProperties(
        Judgment judgment,
        Search search,
        Discovery discovery,
        Selection selection,
        Gathering gathering,
        Cycle cycle,
        Agents agents
) {

    public SentinelProperties {
        judgment = judgment != null ? judgment : new Judgment(null, null, null, null, null);
        search = search != null ? search : new Search(null, null, null, null, null, null);
        discovery = discovery != null ? discovery : new Discovery(null, null, null, null, null, null);
        selection = selection != null ? selection : new Selection(null, null);
        gathering = gathering != null ? gathering : new Gathering(null, null, null, null, null, null, null, null, null, null);
        cycle = cycle != null ? cycle : new Cycle(null, null, null, null, null, null, null);
        agents = agents != null ? agents : new Agents(null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static SentinelProperties defaults() {
        return new SentinelProperties(null, null, null, null, null, null, null);
    }

    /** 판정(LLM) 서비스 접근 설정 */
    public record Judgment(
            List<String> apiKeys,
            String endpoint,
            String extractionModel,
            String synthesisModel,
            Duration rotationBackoff
    ) {
        public Judgment {
            apiKeys = apiKeys != null ? apiKeys.stream().map(String::strip).filter(k -> !k.isEmpty()).toList() : List.of();
            endpoint = endpoint != null ? endpoint : "https://api.openai.com/v1/chat/completions";
            extractionModel = extractionModel != null ? extractionModel : "gpt-4o-mini";
            synthesisModel = synthesisModel != null ? synthesisModel : "gpt-4o-mini";
            rotationBackoff = rotationBackoff != null ? rotationBackoff : Duration.ofMillis(500);
        }
    }

    /** 검색 제공자 설정 */
    public record Search(
            String webEndpoint,
            String newsEndpoint,
            String apiKey,
            String market,
            Integer maxAttempts,
            Duration initialBackoff
    ) {
        public Search {
            webEndpoint = webEndpoint != null ? webEndpoint : "https://api.bing.microsoft.com/v7.0/search";
            newsEndpoint = newsEndpoint != null ? newsEndpoint : "https://api.bing.microsoft.com/v7.0/news/search";
            apiKey = apiKey != null ? apiKey : "";
            market = market != null ? market : "en-WW";
            maxAttempts = maxAttempts != null ? maxAttempts : 3;
            initialBackoff = initialBackoff != null ? initialBackoff : Duration.ofSeconds(1);
        }
    }

    /** 위협 탐지 단계 */
    public record Discovery(
            String signalPattern,
            List<String> feedUrls,
            List<String> socialQueries,
            Integer batchCap,
            Integer notifySeverity,
            Integer digestSnippetLength
    ) {
        public Discovery {
            signalPattern = signalPattern != null ? signalPattern
                    : "(disaster|accident|emergency|collapse|explosion|riot|earthquake|flood|tsunami|virus|outbreak|leak|bioweapon"
                    + "|conspiracy|coverup|censored|exposed|fake|hoax|rumor|forwarded|viral|whatsapp|audio|warning|alert"
                    + "|death|killed|lethal|radioactive|poison)";
            feedUrls = feedUrls != null ? List.copyOf(feedUrls) : List.of();
            socialQueries = socialQueries != null ? List.copyOf(socialQueries) : List.of(
                    "\"forwarded as received\" site:twitter.com",
                    "\"forward this message\" site:whatsapp.com",
                    "\"media wont tell you\" site:twitter.com",
                    "\"viral video\" \"shocking\" site:facebook.com",
                    "\"leaked audio\" warning site:youtube.com",
                    "\"government hiding\" disaster site:reddit.com",
                    "\"urgent alert\" site:instagram.com",
                    "\"don't go there\" site:twitter.com",
                    "\"rumor has it\" site:twitter.com",
                    "\"fake news\" alert site:twitter.com"
            );
            batchCap = batchCap != null ? batchCap : 60;
            notifySeverity = notifySeverity != null ? notifySeverity : 75;
            digestSnippetLength = digestSnippetLength != null ? digestSnippetLength : 100;
        }
    }

    /** 우선순위 선별 단계 */
    public record Selection(Integer trackedCap, Integer candidateLimit) {
        public Selection {
            trackedCap = trackedCap != null ? trackedCap : 10;
            candidateLimit = candidateLimit != null ? candidateLimit : 100;
        }
    }

    /** 심층 수집 스케줄러 */
    public record Gathering(
            Integer highRiskSeverity,
            Duration highRiskInterval,
            Integer concurrency,
            Integer trackedLimit,
            Duration idlePoll,
            Duration emptyBatchPause,
            Duration tickPause,
            List<String> querySuffixes,
            Integer hitsPerQuery,
            Integer minNewsHits
    ) {
        public Gathering {
            highRiskSeverity = highRiskSeverity != null ? highRiskSeverity : 90;
            highRiskInterval = highRiskInterval != null ? highRiskInterval : Duration.ofSeconds(120);
            concurrency = concurrency != null ? concurrency : 5;
            trackedLimit = trackedLimit != null ? trackedLimit : 20;
            idlePoll = idlePoll != null ? idlePoll : Duration.ofSeconds(10);
            emptyBatchPause = emptyBatchPause != null ? emptyBatchPause : Duration.ofSeconds(5);
            tickPause = tickPause != null ? tickPause : Duration.ofSeconds(2);
            querySuffixes = querySuffixes != null ? List.copyOf(querySuffixes) : List.of("", " viral hoax");
            hitsPerQuery = hitsPerQuery != null ? hitsPerQuery : 3;
            minNewsHits = minNewsHits != null ? minNewsHits : 2;
        }
    }

    /** 감독 루프 주기 */
    public record Cycle(
            Boolean enabled,
            Duration period,
            Duration discoveryWindow,
            Duration safetyMargin,
            Duration cooldown,
            Duration staleAfter,
            Integer backgroundCapacity
    ) {
        public Cycle {
            enabled = enabled != null ? enabled : Boolean.TRUE;
            period = period != null ? period : Duration.ofHours(1);
            discoveryWindow = discoveryWindow != null ? discoveryWindow : Duration.ofMinutes(2);
            safetyMargin = safetyMargin != null ? safetyMargin : Duration.ofSeconds(30);
            cooldown = cooldown != null ? cooldown : Duration.ofSeconds(5);
            staleAfter = staleAfter != null ? staleAfter : Duration.ofHours(24);
            backgroundCapacity = backgroundCapacity != null ? backgroundCapacity : 32;
        }

        /** 심층 수집에 쓸 수 있는 시간 = 주기 - 탐지 윈도우 - 안전 여유 */
        public Duration gatheringBudget() {
            Duration budget = period.minus(discoveryWindow).minus(safetyMargin);
            return budget.isNegative() ? Duration.ZERO : budget;
        }
    }

    /** 증거 에이전트 3종의 목록/임계값 */
    public record Agents(
            List<String> officialPortals,
            List<String> officialDomains,
            List<String> officialHandles,
            List<String> mediaDomains,
            List<String> factCheckDomains,
            List<String> debunkMarkers,
            List<String> viralContextTerms,
            Set<String> officialStopWords,
            Set<String> mediaStopWords,
            Set<String> debunkStopWords,
            Double debunkThreshold,
            Duration portalTimeout,
            Integer officialMinKeywordHits
    ) {
        public Agents {
            officialPortals = officialPortals != null ? List.copyOf(officialPortals) : List.of(
                    "https://ndrf.gov.in/",
                    "https://ndma.gov.in/",
                    "https://sachet.ndma.gov.in/",
                    "https://cwc.gov.in/",
                    "https://mausam.imd.gov.in/",
                    "https://incois.gov.in/portal/osf/osf.jsp",
                    "https://mumbaipolice.gov.in/",
                    "https://delhipolice.gov.in/",
                    "https://portal.mcgm.gov.in/",
                    "https://mohfw.gov.in/",
                    "https://ncdc.gov.in/"
            );
            officialDomains = officialDomains != null ? List.copyOf(officialDomains) : List.of(
                    "gov.in", "nic.in", "police.gov.in", "org.in", "who.int", "un.org", "gdacs.org"
            );
            officialHandles = officialHandles != null ? List.copyOf(officialHandles) : List.of(
                    "twitter.com/MumbaiPolice",
                    "twitter.com/NDRFHQ",
                    "twitter.com/Indiametdept",
                    "twitter.com/ndmaindia",
                    "twitter.com/CMOMaharashtra",
                    "twitter.com/MoHFW_INDIA",
                    "facebook.com/BrihanmumbaiMunicipalCorporation"
            );
            mediaDomains = mediaDomains != null ? List.copyOf(mediaDomains) : List.of(
                    "reuters.com", "apnews.com", "bloomberg.com", "bbc.com",
                    "cnn.com", "aljazeera.com", "dw.com", "nytimes.com"
            );
            factCheckDomains = factCheckDomains != null ? List.copyOf(factCheckDomains) : List.of(
                    "altnews.in", "boomlive.in", "newschecker.in", "factly.in", "vishvasnews.com",
                    "thequint.com/news/webqoof", "indiatoday.in/fact-check",
                    "snopes.com", "reuters.com/fact-check", "afp.com/en/fact-check", "politifact.com",
                    "checkyourfact.com", "fullfact.org", "factcheck.org", "leadstories.com",
                    "bellingcat.com", "polygraph.info", "healthfeedback.org", "climatefeedback.org"
            );
            debunkMarkers = debunkMarkers != null ? List.copyOf(debunkMarkers) : List.of(
                    "false", "fake", "hoax", "misleading", "old video", "doctored"
            );
            viralContextTerms = viralContextTerms != null ? List.copyOf(viralContextTerms) : List.of(
                    "viral", "whatsapp", "fake", "hoax"
            );
            officialStopWords = officialStopWords != null ? Set.copyOf(officialStopWords) : Set.of(
                    "is", "are", "was", "were", "the", "a", "an", "in", "on", "at", "to", "for",
                    "of", "with", "by", "has", "have", "had", "been", "it", "this", "that", "i",
                    "official", "confirmed", "news", "report", "fake", "real", "check"
            );
            mediaStopWords = mediaStopWords != null ? Set.copyOf(mediaStopWords) : Set.of(
                    "is", "are", "was", "were", "the", "a", "an", "in", "on", "at", "to",
                    "has", "have", "had", "been", "it", "that", "this", "from", "by", "of",
                    "near", "about", "some", "few", "reportedly", "allegedly", "breaking",
                    "viral", "video", "fake", "rumor"
            );
            debunkStopWords = debunkStopWords != null ? Set.copyOf(debunkStopWords) : Set.of(
                    "is", "are", "was", "were", "the", "a", "an", "in", "on", "at",
                    "to", "for", "of", "with", "by", "i", "it", "this", "that"
            );
            debunkThreshold = debunkThreshold != null ? debunkThreshold : 0.20;
            portalTimeout = portalTimeout != null ? portalTimeout : Duration.ofSeconds(10);
            officialMinKeywordHits = officialMinKeywordHits != null ? officialMinKeywordHits : 2;
        }
    }
}
