package com.goormthonuniv.sentinel.scanner;

import com.goormthonuniv.sentinel.config.ExecutorConfig;
import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.Signal;
import com.goormthonuniv.sentinel.dto.ThreatAssessment;
import com.goormthonuniv.sentinel.dto.ThreatCandidate;
import com.goormthonuniv.sentinel.entity.Crisis;
import com.goormthonuniv.sentinel.entity.Notification;
import com.goormthonuniv.sentinel.entity.SourceRef;
import com.goormthonuniv.sentinel.entity.TimelineItem;
import com.goormthonuniv.sentinel.enums.VerificationStatus;
import com.goormthonuniv.sentinel.exception.JudgmentException;
import com.goormthonuniv.sentinel.feed.FeedAggregator;
import com.goormthonuniv.sentinel.llm.JudgmentGateway;
import com.goormthonuniv.sentinel.llm.JudgmentOptions;
import com.goormthonuniv.sentinel.llm.Prompts;
import com.goormthonuniv.sentinel.service.VerificationOrchestrator;
import com.goormthonuniv.sentinel.store.CrisisStore;
import com.goormthonuniv.sentinel.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 1단계: 원시 신호 -> 새 위기.
 * 피드와 소셜 프로브를 병렬로 모으고, 키워드 정규식 필터 -> URL 중복 제거 -> 상한 적용 후 판정 서비스에 묻는다.
 * 이름이 기존 위기와 퍼지 일치하지 않는 후보만 생성하고, 시드 기록을 남긴 뒤 검증을 백그라운드로 넘긴다.
 */
@Slf4j
@Component
public class ThreatDiscoveryStage {

    static final String SEED_CLAIM_PREFIX = "Signal Detected: ";
    static final String SEED_SUMMARY = "Sentinel AI picked up this signal from web chatter. Automated verification agents have been deployed.";
    static final String SEED_REASONING = "Automated signal detection. Awaiting deep scan.";
    static final int SEED_CONFIDENCE = 10;
    static final String UNKNOWN_LOCATION = "Unknown Location";

    private static final DateTimeFormatter DIGEST_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'");

    private final FeedAggregator feedAggregator;
    private final SocialListeningProbe socialProbe;
    private final JudgmentGateway gateway;
    private final CrisisStore store;
    private final VerificationOrchestrator orchestrator;
    private final SupervisedTaskSet backgroundTasks;
    private final ExecutorService probeExecutor;
    private final SentinelProperties.Discovery config;
    private final String model;
    private final Pattern signalPattern;
    private final Clock clock;

    private final AtomicBoolean firstCycle = new AtomicBoolean(true);

    public ThreatDiscoveryStage(FeedAggregator feedAggregator,
                                SocialListeningProbe socialProbe,
                                JudgmentGateway gateway,
                                CrisisStore store,
                                VerificationOrchestrator orchestrator,
                                SupervisedTaskSet backgroundTasks,
                                @Qualifier(ExecutorConfig.PROBE_EXECUTOR) ExecutorService probeExecutor,
                                SentinelProperties properties,
                                Clock clock) {
        this.feedAggregator = feedAggregator;
        this.socialProbe = socialProbe;
        this.gateway = gateway;
        this.store = store;
        this.orchestrator = orchestrator;
        this.backgroundTasks = backgroundTasks;
        this.probeExecutor = probeExecutor;
        this.config = properties.discovery();
        this.model = properties.judgment().extractionModel();
        this.signalPattern = Pattern.compile(config.signalPattern(), Pattern.CASE_INSENSITIVE);
        this.clock = clock;
    }

    /** @return 이번 실행에서 새로 만든 위기만 */
    public List<Crisis> run() {
        boolean first = firstCycle.getAndSet(false);

        CompletableFuture<List<Signal>> feeds = pull("feeds", feedAggregator::fetchAll);
        CompletableFuture<List<Signal>> social = pull("social", socialProbe::listen);
        List<Signal> all = new ArrayList<>(feeds.join());
        all.addAll(social.join());

        List<Signal> batch = selectBatch(all);
        log.info("[Discovery] {} raw signal(s), {} relevant after filtering", all.size(), batch.size());
        if (batch.isEmpty()) return List.of();

        ThreatAssessment assessment;
        try {
            String now = clock.instant().atOffset(ZoneOffset.UTC).format(DIGEST_TIME);
            assessment = gateway.generateJson(model, Prompts.discovery(now, digest(batch)),
                    JudgmentOptions.DEFAULT_JSON, ThreatAssessment.class);
        } catch (JudgmentException e) {
            log.warn("[Discovery] threat assessment unavailable this tick: {}", e.getMessage());
            return List.of();
        }

        List<Crisis> created = new ArrayList<>();
        for (ThreatCandidate c : assessment.threats()) {
            try {
                createIfNew(c).ifPresent(created::add);
            } catch (RuntimeException e) {
                log.error("[Discovery] failed to register '{}': {}", c.name(), e.getMessage());
            }
        }
        notifyHighSeverity(created, first);
        log.info("[Discovery] {} new crisis(es)", created.size());
        return created;
    }

    /** 정규식 필터 -> URL 중복 제거(첫 항목 유지) -> 상한 */
    List<Signal> selectBatch(List<Signal> signals) {
        Set<String> seen = new HashSet<>();
        return signals.stream()
                .filter(s -> signalPattern.matcher(nn(s.title()) + " " + nn(s.body())).find())
                .filter(s -> seen.add(nn(s.url())))
                .limit(config.batchCap())
                .toList();
    }

    String digest(List<Signal> batch) {
        return batch.stream()
                .map(s -> "- " + s.title() + " (" + nn(s.sourceName()) + "): "
                        + TextUtils.truncate(TextUtils.stripTags(s.body()), config.digestSnippetLength()) + "...")
                .collect(Collectors.joining("\n"));
    }

    private Optional<Crisis> createIfNew(ThreatCandidate c) {
        String name = c.name().strip();
        if (store.findByFuzzyName(name).isPresent()) return Optional.empty();

        String location = c.location() == null || c.location().isBlank() ? UNKNOWN_LOCATION : c.location().strip();
        String keywords = c.keywords() == null || c.keywords().isBlank() ? name : c.keywords();
        String description = c.description() == null ? "" : c.description();
        Crisis crisis = store.createCrisis(name, description, keywords, c.severity(), location);
        log.info("[Discovery] NEW CANDIDATE: {} ({}, severity {})", name, location, crisis.getSeverity());

        store.createTimelineItem(TimelineItem.builder()
                .crisisId(crisis.getId())
                .claimText(SEED_CLAIM_PREFIX + name)
                .summary(SEED_SUMMARY)
                .status(VerificationStatus.UNCONFIRMED)
                .location(location)
                .sources(new ArrayList<>(List.of(new SourceRef("Sentinel Watchdog", "#"))))
                .confidenceScore(SEED_CONFIDENCE)
                .reasoningTrace(SEED_REASONING)
                .timestamp(clock.instant())
                .build());

        String claim = description.isBlank() ? name : description;
        UUID crisisId = crisis.getId();
        backgroundTasks.submit("seed-verify:" + name, () -> orchestrator.run(claim, location, crisisId));
        return Optional.of(crisis);
    }

    /** 첫 주기에는 상위 3건을 묶은 요약 1건, 이후에는 위기별 1건 */
    private void notifyHighSeverity(List<Crisis> created, boolean first) {
        List<Crisis> high = created.stream()
                .filter(c -> c.getSeverity() >= config.notifySeverity())
                .sorted(Comparator.comparingInt(Crisis::getSeverity).reversed())
                .toList();
        if (high.isEmpty()) return;

        if (first) {
            String names = high.stream().limit(3).map(Crisis::getName).collect(Collectors.joining(", "));
            store.createNotification("SYSTEM ONLINE: Initial Scan Complete. Detected " + high.size()
                    + " Active Threats. Top Priority: " + names + ".", Notification.CATASTROPHIC_ALERT, null);
            return;
        }
        for (Crisis c : high) {
            store.createNotification("NEW THREAT DETECTED: " + c.getName() + " (Severity: " + c.getSeverity()
                    + ") detected in " + c.getLocation() + ".", Notification.CATASTROPHIC_ALERT, c.getId());
        }
    }

    private CompletableFuture<List<Signal>> pull(String label, Supplier<List<Signal>> source) {
        return CompletableFuture.supplyAsync(source, probeExecutor)
                .exceptionally(e -> {
                    log.warn("[Discovery] {} source failed: {}", label, e.toString());
                    return List.of();
                });
    }

    private static String nn(String s) {
        return s == null ? "" : s;
    }
}
