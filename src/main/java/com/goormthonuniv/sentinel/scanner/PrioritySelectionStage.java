package com.goormthonuniv.sentinel.scanner;

import com.goormthonuniv.sentinel.config.SentinelProperties;
import com.goormthonuniv.sentinel.dto.SelectionDecision;
import com.goormthonuniv.sentinel.entity.Crisis;
import com.goormthonuniv.sentinel.llm.JudgmentGateway;
import com.goormthonuniv.sentinel.llm.JudgmentOptions;
import com.goormthonuniv.sentinel.llm.Prompts;
import com.goormthonuniv.sentinel.store.CrisisStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 2단계: 추적 집합을 K건으로 줄인다. 삭제만 하고 생성하지 않는다.
 * 판정이 실패/불량/빈 선택이면 심각도 내림차순 상위 K건으로 결정적 폴백.
 */
@Slf4j
@Component
public class PrioritySelectionStage {

    static final int REAL_TIER = 3;

    private final JudgmentGateway gateway;
    private final CrisisStore store;
    private final SentinelProperties.Selection config;
    private final String model;

    public PrioritySelectionStage(JudgmentGateway gateway, CrisisStore store, SentinelProperties properties) {
        this.gateway = gateway;
        this.store = store;
        this.config = properties.selection();
        this.model = properties.judgment().extractionModel();
    }

    public void run() {
        int cap = config.trackedCap();
        List<Crisis> all = store.listCrises(config.candidateLimit());
        if (all.size() <= cap) {
            log.info("[Selection] {} tracked crisis(es), nothing to prune", all.size());
            return;
        }

        Set<UUID> keep = decide(all, cap).orElseGet(() -> fallback(all, cap));
        int deleted = store.retainOnly(keep);
        log.info("[Selection] kept {} crisis(es), deleted {}", keep.size(), deleted);
    }

    /** 판정 서비스 결정. 알 수 없는 id는 버리고 1..K건이 남을 때만 유효 */
    Optional<Set<UUID>> decide(List<Crisis> all, int cap) {
        SelectionDecision decision;
        try {
            decision = gateway.generateJson(model,
                    Prompts.selection(all.size(), cap, REAL_TIER, cap - REAL_TIER, candidates(all)),
                    JudgmentOptions.PRECISE_JSON, SelectionDecision.class);
        } catch (RuntimeException e) {
            log.warn("[Selection] decision failed, using fallback: {}", e.getMessage());
            return Optional.empty();
        }

        Map<String, UUID> known = all.stream()
                .collect(Collectors.toMap(c -> c.getId().toString(), Crisis::getId, (a, b) -> a));
        Set<UUID> keep = decision.selectedIds().stream()
                .map(String::strip)
                .map(known::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (keep.isEmpty() || keep.size() > cap) {
            log.warn("[Selection] decision kept {} known id(s) (cap {}), using fallback", keep.size(), cap);
            return Optional.empty();
        }
        return Optional.of(keep);
    }

    static Set<UUID> fallback(List<Crisis> all, int cap) {
        return all.stream()
                .sorted(Comparator.comparingInt(Crisis::getSeverity).reversed())
                .limit(cap)
                .map(Crisis::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String candidates(List<Crisis> all) {
        return all.stream()
                .map(c -> "ID: " + c.getId() + " | Name: " + c.getName() + " | Sev: " + c.getSeverity()
                        + " | Loc: " + c.getLocation())
                .collect(Collectors.joining("\n"));
    }
}
