package com.goormthonuniv.sentinel.agent;

import com.goormthonuniv.sentinel.dto.EvidenceItem;
import com.goormthonuniv.sentinel.enums.EvidenceKind;

import java.util.List;

/**
 * 주장 1건에 대한 독립 증거 채널.
 * 구현체는 예외를 던지지 않으며 빈 목록 대신 "증거 없음" 항목 1개를 돌려준다.
 */
public interface EvidenceAgent {
    EvidenceKind kind();
    List<EvidenceItem> gather(String claimText);
}
