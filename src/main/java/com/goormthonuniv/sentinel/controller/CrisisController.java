package com.goormthonuniv.sentinel.controller;

import com.goormthonuniv.sentinel.config.OpenApiConfig;
import com.goormthonuniv.sentinel.dto.CrisisResponse;
import com.goormthonuniv.sentinel.dto.NotificationResponse;
import com.goormthonuniv.sentinel.dto.TimelineItemResponse;
import com.goormthonuniv.sentinel.exception.NotFoundException;
import com.goormthonuniv.sentinel.store.CrisisStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.*;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@Tag(name = OpenApiConfig.TAG_MONITORING)
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
public class CrisisController {

    private final CrisisStore store;

    @Operation(summary = "추적 중인 위기 목록", description = "심각도 내림차순")
    @GetMapping("/crises")
    public ResponseEntity<List<CrisisResponse>> list(@RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
        return ResponseEntity.ok(store.listCrises(limit).stream().map(CrisisResponse::from).toList());
    }

    @Operation(summary = "위기 상세")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "없는 위기 id")
    })
    @GetMapping("/crises/{id}")
    public ResponseEntity<CrisisResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(store.findCrisis(id).map(CrisisResponse::from)
                .orElseThrow(() -> new NotFoundException("Crisis not found: " + id)));
    }

    @Operation(summary = "위기 타임라인", description = "최신순 주장 기록")
    @GetMapping("/crises/{id}/timeline")
    public ResponseEntity<List<TimelineItemResponse>> timeline(@PathVariable UUID id) {
        if (store.findCrisis(id).isEmpty()) throw new NotFoundException("Crisis not found: " + id);
        return ResponseEntity.ok(store.listTimeline(id).stream().map(TimelineItemResponse::from).toList());
    }

    @Operation(summary = "최신 알림")
    @GetMapping("/notifications/latest")
    public ResponseEntity<NotificationResponse> latestNotification() {
        return store.latestNotification()
                .map(n -> ResponseEntity.ok(NotificationResponse.from(n)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
