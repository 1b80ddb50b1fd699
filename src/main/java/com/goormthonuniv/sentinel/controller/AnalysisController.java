package com.goormthonuniv.sentinel.controller;

import com.goormthonuniv.sentinel.config.OpenApiConfig;
import com.goormthonuniv.sentinel.dto.AnalysisResponse;
import com.goormthonuniv.sentinel.dto.AnalyzeRequest;
import com.goormthonuniv.sentinel.service.AdHocAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Tag(name = OpenApiConfig.TAG_ANALYSIS)
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalysisController {

    private final AdHocAnalysisService analysisService;

    @Operation(summary = "주장 검증 요청", description = "의심 주장/제보를 접수하고 PENDING 분석 기록을 반환합니다. 결과는 조회 API로 확인합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "접수됨"),
            @ApiResponse(responseCode = "400", description = "요청 형식 오류"),
            @ApiResponse(responseCode = "500", description = "서버 오류")
    })
    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalyzeRequest req) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(AnalysisResponse.from(analysisService.submit(req.queryText())));
    }

    @Operation(summary = "검증 결과 조회")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "없는 분석 id")
    })
    @GetMapping("/analyze/{id}")
    public ResponseEntity<AnalysisResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(AnalysisResponse.from(analysisService.get(id)));
    }
}
