package com.goormthonuniv.sentinel.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/** 선별 단계 판정 응답 */
public record SelectionDecision(
        @JsonProperty("selected_ids") @JsonAlias("selectedIds")
        @NotEmpty List<@NotBlank String> selectedIds
) {}
