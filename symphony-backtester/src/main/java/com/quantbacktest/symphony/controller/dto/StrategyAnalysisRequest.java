package com.quantbacktest.symphony.controller.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.quantbacktest.symphony.strategy.parse.ProgramDialect;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrategyAnalysisRequest {

    @NotNull(message = "Program dialect is required")
    private ProgramDialect dialect;

    @NotNull(message = "Program is required")
    private JsonNode program;
}
