package com.quantbacktest.symphony.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.JsonNode;
import com.quantbacktest.symphony.strategy.parse.ProgramDialect;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrategyEvaluationRequest {

    @NotNull(message = "Program dialect is required")
    private ProgramDialect dialect;

    @NotNull(message = "Program is required")
    private JsonNode program;

    @NotNull(message = "Evaluation date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;
}
