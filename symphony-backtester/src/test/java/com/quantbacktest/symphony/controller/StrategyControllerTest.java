package com.quantbacktest.symphony.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantbacktest.symphony.controller.dto.StrategyAnalysisRequest;
import com.quantbacktest.symphony.controller.dto.StrategyEvaluationRequest;
import com.quantbacktest.symphony.engine.EvaluationErrorKind;
import com.quantbacktest.symphony.engine.EvaluationException;
import com.quantbacktest.symphony.engine.StrategyRequirements;
import com.quantbacktest.symphony.engine.TargetAllocation;
import com.quantbacktest.symphony.service.StrategyService;
import com.quantbacktest.symphony.strategy.AssetNode;
import com.quantbacktest.symphony.strategy.IndicatorRef;
import com.quantbacktest.symphony.strategy.Symphony;
import com.quantbacktest.symphony.strategy.parse.ProgramDialect;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for StrategyController analysis and evaluation endpoints.
 */
@WebMvcTest(StrategyController.class)
class StrategyControllerTest {

    private static final String PROGRAM = "[\"Hold SPY\", \"\", [\"asset\", \"SPY\"]]";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private StrategyService strategyService;

    @Test
    void testAnalyze_ReturnsRequirements() throws Exception {
        // Arrange
        Symphony symphony = new Symphony("Hold SPY", "", AssetNode.of("SPY"));
        IndicatorRef rsi = IndicatorRef.rsi(10);
        StrategyRequirements requirements = new StrategyRequirements(
                Set.of("SPY"), Set.of(rsi), Map.of(rsi, Set.of("SPY")));
        when(strategyService.parse(eq(ProgramDialect.COMPOSER_JSON), any())).thenReturn(symphony);
        when(strategyService.analyze(symphony)).thenReturn(requirements);

        StrategyAnalysisRequest request = StrategyAnalysisRequest.builder()
                .dialect(ProgramDialect.COMPOSER_JSON)
                .program(objectMapper.readTree(PROGRAM))
                .build();

        // Act & Assert
        mockMvc.perform(post("/strategies/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Hold SPY"))
                .andExpect(jsonPath("$.tickers[0]").value("SPY"))
                .andExpect(jsonPath("$.indicators[0].kind").value("RSI"))
                .andExpect(jsonPath("$.indicators[0].window").value(10))
                .andExpect(jsonPath("$.indicators[0].symbols[0]").value("SPY"));
    }

    @Test
    void testEvaluate_ReturnsWeights() throws Exception {
        // Arrange
        LocalDate date = LocalDate.of(2024, 6, 3);
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("SPY", 0.75);
        weights.put("TLT", 0.25);
        when(strategyService.evaluate(eq(ProgramDialect.COMPOSER_JSON), any(), eq(date)))
                .thenReturn(TargetAllocation.normalized(weights));

        StrategyEvaluationRequest request = StrategyEvaluationRequest.builder()
                .dialect(ProgramDialect.COMPOSER_JSON)
                .program(objectMapper.readTree(PROGRAM))
                .date(date)
                .build();

        // Act & Assert
        mockMvc.perform(post("/strategies/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2024-06-03"))
                .andExpect(jsonPath("$.weights.SPY").value(0.75))
                .andExpect(jsonPath("$.weights.TLT").value(0.25))
                .andExpect(jsonPath("$.cash").value(false));
    }

    @Test
    void testEvaluate_MissingData_Unprocessable() throws Exception {
        // Arrange
        when(strategyService.evaluate(any(), any(), any())).thenThrow(
                new EvaluationException(EvaluationErrorKind.DATA_UNAVAILABLE, "SPY", "No close price available"));

        StrategyEvaluationRequest request = StrategyEvaluationRequest.builder()
                .dialect(ProgramDialect.COMPOSER_JSON)
                .program(objectMapper.readTree(PROGRAM))
                .date(LocalDate.of(1990, 1, 2))
                .build();

        // Act & Assert
        mockMvc.perform(post("/strategies/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("DATA_UNAVAILABLE"));
    }

    @Test
    void testEvaluate_MissingDate_BadRequest() throws Exception {
        // Arrange
        StrategyEvaluationRequest request = StrategyEvaluationRequest.builder()
                .dialect(ProgramDialect.COMPOSER_JSON)
                .program(objectMapper.readTree(PROGRAM))
                .build();

        // Act & Assert
        mockMvc.perform(post("/strategies/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest());
    }
}
