package com.quantbacktest.symphony.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AllocationResponse {

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;

    /** Symbol to weight; empty when the allocation is all cash. */
    private Map<String, Double> weights;

    private boolean cash;
}
