package com.quantbacktest.symphony.controller;

import com.quantbacktest.symphony.controller.dto.MarketDataIngestionResponse;
import com.quantbacktest.symphony.service.MarketDataIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

@RestController
@RequestMapping("/market-data")
@RequiredArgsConstructor
@Slf4j
public class MarketDataController {

    private final MarketDataIngestionService ingestionService;

    /**
     * Upload daily bars for a symbol as CSV.
     */
    @PostMapping(value = "/{symbol}", consumes = { "text/csv", "text/plain" })
    public ResponseEntity<MarketDataIngestionResponse> ingest(@PathVariable String symbol,
                                                              @RequestBody String csv) {
        log.info("POST /market-data/{} - {} bytes", symbol, csv.length());

        int inserted = ingestionService.ingestCsv(symbol, csv);
        long total = ingestionService.countRecords(symbol);

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new MarketDataIngestionResponse(symbol.trim().toUpperCase(Locale.ROOT), inserted, total));
    }
}
