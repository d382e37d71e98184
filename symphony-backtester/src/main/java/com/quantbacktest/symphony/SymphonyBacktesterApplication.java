package com.quantbacktest.symphony;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Symphony backtesting service: REST API, Redis job queue and in-process workers.
 */
@SpringBootApplication
public class SymphonyBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(SymphonyBacktesterApplication.class, args);
    }

}
