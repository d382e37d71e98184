package com.quantbacktest.symphony.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA repositories and auditing of job timestamps.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.quantbacktest.symphony.repository")
@EnableJpaAuditing
@EnableTransactionManagement
public class JpaConfig {
}
