package com.logvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for LogVault.
 *
 * LogVault pulls time-ranged Log Search results from Rapid7 InsightOps and stores them
 * as Parquet files for downstream analytics.
 *
 * Key Features:
 * - Asynchronous query submission with bounded polling
 * - Link-based pagination with loop and runaway protection
 * - 429 handling from Retry-After / X-RateLimit-Reset, retries of transient failures
 * - Schema-checked Parquet output with atomic file publication
 */
@SpringBootApplication
public class LogVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogVaultApplication.class, args);
    }
}
