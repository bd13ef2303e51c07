package com.bastion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Bastion threat feed aggregator.
 *
 * Bastion polls remote threat-intelligence feeds, classifies and de-duplicates
 * the indicators they carry, filters them against an operator whitelist and
 * republishes the active set as plain-text and proxy-format blacklist files.
 *
 * Background work:
 * - Feed scheduler dispatching due sources to the ingestion worker pool
 * - Temporary activation sweeper
 * - Periodic and on-demand blacklist export
 */
@SpringBootApplication
@EnableScheduling
public class BastionApplication {

    public static void main(String[] args) {
        SpringApplication.run(BastionApplication.class, args);
    }
}
