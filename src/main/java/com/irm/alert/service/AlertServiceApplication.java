package com.irm.alert.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * IRM Alert Service Application - Entry point for the Spring Boot application.
 *
 * This application keeps the durable state of externally generated alerts:
 * - Receives Alertmanager webhook batches
 * - Reconciles each alert against stored state by fingerprint (new / updated / duplicate)
 * - Serves queries for the current status of each alert
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.irm.alert.service.config")
public class AlertServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertServiceApplication.class, args);
    }
}
