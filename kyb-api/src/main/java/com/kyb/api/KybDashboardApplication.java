package com.kyb.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the KYB dashboard back end.
 * Engine and client components are wired explicitly in
 * {@link com.kyb.api.config.DashboardConfiguration}.
 */
@SpringBootApplication
public class KybDashboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(KybDashboardApplication.class, args);
    }
}
