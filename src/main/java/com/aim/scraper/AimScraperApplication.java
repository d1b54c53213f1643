package com.aim.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the AIM form scraper.
 *
 * <p>The application drives the E-AIM thermodynamic model page the way a user
 * would: it reads the page's form, fills in temperature, relative humidity,
 * species amounts and solid phases, submits it and parses the text output
 * into a structured result.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   mvn spring-boot:run
 *
 *   curl -X POST localhost:8080/api/aim/run -H 'Content-Type: application/json' \
 *        -d '{"temperatureK":298.15,"relativeHumidity":0.5,"species":{"H+":0.2,"SO42-":0.1}}'
 * }</pre>
 */
@SpringBootApplication
public class AimScraperApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(AimScraperApplication.class, args);
    }
}
