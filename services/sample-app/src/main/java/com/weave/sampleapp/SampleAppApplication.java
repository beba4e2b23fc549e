package com.weave.sampleapp;

import com.weave.sampleapp.config.SampleAppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Weave sample application: a route table of guards and responders served by Spring Boot.
 *
 * <p>Spring provides the container, configuration, actuator endpoints and the servlet filters.
 * Every other request is handed to the {@link com.weave.routing.Router} built by
 * {@link com.weave.sampleapp.api.WebApp}.
 */
@SpringBootApplication
@EnableConfigurationProperties(SampleAppProperties.class)
public class SampleAppApplication {

    private static final Logger log = LoggerFactory.getLogger(SampleAppApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SampleAppApplication.class, args);
        log.info("Weave sample app started successfully");
    }
}
