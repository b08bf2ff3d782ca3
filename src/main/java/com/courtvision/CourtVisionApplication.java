package com.courtvision;

import com.courtvision.config.RoutingProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CourtVisionApplication {
    private static final Logger log = LoggerFactory.getLogger(CourtVisionApplication.class);
    private final RoutingProperties routingProperties;

    public CourtVisionApplication(RoutingProperties routingProperties) {
        this.routingProperties = routingProperties;
    }

    public static void main(String[] args) {
        SpringApplication.run(CourtVisionApplication.class, args);
    }

    @PostConstruct
    public void validateRoutingConfiguration() {
        this.routingProperties.validate();
        log.info("Query routing configured (ratioFloor={}, ratioThreshold={}, llmFallback={})",
                this.routingProperties.getRatioFloor(), this.routingProperties.getRatioThreshold(),
                this.routingProperties.getLlmFallback().isEnabled());
    }
}
