package com.jreinhal.waypoint;

import com.jreinhal.waypoint.config.RoutingProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WaypointApplication {
    private static final Logger log = LoggerFactory.getLogger(WaypointApplication.class);
    private final RoutingProperties properties;

    public WaypointApplication(RoutingProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication.run(WaypointApplication.class, args);
    }

    @PostConstruct
    public void validateRoutingConfiguration() {
        long stageTimeout = this.properties.getStageTimeoutMs();
        long intentTimeout = this.properties.getIntent().getLlmTimeoutMs();
        long toneTimeout = this.properties.getTone().getLlmTimeoutMs();
        if (stageTimeout <= Math.max(intentTimeout, toneTimeout)) {
            // Stages would be cut off before their own model timeouts fire.
            log.warn("waypoint.routing.stage-timeout-ms ({}) should exceed the model timeouts (intent={}, tone={})",
                    stageTimeout, intentTimeout, toneTimeout);
        }
        if (this.properties.getLowTierPlans().isEmpty()) {
            log.info("No low-tier plans configured; non-search routing depends on complexity only");
        }
        log.info("Routing configured: stageTimeout={}ms, intentTimeout={}ms, toneTimeout={}ms, lowTierPlans={}",
                stageTimeout, intentTimeout, toneTimeout, this.properties.getLowTierPlans());
    }
}
