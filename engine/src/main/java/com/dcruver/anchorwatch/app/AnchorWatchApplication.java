package com.dcruver.anchorwatch.app;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the anchor-watch engine.
 *
 * Links indexed documents to semantic anchors by embedding similarity, then decides
 * which links are highlights using per-source-tier thresholds learned from recent
 * scores. Runs on a schedule or from the admin shell.
 */
@SpringBootApplication(scanBasePackages = "com.dcruver.anchorwatch")
@EnableScheduling
@ConfigurationPropertiesScan("com.dcruver.anchorwatch")
@Slf4j
public class AnchorWatchApplication {

    public static void main(String[] args) {
        log.info("Starting anchor-watch engine...");
        SpringApplication.run(AnchorWatchApplication.class, args);
    }
}
