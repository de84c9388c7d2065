package com.sandstormtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
@EnableAsync
@EnableScheduling
@Slf4j
public class SandstormTrackerApplication {
    public static void main(String[] args) {
        SpringApplication.run(SandstormTrackerApplication.class, args);
    }

    @PreDestroy
    public void onExit() {
        log.info("Tracker is shutting down. Draining server workers...");
    }
}
