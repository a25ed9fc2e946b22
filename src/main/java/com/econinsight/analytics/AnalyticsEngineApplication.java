package com.econinsight.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AnalyticsEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalyticsEngineApplication.class, args);
    }
}
