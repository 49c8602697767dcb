package com.kmg.altbuddy;

import com.kmg.altbuddy.config.AltBuddyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(AltBuddyProperties.class)
public class AltBuddyApplication {
    public static void main(String[] args) {
        SpringApplication.run(AltBuddyApplication.class, args);
    }
}
