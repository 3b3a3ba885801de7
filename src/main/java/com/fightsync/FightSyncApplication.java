package com.fightsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the fight catalog reconciler.
 */
@SpringBootApplication
public class FightSyncApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(FightSyncApplication.class, args)));
    }
}
