package com.noteshub.gamification;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling // periodic leaderboard refresh, see LeaderboardRefreshJob
public class GamificationBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(GamificationBackendApplication.class, args);
    }

}
