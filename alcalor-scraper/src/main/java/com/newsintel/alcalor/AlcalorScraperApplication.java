package com.newsintel.alcalor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
@EnableConfigurationProperties
public class AlcalorScraperApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(AlcalorScraperApplication.class);
        // backfill registers its own hook and needs the datasource until the last checkpoint is written
        app.setRegisterShutdownHook(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
