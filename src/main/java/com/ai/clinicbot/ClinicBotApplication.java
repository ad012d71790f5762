package com.ai.clinicbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableJpaRepositories(basePackages = "com.ai.clinicbot.repository")
@EntityScan(basePackages = "com.ai.clinicbot.entity")
public class ClinicBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClinicBotApplication.class, args);
    }
}
