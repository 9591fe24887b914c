package com.community.moderation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ModerationBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModerationBackendApplication.class, args);
    }

}
