package com.vouch.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class VouchAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(VouchAuthApplication.class, args);
    }
}
