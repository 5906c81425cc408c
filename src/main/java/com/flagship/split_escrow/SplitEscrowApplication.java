package com.flagship.split_escrow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SplitEscrowApplication {

    public static void main(String[] args) {
        SpringApplication.run(SplitEscrowApplication.class, args);
    }
}
