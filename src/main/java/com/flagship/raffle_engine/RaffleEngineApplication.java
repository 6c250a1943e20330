package com.flagship.raffle_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RaffleEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RaffleEngineApplication.class, args);
    }
}
