package com.clan.clears;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ClearsBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClearsBackendApplication.class, args);
    }

}
