package com.example.strategicpawns;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StrategicPawnsApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrategicPawnsApplication.class, args);
    }
}
