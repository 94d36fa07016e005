package com.depegscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DepegScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(DepegScanApplication.class, args);
    }
}
