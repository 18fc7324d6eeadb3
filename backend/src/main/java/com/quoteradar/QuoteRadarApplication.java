package com.quoteradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuoteRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuoteRadarApplication.class, args);
    }
}
