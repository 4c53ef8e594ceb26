package com.example.hybridretrieval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
public class HybridRetrievalApplication {

    public static void main(String[] args) {
        SpringApplication.run(HybridRetrievalApplication.class, args);
    }
}
