package com.RK8.PriceChecker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PriceCheckerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PriceCheckerApplication.class, args);
    }
}
