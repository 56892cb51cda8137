package com.tradesim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradeSimApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeSimApplication.class, args);
    }
}
