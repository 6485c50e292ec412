package com.tradejournal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradeJournalApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeJournalApplication.class, args);
    }
}
