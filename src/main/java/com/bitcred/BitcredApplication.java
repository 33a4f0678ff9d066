package com.bitcred;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BitcredApplication {

    public static void main(String[] args) {
        SpringApplication.run(BitcredApplication.class, args);
    }
}
