package com.donorid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DonorIdentifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(DonorIdentifierApplication.class, args);
    }
}
