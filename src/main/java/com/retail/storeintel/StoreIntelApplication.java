package com.retail.storeintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StoreIntelApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoreIntelApplication.class, args);
    }
}
