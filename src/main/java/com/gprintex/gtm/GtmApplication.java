package com.gprintex.gtm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GtmApplication {

    public static void main(String[] args) {
        SpringApplication.run(GtmApplication.class, args);
    }
}
