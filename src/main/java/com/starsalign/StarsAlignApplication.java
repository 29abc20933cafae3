package com.starsalign;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StarsAlignApplication {

    public static void main(String[] args) {
        SpringApplication.run(StarsAlignApplication.class, args);
    }
}
