package com.sfiya.autoreply;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SfiyaApplication {

    public static void main(String[] args) {
        SpringApplication.run(SfiyaApplication.class, args);
    }

}
