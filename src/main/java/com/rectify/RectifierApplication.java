package com.rectify;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RectifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(RectifierApplication.class, args);
    }
}
