package com.architecture.memory.vuegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VueGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(VueGraphApplication.class, args);
    }
}
