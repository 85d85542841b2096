package com.bayesai.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BayesServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BayesServerApplication.class, args);
    }
}
