package com.faasrt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FaasRuntimeApplication {

    public static void main(String[] args) {
        // returns only for the seed profile or once the poll loop is interrupted
        System.exit(SpringApplication.exit(SpringApplication.run(FaasRuntimeApplication.class, args)));
    }
}
