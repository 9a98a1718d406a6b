package com.mondayBi.biAgent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BiAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(BiAgentApplication.class, args);
    }
}
