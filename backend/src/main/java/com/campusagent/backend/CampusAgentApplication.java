package com.campusagent.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CampusAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(CampusAgentApplication.class, args);
    }
}
