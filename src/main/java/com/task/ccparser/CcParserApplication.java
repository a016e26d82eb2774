package com.task.ccparser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CcParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(CcParserApplication.class, args);
    }
}
