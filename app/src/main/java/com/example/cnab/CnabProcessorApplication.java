package com.example.cnab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CnabProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CnabProcessorApplication.class, args);
    }
}
