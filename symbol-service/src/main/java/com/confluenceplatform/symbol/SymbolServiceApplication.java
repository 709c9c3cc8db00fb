package com.confluenceplatform.symbol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SymbolServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SymbolServiceApplication.class, args);
    }
}
