package com.oracle.brokencalc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BrokenCalculatorApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(BrokenCalculatorApplication.class, args);
    }
}
