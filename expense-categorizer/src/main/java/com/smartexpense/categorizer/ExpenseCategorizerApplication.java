package com.smartexpense.categorizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class ExpenseCategorizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExpenseCategorizerApplication.class, args);
    }
}
