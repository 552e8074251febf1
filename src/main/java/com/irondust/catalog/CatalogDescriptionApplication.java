package com.irondust.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CatalogDescriptionApplication {
    public static void main(String[] args) {
        SpringApplication.run(CatalogDescriptionApplication.class, args);
    }
}
