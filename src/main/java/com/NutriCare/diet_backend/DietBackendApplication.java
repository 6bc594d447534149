package com.NutriCare.diet_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DietBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(DietBackendApplication.class, args);
    }
}
