package com.example.routines.docgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RoutineDocgenApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoutineDocgenApplication.class, args);
    }
}
