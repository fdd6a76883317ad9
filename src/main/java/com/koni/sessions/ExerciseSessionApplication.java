package com.koni.sessions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ExerciseSessionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExerciseSessionApplication.class, args);
    }
}
