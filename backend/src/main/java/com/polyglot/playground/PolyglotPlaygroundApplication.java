package com.polyglot.playground;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PolyglotPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolyglotPlaygroundApplication.class, args);
    }
}
