package com.locplat.translation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LocplatTranslatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(LocplatTranslatorApplication.class, args);
    }
}
