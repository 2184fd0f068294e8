package com.herzen.screening;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ResponseScreeningApplication {
    public static void main(String[] args) {
        SpringApplication.run(ResponseScreeningApplication.class, args);
    }
}
