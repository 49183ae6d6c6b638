package com.storeforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StoreForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoreForecastApplication.class, args);
    }
}
