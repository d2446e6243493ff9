package com.fluforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FluForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(FluForecastApplication.class, args);
    }
}
