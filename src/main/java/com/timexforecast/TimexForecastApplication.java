package com.timexforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TimexForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimexForecastApplication.class, args);
    }
}
