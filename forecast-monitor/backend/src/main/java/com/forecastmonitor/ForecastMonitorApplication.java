package com.forecastmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ForecastMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastMonitorApplication.class, args);
    }
}
