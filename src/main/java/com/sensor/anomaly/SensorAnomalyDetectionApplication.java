package com.sensor.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SensorAnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(SensorAnomalyDetectionApplication.class, args);
    }
}
