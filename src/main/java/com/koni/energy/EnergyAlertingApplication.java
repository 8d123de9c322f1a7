package com.koni.energy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EnergyAlertingApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnergyAlertingApplication.class, args);
    }
}
