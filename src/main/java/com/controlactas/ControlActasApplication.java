package com.controlactas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Control de actas: reconciles contractor payment certificates against reference unit prices.
 */
@SpringBootApplication
public class ControlActasApplication {

    public static void main(String[] args) {
        SpringApplication.run(ControlActasApplication.class, args);
    }
}
