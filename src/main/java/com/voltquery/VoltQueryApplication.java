package com.voltquery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for VoltQuery - energy question answering over unreliable data APIs.
 */
@SpringBootApplication
public class VoltQueryApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoltQueryApplication.class, args);
    }
}
