package com.controlplane.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the cluster control plane.
 */
@SpringBootApplication(scanBasePackages = {
    "com.controlplane.api",
    "com.controlplane.engine"
})
public class ControlPlaneApplication {

    public static void main(String[] args) {
        SpringApplication.run(ControlPlaneApplication.class, args);
    }
}
