package com.vrwx.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Assembles the settlement ledger, the scoring modules and the completion relayer.
 */
@SpringBootApplication(scanBasePackages = "com.vrwx")
public class VrwxRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(VrwxRelayApplication.class, args);
    }
}
