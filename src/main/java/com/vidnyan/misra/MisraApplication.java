package com.vidnyan.misra;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * MISRA C:2012 rule engine.
 *
 * Checks program models produced by an external C analyzer.
 */
@SpringBootApplication
public class MisraApplication {

    public static void main(String[] args) {
        SpringApplication.run(MisraApplication.class, args);
    }
}
