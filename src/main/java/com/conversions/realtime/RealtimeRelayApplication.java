package com.conversions.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point. A failure to start, such as the port already being
 * in use, propagates out of {@code run} and ends the process.
 */
@SpringBootApplication
public class RealtimeRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealtimeRelayApplication.class, args);
    }
}
