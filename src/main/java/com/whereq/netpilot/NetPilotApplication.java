package com.whereq.netpilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ NetPilot.
 * This service runs network automation jobs (commands, configuration backups and
 * previewed configuration deployments) against inventory devices asynchronously.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class NetPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetPilotApplication.class, args);
    }
}
