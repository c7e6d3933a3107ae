package com.whereq.forge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Forge.
 * This service accepts article, image and video generation requests, queues them
 * for a pool of workers and reports job status back to the web layer.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class ForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForgeApplication.class, args);
    }
}
