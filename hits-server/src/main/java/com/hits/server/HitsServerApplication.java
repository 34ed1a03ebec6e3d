package com.hits.server;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Hit counter service: REST and WebSocket endpoints over the PostgreSQL counter store. */
@Slf4j
@SpringBootApplication(scanBasePackages = {"com.hits.controller", "com.hits.service"})
public class HitsServerApplication {

    public static void main(String[] args) {
        log.info("Starting Hits server with {} available processors", Runtime.getRuntime().availableProcessors());
        SpringApplication.run(HitsServerApplication.class, args);
    }
}
