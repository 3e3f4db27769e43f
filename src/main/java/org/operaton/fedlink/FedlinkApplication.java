package org.operaton.fedlink;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application class for Fedlink.
 * Fedlink signs ActivityPub activities, delivers them to remote inboxes and
 * lazily resolves the remote objects they refer to.
 */
@SpringBootApplication
@Slf4j
public class FedlinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(FedlinkApplication.class, args);
        log.info("Fedlink application started successfully!");
    }
}
