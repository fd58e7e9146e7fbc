package net.cratedigger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the CrateDigger recommendation service.
 */
@SpringBootApplication
@EnableScheduling
public class CrateDiggerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrateDiggerApplication.class, args);
    }
}
