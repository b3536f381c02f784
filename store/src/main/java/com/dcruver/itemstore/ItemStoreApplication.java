package com.dcruver.itemstore;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the item store.
 *
 * Keeps snippets, ordered lists and tables in one SQLite database and
 * exposes maintenance commands through Spring Shell.
 */
@SpringBootApplication
@Slf4j
public class ItemStoreApplication {

    public static void main(String[] args) {
        log.info("Starting Item Store...");
        SpringApplication.run(ItemStoreApplication.class, args);
    }
}
