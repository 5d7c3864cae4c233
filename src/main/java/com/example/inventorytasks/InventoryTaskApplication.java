package com.example.inventorytasks;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Inventory Task Service Application
 * <p>
 * Background side of the inventory system:
 * - Registers the periodic maintenance jobs on startup and runs them on their cadence
 * - Keeps currency exchange rates fresh
 * - Offloads low-stock checks to a persistent task queue
 * - Sends throttled low-stock e-mails to part subscribers
 * - Boots the plugin registry once per process
 */
@EnableScheduling
@SpringBootApplication
public class InventoryTaskApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryTaskApplication.class, args);
    }
}
