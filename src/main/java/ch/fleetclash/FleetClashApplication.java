package ch.fleetclash;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class of the FleetClash session server.
 *
 * <p>Enables:
 * <ul>
 *   <li>Spring Boot auto-configuration</li>
 *   <li>Component scanning for the entire application</li>
 *   <li>Scheduled task execution ({@code @EnableScheduling}) for heartbeats and sweeps</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class FleetClashApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetClashApplication.class, args);
    }

}
