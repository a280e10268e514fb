package org.example.restaurantfieldservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Field service back end for restaurant equipment: tickets, interventions,
 * inventory and the offline replay queue.
 */
@SpringBootApplication
@EnableAsync
@EnableScheduling
public class RestaurantFieldServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RestaurantFieldServiceApplication.class, args);
    }

}
