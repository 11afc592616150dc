/*
 * Where: Flock server entry point
 * What: Boots Spring and scans configuration properties
 * Why: One process serves registration, submissions and the admin notification API
 */
package com.flock.server;

import java.time.Clock;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class FlockServerApplication {

  // partition dates and registration timestamps are UTC
  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  public static void main(String[] args) {
    SpringApplication.run(FlockServerApplication.class, args);
  }
}
