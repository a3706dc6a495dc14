// Namespace
package com.gnovoa.matchsim;

// Imports
import com.gnovoa.matchsim.config.SimProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties(SimProperties.class)
public class MatchSimulatorApplication {

  public static void main(String[] args) {
    SpringApplication.run(MatchSimulatorApplication.class, args);
  }
}
