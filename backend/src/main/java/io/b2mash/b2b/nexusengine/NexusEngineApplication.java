package io.b2mash.b2b.nexusengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NexusEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(NexusEngineApplication.class, args);
  }
}
