package io.b2mash.b2b.inteltask;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IntelTaskApplication {

  public static void main(String[] args) {
    SpringApplication.run(IntelTaskApplication.class, args);
  }
}
