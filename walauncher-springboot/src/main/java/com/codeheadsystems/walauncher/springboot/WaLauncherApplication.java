package com.codeheadsystems.walauncher.springboot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The WhatsApp launcher application.
 */
@SpringBootApplication
public class WaLauncherApplication {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(WaLauncherApplication.class, args);
  }
}
