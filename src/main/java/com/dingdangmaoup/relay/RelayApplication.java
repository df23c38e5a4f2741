package com.dingdangmaoup.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.metrics.buffering.BufferingApplicationStartup;

@SpringBootApplication
public class RelayApplication {

  public static void main(String[] args) {
    //Enable startup probe
    SpringApplication app = new SpringApplication(RelayApplication.class);
    app.setApplicationStartup(new BufferingApplicationStartup(2048));
    app.run(args);
  }

}
