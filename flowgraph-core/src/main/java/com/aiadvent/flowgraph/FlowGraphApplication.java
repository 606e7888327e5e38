package com.aiadvent.flowgraph;

import com.aiadvent.flowgraph.config.FlowGraphProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(FlowGraphProperties.class)
public class FlowGraphApplication {

  public static void main(String[] args) {
    SpringApplication.run(FlowGraphApplication.class, args);
  }
}
