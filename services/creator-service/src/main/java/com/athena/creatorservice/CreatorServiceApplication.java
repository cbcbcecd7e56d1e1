package com.athena.creatorservice;

import com.athena.creatorservice.config.ServiceInfoProperties;
import com.athena.creatorservice.config.TrainingApiProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ServiceInfoProperties.class, TrainingApiProperties.class})
public class CreatorServiceApplication {
  public static void main(String[] args) {
    SpringApplication.run(CreatorServiceApplication.class, args);
  }
}
