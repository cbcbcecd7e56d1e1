package com.athena.creatorservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class TrainingApiConfig {

  @Bean
  public RestClient trainingRestClient(
      RestClient.Builder builder, TrainingApiProperties properties) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());

    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .build();
  }
}
