package com.athena.creatorservice.config;

import com.athena.creatorservice.agent.application.AgentTrainingRegistrar;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = AgentTrainingRegistrar.EXECUTOR)
  public Executor trainingExecutor() {
    ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
    ex.setThreadNamePrefix("training-");
    ex.setCorePoolSize(2);
    ex.setMaxPoolSize(8);
    ex.setQueueCapacity(200);
    ex.setKeepAliveSeconds(60);
    // registrations are best effort, drop them rather than block request threads
    ex.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
    ex.initialize();
    return ex;
  }
}
