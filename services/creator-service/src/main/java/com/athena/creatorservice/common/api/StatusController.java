package com.athena.creatorservice.common.api;

import com.athena.creatorservice.config.ServiceInfoProperties;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {
  private final ServiceInfoProperties serviceInfo;

  @GetMapping("/status")
  public ServiceStatus status() {
    return new ServiceStatus(
        serviceInfo.name(), "Microservice is running successfully",
        serviceInfo.version(), Instant.now());
  }
}
