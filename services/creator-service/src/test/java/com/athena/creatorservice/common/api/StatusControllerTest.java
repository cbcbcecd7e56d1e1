package com.athena.creatorservice.common.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(StatusController.class)
class StatusControllerTest {
  @Autowired
  private MockMvc mvc;

  @Test
  void reportsServiceIdentity() throws Exception {
    mvc.perform(get("/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.service").value("Creator Athena Microservice"))
        .andExpect(jsonPath("$.status").value("Microservice is running successfully"))
        .andExpect(jsonPath("$.version").value("1.0.0"))
        .andExpect(jsonPath("$.timestamp").isNotEmpty());
  }
}
