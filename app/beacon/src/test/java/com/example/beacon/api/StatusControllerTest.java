package com.example.beacon.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(StatusController.class)
class StatusControllerTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void rootReturnsHealthStringWithoutRequestId() throws Exception {
    // MDC インターセプタは /v1 配下だけに掛かる
    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(content().string("beacon: ok"))
        .andExpect(header().doesNotExist("X-Request-Id"));
  }
}
