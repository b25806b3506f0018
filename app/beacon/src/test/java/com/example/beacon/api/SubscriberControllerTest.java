package com.example.beacon.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.beacon.model.Severity;
import com.example.beacon.model.Subscriber;
import com.example.beacon.repository.SubscriberDirectory;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SubscriberController.class)
@Import(ApiExceptionHandler.class)
class SubscriberControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private SubscriberDirectory subscriberDirectory;

  @Test
  void putReturnsNormalizedSubscriber() throws Exception {
    when(subscriberDirectory.findById("s1"))
        .thenReturn(
            Optional.of(
                new Subscriber(
                    "s1",
                    "Ranger@example.com",
                    "+61412345678",
                    Set.of("R2", "R1"),
                    Set.of(),
                    true,
                    true,
                    Severity.MODERATE,
                    true)));

    mockMvc
        .perform(
            put("/v1/subscribers/{subscriber_id}", "s1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email":"Ranger@EXAMPLE.com","phone":"0412 345 678","regions":["R1","R2"],
                     "email_opt_in":true,"sms_opt_in":true,"minimum_severity":"MODERATE"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subscriber_id").value("s1"))
        .andExpect(jsonPath("$.phone").value("+61412345678"))
        .andExpect(jsonPath("$.regions[0]").value("R1"))
        .andExpect(jsonPath("$.regions[1]").value("R2"))
        .andExpect(jsonPath("$.active").value(true));
  }

  @Test
  void putWithoutRegionsReturns400() throws Exception {
    mockMvc
        .perform(
            put("/v1/subscribers/{subscriber_id}", "s1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\":\"a@example.com\",\"email_opt_in\":true}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("regions is required"));
  }

  @Test
  void putWithInvalidContactReturns400() throws Exception {
    doThrow(new IllegalArgumentException("email is invalid"))
        .when(subscriberDirectory)
        .save(any(Subscriber.class));

    mockMvc
        .perform(
            put("/v1/subscribers/{subscriber_id}", "s1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\":\"nope\",\"regions\":[\"R1\"],\"email_opt_in\":true}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("email is invalid"));
  }

  @Test
  void unknownSubscriberReturns404() throws Exception {
    when(subscriberDirectory.findById("ghost")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/v1/subscribers/{subscriber_id}", "ghost"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("SUBSCRIBER_NOT_FOUND"));
  }
}
