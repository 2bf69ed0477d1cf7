package com.logimetrics.coordinator.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.logimetrics.coordinator.config.PropertiesConfig;
import com.logimetrics.coordinator.notification.PushSubscription;
import com.logimetrics.coordinator.notification.PushSubscriptionRepository;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PushSubscriptionController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import({ApiExceptionHandler.class, PropertiesConfig.class})
class PushSubscriptionControllerTest {

  private static final UUID USER_ID = UUID.fromString("0d7c4b1e-8f62-4c1a-a7b5-3e9f2d6c1b20");
  private static final String BODY =
      """
      {"endpoint":"https://push.example.test/abc","keys":{"p256dh":"key","auth":"secret"}}
      """;

  @Autowired private MockMvc mockMvc;

  @MockitoBean private PushSubscriptionRepository subscriptionRepository;

  @Test
  void newEndpointIsCreatedForForwardedUser() throws Exception {
    when(subscriptionRepository.subscribe(eq(USER_ID), any())).thenReturn(true);

    mockMvc
        .perform(
            post("/push/subscriptions")
                .principal(principal(USER_ID.toString()))
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isCreated());

    final ArgumentCaptor<PushSubscription> saved =
        ArgumentCaptor.forClass(PushSubscription.class);
    verify(subscriptionRepository).subscribe(eq(USER_ID), saved.capture());
    assertThat(saved.getValue().endpoint()).isEqualTo("https://push.example.test/abc");
    assertThat(saved.getValue().keys()).containsEntry("auth", "secret");
    assertThat(saved.getValue().createdAt()).isNotNull();
  }

  @Test
  void knownEndpointAnswersOk() throws Exception {
    when(subscriptionRepository.subscribe(eq(USER_ID), any())).thenReturn(false);

    mockMvc
        .perform(
            post("/push/subscriptions")
                .principal(principal(USER_ID.toString()))
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isOk());
  }

  @Test
  void blankEndpointFailsValidation() throws Exception {
    mockMvc
        .perform(
            post("/push/subscriptions")
                .principal(principal(USER_ID.toString()))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"endpoint\":\" \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    verifyNoInteractions(subscriptionRepository);
  }

  @Test
  void nonUuidUserIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/push/subscriptions")
                .principal(principal("driver-7"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("forwarded user id is not a uuid"));
  }

  @Test
  void unsubscribeUnknownEndpointReturns404() throws Exception {
    when(subscriptionRepository.unsubscribe(USER_ID, "https://push.example.test/gone"))
        .thenReturn(false);

    mockMvc
        .perform(
            delete("/push/subscriptions")
                .principal(principal(USER_ID.toString()))
                .param("endpoint", "https://push.example.test/gone"))
        .andExpect(status().isNotFound());
  }

  @Test
  void unsubscribeWithoutEndpointIsBadRequest() throws Exception {
    mockMvc
        .perform(delete("/push/subscriptions").principal(principal(USER_ID.toString())))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  private static UsernamePasswordAuthenticationToken principal(String userId) {
    return new UsernamePasswordAuthenticationToken(
        userId, "N/A", List.of(new SimpleGrantedAuthority("ROLE_INTERNAL")));
  }
}
