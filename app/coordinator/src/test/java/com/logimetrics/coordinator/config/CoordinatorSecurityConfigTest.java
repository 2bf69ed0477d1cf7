package com.logimetrics.coordinator.config;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.logimetrics.coordinator.api.ApiExceptionHandler;
import com.logimetrics.coordinator.api.JobAdminController;
import com.logimetrics.coordinator.api.PushSubscriptionController;
import com.logimetrics.coordinator.job.JobRegistry;
import com.logimetrics.coordinator.notification.PushSubscriptionRepository;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({JobAdminController.class, PushSubscriptionController.class})
@AutoConfigureMockMvc
@Import({CoordinatorSecurityConfig.class, PropertiesConfig.class, ApiExceptionHandler.class})
@TestPropertySource(properties = "coordinator.internal-api.token=test-internal-token")
class CoordinatorSecurityConfigTest {

  private static final String USER_ID = "0d7c4b1e-8f62-4c1a-a7b5-3e9f2d6c1b20";

  @Autowired private MockMvc mockMvc;

  @MockitoBean private JobRegistry jobRegistry;
  @MockitoBean private PushSubscriptionRepository subscriptionRepository;

  @Test
  void adminApiRejectsRequestsWithoutInternalToken() throws Exception {
    mockMvc.perform(get("/admin/jobs")).andExpect(status().isForbidden());
  }

  @Test
  void adminApiRejectsWrongToken() throws Exception {
    mockMvc
        .perform(
            get("/admin/jobs")
                .header("X-Internal-Token", "other-token")
                .header("X-User-Id", USER_ID)
                .header("X-User-Roles", "ADMIN"))
        .andExpect(status().isForbidden());
  }

  @Test
  void adminApiAllowsForwardedAdmin() throws Exception {
    when(jobRegistry.list()).thenReturn(List.of());

    mockMvc
        .perform(
            get("/admin/jobs")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", USER_ID)
                .header("X-User-Roles", "dispatcher, ADMIN"))
        .andExpect(status().isOk());
  }

  @Test
  void adminApiRejectsForwardedUserWithoutAdminRole() throws Exception {
    mockMvc
        .perform(
            get("/admin/jobs")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", USER_ID)
                .header("X-User-Roles", "driver"))
        .andExpect(status().isForbidden());
  }

  @Test
  void pushSubscriptionAcceptsAnyForwardedUser() throws Exception {
    when(subscriptionRepository.subscribe(eq(UUID.fromString(USER_ID)), any())).thenReturn(true);

    mockMvc
        .perform(
            post("/push/subscriptions")
                .header("X-Internal-Token", "test-internal-token")
                .header("X-User-Id", USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"endpoint\":\"https://push.example.test/abc\"}"))
        .andExpect(status().isCreated());

    verify(subscriptionRepository).subscribe(eq(UUID.fromString(USER_ID)), any());
  }

  // no actuator in this slice: reaching the dispatcher proves the path is not guarded
  @Test
  void actuatorPathsSkipAuthorization() throws Exception {
    mockMvc.perform(get("/actuator/prometheus")).andExpect(status().isNotFound());
  }
}
