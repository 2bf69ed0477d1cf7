package com.logimetrics.coordinator.api;

import com.logimetrics.coordinator.api.request.PushSubscriptionRequest;
import com.logimetrics.coordinator.notification.PushSubscription;
import com.logimetrics.coordinator.notification.PushSubscriptionRepository;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Registers web push endpoints for the user the gateway forwarded. */
@RestController
@RequestMapping("/push/subscriptions")
@RequiredArgsConstructor
public class PushSubscriptionController {

  private final PushSubscriptionRepository subscriptionRepository;
  private final Clock clock;

  @PostMapping
  public ResponseEntity<Void> subscribe(
      Authentication authentication, @Valid @RequestBody PushSubscriptionRequest request) {
    final boolean added =
        subscriptionRepository.subscribe(
            userId(authentication),
            new PushSubscription(request.endpoint(), request.keys(), Instant.now(clock)));
    return ResponseEntity.status(added ? HttpStatus.CREATED : HttpStatus.OK).build();
  }

  @DeleteMapping
  public ResponseEntity<Void> unsubscribe(
      Authentication authentication, @RequestParam("endpoint") String endpoint) {
    final boolean removed = subscriptionRepository.unsubscribe(userId(authentication), endpoint);
    return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
  }

  private static UUID userId(Authentication authentication) {
    try {
      return UUID.fromString(authentication.getName());
    } catch (IllegalArgumentException ex) {
      throw new InvalidRequestException("forwarded user id is not a uuid");
    }
  }
}
