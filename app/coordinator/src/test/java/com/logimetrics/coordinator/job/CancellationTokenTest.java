package com.logimetrics.coordinator.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.logimetrics.coordinator.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CancellationTokenTest {

  @Test
  void firstReasonWins() {
    final CancellationToken token = CancellationToken.create();

    token.cancel(CancellationToken.Reason.TIMEOUT);
    token.cancel(CancellationToken.Reason.SHUTDOWN);

    assertThat(token.reason()).isEqualTo(CancellationToken.Reason.TIMEOUT);
  }

  @Test
  void childFollowsParentAndItsOwnBudget() {
    final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    final CancellationToken parent = CancellationToken.create();
    final CancellationToken budgeted = parent.child(clock, Duration.ofSeconds(5));
    final CancellationToken other = parent.child(clock, Duration.ofMinutes(5));

    clock.advance(Duration.ofSeconds(5));

    assertThat(budgeted.reason()).isEqualTo(CancellationToken.Reason.TIMEOUT);
    assertThat(other.isCancelled()).isFalse();

    parent.cancel(CancellationToken.Reason.SHUTDOWN);

    assertThat(other.reason()).isEqualTo(CancellationToken.Reason.PARENT);
    assertThatThrownBy(other::throwIfCancelled)
        .isInstanceOf(JobCancelledException.class)
        .hasMessage("run cancelled: parent");
  }
}
