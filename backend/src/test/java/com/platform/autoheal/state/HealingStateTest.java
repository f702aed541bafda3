package com.platform.autoheal.state;

import com.platform.autoheal.model.WorkloadRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealingStateTest {

    private static final WorkloadRef WORKLOAD = WorkloadRef.of("default", "flask-app");
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("initial state should be healthy with the initial token")
    void initialState() {
        HealingState state = HealingState.initial(WORKLOAD);

        assertThat(state.attempt()).isZero();
        assertThat(state.lastAction()).isEqualTo(HealingAction.NONE);
        assertThat(state.versionToken()).isEqualTo(HealingState.INITIAL_TOKEN);
        assertThat(state.phase()).isEqualTo(HealingPhase.HEALTHY);
        assertThat(state.hasClaim()).isFalse();
    }

    @Test
    @DisplayName("should reject a last action inconsistent with the attempt")
    void rejectsInconsistentAction() {
        assertThatThrownBy(() -> new HealingState(WORKLOAD, 2, HealingAction.RESTARTED, NOW, "v1", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HealingState(WORKLOAD, 4, HealingAction.ROLLED_BACK, NOW, "v1", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("normalized should clamp hand-edited attempts and derive the action")
    void normalizedClamps() {
        assertThat(HealingState.normalized(WORKLOAD, 7, NOW, "v1", null).attempt()).isEqualTo(3);
        assertThat(HealingState.normalized(WORKLOAD, 7, NOW, "v1", null).lastAction()).isEqualTo(HealingAction.ROLLED_BACK);
        assertThat(HealingState.normalized(WORKLOAD, -2, NOW, null, null).attempt()).isZero();
        assertThat(HealingState.normalized(WORKLOAD, -2, NOW, null, null).versionToken()).isEqualTo(HealingState.INITIAL_TOKEN);
    }

    @Nested
    @DisplayName("Claims")
    class Claims {

        @Test
        @DisplayName("claiming should keep the attempt unchanged")
        void claimKeepsAttempt() {
            HealingState claimed = HealingState.initial(WORKLOAD).claim(HealingAction.RESTARTED, NOW);

            assertThat(claimed.attempt()).isZero();
            assertThat(claimed.inFlight()).isEqualTo(new InFlightClaim(HealingAction.RESTARTED, NOW));
        }

        @Test
        @DisplayName("advancing should set the new phase and clear the claim")
        void advanceClearsClaim() {
            HealingState committed = HealingState.initial(WORKLOAD)
                .claim(HealingAction.RESTARTED, NOW)
                .advanceTo(HealingPhase.ESCALATING_1, NOW.plusSeconds(5));

            assertThat(committed.attempt()).isEqualTo(1);
            assertThat(committed.lastAction()).isEqualTo(HealingAction.RESTARTED);
            assertThat(committed.inFlight()).isNull();
            assertThat(committed.lastUpdated()).isEqualTo(NOW.plusSeconds(5));
        }

        @Test
        @DisplayName("claim should be live until its ttl has elapsed")
        void claimExpiry() {
            HealingState claimed = HealingState.initial(WORKLOAD).claim(HealingAction.RESTARTED, NOW);
            Duration ttl = Duration.ofMinutes(10);

            assertThat(claimed.hasLiveClaim(NOW.plus(Duration.ofMinutes(9)), ttl)).isTrue();
            assertThat(claimed.hasLiveClaim(NOW.plus(Duration.ofMinutes(10)), ttl)).isFalse();
        }

        @Test
        @DisplayName("claim marker should round-trip and tolerate garbage")
        void claimMarker() {
            InFlightClaim claim = new InFlightClaim(HealingAction.CACHE_CLEARED, NOW);

            assertThat(claim.encode()).isEqualTo("CACHE_CLEARED@" + NOW.toEpochMilli());
            assertThat(InFlightClaim.decode(claim.encode())).isEqualTo(claim);
            assertThat(InFlightClaim.decode("CACHE_CLEARED")).isNull();
            assertThat(InFlightClaim.decode("REBOOT@123")).isNull();
            assertThat(InFlightClaim.decode("NONE@123")).isNull();
            assertThat(InFlightClaim.decode("RESTARTED@soon")).isNull();
        }
    }
}
