package io.relaybox.relay;

import io.relaybox.model.ErrorKind;
import io.relaybox.ratelimit.SourceRateLimiter;
import io.relaybox.util.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

final class RelayAdmissionTest {

    @Test
    void connectionAndAllocationLimitsAreCountedSeparately() {
        MutableClock clock = MutableClock.startingAt(0L);
        RelayAdmission admission = new RelayAdmission(
                new SourceRateLimiter("relay-connect", 2, clock),
                new SourceRateLimiter("relay-allocate", 1, clock)
        );

        Assertions.assertEquals(Optional.empty(), admission.admitConnection("203.0.113.5"));
        Assertions.assertTrue(admission.admitAllocation("203.0.113.5"));
        Assertions.assertEquals(Optional.empty(), admission.admitConnection("203.0.113.5"));
        Assertions.assertFalse(admission.admitAllocation("203.0.113.5"));
        Assertions.assertEquals(Optional.of(ErrorKind.RATE_LIMITED), admission.admitConnection("203.0.113.5"));

        clock.advance(Duration.ofMinutes(1));
        Assertions.assertEquals(Optional.empty(), admission.admitConnection("203.0.113.5"));
        Assertions.assertTrue(admission.admitAllocation("203.0.113.5"));
    }

    @Test
    void blockedSourceIsForbiddenAndAllowlistedSourceIsNeverLimited() {
        MutableClock clock = MutableClock.startingAt(0L);
        SourceRateLimiter connections = new SourceRateLimiter("relay-connect", 1, clock);
        connections.block(List.of("192.0.2.9"));
        connections.allow(List.of("192.0.2.1"));
        RelayAdmission admission = new RelayAdmission(connections, new SourceRateLimiter("relay-allocate", 1, clock));

        Assertions.assertEquals(Optional.of(ErrorKind.FORBIDDEN), admission.admitConnection("192.0.2.9"));
        for (int i = 0; i < 5; i++) {
            Assertions.assertEquals(Optional.empty(), admission.admitConnection("192.0.2.1"));
        }
    }

    @Test
    void sweepForgetsIdleSourcesInBothLimiters() {
        MutableClock clock = MutableClock.startingAt(0L);
        RelayAdmission admission = new RelayAdmission(
                new SourceRateLimiter("relay-connect", 30, clock),
                new SourceRateLimiter("relay-allocate", 10, clock)
        );
        admission.admitConnection("198.51.100.4");
        admission.admitAllocation("198.51.100.4");
        clock.advance(Duration.ofMinutes(5));

        Assertions.assertEquals(2, admission.sweepIdle(60_000L));
    }

    @Test
    void unlimitedAdmissionLetsEverythingThrough() {
        RelayAdmission admission = RelayAdmission.unlimited(MutableClock.startingAt(0L));
        for (int i = 0; i < 100; i++) {
            Assertions.assertEquals(Optional.empty(), admission.admitConnection("127.0.0.1"));
            Assertions.assertTrue(admission.admitAllocation("127.0.0.1"));
        }
    }
}
