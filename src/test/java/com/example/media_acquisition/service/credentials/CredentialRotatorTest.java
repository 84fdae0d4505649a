package com.example.media_acquisition.service.credentials;

import com.example.media_acquisition.exception.PoolExhaustedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CredentialRotatorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));

    @Test
    void fifteenUsesSpreadEvenlyOverThreeCredentials() {
        CredentialRotator rotator = rotator(5, true, "k1", "k2", "k3");

        Map<String, Integer> picks = new HashMap<>();
        for (int i = 0; i < 15; i++) {
            picks.merge(rotator.acquire("api", 1).secret(), 1, Integer::sum);
        }

        assertThat(picks).containsEntry("k1", 5).containsEntry("k2", 5).containsEntry("k3", 5);
        assertThat(rotator.usageSnapshot("api").values()).allMatch(used -> used <= 5);
    }

    @Test
    void saturatedPoolDegradesToLeastUsedCredential() {
        CredentialRotator rotator = rotator(5, true, "k1", "k2", "k3");
        for (int i = 0; i < 15; i++) {
            rotator.acquire("api", 1);
        }
        rotator.recordUsage("api", "k1", 2);

        CredentialLease sixteenth = rotator.acquire("api", 1);

        assertThat(sixteenth.secret()).isIn("k2", "k3");
        assertThat(rotator.usageSnapshot("api")).containsEntry(sixteenth.secret(), 6);
    }

    @Test
    void saturatedPoolFailsWhenDegradationIsDisabled() {
        CredentialRotator rotator = rotator(5, false, "k1", "k2", "k3");
        for (int i = 0; i < 15; i++) {
            rotator.acquire("api", 1);
        }

        assertThrows(PoolExhaustedException.class, () -> rotator.acquire("api", 1));
        assertThat(rotator.usageSnapshot("api").values()).containsOnly(5);
    }

    @Test
    void rejectedCredentialIsSkippedUntilTheWindowRollsOver() {
        CredentialRotator rotator = rotator(100, true, "k1", "k2");

        assertThat(rotator.recordExhausted("api", "k1")).isFalse();
        assertThat(rotator.usageSnapshot("api")).containsEntry("k1", 100);
        for (int i = 0; i < 4; i++) {
            assertThat(rotator.acquire("api", 1).secret()).isEqualTo("k2");
        }

        clock.advance(Duration.ofHours(24));

        assertThat(rotator.usageSnapshot("api")).containsEntry("k1", 0).containsEntry("k2", 0);
        List<String> next = List.of(rotator.acquire("api", 1).secret(), rotator.acquire("api", 1).secret());
        assertThat(next).containsExactlyInAnyOrder("k1", "k2");
    }

    @Test
    void poolIsExhaustedOnceEveryCredentialIsRejected() {
        CredentialRotator rotator = rotator(100, true, "k1", "k2");

        rotator.recordExhausted("api", "k1");
        assertThat(rotator.recordExhausted("api", "k2")).isTrue();

        assertThrows(PoolExhaustedException.class, () -> rotator.acquire("api", 1));
    }

    @Test
    void nextCredentialRotatesWithoutChargingAndSkipsKeysFilledByRecordUsage() {
        CredentialRotator rotator = rotator(2, false, "k1", "k2");

        assertThat(rotator.nextCredential("api")).isEqualTo("k1");
        assertThat(rotator.nextCredential("api")).isEqualTo("k2");
        assertThat(rotator.usageSnapshot("api").values()).allMatch(used -> used == 0);

        rotator.recordUsage("api", "k1", 2);

        assertThat(rotator.nextCredential("api")).isEqualTo("k2");
        assertThat(rotator.nextCredential("api")).isEqualTo("k2");

        rotator.recordUsage("api", "k2", 2);

        assertThrows(PoolExhaustedException.class, () -> rotator.nextCredential("api"));
    }

    @Test
    void emptyOrUnknownPoolIsExhausted() {
        CredentialRotator rotator = rotator(10, true);

        assertThat(rotator.hasCredentials("api")).isFalse();
        assertThrows(PoolExhaustedException.class, () -> rotator.acquire("api", 1));
        assertThrows(PoolExhaustedException.class, () -> rotator.nextCredential("missing"));
    }

    @Test
    void usageResetsAtWindowRollover() {
        CredentialRotator rotator = rotator(3, false, "k1");
        for (int i = 0; i < 3; i++) {
            rotator.acquire("api", 1);
        }
        assertThrows(PoolExhaustedException.class, () -> rotator.acquire("api", 1));

        clock.advance(Duration.ofHours(24).plusSeconds(1));

        assertThat(rotator.acquire("api", 1).secret()).isEqualTo("k1");
        assertThat(rotator.usageSnapshot("api")).containsEntry("k1", 1);
    }

    @Test
    void concurrentSelectionNeverOverchargesACredential() throws Exception {
        CredentialRotator rotator = rotator(50, false, "k1", "k2", "k3", "k4");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(executor.submit(() -> rotator.acquire("api", 1).secret()));
            }
            for (Future<String> f : futures) {
                f.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(rotator.usageSnapshot("api").values()).containsOnly(50);
        assertThrows(PoolExhaustedException.class, () -> rotator.acquire("api", 1));
    }

    private CredentialRotator rotator(int quota, boolean degrade, String... secrets) {
        CredentialPool pool = new CredentialPool("api", List.of(secrets), quota, Duration.ofHours(24), degrade, clock.instant());
        return new CredentialRotator(List.of(pool), clock);
    }
}
