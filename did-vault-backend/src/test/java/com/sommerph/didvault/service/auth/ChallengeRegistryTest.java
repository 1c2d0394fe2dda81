package com.sommerph.didvault.service.auth;

import com.sommerph.didvault.exception.AuthenticationException;
import com.sommerph.didvault.exception.MalformedIdentityException;
import com.sommerph.didvault.model.auth.Challenge;
import com.sommerph.didvault.repository.challenge.InMemoryChallengeStore;
import com.sommerph.didvault.support.MutableClock;
import com.sommerph.didvault.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChallengeRegistryTest {

    private static final String SUBJECT = TestFixtures.HOLDER_DID;

    private MutableClock clock;
    private InMemoryChallengeStore store;
    private ChallengeRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.START);
        store = new InMemoryChallengeStore();
        registry = new ChallengeRegistry(store, clock, TestFixtures.properties());
    }

    @Test
    void issuesUniqueNonceWithFiveMinuteTtl() {
        Challenge first = registry.issue(SUBJECT);
        Challenge second = registry.issue(SUBJECT);

        assertThat(first.getNonce()).matches("^[0-9a-f]{64}-" + TestFixtures.START.toEpochMilli() + "$");
        assertThat(first.getNonce()).isNotEqualTo(second.getNonce());
        assertThat(first.getExpiresAt()).isEqualTo(TestFixtures.START.plus(Duration.ofMinutes(5)));
        assertThat(first.isConsumed()).isFalse();
    }

    @Test
    void rejectsMalformedSubject() {
        assertThatThrownBy(() -> registry.issue("did:web:example.com")).isInstanceOf(MalformedIdentityException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void consumeIsSingleUse() {
        Challenge challenge = registry.issue(SUBJECT);

        Challenge consumed = registry.consume(SUBJECT, challenge.getNonce());

        assertThat(consumed.isConsumed()).isTrue();
        assertThat(consumed.getNonce()).isEqualTo(challenge.getNonce());
        assertThatThrownBy(() -> registry.consume(SUBJECT, challenge.getNonce()))
                .isInstanceOf(AuthenticationException.class)
                .extracting("reason").isEqualTo(AuthenticationException.Reason.CHALLENGE_NOT_FOUND);
    }

    @Test
    void newChallengeInvalidatesPreviousOne() {
        Challenge first = registry.issue(SUBJECT);
        Challenge second = registry.issue(SUBJECT);

        assertThatThrownBy(() -> registry.consume(SUBJECT, first.getNonce()))
                .isInstanceOf(AuthenticationException.class)
                .extracting("reason").isEqualTo(AuthenticationException.Reason.CHALLENGE_MISMATCH);
        assertThat(registry.consume(SUBJECT, second.getNonce()).isConsumed()).isTrue();
    }

    @Test
    void mismatchLeavesPendingChallengeInPlace() {
        Challenge challenge = registry.issue(SUBJECT);

        assertThatThrownBy(() -> registry.consume(SUBJECT, "wrong"))
                .isInstanceOf(AuthenticationException.class)
                .extracting("reason").isEqualTo(AuthenticationException.Reason.CHALLENGE_MISMATCH);
        assertThat(registry.consume(SUBJECT, challenge.getNonce())).isNotNull();
    }

    @Test
    void expiredChallengeIsRejectedAndDeleted() {
        Challenge challenge = registry.issue(SUBJECT);
        clock.advance(Duration.ofSeconds(301));

        assertThatThrownBy(() -> registry.consume(SUBJECT, challenge.getNonce()))
                .isInstanceOf(AuthenticationException.class)
                .extracting("reason").isEqualTo(AuthenticationException.Reason.CHALLENGE_EXPIRED);
        assertThat(store.get(SUBJECT)).isNull();
    }

    @Test
    void unknownSubjectIsNotFound() {
        assertThatThrownBy(() -> registry.consume(TestFixtures.OTHER_DID, "n"))
                .isInstanceOf(AuthenticationException.class)
                .extracting("reason").isEqualTo(AuthenticationException.Reason.CHALLENGE_NOT_FOUND);
    }

    @Test
    void sweepRemovesExpiredChallenges() {
        registry.issue(SUBJECT);
        clock.advance(Duration.ofMinutes(4));
        registry.issue(TestFixtures.OTHER_DID);
        clock.advance(Duration.ofMinutes(2));

        registry.sweepExpired();

        assertThat(store.get(SUBJECT)).isNull();
        assertThat(store.get(TestFixtures.OTHER_DID)).isNotNull();
    }

    @Test
    void onlyOneConcurrentConsumerWins() throws Exception {
        Challenge challenge = registry.issue(SUBJECT);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            Callable<Boolean> attempt = () -> {
                start.await();
                try {
                    registry.consume(SUBJECT, challenge.getNonce());
                    return true;
                } catch (AuthenticationException e) {
                    return false;
                }
            };
            results.add(pool.submit(attempt));
        }
        start.countDown();

        int winners = 0;
        for (Future<Boolean> result : results) {
            if (result.get()) winners++;
        }
        pool.shutdown();
        assertThat(winners).isEqualTo(1);
    }

}
