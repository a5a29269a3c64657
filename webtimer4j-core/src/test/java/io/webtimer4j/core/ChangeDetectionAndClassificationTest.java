package io.webtimer4j.core;

import io.webtimer4j.utils.ContentHasher;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeDetectionAndClassificationTest {

    private final ChangeDetector detector = new ChangeDetector(new ContentHasher(1024));
    private final NotificationClassifier classifier = new NotificationClassifier();
    private final JobRuntimeState state = new JobRuntimeState("job");

    @Test
    void classificationShouldFollowFiringHistory() {
        assertEquals(NotificationType.FIRST_SUCCESS, fire(ok("A")));
        assertEquals(NotificationType.SUCCESS_NO_CHANGE, fire(ok("A")));
        assertEquals(NotificationType.RESPONSE_CHANGED, fire(ok("B")));
        assertEquals(NotificationType.FAILURE, fire(failed(500)));
        assertEquals(NotificationType.FAILURE, fire(failed(500)));
        assertEquals(NotificationType.RECOVERY, fire(ok("C")));
        assertEquals(NotificationType.SUCCESS_NO_CHANGE, fire(ok("C")));
    }

    @Test
    void firstSuccessShouldReportChangedWithoutPreviousHash() {
        ChangeResult change = detector.detect(ok("hello"), state);

        assertTrue(change.changed());
        assertTrue(change.firstSuccess());
        assertNull(change.previousHash());
        assertEquals(change.currentHash(), state.lastHash());
    }

    @Test
    void failureShouldNotOverwriteLastSuccessfulHash() {
        detector.detect(ok("A"), state);
        String hashOfA = state.lastHash();

        ChangeResult onFailure = detector.detect(failed(502), state);
        assertFalse(onFailure.changed());
        assertNull(onFailure.currentHash());
        assertEquals(hashOfA, state.lastHash());

        ChangeResult afterRecovery = detector.detect(ok("A"), state);
        assertFalse(afterRecovery.changed());
        assertEquals(hashOfA, afterRecovery.previousHash());
    }

    @Test
    void hashShouldOnlyCoverConfiguredPrefix() {
        ContentHasher hasher = new ContentHasher(4);
        assertEquals(hasher.hash(bytes("abcdXXXX")), hasher.hash(bytes("abcdYYYY")));
        assertNotEquals(hasher.hash(bytes("abceXXXX")), hasher.hash(bytes("abcdXXXX")));
        assertEquals(64, hasher.hash(null).length());
    }

    @Test
    void failureShouldOutrankEveryOtherOutcome() {
        ChangeResult anyChange = new ChangeResult(true, null, "h");
        assertEquals(NotificationType.FAILURE, classifier.classify(failed(404), anyChange, true));
        assertEquals(NotificationType.RECOVERY, classifier.classify(ok("x"), anyChange, true));
    }

    @Test
    void emissionGateShouldHonorFlagsAndSuppression() {
        NotificationSettings onlyFailures = new NotificationSettings(true, "localhost", 12345, Duration.ZERO,
                false, true, false, 1024, true);

        assertFalse(classifier.shouldEmit(NotificationType.SUCCESS_NO_CHANGE, onlyFailures, false, null, null));
        assertFalse(classifier.shouldEmit(NotificationType.RESPONSE_CHANGED, onlyFailures, false, null, null));
        assertTrue(classifier.shouldEmit(NotificationType.FAILURE, onlyFailures, false, null, "HTTP 500"));
        assertFalse(classifier.shouldEmit(NotificationType.FAILURE, onlyFailures, true, "HTTP 500", "HTTP 500"));
        assertTrue(classifier.shouldEmit(NotificationType.FAILURE, onlyFailures, true, "HTTP 500", "HTTP 503"));
        assertFalse(classifier.shouldEmit(NotificationType.FAILURE, NotificationSettings.disabled(), false, null, "x"));
    }

    private NotificationType fire(AttemptResult result) {
        boolean wasFailing = state.consecutiveFailure();
        ChangeResult change = detector.detect(result, state);
        NotificationType type = classifier.classify(result, change, wasFailing);
        state.recordOutcome(type, result.error());
        return type;
    }

    private static AttemptResult ok(String body) {
        AttemptContext ctx = new AttemptContext("r", 1, Duration.ofSeconds(1));
        return AttemptResult.success(ctx, "job", Instant.now(), 200, Duration.ofMillis(10), bytes(body), false);
    }

    private static AttemptResult failed(int status) {
        AttemptContext ctx = new AttemptContext("r", 1, Duration.ofSeconds(1));
        return AttemptResult.statusFailure(ctx, "job", Instant.now(), status, Duration.ofMillis(10),
                "HTTP " + status, null, false);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
