package uk.gegc.videobatch.features.batch.application;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import uk.gegc.videobatch.features.batch.config.AdmissionProperties;
import uk.gegc.videobatch.shared.exception.RateLimitExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-owner sliding window over accepted batch submissions.
 *
 * <p>{@link #check(UUID)} and {@link #record(UUID)} are separate so a submission that is
 * rejected later (for example for lack of funds) does not consume a slot. Windows are only
 * touched inside the map's per-key compute, and an owner whose window empties is removed.
 */
@Service
@RequiredArgsConstructor
public class SubmissionRateLimiter {

    private final AdmissionProperties properties;
    private final Clock clock;

    private final Map<UUID, Deque<Instant>> history = new ConcurrentHashMap<>();

    /**
     * @throws RateLimitExceededException when the owner already has the maximum number of
     *                                    accepted submissions inside the trailing window
     */
    public void check(UUID ownerId) {
        Instant now = clock.instant();
        long[] retryAfter = {-1};
        history.computeIfPresent(ownerId, (id, window) -> {
            evictExpired(window, now);
            if (window.size() >= properties.getMaxBatchesPerMinute()) {
                Instant oldest = window.peekFirst();
                retryAfter[0] = Duration.between(now, oldest.plus(properties.getRateWindow())).toSeconds();
            }
            return window.isEmpty() ? null : window;
        });
        if (retryAfter[0] >= 0) {
            throw new RateLimitExceededException("Too many batch submissions", retryAfter[0]);
        }
    }

    public void record(UUID ownerId) {
        Instant now = clock.instant();
        history.compute(ownerId, (id, window) -> {
            Deque<Instant> slots = window == null ? new ArrayDeque<>() : window;
            evictExpired(slots, now);
            slots.addLast(now);
            return slots;
        });
    }

    public int recentSubmissions(UUID ownerId) {
        Instant now = clock.instant();
        Deque<Instant> window = history.computeIfPresent(ownerId, (id, slots) -> {
            evictExpired(slots, now);
            return slots.isEmpty() ? null : slots;
        });
        return window == null ? 0 : window.size();
    }

    /**
     * Drops every owner whose window has emptied out.
     */
    @Scheduled(fixedDelayString = "${admission.rate-window:PT60S}")
    public void evictIdleOwners() {
        Instant now = clock.instant();
        for (UUID ownerId : history.keySet()) {
            history.computeIfPresent(ownerId, (id, slots) -> {
                evictExpired(slots, now);
                return slots.isEmpty() ? null : slots;
            });
        }
    }

    int trackedOwners() {
        return history.size();
    }

    private void evictExpired(Deque<Instant> window, Instant now) {
        Instant cutoff = now.minus(properties.getRateWindow());
        while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
            window.pollFirst();
        }
    }
}
