package io.taskrelay.broker.delivery;

import io.taskrelay.config.impl.DispatchSettings;
import lombok.Getter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Jittered exponential backoff with an attempt ceiling.
 * <p>
 * The nominal delay after attempt {@code n} is {@code min(cap, base * 2^(n-1))}; the actual delay is drawn
 * uniformly from the upper half of it, so concurrent lanes failing together spread out.
 * </p>
 */
public final class RetryPolicy {
    private final long baseMillis;
    private final long capMillis;
    @Getter private final int maxAttempts;
    private final DoubleSupplier jitter;

    public RetryPolicy(final Duration base, final Duration cap, final int maxAttempts) {
        this(base, cap, maxAttempts, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param jitter source of values in {@code [0, 1)}
     */
    public RetryPolicy(final Duration base, final Duration cap, final int maxAttempts, final DoubleSupplier jitter) {
        if (base.isNegative() || base.isZero()) throw new IllegalArgumentException("base must be > 0");
        if (cap.compareTo(base) < 0) throw new IllegalArgumentException("cap must be >= base");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.baseMillis = base.toMillis();
        this.capMillis = cap.toMillis();
        this.maxAttempts = maxAttempts;
        this.jitter = Objects.requireNonNull(jitter, "jitter");
    }

    public static RetryPolicy from(final DispatchSettings settings) {
        return new RetryPolicy(settings.getRetryBase(), settings.getRetryCap(), settings.getMaxAttempts());
    }

    /**
     * @param attempt number of attempts made so far (1-based)
     * @return true if another attempt is allowed
     */
    public boolean shouldRetry(final int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Delay before the attempt following {@code attempt}.
     */
    public Duration delayAfter(final int attempt) {
        if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
        final long nominal = nominalMillis(attempt);
        final long half = nominal / 2;
        final long extra = (long) Math.floor(jitter.getAsDouble() * (nominal - half + 1));
        return Duration.ofMillis(Math.min(nominal, half + extra));
    }

    long nominalMillis(final int attempt) {
        // 2^62 already exceeds any sane cap
        final int shift = Math.min(attempt - 1, 62);
        final long scaled = baseMillis > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : baseMillis << shift;
        return Math.min(capMillis, scaled);
    }
}
