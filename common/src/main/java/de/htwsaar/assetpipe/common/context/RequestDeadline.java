package de.htwsaar.assetpipe.common.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Kooperatives Abbruchsignal für einen einzelnen Request.
 *
 * <p>Handler können {@link #isDone()} prüfen und ihre Arbeit vorzeitig beenden.
 * Ein erzwungener Abbruch findet nicht statt.</p>
 */
public final class RequestDeadline {

    private final Clock clock;
    private final Instant deadline;
    private volatile boolean cancelled;

    private RequestDeadline(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /**
     * Erzeugt eine Deadline relativ zum aktuellen Zeitpunkt der Uhr.
     *
     * @param clock   Zeitquelle
     * @param timeout Dauer bis zum Ablauf
     * @return neue Deadline
     */
    public static RequestDeadline after(Clock clock, Duration timeout) {
        Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        return new RequestDeadline(clock, clock.instant().plus(timeout));
    }

    public Instant deadline() {
        return deadline;
    }

    /**
     * Verbleibende Zeit bis zum Ablauf, nie negativ.
     *
     * @return Restdauer
     */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** Markiert den Request als abgebrochen (z. B. nach einem Timeout). */
    public void cancel() {
        cancelled = true;
    }

    /**
     * @return {@code true}, wenn der Request abgebrochen wurde oder die Deadline erreicht ist
     */
    public boolean isDone() {
        return cancelled || isExpired();
    }
}
