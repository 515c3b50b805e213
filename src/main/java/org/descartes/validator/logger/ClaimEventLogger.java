package org.descartes.validator.logger;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

import net.jcip.annotations.ThreadSafe;

/**
 * Audit log of claim, dispute and epoch events.
 *
 * <p>
 * The validator manager publishes one event per mutating call, carrying the same outcome, claim pair and validator pair
 * that were returned to the caller. Downstream indexers rebuild the history of every epoch from this log, so the events
 * are written only after the call committed its state. The default is a no-op implementation.
 * </p>
 *
 * <h2>Search</h2>
 *
 * <p>
 * The search method enables searching for events based on a time range and event types. Implementations forwarding
 * events to third-party software may not support it.
 * </p>
 *
 * @since 1.0
 */
@ThreadSafe
public interface ClaimEventLogger {

    /**
     * Publish a new event.
     *
     * <p>
     * The implementation <b>must</b> be thread-safe, events may be queried from other threads while they are published.
     * </p>
     *
     * @param event The event to publish.
     */
    void logEvent(ClaimEvent event);

    /**
     * Search for events that match the given criteria.
     *
     * @param criteria The search criteria to match events against.
     * @return A stream of events that match the given criteria, in publication order.
     */
    default Stream<ClaimEvent> search(SearchCriteria criteria) {
        return Stream.empty();
    }

    /**
     * Factory method to create a new event.
     *
     * @param eventId Identifies the event.
     * @param type The type of event.
     * @param timestamp The timestamp of the event.
     * @param details Additional details about the event.
     * @return A new instance of {@link ClaimEvent}.
     */
    static ClaimEvent create(String eventId, EventType type, Instant timestamp, Map<String, String> details) {
        return new ClaimEvent(eventId, type, timestamp, details);
    }

    /**
     * Factory method to create a new event with a generated ID.
     *
     * @param type The type of event.
     * @param timestamp The timestamp of the event.
     * @param details Additional details about the event.
     * @return A new instance of {@link ClaimEvent} with a generated ID.
     */
    static ClaimEvent create(EventType type, Instant timestamp, Map<String, String> details) {
        return create(UUID.randomUUID().toString(), type, timestamp, details);
    }

    record ClaimEvent(String eventId, EventType type, Instant timestamp, Map<String, String> details) {
        public ClaimEvent {
            details = details == null ? Map.of() : Map.copyOf(details);
        }
    }

    /**
     * Represents the type of event that can be logged.
     */
    enum EventType {
        CLAIM_RECEIVED,
        DISPUTE_RESOLVED,
        VALIDATOR_REMOVED,
        EPOCH_FINALIZED,
        PHASE_CHANGE,
    }

    /**
     * Null bounds and a null type set match everything.
     */
    record SearchCriteria(Instant start, Instant end, EnumSet<EventType> types) {

        public static SearchCriteria all() {
            return new SearchCriteria(null, null, null);
        }

        public static SearchCriteria of(EventType first, EventType... rest) {
            return new SearchCriteria(null, null, EnumSet.of(first, rest));
        }

        public boolean matches(ClaimEvent event) {
            if (types != null && !types.contains(event.type())) return false;
            if (start != null && event.timestamp().isBefore(start)) return false;
            return end == null || !event.timestamp().isAfter(end);
        }
    }

    static ClaimEventLogger disabled() {
        return new DisabledEventLogger();
    }

    final class DisabledEventLogger implements ClaimEventLogger {

        private DisabledEventLogger() { }

        @Override
        public void logEvent(ClaimEvent event) { }
    }
}
