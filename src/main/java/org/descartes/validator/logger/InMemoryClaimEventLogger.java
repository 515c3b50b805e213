package org.descartes.validator.logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

import net.jcip.annotations.ThreadSafe;

/**
 * Keeps every published event in memory, in publication order.
 *
 * @since 1.0
 */
@ThreadSafe
public final class InMemoryClaimEventLogger implements ClaimEventLogger {

    private final List<ClaimEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void logEvent(ClaimEvent event) {
        events.add(event);
    }

    @Override
    public Stream<ClaimEvent> search(SearchCriteria criteria) {
        return events.stream().filter(criteria::matches);
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
