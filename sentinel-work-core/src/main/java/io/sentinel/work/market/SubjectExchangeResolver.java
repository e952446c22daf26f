package io.sentinel.work.market;

import java.util.Map;
import java.util.Optional;

/**
 * Maps a work item subject (e.g. an ISIN) to the code of the exchange it trades on.
 */
@FunctionalInterface
public interface SubjectExchangeResolver {

    Optional<String> exchangeFor(String subjectKey);

    static SubjectExchangeResolver fromMap(Map<String, String> subjectExchanges) {
        Map<String, String> copy = Map.copyOf(subjectExchanges);
        return subject -> Optional.ofNullable(copy.get(subject));
    }
}
