package de.bycsitsm.meetingcost.cost;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves the hourly rate of an attendee.
 */
public interface RateResolver {

    /**
     * Returns the hourly rate of the attendee with the given address.
     */
    double hourlyRate(String address);

    /**
     * Opens a lookup that memoizes rates for the duration of one member pass.
     */
    default RateLookup newLookup() {
        return new RateLookup(this, RateLookup.DEFAULT_CAPACITY);
    }

    /**
     * Request-scoped rate cache. It is created per member pass and passed down explicitly,
     * so member passes never share state. Once full, the least recently used entry is evicted.
     */
    final class RateLookup {

        static final int DEFAULT_CAPACITY = 256;

        private final RateResolver resolver;
        private final Map<String, Double> rates;

        RateLookup(RateResolver resolver, int capacity) {
            this.resolver = resolver;
            this.rates = new LinkedHashMap<>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Double> eldest) {
                    return size() > capacity;
                }
            };
        }

        public double rate(String address) {
            return rates.computeIfAbsent(address.toLowerCase(Locale.ROOT), resolver::hourlyRate);
        }

        int size() {
            return rates.size();
        }
    }
}
