package dev.pekelund.shelfscan.receipts.extraction;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates opaque product ids of the form {@code prod_<epochMillis>_<random>}.
 */
public class ProductIdGenerator {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 9;

    private final Clock clock;

    public ProductIdGenerator() {
        this(Clock.systemUTC());
    }

    public ProductIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String nextId() {
        StringBuilder builder = new StringBuilder("prod_").append(clock.millis()).append('_');
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            builder.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return builder.toString();
    }
}
