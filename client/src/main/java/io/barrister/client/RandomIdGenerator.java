package io.barrister.client;

import java.util.Random;

import io.barrister.util.Assert;

/**
 * Generates random ids of lowercase letters and digits.
 * <p>
 * Pass a seeded {@link Random} to get a repeatable sequence of ids.
 */
public class RandomIdGenerator implements IdGenerator {

    public static final int DEFAULT_LENGTH = 20;

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final Random random;
    private final int length;

    public RandomIdGenerator() {
        this(new Random());
    }

    public RandomIdGenerator(Random random) {
        this(random, DEFAULT_LENGTH);
    }

    public RandomIdGenerator(Random random, int length) {
        this.random = Assert.checkNotNullParam("random", random);
        if (length <= 0) {
            throw new IllegalArgumentException("Parameter 'length' must be positive");
        }
        this.length = length;
    }

    @Override
    public String nextId() {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
