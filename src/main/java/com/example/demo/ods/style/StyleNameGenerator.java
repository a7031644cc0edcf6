package com.example.demo.ods.style;

import com.example.demo.ods.exception.InternalInvariantException;

/**
 * Generates automatic style names {@code <prefix><n>} from a per-document counter.
 */
public class StyleNameGenerator {

    private final String prefix;
    private int counter;

    public StyleNameGenerator(String prefix) {
        this.prefix = prefix;
    }

    public String next() {
        counter++;
        return prefix + counter;
    }

    /**
     * Undoes the last {@link #next()} after its name turned out to be unneeded.
     */
    public void rollback() {
        if (counter == 0) {
            throw new InternalInvariantException("Style name counter rolled back below zero");
        }
        counter--;
    }

    /**
     * Moves the counter past an existing generated name so it is never handed out twice.
     */
    public void reserve(String existingName) {
        if (existingName == null || !existingName.startsWith(prefix)) {
            return;
        }
        String suffix = existingName.substring(prefix.length());
        // names longer than nine digits can never be generated
        if (suffix.isEmpty() || suffix.length() > 9 || !suffix.chars().allMatch(Character::isDigit)) {
            return;
        }
        counter = Math.max(counter, Integer.parseInt(suffix));
    }

    public int counter() {
        return counter;
    }
}
