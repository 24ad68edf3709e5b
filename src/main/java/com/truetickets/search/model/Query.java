package com.truetickets.search.model;

/**
 * One snapshot of the operator's input. A new instance is created per keystroke.
 *
 * @param raw     the text exactly as typed
 * @param trimmed the text without surrounding whitespace
 * @param digits  every decimal digit of the text, in order
 */
public record Query(String raw, String trimmed, String digits) {

    public static Query of(String raw) {
        String text = raw == null ? "" : raw;
        return new Query(text, text.trim(), text.replaceAll("\\D", ""));
    }

    public boolean isEmpty() {
        return trimmed.isEmpty();
    }

    public boolean containsLetter() {
        return trimmed.codePoints().anyMatch(Character::isLetter);
    }

    public boolean isNumeric() {
        return !trimmed.isEmpty() && trimmed.chars().allMatch(c -> c >= '0' && c <= '9');
    }
}
