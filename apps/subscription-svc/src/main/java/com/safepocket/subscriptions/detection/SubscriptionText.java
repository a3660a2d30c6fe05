package com.safepocket.subscriptions.detection;

import java.util.Locale;

/**
 * Text reductions shared by transaction matching and email correlation.
 */
public final class SubscriptionText {

    private SubscriptionText() {
    }

    /**
     * Lower-cased letters and numerics only, so "Spotify ABO" and "SPOTIFY-abo" share a key.
     * Numerics include letter numbers and other numbers such as "½" and "²".
     */
    public static String normalizeDescription(String description) {
        if (description == null) {
            return "";
        }
        StringBuilder key = new StringBuilder(description.length());
        description.codePoints()
                .filter(SubscriptionText::isKeyCharacter)
                .map(Character::toLowerCase)
                .forEach(key::appendCodePoint);
        return key.toString();
    }

    private static boolean isKeyCharacter(int codePoint) {
        if (Character.isLetter(codePoint) || Character.isDigit(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.OTHER_NUMBER || type == Character.LETTER_NUMBER;
    }

    /**
     * First alphabetic word, capitalised. Falls back to the title-cased trimmed input when the text
     * has no letters at all.
     */
    public static String deriveProviderName(String reference) {
        if (reference == null) {
            return "";
        }
        StringBuilder cleaned = new StringBuilder(reference.length());
        reference.codePoints()
                .map(cp -> Character.isLetter(cp) ? cp : ' ')
                .forEach(cleaned::appendCodePoint);
        for (String token : cleaned.toString().trim().split(" +")) {
            if (!token.isEmpty()) {
                return capitalize(token);
            }
        }
        return titleCase(reference.trim());
    }

    static String capitalize(String token) {
        int first = token.codePointAt(0);
        int firstLength = Character.charCount(first);
        return new StringBuilder()
                .appendCodePoint(Character.toTitleCase(first))
                .append(token.substring(firstLength).toLowerCase(Locale.ROOT))
                .toString();
    }

    static String titleCase(String text) {
        StringBuilder result = new StringBuilder(text.length());
        boolean startOfWord = true;
        int index = 0;
        while (index < text.length()) {
            int cp = text.codePointAt(index);
            if (Character.isLetter(cp)) {
                result.appendCodePoint(startOfWord ? Character.toTitleCase(cp) : Character.toLowerCase(cp));
                startOfWord = false;
            } else {
                result.appendCodePoint(cp);
                startOfWord = true;
            }
            index += Character.charCount(cp);
        }
        return result.toString();
    }
}
