package com.electionlens.boothrecon.service.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Utility for repairing letter/digit confusions in numeric words of noisy OCR output.
 *
 * <p>Rules:
 * <ul>
 *   <li>Lines are split into words on whitespace and the column separators {@code | , ;}</li>
 *   <li>A word is repaired only if every character is a digit or a substitutable letter and it
 *       contains at least one digit, or it is a single substitutable letter</li>
 *   <li>The fixed table is applied left to right in one pass; a replaced character is never
 *       looked up again</li>
 * </ul>
 * Words like "Booth" or a suffixed booth number like "12A" are left untouched.
 */
public final class OcrSubstitution {

    /** Fixed substitution table: O/o→0, I/l→1, S/s→5, B→8. */
    static final Map<Character, Character> TABLE = Map.of(
            'O', '0',
            'o', '0',
            'I', '1',
            'l', '1',
            'S', '5',
            's', '5',
            'B', '8'
    );

    private static final String WORD_SEPARATORS = "[\\s|,;]+";

    private OcrSubstitution() {
        // Prevent instantiation
    }

    /**
     * Splits a line into words and repairs numeric ones.
     *
     * @param line raw line (may be null or blank)
     * @return immutable list of words, repaired where eligible
     */
    public static List<String> normalizedWords(String line) {
        if (line == null || line.isBlank()) {
            return List.of();
        }
        List<String> words = new ArrayList<>();
        for (String word : line.trim().split(WORD_SEPARATORS)) {
            if (!word.isEmpty()) {
                words.add(normalizeWord(word));
            }
        }
        return List.copyOf(words);
    }

    /**
     * Repairs a single word if it is eligible, otherwise returns it unchanged.
     */
    static String normalizeWord(String word) {
        if (!isEligible(word)) {
            return word;
        }
        StringBuilder sb = new StringBuilder(word.length());
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            Character replacement = TABLE.get(c);
            sb.append(replacement == null ? c : replacement);
        }
        return sb.toString();
    }

    private static boolean isEligible(String word) {
        if (word.length() == 1) {
            return TABLE.containsKey(word.charAt(0));
        }
        boolean hasDigit = false;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c >= '0' && c <= '9') {
                hasDigit = true;
            } else if (!TABLE.containsKey(c)) {
                return false;
            }
        }
        return hasDigit;
    }
}
