package sten.steganography.crypto;

import java.util.Optional;

/**
 * The printable ASCII characters every cipher works over, in a fixed order.
 * All cipher arithmetic is done modulo {@link #LENGTH}.
 */
public final class Alphabet {

    public static final String CHARACTERS =
            "0123456789"
            + "abcdefghijklmnopqrstuvwxyz"
            + "ABCDEFGHIJKLMNOPQRSTUVWXYZ"
            + "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~"
            + " \t\n\r\u000B\f";

    public static final int LENGTH = CHARACTERS.length();

    private Alphabet() {
    }

    public static boolean contains(char c) {
        return CHARACTERS.indexOf(c) >= 0;
    }

    /**
     * @return the position of {@code c} in the alphabet.
     * @throws IllegalArgumentException if {@code c} is not a member.
     */
    public static int indexOf(char c) {
        int index = CHARACTERS.indexOf(c);
        if (index < 0) {
            throw new IllegalArgumentException(String.format("Character not in alphabet: U+%04X", (int) c));
        }
        return index;
    }

    /**
     * @return the character at {@code index} reduced modulo the alphabet length.
     */
    public static char charAt(long index) {
        return CHARACTERS.charAt((int) Math.floorMod(index, (long) LENGTH));
    }

    /**
     * Finds the first character of {@code text} that is not part of the alphabet.
     * @param text Text to check.
     * @return the offending character, or empty if all characters are members.
     */
    public static Optional<Character> firstForeign(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!contains(c)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    static boolean allMembers(String text) {
        return !text.isEmpty() && firstForeign(text).isEmpty();
    }
}
