package sten.steganography.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The closed set of supported ciphers. Each constant knows how to build its cipher from a key string
 * and how to filter key entry one edit at a time.
 */
public enum CipherType {

    NONE("", "none", KeyInputSubject.EDITED_TEXT) {
        @Override
        public boolean validate(EditAction action, String data) {
            return false;
        }

        @Override
        public Cipher create(String key) {
            return NoCipher.INSTANCE;
        }
    },

    CAESAR("Caesar-style", "caesar", KeyInputSubject.EDITED_TEXT) {
        @Override
        public boolean validate(EditAction action, String data) {
            return action == EditAction.DELETE || DIGITS.matcher(data).matches();
        }

        @Override
        public Cipher create(String key) throws CipherConstructionException {
            return new CaesarCipher(parseInteger(key).mod(ALPHABET_LENGTH).longValueExact());
        }
    },

    HILL("Matrix", "hill", KeyInputSubject.EDITED_TEXT) {
        @Override
        public boolean validate(EditAction action, String data) {
            return action == EditAction.DELETE || Alphabet.allMembers(data);
        }

        @Override
        public Cipher create(String key) throws CipherConstructionException {
            return new HillCipher(requireKey(key));
        }
    },

    SCYTALE("Transposition", "scytale", KeyInputSubject.PROPOSED_VALUE) {
        @Override
        public boolean validate(EditAction action, String data) {
            return action == EditAction.DELETE || POSITIVE_INTEGER.matcher(data).matches();
        }

        @Override
        public Cipher create(String key) {
            // more columns than characters leaves any text unchanged
            return new ScytaleCipher(parseInteger(key).min(MAX_COLUMNS).intValueExact());
        }
    },

    VIGENERE("Polyalphabetic", "vigenere", KeyInputSubject.EDITED_TEXT) {
        @Override
        public boolean validate(EditAction action, String data) {
            return action == EditAction.DELETE || Alphabet.allMembers(data);
        }

        @Override
        public Cipher create(String key) {
            return new VigenereCipher(requireKey(key));
        }
    };

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");
    private static final Pattern POSITIVE_INTEGER = Pattern.compile("[1-9][0-9]*");
    private static final BigInteger ALPHABET_LENGTH = BigInteger.valueOf(Alphabet.LENGTH);
    private static final BigInteger MAX_COLUMNS = BigInteger.valueOf(Integer.MAX_VALUE);

    private final String displayName;
    private final String alias;
    private final KeyInputSubject inputSubject;

    CipherType(String displayName, String alias, KeyInputSubject inputSubject) {
        this.displayName = displayName;
        this.alias = alias;
        this.inputSubject = inputSubject;
    }

    /**
     * Key entry filter of this variant.
     * @param action Kind of edit.
     * @param data The edited characters, or the proposed key value when {@link #inputSubject()} says so.
     * @return true if the edit is acceptable.
     */
    public abstract boolean validate(EditAction action, String data);

    /**
     * Builds a cipher of this variant.
     * @param key Key as typed by the user.
     * @return the keyed cipher.
     * @throws CipherConstructionException if the key is unusable for this variant.
     * @throws IllegalArgumentException if the key is missing or malformed.
     */
    public abstract Cipher create(String key) throws CipherConstructionException;

    public String displayName() {
        return displayName;
    }

    public String alias() {
        return alias;
    }

    public KeyInputSubject inputSubject() {
        return inputSubject;
    }

    public boolean requiresKey() {
        return this != NONE;
    }

    /**
     * Replays {@code key} as if it were typed one character at a time and runs every insertion through
     * {@link #validate(EditAction, String)}.
     * @param key Complete key.
     * @return true if every keystroke would have been accepted.
     */
    public boolean acceptsKey(String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        for (int i = 0; i < key.length(); i++) {
            String data = inputSubject == KeyInputSubject.PROPOSED_VALUE
                    ? key.substring(0, i + 1)
                    : String.valueOf(key.charAt(i));
            if (!validate(EditAction.INSERT, data)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Looks a cipher up by display name, alias or constant name, ignoring case.
     * A null or empty name selects {@link #NONE}.
     * @throws IllegalArgumentException for an unknown name.
     */
    public static CipherType fromName(String name) {
        if (name == null || name.isBlank()) {
            return NONE;
        }
        String wanted = name.trim();
        for (CipherType type : values()) {
            if (type.displayName.equalsIgnoreCase(wanted)
                    || type.alias.equalsIgnoreCase(wanted)
                    || type.name().equalsIgnoreCase(wanted)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown cipher: " + name + ". Valid ciphers: "
                + Arrays.stream(values()).map(CipherType::alias).collect(Collectors.joining(", ")));
    }

    private static String requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("A key is required for this cipher.");
        }
        return key;
    }

    private static BigInteger parseInteger(String key) {
        String digits = requireKey(key).trim();
        try {
            return new BigInteger(digits);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Key must be an integer, got: " + digits, e);
        }
    }
}
