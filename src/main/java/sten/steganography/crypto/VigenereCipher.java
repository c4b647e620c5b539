package sten.steganography.crypto;

/**
 * Polyalphabetic substitution: the key is repeated over the text and each key character's
 * alphabet index is added (encrypt) or subtracted (decrypt) position by position.
 */
public final class VigenereCipher extends Cipher {

    private final String key;
    private final int[] keyIndices;

    public VigenereCipher(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Vigenere key must not be empty.");
        }
        this.key = key;
        this.keyIndices = indices(key);
    }

    public String getKey() {
        return key;
    }

    @Override
    public CipherType type() {
        return CipherType.VIGENERE;
    }

    @Override
    public String encrypt(String plaintext) {
        return apply(plaintext, 1);
    }

    @Override
    public String decrypt(String ciphertext) {
        return apply(ciphertext, -1);
    }

    private String apply(String text, int sign) {
        int[] textIndices = indices(text);
        StringBuilder result = new StringBuilder(textIndices.length);
        for (int i = 0; i < textIndices.length; i++) {
            result.append(Alphabet.charAt(textIndices[i] + (long) sign * keyIndices[i % keyIndices.length]));
        }
        return result.toString();
    }
}
