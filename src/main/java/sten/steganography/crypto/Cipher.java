package sten.steganography.crypto;

/**
 * A classical text cipher bound to a key. Instances are immutable; re-keying means building a new one
 * through {@link CipherType#create(String)}.
 * <p>
 * Both directions require every character of the text to be an {@link Alphabet} member.
 */
public abstract class Cipher {

    /**
     * @return the variant this cipher belongs to.
     */
    public abstract CipherType type();

    /**
     * Decides whether a single edit of a key being typed for this variant is acceptable.
     * @param action Kind of edit.
     * @param data Edited characters or proposed key value, see {@link CipherType#inputSubject()}.
     * @return true if the edit leaves a valid key state.
     */
    public boolean validate(EditAction action, String data) {
        return type().validate(action, data);
    }

    /**
     * @param plaintext Text made of alphabet members.
     * @return the ciphertext.
     */
    public abstract String encrypt(String plaintext);

    /**
     * @param ciphertext Text made of alphabet members.
     * @return the plaintext.
     */
    public abstract String decrypt(String ciphertext);

    static int[] indices(String text) {
        int[] result = new int[text.length()];
        for (int i = 0; i < result.length; i++) {
            result[i] = Alphabet.indexOf(text.charAt(i));
        }
        return result;
    }

    static void requireMembers(String text) {
        Alphabet.firstForeign(text).ifPresent(c -> {
            throw new IllegalArgumentException(String.format("Character not in alphabet: U+%04X", (int) c));
        });
    }

    @Override
    public String toString() {
        return type().displayName().isEmpty() ? "no cipher" : type().displayName() + " cipher";
    }
}
