package sten.steganography.crypto;

/**
 * Additive shift over the alphabet.
 */
public final class CaesarCipher extends Cipher {

    private final int shift;

    /**
     * @param shift Any shift, kept reduced modulo the alphabet length.
     * @throws DegenerateKeyException if the reduced shift is 0.
     */
    public CaesarCipher(long shift) throws DegenerateKeyException {
        this.shift = (int) Math.floorMod(shift, (long) Alphabet.LENGTH);
        if (this.shift == 0) {
            throw new DegenerateKeyException("Key error. Shift value is equal to 0.");
        }
    }

    /**
     * @return the shift in {@code [1, Alphabet.LENGTH)}.
     */
    public int getShift() {
        return shift;
    }

    @Override
    public CipherType type() {
        return CipherType.CAESAR;
    }

    @Override
    public String encrypt(String plaintext) {
        return shift(plaintext, shift);
    }

    @Override
    public String decrypt(String ciphertext) {
        return shift(ciphertext, Alphabet.LENGTH - shift);
    }

    private static String shift(String text, int by) {
        StringBuilder result = new StringBuilder(text.length());
        for (int index : indices(text)) {
            result.append(Alphabet.charAt(index + by));
        }
        return result.toString();
    }
}
