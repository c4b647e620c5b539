package sten.steganography.crypto;

/**
 * Leaves the text as it is. Takes no key.
 */
final class NoCipher extends Cipher {

    static final NoCipher INSTANCE = new NoCipher();

    private NoCipher() {
    }

    @Override
    public CipherType type() {
        return CipherType.NONE;
    }

    @Override
    public String encrypt(String plaintext) {
        return plaintext;
    }

    @Override
    public String decrypt(String ciphertext) {
        return ciphertext;
    }
}
