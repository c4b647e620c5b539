package sten.steganography.crypto;

public class DegenerateKeyException extends CipherConstructionException {

    public DegenerateKeyException(String message) {
        super(Kind.DEGENERATE_KEY, message);
    }
}
