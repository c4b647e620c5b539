package sten.steganography.crypto;

public class NonInvertibleKeyException extends CipherConstructionException {

    public NonInvertibleKeyException(String message) {
        super(Kind.NON_INVERTIBLE_KEY, message);
    }
}
