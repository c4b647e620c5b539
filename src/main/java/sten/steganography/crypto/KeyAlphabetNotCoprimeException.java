package sten.steganography.crypto;

public class KeyAlphabetNotCoprimeException extends CipherConstructionException {

    private final long determinant;

    public KeyAlphabetNotCoprimeException(long determinant) {
        super(Kind.KEY_ALPHABET_NOT_COPRIME,
                "Key determinant (" + determinant + ") and alphabet length (" + Alphabet.LENGTH + ") are not co-prime.");
        this.determinant = determinant;
    }

    public long getDeterminant() {
        return determinant;
    }
}
