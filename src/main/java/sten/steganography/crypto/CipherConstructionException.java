package sten.steganography.crypto;

import sten.steganography.StegoException;

/**
 * Raised when a cipher cannot be built from the given key. The caller has to ask for another key.
 */
public abstract class CipherConstructionException extends StegoException {

    public enum Kind {
        DEGENERATE_KEY,
        NON_INVERTIBLE_KEY,
        KEY_ALPHABET_NOT_COPRIME
    }

    private final Kind kind;

    protected CipherConstructionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
