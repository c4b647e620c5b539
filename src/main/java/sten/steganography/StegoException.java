package sten.steganography;

/**
 * Base class for the recoverable failures of the cipher suite and the LSB codec.
 */
public class StegoException extends Exception {

    public StegoException(String message) {
        super(message);
    }

    public StegoException(String message, Throwable cause) {
        super(message, cause);
    }
}
