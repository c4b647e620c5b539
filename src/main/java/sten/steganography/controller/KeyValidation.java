package sten.steganography.controller;

import sten.steganography.crypto.CipherType;
import sten.steganography.view.SteganographyView;

final class KeyValidation {

    private KeyValidation() {
    }

    /**
     * Applies the cipher's key entry filter to a key given on the command line.
     * @return the key to use, null when the cipher takes none.
     */
    static String check(CipherType cipher, String key, SteganographyView view) {
        if (!cipher.requiresKey()) {
            if (key != null && !key.isEmpty()) {
                view.showWarning("No cipher selected, the key is ignored.");
            }
            return null;
        }
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Cipher " + cipher.alias() + " requires a key (-k).");
        }
        if (!cipher.acceptsKey(key)) {
            throw new IllegalArgumentException("Key not accepted by cipher " + cipher.alias() + ": "
                    + describeRule(cipher));
        }
        return key;
    }

    private static String describeRule(CipherType cipher) {
        switch (cipher) {
            case CAESAR:
                return "digits only.";
            case SCYTALE:
                return "a positive integer.";
            default:
                return "printable ASCII characters only.";
        }
    }
}
