package sten.steganography.crypto;

/**
 * Columnar transposition. The text is written row by row into {@code columns} columns and read back
 * column by column. When the length is not a multiple of the column count the last row is short, so
 * the first {@code length % columns} columns are one character longer than the rest.
 */
public final class ScytaleCipher extends Cipher {

    private final int columns;

    public ScytaleCipher(int columns) {
        if (columns < 1) {
            throw new IllegalArgumentException("Scytale key must be a positive integer, got " + columns);
        }
        this.columns = columns;
    }

    public int getColumns() {
        return columns;
    }

    @Override
    public CipherType type() {
        return CipherType.SCYTALE;
    }

    @Override
    public String encrypt(String plaintext) {
        requireMembers(plaintext);
        StringBuilder result = new StringBuilder(plaintext.length());
        for (int column = 0; column < Math.min(columns, plaintext.length()); column++) {
            for (int i = column; i < plaintext.length(); i += columns) {
                result.append(plaintext.charAt(i));
            }
        }
        return result.toString();
    }

    @Override
    public String decrypt(String ciphertext) {
        requireMembers(ciphertext);
        int length = ciphertext.length();
        int fullRows = length / columns;
        int longColumns = length % columns;

        char[] plain = new char[length];
        int cursor = 0;
        for (int column = 0; column < Math.min(columns, length); column++) {
            int rows = fullRows + (column < longColumns ? 1 : 0);
            for (int row = 0; row < rows; row++) {
                plain[row * columns + column] = ciphertext.charAt(cursor++);
            }
        }
        return new String(plain);
    }
}
