package sten.steganography.crypto;

import java.math.BigInteger;

/**
 * Hill cipher over the alphabet.
 * <p>
 * The key is laid row by row into the smallest square matrix that holds it. Cells left over after the
 * key characters are filled with a counter 0, 1, 2, ... and the text is split into column vectors that
 * are padded the same way, so a ciphertext is always a multiple of the matrix size long.
 * Decrypting a padded ciphertext gives back the plaintext followed by its padding.
 * <p>
 * The decryption matrix is derived from a floating point inverse rounded to integers, which is exact
 * for the small matrices a typed key produces.
 */
public final class HillCipher extends Cipher {

    private static final BigInteger MODULUS = BigInteger.valueOf(Alphabet.LENGTH);

    private final int size;
    private final long[][] keyMatrix;
    private final long[][] decryptionMatrix;
    private final long determinant;

    public HillCipher(String key) throws CipherConstructionException {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Hill key must not be empty.");
        }
        this.size = (int) Math.ceil(Math.sqrt(key.length()));
        this.keyMatrix = fill(indices(key), size, size, false);

        double[][] real = toDouble(keyMatrix);
        this.determinant = Math.round(determinant(real));
        if (determinant == 0) {
            throw new NonInvertibleKeyException("Key matrix is not invertible.");
        }
        if (BigInteger.valueOf(determinant).gcd(MODULUS).intValue() != 1) {
            throw new KeyAlphabetNotCoprimeException(determinant);
        }

        double[][] inverse = inverse(real);
        long determinantInverse = BigInteger.valueOf(determinant).mod(MODULUS).modInverse(MODULUS).longValue();
        this.decryptionMatrix = new long[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                double adjugate = inverse[i][j] * determinant;
                decryptionMatrix[i][j] = Math.round(adjugate * determinantInverse);
            }
        }
    }

    public int getSize() {
        return size;
    }

    public long getDeterminant() {
        return determinant;
    }

    @Override
    public CipherType type() {
        return CipherType.HILL;
    }

    @Override
    public String encrypt(String plaintext) {
        return apply(keyMatrix, plaintext);
    }

    @Override
    public String decrypt(String ciphertext) {
        return apply(decryptionMatrix, ciphertext);
    }

    private String apply(long[][] matrix, String text) {
        int blocks = (text.length() + size - 1) / size;
        long[][] vectors = fill(indices(text), size, blocks, true);

        StringBuilder result = new StringBuilder(blocks * size);
        for (int block = 0; block < blocks; block++) {
            for (int row = 0; row < size; row++) {
                long sum = 0;
                for (int k = 0; k < size; k++) {
                    sum += matrix[row][k] * vectors[k][block];
                }
                result.append(Alphabet.charAt(sum));
            }
        }
        return result.toString();
    }

    /**
     * Lays {@code values} into a {@code rows x cols} matrix, row by row or column by column, and fills
     * the remaining cells with 0, 1, 2, ...
     */
    static long[][] fill(int[] values, int rows, int cols, boolean columnMajor) {
        long[][] matrix = new long[rows][cols];
        int outer = columnMajor ? cols : rows;
        int inner = columnMajor ? rows : cols;
        int index = 0;
        long extra = 0;
        for (int i = 0; i < outer; i++) {
            for (int j = 0; j < inner; j++) {
                long value = index < values.length ? values[index++] : extra++;
                if (columnMajor) {
                    matrix[j][i] = value;
                } else {
                    matrix[i][j] = value;
                }
            }
        }
        return matrix;
    }

    private static double[][] toDouble(long[][] matrix) {
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = new double[matrix[i].length];
            for (int j = 0; j < matrix[i].length; j++) {
                result[i][j] = matrix[i][j];
            }
        }
        return result;
    }

    static double determinant(double[][] matrix) {
        int n = matrix.length;
        double[][] m = copy(matrix);
        double det = 1;
        for (int col = 0; col < n; col++) {
            int pivot = pivotRow(m, col);
            if (m[pivot][col] == 0) {
                return 0;
            }
            if (pivot != col) {
                swapRows(m, pivot, col);
                det = -det;
            }
            det *= m[col][col];
            for (int row = col + 1; row < n; row++) {
                double factor = m[row][col] / m[col][col];
                for (int c = col; c < n; c++) {
                    m[row][c] -= factor * m[col][c];
                }
            }
        }
        return det;
    }

    // Gauss-Jordan elimination, only called for a non-singular matrix
    static double[][] inverse(double[][] matrix) {
        int n = matrix.length;
        double[][] m = copy(matrix);
        double[][] inv = new double[n][n];
        for (int i = 0; i < n; i++) {
            inv[i][i] = 1;
        }
        for (int col = 0; col < n; col++) {
            int pivot = pivotRow(m, col);
            swapRows(m, pivot, col);
            swapRows(inv, pivot, col);

            double divisor = m[col][col];
            for (int c = 0; c < n; c++) {
                m[col][c] /= divisor;
                inv[col][c] /= divisor;
            }
            for (int row = 0; row < n; row++) {
                if (row == col) {
                    continue;
                }
                double factor = m[row][col];
                for (int c = 0; c < n; c++) {
                    m[row][c] -= factor * m[col][c];
                    inv[row][c] -= factor * inv[col][c];
                }
            }
        }
        return inv;
    }

    private static int pivotRow(double[][] m, int col) {
        int pivot = col;
        for (int row = col + 1; row < m.length; row++) {
            if (Math.abs(m[row][col]) > Math.abs(m[pivot][col])) {
                pivot = row;
            }
        }
        return pivot;
    }

    private static void swapRows(double[][] m, int a, int b) {
        double[] tmp = m[a];
        m[a] = m[b];
        m[b] = tmp;
    }

    private static double[][] copy(double[][] matrix) {
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = matrix[i].clone();
        }
        return result;
    }
}
