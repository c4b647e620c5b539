package sten.steganography.crypto;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class HillCipherTest {

    @Test
    void multipliesKeyMatrixWithTextVectors() throws Exception {
        // [[1, 2], [0, 3]]
        HillCipher cipher = new HillCipher("1203");
        assertThat(cipher.getSize()).isEqualTo(2);
        assertThat(cipher.getDeterminant()).isEqualTo(3);
        assertThat(cipher.encrypt("abcd")).isEqualTo("wxCD");
        assertThat(cipher.decrypt("wxCD")).isEqualTo("abcd");
    }

    @Test
    void padsKeyMatrixWithCounter() throws Exception {
        // "abd" -> [[10, 11], [13, 0]]
        HillCipher cipher = new HillCipher("abd");
        assertThat(cipher.getDeterminant()).isEqualTo(-143);
    }

    @Test
    void padsLastBlockAndDecryptKeepsPadding() throws Exception {
        HillCipher cipher = new HillCipher("abd");
        String ciphertext = cipher.encrypt("abc");
        assertThat(ciphertext).isEqualTo("lukU");
        assertThat(cipher.decrypt(ciphertext)).isEqualTo("abc0");
    }

    @Test
    void roundTripsBlockAlignedTextWithThreeByThreeKey() throws Exception {
        HillCipher cipher = new HillCipher("GYBNQKURP");
        assertThat(cipher.getSize()).isEqualTo(3);
        String text = "Retreat now! Meet at dawn.~";
        assertThat(text.length() % 3).isZero();
        assertThat(cipher.decrypt(cipher.encrypt(text))).isEqualTo(text);
    }

    @Test
    void singleCharacterKeyIsAMultiplicativeCipher() throws Exception {
        HillCipher cipher = new HillCipher("b");
        assertThat(cipher.encrypt("Hi")).isEqualTo(",\u000B");
        assertThat(cipher.decrypt(",\u000B")).isEqualTo("Hi");
    }

    @Test
    void singularKeyIsRejected() {
        assertThatThrownBy(() -> new HillCipher("00"))
                .isInstanceOf(NonInvertibleKeyException.class)
                .hasMessageContaining("not invertible");
    }

    @Test
    void determinantSharingFactorWithAlphabetLengthIsRejected() {
        assertThatThrownBy(() -> new HillCipher("24"))
                .isInstanceOfSatisfying(KeyAlphabetNotCoprimeException.class, e -> {
                    assertThat(e.getDeterminant()).isEqualTo(2);
                    assertThat(e.getKind()).isEqualTo(CipherConstructionException.Kind.KEY_ALPHABET_NOT_COPRIME);
                });
        assertThatThrownBy(() -> new HillCipher("secret")).isInstanceOf(KeyAlphabetNotCoprimeException.class);
    }

    @Test
    void ciphertextLengthIsMultipleOfMatrixSize() throws Exception {
        HillCipher cipher = new HillCipher("GYBNQKURP");
        assertThat(cipher.encrypt("abcd")).hasSize(6);
        assertThat(cipher.encrypt("")).isEmpty();
    }

    @Test
    void determinantAndInverseOfKnownMatrix() {
        double[][] m = {{1, 2, 3}, {0, 1, 4}, {5, 6, 0}};
        assertThat(HillCipher.determinant(m)).isCloseTo(1, offset(1e-9));
        double[][] inverse = HillCipher.inverse(m);
        assertThat(inverse[0][0]).isCloseTo(-24, offset(1e-9));
        assertThat(inverse[0][1]).isCloseTo(18, offset(1e-9));
        assertThat(inverse[1][2]).isCloseTo(-4, offset(1e-9));
        assertThat(inverse[2][2]).isCloseTo(1, offset(1e-9));
    }
}
