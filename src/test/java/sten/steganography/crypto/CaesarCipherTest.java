package sten.steganography.crypto;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaesarCipherTest {

    @Test
    void shiftsWithinTheAlphabet() throws Exception {
        assertThat(new CaesarCipher(3).encrypt("Hello")).isEqualTo("Khoor");
        assertThat(new CaesarCipher(5).encrypt("abc xyz")).isEqualTo("fgh\fCDE");
    }

    @Test
    void decryptUndoesEncrypt() throws Exception {
        CaesarCipher cipher = new CaesarCipher(5);
        String text = "The quick brown fox jumps over the lazy dog!\t~";
        assertThat(cipher.decrypt(cipher.encrypt(text))).isEqualTo(text);
    }

    @Test
    void negativeAndLargeShiftsAreReducedModuloAlphabetLength() throws Exception {
        assertThat(new CaesarCipher(-93).encrypt("message")).isEqualTo(new CaesarCipher(7).encrypt("message"));
        assertThat(new CaesarCipher(1007).encrypt("message")).isEqualTo(new CaesarCipher(7).encrypt("message"));
    }

    @Test
    void extremeShiftsRoundTrip() throws Exception {
        for (long shift : new long[]{Long.MAX_VALUE, Long.MIN_VALUE, Long.MIN_VALUE + 1}) {
            CaesarCipher cipher = new CaesarCipher(shift);
            assertThat(cipher.getShift()).isEqualTo((int) Math.floorMod(shift, 100L));
            assertThat(cipher.decrypt(cipher.encrypt("attack at dawn"))).isEqualTo("attack at dawn");
        }
    }

    @Test
    void keysBeyondLongRangeAreReducedBeforeUse() throws Exception {
        // 9223372036854775807 = 7 (mod 100)
        Cipher maxLong = CipherType.CAESAR.create("9223372036854775807");
        assertThat(maxLong.encrypt("attack")).isEqualTo("hAAhjr");
        assertThat(maxLong.decrypt("hAAhjr")).isEqualTo("attack");

        String twentyDigits = "12345678901234567890";
        assertThat(CipherType.CAESAR.acceptsKey(twentyDigits)).isTrue();
        Cipher huge = CipherType.CAESAR.create(twentyDigits);
        assertThat(((CaesarCipher) huge).getShift()).isEqualTo(90);
        assertThat(huge.decrypt(huge.encrypt("attack"))).isEqualTo("attack");
    }

    @Test
    void hugeMultipleOfAlphabetLengthIsDegenerate() {
        assertThatThrownBy(() -> CipherType.CAESAR.create("100000000000000000000000"))
                .isInstanceOf(DegenerateKeyException.class);
    }

    @ParameterizedTest
    @ValueSource(longs = {0, 100, -200, 1_000_000})
    void zeroShiftIsRejected(long shift) {
        assertThatThrownBy(() -> new CaesarCipher(shift))
                .isInstanceOf(DegenerateKeyException.class)
                .satisfies(e -> assertThat(((CipherConstructionException) e).getKind())
                        .isEqualTo(CipherConstructionException.Kind.DEGENERATE_KEY));
    }

    @Test
    void keyEntryAcceptsDigitsOnly() throws Exception {
        Cipher cipher = new CaesarCipher(1);
        assertThat(cipher.validate(EditAction.INSERT, "7")).isTrue();
        assertThat(cipher.validate(EditAction.INSERT, "42")).isTrue();
        assertThat(cipher.validate(EditAction.INSERT, "x")).isFalse();
        assertThat(cipher.validate(EditAction.INSERT, "-")).isFalse();
        assertThat(cipher.validate(EditAction.DELETE, "x")).isTrue();
    }
}
