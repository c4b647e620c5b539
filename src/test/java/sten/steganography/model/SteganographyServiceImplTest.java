package sten.steganography.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import sten.steganography.StegoException;
import sten.steganography.codec.BandDepthPlan;
import sten.steganography.codec.CapacityExceededException;
import sten.steganography.codec.LsbCodec;
import sten.steganography.crypto.CipherType;
import sten.steganography.crypto.DegenerateKeyException;

import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SteganographyServiceImplTest {

    private static final String MESSAGE = "Meet me at the usual place at 10 o'clock!";

    @TempDir
    Path tempDir;

    private final SteganographyService service = new SteganographyServiceImpl();

    private Path cover;

    @BeforeEach
    void setUp() throws Exception {
        cover = TestImages.writeCover(tempDir, "cover.png", 40, 30, 3);
    }

    @ParameterizedTest
    @CsvSource({
            "NONE, ''",
            "CAESAR, 17",
            "HILL, 1203",
            "SCYTALE, 4",
            "VIGENERE, lemon"
    })
    void hidesAndExtractsWithEveryCipher(CipherType cipher, String key) throws Exception {
        StegoOptions options = new StegoOptions(cipher, key, "seed", BandDepthPlan.of(1, 2, 1));
        Path output = tempDir.resolve("stego-" + cipher + ".png");

        HideResult result = service.hideMessage(cover, MESSAGE, output, options);
        Optional<String> extracted = service.extractMessage(output, options);

        assertThat(result.truncated()).isFalse();
        assertThat(result.hiddenCharacters()).isEqualTo(MESSAGE.length());
        // 41 characters, padded by the 2x2 Hill key to 42
        String expected = cipher == CipherType.HILL ? MESSAGE + "0" : MESSAGE;
        assertThat(extracted).contains(expected);
    }

    @Test
    void extractsWithBruteForce() throws Exception {
        Path output = tempDir.resolve("stego.png");
        service.hideMessage(cover, MESSAGE, output,
                new StegoOptions(CipherType.VIGENERE, "key", "", BandDepthPlan.of(0, 4, 3)));

        StegoOptions bruteForce = new StegoOptions(CipherType.VIGENERE, "key", "", BandDepthPlan.of(1, 1, 1),
                true, false, false);

        assertThat(service.extractMessage(output, bruteForce)).contains(MESSAGE);
    }

    @Test
    void plainExtractionWithWrongPlanFindsNothing() throws Exception {
        Path output = tempDir.resolve("stego.png");
        service.hideMessage(cover, MESSAGE, output, new StegoOptions(CipherType.NONE, null, "", BandDepthPlan.of(3, 0, 0)));

        assertThat(service.extractMessage(output, new StegoOptions(CipherType.NONE, null, "", BandDepthPlan.of(1, 1, 1))))
                .isEmpty();
    }

    @Test
    void hidesIntoBmp() throws Exception {
        Path bmpCover = TestImages.writeCover(tempDir, "cover.bmp", 20, 20, 3);
        Path output = tempDir.resolve("stego.bmp");
        StegoOptions options = new StegoOptions(CipherType.CAESAR, "3", "", BandDepthPlan.of(1, 1, 1));

        service.hideMessage(bmpCover, "bitmap", output, options);

        assertThat(service.extractMessage(output, options)).contains("bitmap");
    }

    @Test
    void hidesIntoAlphaChannel() throws Exception {
        Path rgbaCover = TestImages.writeCover(tempDir, "rgba.png", 20, 20, 4);
        Path output = tempDir.resolve("stego-rgba.png");
        StegoOptions options = new StegoOptions(CipherType.NONE, null, "alpha", BandDepthPlan.of(0, 0, 0, 3));

        service.hideMessage(rgbaCover, "transparent", output, options);

        assertThat(service.extractMessage(output, options)).contains("transparent");
    }

    @Test
    void tooLongMessageFailsUnlessTruncated() throws Exception {
        Path small = TestImages.writeCover(tempDir, "small.png", 12, 12, 3);
        BandDepthPlan plan = BandDepthPlan.of(1, 1, 1);
        int capacity = LsbCodec.capacity(144, plan);
        String message = "z".repeat(capacity + 10);
        Path output = tempDir.resolve("out.png");

        assertThatThrownBy(() -> service.hideMessage(small, message, output,
                new StegoOptions(CipherType.NONE, null, "", plan)))
                .isInstanceOf(CapacityExceededException.class);

        HideResult result = service.hideMessage(small, message, output,
                new StegoOptions(CipherType.NONE, null, "", plan, false, true, false));

        assertThat(result.truncated()).isTrue();
        assertThat(result.hiddenCharacters()).isEqualTo(capacity);
        assertThat(service.extractMessage(output, new StegoOptions(CipherType.NONE, null, "", plan)))
                .contains("z".repeat(capacity));
    }

    @Test
    void paddedHillCiphertextCanExceedCapacity() throws Exception {
        Path small = TestImages.writeCover(tempDir, "small.png", 12, 12, 3);
        BandDepthPlan plan = BandDepthPlan.of(1, 1, 1);
        // capacity is 37 characters, a 3x3 key pads 37 to 39
        String message = "a".repeat(LsbCodec.capacity(144, plan));

        assertThatThrownBy(() -> service.hideMessage(small, message, tempDir.resolve("out.png"),
                new StegoOptions(CipherType.HILL, "GYBNQKURP", "", plan)))
                .isInstanceOf(CapacityExceededException.class);
    }

    @Test
    void refusesMessageContainingDelimiterUnlessForced() throws Exception {
        String message = "before" + LsbCodec.DELIMITER + "after";
        Path output = tempDir.resolve("out.png");
        BandDepthPlan plan = BandDepthPlan.of(1, 1, 1);

        assertThatThrownBy(() -> service.hideMessage(cover, message, output,
                new StegoOptions(CipherType.NONE, null, "", plan)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("delimiter");

        service.hideMessage(cover, message, output, new StegoOptions(CipherType.NONE, null, "", plan, false, false, true));

        assertThat(service.extractMessage(output, new StegoOptions(CipherType.NONE, null, "", plan))).contains("before");
    }

    @Test
    void rejectsNonAsciiAndEmptyMessages() {
        StegoOptions options = new StegoOptions(CipherType.NONE, null, "", BandDepthPlan.of(1, 1, 1));
        Path output = tempDir.resolve("out.png");

        assertThatThrownBy(() -> service.hideMessage(cover, "naïve", output, options))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("U+00EF");
        assertThatThrownBy(() -> service.hideMessage(cover, "", output, options))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unusableKeyFailsBeforeWriting() {
        Path output = tempDir.resolve("out.png");

        assertThatThrownBy(() -> service.hideMessage(cover, MESSAGE, output,
                new StegoOptions(CipherType.CAESAR, "100", "", BandDepthPlan.of(1, 1, 1))))
                .isInstanceOf(DegenerateKeyException.class);
        assertThat(output).doesNotExist();
    }

    @Test
    void payloadWithForeignCharactersIsRejected() throws Exception {
        Path output = tempDir.resolve("stego.png");
        BandDepthPlan plan = BandDepthPlan.of(8, 0, 0);
        // codec level write of a character outside the alphabet
        ImageFiles.write(new LsbCodec().embed("\u0001bad", plan, ImageFiles.read(cover), ""), output);

        assertThatThrownBy(() -> service.extractMessage(output, new StegoOptions(CipherType.NONE, null, "", plan)))
                .isInstanceOf(StegoException.class)
                .hasMessageContaining("non-ASCII");
    }

    @Test
    void describesImageAndCapacity() throws Exception {
        ImageProperties properties = service.describe(cover, BandDepthPlan.of(1, 1, 1));

        assertThat(properties.width()).isEqualTo(40);
        assertThat(properties.height()).isEqualTo(30);
        assertThat(properties.channels()).isEqualTo(3);
        assertThat(properties.mode()).isEqualTo("RGB");
        assertThat(properties.bitDepth()).isEqualTo(24);
        assertThat(properties.capacity()).isEqualTo(1200 * 3 / 8 - 17);
        assertThat(properties.maxCapacity()).isEqualTo(1200 * 3 - 17);
    }
}
