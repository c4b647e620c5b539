package sten.steganography.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sten.steganography.StegoException;
import sten.steganography.codec.BandDepthPlan;
import sten.steganography.codec.CapacityExceededException;
import sten.steganography.codec.LsbCodec;
import sten.steganography.codec.PixelBuffer;
import sten.steganography.crypto.Alphabet;
import sten.steganography.crypto.Cipher;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads images, applies the cipher and drives the {@link LsbCodec}.
 * The message is encrypted before it is embedded and decrypted after it is extracted, so the codec only
 * ever sees ciphertext.
 */
public class SteganographyServiceImpl implements SteganographyService {

    private static final Logger logger = LoggerFactory.getLogger(SteganographyServiceImpl.class);

    private static final int FULL_DEPTH = BandDepthPlan.MAX_DEPTH;

    private final LsbCodec codec;

    public SteganographyServiceImpl() {
        this(new LsbCodec());
    }

    public SteganographyServiceImpl(LsbCodec codec) {
        this.codec = codec;
    }

    @Override
    public HideResult hideMessage(Path coverFile, String message, Path outputFile, StegoOptions options)
            throws StegoException, IOException {
        PixelBuffer cover = ImageFiles.read(coverFile);

        if (message.isEmpty()) {
            throw new IllegalArgumentException("Message is empty.");
        }
        Optional<Character> foreign = Alphabet.firstForeign(message);
        if (foreign.isPresent()) {
            throw new IllegalArgumentException(String.format(
                    "Message contains a non-ASCII character: U+%04X", (int) foreign.get()));
        }

        int capacity = LsbCodec.capacity(cover.pixelCount(), options.plan());
        boolean truncated = false;
        if (message.length() > capacity) {
            if (!options.truncate() || capacity <= 0) {
                throw new CapacityExceededException(
                        (long) (message.length() + LsbCodec.DELIMITER.length()) * LsbCodec.BITS_PER_CHAR,
                        (long) cover.pixelCount() * options.plan().totalDepth());
            }
            logger.warn("Message of {} characters truncated to the capacity of {}", message.length(), capacity);
            message = message.substring(0, capacity);
            truncated = true;
        }

        Cipher cipher = options.cipher().create(options.key());
        String ciphertext = cipher.encrypt(message);

        if (ciphertext.contains(LsbCodec.DELIMITER)) {
            if (!options.force()) {
                throw new IllegalArgumentException("Message will contain the delimiter, some data will be lost "
                        + "on extraction. Use --force to hide it anyway.");
            }
            logger.warn("Hiding a message that contains the delimiter, extraction will stop early");
        }

        PixelBuffer stego = codec.embed(ciphertext, options.plan(), cover, options.seed());
        ImageFiles.write(stego, outputFile);
        logger.info("Hid {} characters with {} into {}", message.length(), cipher, outputFile);

        return new HideResult(message.length(), ciphertext.length() + LsbCodec.DELIMITER.length(), capacity, truncated);
    }

    @Override
    public Optional<String> extractMessage(Path stegoFile, StegoOptions options) throws StegoException, IOException {
        PixelBuffer stego = ImageFiles.read(stegoFile);
        Cipher cipher = options.cipher().create(options.key());

        Optional<String> payload = options.bruteForce()
                ? codec.extractBruteForce(stego, options.seed())
                : codec.extract(options.plan(), stego, options.seed());
        if (payload.isEmpty()) {
            logger.info("No hidden message found in {}", stegoFile);
            return Optional.empty();
        }

        if (Alphabet.firstForeign(payload.get()).isPresent()) {
            throw new StegoException("Message contains a non-ASCII character. "
                    + "Are you sure this message was created using Sten?");
        }
        return Optional.of(cipher.decrypt(payload.get()));
    }

    @Override
    public ImageProperties describe(Path imageFile, BandDepthPlan plan) throws IOException {
        PixelBuffer pixels = ImageFiles.read(imageFile);
        int maxCapacity = LsbCodec.capacity(pixels.pixelCount(), BandDepthPlan.of(FULL_DEPTH, FULL_DEPTH, FULL_DEPTH));
        return new ImageProperties(
                pixels.getWidth(),
                pixels.getHeight(),
                pixels.getChannels(),
                ImageFiles.modeOf(pixels),
                LsbCodec.BITS_PER_CHAR * pixels.getChannels(),
                LsbCodec.capacity(pixels.pixelCount(), plan),
                maxCapacity);
    }
}
