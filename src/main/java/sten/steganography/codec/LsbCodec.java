package sten.steganography.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Hides text in the low-order bits of pixel channels and reads it back.
 * <p>
 * The text is followed by {@link #DELIMITER} and written as 8-bit character codes, most significant bit
 * first. Pixels are visited in {@link PixelOrder}; within a pixel, channels are visited in plan order and
 * each takes as many bits as its depth. Reading stops as soon as the decoded text ends with the
 * delimiter.
 * <p>
 * Instances hold no state and can be shared between threads.
 */
public class LsbCodec {

    private static final Logger logger = LoggerFactory.getLogger(LsbCodec.class);

    /** Marks the end of the payload. Changing it breaks every image written before. */
    public static final String DELIMITER = "$t3nb7$3rh@tC3l!k";

    public static final int BITS_PER_CHAR = 8;

    /** Smallest image that can hold one character and the delimiter at one bit per pixel. */
    public static final int MIN_PIXELS = BITS_PER_CHAR + BITS_PER_CHAR * DELIMITER.length();

    /**
     * @return how many characters, excluding the delimiter, fit into {@code pixelCount} pixels under {@code plan}.
     */
    public static int capacity(int pixelCount, BandDepthPlan plan) {
        return (int) (((long) pixelCount * plan.totalDepth()) / BITS_PER_CHAR) - DELIMITER.length();
    }

    /**
     * Embeds {@code plaintext} followed by the delimiter.
     * @param plaintext Text to hide, characters below 256.
     * @param plan Channels and depths to write, not empty.
     * @param pixels Cover pixels, left untouched.
     * @param seed Pixel order seed, null or empty for row-major order.
     * @return a new buffer carrying the payload. Pixels past the payload keep their values.
     * @throws CapacityExceededException if the payload needs more bits than the plan offers.
     */
    public PixelBuffer embed(String plaintext, BandDepthPlan plan, PixelBuffer pixels, String seed)
            throws CapacityExceededException {
        checkPlan(plan, pixels);
        if (plan.isEmpty()) {
            throw new IllegalArgumentException("Plan must use at least one channel.");
        }

        String payload = plaintext + DELIMITER;
        for (int i = 0; i < payload.length(); i++) {
            if (payload.charAt(i) > 0xFF) {
                throw new IllegalArgumentException(String.format("Character U+%04X does not fit in 8 bits", (int) payload.charAt(i)));
            }
        }

        long bitCount = (long) payload.length() * BITS_PER_CHAR;
        long availableBits = (long) pixels.pixelCount() * plan.totalDepth();
        if (bitCount > availableBits) {
            throw new CapacityExceededException(bitCount, availableBits);
        }

        int[] order = PixelOrder.of(pixels.pixelCount(), seed);
        PixelBuffer result = pixels.copy();
        long cursor = 0;
        int visited = 0;

        while (cursor < bitCount) {
            int pixel = order[visited++];
            for (BandDepthPlan.Entry entry : plan) {
                if (cursor >= bitCount) {
                    break;
                }
                int depth = entry.depth();
                int chunk = (int) Math.min(depth, bitCount - cursor);
                int field = 0;
                for (int k = 0; k < chunk; k++) {
                    field = (field << 1) | bitAt(payload, cursor + k);
                }

                // a short final chunk goes to the top of the field, the bits below it are kept
                int shift = depth - chunk;
                int mask = ((1 << chunk) - 1) << shift;
                int value = result.getSample(pixel, entry.channel());
                result.setSample(pixel, entry.channel(), (value & ~mask) | (field << shift));
                cursor += chunk;
            }
        }

        logger.debug("Embedded {} bits into {} of {} pixels with plan {}", bitCount, visited, pixels.pixelCount(), plan);
        return result;
    }

    /**
     * Reads a delimiter-terminated text.
     * @param plan Channels and depths the text was written with.
     * @param pixels Stego pixels.
     * @param seed Pixel order seed used when embedding.
     * @return the text without the delimiter, or empty if no delimiter is found.
     */
    public Optional<String> extract(BandDepthPlan plan, PixelBuffer pixels, String seed) {
        checkPlan(plan, pixels);
        if (plan.isEmpty()) {
            return Optional.empty();
        }
        return extract(plan, pixels, PixelOrder.of(pixels.pixelCount(), seed));
    }

    /**
     * Tries every non-empty plan over the first three channels, in {@link BandDepthPlan#bruteForceCandidates(int)}
     * order, and returns the first text found.
     * @param pixels Stego pixels.
     * @param seed Pixel order seed used when embedding.
     * @return the text of the first plan that finds a delimiter, or empty if none does.
     */
    public Optional<String> extractBruteForce(PixelBuffer pixels, String seed) {
        int[] order = PixelOrder.of(pixels.pixelCount(), seed);
        List<BandDepthPlan> candidates = BandDepthPlan.bruteForceCandidates(3);
        for (BandDepthPlan plan : candidates) {
            Optional<String> text = extract(plan, pixels, order);
            if (text.isPresent()) {
                logger.debug("Brute force found a message with plan {}", plan);
                return text;
            }
        }
        logger.debug("Brute force tried {} plans without finding a message", candidates.size());
        return Optional.empty();
    }

    private Optional<String> extract(BandDepthPlan plan, PixelBuffer pixels, int[] order) {
        StringBuilder text = new StringBuilder();
        int accumulator = 0;
        int pending = 0;

        for (int pixel : order) {
            for (BandDepthPlan.Entry entry : plan) {
                int depth = entry.depth();
                accumulator = (accumulator << depth) | (pixels.getSample(pixel, entry.channel()) & ((1 << depth) - 1));
                pending += depth;
                if (pending >= BITS_PER_CHAR) {
                    pending -= BITS_PER_CHAR;
                    text.append((char) ((accumulator >> pending) & 0xFF));
                    accumulator &= (1 << pending) - 1;
                    if (endsWithDelimiter(text)) {
                        return Optional.of(text.substring(0, text.length() - DELIMITER.length()));
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static boolean endsWithDelimiter(StringBuilder text) {
        int start = text.length() - DELIMITER.length();
        return start >= 0 && text.indexOf(DELIMITER, start) == start;
    }

    private static int bitAt(String payload, long bit) {
        char c = payload.charAt((int) (bit / BITS_PER_CHAR));
        return (c >> (BITS_PER_CHAR - 1 - (int) (bit % BITS_PER_CHAR))) & 1;
    }

    private static void checkPlan(BandDepthPlan plan, PixelBuffer pixels) {
        if (plan.highestChannel() >= pixels.getChannels()) {
            throw new IllegalArgumentException("Plan uses channel " + plan.highestChannel()
                    + " but pixels only have " + pixels.getChannels() + " channels");
        }
    }
}
