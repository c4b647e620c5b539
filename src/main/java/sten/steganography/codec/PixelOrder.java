package sten.steganography.codec;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Random;

/**
 * Order in which the codec visits pixels. An empty seed means row-major order; any other seed gives a
 * shuffled order that is the same every time for the same seed.
 */
public final class PixelOrder {

    private PixelOrder() {
    }

    /**
     * @param pixelCount Number of pixels in the image.
     * @param seed Seed string, null or empty for the identity order.
     * @return every pixel index exactly once.
     */
    public static int[] of(int pixelCount, String seed) {
        int[] order = new int[pixelCount];
        for (int i = 0; i < pixelCount; i++) {
            order[i] = i;
        }
        if (seed == null || seed.isEmpty()) {
            return order;
        }

        Random random = new Random(seedValue(seed));
        for (int i = pixelCount - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
        return order;
    }

    static long seedValue(String seed) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(seed.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
