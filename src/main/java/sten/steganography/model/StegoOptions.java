package sten.steganography.model;

import sten.steganography.codec.BandDepthPlan;
import sten.steganography.crypto.CipherType;

import java.util.Objects;

/**
 * Options shared by hiding and extracting.
 * @param cipher Cipher applied to the message, {@link CipherType#NONE} for plain text.
 * @param key Cipher key as typed, ignored for {@link CipherType#NONE}.
 * @param seed Pixel order seed, empty for row-major order.
 * @param plan Channels and LSB depths carrying the message.
 * @param bruteForce Extract by trying every plan instead of {@code plan}.
 * @param truncate Cut a message that is longer than the capacity instead of failing.
 * @param force Hide a message even if its ciphertext contains the delimiter.
 */
public record StegoOptions(CipherType cipher, String key, String seed, BandDepthPlan plan,
                           boolean bruteForce, boolean truncate, boolean force) {

    public StegoOptions {
        cipher = cipher == null ? CipherType.NONE : cipher;
        seed = seed == null ? "" : seed;
        Objects.requireNonNull(plan, "plan");
    }

    public StegoOptions(CipherType cipher, String key, String seed, BandDepthPlan plan) {
        this(cipher, key, seed, plan, false, false, false);
    }
}
