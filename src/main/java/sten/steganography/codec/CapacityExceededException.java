package sten.steganography.codec;

import sten.steganography.StegoException;

/**
 * The payload does not fit into the pixels under the chosen plan.
 */
public class CapacityExceededException extends StegoException {

    private final long requiredBits;
    private final long availableBits;

    public CapacityExceededException(long requiredBits, long availableBits) {
        super("Message is too large for the available space: needs " + requiredBits
                + " bits, the image holds " + availableBits + " bits with this plan.");
        this.requiredBits = requiredBits;
        this.availableBits = availableBits;
    }

    public long getRequiredBits() {
        return requiredBits;
    }

    public long getAvailableBits() {
        return availableBits;
    }
}
