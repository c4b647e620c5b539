package sten.steganography.model;

/**
 * What the {@code info} command reports about an image.
 * @param capacity Characters that fit under the requested plan.
 * @param maxCapacity Characters that fit using all eight bits of three channels.
 */
public record ImageProperties(int width, int height, int channels, String mode, int bitDepth,
                              int capacity, int maxCapacity) {
}
