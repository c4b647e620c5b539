package sten.steganography.codec;

import java.util.Arrays;

/**
 * Decoded image samples: {@code width * height} pixels in row-major order, each made of
 * {@code channels} unsigned 8-bit values (3 for RGB, 4 for RGBA).
 */
public final class PixelBuffer {

    private final int width;
    private final int height;
    private final int channels;
    private final byte[] samples;

    public PixelBuffer(int width, int height, int channels, byte[] samples) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid dimensions: " + width + "x" + height);
        }
        if (channels != 3 && channels != 4) {
            throw new IllegalArgumentException("Pixels must have 3 or 4 channels, got " + channels);
        }
        if ((long) width * height * channels != samples.length) {
            throw new IllegalArgumentException("Expected " + ((long) width * height * channels)
                    + " samples, got " + samples.length);
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.samples = samples.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    public int pixelCount() {
        return width * height;
    }

    /**
     * @param pixel Row-major pixel index.
     * @param channel Channel index within the pixel.
     * @return the sample value in 0..255.
     */
    public int getSample(int pixel, int channel) {
        return samples[offset(pixel, channel)] & 0xFF;
    }

    public int getSample(int x, int y, int channel) {
        return getSample(y * width + x, channel);
    }

    void setSample(int pixel, int channel, int value) {
        samples[offset(pixel, channel)] = (byte) value;
    }

    /**
     * @return a copy of the raw samples, pixel after pixel.
     */
    public byte[] toByteArray() {
        return samples.clone();
    }

    PixelBuffer copy() {
        return new PixelBuffer(width, height, channels, samples);
    }

    private int offset(int pixel, int channel) {
        if (channel < 0 || channel >= channels) {
            throw new IndexOutOfBoundsException("Channel " + channel + " out of range for " + channels + " channels");
        }
        return pixel * channels + channel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBuffer)) return false;
        PixelBuffer other = (PixelBuffer) o;
        return width == other.width && height == other.height && channels == other.channels
                && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * width + height) + channels) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + ", " + channels + " channels]";
    }
}
