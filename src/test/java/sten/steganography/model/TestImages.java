package sten.steganography.model;

import sten.steganography.codec.PixelBuffer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Random;

final class TestImages {

    private TestImages() {
    }

    static PixelBuffer randomPixels(int width, int height, int channels, long seed) {
        byte[] samples = new byte[width * height * channels];
        Random random = new Random(seed);
        random.nextBytes(samples);
        if (channels == 4) {
            for (int i = 3; i < samples.length; i += 4) {
                samples[i] = (byte) (128 + random.nextInt(128));
            }
        }
        return new PixelBuffer(width, height, channels, samples);
    }

    static Path writeCover(Path dir, String name, int width, int height, int channels) throws IOException {
        Path file = dir.resolve(name);
        ImageFiles.write(randomPixels(width, height, channels, name.hashCode()), file);
        return file;
    }
}
