package sten.steganography.model;

import sten.steganography.codec.LsbCodec;
import sten.steganography.codec.PixelBuffer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Converts between lossless image files and {@link PixelBuffer}s.
 */
public final class ImageFiles {

    public static final List<String> EXTENSIONS = List.of(".bmp", ".png");

    private static final Set<Integer> SUPPORTED_TYPES = Set.of(
            BufferedImage.TYPE_3BYTE_BGR,
            BufferedImage.TYPE_4BYTE_ABGR,
            BufferedImage.TYPE_INT_RGB,
            BufferedImage.TYPE_INT_BGR,
            BufferedImage.TYPE_INT_ARGB);

    private ImageFiles() {
    }

    /**
     * Decodes an RGB or RGBA image.
     * @throws IllegalArgumentException for an unsupported extension or color mode, or a too small image.
     * @throws IOException if the file cannot be read or decoded.
     */
    public static PixelBuffer read(Path file) throws IOException {
        formatOf(file);
        if (!Files.isRegularFile(file)) {
            throw new IOException("File not found: " + file);
        }
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Not a readable image: " + file);
        }
        if (!SUPPORTED_TYPES.contains(image.getType())) {
            throw new IllegalArgumentException("Mode not supported: " + file.getFileName() + ". Supported modes: RGB|RGBA");
        }

        int width = image.getWidth();
        int height = image.getHeight();
        if ((long) width * height < LsbCodec.MIN_PIXELS) {
            throw new IllegalArgumentException("Need minimum " + LsbCodec.MIN_PIXELS + " pixels. Provided: "
                    + ((long) width * height) + " pixels");
        }

        int channels = image.getColorModel().hasAlpha() ? 4 : 3;
        byte[] samples = new byte[width * height * channels];
        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = image.getRGB(x, y);
                samples[i++] = (byte) (argb >> 16);
                samples[i++] = (byte) (argb >> 8);
                samples[i++] = (byte) argb;
                if (channels == 4) {
                    samples[i++] = (byte) (argb >>> 24);
                }
            }
        }
        return new PixelBuffer(width, height, channels, samples);
    }

    /**
     * Encodes {@code pixels} in the format named by the file extension.
     * @throws IllegalArgumentException for an unsupported extension, or RGBA pixels written as BMP.
     */
    public static void write(PixelBuffer pixels, Path file) throws IOException {
        String format = formatOf(file);
        boolean alpha = pixels.getChannels() == 4;
        if (alpha && "bmp".equals(format)) {
            throw new IllegalArgumentException("BMP output supports RGB only, use .png for RGBA images.");
        }

        BufferedImage image = new BufferedImage(pixels.getWidth(), pixels.getHeight(),
                alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < pixels.getHeight(); y++) {
            for (int x = 0; x < pixels.getWidth(); x++) {
                int argb = (pixels.getSample(x, y, 0) << 16)
                        | (pixels.getSample(x, y, 1) << 8)
                        | pixels.getSample(x, y, 2);
                argb |= alpha ? pixels.getSample(x, y, 3) << 24 : 0xFF000000;
                image.setRGB(x, y, argb);
            }
        }
        if (!ImageIO.write(image, format, file.toFile())) {
            throw new IOException("No image writer for format " + format);
        }
    }

    public static String modeOf(PixelBuffer pixels) {
        return pixels.getChannels() == 4 ? "RGBA" : "RGB";
    }

    static String formatOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String extension = dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
        if (!EXTENSIONS.contains(extension)) {
            throw new IllegalArgumentException("Not a valid extension: " + (extension.isEmpty() ? name : extension)
                    + ". Valid extensions: " + String.join("|", EXTENSIONS));
        }
        return extension.substring(1);
    }
}
