package sten.steganography.model;

import sten.steganography.StegoException;
import sten.steganography.codec.BandDepthPlan;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public interface SteganographyService {

    /**
     * Hides a text message inside an image.
     * @param coverFile Cover image (PNG or BMP).
     * @param message Message made of printable ASCII characters.
     * @param outputFile Output stego-image.
     * @param options Steganography options (cipher, key, seed, plan, etc).
     * @return what was hidden.
     * @throws StegoException if the key is unusable or the message does not fit.
     * @throws IOException if an image cannot be read or written.
     */
    HideResult hideMessage(Path coverFile, String message, Path outputFile, StegoOptions options)
            throws StegoException, IOException;

    /**
     * Extracts a hidden message from a stego-image.
     * @param stegoFile Image containing the message.
     * @param options Steganography options (cipher, key, seed, plan, etc).
     * @return the decrypted message, or empty if no message was found.
     * @throws StegoException if the key is unusable or the payload was not written by this tool.
     * @throws IOException if the image cannot be read.
     */
    Optional<String> extractMessage(Path stegoFile, StegoOptions options) throws StegoException, IOException;

    /**
     * Describes an image and its capacity.
     * @param imageFile Image to inspect.
     * @param plan Plan the capacity is computed for.
     * @return the image properties.
     * @throws IOException if the image cannot be read.
     */
    ImageProperties describe(Path imageFile, BandDepthPlan plan) throws IOException;
}
