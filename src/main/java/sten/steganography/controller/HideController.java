package sten.steganography.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import sten.steganography.codec.BandDepthPlan;
import sten.steganography.crypto.CipherType;
import sten.steganography.model.HideResult;
import sten.steganography.model.SteganographyService;
import sten.steganography.model.StegoOptions;
import sten.steganography.view.SteganographyView;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "hide", description = "Hide a text message into an image file.")
public class HideController implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(HideController.class);

    private final SteganographyService service;
    private final SteganographyView view;

    public HideController(SteganographyService service, SteganographyView view) {
        this.service = service;
        this.view = view;
    }

    static class MessageSource {
        @Option(names = {"-m", "--message"}, required = true, description = "Message text to hide.")
        String text;

        @Option(names = {"-f", "--message-file"}, required = true, description = "File containing the message to hide.")
        Path file;
    }

    @Option(names = {"-c", "--cover"}, required = true, description = "Image file (PNG or BMP) as cover medium.")
    private Path coverFile;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private MessageSource message;

    @Option(names = {"-o", "--output"}, required = true, description = "Output stego-image file name (.png or .bmp).")
    private Path outputFile;

    @Option(names = {"-C", "--cipher"}, defaultValue = "none", converter = CipherTypeConverter.class,
            description = "Cipher applied before hiding: none, caesar, hill, scytale, vigenere. Default: ${DEFAULT-VALUE}.")
    private CipherType cipher;

    @Option(names = {"-k", "--key"}, interactive = true, arity = "0..1",
            description = "Cipher key. Prompted for with echo off when given without a value.")
    private String key;

    @Option(names = {"-s", "--seed"}, defaultValue = "",
            description = "PRNG seed scattering the message over the pixels. Empty keeps row order.")
    private String seed;

    @Option(names = {"-b", "--bands"}, defaultValue = "1,1,1", converter = BandDepthPlanConverter.class,
            description = "LSB depth per channel as r,g,b[,a] (0-8 each). Default: ${DEFAULT-VALUE}.")
    private BandDepthPlan plan;

    @Option(names = "--truncate", description = "Cut a message that does not fit instead of failing.")
    private boolean truncate;

    @Option(names = "--force", description = "Hide the message even if it will contain the delimiter.")
    private boolean force;

    @Override
    public Integer call() {
        try {
            String text = readMessage();
            validateInputs();
            StegoOptions options = new StegoOptions(cipher, KeyValidation.check(cipher, key, view), seed, plan,
                    false, truncate, force);
            view.showMessage("Starting hiding process...");
            HideResult result = service.hideMessage(coverFile, text, outputFile, options);
            if (result.truncated()) {
                view.showWarning("Message truncated to " + result.hiddenCharacters() + " characters.");
            }
            view.showSuccess("Message successfully hidden into: " + outputFile.toAbsolutePath());
            return 0;
        } catch (Exception e) {
            view.showError(e.getMessage());
            logger.debug("Hiding failed", e);
            return 1;
        }
    }

    private String readMessage() throws Exception {
        if (message.file != null) {
            if (!Files.exists(message.file)) throw new IllegalArgumentException("Message file not found: " + message.file);
            return Files.readString(message.file, StandardCharsets.UTF_8);
        }
        return message.text;
    }

    private void validateInputs() {
        if (!Files.exists(coverFile)) throw new IllegalArgumentException("Cover file not found: " + coverFile);
        if (plan.isEmpty()) throw new IllegalArgumentException("At least one channel must carry LSBs.");
    }
}
