package sten.steganography.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import sten.steganography.codec.BandDepthPlan;
import sten.steganography.crypto.CipherType;
import sten.steganography.model.SteganographyService;
import sten.steganography.model.StegoOptions;
import sten.steganography.view.SteganographyView;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "extract", description = "Extract a hidden text message from an image file.")
public class ExtractController implements Callable<Integer> {

    static final int NOT_FOUND = 3;

    private static final Logger logger = LoggerFactory.getLogger(ExtractController.class);

    private final SteganographyService service;
    private final SteganographyView view;

    public ExtractController(SteganographyService service, SteganographyView view) {
        this.service = service;
        this.view = view;
    }

    @Option(names = {"-i", "--input"}, required = true, description = "Stego-image file (PNG or BMP) containing the message.")
    private Path inputFile;

    @Option(names = {"-o", "--output"}, description = "File to save the message to. Printed when omitted.")
    private Path outputFile;

    @Option(names = {"-C", "--cipher"}, defaultValue = "none", converter = CipherTypeConverter.class,
            description = "Cipher the message was hidden with: none, caesar, hill, scytale, vigenere. Default: ${DEFAULT-VALUE}.")
    private CipherType cipher;

    @Option(names = {"-k", "--key"}, interactive = true, arity = "0..1",
            description = "Cipher key. Prompted for with echo off when given without a value.")
    private String key;

    @Option(names = {"-s", "--seed"}, defaultValue = "", description = "PRNG seed used when hiding.")
    private String seed;

    @Option(names = {"-b", "--bands"}, defaultValue = "1,1,1", converter = BandDepthPlanConverter.class,
            description = "LSB depth per channel as r,g,b[,a] (0-8 each). Default: ${DEFAULT-VALUE}.")
    private BandDepthPlan plan;

    @Option(names = "--brute-force", description = "Try every channel/depth combination instead of --bands.")
    private boolean bruteForce;

    @Override
    public Integer call() {
        try {
            validateInputs();
            StegoOptions options = new StegoOptions(cipher, KeyValidation.check(cipher, key, view), seed, plan,
                    bruteForce, false, false);
            view.showMessage("Starting extraction process...");
            Optional<String> message = service.extractMessage(inputFile, options);
            if (message.isEmpty()) {
                view.showWarning("No hidden message found.");
                return NOT_FOUND;
            }
            if (outputFile != null) {
                Files.writeString(outputFile, message.get(), StandardCharsets.UTF_8);
                view.showSuccess("Message successfully extracted into: " + outputFile.toAbsolutePath());
            } else {
                view.showMessage(message.get());
                view.showSuccess("Message successfully extracted.");
            }
            return 0;
        } catch (Exception e) {
            view.showError(e.getMessage());
            logger.debug("Extraction failed", e);
            return 1;
        }
    }

    private void validateInputs() {
        if (!Files.exists(inputFile)) throw new IllegalArgumentException("Input file not found: " + inputFile);
        if (!bruteForce && plan.isEmpty()) throw new IllegalArgumentException("At least one channel must carry LSBs.");
    }
}
