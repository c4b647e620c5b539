package sten.steganography.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import sten.steganography.codec.BandDepthPlan;
import sten.steganography.model.ImageProperties;
import sten.steganography.model.SteganographyService;
import sten.steganography.view.SteganographyView;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "info", description = "Show image properties and message capacity.")
public class InfoController implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(InfoController.class);

    private final SteganographyService service;
    private final SteganographyView view;

    public InfoController(SteganographyService service, SteganographyView view) {
        this.service = service;
        this.view = view;
    }

    @Option(names = {"-i", "--input"}, required = true, description = "Image file (PNG or BMP).")
    private Path imageFile;

    @Option(names = {"-b", "--bands"}, defaultValue = "1,1,1", converter = BandDepthPlanConverter.class,
            description = "LSB depth per channel the capacity is computed for. Default: ${DEFAULT-VALUE}.")
    private BandDepthPlan plan;

    @Override
    public Integer call() {
        try {
            if (!Files.exists(imageFile)) throw new IllegalArgumentException("Image file not found: " + imageFile);
            ImageProperties properties = service.describe(imageFile, plan);
            view.showMessage(String.format("Capacity: %d characters (%d bits per pixel)",
                    properties.capacity(), plan.totalDepth()));
            view.showMessage(String.format("Maximum capacity: %d characters", properties.maxCapacity()));
            view.showMessage(String.format("Width: %d pixels", properties.width()));
            view.showMessage(String.format("Height: %d pixels", properties.height()));
            view.showMessage(String.format("Bit depth: %d (%s)", properties.bitDepth(), properties.mode()));
            return 0;
        } catch (Exception e) {
            view.showError(e.getMessage());
            logger.debug("Reading image properties failed", e);
            return 1;
        }
    }
}
