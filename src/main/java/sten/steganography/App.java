package sten.steganography;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import sten.steganography.controller.ExtractController;
import sten.steganography.controller.HideController;
import sten.steganography.controller.InfoController;
import sten.steganography.model.SteganographyService;
import sten.steganography.model.SteganographyServiceImpl;
import sten.steganography.view.SteganographyView;
import sten.steganography.view.SteganographyViewImpl;

@Command(
        name = "sten",
        mixinStandardHelpOptions = true,
        version = "Sten 1.0",
        description = "CLI application for LSB steganography on PNG and BMP images."
)
public class App {
    public static void main(String[] args) {
        SteganographyService service = new SteganographyServiceImpl();
        SteganographyView view = new SteganographyViewImpl();

        int exitCode = createCommandLine(service, view).execute(args);
        System.exit(exitCode);
    }

    /**
     * Wires the subcommands. Option defaults can be overridden in {@code ~/.sten.properties}.
     */
    public static CommandLine createCommandLine(SteganographyService service, SteganographyView view) {
        return createCommandLine(service, view, new CommandLine.PropertiesDefaultProvider());
    }

    /**
     * Wires the subcommands with option defaults taken from {@code defaults}.
     */
    public static CommandLine createCommandLine(SteganographyService service, SteganographyView view,
                                                CommandLine.IDefaultValueProvider defaults) {
        CommandLine cmd = new CommandLine(new App());
        cmd.addSubcommand("hide", new HideController(service, view));
        cmd.addSubcommand("extract", new ExtractController(service, view));
        cmd.addSubcommand("info", new InfoController(service, view));
        cmd.setDefaultValueProvider(defaults);
        return cmd;
    }
}
