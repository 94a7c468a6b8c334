package com.project.image.depix.tools;

import com.project.image.depix.DTOs.DepixelizationResult;
import com.project.image.depix.model.AveragingMode;
import com.project.image.depix.model.PixelGrid;
import com.project.image.depix.model.RgbColor;
import com.project.image.depix.service.DepixelizationService;
import com.project.image.depix.service.ImageIoService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "depix",
        mixinStandardHelpOptions = true,
        description = "Recover passwords from pixelized screenshots.",
        footer = {"",
                "Example usage:",
                "  depix -p pixelated.png -s search.png -o output.png",
                "  depix -p image.png -s search.png --averagetype linear",
                "  depix -p image.png -s search.png --backgroundcolor 40,41,35"})
public class DepixCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DepixCommand.class);

    @Option(names = {"-p", "--pixelimage"}, required = true, paramLabel = "PATH",
            converter = Converters.ExistingFile.class, description = "Path to pixelated image")
    Path pixelImage;

    @Option(names = {"-s", "--searchimage"}, required = true, paramLabel = "PATH",
            converter = Converters.ExistingFile.class, description = "Path to search image (De Bruijn sequence)")
    Path searchImage;

    @Option(names = {"-a", "--averagetype"}, defaultValue = "gammacorrected",
            converter = Converters.Averaging.class,
            description = "Type of RGB averaging: gammacorrected or linear (default: ${DEFAULT-VALUE})")
    AveragingMode averageType;

    @Option(names = {"-b", "--backgroundcolor"}, paramLabel = "R,G,B",
            converter = Converters.Color.class, description = "Background color to ignore (format: r,g,b)")
    RgbColor backgroundColor;

    @Option(names = {"-o", "--outputimage"}, defaultValue = "output.png", paramLabel = "PATH",
            description = "Path to output image (default: ${DEFAULT-VALUE})")
    Path outputImage;

    private final ImageIoService imageIo;
    private final DepixelizationService depixelizationService;

    public DepixCommand() {
        this(new ImageIoService(), new DepixelizationService());
    }

    DepixCommand(ImageIoService imageIo, DepixelizationService depixelizationService) {
        this.imageIo = imageIo;
        this.depixelizationService = depixelizationService;
    }

    @Override
    public Integer call() {
        log.info("Loading pixelated image from {}", pixelImage);
        PixelGrid pixelated = imageIo.load(pixelImage);

        log.info("Loading search image from {}", searchImage);
        PixelGrid reference = imageIo.load(searchImage);

        DepixelizationResult result = depixelizationService.depixelize(
                pixelated, reference, averageType, backgroundColor, log);

        imageIo.save(result.canvas(), outputImage);
        return 0;
    }
}
