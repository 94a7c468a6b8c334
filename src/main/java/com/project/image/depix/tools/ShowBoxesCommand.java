package com.project.image.depix.tools;

import com.project.image.depix.model.PixelGrid;
import com.project.image.depix.model.RgbColor;
import com.project.image.depix.service.BoxOverlayService;
import com.project.image.depix.service.ImageIoService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "show-boxes",
        mixinStandardHelpOptions = true,
        description = "Visualize detected pixelated blocks.",
        footer = {"",
                "The pixelated rectangle must be cut out to only include the pixelated rectangles.",
                "The pattern search image is generally a screenshot of a De Bruijn sequence of expected characters,",
                "made on a machine with the same editor and text size as the original screenshot that was pixelated."})
public class ShowBoxesCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ShowBoxesCommand.class);

    @Option(names = {"-p", "--pixelimage"}, required = true, paramLabel = "PATH",
            converter = Converters.ExistingFile.class, description = "Path to image with pixelated rectangle")
    Path pixelImage;

    @Option(names = {"-s", "--searchimage"}, required = true, paramLabel = "PATH",
            converter = Converters.ExistingFile.class, description = "Path to image with patterns to search")
    Path searchImage;

    @Option(names = {"-b", "--backgroundcolor"}, paramLabel = "R,G,B",
            converter = Converters.Color.class,
            description = "Original editor background color in format r,g,b (color to ignore)")
    RgbColor backgroundColor;

    @Option(names = {"-e", "--enhance"}, defaultValue = "3", paramLabel = "N",
            description = "Enhancement factor (default: ${DEFAULT-VALUE})")
    int enhance;

    @Option(names = {"-o", "--outputimage"}, required = true, paramLabel = "PATH",
            description = "Path to save output image")
    Path outputImage;

    private final ImageIoService imageIo;
    private final BoxOverlayService boxOverlayService;

    public ShowBoxesCommand() {
        this(new ImageIoService(), new BoxOverlayService());
    }

    ShowBoxesCommand(ImageIoService imageIo, BoxOverlayService boxOverlayService) {
        this.imageIo = imageIo;
        this.boxOverlayService = boxOverlayService;
    }

    @Override
    public Integer call() {
        log.info("Loading pixelated image from {}", pixelImage);
        PixelGrid pixelated = imageIo.load(pixelImage);

        // only checked for readability, the boxes come from the pixelated image alone
        log.info("Loading search image from {}", searchImage);
        imageIo.load(searchImage);

        BufferedImage overlay = boxOverlayService.visualize(pixelated, backgroundColor, enhance);
        imageIo.write(overlay, outputImage);
        log.info("Saved visualization to {}", outputImage);
        return 0;
    }
}
