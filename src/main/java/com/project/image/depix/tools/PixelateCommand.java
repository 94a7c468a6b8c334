package com.project.image.depix.tools;

import com.project.image.depix.model.OutputCanvas;
import com.project.image.depix.model.PixelGrid;
import com.project.image.depix.model.PixelationMethod;
import com.project.image.depix.service.ImageIoService;
import com.project.image.depix.service.PixelationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "pixelate",
        mixinStandardHelpOptions = true,
        description = "Generate pixelized image from a given image.",
        footer = {"",
                "Example usage:",
                "  pixelate -i input.png -o pixelated.png",
                "  pixelate -i input.png -o output.png --blocksize 10",
                "  pixelate -i input.png --method linear"})
public class PixelateCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(PixelateCommand.class);

    @Option(names = {"-i", "--image"}, required = true, paramLabel = "PATH",
            converter = Converters.ExistingFile.class, description = "Path to image to pixelize")
    Path image;

    @Option(names = {"-o", "--outputimage"}, defaultValue = "output_pixelated.png", paramLabel = "PATH",
            description = "Path to output image (default: ${DEFAULT-VALUE})")
    Path outputImage;

    @Option(names = {"-b", "--blocksize"}, defaultValue = "5", paramLabel = "N",
            description = "Size of pixelation blocks (default: ${DEFAULT-VALUE})")
    int blockSize;

    @Option(names = {"-m", "--method"}, defaultValue = "gamma", paramLabel = "METHOD",
            converter = Converters.Method.class, description = "Averaging method: gamma or linear (default: ${DEFAULT-VALUE})")
    PixelationMethod method;

    private final ImageIoService imageIo;
    private final PixelationService pixelationService;

    public PixelateCommand() {
        this(new ImageIoService(), new PixelationService());
    }

    PixelateCommand(ImageIoService imageIo, PixelationService pixelationService) {
        this.imageIo = imageIo;
        this.pixelationService = pixelationService;
    }

    @Override
    public Integer call() {
        log.info("Loading image from {}", image);
        PixelGrid source = imageIo.load(image);
        log.info("Image size: {}x{}", source.width(), source.height());

        PixelGrid pixelated = pixelationService.pixelate(source, blockSize, method);
        imageIo.save(OutputCanvas.copyOf(pixelated), outputImage);
        return 0;
    }
}
