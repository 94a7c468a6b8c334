package com.project.image.depix.service;

import com.project.image.depix.exceptions.InvalidInputException;
import com.project.image.depix.exceptions.StorageException;
import com.project.image.depix.model.OutputCanvas;
import com.project.image.depix.model.PixelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Decodes images into {@link PixelGrid}s and encodes {@link OutputCanvas}es back to files.
 */
@Service
public class ImageIoService {
    private static final Logger log = LoggerFactory.getLogger(ImageIoService.class);

    private static final String DEFAULT_FORMAT = "png";

    public PixelGrid load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new InvalidInputException(path + " is not a file.");
        }
        if (!Files.isReadable(path)) {
            throw new InvalidInputException(path + " is not readable.");
        }
        try (InputStream in = Files.newInputStream(path)) {
            PixelGrid grid = decode(in, path.toString());
            log.debug("Image loaded from {}: {}x{}", path, grid.width(), grid.height());
            return grid;
        } catch (IOException e) {
            throw new InvalidInputException("Failed to read image " + path + ": " + e.getMessage(), e);
        }
    }

    public PixelGrid decode(byte[] bytes, String name) {
        try {
            return decode(new ByteArrayInputStream(bytes), name);
        } catch (IOException e) {
            throw new InvalidInputException("Failed to read image " + name + ": " + e.getMessage(), e);
        }
    }

    private PixelGrid decode(InputStream in, String name) throws IOException {
        BufferedImage image = ImageIO.read(in);
        if (image == null) {
            throw new InvalidInputException(name + " is not a valid image or is corrupted.");
        }
        return PixelGrid.fromImage(image);
    }

    /**
     * Writes the canvas, creating missing parent directories. The format follows the file
     * extension and falls back to PNG.
     */
    public Path save(OutputCanvas canvas, Path path) {
        write(canvas.toImage(writableType(canvas, formatOf(path))), path);
        log.info("Successfully saved output image to: {}", path);
        return path;
    }

    public byte[] toPng(OutputCanvas canvas) {
        return toPng(canvas.toImage(writableType(canvas, DEFAULT_FORMAT)));
    }

    public byte[] toPng(BufferedImage image) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(image, DEFAULT_FORMAT, baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new StorageException("Failed to encode image", e);
        }
    }

    public void write(BufferedImage image, Path path) {
        String format = formatOf(path);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!ImageIO.write(image, format, path.toFile())) {
                throw new StorageException("No image writer available for format '" + format + "'");
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write image " + path, e);
        }
    }

    static String formatOf(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return DEFAULT_FORMAT;
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return switch (ext) {
            case "jpg", "jpeg" -> "jpg";
            case "bmp", "gif", "png" -> ext;
            default -> DEFAULT_FORMAT;
        };
    }

    /**
     * Keeps the source type when every pixel can be written back without a palette; JPEG
     * and BMP writers reject alpha, so those get plain RGB.
     */
    static int writableType(OutputCanvas canvas, String format) {
        boolean alphaCapable = !format.equals("jpg") && !format.equals("bmp");
        switch (canvas.imageType()) {
            case BufferedImage.TYPE_INT_RGB:
            case BufferedImage.TYPE_INT_BGR:
            case BufferedImage.TYPE_3BYTE_BGR:
            case BufferedImage.TYPE_BYTE_GRAY:
            case BufferedImage.TYPE_USHORT_GRAY:
                return canvas.imageType();
            case BufferedImage.TYPE_INT_ARGB:
            case BufferedImage.TYPE_4BYTE_ABGR:
                return alphaCapable ? canvas.imageType() : BufferedImage.TYPE_INT_RGB;
            default:
                return canvas.hasAlpha() && alphaCapable ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        }
    }
}
