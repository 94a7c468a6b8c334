package com.project.image.depix.tools;

import com.project.image.depix.model.AveragingMode;
import com.project.image.depix.model.PixelationMethod;
import com.project.image.depix.model.RgbColor;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Option converters. Failures surface as picocli usage errors, so bad input is rejected before
 * any image is processed.
 */
final class Converters {

    private Converters() {}

    static final class ExistingFile implements CommandLine.ITypeConverter<Path> {
        @Override
        public Path convert(String value) {
            Path path = Paths.get(value);
            if (!Files.isRegularFile(path)) {
                throw new CommandLine.TypeConversionException("'" + value + "' is not a file.");
            }
            return path;
        }
    }

    static final class Color implements CommandLine.ITypeConverter<RgbColor> {
        @Override
        public RgbColor convert(String value) {
            try {
                return RgbColor.parse(value);
            } catch (RuntimeException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    static final class Averaging implements CommandLine.ITypeConverter<AveragingMode> {
        @Override
        public AveragingMode convert(String value) {
            try {
                return AveragingMode.fromName(value);
            } catch (RuntimeException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    static final class Method implements CommandLine.ITypeConverter<PixelationMethod> {
        @Override
        public PixelationMethod convert(String value) {
            try {
                return PixelationMethod.fromName(value);
            } catch (RuntimeException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
