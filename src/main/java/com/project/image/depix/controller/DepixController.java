package com.project.image.depix.controller;

import com.project.image.depix.DTOs.DepixelizationResult;
import com.project.image.depix.exceptions.InvalidInputException;
import com.project.image.depix.model.AveragingMode;
import com.project.image.depix.model.PixelGrid;
import com.project.image.depix.model.RgbColor;
import com.project.image.depix.service.DepixelizationService;
import com.project.image.depix.service.ImageIoService;
import com.project.image.depix.service.StorageService;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Controller
@Validated
public class DepixController {
    private static final Logger log = LoggerFactory.getLogger(DepixController.class);

    private static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/png", "image/bmp", "image/gif", "image/jpeg", "image/jpg"
    );
    private static final long MAX_UPLOAD_BYTES = 10 * 1024 * 1024;

    private final DepixelizationService depixelizationService;
    private final ImageIoService imageIoService;
    private final StorageService storageService;

    public DepixController(DepixelizationService depixelizationService, ImageIoService imageIoService,
                           StorageService storageService) {
        this.depixelizationService = depixelizationService;
        this.imageIoService = imageIoService;
        this.storageService = storageService;
    }

    @GetMapping("/depix")
    public String showForm(Model model) {
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
        return "depix";
    }

    @PostMapping(value = "/depix", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("pixelImage") @NotNull MultipartFile pixelImage,
            @RequestParam("searchImage") @NotNull MultipartFile searchImage,
            @RequestParam(name = "averageType", defaultValue = "gammacorrected") String averageType,
            @RequestParam(name = "backgroundColor", required = false) String backgroundColor,
            Model model
    ) throws IOException {

        validateUploadedFile(pixelImage, "pixelated image");
        validateUploadedFile(searchImage, "search image");
        AveragingMode mode = AveragingMode.fromName(averageType);
        RgbColor background = backgroundColor == null || backgroundColor.isBlank()
                ? null : RgbColor.parse(backgroundColor);

        log.info("Processing {} against {}, averaging={}, background={}",
                pixelImage.getOriginalFilename(), searchImage.getOriginalFilename(), mode.cliName(), background);

        PixelGrid pixelated = imageIoService.decode(pixelImage.getBytes(), "pixelated image");
        PixelGrid reference = imageIoService.decode(searchImage.getBytes(), "search image");

        var storedPixelated = storageService.store(pixelImage, "pixelated");
        var storedSearch = storageService.store(searchImage, "search");

        DepixelizationResult result = depixelizationService.depixelize(pixelated, reference, mode, background);
        var storedOutput = storageService.storeResultImage(imageIoService.toPng(result.canvas()));

        populateResultModel(model, storedPixelated, storedSearch, storedOutput, result, mode);
        log.info("Depixelization completed for {}", pixelImage.getOriginalFilename());
        return "result";
    }

    private void validateUploadedFile(MultipartFile file, String label) {
        if (file == null || file.isEmpty()) {
            throw new InvalidInputException("Please choose a " + label + " to upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase(Locale.ROOT))) {
            throw new InvalidInputException("Unsupported " + label + " format: " + contentType
                    + ". Supported formats: " + String.join(", ", SUPPORTED_FORMATS));
        }
        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new InvalidInputException("The " + label + " is too large. Maximum size: 10MB");
        }
    }

    private void populateResultModel(Model model, StorageService.StoredFile pixelated,
                                     StorageService.StoredFile search, StorageService.StoredFile output,
                                     DepixelizationResult result, AveragingMode mode) {
        model.addAttribute("pixelatedPath", "/" + pixelated.relativeWebPath());
        model.addAttribute("searchPath", "/" + search.relativeWebPath());
        model.addAttribute("outputPath", "/" + output.relativeWebPath());
        model.addAttribute("width", result.width());
        model.addAttribute("height", result.height());
        model.addAttribute("averageType", mode.cliName());
        model.addAttribute("blocksFound", result.blocksFound());
        model.addAttribute("blocksAfterFilter", result.blocksAfterFilter());
        model.addAttribute("sizeVariants", result.sizeVariants());
        model.addAttribute("matched", result.matched());
        model.addAttribute("unmatched", result.unmatched());
        model.addAttribute("direct", result.direct());
        model.addAttribute("averaged", result.averaged());
    }
}
