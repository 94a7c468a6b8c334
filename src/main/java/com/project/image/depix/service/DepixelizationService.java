package com.project.image.depix.service;

import com.project.image.depix.DTOs.DepixelizationResult;
import com.project.image.depix.exceptions.InvalidInputException;
import com.project.image.depix.model.AveragingMode;
import com.project.image.depix.model.Block;
import com.project.image.depix.model.BlockMatch;
import com.project.image.depix.model.BlockSize;
import com.project.image.depix.model.OutputCanvas;
import com.project.image.depix.model.PixelGrid;
import com.project.image.depix.model.Resolution;
import com.project.image.depix.model.ResolvedBlock;
import com.project.image.depix.model.RgbColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the whole depixelization pipeline: segment the pixelated image into same-color blocks,
 * drop moot colors, match every remaining block against the reference image, resolve ties and
 * write the recovered pixels into a copy of the pixelated image.
 *
 * <p>The service keeps no state between runs. Size groups are matched in parallel when enabled;
 * compositing always runs afterwards on the calling thread.
 */
@Service
public class DepixelizationService {
    private static final Logger log = LoggerFactory.getLogger(DepixelizationService.class);

    private final BlockSegmenter segmenter;
    private final BlockFilter filter;
    private final TemplateMatcher matcher;
    private final MatchResolver resolver;
    private final Compositor compositor;
    private final boolean parallel;

    public DepixelizationService() {
        this(new BlockSegmenter(), new BlockFilter(), new TemplateMatcher(), new MatchResolver(), new Compositor(), true);
    }

    @Autowired
    public DepixelizationService(BlockSegmenter segmenter, BlockFilter filter, TemplateMatcher matcher,
                                 MatchResolver resolver, Compositor compositor,
                                 @Value("${depix.matching.parallel:true}") boolean parallel) {
        this.segmenter = segmenter;
        this.filter = filter;
        this.matcher = matcher;
        this.resolver = resolver;
        this.compositor = compositor;
        this.parallel = parallel;
    }

    public DepixelizationResult depixelize(PixelGrid pixelated, PixelGrid reference,
                                           AveragingMode mode, RgbColor background) {
        return depixelize(pixelated, reference, mode, background, log);
    }

    /**
     * @param background editor background color to ignore, or {@code null}
     * @param runLog     receives the progress and per-block diagnostics of this run
     * @throws InvalidInputException if an image or the averaging mode is missing
     */
    public DepixelizationResult depixelize(PixelGrid pixelated, PixelGrid reference, AveragingMode mode,
                                           RgbColor background, Logger runLog) {
        if (pixelated == null || reference == null) {
            throw new InvalidInputException("Both a pixelated image and a search image are required");
        }
        if (mode == null) {
            throw new InvalidInputException("Averaging mode is required");
        }

        runLog.info("Finding color rectangles from pixelated space");
        List<Block> blocks = segmenter.segment(pixelated);
        runLog.info("Found {} same color rectangles", blocks.size());

        List<Block> informative = filter.removeMootColors(blocks, background);
        runLog.info("{} rectangles left after moot filter", informative.size());

        SizeIndex index = SizeIndex.of(informative);
        runLog.info("Found {} different rectangle sizes", index.sizeCount());
        if (index.hasTooManyVariants(pixelated.width() * pixelated.height())) {
            runLog.warn("Too many variants on block size. Re-cropping the image might help.");
        }

        OutputCanvas canvas = OutputCanvas.copyOf(pixelated);

        runLog.info("Finding matches in search image ({} averaging)", mode.cliName());
        List<BlockMatch> matches = findMatches(index, informative, pixelated, reference, mode, runLog);

        int unmatched = 0;
        for (BlockMatch match : matches) {
            if (match.isEmpty()) unmatched++;
        }
        int matched = matches.size() - unmatched;
        runLog.info("Found matches for {} blocks, {} blocks without a match stay pixelated", matched, unmatched);

        List<ResolvedBlock> resolved = resolver.resolveAll(matches);
        int averaged = 0;
        for (ResolvedBlock block : resolved) {
            if (block.resolution().kind() == Resolution.Kind.AVERAGED) averaged++;
        }
        int direct = resolved.size() - averaged;
        runLog.info("[{} straight matches | {} multiple matches]", direct, averaged);

        compositor.compose(canvas, resolved);
        runLog.info("Wrote {} recovered blocks to output", resolved.size());

        return new DepixelizationResult(canvas, blocks.size(), informative.size(), index.sizeCount(),
                matched, unmatched, direct, averaged);
    }

    private List<BlockMatch> findMatches(SizeIndex index, List<Block> ordered, PixelGrid pixelated,
                                         PixelGrid reference, AveragingMode mode, Logger runLog) {
        if (index.isEmpty()) {
            return List.of();
        }

        TemplateMatcher.PreparedReference prepared = matcher.prepare(reference, mode);
        try {
            final int total = ordered.size();
            AtomicInteger processed = new AtomicInteger();

            Stream<Map.Entry<BlockSize, List<Block>>> groups = index.groups().entrySet().stream();
            if (parallel) {
                groups = groups.parallel();
            }
            List<BlockMatch> found = groups
                    .flatMap(group -> {
                        List<BlockMatch> result = matcher.matchGroup(
                                group.getKey(), group.getValue(), pixelated, prepared, runLog);
                        int done = processed.addAndGet(result.size());
                        runLog.info("Progress: {}/{} blocks processed ({}%)",
                                done, total, String.format("%.1f", 100.0 * done / total));
                        return result.stream();
                    })
                    .collect(Collectors.toList());

            Map<Block, BlockMatch> byBlock = new IdentityHashMap<>();
            for (BlockMatch match : found) {
                byBlock.put(match.block(), match);
            }
            List<BlockMatch> inOrder = new ArrayList<>(ordered.size());
            for (Block block : ordered) {
                inOrder.add(byBlock.get(block));
            }
            return inOrder;
        } finally {
            prepared.release();
        }
    }
}
