package com.project.image.depix.service;

import com.project.image.depix.exceptions.GeometryException;
import com.project.image.depix.model.AveragingMode;
import com.project.image.depix.model.Block;
import com.project.image.depix.model.BlockMatch;
import com.project.image.depix.model.BlockSize;
import com.project.image.depix.model.Candidate;
import com.project.image.depix.model.PixelGrid;
import com.project.image.depix.model.Region;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Finds, for every block, the window of the reference image that is closest to the block's
 * pixels under OpenCV's normalized squared difference ({@code TM_SQDIFF_NORMED}).
 *
 * <p>Both images are compared as three-channel float data in [0,1]; in {@link AveragingMode#LINEAR}
 * mode every channel is raised to the power 2.2 first. The float scores only shortlist windows;
 * shortlisted windows are scored again in double precision from their 8-bit pixels, and those
 * within {@code tieTolerance} of the best exact score are reported as candidates. With tie
 * detection switched off only the first of them is kept.
 *
 * <p>Instances hold no mutable state; a {@link PreparedReference} can be shared by threads
 * matching different size groups.
 */
@Component
public class TemplateMatcher {
    private static final Logger log = LoggerFactory.getLogger(TemplateMatcher.class);

    public static final double DEFAULT_TIE_TOLERANCE = 1e-9;
    public static final int DEFAULT_MAX_CANDIDATES = 16;
    private static final double LINEAR_GAMMA = 2.2;

    /** Float scores within this distance of the minimum are re-scored exactly. */
    static final double SHORTLIST_MARGIN = 1e-4;
    static final int SHORTLIST_LIMIT = 256;

    private static final double[] GAMMA_TABLE = table(1.0);
    private static final double[] LINEAR_TABLE = table(LINEAR_GAMMA);

    static {
        try {
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV loaded successfully");
        } catch (Exception e) {
            log.error("Failed to load OpenCV", e);
        }
    }

    private final boolean detectTies;
    private final double tieTolerance;
    private final int maxCandidates;

    public TemplateMatcher() {
        this(true, DEFAULT_TIE_TOLERANCE, DEFAULT_MAX_CANDIDATES);
    }

    @Autowired
    public TemplateMatcher(@Value("${depix.matching.detect-ties:true}") boolean detectTies,
                           @Value("${depix.matching.tie-tolerance:1e-9}") double tieTolerance,
                           @Value("${depix.matching.max-candidates:16}") int maxCandidates) {
        if (tieTolerance < 0) {
            throw new IllegalArgumentException("Tie tolerance must not be negative: " + tieTolerance);
        }
        if (maxCandidates < 1) {
            throw new IllegalArgumentException("At least one candidate per block is required: " + maxCandidates);
        }
        this.detectTies = detectTies;
        this.tieTolerance = tieTolerance;
        this.maxCandidates = maxCandidates;
    }

    /** Converts the reference image once per run. */
    public PreparedReference prepare(PixelGrid reference, AveragingMode mode) {
        int[] rgb = reference.extract(Region.of(reference));
        return new PreparedReference(reference, mode, toFloatMat(rgb, reference.width(), reference.height(), mode));
    }

    /**
     * Matches all blocks of one size. Blocks that cannot be matched come back with no
     * candidates; the reason is logged on {@code runLog}.
     */
    public List<BlockMatch> matchGroup(BlockSize size, List<Block> blocks, PixelGrid pixelated,
                                       PreparedReference reference, Logger runLog) {
        runLog.debug("Processing block size {} ({} occurrences)", size, blocks.size());
        Mat search = reference.paddedFor(size);
        try {
            List<BlockMatch> matches = new ArrayList<>(blocks.size());
            for (Block block : blocks) {
                matches.add(matchBlock(block, pixelated, reference, search, runLog));
            }
            return matches;
        } finally {
            if (search != reference.mat()) {
                search.release();
            }
        }
    }

    public BlockMatch match(Block block, PixelGrid pixelated, PreparedReference reference, Logger runLog) {
        return matchGroup(block.size(), List.of(block), pixelated, reference, runLog).get(0);
    }

    private BlockMatch matchBlock(Block block, PixelGrid pixelated, PreparedReference reference,
                                 Mat search, Logger runLog) {
        try {
            int[] source = pixelated.extract(block.geometry());
            return new BlockMatch(block, findCandidates(block, source, reference, search));
        } catch (GeometryException e) {
            runLog.warn("Block at ({}, {}) skipped: {}", block.x(), block.y(), e.getMessage());
        } catch (RuntimeException e) {
            runLog.error("Error processing block at ({}, {}): {}", block.x(), block.y(), e.getMessage(), e);
        }
        return new BlockMatch(block, List.of());
    }

    private List<Candidate> findCandidates(Block block, int[] source, PreparedReference reference, Mat search) {
        final int w = block.width(), h = block.height();
        Mat template = toFloatMat(source, w, h, reference.mode());
        Mat result = new Mat();
        try {
            Imgproc.matchTemplate(search, template, result, Imgproc.TM_SQDIFF_NORMED);
            Core.MinMaxLocResult best = Core.minMaxLoc(result);
            int cols = result.cols();
            int bestIndex = (int) best.minLoc.y * cols + (int) best.minLoc.x;

            float[] scores = new float[cols * result.rows()];
            result.get(0, 0, scores);
            List<Integer> shortlist = shortlist(scores, bestIndex, best.minVal);

            // float scores only shortlist; the pixels decide which windows are really tied
            PixelGrid ref = reference.grid();
            double[] table = transferTable(reference.mode());
            List<Candidate> rescored = new ArrayList<>(shortlist.size());
            double minScore = Double.MAX_VALUE;
            for (int index : shortlist) {
                int mx = index % cols, my = index / cols;
                int[] content = ref.extractPadded(mx, my, w, h);
                double score = exactScore(source, content, table);
                rescored.add(new Candidate(mx, my, score, content));
                minScore = Math.min(minScore, score);
            }

            int limit = detectTies ? maxCandidates : 1;
            List<Candidate> candidates = new ArrayList<>();
            for (Candidate candidate : rescored) {
                if (candidate.score() <= minScore + tieTolerance) {
                    candidates.add(candidate);
                    if (candidates.size() == limit) break;
                }
            }
            return candidates;
        } finally {
            template.release();
            result.release();
        }
    }

    /**
     * Window indexes whose float score is close enough to the minimum to be re-checked: the
     * {@code minMaxLoc} location first, then the rest in row-major order.
     */
    private static List<Integer> shortlist(float[] scores, int bestIndex, double minVal) {
        double limit = minVal + SHORTLIST_MARGIN;
        List<Integer> near = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            if (i != bestIndex && scores[i] <= limit) {
                near.add(i);
            }
        }
        if (near.size() > SHORTLIST_LIMIT) {
            near.sort(Comparator.comparingDouble(i -> scores[i]));
            near = new ArrayList<>(near.subList(0, SHORTLIST_LIMIT));
            Collections.sort(near);
        }
        near.add(0, bestIndex);
        return near;
    }

    /**
     * Normalized squared difference in double precision, same definition as
     * {@code TM_SQDIFF_NORMED}. Identical pixels always score exactly 0.
     */
    static double exactScore(int[] template, int[] window, double[] table) {
        double diff = 0, templateEnergy = 0, windowEnergy = 0;
        for (int i = 0; i < template.length; i++) {
            for (int shift = 16; shift >= 0; shift -= 8) {
                double t = table[(template[i] >> shift) & 0xFF];
                double v = table[(window[i] >> shift) & 0xFF];
                diff += (t - v) * (t - v);
                templateEnergy += t * t;
                windowEnergy += v * v;
            }
        }
        if (diff == 0) {
            return 0;
        }
        double norm = Math.sqrt(templateEnergy * windowEnergy);
        return norm == 0 ? 1 : Math.min(1, diff / norm);
    }

    static double[] transferTable(AveragingMode mode) {
        return mode == AveragingMode.LINEAR ? LINEAR_TABLE : GAMMA_TABLE;
    }

    private static double[] table(double gamma) {
        double[] table = new double[256];
        for (int c = 0; c < 256; c++) {
            table[c] = Math.pow(c / 255.0, gamma);
        }
        return table;
    }

    static Mat toFloatMat(int[] rgb, int width, int height, AveragingMode mode) {
        float[] data = new float[rgb.length * 3];
        for (int i = 0; i < rgb.length; i++) {
            int p = rgb[i];
            data[3 * i] = ((p >> 16) & 0xFF) / 255f;
            data[3 * i + 1] = ((p >> 8) & 0xFF) / 255f;
            data[3 * i + 2] = (p & 0xFF) / 255f;
        }
        Mat mat = new Mat(height, width, CvType.CV_32FC3);
        mat.put(0, 0, data);
        if (mode == AveragingMode.LINEAR) {
            Core.pow(mat, LINEAR_GAMMA, mat);
        }
        return mat;
    }

    /**
     * Reference image converted for matching. Read-only after construction.
     */
    public static final class PreparedReference {
        private final PixelGrid grid;
        private final AveragingMode mode;
        private final Mat mat;

        PreparedReference(PixelGrid grid, AveragingMode mode, Mat mat) {
            this.grid = grid;
            this.mode = mode;
            this.mat = mat;
        }

        public PixelGrid grid() { return grid; }

        public AveragingMode mode() { return mode; }

        Mat mat() { return mat; }

        /** The reference extended with black on the right and bottom when it is smaller than the block. */
        Mat paddedFor(BlockSize size) {
            int padRight = Math.max(0, size.width() - mat.cols());
            int padBottom = Math.max(0, size.height() - mat.rows());
            if (padRight == 0 && padBottom == 0) {
                return mat;
            }
            Mat padded = new Mat();
            Core.copyMakeBorder(mat, padded, 0, padBottom, 0, padRight, Core.BORDER_CONSTANT, new Scalar(0, 0, 0));
            return padded;
        }

        public void release() {
            mat.release();
        }
    }
}
