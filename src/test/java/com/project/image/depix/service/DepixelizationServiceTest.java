package com.project.image.depix.service;

import com.project.image.depix.DTOs.DepixelizationResult;
import com.project.image.depix.exceptions.InvalidInputException;
import com.project.image.depix.model.AveragingMode;
import com.project.image.depix.model.Block;
import com.project.image.depix.model.BlockMatch;
import com.project.image.depix.model.Candidate;
import com.project.image.depix.model.OutputCanvas;
import com.project.image.depix.model.PixelGrid;
import com.project.image.depix.model.PixelationMethod;
import com.project.image.depix.model.Region;
import com.project.image.depix.model.RgbColor;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.*;

class DepixelizationServiceTest {
    private static final RgbColor RED = new RgbColor(255, 0, 0);

    private final DepixelizationService service = new DepixelizationService();

    private static PixelGrid withSquare(int w, int h, int sx, int sy, int size, RgbColor square) {
        int[] rgb = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                boolean inside = x >= sx && x < sx + size && y >= sy && y < sy + size;
                rgb[y * w + x] = (inside ? square : RgbColor.WHITE).toRgb();
            }
        }
        return PixelGrid.of(w, h, rgb);
    }

    @Test
    void depixelize_redSquare_isRecoveredFromReference() {
        PixelGrid pixelated = withSquare(10, 10, 0, 0, 5, RED);
        PixelGrid reference = withSquare(20, 20, 3, 7, 5, RED);

        DepixelizationResult result = service.depixelize(pixelated, reference, AveragingMode.GAMMA_CORRECTED, null);

        assertThat(result.blocksFound()).isEqualTo(2);
        assertThat(result.blocksAfterFilter()).isEqualTo(1);
        assertThat(result.sizeVariants()).isEqualTo(1);
        assertThat(result.matched()).isEqualTo(1);
        assertThat(result.unmatched()).isZero();
        assertThat(result.direct()).isEqualTo(1);
        assertThat(result.averaged()).isZero();

        OutputCanvas out = result.canvas();
        assertThat(out.width()).isEqualTo(10);
        assertThat(out.height()).isEqualTo(10);
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 10; x++) {
                RgbColor expected = x < 5 && y < 5 ? RED : RgbColor.WHITE;
                assertThat(out.rgb(x, y)).as("pixel (%d,%d)", x, y).isEqualTo(expected.toRgb());
            }
        }

        TemplateMatcher matcher = new TemplateMatcher();
        TemplateMatcher.PreparedReference prepared = matcher.prepare(reference, AveragingMode.GAMMA_CORRECTED);
        BlockMatch match = matcher.match(Block.of(0, 0, 5, 5, RED), pixelated, prepared,
                LoggerFactory.getLogger(DepixelizationServiceTest.class));
        prepared.release();
        assertThat(match.candidates()).extracting(Candidate::mx, Candidate::my).containsExactly(tuple(3, 7));
        assertThat(match.candidates().get(0).score()).isZero();
    }

    @Test
    void depixelize_nearlyEqualNeighbours_keepTheirExactColors() {
        RgbColor light = new RgbColor(250, 250, 250);
        RgbColor lighter = new RgbColor(251, 250, 250);
        PixelGrid image = TemplateMatcherTest.halves(light, lighter);

        DepixelizationResult result = service.depixelize(image, image, AveragingMode.GAMMA_CORRECTED, null);

        assertThat(result.direct()).isEqualTo(2);
        assertThat(result.averaged()).isZero();
        assertThat(result.canvas().rgb(2, 2)).isEqualTo(light.toRgb());
        assertThat(result.canvas().rgb(7, 2)).isEqualTo(lighter.toRgb());
    }

    @Test
    void depixelize_tiedCandidates_areAveraged() {
        RgbColor gray = new RgbColor(100, 100, 100);
        RgbColor tinted = new RgbColor(90, 100, 100);
        PixelGrid pixelated = PixelGrid.filled(2, 1, gray);
        PixelGrid reference = PixelGrid.of(5, 1, new int[]{
                tinted.toRgb(), gray.toRgb(), RgbColor.BLACK.toRgb(), gray.toRgb(), tinted.toRgb()});

        DepixelizationResult result = service.depixelize(pixelated, reference, AveragingMode.GAMMA_CORRECTED, null);

        assertThat(result.averaged()).isEqualTo(1);
        assertThat(result.direct()).isZero();
        int expected = new RgbColor(95, 100, 100).toRgb();
        assertThat(result.canvas().rgb(0, 0)).isEqualTo(expected);
        assertThat(result.canvas().rgb(1, 0)).isEqualTo(expected);
    }

    @Test
    void depixelize_backgroundOnly_leavesImageUntouched() {
        RgbColor background = new RgbColor(40, 41, 35);
        PixelGrid pixelated = PixelGrid.filled(6, 6, background);

        DepixelizationResult result = service.depixelize(
                pixelated, PixelGrid.filled(8, 8, RED), AveragingMode.LINEAR, background);

        assertThat(result.blocksFound()).isEqualTo(1);
        assertThat(result.blocksAfterFilter()).isZero();
        assertThat(result.matched()).isZero();
        assertThat(result.canvas().toGrid().extract(Region.of(pixelated)))
                .containsOnly(background.toRgb());
    }

    @Test
    void depixelize_ownPixelationAsReference_recoversEveryBlock() {
        RgbColor[] bases = {
                new RgbColor(200, 60, 60), new RgbColor(60, 200, 60), new RgbColor(60, 60, 200), new RgbColor(200, 200, 60),
                new RgbColor(60, 200, 200), new RgbColor(200, 60, 200), new RgbColor(150, 100, 50), new RgbColor(50, 100, 150)};
        int w = 20, h = 10;
        int[] rgb = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                RgbColor base = bases[(y / 5) * 4 + x / 5];
                int shade = y % 5 == 0 ? 40 : 0;
                rgb[y * w + x] = new RgbColor(base.red() - shade, base.green() - shade, base.blue() - shade).toRgb();
            }
        }
        PixelGrid pixelated = new PixelationService().pixelate(PixelGrid.of(w, h, rgb), 5, PixelationMethod.GAMMA);
        assertThat(pixelated.color(0, 0)).isEqualTo(new RgbColor(192, 52, 52));

        DepixelizationResult sequential = new DepixelizationService(new BlockSegmenter(), new BlockFilter(),
                new TemplateMatcher(), new MatchResolver(), new Compositor(), false)
                .depixelize(pixelated, pixelated, AveragingMode.GAMMA_CORRECTED, null);
        DepixelizationResult parallel = service.depixelize(pixelated, pixelated, AveragingMode.GAMMA_CORRECTED, null);

        for (DepixelizationResult result : new DepixelizationResult[]{sequential, parallel}) {
            assertThat(result.blocksFound()).isEqualTo(8);
            assertThat(result.matched()).isEqualTo(8);
            assertThat(result.direct()).isEqualTo(8);
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    assertThat(result.canvas().rgb(x, y)).as("pixel (%d,%d)", x, y).isEqualTo(pixelated.rgb(x, y));
                }
            }
        }
    }

    @Test
    void depixelize_missingInputs_areRejected() {
        PixelGrid grid = PixelGrid.filled(2, 2, RED);

        assertThatThrownBy(() -> service.depixelize(null, grid, AveragingMode.LINEAR, null))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.depixelize(grid, null, AveragingMode.LINEAR, null))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.depixelize(grid, grid, null, null))
                .isInstanceOf(InvalidInputException.class);
    }
}
