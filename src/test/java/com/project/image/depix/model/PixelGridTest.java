package com.project.image.depix.model;

import com.project.image.depix.exceptions.GeometryException;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.*;

class PixelGridTest {

    @Test
    void fromImage_dropsAlphaForColorReads() {
        BufferedImage img = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
        img.setRGB(0, 0, 0x80FF0000);
        img.setRGB(1, 0, 0xFF00FF00);

        PixelGrid grid = PixelGrid.fromImage(img);

        assertThat(grid.hasAlpha()).isTrue();
        assertThat(grid.imageType()).isEqualTo(BufferedImage.TYPE_INT_ARGB);
        assertThat(grid.rgb(0, 0)).isEqualTo(0xFF0000);
        assertThat(grid.color(1, 0)).isEqualTo(new RgbColor(0, 255, 0));
    }

    @Test
    void extract_readsRowMajorAndRejectsOutOfBounds() {
        PixelGrid grid = PixelGrid.of(3, 2, new int[]{1, 2, 3, 4, 5, 6});

        assertThat(grid.extract(new Region(1, 0, 2, 2))).containsExactly(2, 3, 5, 6);
        assertThatThrownBy(() -> grid.extract(new Region(2, 1, 2, 1))).isInstanceOf(GeometryException.class);
        assertThatThrownBy(() -> grid.rgb(3, 0)).isInstanceOf(GeometryException.class);
    }

    @Test
    void extractPadded_fillsOutsideWithBlack() {
        PixelGrid grid = PixelGrid.filled(2, 2, new RgbColor(9, 9, 9));

        assertThat(grid.extractPadded(1, 1, 2, 2)).containsExactly(0x090909, 0, 0, 0);
    }

    @Test
    void outputCanvas_keepsAlphaAndDoesNotTouchSource() {
        BufferedImage img = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        img.setRGB(0, 0, 0x40102030);
        PixelGrid source = PixelGrid.fromImage(img);

        OutputCanvas canvas = OutputCanvas.copyOf(source);
        canvas.setRgb(0, 0, 0xABCDEF);

        assertThat(canvas.rgb(0, 0)).isEqualTo(0xABCDEF);
        assertThat(canvas.toGrid().argb(0, 0)).isEqualTo(0x40ABCDEF);
        assertThat(source.rgb(0, 0)).isEqualTo(0x102030);
    }
}
