package com.project.image.depix.model;

import com.project.image.depix.exceptions.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RgbColorTest {

    @Test
    void parse_acceptsCommaSeparatedChannels() {
        assertThat(RgbColor.parse("255,0,0")).isEqualTo(new RgbColor(255, 0, 0));
        assertThat(RgbColor.parse("128, 128, 128")).isEqualTo(new RgbColor(128, 128, 128));
        assertThat(RgbColor.parse(" 40,41 ,35 ")).isEqualTo(new RgbColor(40, 41, 35));
    }

    @Test
    void parse_rejectsWrongFieldCount() {
        assertThatThrownBy(() -> RgbColor.parse("255,0")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> RgbColor.parse("1,2,3,4")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> RgbColor.parse("invalid")).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void parse_rejectsOutOfRangeAndNonNumericChannels() {
        assertThatThrownBy(() -> RgbColor.parse("256,0,0"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> RgbColor.parse("-1,0,0")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> RgbColor.parse("a,b,c")).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void hexConversion_worksBothWays() {
        assertThat(new RgbColor(255, 0, 0).toHex()).isEqualTo("#ff0000");
        assertThat(new RgbColor(128, 128, 128).toHex()).isEqualTo("#808080");
        assertThat(RgbColor.fromHex("#0000ff")).isEqualTo(new RgbColor(0, 0, 255));
        assertThat(RgbColor.fromHex("00ff00")).isEqualTo(new RgbColor(0, 255, 0));
        assertThatThrownBy(() -> RgbColor.fromHex("#ff")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> RgbColor.fromHex("zzzzzz")).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void distanceAndSimilarity() {
        assertThat(new RgbColor(255, 0, 0).distanceTo(new RgbColor(255, 0, 0))).isZero();
        assertThat(new RgbColor(255, 0, 0).distanceTo(RgbColor.BLACK)).isEqualTo(255.0);
        assertThat(RgbColor.BLACK.distanceTo(new RgbColor(3, 4, 0))).isEqualTo(5.0);

        assertThat(new RgbColor(255, 0, 0).isSimilarTo(new RgbColor(250, 0, 0))).isTrue();
        assertThat(new RgbColor(255, 0, 0).isSimilarTo(new RgbColor(0, 0, 255))).isFalse();
        assertThat(new RgbColor(100, 100, 100).isSimilarTo(new RgbColor(110, 110, 110), 20)).isTrue();
        assertThat(new RgbColor(100, 100, 100).isSimilarTo(new RgbColor(150, 150, 150), 20)).isFalse();
    }

    @Test
    void packedRgb_roundTrips() {
        RgbColor color = new RgbColor(12, 34, 56);
        assertThat(color.toRgb()).isEqualTo(0x0C2238);
        assertThat(RgbColor.fromRgb(0xFF0C2238)).isEqualTo(color);
    }
}
