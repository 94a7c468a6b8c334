package com.project.image.depix.model;

import com.project.image.depix.exceptions.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class AveragingModeTest {

    @Test
    void fromName_acceptsCliAndEnumNames() {
        assertThat(AveragingMode.fromName("gammacorrected")).isEqualTo(AveragingMode.GAMMA_CORRECTED);
        assertThat(AveragingMode.fromName(" Linear ")).isEqualTo(AveragingMode.LINEAR);
        assertThat(AveragingMode.fromName("GAMMA_CORRECTED")).isEqualTo(AveragingMode.GAMMA_CORRECTED);
    }

    @Test
    void fromName_rejectsUnknownAndBlankNames() {
        assertThatThrownBy(() -> AveragingMode.fromName("cubic")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> AveragingMode.fromName("")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> AveragingMode.fromName("  ")).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> AveragingMode.fromName(null)).isInstanceOf(InvalidInputException.class);
    }
}
