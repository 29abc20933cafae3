package com.starsalign.imageAlignment;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class AlignmentStrategyTest {

    @Test
    void parsesNamesIgnoringCase() {
        assertThat(AlignmentStrategy.fromName("fast")).isEqualTo(AlignmentStrategy.FAST);
        assertThat(AlignmentStrategy.fromName(" Precise ")).isEqualTo(AlignmentStrategy.PRECISE);
    }

    @Test
    void rejectsUnknownNames() {
        assertThatIllegalArgumentException().isThrownBy(() -> AlignmentStrategy.fromName("accurate"))
                .withMessageContaining("accurate");
        assertThatIllegalArgumentException().isThrownBy(() -> AlignmentStrategy.fromName(""));
        assertThatIllegalArgumentException().isThrownBy(() -> AlignmentStrategy.fromName(null));
    }
}
