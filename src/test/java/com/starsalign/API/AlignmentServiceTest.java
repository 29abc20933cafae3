package com.starsalign.API;

import com.starsalign.imageAlignment.AlignmentStrategy;
import com.starsalign.imageOperator.CodecRoundTripChannelAdapter;
import com.starsalign.imageOperator.DirectChannelAdapter;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class AlignmentServiceTest {

    private static AlignmentService service(String defaultStrategy, String scratch) {
        StarsAlignProperties properties = new StarsAlignProperties();
        properties.setDefaultStrategy(defaultStrategy);
        properties.setScratchDirectory(scratch);
        return new AlignmentService(properties);
    }

    @Test
    void blankStrategyFallsBackToConfiguredDefault() {
        AlignmentService service = service("precise", "");

        assertThat(service.resolveStrategy(null)).isEqualTo(AlignmentStrategy.PRECISE);
        assertThat(service.resolveStrategy(" ")).isEqualTo(AlignmentStrategy.PRECISE);
        assertThat(service.resolveStrategy("FAST")).isEqualTo(AlignmentStrategy.FAST);
        assertThatIllegalArgumentException().isThrownBy(() -> service.resolveStrategy("slow"));
    }

    @Test
    void strategiesSelectTheirChannelAdapter() {
        AlignmentService service = service("fast", "/var/tmp/starsalign");

        assertThat(service.aligner(AlignmentStrategy.FAST).getChannelAdapter()).isInstanceOf(DirectChannelAdapter.class);
        assertThat(service.aligner(AlignmentStrategy.PRECISE).getChannelAdapter())
                .isInstanceOfSatisfying(CodecRoundTripChannelAdapter.class,
                        adapter -> assertThat(adapter.getScratchDirectory()).isEqualTo(Paths.get("/var/tmp/starsalign")));
    }
}
