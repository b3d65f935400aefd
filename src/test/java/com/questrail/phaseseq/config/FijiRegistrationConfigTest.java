package com.questrail.phaseseq.config;

import com.questrail.phaseseq.validation.ValidationMode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class FijiRegistrationConfigTest
{
    @Test
    void builderAppliesDefaults()
    {
        FijiRegistrationConfig config = FijiRegistrationConfig.builder()
                .withExecutable(Path.of("fiji"))
                .withMacroFile(Path.of("sift.ijm"))
                .build();

        assertEquals(List.of("--console"), config.launcherOptions());
        assertEquals(FijiRegistrationConfig.DEFAULT_TIMEOUT, config.timeout());
        assertEquals(FijiRegistrationConfig.DEFAULT_POLL_INTERVAL, config.pollInterval());
        assertNull(config.batchMacroFile());
    }

    @Test
    void rejectsMissingPathsAndNonPositiveDurations()
    {
        assertThrows(NullPointerException.class, () -> FijiRegistrationConfig.builder()
                .withMacroFile(Path.of("sift.ijm")).build());
        assertThrows(IllegalArgumentException.class, () -> FijiRegistrationConfig.builder()
                .withExecutable(Path.of("fiji"))
                .withMacroFile(Path.of("sift.ijm"))
                .withTimeout(Duration.ZERO)
                .build());
    }

    @Test
    void pipelineDefaults()
    {
        PipelineConfig config = PipelineConfig.defaults();

        assertEquals(ValidationMode.FIRST_FRAME, config.validationMode());
        assertEquals(100f, config.rangeLimit());
        assertFalse(config.keepIntermediates());
        assertThrows(IllegalArgumentException.class,
                () -> PipelineConfig.builder().withRangeLimit(-1f).build());
    }
}
