package com.questrail.phaseseq.validation;

import com.questrail.phaseseq.api.SequenceDecodeException;
import com.questrail.phaseseq.config.PipelineConfig;
import com.questrail.phaseseq.support.ContainerFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ContainerValidatorTest
 * -----------------------------------------------------------------------------
 * Range checks of encoded containers.
 */
final class ContainerValidatorTest
{
    private final ContainerValidator validator = new ContainerValidator();

    @TempDir
    Path dir;

    @Test
    void frameWithinRangePasses() throws Exception
    {
        Path file = ContainerFiles.write(dir.resolve("ok.bnr"), 2, 2, new float[] { 0f },
                new float[] { -3.1f, 0f, 1.5f, 3.1f });

        ValidationReport report = validator.validate(file);

        assertFalse(report.hasViolation());
        assertEquals(-3.1f, report.min());
        assertEquals(3.1f, report.max());
        assertEquals(1, report.framesScanned());
        assertEquals(2, report.firstFrame().width());
    }

    @Test
    void sampleAboveLimitIsViolation() throws Exception
    {
        Path file = ContainerFiles.write(dir.resolve("bad.bnr"), 2, 1, new float[] { 0f },
                new float[] { 150f, 0f });

        ValidationReport report = validator.validate(file);

        RangeViolation violation = report.violation().orElseThrow();
        assertEquals(150f, violation.max());
        assertEquals(0, violation.frameIndex());
        assertEquals(file, violation.container());
        assertTrue(violation.describe().contains("bad.bnr"));
    }

    @Test
    void sampleBelowNegativeLimitIsViolation() throws Exception
    {
        Path file = ContainerFiles.write(dir.resolve("low.bnr"), 1, 1, new float[] { 0f }, new float[] { -100.5f });

        assertTrue(validator.validate(file).hasViolation());
    }

    @Test
    void limitItselfIsInRange() throws Exception
    {
        Path file = ContainerFiles.write(dir.resolve("edge.bnr"), 2, 1, new float[] { 0f },
                new float[] { -100f, 100f });

        assertFalse(validator.validate(file).hasViolation());
    }

    @Test
    void nanSampleIsViolation() throws Exception
    {
        Path file = ContainerFiles.write(dir.resolve("nan.bnr"), 2, 1, new float[] { 0f },
                new float[] { Float.NaN, 1f });

        assertTrue(validator.validate(file).hasViolation());
    }

    @Test
    void firstFrameModeIgnoresLaterFrames() throws Exception
    {
        Path file = ContainerFiles.write(dir.resolve("later.bnr"), 1, 1, new float[] { 0f, 1f },
                new float[] { 1f }, new float[] { 500f });

        ValidationReport report = validator.validate(file);

        assertFalse(report.hasViolation());
        assertEquals(1, report.framesScanned());
    }

    @Test
    void fullScanFindsViolationInLaterFrame() throws Exception
    {
        Path file = ContainerFiles.write(dir.resolve("later.bnr"), 1, 1, new float[] { 0f, 1f, 2f },
                new float[] { 1f }, new float[] { 2f }, new float[] { 500f });
        ContainerValidator fullScan = ContainerValidator.from(
                PipelineConfig.builder().withValidationMode(ValidationMode.FULL_SCAN).build());

        ValidationReport report = fullScan.validate(file);

        assertEquals(3, report.framesScanned());
        assertEquals(2, report.violation().orElseThrow().frameIndex());
        assertEquals(500f, report.max());
    }

    @Test
    void customLimitIsHonoured() throws Exception
    {
        Path file = ContainerFiles.write(dir.resolve("c.bnr"), 1, 1, new float[] { 0f }, new float[] { 5f });

        assertTrue(new ContainerValidator(ValidationMode.FIRST_FRAME, 4f).validate(file).hasViolation());
    }

    @Test
    void containerWithoutFramesIsDecodeError() throws Exception
    {
        Path file = ContainerFiles.write(dir.resolve("empty.bnr"), 2, 2, new float[0]);

        assertThrows(SequenceDecodeException.class, () -> validator.validate(file));
    }

    @Test
    void nonPositiveLimitIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new ContainerValidator(ValidationMode.FIRST_FRAME, 0f));
    }
}
