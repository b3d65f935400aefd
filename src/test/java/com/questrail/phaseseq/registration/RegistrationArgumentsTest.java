package com.questrail.phaseseq.registration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RegistrationArgumentsTest
{
    @TempDir
    Path dir;

    @Test
    void singleJoinsGroupsWithQuestionMark()
    {
        Path in = dir.resolve("a.tif");
        Path out = dir.resolve("a_aligned.tif");
        Path log = dir.resolve("log.txt");

        assertEquals(in + "?" + out + "?" + log, RegistrationArguments.single(in, out, log));
    }

    @Test
    void batchJoinsPathsWithStarAndClearsOutputs() throws Exception
    {
        Path in1 = dir.resolve("1.tif");
        Path in2 = dir.resolve("2.tif");
        Path out1 = Files.writeString(dir.resolve("1_aligned.tif"), "old");
        Path out2 = dir.resolve("2_aligned.tif");

        String args = RegistrationArguments.batch(List.of(in1, in2), List.of(out1, out2));

        assertEquals(in1 + "*" + in2 + "?" + out1 + "*" + out2, args);
        assertFalse(Files.exists(out1));
    }

    @Test
    void batchRejectsMismatchedLists()
    {
        assertThrows(IllegalArgumentException.class,
                () -> RegistrationArguments.batch(List.of(dir.resolve("1.tif")), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> RegistrationArguments.batch(List.of(), List.of()));
    }

    @Test
    void separatorCharactersInPathsAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> RegistrationArguments.single(
                Path.of("what*.tif"), dir.resolve("o.tif"), dir.resolve("l.txt")));
    }
}
