package com.questrail.phaseseq.registration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the single macro argument handed to the registration macro.
 *
 * <p>The macro receives one string: groups separated by {@code ?}, paths within
 * a group separated by {@code *}. A single sequence is {@code in?out?log}; a
 * batch is {@code in1*in2*...?out1*out2*...}.</p>
 */
public final class RegistrationArguments
{
    public static final char GROUP_SEPARATOR = '?';
    public static final char PATH_SEPARATOR = '*';

    private RegistrationArguments() {}

    public static String single(Path input, Path output, Path log)
    {
        return join(List.of(input)) + GROUP_SEPARATOR + join(List.of(output)) + GROUP_SEPARATOR + join(List.of(log));
    }

    /**
     * Batched form. Existing outputs are deleted first so the tool never
     * refuses to overwrite or appends to a previous result.
     *
     * @throws IllegalArgumentException if the lists are empty or differ in length
     */
    public static String batch(List<Path> inputs, List<Path> outputs) throws IOException
    {
        if (inputs.isEmpty() || inputs.size() != outputs.size()) {
            throw new IllegalArgumentException("Expected matching, non-empty input and output lists, got "
                    + inputs.size() + " and " + outputs.size());
        }
        for (Path output : outputs) {
            Files.deleteIfExists(output);
        }
        return join(inputs) + GROUP_SEPARATOR + join(outputs);
    }

    private static String join(List<Path> paths)
    {
        return paths.stream()
                .map(RegistrationArguments::checked)
                .collect(Collectors.joining(String.valueOf(PATH_SEPARATOR)));
    }

    private static String checked(Path path)
    {
        final String text = path.toString();
        if (text.indexOf(GROUP_SEPARATOR) >= 0 || text.indexOf(PATH_SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Path contains a reserved separator character: " + text);
        }
        return text;
    }
}
