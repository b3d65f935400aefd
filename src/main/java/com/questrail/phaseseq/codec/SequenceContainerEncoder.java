package com.questrail.phaseseq.codec;

import com.questrail.phaseseq.api.AcquisitionMetadata;
import com.questrail.phaseseq.api.ProgressListener;
import com.questrail.phaseseq.api.SequenceDecodeException;
import com.questrail.phaseseq.api.SequenceParseException;

import java.io.IOException;
import java.nio.file.Path;

/**
 * SequenceContainerEncoder
 * -----------------------------------------------------------------------------
 * Serializes an aligned image stack, its timestamp table and the acquisition
 * metadata into a sequence container (see {@link SequenceContainerLayout}).
 *
 * <p>The encoder is responsible only for:</p>
 * <ul>
 *   <li>Parsing the timestamp table</li>
 *   <li>Checking that the table and the stack describe the same number of frames</li>
 *   <li>Writing header, timestamps and frames in order</li>
 * </ul>
 *
 * <p>The encoder is <strong>not</strong> responsible for deleting the source
 * stack, confirming overwrites, or validating sample ranges.</p>
 */
public interface SequenceContainerEncoder
{
    /**
     * Encode {@code stack} into {@code destination}, truncating any existing file.
     *
     * @return the header that was written
     * @throws SequenceParseException  if the timestamp table is malformed or its
     *                                 row count differs from the stack's page count
     * @throws SequenceDecodeException if the stack cannot be read or has no pages
     * @throws IOException             if the destination cannot be written
     */
    SequenceContainerHeader encode(Path stack,
                                   Path timestampTable,
                                   AcquisitionMetadata metadata,
                                   Path destination,
                                   ProgressListener progress) throws IOException;
}
