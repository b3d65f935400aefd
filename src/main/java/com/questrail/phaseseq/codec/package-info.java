/**
 * Sequence Container Codec
 * =============================================================================
 *
 * <p>The container ({@code .bnr}) carries a whole registered phase sequence in
 * one flat little-endian file: seven header scalars, one timestamp per frame,
 * then every frame row-major. See {@link com.questrail.phaseseq.codec.SequenceContainerLayout}
 * for the byte offsets.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   aligned TIFF stack + timestamp table + acquisition metadata
 *        → SequenceContainerEncoder
 *            → .bnr container
 *                → SequenceContainerReader   (validation, inspection)
 * </pre>
 *
 * <p>This package holds the format description and the reader; the encoder
 * implementation lives in {@code codec.impl}.</p>
 */
package com.questrail.phaseseq.codec;
