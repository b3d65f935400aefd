/**
 * Sequence Container Codec Implementation
 * =============================================================================
 *
 * <pre>
 *   timestamps.txt  → TimestampTableParser   (column 3, one row per frame)
 *   aligned stack   → PageStack              (one page in memory at a time)
 *                   → DefaultSequenceContainerEncoder
 *                   → header, timestamps, frames
 * </pre>
 *
 * <p>Inputs are parsed and cross-checked before the destination is opened, so
 * a malformed table never leaves a half-written container behind.</p>
 */
package com.questrail.phaseseq.codec.impl;
