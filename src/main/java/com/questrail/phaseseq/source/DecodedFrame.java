package com.questrail.phaseseq.source;

import com.questrail.phaseseq.api.Frame;

import java.util.Objects;

/**
 * Output of {@link FrameSource#decode}: the sample grid plus its file header.
 */
public record DecodedFrame(Frame frame, FrameHeader header) {
    public DecodedFrame {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(header, "header");
    }
}
