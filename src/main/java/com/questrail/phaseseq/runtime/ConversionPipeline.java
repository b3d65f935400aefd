package com.questrail.phaseseq.runtime;

import com.questrail.phaseseq.api.AcquisitionMetadata;
import com.questrail.phaseseq.api.CancellationSignal;
import com.questrail.phaseseq.codec.SequenceContainerEncoder;
import com.questrail.phaseseq.codec.SequenceContainerHeader;
import com.questrail.phaseseq.codec.impl.DefaultSequenceContainerEncoder;
import com.questrail.phaseseq.config.PipelineConfig;
import com.questrail.phaseseq.internal.time.MonotonicClock;
import com.questrail.phaseseq.internal.time.SystemMonotonicClock;
import com.questrail.phaseseq.internal.time.SystemWallClock;
import com.questrail.phaseseq.internal.time.WallClock;
import com.questrail.phaseseq.observability.NullObservabilitySink;
import com.questrail.phaseseq.observability.PipelineErrorEvent;
import com.questrail.phaseseq.observability.PipelineObservabilitySink;
import com.questrail.phaseseq.observability.PipelineStageEvent;
import com.questrail.phaseseq.observability.SequenceSkippedEvent;
import com.questrail.phaseseq.registration.RegistrationLogTranslator;
import com.questrail.phaseseq.registration.RegistrationShift;
import com.questrail.phaseseq.registration.RegistrationTool;
import com.questrail.phaseseq.source.BinFrameListing;
import com.questrail.phaseseq.source.FrameSource;
import com.questrail.phaseseq.source.KoalaBinFrameSource;
import com.questrail.phaseseq.stack.SequenceCompositor;
import com.questrail.phaseseq.validation.ContainerValidator;
import com.questrail.phaseseq.validation.RangeViolation;
import com.questrail.phaseseq.validation.ValidationReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

/**
 * ConversionPipeline
 * =============================================================================
 * Runs the conversion of phase-frame folders into sequence containers.
 *
 * <h2>Stages</h2>
 * <pre>
 *   frame folder
 *        → SequenceCompositor          (composed stack)
 *        → RegistrationTool            (aligned stack + log)
 *        → RegistrationLogTranslator   (shift report, composed stack removed)
 *        → SequenceContainerEncoder    (container, aligned stack removed)
 *        → ContainerValidator          (range check)
 * </pre>
 *
 * <h2>Execution model</h2>
 * <p>All stages run on the calling thread, strictly one after another, one
 * frame at a time. The pipeline holds no lock on its files; callers must not
 * start two runs concurrently (see {@link PipelineRunner}).</p>
 *
 * <h2>Failures</h2>
 * <p>Decode, parse, registration and I/O failures abort the run at once and are
 * rethrown as {@link PipelineStageException} naming the stage and artifact.
 * There are no retries. Range violations do not abort a run; they are reported
 * to the observability sink and returned in the report.</p>
 *
 * <h2>Overwrites</h2>
 * <p>Existing outputs are never replaced without a positive answer from the
 * {@link OverwriteConfirmation} passed to each operation.</p>
 */
public final class ConversionPipeline
{
    @FunctionalInterface
    private interface StageAction<T>
    {
        T run() throws IOException;
    }

    private final FrameSource source;
    private final SequenceCompositor compositor;
    private final RegistrationTool registrationTool;
    private final RegistrationLogTranslator translator;
    private final SequenceContainerEncoder encoder;
    private final ContainerValidator validator;
    private final PipelineConfig config;
    private final PipelineObservabilitySink observabilitySink;
    private final ProgressDispatcher progress;
    private final MonotonicClock clock;
    private final WallClock wallClock;

    private ConversionPipeline(Builder b)
    {
        this.source = b.source;
        this.compositor = new SequenceCompositor(b.source);
        this.registrationTool = b.registrationTool;
        this.translator = new RegistrationLogTranslator();
        this.encoder = b.encoder;
        this.validator = ContainerValidator.from(b.config);
        this.config = b.config;
        this.observabilitySink = b.observabilitySink;
        this.progress = b.progress;
        this.clock = b.clock;
        this.wallClock = b.wallClock;
    }

    public PipelineConfig config()
    {
        return config;
    }

    /**
     * Pixel size recorded in the header of the first frame of {@code frameFolder}.
     */
    public float detectPixelSize(Path frameFolder) throws IOException
    {
        final List<Path> frames = BinFrameListing.list(frameFolder);
        return source.readPixelSize(frames.get(0));
    }

    /**
     * Converts one sequence end to end and validates its container.
     */
    public ConversionReport run(SequenceJob job, OverwriteConfirmation confirmation, CancellationSignal cancellation)
    {
        if (!confirmed(job.outputs(), confirmation)) {
            return ConversionReport.declined(job);
        }
        final ConversionReport converted = convert(job, cancellation);
        final ValidationReport validation = validate(job.name(), job.container(), cancellation);
        progress.message("Sequence " + job.name() + " done.");
        return converted.withValidation(validation);
    }

    /**
     * Converts several sequences one after another, then validates every
     * container. Overwrite confirmation is asked once for all jobs. A job whose
     * frame folder is missing is skipped and the batch goes on with the rest.
     */
    public BatchConversionReport runBatch(List<SequenceJob> jobs,
                                          OverwriteConfirmation confirmation,
                                          CancellationSignal cancellation)
    {
        final List<Path> outputs = jobs.stream()
                .flatMap(job -> job.outputs().stream())
                .collect(Collectors.toList());
        if (!confirmed(outputs, confirmation)) {
            return new BatchConversionReport(ConversionOutcome.DECLINED,
                    jobs.stream().map(ConversionReport::declined).toList(), List.of());
        }

        final List<ConversionReport> converted = new ArrayList<>();
        for (SequenceJob job : jobs) {
            if (Files.isDirectory(job.frameFolder())) {
                converted.add(convert(job, cancellation));
            }
            else {
                converted.add(skip(job));
            }
        }
        progress.message("File conversion and image alignment done.");

        final List<ConversionReport> reports = new ArrayList<>();
        final List<RangeViolation> violations = new ArrayList<>();
        for (ConversionReport report : converted) {
            if (report.outcome() == ConversionOutcome.SKIPPED) {
                reports.add(report);
                continue;
            }
            final ValidationReport validation = validate(report.job().name(), report.job().container(), cancellation);
            validation.violation().ifPresent(violations::add);
            reports.add(report.withValidation(validation));
        }
        progress.message("Checking sequence containers done.");
        return new BatchConversionReport(ConversionOutcome.COMPLETED, reports, violations);
    }

    /**
     * Only composes {@code frameFolder} into a stack.
     *
     * @return the page count, or empty if the overwrite was declined
     */
    public Optional<Integer> composeOnly(Path frameFolder, Path destination, OverwriteConfirmation confirmation)
    {
        if (!confirmed(List.of(destination), confirmation)) {
            return Optional.empty();
        }
        final String name = frameFolder.getFileName().toString();
        return Optional.of(stage(name, PipelineStage.COMPOSE, destination, CancellationSignal.none(),
                () -> compositor.composeFolder(frameFolder, destination, progress.forStage(PipelineStage.COMPOSE))));
    }

    /**
     * Only registers {@code stack} and rewrites the registration log.
     *
     * @return the shifts, or empty if the overwrite was declined
     */
    public Optional<List<RegistrationShift>> registerOnly(Path stack,
                                                          Path alignedStack,
                                                          Path registrationLog,
                                                          OverwriteConfirmation confirmation,
                                                          CancellationSignal cancellation)
    {
        if (!confirmed(List.of(alignedStack), confirmation)) {
            return Optional.empty();
        }
        final String name = stack.getFileName().toString();
        register(name, stack, alignedStack, registrationLog, cancellation);
        return Optional.of(stage(name, PipelineStage.TRANSLATE_LOG, registrationLog, cancellation,
                () -> translator.translate(registrationLog)));
    }

    /**
     * Only encodes an aligned stack into a container; the stack is kept.
     *
     * @return the written header, or empty if the overwrite was declined
     */
    public Optional<SequenceContainerHeader> encodeOnly(Path alignedStack,
                                                        Path timestampTable,
                                                        AcquisitionMetadata metadata,
                                                        Path container,
                                                        OverwriteConfirmation confirmation)
    {
        if (!confirmed(List.of(container), confirmation)) {
            return Optional.empty();
        }
        final String name = alignedStack.getFileName().toString();
        return Optional.of(stage(name, PipelineStage.ENCODE, container, CancellationSignal.none(),
                () -> encoder.encode(alignedStack, timestampTable, metadata, container,
                        progress.forStage(PipelineStage.ENCODE))));
    }

    /**
     * Validates an existing container.
     */
    public ValidationReport validateOnly(Path container)
    {
        return validate(container.getFileName().toString(), container, CancellationSignal.none());
    }

    private ConversionReport convert(SequenceJob job, CancellationSignal cancellation)
    {
        final String name = job.name();

        stage(name, PipelineStage.COMPOSE, job.composedStack(), cancellation,
                () -> compositor.composeFolder(job.frameFolder(), job.composedStack(),
                        progress.forStage(PipelineStage.COMPOSE)));

        register(name, job.composedStack(), job.alignedStack(), job.registrationLog(), cancellation);

        final List<RegistrationShift> shifts = stage(name, PipelineStage.TRANSLATE_LOG, job.registrationLog(),
                cancellation, () -> {
                    final List<RegistrationShift> result = translator.translate(job.registrationLog());
                    discard(job.composedStack());
                    return result;
                });

        final SequenceContainerHeader header = stage(name, PipelineStage.ENCODE, job.container(), cancellation,
                () -> {
                    final SequenceContainerHeader written = encoder.encode(job.alignedStack(), job.timestampTable(),
                            job.metadata(), job.container(), progress.forStage(PipelineStage.ENCODE));
                    discard(job.alignedStack());
                    return written;
                });

        return new ConversionReport(job, ConversionOutcome.COMPLETED, Optional.of(header), shifts, Optional.empty());
    }

    private ConversionReport skip(SequenceJob job)
    {
        observabilitySink.onSequenceSkipped(
                new SequenceSkippedEvent(wallClock.now(), job.name(), job.frameFolder()));
        progress.message("Files missing for well " + job.name());
        return ConversionReport.skipped(job);
    }

    private void register(String name, Path input, Path aligned, Path registrationLog, CancellationSignal cancellation)
    {
        stage(name, PipelineStage.REGISTER, aligned, cancellation, () -> {
            Files.deleteIfExists(aligned);
            registrationTool.register(input, aligned, registrationLog, cancellation);
            return null;
        });
    }

    private ValidationReport validate(String name, Path container, CancellationSignal cancellation)
    {
        final ValidationReport report = stage(name, PipelineStage.VALIDATE, container, cancellation,
                () -> validator.validate(container));
        report.violation().ifPresent(v -> {
            observabilitySink.onRangeViolation(v);
            progress.message("Problem with sequence container " + container.getFileName());
        });
        return report;
    }

    private void discard(Path intermediate) throws IOException
    {
        if (!config.keepIntermediates()) {
            Files.deleteIfExists(intermediate);
        }
    }

    private boolean confirmed(List<Path> outputs, OverwriteConfirmation confirmation)
    {
        final List<Path> existing = new ArrayList<>();
        for (Path output : outputs) {
            if (Files.exists(output)) {
                existing.add(output);
            }
        }
        if (existing.isEmpty()) {
            return true;
        }
        final boolean confirmed = Objects.requireNonNull(confirmation, "confirmation").confirmOverwrite(existing);
        if (!confirmed) {
            progress.message("Existing output files kept; nothing was converted.");
        }
        return confirmed;
    }

    private <T> T stage(String name, PipelineStage stage, Path artifact, CancellationSignal cancellation,
                        StageAction<T> action)
    {
        if (cancellation.isCancelled()) {
            throw failed(name, stage, artifact, new CancellationException("Run cancelled before " + stage));
        }
        progress.message(stage.description() + "...");
        observabilitySink.onStageStarted(
                new PipelineStageEvent(wallClock.now(), name, stage, artifact, Duration.ZERO));
        final long started = clock.nowNanos();
        try {
            final T result = action.run();
            observabilitySink.onStageCompleted(new PipelineStageEvent(wallClock.now(), name, stage, artifact,
                    Duration.ofNanos(clock.nowNanos() - started)));
            return result;
        }
        catch (IOException | RuntimeException e) {
            throw failed(name, stage, artifact, e);
        }
    }

    private PipelineStageException failed(String name, PipelineStage stage, Path artifact, Exception cause)
    {
        observabilitySink.onError(new PipelineErrorEvent(wallClock.now(), name, stage, cause.getMessage(), cause));
        return new PipelineStageException(stage, artifact, cause);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private FrameSource source = new KoalaBinFrameSource();
        private RegistrationTool registrationTool;
        private SequenceContainerEncoder encoder = new DefaultSequenceContainerEncoder();
        private PipelineConfig config = PipelineConfig.defaults();
        private PipelineObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private ProgressDispatcher progress = ProgressDispatcher.NONE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withFrameSource(FrameSource source)
        {
            this.source = source;
            return this;
        }

        public Builder withRegistrationTool(RegistrationTool tool)
        {
            this.registrationTool = tool;
            return this;
        }

        public Builder withEncoder(SequenceContainerEncoder encoder)
        {
            this.encoder = encoder;
            return this;
        }

        public Builder withConfig(PipelineConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(PipelineObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withProgressDispatcher(ProgressDispatcher progress)
        {
            this.progress = progress;
            return this;
        }

        public Builder withClock(MonotonicClock clock)
        {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        public ConversionPipeline build()
        {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(registrationTool, "registrationTool");
            Objects.requireNonNull(encoder, "encoder");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(progress, "progress");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            return new ConversionPipeline(this);
        }
    }
}
