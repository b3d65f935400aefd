package com.questrail.phaseseq.registration;

import com.questrail.phaseseq.api.CancellationSignal;
import com.questrail.phaseseq.config.FijiRegistrationConfig;
import com.questrail.phaseseq.internal.time.MonotonicClock;
import com.questrail.phaseseq.internal.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * FijiRegistrationTool
 * =============================================================================
 * {@link RegistrationTool} that runs the "Linear Stack Alignment with SIFT"
 * macro in a separate Fiji process.
 *
 * <h2>Command line</h2>
 * <pre>
 *   executable [launcherOptions...] -macro macroFile in?out?log
 * </pre>
 * <p>The child's stdout and stderr are inherited so the tool's console output
 * appears live in the parent's output.</p>
 *
 * <h2>Time box and cancellation</h2>
 * <p>The worker waits in {@code pollInterval} slices until the process exits,
 * the configured timeout elapses, or the {@link CancellationSignal} fires. In
 * the last two cases the process tree is destroyed and a
 * {@link RegistrationException} is raised. There are no retries.</p>
 *
 * <h2>Postconditions</h2>
 * <p>A zero exit status is required, and the log (single runs) or every
 * aligned output (batched runs) must exist afterwards.</p>
 */
public final class FijiRegistrationTool implements RegistrationTool
{
    private static final Logger log = LoggerFactory.getLogger(FijiRegistrationTool.class);

    private final FijiRegistrationConfig config;
    private final MonotonicClock clock;

    public FijiRegistrationTool(FijiRegistrationConfig config)
    {
        this(config, SystemMonotonicClock.INSTANCE);
    }

    public FijiRegistrationTool(FijiRegistrationConfig config, MonotonicClock clock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void register(Path input, Path output, Path logFile, CancellationSignal cancellation)
    {
        run(config.macroFile(), RegistrationArguments.single(input, output, logFile), cancellation);
        if (!Files.isReadable(logFile)) {
            throw new RegistrationException("Registration finished without writing its log: " + logFile);
        }
        if (!Files.isRegularFile(output)) {
            throw new RegistrationException("Registration finished without writing the aligned stack: " + output);
        }
    }

    /**
     * Registers several stacks in one tool run using the batch macro.
     *
     * @throws RegistrationException if no batch macro is configured or the run fails
     */
    public void registerBatch(List<Path> inputs, List<Path> outputs, CancellationSignal cancellation)
    {
        if (config.batchMacroFile() == null) {
            throw new RegistrationException("No batch registration macro configured");
        }
        final String arguments;
        try {
            arguments = RegistrationArguments.batch(inputs, outputs);
        }
        catch (IOException e) {
            throw new RegistrationException("Cannot clear previous registration outputs", e);
        }
        run(config.batchMacroFile(), arguments, cancellation);
        for (Path output : outputs) {
            if (!Files.isRegularFile(output)) {
                throw new RegistrationException("Registration finished without writing " + output);
            }
        }
    }

    /**
     * Command line for one run; exposed for diagnostics.
     */
    public List<String> command(Path macro, String macroArguments)
    {
        final List<String> cmd = new ArrayList<>();
        cmd.add(config.executable().toString());
        cmd.addAll(config.launcherOptions());
        cmd.add("-macro");
        cmd.add(macro.toString());
        cmd.add(macroArguments);
        return cmd;
    }

    private void run(Path macro, String macroArguments, CancellationSignal cancellation)
    {
        if (!Files.isRegularFile(config.executable())) {
            throw new RegistrationException("Registration executable not found: " + config.executable());
        }
        if (!Files.isRegularFile(macro)) {
            throw new RegistrationException("Registration macro not found: " + macro);
        }

        final List<String> cmd = command(macro, macroArguments);
        log.info("Starting registration: {}", String.join(" ", cmd));

        final Process process;
        try {
            process = new ProcessBuilder(cmd).inheritIO().start();
        }
        catch (IOException e) {
            throw new RegistrationException("Cannot start registration process", e);
        }

        final Runnable destroyOnCancel = () -> destroy(process);
        cancellation.onCancel(destroyOnCancel);
        try {
            final int exit = awaitExit(process, cancellation);
            if (exit != 0) {
                throw new RegistrationException("Registration process exited with status " + exit);
            }
            log.info("Registration finished");
        }
        finally {
            cancellation.removeCallback(destroyOnCancel);
        }
    }

    private int awaitExit(Process process, CancellationSignal cancellation)
    {
        final long deadline = clock.nowNanos() + config.timeout().toNanos();
        final long sliceNanos = config.pollInterval().toNanos();
        try {
            while (true) {
                if (process.waitFor(sliceNanos, TimeUnit.NANOSECONDS)) {
                    if (cancellation.isCancelled()) {
                        throw new RegistrationException("Registration cancelled");
                    }
                    return process.exitValue();
                }
                if (cancellation.isCancelled()) {
                    destroy(process);
                    throw new RegistrationException("Registration cancelled");
                }
                if (clock.nowNanos() - deadline >= 0) {
                    destroy(process);
                    throw new RegistrationException("Registration exceeded its time box of " + config.timeout());
                }
            }
        }
        catch (InterruptedException e) {
            destroy(process);
            Thread.currentThread().interrupt();
            throw new RegistrationException("Interrupted while waiting for registration", e);
        }
    }

    private static void destroy(Process process)
    {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }
}
