package com.questrail.phaseseq.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * FijiRegistrationConfig
 * -----------------------------------------------------------------------------
 * Location and time box of the external Fiji registration run.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>executable</b>: the Fiji/ImageJ launcher.</li>
 *   <li><b>macroFile</b>: SIFT macro taking {@code in?out?log}.</li>
 *   <li><b>batchMacroFile</b>: optional SIFT macro taking
 *       {@code in1*in2?out1*out2}; {@code null} disables batched runs.</li>
 *   <li><b>launcherOptions</b>: options placed before {@code -macro};
 *       {@code --console} routes the tool's output to the inherited stdout.</li>
 *   <li><b>timeout</b>: maximum run time; the process is destroyed after it.</li>
 *   <li><b>pollInterval</b>: how often the waiting worker checks for
 *       cancellation.</li>
 * </ul>
 */
public record FijiRegistrationConfig(
        Path executable,
        Path macroFile,
        Path batchMacroFile,
        List<String> launcherOptions,
        Duration timeout,
        Duration pollInterval
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);

    public FijiRegistrationConfig {
        Objects.requireNonNull(executable, "executable");
        Objects.requireNonNull(macroFile, "macroFile");
        Objects.requireNonNull(launcherOptions, "launcherOptions");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(pollInterval, "pollInterval");
        launcherOptions = List.copyOf(launcherOptions);

        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path executable;
        private Path macroFile;
        private Path batchMacroFile;
        private List<String> launcherOptions = List.of("--console");
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;

        public Builder withExecutable(Path executable) {
            this.executable = executable;
            return this;
        }

        public Builder withMacroFile(Path macroFile) {
            this.macroFile = macroFile;
            return this;
        }

        public Builder withBatchMacroFile(Path batchMacroFile) {
            this.batchMacroFile = batchMacroFile;
            return this;
        }

        public Builder withLauncherOptions(List<String> options) {
            this.launcherOptions = options;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public FijiRegistrationConfig build() {
            return new FijiRegistrationConfig(executable, macroFile, batchMacroFile,
                    launcherOptions, timeout, pollInterval);
        }
    }
}
