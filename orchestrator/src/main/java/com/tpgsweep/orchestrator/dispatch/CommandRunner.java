package com.tpgsweep.orchestrator.dispatch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Runs a short-lived scheduler command (sbatch, sacct, scancel) and captures
 * its output.
 */
@FunctionalInterface
interface CommandRunner {

    record Result(int exitCode, String output) {
        boolean ok() { return exitCode == 0; }
    }

    Result run(List<String> command) throws IOException, InterruptedException;

    /** Runs the command as a local process, stderr merged into stdout. */
    static CommandRunner local() {
        return command -> {
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .start();
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            return new Result(process.waitFor(), output);
        };
    }
}
