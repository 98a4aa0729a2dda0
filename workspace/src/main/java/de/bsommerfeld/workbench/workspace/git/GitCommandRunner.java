package de.bsommerfeld.workbench.workspace.git;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.workbench.core.config.GlobalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a git command in a working directory and returns its standard output.
 *
 * <p>
 * Output is redirected to a temp file rather than read from the pipe, so the
 * timeout also covers a process that keeps writing. Standard error is merged
 * into the output and becomes part of the exception message on failure.
 */
@Singleton
public class GitCommandRunner {

    private static final Logger LOG = LoggerFactory.getLogger(GitCommandRunner.class);

    private final String executable;
    private final long timeoutSeconds;

    @Inject
    public GitCommandRunner(GlobalConfig config) {
        this(config.getGit().getExecutable(), config.getGit().getCommandTimeoutSeconds());
    }

    public GitCommandRunner(String executable, long timeoutSeconds) {
        this.executable = executable;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * @throws IOException      if the process cannot be started or exits non-zero
     * @throws TimeoutException     if it runs longer than the configured
     *                              timeout; the process is killed
     * @throws InterruptedException if the calling thread is interrupted while
     *                              waiting; the process is killed as well
     */
    public String run(Path workingDir, String... args) throws IOException, TimeoutException, InterruptedException {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add(executable);
        command.addAll(List.of(args));

        File output = File.createTempFile("workbench-git-", ".out");
        try {
            Process process = new ProcessBuilder(command)
                    .directory(workingDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(output)
                    .start();
            LOG.trace("Started {} in {}", command, workingDir);

            boolean finished;
            try {
                finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                process.destroyForcibly();
                throw new TimeoutException(
                        "git " + String.join(" ", args) + " timed out after " + timeoutSeconds + "s in " + workingDir);
            }

            String stdout = Files.readString(output.toPath(), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new IOException("git " + String.join(" ", args) + " exited with " + process.exitValue()
                        + " in " + workingDir + ": " + stdout.strip());
            }
            return stdout;
        } finally {
            Files.deleteIfExists(output.toPath());
        }
    }
}
