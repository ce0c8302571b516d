package nl.bytesoflife.xdot.layout;

import nl.bytesoflife.xdot.parser.DotParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a Graphviz program ({@code dot}, {@code neato}, ...) with {@code -Txdot} as a subprocess.
 */
public class GraphvizLayoutEngine implements LayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(GraphvizLayoutEngine.class);

    public static final String DEFAULT_PROGRAM = "dot";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private static final Executor DEFAULT_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "graphviz-layout");
        thread.setDaemon(true);
        return thread;
    });

    private final String program;
    private final Duration timeout;
    private final Executor executor;

    public GraphvizLayoutEngine() {
        this(DEFAULT_PROGRAM, DEFAULT_TIMEOUT, DEFAULT_EXECUTOR);
    }

    public GraphvizLayoutEngine(String program, Duration timeout) {
        this(program, timeout, DEFAULT_EXECUTOR);
    }

    public GraphvizLayoutEngine(String program, Duration timeout, Executor executor) {
        this.program = program;
        this.timeout = timeout;
        this.executor = executor;
    }

    public String getProgram() {
        return program;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public CompletableFuture<AnnotatedLayout> layout(String dotSource) {
        CompletableFuture<AnnotatedLayout> future = new CompletableFuture<>();
        AtomicReference<Process> running = new AtomicReference<>();

        future.whenComplete((layout, error) -> {
            if (future.isCancelled()) {
                Process process = running.get();
                if (process != null) {
                    log.debug("Layout cancelled, destroying {}", program);
                    process.destroyForcibly();
                }
            }
        });

        executor.execute(() -> {
            if (future.isDone()) {
                return;
            }
            try {
                future.complete(run(dotSource, running, future));
            } catch (LayoutException | RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    private AnnotatedLayout run(String dotSource, AtomicReference<Process> running,
                                CompletableFuture<AnnotatedLayout> future) throws LayoutException {
        long startTime = System.currentTimeMillis();
        Path input = null;
        Path output = null;
        Path errors = null;
        try {
            input = Files.createTempFile("xdot-input", ".dot");
            output = Files.createTempFile("xdot-output", ".xdot");
            errors = Files.createTempFile("xdot-errors", ".txt");
            Files.writeString(input, dotSource, StandardCharsets.UTF_8);

            ProcessBuilder builder = new ProcessBuilder(program, "-Txdot")
                    .redirectInput(input.toFile())
                    .redirectOutput(output.toFile())
                    .redirectError(errors.toFile());

            Process process;
            try {
                process = builder.start();
            } catch (IOException e) {
                throw new LayoutException("Could not start layout program '" + program + "': " + e.getMessage(), e);
            }
            running.set(process);
            if (future.isCancelled()) {
                process.destroyForcibly();
            }

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new LayoutException(program + " did not finish within " + timeout.toSeconds() + "s");
            }

            String stderr = Files.readString(errors, StandardCharsets.UTF_8).trim();
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new LayoutException(program + " exited with code " + exitCode
                        + (stderr.isEmpty() ? "" : ": " + stderr));
            }
            if (!stderr.isEmpty()) {
                log.warn("{}: {}", program, stderr);
            }

            String xdot = Files.readString(output, StandardCharsets.UTF_8);
            log.info("{} finished in {}ms ({} bytes)", program, System.currentTimeMillis() - startTime, xdot.length());
            try {
                return new DotParser().parse(xdot);
            } catch (DotParser.ParseException e) {
                throw new LayoutException("Unreadable output from " + program + ": " + e.getMessage(), e);
            }
        } catch (IOException e) {
            throw new LayoutException("I/O error running " + program + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LayoutException("Interrupted while waiting for " + program, e);
        } finally {
            delete(input);
            delete(output);
            delete(errors);
        }
    }

    private static void delete(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}", path, e);
        }
    }
}
