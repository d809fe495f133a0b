package imagecorpus.reorganizer;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Delegates each transfer to an external utility such as {@code rsync -a} or {@code cp -p}, run as
 * {@code <command...> -- <source> <destination>}. A non-zero exit status fails the job with the
 * tool's output as the message.
 */
public final class ExternalToolStrategy implements TransferStrategy {

    private static final int MAX_OUTPUT_CHARS = 500;

    private final String name;
    private final List<String> command;

    public ExternalToolStrategy(String name, List<String> command) {
        if (command.isEmpty()) throw new IllegalArgumentException("command must not be empty");
        this.name = name;
        this.command = List.copyOf(command);
    }

    public static ExternalToolStrategy rsync() {
        return new ExternalToolStrategy("rsync", List.of("rsync", "-a"));
    }

    public static ExternalToolStrategy cp() {
        return new ExternalToolStrategy("cp", List.of("cp", "-p"));
    }

    @Override
    public String name() {
        return name;
    }

    List<String> commandFor(Path source, Path destination) {
        List<String> cmd = new ArrayList<>(command);
        cmd.add("--");
        cmd.add(source.toString());
        cmd.add(destination.toString());
        return cmd;
    }

    @Override
    public void transfer(Path source, Path destination) throws IOException {
        ToolResult result = run(commandFor(source, destination));
        if (result.exit != 0) {
            throw new IOException(name + " exited with " + result.exit + " for " + source
                + (result.output.isEmpty() ? "" : ": " + result.output));
        }
    }

    private static ToolResult run(List<String> cmd) throws IOException {
        Process process = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        try (InputStream out = process.getInputStream()) {
            String output = new String(out.readAllBytes(), StandardCharsets.UTF_8).trim();
            if (output.length() > MAX_OUTPUT_CHARS) {
                output = output.substring(0, MAX_OUTPUT_CHARS) + "...";
            }
            return new ToolResult(process.waitFor(), output);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while running " + cmd.get(0));
        }
    }

    /** Runs the tool with {@code --version} to make sure it is installed. */
    @Override
    public void verify() throws IOException {
        ToolResult result;
        try {
            result = run(List.of(command.get(0), "--version"));
        } catch (IOException e) {
            throw new IOException("Transfer tool '" + command.get(0) + "' is not available: " + e.getMessage(), e);
        }
        if (result.exit != 0) {
            throw new IOException("Transfer tool '" + command.get(0) + "' is not usable (exit " + result.exit + ")");
        }
    }

    private static final class ToolResult {
        final int exit;
        final String output;

        ToolResult(int exit, String output) {
            this.exit = exit;
            this.output = output;
        }
    }
}
