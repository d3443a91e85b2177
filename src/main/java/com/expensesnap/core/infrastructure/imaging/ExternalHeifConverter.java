package com.expensesnap.core.infrastructure.imaging;

import com.expensesnap.core.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Decodes HEIC/HEIF through an external command line converter (libheif's
 * {@code heif-convert} by default). The command is read from
 * {@code app.normalizer.heic-command}; {@code {input}} and {@code {output}} are replaced with
 * temporary file paths and the process is killed after {@code app.normalizer.heic-timeout}.
 */
class ExternalHeifConverter {

    private static final Logger log = LoggerFactory.getLogger(ExternalHeifConverter.class);

    static final String INPUT = "{input}";
    static final String OUTPUT = "{output}";

    private final AppProperties.Normalizer settings;

    ExternalHeifConverter(AppProperties.Normalizer settings) {
        this.settings = settings;
    }

    /**
     * @return the decoded image, or null when the converter succeeded but wrote nothing readable
     * @throws IOException when the converter is missing, fails or times out
     */
    BufferedImage convert(byte[] content) throws IOException {
        Path workDir = Files.createTempDirectory("expensesnap-heif-");
        try {
            Path input = Files.write(workDir.resolve("input.heic"), content);
            Path output = workDir.resolve("output.jpg");
            Path console = workDir.resolve("converter.log");

            List<String> command = commandFor(input, output);
            log.debug("Running HEIF converter: {}", command);
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(console.toFile())
                    .start();

            Duration timeout = settings.getHeicTimeout();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("HEIF converter timed out after " + timeout.toMillis() + " ms");
            }
            if (process.exitValue() != 0) {
                throw new IOException("HEIF converter exited with status " + process.exitValue()
                        + ": " + tail(console));
            }
            if (!Files.exists(output)) {
                throw new IOException("HEIF converter produced no output");
            }
            return ImageIO.read(output.toFile());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while converting HEIF", e);
        } finally {
            deleteRecursively(workDir);
        }
    }

    List<String> commandFor(Path input, Path output) throws IOException {
        List<String> template = settings.getHeicCommand();
        if (template == null || template.isEmpty()) {
            throw new IOException("No HEIF converter configured");
        }
        List<String> command = new ArrayList<>(template.size());
        for (String arg : template) {
            command.add(arg.replace(INPUT, input.toString()).replace(OUTPUT, output.toString()));
        }
        return command;
    }

    private static String tail(Path console) {
        try {
            String text = Files.readString(console).strip();
            return text.length() > 200 ? text.substring(text.length() - 200) : text;
        } catch (IOException e) {
            return "(no converter output: " + e.getMessage() + ")";
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(ExternalHeifConverter::deleteQuietly);
        } catch (IOException e) {
            log.warn("Could not clean up HEIF work directory {}: {}", dir, e.getMessage());
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
