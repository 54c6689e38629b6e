package com.simod.discovery.service.engine;

import com.simod.discovery.service.config.EngineConfig;
import com.simod.discovery.service.exception.EngineException;
import com.simod.discovery.service.schema.DiscoveryConfigurationValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Discovery engine that runs an external command per job.
 *
 * The command line comes from {@code discovery.engine.command}; the
 * placeholders {@code {log}}, {@code {config}} and {@code {output}} are
 * replaced with absolute paths. Output is captured to {@code engine.log} in
 * the workspace. The result directory is packaged as a gzipped tarball.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessDiscoveryEngine implements DiscoveryEngine {

    static final String ENGINE_LOG = "engine.log";
    static final String OUTPUT_DIR = "output";
    static final String GENERATED_CONFIG = "configuration.generated.yaml";

    private static final int LOG_TAIL_LINES = 20;

    private final EngineConfig engineConfig;
    private final DiscoveryConfigurationValidator configurationValidator;

    @Override
    public Path discover(DiscoveryInput input) {
        String jobId = input.jobId();
        try {
            Path outputDir = Files.createDirectories(input.workspace().resolve(OUTPUT_DIR));
            Path configuration = configurationFor(input);
            List<String> command = buildCommand(input.eventLog(), configuration, outputDir);

            log.info("Running discovery engine for job {}: {}", jobId, command);
            int exitCode = run(jobId, command, input.workspace());
            if (exitCode != 0) {
                throw new EngineException("Discovery engine exited with code " + exitCode
                        + describeLogTail(input.workspace()), jobId);
            }

            return archiveResult(jobId, outputDir, input.workspace());
        } catch (IOException e) {
            throw new EngineException("Discovery engine I/O failure: " + e.getMessage(), jobId, e);
        }
    }

    // ==================== Command ====================

    private Path configurationFor(DiscoveryInput input) throws IOException {
        if (input.hasConfiguration()) {
            return input.configuration();
        }
        Path generated = input.workspace().resolve(GENERATED_CONFIG);
        Files.write(generated, configurationValidator.minimalFor(input.eventLog().toAbsolutePath().toString()));
        log.debug("No configuration uploaded for job {}, generated {}", input.jobId(), generated);
        return generated;
    }

    List<String> buildCommand(Path eventLog, Path configuration, Path outputDir) {
        List<String> command = new ArrayList<>();
        for (String part : engineConfig.getCommand()) {
            command.add(part
                    .replace("{log}", eventLog.toAbsolutePath().toString())
                    .replace("{config}", configuration.toAbsolutePath().toString())
                    .replace("{output}", outputDir.toAbsolutePath().toString()));
        }
        return command;
    }

    private int run(String jobId, List<String> command, Path workspace) throws IOException {
        Path engineLog = workspace.resolve(ENGINE_LOG);
        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(engineLog.toFile()));
        if (engineConfig.getWorkingDirectory() != null) {
            builder.directory(Path.of(engineConfig.getWorkingDirectory()).toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new EngineException("Failed to start discovery engine: " + e.getMessage(), jobId, e);
        }

        try {
            long timeoutMs = engineConfig.getTimeout().toMillis();
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new EngineException("Discovery engine timed out after " + engineConfig.getTimeout(), jobId);
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new EngineException("Discovery engine interrupted", jobId, e);
        }
    }

    private String describeLogTail(Path workspace) {
        Path engineLog = workspace.resolve(ENGINE_LOG);
        if (!Files.exists(engineLog)) {
            return "";
        }
        try {
            List<String> lines = Files.readAllLines(engineLog, StandardCharsets.UTF_8);
            List<String> tail = lines.subList(Math.max(0, lines.size() - LOG_TAIL_LINES), lines.size());
            return tail.isEmpty() ? "" : ": " + String.join("\n", tail);
        } catch (IOException e) {
            log.warn("Could not read engine log {}: {}", engineLog, e.getMessage());
            return "";
        }
    }

    // ==================== Packaging ====================

    private Path archiveResult(String jobId, Path outputDir, Path workspace) throws IOException {
        Path resultDir = outputDir.resolve(engineConfig.getResultDirectory());
        if (!Files.isDirectory(resultDir)) {
            resultDir = outputDir;
        }
        if (isEmpty(resultDir)) {
            throw new EngineException("Discovery engine produced no result", jobId);
        }

        Path archive = workspace.resolve(engineConfig.getArchiveName());
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(archive));
             GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(out);
             TarArchiveOutputStream tar = new TarArchiveOutputStream(gzip)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            addDirectory(tar, resultDir, resultDir.getFileName().toString());
            tar.finish();
        }

        log.debug("Packaged {} for job {} ({})", resultDir, jobId,
                FileUtils.byteCountToDisplaySize(Files.size(archive)));
        return archive;
    }

    private void addDirectory(TarArchiveOutputStream tar, Path root, String prefix) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile).sorted().toList();
        }
        for (Path file : files) {
            String entryName = prefix + "/" + root.relativize(file).toString().replace('\\', '/');
            TarArchiveEntry entry = new TarArchiveEntry(file.toFile(), entryName);
            tar.putArchiveEntry(entry);
            Files.copy(file, tar);
            tar.closeArchiveEntry();
        }
    }

    private boolean isEmpty(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }
}
