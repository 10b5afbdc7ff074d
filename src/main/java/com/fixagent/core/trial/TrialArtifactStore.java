package com.fixagent.core.trial;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fixagent.core.json.TrialJson;
import com.fixagent.core.model.ExceptionInfo;
import com.fixagent.core.model.TrialConfig;
import com.fixagent.core.model.TrialResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes and reads the files of a trial directory:
 * {@code config.json}, {@code result.json}, {@code compilation.log}, {@code exception.txt}.
 */
@Component
public class TrialArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(TrialArtifactStore.class);

    public static final String CONFIG_FILE = "config.json";
    public static final String RESULT_FILE = "result.json";
    public static final String COMPILATION_LOG = "compilation.log";
    public static final String EXCEPTION_FILE = "exception.txt";

    private final ObjectMapper mapper = TrialJson.mapper();

    /**
     * Creates the trial directory and writes {@code config.json} without the output directory.
     *
     * @return the trial directory
     */
    public Path prepare(TrialConfig config) {
        Path trialDir = config.trialDir();
        try {
            Files.createDirectories(trialDir);
            ObjectNode json = mapper.valueToTree(config);
            json.remove("outputDir");
            Files.writeString(trialDir.resolve(CONFIG_FILE), mapper.writeValueAsString(json),
                    StandardCharsets.UTF_8);
            return trialDir;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to prepare trial directory " + trialDir, e);
        }
    }

    public void writeException(Path trialDir, Throwable error) {
        write(trialDir.resolve(EXCEPTION_FILE), ExceptionInfo.stackTrace(error));
    }

    /**
     * Writes {@code result.json}, plus {@code compilation.log} when the trial reached verification.
     */
    public void writeResult(TrialResult result) {
        Path trialDir = result.getTrialDir();
        try {
            write(trialDir.resolve(RESULT_FILE), mapper.writeValueAsString(result));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize result of " + result.getTrialName(), e);
        }
        if (result.getVerificationResult() != null) {
            write(trialDir.resolve(COMPILATION_LOG), result.getVerificationResult().compilationOutput());
        }
        log.debug("Wrote artifacts for {} to {}", result.getTrialName(), trialDir);
    }

    public TrialResult readResult(Path trialDir) {
        try {
            return mapper.readValue(trialDir.resolve(RESULT_FILE).toFile(), TrialResult.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read result from " + trialDir, e);
        }
    }

    private static void write(Path file, String content) {
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }
}
