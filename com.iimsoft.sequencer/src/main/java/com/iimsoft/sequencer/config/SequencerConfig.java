package com.iimsoft.sequencer.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sequencing options, read from {@value #RESOURCE} on the classpath.
 * Options sent with a request take precedence.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SequencerConfig {

    public static final String RESOURCE = "sequencer-config.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(SequencerConfig.class);

    /**
     * How new tasks are placed on their resource.
     */
    public enum InsertMode {
        /** keep request order */
        APPEND,
        /** slot finder */
        BEST
    }

    @JsonProperty("improve")
    private boolean improve = true;

    @JsonProperty("branchImprove")
    private boolean branchImprove = false;

    @JsonProperty("insertMode")
    private InsertMode insertMode = InsertMode.APPEND;

    @JsonProperty("timeLimitSeconds")
    private int timeLimitSeconds = 10;

    public SequencerConfig() {
    }

    public static SequencerConfig load() {
        return load(RESOURCE);
    }

    public static SequencerConfig load(String resource) {
        try (InputStream in = SequencerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                LOGGER.info("{} not found on classpath, using defaults", resource);
                return new SequencerConfig();
            }
            return read(in, resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
    }

    /**
     * Reads a config file from disk; unlike the classpath variant a missing file is an error.
     */
    public static SequencerConfig load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    private static SequencerConfig read(InputStream in, String source) throws IOException {
        SequencerConfig config = new ObjectMapper().readValue(in, SequencerConfig.class);
        LOGGER.debug("Loaded {}: {}", source, config);
        return config;
    }

    public boolean isImprove() {
        return improve;
    }

    public void setImprove(boolean improve) {
        this.improve = improve;
    }

    public boolean isBranchImprove() {
        return branchImprove;
    }

    public void setBranchImprove(boolean branchImprove) {
        this.branchImprove = branchImprove;
    }

    public InsertMode getInsertMode() {
        return insertMode;
    }

    public void setInsertMode(InsertMode insertMode) {
        this.insertMode = insertMode;
    }

    public int getTimeLimitSeconds() {
        return timeLimitSeconds;
    }

    public void setTimeLimitSeconds(int timeLimitSeconds) {
        this.timeLimitSeconds = timeLimitSeconds;
    }

    @Override
    public String toString() {
        return "SequencerConfig{improve=" + improve + ", branchImprove=" + branchImprove
                + ", insertMode=" + insertMode + ", timeLimitSeconds=" + timeLimitSeconds + "}";
    }
}
