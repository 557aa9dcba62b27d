package com.trading.quant.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.quant.api.InvalidInputException;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Tunable defaults of the iterative algorithms.
 *
 * <p>
 * Every field carries the engine's built-in default, so an empty JSON object
 * (or a missing {@value #CLASSPATH_RESOURCE}) yields the standard behaviour.
 * Unknown keys are ignored.
 *
 * <pre>
 * {
 *   "options":   { "binomialSteps": 100, "impliedVolTolerance": 1e-6 },
 *   "bond":      { "ytmMaxIterations": 100 },
 *   "optimizer": { "iterations": 10000, "learningRate": 0.01 }
 * }
 * </pre>
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineSettings {
    public static final String CLASSPATH_RESOURCE = "quant-engine.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OptionSettings options = new OptionSettings();
    private BondSettings bond = new BondSettings();
    private OptimizerSettings optimizer = new OptimizerSettings();

    /** Lattice and implied-volatility defaults. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class OptionSettings {
        private int binomialSteps = 100;
        private double impliedVolLow = 0.001;
        private double impliedVolHigh = 5.0;
        private double impliedVolTolerance = 1e-6;
        private int impliedVolMaxIterations = 100;
    }

    /** Yield solver and finite-difference defaults. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BondSettings {
        private double ytmTolerance = 1e-6;
        private int ytmMaxIterations = 100;
        private double ytmLowerBound = -1.0;
        private double ytmUpperBound = 1.0;
        private double yieldBump = 0.01;
    }

    /** Random local search defaults. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class OptimizerSettings {
        private int iterations = 10_000;
        private double learningRate = 0.01;
        private int frontierPortfolios = 20;
    }

    /** Built-in defaults. */
    public static EngineSettings defaults() {
        return new EngineSettings();
    }

    /** Parses settings from a JSON string. */
    public static EngineSettings parse(String json) {
        try {
            return validate(MAPPER.readValue(json, EngineSettings.class));
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Malformed engine settings: " + e.getOriginalMessage());
        }
    }

    /** Parses settings from a JSON file. */
    public static EngineSettings load(Path path) throws IOException {
        log.info("Loading engine settings from {}", path);
        return parse(Files.readString(path));
    }

    /**
     * Reads {@value #CLASSPATH_RESOURCE} from the classpath, or returns the
     * defaults when it is not present.
     */
    public static EngineSettings fromClasspath() {
        try (InputStream in = EngineSettings.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                log.debug("{} not found on classpath, using defaults", CLASSPATH_RESOURCE);
                return defaults();
            }
            return validate(MAPPER.readValue(in, EngineSettings.class));
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Malformed " + CLASSPATH_RESOURCE + ": " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + CLASSPATH_RESOURCE, e);
        }
    }

    private static EngineSettings validate(EngineSettings s) {
        if (s.options == null)
            s.options = new OptionSettings();
        if (s.bond == null)
            s.bond = new BondSettings();
        if (s.optimizer == null)
            s.optimizer = new OptimizerSettings();

        if (s.options.binomialSteps <= 0)
            throw new InvalidInputException("options.binomialSteps must be > 0");
        if (!(s.options.impliedVolLow > 0 && s.options.impliedVolLow < s.options.impliedVolHigh))
            throw new InvalidInputException("options.impliedVolLow must be > 0 and below impliedVolHigh");
        if (s.options.impliedVolMaxIterations <= 0 || s.bond.ytmMaxIterations <= 0)
            throw new InvalidInputException("Solver iteration caps must be > 0");
        if (!(s.options.impliedVolTolerance > 0))
            throw new InvalidInputException("options.impliedVolTolerance must be > 0");
        if (!(s.bond.ytmTolerance > 0))
            throw new InvalidInputException("bond.ytmTolerance must be > 0");
        if (!(s.bond.yieldBump > 0))
            throw new InvalidInputException("bond.yieldBump must be > 0");
        if (s.bond.ytmLowerBound >= s.bond.ytmUpperBound)
            throw new InvalidInputException("bond.ytmLowerBound must be below ytmUpperBound");
        if (s.optimizer.iterations < 0)
            throw new InvalidInputException("optimizer.iterations must be >= 0");
        if (!(s.optimizer.learningRate > 0))
            throw new InvalidInputException("optimizer.learningRate must be > 0");
        if (s.optimizer.frontierPortfolios < 2)
            throw new InvalidInputException("optimizer.frontierPortfolios must be >= 2");
        return s;
    }
}
