package com.trading.quant.io;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.trading.quant.api.InvalidInputException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

public class EngineSettingsTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testDefaults() {
        EngineSettings s = EngineSettings.defaults();
        assertEquals(100, s.getOptions().getBinomialSteps());
        assertEquals(0.001, s.getOptions().getImpliedVolLow(), 0.0);
        assertEquals(5.0, s.getOptions().getImpliedVolHigh(), 0.0);
        assertEquals(1e-6, s.getBond().getYtmTolerance(), 0.0);
        assertEquals(0.01, s.getBond().getYieldBump(), 0.0);
        assertEquals(10_000, s.getOptimizer().getIterations());
        assertEquals(0.01, s.getOptimizer().getLearningRate(), 0.0);
        assertEquals(20, s.getOptimizer().getFrontierPortfolios());
    }

    @Test
    public void testParsePartialKeepsDefaults() {
        EngineSettings s = EngineSettings.parse("{\"options\":{\"binomialSteps\":500},\"unknown\":1}");
        assertEquals(500, s.getOptions().getBinomialSteps());
        assertEquals(100, s.getOptions().getImpliedVolMaxIterations());
        assertEquals(100, s.getBond().getYtmMaxIterations());
        assertEquals(10_000, s.getOptimizer().getIterations());
    }

    @Test
    public void testParseNullSectionFallsBackToDefaults() {
        EngineSettings s = EngineSettings.parse("{\"bond\":null}");
        assertNotNull(s.getBond());
        assertEquals(1.0, s.getBond().getYtmUpperBound(), 0.0);
    }

    @Test
    public void testMalformedJson() {
        try {
            EngineSettings.parse("{\"options\":");
            fail("Should throw InvalidInputException for malformed JSON");
        } catch (InvalidInputException e) {
            assertTrue(e.getMessage().contains("Malformed"));
        }
    }

    @Test
    public void testRejectsInvalidValues() {
        String[] bad = {
                "{\"options\":{\"binomialSteps\":0}}",
                "{\"options\":{\"impliedVolLow\":6.0}}",
                "{\"bond\":{\"ytmLowerBound\":2.0}}",
                "{\"optimizer\":{\"learningRate\":0}}",
                "{\"optimizer\":{\"frontierPortfolios\":1}}",
                "{\"options\":{\"impliedVolTolerance\":0}}",
                "{\"bond\":{\"ytmTolerance\":-1e-6}}",
                "{\"bond\":{\"yieldBump\":0}}"
        };
        for (String json : bad) {
            try {
                EngineSettings.parse(json);
                fail("Should reject " + json);
            } catch (InvalidInputException e) {
                // Expected
            }
        }
    }

    @Test
    public void testLoadFromFile() throws Exception {
        Path file = tmp.newFile("engine.json").toPath();
        Files.write(file, "{\"optimizer\":{\"iterations\":250}}".getBytes(StandardCharsets.UTF_8));

        EngineSettings s = EngineSettings.load(file);
        assertEquals(250, s.getOptimizer().getIterations());
        assertEquals(0.01, s.getOptimizer().getLearningRate(), 0.0);
    }

    @Test
    public void testFromClasspath() {
        EngineSettings s = EngineSettings.fromClasspath();
        assertEquals(EngineSettings.defaults(), s);
    }
}
