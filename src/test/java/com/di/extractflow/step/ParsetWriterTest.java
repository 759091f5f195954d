package com.di.extractflow.step;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ParsetWriter Tests")
class ParsetWriterTest {

    @Test
    @DisplayName("Renders key = value lines in insertion order")
    void testFlat() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("msin", "/w/partition_0.ms");
        values.put("avg.freqstep", 4);
        values.put("cal.smoothnessconstraint", 2e6);
        values.put("flag", true);
        values.put("steps", List.of("aoflag", "avg"));

        assertEquals("""
                msin = /w/partition_0.ms
                avg.freqstep = 4
                cal.smoothnessconstraint = 2000000.0
                flag = true
                steps = [aoflag, avg]
                """, ParsetWriter.render(values));
    }

    @Test
    @DisplayName("Nested groups become sections after the plain entries")
    void testSections() {
        Map<String, Object> cal = new LinkedHashMap<>();
        cal.put("type", "ddecal");
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("cal", cal);
        values.put("numthreads", 4);

        assertEquals("""
                numthreads = 4
                [cal]
                type = ddecal
                """, ParsetWriter.render(values));
    }

    @Test
    @DisplayName("Writes the file, creating parent directories")
    void testWrite(@TempDir Path tmp) throws IOException {
        Path file = ParsetWriter.write(Map.of("msin", "x"), tmp.resolve("parsets").resolve("step.parset"));
        assertEquals("msin = x\n", Files.readString(file));
    }
}
