/*
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of XRDFIT
 *
 * XRDFIT is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * XRDFIT is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with XRDFIT.  If not, see <http://www.gnu.org/licenses/>.
 */
package xrdfit.core;

import org.json.simple.parser.ParseException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import xrdfit.data_structure.BackgroundAnchor;
import xrdfit.data_structure.Spectrum;
import xrdfit.data_structure.io.FitResultWriter;
import xrdfit.processing.peak_fit.ProfileModel;
import xrdfit.test_utils.TestUtils;
import xrdfit.utils.FileIO;
import xrdfit.utils.JSONUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author Jean Ollion
 */
public class BatchFitTaskTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path inputDir() throws IOException {
        Path dir = folder.newFolder("input").toPath();
        String spectrum = TestUtils.toText(TestUtils.singleGaussianSpectrum());
        Files.write(dir.resolve("a.xy"), spectrum.getBytes(StandardCharsets.ISO_8859_1));
        Files.write(dir.resolve("b.dat"), spectrum.getBytes(StandardCharsets.ISO_8859_1));
        Files.write(dir.resolve("bad.txt"), "hello\nworld\n".getBytes(StandardCharsets.ISO_8859_1));
        Files.write(dir.resolve("notes.csv"), "1,2\n3,4\n".getBytes(StandardCharsets.ISO_8859_1));
        return dir;
    }

    @Test
    public void testRun() throws IOException {
        Path in = inputDir();
        Path out = folder.getRoot().toPath().resolve("output");
        BatchFitTask task = new BatchFitTask(in.toString()).setOutputDir(out.toString());
        assertEquals(3, task.listInputFiles().size());
        task.runTask();
        assertEquals(2, task.getProcessedCount());
        assertEquals(1, task.getSkippedCount());
        assertEquals(0, task.getFailedCount());
        assertEquals(1, task.getErrors().size());
        assertEquals("bad", task.getErrors().get(0).key);
        assertTrue(Files.exists(out.resolve("a" + FitResultWriter.SUFFIX)));
        assertTrue(Files.exists(out.resolve("b" + FitResultWriter.SUFFIX)));
        assertFalse(Files.exists(out.resolve("bad" + FitResultWriter.SUFFIX)));
        assertNotNull(task.getCombinedFile());
        List<String> combined = FileIO.readLines(task.getCombinedFile(), StandardCharsets.UTF_8);
        assertEquals(FitResultWriter.HEADER, combined.get(0));
        assertEquals(4, combined.size());
        String[] row = combined.get(1).split(",");
        assertEquals(10, Double.parseDouble(row[1]), 0.005);
        assertEquals("a", row[8]);
    }

    @Test
    public void testOutputInInputDir() throws IOException {
        Path in = inputDir();
        BatchFitTask task = new BatchFitTask(in.toString()).setCombinedOutput(false).setReuseBackgroundTemplate(true);
        task.runTask();
        assertEquals(2, task.getProcessedCount());
        assertTrue(Files.exists(in.resolve("a" + FitResultWriter.SUFFIX)));
        assertNull(task.getCombinedFile());
        assertFalse(Files.exists(in.resolve(FitResultWriter.COMBINED_FILE)));
    }

    @Test
    public void testTemplateAnchors() {
        Spectrum s = TestUtils.singleGaussianSpectrum();
        List<BackgroundAnchor> anchors = BatchFitTask.getAnchorsFromTemplate(s, new double[]{4, 7.003, 7.004, 12, 20});
        assertEquals(2, anchors.size());
        assertEquals(s.getX(200), anchors.get(0).getX(), 0);
        assertEquals(s.getY(200), anchors.get(0).getY(), 0);
        assertEquals(s.getX(700), anchors.get(1).getX(), 0);
    }

    @Test
    public void testMissingInput() {
        BatchFitTask task = new BatchFitTask(folder.getRoot().toPath().resolve("missing").toString());
        assertFalse(task.isValid());
        assertEquals(1, task.getErrors().size());
        task.runTask();
        assertEquals(0, task.getProcessedCount());
    }

    @Test
    public void testJSON() throws ParseException {
        Map<String, Double> params = new HashMap<>();
        params.put("sigma", 1.5);
        BatchFitTask task = new BatchFitTask("/data/in").setOutputDir("/data/out").setAutoBackgroundPoints(12)
                .setReuseBackgroundTemplate(true).setCombinedOutput(false).setSmoothing("gaussian", params);
        task.getFitConfig().setProfile(ProfileModel.VOIGT);
        BatchFitTask other = new BatchFitTask();
        other.initFromJSONEntry(JSONUtils.parse(JSONUtils.serialize(task)));
        assertEquals(task, other);
        assertEquals("/data/out", other.getOutputDir());
        assertEquals(ProfileModel.VOIGT, other.getFitConfig().profile);
        assertEquals(task, task.duplicate());
        assertEquals("output defaults to input", "/data/in", new BatchFitTask("/data/in").getOutputDir());
    }
}
