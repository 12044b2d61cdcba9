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
package xrdfit.data_structure.io;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import xrdfit.data_structure.FitResult;
import xrdfit.data_structure.PeakFitResults;
import xrdfit.processing.peak_fit.ProfileModel;
import xrdfit.utils.FileIO;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class FitResultWriterTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static PeakFitResults results(FitResult... res) {
        return new PeakFitResults(Arrays.asList(res), new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new double[0], 1, false);
    }

    @Test
    public void testLine() {
        FitResult pv = new FitResult(0, 0, ProfileModel.PSEUDO_VOIGT, new double[]{100, 10, 0.1, 0.2, 0.5}, 0, 10, 9, 11);
        String[] cols = FitResultWriter.toCSVLine(pv, "scan").split(",");
        assertEquals(9, cols.length);
        assertEquals("1", cols[0]);
        assertEquals(10, Double.parseDouble(cols[1]), 0);
        assertEquals(pv.getFWHM(), Double.parseDouble(cols[2]), 0);
        assertEquals(pv.getArea(), Double.parseDouble(cols[3]), 0);
        assertEquals("0.5", cols[7]);
        assertEquals("scan", cols[8]);
        FitResult voigt = new FitResult(2, 0, ProfileModel.VOIGT, new double[]{100, 10, 0.1, 0.2}, 0, 10, 9, 11);
        String line = FitResultWriter.toCSVLine(voigt, "a,b");
        assertTrue(line.startsWith("3,"));
        assertTrue(line.endsWith(",N/A,\"a,b\""));
    }

    @Test
    public void testWrite() throws IOException {
        Path dir = folder.getRoot().toPath();
        FitResult r1 = new FitResult(0, 0, ProfileModel.PSEUDO_VOIGT, new double[]{100, 10, 0.1, 0.2, 0.5}, 0, 10, 9, 11);
        FitResult r2 = new FitResult(1, 1, ProfileModel.PSEUDO_VOIGT, new double[]{50, 12, 0.1, 0.2, 0.1}, 10, 20, 11, 13);
        Path a = FitResultWriter.write(results(r1, r2), "a", dir);
        assertEquals(dir.resolve("a_fit_results.csv"), a);
        List<String> lines = FileIO.readLines(a, StandardCharsets.UTF_8);
        assertEquals(FitResultWriter.HEADER, lines.get(0));
        assertEquals(3, lines.size());
        assertTrue(lines.get(2).startsWith("2,12.0,"));

        Path b = FitResultWriter.write(results(r1), "b", dir);
        Path empty = FitResultWriter.write(results(), "c", dir);
        assertEquals(Collections.singletonList(FitResultWriter.HEADER), FileIO.readLines(empty, StandardCharsets.UTF_8));
        Path combined = dir.resolve(FitResultWriter.COMBINED_FILE);
        FitResultWriter.writeCombined(Arrays.asList(a, b), combined);
        assertTrue(Files.exists(combined));
        List<String> all = FileIO.readLines(combined, StandardCharsets.UTF_8);
        assertEquals(5, all.size());
        assertEquals(FitResultWriter.HEADER, all.get(0));
        assertEquals(",,,,,,,,", all.get(3));
        assertTrue(all.get(4).endsWith(",b"));
    }
}
