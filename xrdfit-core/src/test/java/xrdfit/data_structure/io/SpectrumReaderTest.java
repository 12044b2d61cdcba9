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
import xrdfit.data_structure.InvalidSpectrumException;
import xrdfit.data_structure.Spectrum;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author Jean Ollion
 */
public class SpectrumReaderTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path write(String name, String content) throws IOException {
        Path p = folder.getRoot().toPath().resolve(name);
        Files.write(p, content.getBytes(StandardCharsets.ISO_8859_1));
        return p;
    }

    @Test
    public void testRead() throws IOException {
        Path p = write("sample.xy", "# header\nangle intensity\n1.0 10 5\n\n2.0\t20\n3.0, 30 # comment\nabc def\n4.0 40\n");
        Spectrum s = SpectrumReader.read(p);
        assertEquals("sample", s.getName());
        assertArrayEquals(new double[]{1, 2, 3, 4}, s.getXValues(), 0);
        assertArrayEquals(new double[]{10, 20, 30, 40}, s.getYValues(), 0);
    }

    @Test
    public void testParseLine() {
        assertNull(SpectrumReader.parseLine("   "));
        assertNull(SpectrumReader.parseLine("# 2theta"));
        assertNull("single column", SpectrumReader.parseLine("12.5"));
        assertNull(SpectrumReader.parseLine("1 NaN"));
        assertArrayEquals(new double[]{1.5, -2e3}, SpectrumReader.parseLine("1.5;-2e3"), 0);
    }

    @Test(expected = InvalidSpectrumException.class)
    public void testTooFewRows() throws IOException {
        SpectrumReader.read(write("short.dat", "hello\n1 2\n"));
    }

    @Test(expected = InvalidSpectrumException.class)
    public void testNotIncreasing() throws IOException {
        SpectrumReader.read(write("unsorted.txt", "1 2\n3 4\n2 5\n"));
    }

    @Test(expected = IOException.class)
    public void testMissingFile() throws IOException {
        SpectrumReader.read(folder.getRoot().toPath().resolve("missing.xy"));
    }

    @Test
    public void testExtensions() {
        assertTrue(SpectrumReader.isSpectrumFile(Paths.get("a.xy")));
        assertTrue(SpectrumReader.isSpectrumFile(Paths.get("dir", "b.DAT")));
        assertTrue(SpectrumReader.isSpectrumFile(Paths.get("c.chi")));
        assertFalse(SpectrumReader.isSpectrumFile(Paths.get("d.csv")));
        assertFalse(SpectrumReader.isSpectrumFile(Paths.get("xy")));
    }
}
