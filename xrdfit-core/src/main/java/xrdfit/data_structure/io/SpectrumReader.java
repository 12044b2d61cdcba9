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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrdfit.data_structure.InvalidSpectrumException;
import xrdfit.data_structure.Spectrum;
import xrdfit.utils.FileIO;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads spectra from text files with at least two whitespace-separated numeric columns: x then y. Other columns are ignored.
 * Text after '#' is a comment. Empty lines and lines that do not start with two numbers are skipped.
 * @author Jean Ollion
 */
public class SpectrumReader {
    public static final Logger logger = LoggerFactory.getLogger(SpectrumReader.class);
    public static final Charset CHARSET = StandardCharsets.ISO_8859_1;
    public static final String[] EXTENSIONS = new String[]{"xy", "dat", "txt", "chi"};
    static final Pattern SEPARATOR = Pattern.compile("[\\s,;]+");

    public static boolean isSpectrumFile(Path path) {
        String ext = FileIO.getExtension(path);
        for (String e : EXTENSIONS) if (e.equals(ext)) return true;
        return false;
    }

    /**
     *
     * @param path
     * @return spectrum named after the file name without extension
     * @throws IOException
     * @throws InvalidSpectrumException if less than 2 numeric rows are found or if x values are not strictly increasing
     */
    public static Spectrum read(Path path) throws IOException, InvalidSpectrumException {
        List<double[]> rows = FileIO.readFromFile(path, CHARSET, SpectrumReader::parseLine);
        if (rows.size()<2) throw new InvalidSpectrumException(path.getFileName()+": at least 2 rows with 2 numeric columns are required, found: "+rows.size());
        double[] x = new double[rows.size()];
        double[] y = new double[rows.size()];
        for (int i = 0; i<rows.size(); ++i) {
            x[i] = rows.get(i)[0];
            y[i] = rows.get(i)[1];
        }
        Spectrum res = new Spectrum(FileIO.removeExtension(path), x, y);
        logger.debug("read: {}", res);
        return res;
    }

    /**
     *
     * @param line
     * @return x and y values or null if the line contains no data
     * @throws NumberFormatException if one of the first two columns is not a number
     */
    static double[] parseLine(String line) {
        int comment = line.indexOf('#');
        if (comment>=0) line = line.substring(0, comment);
        line = line.trim();
        if (line.isEmpty()) return null;
        String[] tokens = SEPARATOR.split(line);
        if (tokens.length<2) return null;
        double x = Double.parseDouble(tokens[0]);
        double y = Double.parseDouble(tokens[1]);
        if (!Double.isFinite(x) || !Double.isFinite(y)) return null;
        return new double[]{x, y};
    }
}
