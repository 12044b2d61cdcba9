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
import xrdfit.data_structure.FitResult;
import xrdfit.data_structure.PeakFitResults;
import xrdfit.utils.FileIO;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Exports fit results as CSV tables, one row per fitted peak. Peaks are numbered from 1
 * @author Jean Ollion
 */
public class FitResultWriter {
    public static final Logger logger = LoggerFactory.getLogger(FitResultWriter.class);
    public static final String HEADER = "Peak,Center,FWHM,Area,Amplitude,Sigma,Gamma,Eta,File";
    public static final String SUFFIX = "_fit_results.csv";
    public static final String COMBINED_FILE = "batch_fit_results_combined.csv";
    static final String NOT_AVAILABLE = "N/A";

    public static String toCSVLine(FitResult r, String fileName) {
        return String.join(",",
                String.valueOf(r.getPeakIndex() + 1),
                String.valueOf(r.getCenter()),
                String.valueOf(r.getFWHM()),
                String.valueOf(r.getArea()),
                String.valueOf(r.getAmplitude()),
                String.valueOf(r.getSigma()),
                String.valueOf(r.getGamma()),
                r.hasEta() ? String.valueOf(r.getEta()) : NOT_AVAILABLE,
                escape(fileName));
    }

    static String escape(String value) {
        if (value.contains(",") || value.contains("\"")) return "\"" + value.replace("\"", "\"\"") + "\"";
        return value;
    }

    /**
     *
     * @param results
     * @param fileName name of the fitted spectrum, written in the File column and used to name the output file
     * @param dir output directory
     * @return path of the written file: dir/fileName_fit_results.csv
     * @throws IOException
     */
    public static Path write(PeakFitResults results, String fileName, Path dir) throws IOException {
        Path output = dir.resolve(fileName + SUFFIX);
        List<String> lines = new ArrayList<>(results.getResults().size() + 1);
        lines.add(HEADER);
        for (FitResult r : results.getResults()) lines.add(toCSVLine(r, fileName));
        FileIO.writeToFile(output.toString(), lines, l -> l);
        logger.debug("{} result(s) written to: {}", results.getResults().size(), output);
        return output;
    }

    /**
     * Concatenates result tables in a single table, with one header and an empty row between tables
     * @param csvFiles tables written by {@link #write(PeakFitResults, String, Path)}
     * @param output
     * @throws IOException
     */
    public static void writeCombined(List<Path> csvFiles, Path output) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        String emptyRow = HEADER.replaceAll("[^,]", "");
        for (int i = 0; i<csvFiles.size(); ++i) {
            List<String> table = FileIO.readLines(csvFiles.get(i), StandardCharsets.UTF_8);
            for (int l = 1; l<table.size(); ++l) if (!table.get(l).isEmpty()) lines.add(table.get(l));
            if (i<csvFiles.size()-1) lines.add(emptyRow);
        }
        FileIO.writeToFile(output.toString(), lines, l -> l);
    }
}
