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

import org.json.simple.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrdfit.data_structure.BackgroundAnchor;
import xrdfit.data_structure.InvalidSpectrumException;
import xrdfit.data_structure.PeakFitResults;
import xrdfit.data_structure.Spectrum;
import xrdfit.data_structure.io.FitResultWriter;
import xrdfit.data_structure.io.SpectrumReader;
import xrdfit.processing.Smoother;
import xrdfit.processing.background.BackgroundEstimator;
import xrdfit.processing.peak_detection.PeakLocator;
import xrdfit.processing.peak_fit.PeakFit;
import xrdfit.processing.peak_fit.PeakFitConfig;
import xrdfit.ui.logger.ProgressLogger;
import xrdfit.utils.FileIO;
import xrdfit.utils.JSONSerializable;
import xrdfit.utils.JSONUtils;
import xrdfit.utils.MultipleException;
import xrdfit.utils.Pair;
import xrdfit.utils.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fits all spectrum files of a directory: for each file, peaks are detected, background anchors are placed and peaks are fitted.
 * Results are written to one CSV file per spectrum and optionally to a combined CSV file.
 * An error on a file is recorded and does not stop the processing of other files. Files that do not contain a valid spectrum are skipped,
 * files without detected peak or without any fitted peak are counted as failed.
 * @author Jean Ollion
 */
public class BatchFitTask implements ProgressCallback, JSONSerializable {
    private static final Logger logger = LoggerFactory.getLogger(BatchFitTask.class);
    String inputDir, outputDir;
    int autoBackgroundPoints = BackgroundEstimator.DEFAULT_AUTO_POINTS;
    boolean reuseBackgroundTemplate = false;
    boolean combinedOutput = true;
    String smoothingMethod;
    Map<String, Double> smoothingParameters = new HashMap<>();
    PeakFitConfig fitConfig = new PeakFitConfig();

    MultipleException errors = new MultipleException();
    ProgressLogger ui;
    int[] taskCounter = new int[2];
    int processed, failed, skipped;
    final List<Path> outputFiles = new ArrayList<>();
    Path combinedFile;

    public BatchFitTask() {}

    public BatchFitTask(String inputDir) {
        this.inputDir = inputDir;
    }

    public BatchFitTask setUI(ProgressLogger ui) {
        this.ui = ui;
        return this;
    }

    public BatchFitTask setOutputDir(String outputDir) {
        this.outputDir = outputDir;
        return this;
    }

    /**
     * @param autoBackgroundPoints number of background anchors placed automatically on each spectrum
     */
    public BatchFitTask setAutoBackgroundPoints(int autoBackgroundPoints) {
        this.autoBackgroundPoints = autoBackgroundPoints;
        return this;
    }

    /**
     * @param reuseBackgroundTemplate if true, the x positions of the anchors found on the first file are used for all files
     */
    public BatchFitTask setReuseBackgroundTemplate(boolean reuseBackgroundTemplate) {
        this.reuseBackgroundTemplate = reuseBackgroundTemplate;
        return this;
    }

    public BatchFitTask setCombinedOutput(boolean combinedOutput) {
        this.combinedOutput = combinedOutput;
        return this;
    }

    /**
     * @param method smoothing applied to each spectrum before processing, see {@link Smoother}. null: no smoothing
     * @param parameters
     */
    public BatchFitTask setSmoothing(String method, Map<String, Double> parameters) {
        this.smoothingMethod = method;
        this.smoothingParameters = parameters==null ? new HashMap<>() : new HashMap<>(parameters);
        return this;
    }

    public BatchFitTask setFitConfig(PeakFitConfig fitConfig) {
        this.fitConfig = fitConfig;
        return this;
    }

    public PeakFitConfig getFitConfig() {
        return fitConfig;
    }
    public String getInputDir() {
        return inputDir;
    }
    public String getOutputDir() {
        return outputDir==null ? inputDir : outputDir;
    }
    public List<Pair<String, Throwable>> getErrors() {return errors.getExceptions();}
    public int getProcessedCount() {
        return processed;
    }
    public int getFailedCount() {
        return failed;
    }
    public int getSkippedCount() {
        return skipped;
    }
    public List<Path> getOutputFiles() {
        return outputFiles;
    }
    /**
     *
     * @return path of combined output or null if it was not written
     */
    public Path getCombinedFile() {
        return combinedFile;
    }

    public boolean isValid() {
        if (inputDir==null || !Files.isDirectory(Paths.get(inputDir))) {
            errors.addException(new Pair<>(String.valueOf(inputDir), new IOException("Input directory not found: "+inputDir)));
            return false;
        }
        return true;
    }

    public List<Path> listInputFiles() throws IOException {
        return FileIO.listFiles(Paths.get(inputDir), SpectrumReader::isSpectrumFile);
    }

    public void runTask() {
        publish("Run task: "+this);
        processed = 0;
        failed = 0;
        skipped = 0;
        outputFiles.clear();
        combinedFile = null;
        if (!isValid()) {
            done();
            return;
        }
        List<Path> files;
        Path outDir = Paths.get(getOutputDir());
        try {
            files = listInputFiles();
            Files.createDirectories(outDir);
        } catch (IOException e) {
            errors.addException(new Pair<>(inputDir, e));
            done();
            return;
        }
        setTaskNumber(files.size());
        publish("number of files: "+files.size());
        double[] templateX = null;
        for (Path file : files) {
            String name = FileIO.removeExtension(file);
            try {
                Spectrum spectrum = SpectrumReader.read(file);
                if (smoothingMethod!=null) spectrum = spectrum.smooth(smoothingMethod, smoothingParameters);
                int[] peaks = PeakLocator.autoFindPeaks(spectrum);
                if (peaks.length==0) throw new IllegalStateException("No peaks detected");
                List<BackgroundAnchor> anchors;
                if (reuseBackgroundTemplate && templateX!=null) anchors = getAnchorsFromTemplate(spectrum, templateX);
                else {
                    anchors = BackgroundEstimator.findAutoAnchors(spectrum, autoBackgroundPoints, BackgroundEstimator.DEFAULT_AUTO_WINDOW);
                    if (reuseBackgroundTemplate) {
                        templateX = anchors.stream().mapToDouble(BackgroundAnchor::getX).toArray();
                        publish("background template: "+Utils.toStringArray(templateX, 4));
                    }
                }
                PeakFitResults results = PeakFit.fit(spectrum, PeakLocator.toPeaks(spectrum, peaks), anchors, fitConfig);
                if (results.getResults().isEmpty()) throw new IllegalStateException("No peak could be fitted ("+results.getFailures().size()+" failed group(s))");
                outputFiles.add(FitResultWriter.write(results, name, outDir));
                ++processed;
                publish(name+": "+results);
                if (results.hasFailures()) {
                    results.getFailures().forEach(f -> errors.addException(new Pair<>(name+"/group:"+f.getGroupId(), new IllegalStateException(f.getMessage()))));
                }
            } catch (InvalidSpectrumException e) {
                ++skipped;
                logger.warn("File skipped: {}: {}", file, e.getMessage());
                errors.addException(new Pair<>(name, e));
            } catch (IOException | RuntimeException e) {
                ++failed;
                logger.error("Error processing file: {}: {}", file, e.toString());
                errors.addException(new Pair<>(name, e));
            }
            incrementProgress();
        }
        if (combinedOutput && !outputFiles.isEmpty()) {
            Path combined = outDir.resolve(FitResultWriter.COMBINED_FILE);
            try {
                FitResultWriter.writeCombined(outputFiles, combined);
                combinedFile = combined;
            } catch (IOException e) {
                errors.addException(new Pair<>(combined.toString(), e));
            }
        }
        publish("processed: "+processed+" failed: "+failed+" skipped: "+skipped);
        done();
    }

    /**
     * Anchors at the samples closest to the template positions, with the intensity of the spectrum. Template positions outside the spectrum range are ignored
     */
    static List<BackgroundAnchor> getAnchorsFromTemplate(Spectrum spectrum, double[] templateX) {
        double xMin = spectrum.getX(0);
        double xMax = spectrum.getX(spectrum.size()-1);
        return Arrays.stream(templateX).filter(x -> x>=xMin && x<=xMax)
                .mapToInt(spectrum::getNearestIndex).distinct()
                .mapToObj(i -> new BackgroundAnchor(spectrum.getX(i), spectrum.getY(i), false))
                .sorted().collect(Collectors.toList());
    }

    public void done() {
        publish("Task done.");
        publishErrors();
        printErrors();
        publish("------------------");
    }

    public void printErrors() {
        if (!errors.isEmpty()) logger.error("Errors for Task: {}", toString());
        for (Pair<String, ? extends Throwable> e : errors.getExceptions()) logger.error(e.key, e.value);
    }

    public void publish(String message) {
        if (ui!=null) ui.setMessage(message);
        logger.debug(message);
    }
    public void publishErrors() {
        if (errors.isEmpty()) return;
        publish("Errors: "+errors.getExceptions().size()+" For JOB: "+this);
        for (Pair<String, ? extends Throwable> e : errors.getExceptions()) publish("Error @"+e.key+" "+(e.value==null?"null":e.value.toString()));
    }

    // Progress Callback
    @Override
    public void incrementTaskNumber(int tasks) {
        taskCounter[1]+=tasks;
    }

    @Override
    public void setTaskNumber(int number) {
        taskCounter[0] = 0;
        taskCounter[1] = number;
    }

    @Override
    public int getTaskNumber() {
        return taskCounter[1];
    }

    @Override
    public synchronized void incrementProgress() {
        ++taskCounter[0];
        if (ui!=null && taskCounter[1]>0) ui.setProgress(100*taskCounter[0]/taskCounter[1]);
    }

    @Override
    public void log(String message) {
        publish(message);
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("inputDir", inputDir);
        if (outputDir!=null) res.put("outputDir", outputDir);
        res.put("autoBackgroundPoints", autoBackgroundPoints);
        if (reuseBackgroundTemplate) res.put("reuseBackgroundTemplate", true);
        if (!combinedOutput) res.put("combinedOutput", false);
        if (smoothingMethod!=null) {
            JSONObject smoothing = new JSONObject();
            smoothing.put("method", smoothingMethod);
            smoothing.putAll(smoothingParameters);
            res.put("smoothing", smoothing);
        }
        res.put("fit", fitConfig.toJSONEntry());
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof Map)) throw new IllegalArgumentException("Invalid batch task: "+jsonEntry);
        Map json = (Map)jsonEntry;
        inputDir = JSONUtils.getString(json, "inputDir", null);
        outputDir = JSONUtils.getString(json, "outputDir", null);
        autoBackgroundPoints = JSONUtils.getInt(json, "autoBackgroundPoints", autoBackgroundPoints);
        reuseBackgroundTemplate = JSONUtils.getBoolean(json, "reuseBackgroundTemplate", reuseBackgroundTemplate);
        combinedOutput = JSONUtils.getBoolean(json, "combinedOutput", combinedOutput);
        Object smoothing = json.get("smoothing");
        if (smoothing instanceof Map) {
            Map sm = (Map)smoothing;
            smoothingMethod = JSONUtils.getString(sm, "method", null);
            smoothingParameters = new HashMap<>();
            for (Object k : sm.keySet()) {
                if ("method".equals(k)) continue;
                double v = JSONUtils.getDouble(sm, k.toString(), Double.NaN);
                if (!Double.isNaN(v)) smoothingParameters.put(k.toString(), v);
            }
        }
        fitConfig = new PeakFitConfig();
        if (json.containsKey("fit")) fitConfig.initFromJSONEntry(json.get("fit"));
    }

    public BatchFitTask duplicate() {
        BatchFitTask res = new BatchFitTask();
        res.initFromJSONEntry(toJSONEntry());
        return res.setUI(ui);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputDir, getOutputDir());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return toJSONEntry().equals(((BatchFitTask)obj).toJSONEntry());
    }

    @Override
    public String toString() {
        return "BatchFit: input:"+inputDir+", output:"+getOutputDir()+(reuseBackgroundTemplate?", background template":"")+(smoothingMethod!=null?", smoothing:"+smoothingMethod:"");
    }
}
