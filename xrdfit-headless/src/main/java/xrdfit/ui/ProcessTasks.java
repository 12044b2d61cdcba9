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
package xrdfit.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.json.simple.parser.ParseException;
import org.slf4j.LoggerFactory;
import xrdfit.core.BatchFitTask;
import xrdfit.ui.logger.ConsoleProgressLogger;
import xrdfit.ui.logger.FileProgressLogger;
import xrdfit.ui.logger.MultiProgressLogger;
import xrdfit.ui.logger.ProgressLogger;
import xrdfit.utils.FileIO;
import xrdfit.utils.JSONUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs batch fit jobs from a job list file containing one json object per line
 * @author Jean Ollion
 */
public class ProcessTasks {

    public static void main(String[] args) {
        Logger root = (Logger)LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.INFO);
        ConsoleProgressLogger consoleUI = new ConsoleProgressLogger();
        final ProgressLogger ui;
        if (args.length==0) {
            consoleUI.setMessage("Missing argument: job list file and optionally a log file as second argument");
            return;
        } else if (args.length==1) {
            ui = consoleUI;
        } else if (args.length==2) {
            FileProgressLogger logUI = new FileProgressLogger(true);
            logUI.setLogFile(args[1]);
            consoleUI.setMessage("Setting log file: "+args[1]);
            ui = new MultiProgressLogger(consoleUI, logUI);
        } else {
            consoleUI.setMessage("Too many arguments. Expect only path of job list file and optionally a log file as second argument");
            return;
        }
        ui.setRunning(true);
        List<String> lines;
        try {
            lines = FileIO.readLines(Paths.get(args[0]), StandardCharsets.UTF_8);
        } catch (IOException e) {
            ui.setMessage("Error: job list file could not be read: "+args[0]+" "+e.getMessage());
            ui.setRunning(false);
            return;
        }
        List<BatchFitTask> jobs = new ArrayList<>();
        int count = 0;
        for (String line : lines) {
            ++count;
            if (line.trim().isEmpty()) continue;
            try {
                BatchFitTask t = new BatchFitTask().setUI(ui);
                t.initFromJSONEntry(JSONUtils.parse(line));
                jobs.add(t);
            } catch (ParseException | RuntimeException e) {
                ui.setMessage("Error: job at line "+count+" could not be parsed: "+e);
                ui.setRunning(false);
                return;
            }
        }
        ui.setMessage(jobs.size()+" jobs found in file: "+args[0]);
        if (jobs.isEmpty()) return;
        for (BatchFitTask t : jobs) {
            if (!t.isValid()) {
                ui.setMessage("Error: job: "+t.toString()+" is not valid");
                t.publishErrors();
                ui.setRunning(false);
                return;
            }
        }
        ui.setMessage(">Will execute: "+jobs.size()+" jobs");
        for (BatchFitTask t : jobs) t.runTask();
        int errorCount = 0;
        int processed = 0, failed = 0, skipped = 0;
        for (BatchFitTask t: jobs) {
            errorCount+=t.getErrors().size();
            processed += t.getProcessedCount();
            failed += t.getFailedCount();
            skipped += t.getSkippedCount();
        }
        ui.setMessage("All jobs finished. Files processed: "+processed+", failed: "+failed+", skipped: "+skipped+". Errors: "+errorCount);
        ui.setRunning(false);
    }

}
