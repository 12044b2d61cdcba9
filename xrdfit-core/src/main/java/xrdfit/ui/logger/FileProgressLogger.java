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
package xrdfit.ui.logger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrdfit.utils.FileIO;
import xrdfit.utils.Utils;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;

/**
 * Writes time-stamped messages to a log file. The file is locked while running
 * @author Jean Ollion
 */
public class FileProgressLogger implements ProgressLogger {
    public static final Logger logger = LoggerFactory.getLogger(FileProgressLogger.class);
    File logFile;
    FileLock fileLock;
    RandomAccessFile logFileWriter;
    boolean append;
    boolean logProgress;

    public FileProgressLogger(boolean append) {
        this.append = append;
    }
    public FileProgressLogger setLogProgress(boolean logProgress) {
        this.logProgress = logProgress;
        return this;
    }

    private synchronized void lockLogFile() {
        if (fileLock!=null || logFile==null) return;
        try {
            if (logFile.getParentFile()!=null) logFile.getParentFile().mkdirs();
            logFileWriter = new RandomAccessFile(logFile, "rw");
            fileLock = logFileWriter.getChannel().tryLock();
            if (!append) logFileWriter.setLength(0);
        } catch (OverlappingFileLockException e) {
            logger.error("log file already locked: {}", logFile);
            closeWriter();
        } catch (IOException e) {
            logger.error("log file could not be opened: {}", logFile, e);
            closeWriter();
        }
    }

    public synchronized void unlockLogFile() {
        if (fileLock!=null) {
            try {
                fileLock.release();
            } catch (IOException e) {
                logger.error("error releasing log file lock", e);
            } finally {
                fileLock = null;
            }
        }
        closeWriter();
    }

    private void closeWriter() {
        if (logFileWriter!=null) {
            try {
                logFileWriter.close();
            } catch (IOException e) {
                logger.error("could not close log file", e);
            } finally {
                logFileWriter = null;
            }
        }
    }

    public File getLogFile() {
        return logFile;
    }

    public void setLogFile(String path) {
        if (logFileWriter!=null) unlockLogFile();
        this.logFile = path==null ? null : new File(path);
    }

    @Override
    public void setProgress(int i) {
        if (logProgress) setMessage("Progress: "+i+"%");
    }

    @Override
    public synchronized void setMessage(String message) {
        if (logFileWriter!=null) {
            try {
                FileIO.write(logFileWriter, Utils.getFormattedTime()+": "+message, true);
            } catch (IOException e) {
                logger.error("cannot log to file: {}", logFile, e);
            }
        }
    }

    @Override
    public void setRunning(boolean running) {
        if (running) lockLogFile();
        else unlockLogFile();
    }
}
