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

import xrdfit.ui.logger.ProgressLogger;

/**
 *
 * @author Jean Ollion
 */
public interface ProgressCallback {
    void incrementTaskNumber(int tasks);
    void setTaskNumber(int number);
    int getTaskNumber();
    void incrementProgress();
    void log(String message);

    static ProgressCallback get(ProgressLogger ui) {
        return new ProgressCallback() {
            int taskCounter = 0;
            int taskNumber = 0;

            @Override
            public void incrementTaskNumber(int tasks) {
                taskNumber += tasks;
            }

            @Override
            public void setTaskNumber(int number) {
                taskNumber = number;
                taskCounter = 0;
            }

            @Override
            public int getTaskNumber() {
                return taskNumber;
            }

            @Override
            public synchronized void incrementProgress() {
                ++taskCounter;
                if (taskNumber>0) ui.setProgress((int)(100 * ((double)taskCounter / taskNumber)));
            }

            @Override
            public void log(String message) {
                ui.setMessage(message);
            }
        };
    }
}
