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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Dispatches messages and progress to several loggers
 * @author Jean Ollion
 */
public class MultiProgressLogger implements ProgressLogger {
    final List<ProgressLogger> loggers = new ArrayList<>();

    public MultiProgressLogger(ProgressLogger... loggers) {
        this.loggers.addAll(Arrays.asList(loggers));
    }

    public MultiProgressLogger add(ProgressLogger... loggers) {
        this.loggers.addAll(Arrays.asList(loggers));
        return this;
    }

    @Override
    public void setProgress(int i) {
        loggers.forEach(l -> l.setProgress(i));
    }

    @Override
    public void setMessage(String message) {
        loggers.forEach(l -> l.setMessage(message));
    }

    @Override
    public void setRunning(boolean running) {
        loggers.forEach(l -> l.setRunning(running));
    }
}
