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
package xrdfit.data_structure;

import xrdfit.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Peaks fitted jointly. Peaks are ordered by position, {@link #getOriginalIndices()} gives for each peak its index in the collection supplied to the fit
 * @author Jean Ollion
 */
public class PeakGroup {
    final int id;
    final List<Peak> peaks;
    final int[] originalIndices;

    public PeakGroup(int id, List<Peak> peaks, int[] originalIndices) {
        if (peaks.size()!=originalIndices.length) throw new IllegalArgumentException("peaks and indices should have same size");
        this.id = id;
        this.peaks = Collections.unmodifiableList(new ArrayList<>(peaks));
        this.originalIndices = originalIndices.clone();
    }

    public int getId() {
        return id;
    }
    public int size() {
        return peaks.size();
    }
    public List<Peak> getPeaks() {
        return peaks;
    }
    public Peak getPeak(int i) {
        return peaks.get(i);
    }
    public int[] getOriginalIndices() {
        return originalIndices.clone();
    }
    public int getOriginalIndex(int i) {
        return originalIndices[i];
    }
    public Peak getFirst() {
        return peaks.get(0);
    }
    public Peak getLast() {
        return peaks.get(peaks.size()-1);
    }
    public int getMinSampleIndex() {
        return peaks.stream().mapToInt(Peak::getIndex).min().orElse(-1);
    }
    public int getMaxSampleIndex() {
        return peaks.stream().mapToInt(Peak::getIndex).max().orElse(-1);
    }

    @Override
    public String toString() {
        return "Group#"+id+" peaks: "+Utils.toStringArray(originalIndices) + " x="+ peaks.stream().map(p -> Utils.formatDouble(4, p.getPosition())).collect(Collectors.joining("; ", "[", "]"));
    }
}
