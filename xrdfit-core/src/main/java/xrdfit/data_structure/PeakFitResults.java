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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a fit: results of the successfully fitted peaks ordered by peak index, failed groups, and the intermediate values used (background, groups, clustering radius).
 * A partially failed fit still carries the results of the other groups.
 * @author Jean Ollion
 */
public class PeakFitResults {
    final List<FitResult> results;
    final List<GroupFailure> failures;
    final List<PeakGroup> groups;
    final List<BackgroundAnchor> anchors;
    final double[] background;
    final double eps;
    final boolean cancelled;

    public PeakFitResults(List<FitResult> results, List<GroupFailure> failures, List<PeakGroup> groups, List<BackgroundAnchor> anchors, double[] background, double eps, boolean cancelled) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
        this.groups = Collections.unmodifiableList(new ArrayList<>(groups));
        this.anchors = Collections.unmodifiableList(new ArrayList<>(anchors));
        this.background = background==null ? new double[0] : Arrays.copyOf(background, background.length);
        this.eps = eps;
        this.cancelled = cancelled;
    }

    public List<FitResult> getResults() {
        return results;
    }
    public Optional<FitResult> getResult(int peakIndex) {
        return results.stream().filter(r -> r.getPeakIndex()==peakIndex).findAny();
    }
    public List<GroupFailure> getFailures() {
        return failures;
    }
    public boolean hasFailures() {
        return !failures.isEmpty();
    }
    public List<PeakGroup> getGroups() {
        return groups;
    }
    public List<BackgroundAnchor> getAnchors() {
        return anchors;
    }
    public double[] getBackground() {
        return Arrays.copyOf(background, background.length);
    }
    /**
     *
     * @return clustering radius used to group peaks
     */
    public double getEps() {
        return eps;
    }
    /**
     *
     * @return whether the fit was interrupted before all groups were processed
     */
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public String toString() {
        return results.size()+" fitted peak(s), "+failures.size()+" failed group(s) over "+groups.size()+" group(s)"+(cancelled?" (cancelled)":"");
    }
}
