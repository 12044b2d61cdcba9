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
package xrdfit.processing.peak_fit;

import xrdfit.data_structure.FitResult;
import xrdfit.data_structure.PeakGroup;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 *
 * @author Jean Ollion
 */
public class ResultAssembler {

    /**
     * Splits packed parameters in one slice per peak, in the order peaks appear in {@param group}
     * @param group
     * @param params packed parameters
     * @param profile
     * @param window fit window of the group
     * @return results tagged with the original index of each peak and the group id
     */
    public static List<FitResult> unpack(PeakGroup group, double[] params, ProfileModel profile, FitWindow window) {
        int nParams = profile.getParameterCount();
        if (params.length != nParams * group.size()) throw new IllegalArgumentException("Expected "+nParams * group.size()+" parameters, got: "+params.length);
        List<FitResult> res = new ArrayList<>(group.size());
        for (int i = 0; i<group.size(); ++i) {
            double[] p = new double[nParams];
            System.arraycopy(params, i * nParams, p, 0, nParams);
            res.add(new FitResult(group.getOriginalIndex(i), group.getId(), profile, p, window.getStart(), window.getStop(), window.getXMin(), window.getXMax()));
        }
        return res;
    }

    /**
     *
     * @param results results of all groups
     * @return results ordered by original peak index
     */
    public static List<FitResult> assemble(Collection<FitResult> results) {
        List<FitResult> res = new ArrayList<>(results);
        res.sort(Comparator.comparingInt(FitResult::getPeakIndex));
        return res;
    }
}
