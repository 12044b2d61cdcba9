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

import org.junit.Test;
import xrdfit.data_structure.FitResult;
import xrdfit.data_structure.Peak;
import xrdfit.data_structure.PeakGroup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ResultAssemblerTest {

    @Test
    public void testUnpackAndAssemble() {
        PeakGroup group = new PeakGroup(2, Arrays.asList(new Peak(10, 1), new Peak(20, 2)), new int[]{3, 1});
        double[] params = new double[]{100, 1.01, 0.1, 0.2, 0.3, 50, 2.02, 0.15, 0.25, 0.6};
        FitWindow window = new FitWindow(4, 30, 0.5, 3);
        List<FitResult> unpacked = ResultAssembler.unpack(group, params, ProfileModel.PSEUDO_VOIGT, window);
        assertEquals(2, unpacked.size());
        assertEquals(3, unpacked.get(0).getPeakIndex());
        assertEquals(2, unpacked.get(0).getGroupId());
        assertArrayEquals(new double[]{100, 1.01, 0.1, 0.2, 0.3}, unpacked.get(0).getParameters(), 0);
        assertEquals(ProfileModel.pseudoVoigtFWHM(0.15, 0.25, 0.6), unpacked.get(1).getFWHM(), 1e-12);
        assertEquals(ProfileModel.pseudoVoigtArea(50, 0.15, 0.25, 0.6), unpacked.get(1).getArea(), 1e-12);
        assertEquals(4, unpacked.get(1).getWindowStart());
        assertEquals(3, unpacked.get(1).getWindowXMax(), 0);

        List<FitResult> all = new ArrayList<>(unpacked);
        all.add(new FitResult(0, 0, ProfileModel.PSEUDO_VOIGT, new double[]{1, 0.5, 0.1, 0.1, 0}, 0, 3, 0, 1));
        List<FitResult> assembled = ResultAssembler.assemble(all);
        assertEquals(Arrays.asList(0, 1, 3), Arrays.asList(assembled.get(0).getPeakIndex(), assembled.get(1).getPeakIndex(), assembled.get(2).getPeakIndex()));
    }

    @Test
    public void testVoigtResult() {
        FitResult r = new FitResult(0, 0, ProfileModel.VOIGT, new double[]{80, 3, 0.2, 0.1}, 0, 10, 2, 4);
        assertFalse(r.hasEta());
        assertTrue(Double.isNaN(r.getEta()));
        assertEquals(80, r.getArea(), 0);
        assertEquals(2.355 * 0.2, r.getFWHM(), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParameterCount() {
        PeakGroup group = new PeakGroup(0, Arrays.asList(new Peak(10, 1)), new int[]{0});
        ResultAssembler.unpack(group, new double[5], ProfileModel.VOIGT, new FitWindow(0, 10, 0, 1));
    }
}
