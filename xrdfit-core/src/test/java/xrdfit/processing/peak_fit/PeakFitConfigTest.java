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

import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.junit.Test;
import xrdfit.processing.background.BackgroundMethod;
import xrdfit.utils.JSONUtils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

public class PeakFitConfigTest {

    @Test
    public void testJSON() throws ParseException {
        PeakFitConfig config = new PeakFitConfig().setProfile(ProfileModel.VOIGT).setOverlapMode(true).setBackgroundMethod(BackgroundMethod.SPLINE)
                .setSplineSmoothing(12.5).setPolyOrder(2).setMaxEvaluations(100, 200, 300).setFwhmWindow(30);
        PeakFitConfig other = new PeakFitConfig();
        other.initFromJSONEntry(JSONUtils.parse(JSONUtils.serialize(config)));
        assertEquals(config.toJSONEntry(), other.toJSONEntry());
        assertEquals(ProfileModel.VOIGT, other.profile);
        assertEquals(BackgroundMethod.SPLINE, other.backgroundMethod);
        assertEquals(12.5, other.splineSmoothing, 0);
        assertEquals(300, other.maxEvaluationsFallback);
        assertEquals(30, other.fwhmWindow);
    }

    @Test
    public void testDefaults() throws ParseException {
        PeakFitConfig defaults = new PeakFitConfig();
        PeakFitConfig other = new PeakFitConfig();
        other.initFromJSONEntry(JSONUtils.parse(JSONUtils.serialize(defaults)));
        assertTrue("unset smoothing", Double.isNaN(other.splineSmoothing));

        PeakFitConfig partial = new PeakFitConfig();
        JSONObject json = new JSONObject();
        json.put("polyOrder", 1);
        json.put("profile", "lorentzian");
        partial.initFromJSONEntry(json);
        assertEquals(1, partial.polyOrder);
        assertEquals("invalid value: default kept", ProfileModel.PSEUDO_VOIGT, partial.profile);
        assertEquals(BackgroundMethod.PIECEWISE, partial.backgroundMethod);
        assertEquals(2.5, partial.groupDistanceThreshold, 0);
    }

    @Test
    public void testModes() {
        PeakFitConfig config = new PeakFitConfig();
        assertEquals(2.5, config.getGroupingFactor(), 0);
        assertEquals(3, config.getWindowMultiplier(2), 0);
        assertEquals(0.5, config.getCenterTolerance(), 0);
        PeakFitConfig overlap = config.duplicate().setOverlapMode(true);
        assertNotSame(config, overlap);
        assertEquals(5, overlap.getGroupingFactor(), 0);
        assertEquals(4, overlap.getWindowMultiplier(2), 0);
        assertEquals(3, overlap.getWindowMultiplier(1), 0);
        assertEquals(0.8, overlap.getCenterTolerance(), 0);
        assertEquals("original unchanged", false, config.overlapMode);
    }
}
