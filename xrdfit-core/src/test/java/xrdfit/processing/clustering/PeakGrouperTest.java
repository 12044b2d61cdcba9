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
package xrdfit.processing.clustering;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

/**
 *
 * @author Jean Ollion
 */
public class PeakGrouperTest {

    @Test
    public void testGroups() {
        ClusterResult res = PeakGrouper.cluster(new double[]{1, 1.1, 5, 5.2, 10}, 0.5, 1);
        assertEquals(3, res.getCount());
        assertArrayEquals(new int[]{0, 0, 1, 1, 2}, res.getLabels());
        assertEquals(Arrays.asList(Arrays.asList(0, 1), Arrays.asList(2, 3), Arrays.asList(4)), res.getGroups());
    }

    @Test
    public void testLabelsFollowPositions() {
        ClusterResult res = PeakGrouper.cluster(new double[]{10, 1, 5, 1.1}, 0.5, 1);
        assertArrayEquals("groups numbered by leftmost member", new int[]{2, 0, 1, 0}, res.getLabels());
    }

    @Test
    public void testChaining() {
        ClusterResult res = PeakGrouper.cluster(new double[]{0, 0.4, 0.8, 1.2, 3}, 0.5, 1);
        assertArrayEquals(new int[]{0, 0, 0, 0, 1}, res.getLabels());
    }

    @Test
    public void testDefaultEps() {
        assertEquals(2.25, PeakGrouper.getDefaultEps(new double[]{4, 1, 2}), 1e-12);
        assertEquals(1, PeakGrouper.getDefaultEps(new double[]{3}), 0);
        ClusterResult res = PeakGrouper.cluster(new double[]{1, 2, 4});
        assertEquals(1, res.getCount());
        assertEquals(2.25, res.getEps(), 1e-12);
    }

    @Test
    public void testIsolatedPositions() {
        ClusterResult res = PeakGrouper.cluster(new double[]{1, 1.1, 5}, 0.5, 2);
        assertEquals("isolated position joins the nearest group", 1, res.getCount());
        assertArrayEquals(new int[]{0, 0, 0}, res.getLabels());
        res = PeakGrouper.cluster(new double[]{1, 5, 10}, 0.5, 2);
        assertEquals("all isolated: single group", 1, res.getCount());
    }

    @Test
    public void testDegenerateInputs() {
        assertEquals(0, PeakGrouper.cluster(new double[0], 1, 1).getCount());
        ClusterResult single = PeakGrouper.cluster(new double[]{3}, Double.NaN, 1);
        assertEquals(1, single.getCount());
        assertArrayEquals(new int[]{0}, single.getLabels());
        ClusterResult duplicates = PeakGrouper.cluster(new double[]{2, 2}, 0, 1);
        assertArrayEquals(new int[]{0, 0}, duplicates.getLabels());
    }
}
