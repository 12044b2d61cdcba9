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

import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrdfit.utils.ArrayUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Density based grouping (DBSCAN) of peak positions.
 * Positions closer than eps, directly or through a chain of positions, are grouped when they are core points. Isolated positions are assigned to the group of the nearest grouped position.
 * @author Jean Ollion
 */
public class PeakGrouper {
    public static final Logger logger = LoggerFactory.getLogger(PeakGrouper.class);
    public static final double DEFAULT_EPS_FACTOR = 1.5;

    /**
     * Identity-based wrapper: positions can be equal
     */
    static class PeakPosition implements Clusterable {
        final int index;
        final double[] point;
        PeakPosition(int index, double position) {
            this.index = index;
            this.point = new double[]{position};
        }
        @Override
        public double[] getPoint() {
            return point;
        }
    }

    /**
     * Default neighborhood radius: {@value #DEFAULT_EPS_FACTOR} × median of the gaps between successive sorted positions
     * @param positions
     * @return radius, 1 if there are less than 2 positions
     */
    public static double getDefaultEps(double[] positions) {
        if (positions.length<2) return 1;
        double[] sorted = positions.clone();
        Arrays.sort(sorted);
        return ArrayUtil.median(ArrayUtil.diff(sorted)) * DEFAULT_EPS_FACTOR;
    }

    public static ClusterResult cluster(double[] positions) {
        return cluster(positions, Double.NaN, 1);
    }

    /**
     *
     * @param positions peak positions, in any order
     * @param eps neighborhood radius. NaN: see {@link #getDefaultEps(double[])}
     * @param minSamples minimal number of positions within eps (including the position itself) for a position to be a core point
     * @return group labels, in the same order as {@param positions}
     */
    public static ClusterResult cluster(double[] positions, double eps, int minSamples) {
        if (minSamples<1) throw new IllegalArgumentException("minSamples must be >= 1");
        if (Double.isNaN(eps)) eps = getDefaultEps(positions);
        if (eps<0) throw new IllegalArgumentException("eps must be >= 0");
        int n = positions.length;
        if (n==0) return new ClusterResult(new int[0], 0, eps);
        if (n==1) return new ClusterResult(new int[]{0}, 1, eps);
        List<PeakPosition> points = new ArrayList<>(n);
        for (int i = 0; i<n; ++i) points.add(new PeakPosition(i, positions[i]));
        List<Cluster<PeakPosition>> clusters = new DBSCANClusterer<PeakPosition>(eps, minSamples - 1).cluster(points);
        int[] labels = new int[n];
        Arrays.fill(labels, -1);
        for (int c = 0; c<clusters.size(); ++c) {
            for (PeakPosition p : clusters.get(c).getPoints()) labels[p.index] = c;
        }
        if (clusters.isEmpty()) {
            logger.debug("all {} positions are isolated with eps={}: single group", n, eps);
            Arrays.fill(labels, 0);
        } else {
            int[] clustered = IntStream.range(0, n).filter(i -> labels[i]>=0).toArray();
            for (int i = 0; i<n; ++i) {
                if (labels[i]>=0) continue;
                int nearest = clustered[0];
                for (int j : clustered) if (Math.abs(positions[j] - positions[i]) < Math.abs(positions[nearest] - positions[i])) nearest = j;
                labels[i] = labels[nearest];
            }
        }
        return relabel(positions, labels, eps);
    }

    /**
     * Numbers groups by increasing position of their leftmost member
     */
    static ClusterResult relabel(double[] positions, int[] labels, double eps) {
        int maxLabel = Arrays.stream(labels).max().getAsInt();
        double[] leftMost = new double[maxLabel+1];
        Arrays.fill(leftMost, Double.POSITIVE_INFINITY);
        for (int i = 0; i<labels.length; ++i) leftMost[labels[i]] = Math.min(leftMost[labels[i]], positions[i]);
        int[] existing = IntStream.range(0, maxLabel+1).filter(l -> leftMost[l]<Double.POSITIVE_INFINITY).boxed()
                .sorted(Comparator.comparingDouble(l -> leftMost[l])).mapToInt(Integer::intValue).toArray();
        int[] newLabel = new int[maxLabel+1];
        for (int i = 0; i<existing.length; ++i) newLabel[existing[i]] = i;
        int[] res = new int[labels.length];
        for (int i = 0; i<labels.length; ++i) res[i] = newLabel[labels[i]];
        ClusterResult result = new ClusterResult(res, existing.length, eps);
        logger.debug("clustering: {}", result);
        return result;
    }
}
