package xrdfit.processing.clustering;

import xrdfit.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Group label of each peak position. Labels range from 0 to count-1 and are numbered by increasing position of the leftmost member of each group
 */
public class ClusterResult {
    final int[] labels;
    final int count;
    final double eps;

    public ClusterResult(int[] labels, int count, double eps) {
        this.labels = labels;
        this.count = count;
        this.eps = eps;
    }

    public int[] getLabels() {
        return labels.clone();
    }
    public int getLabel(int i) {
        return labels[i];
    }
    public int getCount() {
        return count;
    }
    public double getEps() {
        return eps;
    }
    /**
     *
     * @return for each group, indices of its members in increasing order
     */
    public List<List<Integer>> getGroups() {
        List<List<Integer>> res = new ArrayList<>(count);
        for (int i = 0; i<count; ++i) res.add(new ArrayList<>());
        for (int i = 0; i<labels.length; ++i) res.get(labels[i]).add(i);
        return res;
    }

    @Override
    public String toString() {
        return count+" group(s) eps="+Utils.formatDouble(5, eps)+" labels="+Utils.toStringArray(labels);
    }
}
