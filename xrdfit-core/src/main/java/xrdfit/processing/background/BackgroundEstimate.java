package xrdfit.processing.background;

import xrdfit.data_structure.BackgroundAnchor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Background curve evaluated at each sample of a spectrum, with the anchors it was computed from and the method actually applied
 */
public class BackgroundEstimate {
    final double[] values;
    final List<BackgroundAnchor> anchors;
    final BackgroundMethod method;

    public BackgroundEstimate(double[] values, List<BackgroundAnchor> anchors, BackgroundMethod method) {
        this.values = values;
        this.anchors = Collections.unmodifiableList(new ArrayList<>(anchors));
        this.method = method;
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }
    public List<BackgroundAnchor> getAnchors() {
        return anchors;
    }
    /**
     *
     * @return method used to compute the curve. Null when the background is flat
     */
    public BackgroundMethod getMethod() {
        return method;
    }
}
