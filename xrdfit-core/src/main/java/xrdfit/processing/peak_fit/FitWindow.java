package xrdfit.processing.peak_fit;

/**
 * Range of samples a group is fitted on: [start; stop)
 */
public class FitWindow {
    final int start, stop;
    final double xMin, xMax;

    public FitWindow(int start, int stop, double xMin, double xMax) {
        this.start = start;
        this.stop = stop;
        this.xMin = xMin;
        this.xMax = xMax;
    }

    public int getStart() {
        return start;
    }
    public int getStop() {
        return stop;
    }
    public int size() {
        return Math.max(0, stop - start);
    }
    /**
     *
     * @return requested left bound, in x units
     */
    public double getXMin() {
        return xMin;
    }
    /**
     *
     * @return requested right bound, in x units
     */
    public double getXMax() {
        return xMax;
    }

    @Override
    public String toString() {
        return "["+start+"; "+stop+")";
    }
}
