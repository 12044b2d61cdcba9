package xrdfit.data_structure;

/**
 * Reference to a sample of a {@link Spectrum}. Estimated height, FWHM and baseline are transient values, NaN until estimated.
 */
public class Peak implements Comparable<Peak> {
    final int index;
    final double position;
    final double height, fwhm, baseline;

    public Peak(int index, double position) {
        this(index, position, Double.NaN, Double.NaN, Double.NaN);
    }
    public Peak(int index, double position, double height, double fwhm, double baseline) {
        this.index = index;
        this.position = position;
        this.height = height;
        this.fwhm = fwhm;
        this.baseline = baseline;
    }

    public static Peak fromIndex(Spectrum spectrum, int index) {
        return new Peak(index, spectrum.getX(index));
    }

    public Peak setEstimation(double height, double fwhm, double baseline) {
        return new Peak(index, position, height, fwhm, baseline);
    }

    public int getIndex() {
        return index;
    }
    public double getPosition() {
        return position;
    }
    public double getHeight() {
        return height;
    }
    public double getFWHM() {
        return fwhm;
    }
    public double getBaseline() {
        return baseline;
    }

    @Override
    public int compareTo(Peak o) {
        return Double.compare(position, o.position);
    }

    @Override
    public String toString() {
        return "Peak{idx="+index+", x="+position+(Double.isNaN(fwhm)?"":", fwhm="+fwhm)+"}";
    }
}
