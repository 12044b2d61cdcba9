package xrdfit.processing.background;

/**
 * Interpolation of the background curve through its anchors
 */
public enum BackgroundMethod {
    POLYNOMIAL("polynomial"),
    SPLINE("spline"),
    PIECEWISE("piecewise");

    public final String name;
    BackgroundMethod(String name) {
        this.name = name;
    }

    public static BackgroundMethod fromName(String name) {
        for (BackgroundMethod m : values()) {
            if (m.name.equalsIgnoreCase(name) || m.name().equalsIgnoreCase(name)) return m;
        }
        throw new IllegalArgumentException("Unknown background method: "+name);
    }

    @Override
    public String toString() {
        return name;
    }
}
