package xrdfit.data_structure;

/**
 * Control point of the background curve. Auto-derived anchors are regenerated on demand, user-defined anchors are kept until cleared
 */
public class BackgroundAnchor implements Comparable<BackgroundAnchor> {
    final double x, y;
    final boolean userDefined;

    public BackgroundAnchor(double x, double y, boolean userDefined) {
        this.x = x;
        this.y = y;
        this.userDefined = userDefined;
    }

    public double getX() {
        return x;
    }
    public double getY() {
        return y;
    }
    public boolean isUserDefined() {
        return userDefined;
    }

    @Override
    public int compareTo(BackgroundAnchor o) {
        return Double.compare(x, o.x);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BackgroundAnchor)) return false;
        BackgroundAnchor that = (BackgroundAnchor) o;
        return Double.compare(that.x, x) == 0 && Double.compare(that.y, y) == 0 && userDefined == that.userDefined;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 29 * hash + Double.hashCode(x);
        hash = 29 * hash + Double.hashCode(y);
        return 29 * hash + (userDefined ? 1 : 0);
    }

    @Override
    public String toString() {
        return "("+x+"; "+y+")";
    }
}
