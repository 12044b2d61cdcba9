package xrdfit.data_structure;

import xrdfit.utils.Utils;

/**
 * A group for which every optimization strategy failed. Its peaks have no {@link FitResult}.
 */
public class GroupFailure {
    final int groupId;
    final int[] peakIndices;
    final String message;

    public GroupFailure(int groupId, int[] peakIndices, String message) {
        this.groupId = groupId;
        this.peakIndices = peakIndices.clone();
        this.message = message;
    }

    public int getGroupId() {
        return groupId;
    }
    public int[] getPeakIndices() {
        return peakIndices.clone();
    }
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "Group#"+groupId+" peaks: "+ Utils.toStringArray(peakIndices)+" failed: "+message;
    }
}
