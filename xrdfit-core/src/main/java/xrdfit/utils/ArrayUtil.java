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
package xrdfit.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.DoublePredicate;

/**
 *
 * @author Jean Ollion
 */
public class ArrayUtil {
    public static final Logger logger = LoggerFactory.getLogger(ArrayUtil.class);

    /**
     * Equivalent of a left-sided insertion point search in a sorted array
     * @param sortedArray array sorted in increasing order
     * @param key value to insert
     * @return first index i such that sortedArray[i] >= key, or sortedArray.length if all values are lower
     */
    public static int searchSorted(double[] sortedArray, double key) {
        int low = 0;
        int high = sortedArray.length;
        while (low < high) {
            int mid = low  + ((high - low) / 2);
            if (sortedArray[mid] < key) low = mid + 1;
            else high = mid;
        }
        return low;
    }

    /**
     *
     * @param sortedArray array sorted in increasing order
     * @param key value
     * @return index of the element of {@param sortedArray} closest to {@param key}. In case of tie the lowest index is returned
     */
    public static int nearestIndex(double[] sortedArray, double key) {
        int idx = searchSorted(sortedArray, key);
        if (idx==0) return 0;
        if (idx==sortedArray.length) return sortedArray.length-1;
        return (key - sortedArray[idx-1] <= sortedArray[idx] - key) ? idx-1 : idx;
    }

    public static int max(double[] array) {
        return max(array, 0, array.length);
    }
    /**
     *
     * @param array
     * @param start start of search index, inclusive
     * @param stop end of search index, exclusive
     * @return index of maximum value (first occurrence)
     */
    public static int max(double[] array, int start, int stop) {
        if (start<0) start=0;
        if (stop>array.length) stop=array.length;
        if (stop<=start) throw new IllegalArgumentException("Stop before start");
        int idxMax = start;
        for (int i = start+1; i<stop; ++i) if (array[i]>array[idxMax]) idxMax=i;
        return idxMax;
    }
    public static int min(double[] array) {
        return min(array, 0, array.length);
    }
    public static int min(double[] array, int start, int stop) {
        if (start<0) start=0;
        if (stop>array.length) stop=array.length;
        if (stop<=start) throw new IllegalArgumentException("Stop before start");
        int idxMin = start;
        for (int i = start+1; i<stop; ++i) if (array[i]<array[idxMin]) idxMin=i;
        return idxMin;
    }

    public static double mean(double[] array) {
        return mean(array, 0, array.length);
    }
    public static double mean(double[] array, int start, int stop) {
        double sum=0;
        for (int i = start; i<stop; ++i) sum+=array[i];
        sum /= (stop-start);
        return sum;
    }

    public static double median(double[] array) {
        if (array.length==0) return Double.NaN;
        double[] sorted = Arrays.copyOf(array, array.length);
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length%2==1) return sorted[mid];
        else return (sorted[mid-1] + sorted[mid]) / 2;
    }

    /**
     * @param array sorted array of length >= 2
     * @return mean of successive differences
     */
    public static double meanStep(double[] array) {
        if (array.length<2) return Double.NaN;
        return (array[array.length-1] - array[0]) / (array.length - 1);
    }

    public static double[] diff(double[] array) {
        if (array.length<2) return new double[0];
        double[] res = new double[array.length-1];
        for (int i = 1; i<array.length; ++i) res[i-1] = array[i] - array[i-1];
        return res;
    }

    public static int getFirstOccurence(double[] array, int start, int stop, DoublePredicate verify) {
        if (start<0) start=0;
        if (stop<0) stop = 0;
        if (stop>array.length) stop=array.length;
        if (start>=array.length) start = array.length-1;
        int i = start;
        if (start<=stop) {
            while(i<stop-1 && !verify.test(array[i])) ++i;
            if (verify.test(array[i])) return i;
            else return -1;
        } else {
            while (i>stop && !verify.test(array[i])) --i;
            if (verify.test(array[i])) return i;
            else return -1;
        }
    }

    /**
     * Strict local maxima of a 1D signal. Borders are never maxima. A flat maximum (plateau) is reduced to its middle sample (rounded down)
     * @param array signal
     * @return indices of local maxima in increasing order
     */
    public static List<Integer> getLocalMaxima(double[] array) {
        List<Integer> localMax = new ArrayList<>();
        int i = 1;
        int iMax = array.length - 1;
        while (i < iMax) {
            if (array[i - 1] < array[i]) {
                int ahead = i + 1;
                while (ahead < iMax && array[ahead] == array[i]) ++ahead; // suppress plateau
                if (array[ahead] < array[i]) {
                    localMax.add((i + ahead - 1) / 2);
                    i = ahead;
                }
            }
            ++i;
        }
        return localMax;
    }

    public static double[] duplicate(double[] array) {
        return Arrays.copyOf(array, array.length);
    }

    public static double[] subtract(double[] array, double[] toSubtract) {
        if (array.length!=toSubtract.length) throw new IllegalArgumentException("arrays should be of same length");
        double[] res = new double[array.length];
        for (int i = 0; i<array.length; ++i) res[i] = array[i] - toSubtract[i];
        return res;
    }

    public static int[] toIntArray(List<Integer> list) {
        return list.stream().mapToInt(Integer::intValue).toArray();
    }
}
