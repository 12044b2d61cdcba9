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

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.SimpleDateFormat;
import java.util.Collection;
import java.util.Date;
import java.util.Locale;
import java.util.function.Function;

/**
 *
 * @author Jean Ollion
 */
public class Utils {

    public static String formatDouble(int decimals, double number) {
        if (Double.isNaN(number)) return "NaN";
        StringBuilder pattern = new StringBuilder("0");
        if (decimals>0) pattern.append('.');
        for (int i = 0; i<decimals; ++i) pattern.append('0');
        return new DecimalFormat(pattern.toString(), DecimalFormatSymbols.getInstance(Locale.US)).format(number);
    }

    public static String getFormattedTime() {
        return new SimpleDateFormat("yyyy-MM-dd HH:mm:ss").format(new Date());
    }

    public static <T> String toStringList(Collection<T> array) {
        return toStringList(array, Object::toString);
    }
    public static <T> String toStringList(Collection<T> array, Function<T, Object> toString) {
        return toStringList(array, "[", "]", "; ", toString).toString();
    }
    public static <T> StringBuilder toStringList(Collection<T> array, String init, String end, String sep, Function<T, Object> toString) {
        StringBuilder sb = new StringBuilder(init);
        boolean first = true;
        for (T t : array) {
            if (!first) sb.append(sep);
            else first = false;
            sb.append(t==null ? "null" : toString.apply(t));
        }
        sb.append(end);
        return sb;
    }
    public static String toStringArray(int[] array) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i<array.length; ++i) {
            if (i>0) sb.append("; ");
            sb.append(array[i]);
        }
        return sb.append("]").toString();
    }
    public static String toStringArray(double[] array, int decimals) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i<array.length; ++i) {
            if (i>0) sb.append("; ");
            sb.append(formatDouble(decimals, array[i]));
        }
        return sb.append("]").toString();
    }
}
