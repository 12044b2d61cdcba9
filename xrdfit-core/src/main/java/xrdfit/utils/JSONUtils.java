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

import java.util.*;

import org.json.simple.JSONArray;
import org.json.simple.JSONAware;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.slf4j.LoggerFactory;

/**
 *
 * @author Jean Ollion
 */
public class JSONUtils {
    public final static org.slf4j.Logger logger = LoggerFactory.getLogger(JSONUtils.class);

    public static String serialize(JSONSerializable o) {
        Object entry = o.toJSONEntry();
        if (entry instanceof JSONAware) return ((JSONAware)entry).toJSONString();
        else return entry.toString();
    }
    public static JSONObject parse(String s) throws ParseException {
        Object res= new JSONParser().parse(s);
        return (JSONObject)res;
    }

    public static double[] fromDoubleArray(List array) {
        double[] res = new double[array.size()];
        for (int i = 0; i<res.length; ++i) {
            if (array.get(i)==null) {
                logger.debug("fromDoubleArrayError: {}", array);
                res[i] = Double.NaN;
            } else res[i]=((Number)array.get(i)).doubleValue();
        }
        return res;
    }
    public static JSONArray toJSONArray(double[] array) {
        JSONArray res = new JSONArray();
        for (double d : array) res.add(d);
        return res;
    }
    public static String[] fromStringArray(List array) {
        String[] res = new String[array.size()];
        res = (String[])array.toArray(res);
        return res;
    }
    public static JSONArray toJSONArray(String[] array) {
        JSONArray res = new JSONArray();
        res.addAll(Arrays.asList(array));
        return res;
    }

    /**
     * json-simple stores NaN as an invalid token, so NaN values are stored as the "NaN" string
     */
    public static Object toJSONEntry(double value) {
        if (Double.isNaN(value)) return "NaN";
        return value;
    }
    public static double getDouble(Map json, String key, double defaultValue) {
        Object o = json.get(key);
        if (o==null) return defaultValue;
        if (o instanceof Number) return ((Number)o).doubleValue();
        if (o instanceof String) {
            try {
                return Double.parseDouble((String)o);
            } catch (NumberFormatException e) {
                logger.warn("invalid number for key: {} -> {}", key, o);
                return defaultValue;
            }
        }
        return defaultValue;
    }
    public static int getInt(Map json, String key, int defaultValue) {
        Object o = json.get(key);
        if (o instanceof Number) return ((Number)o).intValue();
        return defaultValue;
    }
    public static boolean getBoolean(Map json, String key, boolean defaultValue) {
        Object o = json.get(key);
        if (o instanceof Boolean) return (Boolean)o;
        return defaultValue;
    }
    public static String getString(Map json, String key, String defaultValue) {
        Object o = json.get(key);
        if (o==null) return defaultValue;
        return o.toString();
    }
    public static <E extends Enum<E>> E getEnum(Map json, String key, Class<E> enumType, E defaultValue) {
        Object o = json.get(key);
        if (o==null) return defaultValue;
        try {
            return Enum.valueOf(enumType, o.toString());
        } catch (IllegalArgumentException e) {
            logger.warn("invalid value for key: {} -> {}, default value will be used: {}", key, o, defaultValue);
            return defaultValue;
        }
    }
}
