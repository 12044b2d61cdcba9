package xrdfit.utils;

/**
 * Objects that can be stored as / restored from a json-simple entry (JSONObject, JSONArray, Number, String or Boolean)
 */
public interface JSONSerializable {
    Object toJSONEntry();
    void initFromJSONEntry(Object jsonEntry);
}
