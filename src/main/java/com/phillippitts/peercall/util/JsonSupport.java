package com.phillippitts.peercall.util;

import org.json.JSONObject;

/** Null-tolerant accessors for relay JSON payloads. */
public final class JsonSupport {

    private JsonSupport() {}

    /**
     * Returns the string value for key, or {@code null} when absent or JSON null.
     * Numbers are rendered as strings since the relay is loose about id types.
     */
    public static String optString(JSONObject json, String key) {
        if (json == null || !json.has(key) || json.isNull(key)) {
            return null;
        }
        Object v = json.get(key);
        return String.valueOf(v);
    }

    public static Integer optInteger(JSONObject json, String key) {
        if (json == null || !json.has(key) || json.isNull(key)) {
            return null;
        }
        return json.optInt(key);
    }

    public static JSONObject optObject(JSONObject json, String key) {
        if (json == null) {
            return null;
        }
        return json.optJSONObject(key);
    }

    public static JSONObject orEmpty(JSONObject json) {
        return json == null ? new JSONObject() : json;
    }
}
