package com.example.towermud.persistence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Lenient accessors for maps parsed by SnakeYAML. Values may arrive as
 * numbers, booleans or strings depending on how the file was written.
 */
public final class YamlSupport {

    private YamlSupport() {}

    public static String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        return val != null ? val.toString() : defaultVal;
    }

    public static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try { return Integer.parseInt(((String) val).trim()); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }

    public static long getLong(Map<String, Object> map, String key, long defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).longValue();
        if (val instanceof String) {
            try { return Long.parseLong(((String) val).trim()); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }

    public static double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).doubleValue();
        if (val instanceof String) {
            try { return Double.parseDouble(((String) val).trim()); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }

    public static boolean getBoolean(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean) return (Boolean) val;
        if (val instanceof String) return Boolean.parseBoolean(((String) val).trim());
        return defaultVal;
    }

    /** A nested mapping, or an empty map when missing or not a mapping. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object val = map.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        return Collections.emptyMap();
    }

    /** A list of mappings; non-mapping entries are skipped. */
    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> getMapList(Map<String, Object> map, String key) {
        Object val = map.get(key);
        List<Map<String, Object>> out = new ArrayList<>();
        if (val instanceof List) {
            for (Object o : (List<?>) val) {
                if (o instanceof Map) out.add((Map<String, Object>) o);
            }
        }
        return out;
    }

    /** A list of strings; a single scalar becomes a one-element list. */
    public static List<String> getStringList(Map<String, Object> map, String key) {
        Object val = map.get(key);
        List<String> out = new ArrayList<>();
        if (val instanceof List) {
            for (Object o : (List<?>) val) if (o != null) out.add(o.toString());
        } else if (val != null) {
            out.add(val.toString());
        }
        return out;
    }
}
