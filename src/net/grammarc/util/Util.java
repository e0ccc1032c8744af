package net.grammarc.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.json.JSONArray;
import org.json.JSONObject;

public final class Util {

    // Prevent construction.
    private Util() {}

    public static JSONObject createJSONObject(Object... params) {
        if (params.length % 2 == 1)
            throw new IllegalArgumentException("Invalid parameter amount " +
                "for createJSONObject()");
        JSONObject ret = new JSONObject();
        for (int i = 0; i < params.length; i += 2) {
            if (! (params[i] instanceof String))
                throw new IllegalArgumentException("Invalid parameter " +
                    "type for createJSONObject()");
            // JSONObject drops null values; emitters expect the key.
            ret.put((String) params[i], (params[i + 1] == null) ?
                JSONObject.NULL : params[i + 1]);
        }
        return ret;
    }

    public static JSONArray sortedJSONArray(Collection<String> items) {
        List<String> sorted = new ArrayList<String>(items);
        Collections.sort(sorted);
        return new JSONArray(sorted);
    }

    public static JSONObject sortedSetMap(
            Map<String, ? extends Collection<String>> map) {
        JSONObject ret = new JSONObject();
        for (Map.Entry<String, ? extends Collection<String>> ent :
                new TreeMap<String, Collection<String>>(map).entrySet()) {
            ret.put(ent.getKey(), sortedJSONArray(ent.getValue()));
        }
        return ret;
    }

    public static JSONArray toJSONArray(int[] values) {
        JSONArray ret = new JSONArray();
        for (int v : values) ret.put(v);
        return ret;
    }

}
