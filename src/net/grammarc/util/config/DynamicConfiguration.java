package net.grammarc.util.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public class DynamicConfiguration implements Configuration {

    public static final String DEFAULTS_RESOURCE = "grammarc.properties";

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(key.toUpperCase().replace(".", "_"));
        }
    };

    private static final Logger LOGGER = Logger.getLogger("Config");

    private final List<Configuration> sources;
    private final Map<String, String> data;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        data = new LinkedHashMap<String, String>();
    }

    public synchronized String get(String key) {
        if (data.containsKey(key)) return data.get(key);
        String ret = null;
        for (Configuration src : sources) {
            ret = src.get(key);
            if (ret != null) break;
        }
        data.put(key, ret);
        return ret;
    }

    public boolean getBoolean(String key, boolean dflt) {
        String value = get(key);
        if (value == null || value.isEmpty()) return dflt;
        value = value.trim();
        if (value.equalsIgnoreCase("true") || value.equals("1") ||
                value.equalsIgnoreCase("yes"))
            return true;
        if (value.equalsIgnoreCase("false") || value.equals("0") ||
                value.equalsIgnoreCase("no"))
            return false;
        LOGGER.warning("Ignoring non-boolean value " + value + " of " + key);
        return dflt;
    }

    public int getInt(String key, int dflt) {
        String value = get(key);
        if (value == null || value.isEmpty()) return dflt;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException exc) {
            LOGGER.warning("Ignoring non-integer value " + value + " of " +
                           key);
            return dflt;
        }
    }

    public synchronized void put(String key, String value) {
        data.put(key, value);
    }

    public synchronized void remove(String key) {
        data.remove(key);
    }

    public void addSource(Configuration source) {
        sources.add(source);
    }

    public static DynamicConfiguration wrap(Configuration base) {
        if (base instanceof DynamicConfiguration)
            return (DynamicConfiguration) base;
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(base);
        return ret;
    }

    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        PropertiesConfiguration bundled =
            PropertiesConfiguration.fromResource(DEFAULTS_RESOURCE);
        if (bundled != null) ret.addSource(bundled);
        return ret;
    }

}
