package net.grammarc.util;

import java.util.logging.Level;
import java.util.logging.Logger;
import net.grammarc.util.config.Configuration;

public final class Logging {

    public static final String LEVEL_KEY = "grammarc.log.level";

    private Logging() {}

    public static void initFormat() {
        System.setProperty("java.util.logging.SimpleFormatter.format",
                           "[%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL " +
                           "%4$s %3$s] %5$s%6$s%n");
    }

    public static Level parseLevel(String value, Level dflt) {
        if (value == null || value.isEmpty()) return dflt;
        try {
            return Level.parse(value.trim().toUpperCase());
        } catch (IllegalArgumentException exc) {
            Logger.getLogger("Logging").warning("Ignoring invalid log " +
                "level " + Formats.formatString(value));
            return dflt;
        }
    }

    public static Level applyLevel(Configuration config) {
        Level lvl = parseLevel(config.get(LEVEL_KEY), Level.WARNING);
        Logger.getLogger("").setLevel(lvl);
        return lvl;
    }

}
