package driver;

import util.logging.LogLevel;

/*
 * configuration of the lifter, read from system properties
 * eg: -Ddebug=true -Dformula.passes=deadbranchelimination,bitwidthreduction
 */
public class Config {
    private static Config config = new Config();

    public boolean isO1 = true;
    public boolean isDebug = false;
    public boolean typecheck = true;
    public int checkSamples = 0;
    public long checkSeed = 0L;

    public LogLevel logLevel = LogLevel.INFO;
    public boolean logConsole = false;
    public boolean logFile = false;

    private Config() {
        isDebug = getFlag("debug");
        typecheck = getFlag("lift.typecheck", true);
        checkSamples = getInt("lift.check.samples", 0);
        checkSeed = getLong("lift.check.seed", 0L);
        logLevel = LogLevel.parse(System.getProperty("log.level"), LogLevel.INFO);
        logConsole = getFlag("log.console");
        logFile = getFlag("log.file");
    }

    /**
     * Check if a boolean system property is set to "true" (case-insensitive).
     * @param name the system property name
     * @return true if the property is exactly "true", false otherwise
     */
    public static boolean getFlag(String name) {
        return getFlag(name, false);
    }

    public static boolean getFlag(String name, boolean fallback) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim().equalsIgnoreCase("true");
    }

    public static int getInt(String name, int fallback) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("system property " + name + " is not an int: " + raw, e);
        }
    }

    public static long getLong(String name, long fallback) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("system property " + name + " is not a long: " + raw, e);
        }
    }

    public static Config getInstance() {
        return config;
    }
}
