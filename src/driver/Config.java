package driver;

import frontend.plangen.CompilerConfig;

/*
 * process-wide configuration, read once from system properties
 */
public class Config {
    private static Config config = new Config();

    public boolean isDebug = false;
    public boolean isStrict = false;
    public int maxOps;
    public int maxSourceLength;
    public int maxDepth;
    public boolean boxKeywordLiterals;

    private Config() {
        isDebug = getFlag("debug");
        isStrict = getFlag("plan.strict");
        maxOps = getInt("plan.maxOps", CompilerConfig.DEFAULT_MAX_OPS);
        maxSourceLength = getInt("plan.maxSource", CompilerConfig.DEFAULT_MAX_SOURCE_LENGTH);
        maxDepth = getInt("plan.maxDepth", CompilerConfig.DEFAULT_MAX_DEPTH);
        boxKeywordLiterals = getFlag("plan.boxKeywordLiterals");
    }

    /**
     * Check if a boolean system property is set to "true" (case-insensitive).
     * @param name the system property name
     * @return true if the property is exactly "true", false otherwise
     */
    public static boolean getFlag(String name) {
        String raw = System.getProperty(name);
        return raw != null && raw.equalsIgnoreCase("true");
    }

    static int getInt(String name, int fallback) {
        String raw = System.getProperty(name);
        if (raw == null) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public static Config getInstance() {
        return config;
    }

    public CompilerConfig toCompilerConfig() {
        CompilerConfig base = isStrict ? CompilerConfig.strictConfig() : CompilerConfig.defaultConfig();
        return base
                .setMaxOps(maxOps)
                .setMaxSourceLength(maxSourceLength)
                .setMaxDepth(maxDepth)
                .setBoxKeywordLiterals(boxKeywordLiterals);
    }
}
