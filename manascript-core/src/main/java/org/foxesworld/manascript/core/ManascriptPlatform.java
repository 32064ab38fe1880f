package org.foxesworld.manascript.core;

public final class ManascriptPlatform {
    public static final String NAME = "Manascript";

    public static String java() {
        return System.getProperty("java.version");
    }

    public static String os() {
        return System.getProperty("os.name") + " " + System.getProperty("os.version");
    }

    /** One-line runtime description for startup logs. */
    public static String describe() {
        return NAME + " on Java " + java() + " (" + os() + ")";
    }

    private ManascriptPlatform() {}
}
