package com.sandstormtracker.parser;

/**
 * Decodes scenario ids such as {@code Scenario_Refinery_Push_Insurgents}.
 */
public final class Scenarios {

    private static final String PREFIX = "Scenario_";

    private Scenarios() {}

    /** "Security", "Insurgents" or null for sideless modes. */
    public static String playerTeam(String scenario) {
        if (scenario.contains("_Security")) {
            return "Security";
        }
        if (scenario.contains("_Insurgents")) {
            return "Insurgents";
        }
        return null;
    }

    public static String mode(String scenario) {
        String body = scenario.startsWith(PREFIX) ? scenario.substring(PREFIX.length()) : scenario;
        body = stripSuffix(body, "_Security");
        body = stripSuffix(body, "_Insurgents");

        String[] parts = body.split("_");
        if (parts.length < 2) {
            return null;
        }
        String last = parts[parts.length - 1];
        if (last.equals("Hardcore") && parts.length >= 3) {
            return parts[parts.length - 2] + " Hardcore";
        }
        return last;
    }

    private static String stripSuffix(String value, String suffix) {
        return value.endsWith(suffix) ? value.substring(0, value.length() - suffix.length()) : value;
    }
}
