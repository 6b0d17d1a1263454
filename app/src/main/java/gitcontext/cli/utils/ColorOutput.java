package gitcontext.cli.utils;

public class ColorOutput {
    public static final String RESET = "\033[0m";
    public static final String BOLD = "\033[1m";

    // Colors
    public static final String GREEN = "\033[32m";
    public static final String YELLOW = "\033[33m";
    public static final String CYAN = "\033[36m";

    private static boolean colorEnabled = true;

    public static void setColorEnabled(boolean enabled) {
        colorEnabled = enabled;
    }

    public static String colorize(String text, String color) {
        if (!colorEnabled)
            return text;
        return color + text + RESET;
    }

    public static String green(String text) {
        return colorize(text, GREEN);
    }

    public static String yellow(String text) {
        return colorize(text, YELLOW);
    }

    public static String cyan(String text) {
        return colorize(text, CYAN);
    }

    public static String bold(String text) {
        return colorize(text, BOLD);
    }
}
