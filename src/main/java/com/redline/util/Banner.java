package com.redline.util;

import com.redline.util.LogUtil.Color;

import java.util.List;
import java.util.Properties;

/**
 * Startup banner printed when a server begins listening.
 * Lists the bound address and the size of the route table.
 */
public class Banner {

    private static final String[] REDLINE_BANNER = {
        "  ____          _ _ _            ",
        " |  _ \\ ___  __| | (_)_ __   ___ ",
        " | |_) / _ \\/ _` | | | '_ \\ / _ \\",
        " |  _ <  __/ (_| | | | | | |  __/",
        " |_| \\_\\___|\\__,_|_|_|_| |_|\\___|",
        "                                 "
    };

    /**
     * Generates the banner text.
     *
     * @param host host the server is bound to
     * @param port port the server is listening on
     * @param routeTable one line per registered route
     * @return the formatted banner string
     */
    public static String generate(String host, int port, List<String> routeTable) {
        StringBuilder sb = new StringBuilder();
        String lineSeparator = System.lineSeparator();

        for (String line : REDLINE_BANNER) {
            sb.append(LogUtil.highlight(line, Color.RED_BOLD)).append(lineSeparator);
        }

        Properties props = System.getProperties();
        sb.append(LogUtil.highlight(" :: Redline ::", Color.CYAN_BOLD))
            .append("  ")
            .append(LogUtil.highlight("(v1.0.0)", Color.WHITE_BOLD))
            .append(lineSeparator).append(lineSeparator);

        sb.append(LogUtil.highlight(" Listening on: ", Color.PURPLE))
            .append("http://").append("0.0.0.0".equals(host) ? "localhost" : host)
            .append(":").append(port).append(lineSeparator);

        sb.append(LogUtil.highlight(" Java:         ", Color.PURPLE))
            .append(props.getProperty("java.version"))
            .append(" (").append(props.getProperty("java.vendor")).append(")")
            .append(lineSeparator);

        sb.append(LogUtil.highlight(" Routes:       ", Color.PURPLE))
            .append(routeTable.size()).append(lineSeparator);
        for (String route : routeTable) {
            sb.append("   ").append(LogUtil.highlight(route, Color.WHITE)).append(lineSeparator);
        }
        return sb.toString();
    }

    /**
     * Prints the banner to standard output.
     *
     * @param host host the server is bound to
     * @param port port the server is listening on
     * @param routeTable one line per registered route
     */
    public static void display(String host, int port, List<String> routeTable) {
        System.out.println(generate(host, port, routeTable));
    }
}
