package org.lexlens.engine.util;

/*
 * This file is part of LexLens.
 *
 * Copyright (C) 2025 LexLens contributors
 *
 * LexLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * LexLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with LexLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Small static logger used throughout the engine.
 *
 * <p>Each line carries a timestamp, the thread name and the level. INFO and
 * below go to stdout, WARN and ERROR to stderr. Configuration is read once
 * from system properties:</p>
 * <ul>
 *   <li><b>lexlens.log.level</b> minimum level printed (default INFO)</li>
 *   <li><b>lexlens.log.datetime</b> timestamp pattern (default yyyy-MM-dd HH:mm:ss)</li>
 * </ul>
 */
public final class Logger {

    public enum Level {
        TRACE, DEBUG, INFO, WARN, ERROR;

        static Level parse(String s, Level fallback) {
            if (s == null) return fallback;
            try {
                return Level.valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                return fallback;
            }
        }
    }

    public static final String SYS_PROP_LEVEL = "lexlens.log.level";
    public static final String SYS_PROP_DATETIME = "lexlens.log.datetime";

    private static final Level MIN_LEVEL =
            Level.parse(System.getProperty(SYS_PROP_LEVEL), Level.INFO);

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern(System.getProperty(SYS_PROP_DATETIME, "yyyy-MM-dd HH:mm:ss"));

    private Logger() {}

    public static boolean isEnabled(Level level) {
        return level.ordinal() >= MIN_LEVEL.ordinal();
    }

    public static void trace(String msg, Object... args) { log(Level.TRACE, null, msg, args); }
    public static void debug(String msg, Object... args) { log(Level.DEBUG, null, msg, args); }
    public static void info (String msg, Object... args) { log(Level.INFO , null, msg, args); }
    public static void warn (String msg, Object... args) { log(Level.WARN , null, msg, args); }
    public static void error(String msg, Object... args) { log(Level.ERROR, null, msg, args); }

    public static void warn (String msg, Throwable t, Object... args) { log(Level.WARN , t, msg, args); }
    public static void error(String msg, Throwable t, Object... args) { log(Level.ERROR, t, msg, args); }

    private static void log(Level level, Throwable t, String msg, Object... args) {
        if (!isEnabled(level)) return;

        final String line = "[" + LocalDateTime.now().format(TS) + "] ["
                + Thread.currentThread().getName() + "] " + level + " " + format(msg, args);
        final PrintStream out = (level.ordinal() >= Level.WARN.ordinal()) ? System.err : System.out;

        synchronized (Logger.class) {
            out.println(line);
            if (t != null) {
                // keep WARN lines to one line unless DEBUG is on
                if (level == Level.ERROR || isEnabled(Level.DEBUG)) {
                    t.printStackTrace(out);
                } else {
                    out.println("    caused by: " + t);
                }
            }
        }
    }

    /**
     * Replaces each "{}" in order with the next argument; leftover
     * arguments are appended separated by a space.
     */
    static String format(String template, Object... args) {
        if (template == null) return "null";
        if (args == null || args.length == 0) return template;

        StringBuilder sb = new StringBuilder(template.length() + args.length * 8);
        int argIdx = 0;
        int i = 0;
        while (i < template.length()) {
            int open = template.indexOf("{}", i);
            if (open < 0 || argIdx >= args.length) {
                sb.append(template, i, template.length());
                break;
            }
            sb.append(template, i, open).append(args[argIdx++]);
            i = open + 2;
        }
        while (argIdx < args.length) {
            sb.append(' ').append(args[argIdx++]);
        }
        return sb.toString();
    }
}
