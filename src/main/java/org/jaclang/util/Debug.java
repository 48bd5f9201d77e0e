package org.jaclang.util;

/**
 * Console logging for the compiler. Debug output is off unless {@link #ENABLE_DEBUG}
 * is set, either directly or through the {@code debug} setting.
 */
public class Debug
{
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";
	public static final String ANSI_CYAN = "\u001B[36m";

	public static boolean ENABLE_DEBUG = false;

	// Turned off when output is not a terminal, e.g. in build logs.
	public static boolean ENABLE_COLOR = System.console() != null;

	public static void log(String log)
	{
		System.out.println(log);
	}

	public static void logInfo(String log)
	{
		System.out.println(paint(ANSI_GREEN, log));
	}

	public static void logDebug(String log)
	{
		if (ENABLE_DEBUG)
		{
			System.out.println(paint(ANSI_CYAN, log));
		}
	}

	public static void logWarning(String log)
	{
		System.out.println(paint(ANSI_YELLOW, log));
	}

	public static void logError(String log)
	{
		System.err.println(paint(ANSI_RED, log));
	}

	private static String paint(String color, String log)
	{
		return ENABLE_COLOR ? color + log + ANSI_RESET : log;
	}
}
