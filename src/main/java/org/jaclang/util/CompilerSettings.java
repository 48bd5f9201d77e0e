package org.jaclang.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Compiler settings, read from {@code jac.properties} on the classpath. Any key can
 * be overridden with a {@code jac.}-prefixed system property, e.g.
 * {@code -Djac.max_line_length=120}.
 */
public class CompilerSettings
{
	public static final String RESOURCE = "jac.properties";

	private final int maxLineLength;
	private final int indentSize;
	private final boolean debug;

	public CompilerSettings(Properties props)
	{
		this.maxLineLength = Integer.parseInt(read(props, "max_line_length", "160"));
		this.indentSize = Integer.parseInt(read(props, "indent_size", "4"));
		this.debug = Boolean.parseBoolean(read(props, "debug", "false"));
	}

	private static String read(Properties props, String key, String fallback)
	{
		String override = System.getProperty("jac." + key);
		if (override != null)
		{
			return override.trim();
		}
		return props.getProperty(key, fallback).trim();
	}

	public static CompilerSettings load()
	{
		Properties props = new Properties();
		try (InputStream in = CompilerSettings.class.getClassLoader().getResourceAsStream(RESOURCE))
		{
			if (in != null)
			{
				props.load(in);
			}
			else
			{
				Debug.logDebug("No " + RESOURCE + " on the classpath, using defaults.");
			}
		}
		catch (IOException e)
		{
			throw new UncheckedIOException("Could not read " + RESOURCE, e);
		}
		return new CompilerSettings(props);
	}

	public int getMaxLineLength()
	{
		return maxLineLength;
	}

	/**
	 * The formatter wraps at half the maximum line length.
	 */
	public int getWrapWidth()
	{
		return maxLineLength / 2;
	}

	public int getIndentSize()
	{
		return indentSize;
	}

	public boolean isDebug()
	{
		return debug;
	}
}
