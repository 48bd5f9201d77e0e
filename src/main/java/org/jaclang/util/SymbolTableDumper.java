package org.jaclang.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.jaclang.dto.ScopeDTO;
import org.jaclang.semantic.symbol.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes a module's scope tree as pretty-printed JSON: every scope with its symbols,
 * and for each symbol its kind, access, declaration line and use lines.
 */
public class SymbolTableDumper
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	public static String toJson(Scope root)
	{
		return GSON.toJson(SymbolDTOConverter.toScope(root));
	}

	public static ScopeDTO fromJson(String json)
	{
		return GSON.fromJson(json, ScopeDTO.class);
	}

	public static void write(Scope root, Path outPath) throws IOException
	{
		if (outPath.getParent() != null)
		{
			Files.createDirectories(outPath.getParent());
		}
		Files.writeString(outPath, toJson(root), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote symbol table of '" + root.getName() + "' to: " + outPath);
	}
}
