package org.jaclang.semantic;

import org.jaclang.ast.declarations.JacModule;
import org.jaclang.util.Debug;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory {@link ModuleResolver}. Compiled modules register under their dotted
 * name, so a module has to be compiled before the modules that include it.
 */
public class ModuleRegistry implements ModuleResolver
{
	private final Map<String, JacModule> modules = new LinkedHashMap<>();

	public void register(JacModule module)
	{
		if (module.getScope() == null)
		{
			throw new IllegalArgumentException("Module '" + module.getName() + "' has no scope, run the scope-build pass first");
		}
		Debug.logDebug("Registered module '" + module.getName() + "'");
		modules.put(module.getName(), module);
	}

	@Override
	public Optional<JacModule> resolve(String dotPath)
	{
		return Optional.ofNullable(modules.get(dotPath));
	}

	public boolean contains(String dotPath)
	{
		return modules.containsKey(dotPath);
	}
}
