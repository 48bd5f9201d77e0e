package org.jaclang.semantic;

import org.jaclang.ast.declarations.JacModule;

import java.util.Optional;

/**
 * Finds modules referenced by imports. The returned module must already have been
 * through the scope-build pass so its root scope is available.
 */
public interface ModuleResolver
{
	Optional<JacModule> resolve(String dotPath);

	/**
	 * A resolver that knows no modules.
	 */
	static ModuleResolver none()
	{
		return dotPath -> Optional.empty();
	}
}
