package org.jaclang.semantic;

import org.jaclang.ast.declarations.JacModule;
import org.jaclang.parser.JacSourceParser;
import org.jaclang.util.ErrorHandler;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModuleRegistryTest
{
	@Test
	void unscopedModuleIsRejected()
	{
		ModuleRegistry registry = new ModuleRegistry();
		JacModule module = new JacSourceParser(new ErrorHandler("lib")).parse("glob x = 1;\n");

		assertThatThrownBy(() -> registry.register(module))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("lib");
		assertThat(registry.contains("lib")).isFalse();
	}

	@Test
	void registeredModuleResolvesByDottedName()
	{
		ModuleRegistry registry = new ModuleRegistry();
		ErrorHandler errorHandler = new ErrorHandler("pkg.lib");
		JacModule module = new JacSourceParser(errorHandler).parse("glob x = 1;\n");
		new SemanticAnalyzer(errorHandler, registry).analyze(module);

		registry.register(module);

		assertThat(registry.resolve("pkg.lib")).containsSame(module);
		assertThat(registry.resolve("pkg")).isEmpty();
	}
}
