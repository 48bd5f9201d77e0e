package org.jaclang.util;

import org.jaclang.ast.declarations.JacModule;
import org.jaclang.dto.ScopeDTO;
import org.jaclang.dto.SymbolDTO;
import org.jaclang.parser.JacSourceParser;
import org.jaclang.semantic.ModuleRegistry;
import org.jaclang.semantic.SemanticAnalyzer;
import org.jaclang.semantic.symbol.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolTableDumperTest
{
	private Scope root;

	@BeforeEach
	void setUp()
	{
		ErrorHandler errorHandler = new ErrorHandler("shapes");
		JacModule module = new JacSourceParser(errorHandler).parse("""
				obj Base {
				    has x: int;
				}
				obj Child :Base: {
				    can get() -> int {
				        return self.x;
				    }
				}
				with entry {
				    c = Child();
				}
				""");
		SemanticAnalyzer analyzer = new SemanticAnalyzer(errorHandler, new ModuleRegistry());
		analyzer.analyze(module);
		root = analyzer.getRootScope();
	}

	private static SymbolDTO symbol(ScopeDTO scope, String name)
	{
		return scope.symbols.stream().filter(s -> s.name.equals(name)).findFirst().orElseThrow();
	}

	private static ScopeDTO child(ScopeDTO scope, String name)
	{
		return scope.children.stream().filter(s -> s.name.equals(name)).findFirst().orElseThrow();
	}

	@Test
	void dumpDescribesScopesAndSymbols()
	{
		ScopeDTO dto = SymbolTableDumper.fromJson(SymbolTableDumper.toJson(root));

		assertThat(dto.name).isEqualTo("shapes");
		assertThat(dto.owner).isEqualTo("JacModule");
		assertThat(dto.symbols).extracting(s -> s.name).contains("Base", "Child");

		SymbolDTO base = symbol(dto, "Base");
		assertThat(base.kind).isEqualTo("OBJECT_ARCH");
		assertThat(base.access).isEqualTo("PUBLIC");
		assertThat(base.declLine).isEqualTo(1);
		assertThat(base.useLines).containsExactly(4);
		assertThat(base.memberScope).isEqualTo("Base");

		ScopeDTO childScope = child(dto, "Child");
		assertThat(childScope.line).isEqualTo(4);
		assertThat(childScope.inherits).containsExactly("Base");

		SymbolDTO x = symbol(child(dto, "Base"), "x");
		assertThat(x.kind).isEqualTo("HAS_VAR");
		assertThat(x.useLines).containsExactly(6);
	}

	@Test
	void writeStoresPrettyPrintedJson(@TempDir Path dir) throws IOException
	{
		Path out = dir.resolve("out").resolve("shapes.json");

		SymbolTableDumper.write(root, out);

		String json = Files.readString(out);
		assertThat(json).isEqualTo(SymbolTableDumper.toJson(root));
		assertThat(json).contains("\n  \"name\": \"shapes\"");
	}
}
