package org.jaclang;

import org.jaclang.dto.ScopeDTO;
import org.jaclang.dto.SymbolDTO;
import org.jaclang.semantic.ModuleRegistry;
import org.jaclang.semantic.symbol.Symbol;
import org.jaclang.util.CompilerSettings;
import org.jaclang.util.DiagnosticKind;
import org.jaclang.util.SymbolDTOConverter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class JacCompilerTest
{
	private JacCompiler compiler;

	@BeforeEach
	void setUp()
	{
		compiler = new JacCompiler(new CompilerSettings(new Properties()), new ModuleRegistry());
	}

	@Test
	void compilesAndFormatsModule()
	{
		CompilationResult result = compiler.compile("obj A{has x:int;can get_x()->int{return self.x;}}", "main");

		assertThat(result.isSuccess()).isTrue();
		assertThat(result.getDiagnostics()).isEmpty();
		assertThat(result.getRootScope().getName()).isEqualTo("main");
		assertThat(result.getFormatted()).contains("""
				obj A {
				    has x: int;

				    can get_x() -> int {
				        return self.x;
				    }
				}
				""");
		assertThat(compiler.getRegistry().contains("main")).isTrue();
	}

	@Test
	void includePullsInPublicNamesOfCompiledModule()
	{
		CompilationResult base = compiler.compile("obj Base {\n    has a: int;\n}\nglob:priv hidden = 1;\n", "base");
		CompilationResult main = compiler.compile("include:jac base;\nwith entry {\n    b = Base();\n    print(hidden);\n}\n", "main");

		assertThat(base.isSuccess()).isTrue();
		assertThat(main.isSuccess()).isTrue();
		Symbol baseSymbol = base.getRootScope().getSymbols().get("Base");
		assertThat(main.getRootScope().getSymbols().get("Base")).isSameAs(baseSymbol);
		assertThat(baseSymbol.getUses()).hasSize(1);
		assertThat(main.getDiagnostics(DiagnosticKind.UNRESOLVED_NAME)).hasSize(1);
	}

	@Test
	void includeOfUnknownModuleStillFormats()
	{
		CompilationResult result = compiler.compile("include:jac nowhere;\n", "main");

		assertThat(result.isParsed()).isTrue();
		assertThat(result.hasErrors()).isTrue();
		assertThat(result.getDiagnostics(DiagnosticKind.MODULE_NOT_FOUND)).hasSize(1);
		assertThat(result.getFormatted()).contains("include:jac nowhere;\n");
	}

	@Test
	void syntaxErrorStopsPipeline()
	{
		CompilationResult result = compiler.compile("obj A { has x int; }", "broken");

		assertThat(result.isParsed()).isFalse();
		assertThat(result.isSuccess()).isFalse();
		assertThat(result.getFormatted()).isEmpty();
		assertThat(result.getDiagnostics(DiagnosticKind.SYNTAX_ERROR)).isNotEmpty();
		assertThat(compiler.getRegistry().contains("broken")).isFalse();
	}

	@Test
	void formatSkipsSemanticPasses()
	{
		assertThat(compiler.format("with entry{print(undefined);}")).contains("with entry {\n    print(undefined);\n}\n");
		assertThat(compiler.format("with entry {")).isEmpty();
	}

	@Test
	void compilesFileNamedAfterModule(@TempDir Path dir) throws IOException
	{
		Path file = dir.resolve("shapes.jac");
		Files.writeString(file, "glob area = 3;\n");

		CompilationResult result = compiler.compile(file);

		assertThat(result.getModuleName()).isEqualTo("shapes");
		assertThat(result.getModule().getName()).isEqualTo("shapes");
		assertThat(compiler.getRegistry().resolve("shapes")).isPresent();
	}

	@Test
	void formattedOutputCompilesToSameSymbolGraph()
	{
		String source = """
				import:py os;
				glob:priv counter=0,limit:int=10;
				obj Base{has x:int=0;can get()->int{return self.x;}}
				obj Point :Base: {has y:int=0;can norm()->float{return (self.x**2+self.y**2)**0.5;}
				can shift(dx:int){self.y+=dx;super.get();}}
				enum Color{RED=1,GREEN=2}
				can helper(*args)->list{result=[a for a in args if a];return result;}
				with entry{p=Point(x=1,y=2);for i in range(3){p.shift(i);}
				while counter<limit{counter+=1;}
				match p.y{case 1|2:print("small");case n:print(n);}}
				test point_norm{assertEqual(Point(x=3,y=4).norm(),5.0);}
				""";

		CompilationResult first = compiler.compile(source, "main");
		String formatted = first.getFormatted().orElseThrow();
		CompilationResult second = new JacCompiler(new CompilerSettings(new Properties()), new ModuleRegistry()).compile(formatted, "main");

		assertThat(first.isSuccess()).isTrue();
		assertThat(second.isSuccess()).isTrue();
		assertThat(formatted).isNotEqualTo(source);
		assertThat(second.getDiagnostics()).hasSameSizeAs(first.getDiagnostics());
		assertThat(shape(SymbolDTOConverter.toScope(second.getRootScope())))
				.isEqualTo(shape(SymbolDTOConverter.toScope(first.getRootScope())));
	}

	/**
	 * Renders a dumped scope tree without line numbers: scope names and owners, and each
	 * symbol's kind, access, declaration count, use count and member scope.
	 */
	private static String shape(ScopeDTO scope)
	{
		StringBuilder out = new StringBuilder();
		shape(scope, "", out);
		return out.toString();
	}

	private static void shape(ScopeDTO scope, String indent, StringBuilder out)
	{
		out.append(indent).append(scope.name).append(" <").append(scope.owner).append("> inherits ").append(scope.inherits).append('\n');
		for (SymbolDTO symbol : scope.symbols)
		{
			out.append(indent).append("  ").append(symbol.name)
					.append(' ').append(symbol.kind)
					.append(' ').append(symbol.access)
					.append(" decls=").append(symbol.additionalDeclLines.size() + 1)
					.append(" uses=").append(symbol.useLines.size())
					.append(" member=").append(symbol.memberScope)
					.append('\n');
		}
		for (ScopeDTO child : scope.children)
		{
			shape(child, indent + "    ", out);
		}
	}
}
