package org.jaclang.semantic;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.declarations.Architype;
import org.jaclang.ast.declarations.JacModule;
import org.jaclang.parser.JacSourceParser;
import org.jaclang.semantic.symbol.AccessModifier;
import org.jaclang.semantic.symbol.Scope;
import org.jaclang.semantic.symbol.Symbol;
import org.jaclang.semantic.symbol.SymbolKind;
import org.jaclang.util.DiagnosticKind;
import org.jaclang.util.ErrorHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolTableBuilderTest
{
	private ErrorHandler errorHandler;

	@BeforeEach
	void setUp()
	{
		errorHandler = new ErrorHandler("main");
	}

	private JacModule parse(String source)
	{
		JacModule module = new JacSourceParser(errorHandler).parse(source);
		assertThat(module).as("parse result").isNotNull();
		return module;
	}

	private Scope build(JacModule module)
	{
		return new SymbolTableBuilder(errorHandler).build(module);
	}

	@Test
	void rootScopeIsNamedAfterModule()
	{
		JacModule module = parse("glob x = 1;\n");

		Scope root = build(module);

		assertThat(root.getName()).isEqualTo("main");
		assertThat(root.getOwner()).isSameAs(module);
		assertThat(root.getParent()).isNull();
		assertThat(module.getScope()).isSameAs(root);
		assertThat(root.getSymbols()).containsKey("x");
	}

	@Test
	void architypeAndAbilityOpenNestedScopes()
	{
		JacModule module = parse("""
				obj Point {
				    has x: int;
				    can norm() -> float {
				        if x > 0 {
				            return 1.0;
				        }
				        return 0.0;
				    }
				}
				""");

		Scope root = build(module);

		Scope point = root.findScope("Point").orElseThrow();
		Scope norm = point.findScope("norm").orElseThrow();
		assertThat(norm.findScope("IfStmt")).isPresent();
		assertThat(point.getOwner()).isInstanceOf(Architype.class);

		Symbol pointSymbol = root.getSymbols().get("Point");
		assertThat(pointSymbol.getKind()).isEqualTo(SymbolKind.OBJECT_ARCH);
		assertThat(pointSymbol.getMemberScope()).isSameAs(point);
		assertThat(point.getSymbols().get("x").getKind()).isEqualTo(SymbolKind.HAS_VAR);
		assertThat(point.getSymbols().get("norm").getKind()).isEqualTo(SymbolKind.METHOD);
	}

	@Test
	void methodsGetSelfAndSuper()
	{
		JacModule module = parse("obj A {\n    can f() {\n        return;\n    }\n}\n");

		Scope root = build(module);

		Scope a = root.findScope("A").orElseThrow();
		Scope f = a.findScope("f").orElseThrow();
		Symbol self = f.getSymbols().get("self");
		assertThat(self.getKind()).isEqualTo(SymbolKind.SELF);
		assertThat(self.getMemberScope()).isSameAs(a);
		assertThat(f.getSymbols().get("super").getKind()).isEqualTo(SymbolKind.SUPER);
	}

	@Test
	void freeAbilityHasNoSelf()
	{
		JacModule module = parse("can helper(a: int, *rest) -> int {\n    return a;\n}\n");

		Scope root = build(module);

		Scope helper = root.findScope("helper").orElseThrow();
		assertThat(helper.getSymbols()).containsOnlyKeys("a", "rest");
		assertThat(helper.getSymbols().get("a").getKind()).isEqualTo(SymbolKind.PARAM);
		assertThat(root.getSymbols().get("helper").getKind()).isEqualTo(SymbolKind.ABILITY);
	}

	@Test
	void everyNodeRecordsItsScope()
	{
		JacModule module = parse("""
				# leading comment
				walker W {
				    can go with entry {
				        for i in [1, 2] {
				            visit [-->];
				        }
				    }
				}
				""");

		build(module);

		assertThat(module.findAll(AstNode.class)).allSatisfy(node -> assertThat(node.getScope()).isNotNull());
	}

	@Test
	void duplicateArchitypeIsReported()
	{
		JacModule module = parse("obj A {}\nobj A {}\n");

		build(module);

		assertThat(errorHandler.getDiagnostics(DiagnosticKind.DUPLICATE_DEFINITION)).hasSize(1);
		assertThat(errorHandler.getDiagnostics(DiagnosticKind.DUPLICATE_DEFINITION).get(0).location().firstLine()).isEqualTo(2);
	}

	@Test
	void forwardDeclarationIsNotADuplicate()
	{
		JacModule module = parse("obj A;\nobj A {\n    can f();\n    can f() {\n        return;\n    }\n}\n");

		build(module);

		assertThat(errorHandler.getDiagnostics()).isEmpty();
	}

	@Test
	void duplicateParameterIsReported()
	{
		JacModule module = parse("can f(a: int, a: int) {\n    return;\n}\n");

		build(module);

		assertThat(errorHandler.has(DiagnosticKind.DUPLICATE_DEFINITION)).isTrue();
	}

	@Test
	void accessTagsAreRecorded()
	{
		JacModule module = parse("glob:priv secret = 1;\nobj:protect A {\n    has:priv inner: int;\n}\n");

		Scope root = build(module);

		assertThat(root.getSymbols().get("secret").getAccess()).isEqualTo(AccessModifier.PRIVATE);
		assertThat(root.getSymbols().get("A").getAccess()).isEqualTo(AccessModifier.PROTECTED);
		Scope a = root.findScope("A").orElseThrow();
		assertThat(a.getSymbols().get("inner").getAccess()).isEqualTo(AccessModifier.PRIVATE);
	}

	@Test
	void testBlockDeclaresAssertionHelpers()
	{
		JacModule module = parse("test adds_up {\n    assertEqual(1 + 1, 2);\n}\n");

		Scope root = build(module);

		assertThat(root.getSymbols().get("adds_up").getKind()).isEqualTo(SymbolKind.TEST);
		Scope test = root.findScope("adds_up").orElseThrow();
		assertThat(test.getSymbols()).containsKeys("assertEqual", "assertTrue", "assertRaises");
		assertThat(test.getSymbols()).hasSize(BuiltInNames.TEST_HELPERS.size());
	}

	@Test
	void importsAreDeclaredInModuleScope()
	{
		JacModule module = parse("import:py os;\nimport:py numpy as np;\nimport:py from os.path { join, exists as ex }\n");

		Scope root = build(module);

		assertThat(root.getSymbols()).containsKeys("os", "np", "join", "ex");
		assertThat(root.getSymbols().get("np").getKind()).isEqualTo(SymbolKind.MOD_VAR);
	}

	@Test
	void enumMembersLiveInEnumScope()
	{
		JacModule module = parse("enum Color {\n    RED = 1,\n    GREEN\n}\n");

		Scope root = build(module);

		Scope color = root.findScope("Color").orElseThrow();
		assertThat(color.getSymbols()).containsOnlyKeys("RED", "GREEN");
		assertThat(color.getSymbols().get("RED").getKind()).isEqualTo(SymbolKind.ENUM_MEMBER);
		assertThat(root.getSymbols().get("Color").getMemberScope()).isSameAs(color);
	}
}
