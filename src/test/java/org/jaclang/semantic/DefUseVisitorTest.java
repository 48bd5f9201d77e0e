package org.jaclang.semantic;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.Name;
import org.jaclang.ast.SpecialVarRef;
import org.jaclang.ast.declarations.Ability;
import org.jaclang.ast.declarations.JacModule;
import org.jaclang.ast.declarations.ModuleItem;
import org.jaclang.ast.expressions.DictCompr;
import org.jaclang.ast.expressions.ListCompr;
import org.jaclang.ast.statements.Except;
import org.jaclang.ast.statements.InForStmt;
import org.jaclang.ast.statements.MatchCase;
import org.jaclang.ast.statements.VisitStmt;
import org.jaclang.ast.statements.WithStmt;
import org.jaclang.parser.JacSourceParser;
import org.jaclang.semantic.symbol.Scope;
import org.jaclang.semantic.symbol.Symbol;
import org.jaclang.semantic.symbol.SymbolKind;
import org.jaclang.util.Diagnostic;
import org.jaclang.util.DiagnosticKind;
import org.jaclang.util.ErrorHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DefUseVisitorTest
{
	private ErrorHandler errorHandler;
	private ModuleRegistry registry;

	@BeforeEach
	void setUp()
	{
		errorHandler = new ErrorHandler("main");
		registry = new ModuleRegistry();
	}

	private JacModule analyze(String source)
	{
		JacModule module = new JacSourceParser(errorHandler).parse(source);
		assertThat(module).as("parse result").isNotNull();
		new SemanticAnalyzer(errorHandler, registry).analyze(module);
		return module;
	}

	private static Name nameAt(JacModule module, String value, int line)
	{
		return module.findAll(Name.class).stream()
				.filter(n -> n.getValue().equals(value) && n.getLocation().firstLine() == line)
				.findFirst()
				.orElseThrow();
	}

	/**
	 * Every occurrence of the name shares one variable, declared in the scope of the given node kind and used at least once.
	 */
	private static Symbol assertBoundIn(JacModule module, String value, Class<? extends AstNode> scopeOwner)
	{
		List<Name> names = module.findAll(Name.class).stream()
				.filter(n -> n.getValue().equals(value))
				.toList();
		assertThat(names).as("occurrences of %s", value).hasSizeGreaterThanOrEqualTo(2);

		Symbol bound = names.get(0).getSymbol();
		assertThat(bound).as("symbol of %s", value).isNotNull();
		assertThat(bound.getKind()).isEqualTo(SymbolKind.VARIABLE);
		assertThat(bound.getOwner().getOwner()).isInstanceOf(scopeOwner);
		assertThat(names).allSatisfy(n -> assertThat(n.getSymbol()).isSameAs(bound));
		assertThat(bound.getUses()).isNotEmpty();
		return bound;
	}

	@Test
	void selfMemberResolvesToHasVar()
	{
		JacModule module = analyze("""
				obj A {
				    has x: int;
				    can get_x() -> int {
				        return self.x;
				    }
				}
				""");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
		Scope a = module.getScope().findScope("A").orElseThrow();
		Symbol x = a.getSymbols().get("x");
		Name use = nameAt(module, "x", 4);
		assertThat(x.getUses()).containsExactly(use);
		assertThat(use.getSymbol()).isSameAs(x);

		SpecialVarRef self = module.findAll(SpecialVarRef.class).get(0);
		assertThat(self.getSymbol().getKind()).isEqualTo(SymbolKind.SELF);
		assertThat(self.getSymbol().getMemberScope()).isSameAs(a);
	}

	@Test
	void assigningThroughSelfDeclaresMember()
	{
		JacModule module = analyze("""
				obj A {
				    can init() {
				        self.y = 1;
				    }
				    can read() -> int {
				        return self.y;
				    }
				}
				""");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
		Symbol y = module.getScope().findScope("A").orElseThrow().getSymbols().get("y");
		assertThat(y).isNotNull();
		assertThat(y.getDeclarationLine()).isEqualTo(3);
		assertThat(y.getUses()).extracting(n -> ((Name) n).getLocation().firstLine()).containsExactly(6);
	}

	@Test
	void parameterShadowsGlobal()
	{
		JacModule module = analyze("""
				glob x = 1;
				can f(x: int) -> int {
				    return x;
				}
				""");

		Symbol resolved = nameAt(module, "x", 3).getSymbol();
		assertThat(resolved.getKind()).isEqualTo(SymbolKind.PARAM);
		assertThat(module.getScope().getSymbols().get("x").getUses()).isEmpty();
	}

	@Test
	void laterDeclarationsAreVisibleEarlier()
	{
		analyze("""
				with entry {
				    r = helper();
				}
				can helper() -> int {
				    return 1;
				}
				""");

		assertThat(errorHandler.has(DiagnosticKind.UNRESOLVED_NAME)).isFalse();
	}

	@Test
	void resolvingTwiceRecordsEachUseOnce()
	{
		JacModule module = analyze("""
				obj A {
				    has x: int;
				    can get_x() -> int {
				        return self.x;
				    }
				}
				with entry {
				    a = A();
				    print(a);
				}
				""");
		Symbol x = module.getScope().findScope("A").orElseThrow().getSymbols().get("x");
		Symbol arch = module.getScope().getSymbols().get("A");

		new DefUseVisitor(errorHandler, registry).resolve(module);

		assertThat(x.getUses()).hasSize(1);
		assertThat(arch.getUses()).hasSize(1);
		assertThat(errorHandler.getDiagnostics()).isEmpty();
	}

	@Test
	void ownMemberShadowsInheritedOne()
	{
		JacModule module = analyze("""
				obj Base {
				    has x: int;
				    has y: int;
				}
				obj Child :Base: {
				    has x: str;
				    can f() -> str {
				        return self.x;
				    }
				    can g() -> int {
				        return self.y;
				    }
				}
				""");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
		Scope base = module.getScope().findScope("Base").orElseThrow();
		Scope child = module.getScope().findScope("Child").orElseThrow();
		assertThat(child.getInherited()).containsExactly(base);
		assertThat(nameAt(module, "x", 8).getSymbol()).isSameAs(child.getSymbols().get("x"));
		assertThat(nameAt(module, "y", 11).getSymbol()).isSameAs(base.getSymbols().get("y"));
		assertThat(nameAt(module, "Base", 5).getSymbol()).isSameAs(module.getScope().getSymbols().get("Base"));
	}

	@Test
	void superPointsAtFirstBase()
	{
		JacModule module = analyze("""
				obj Base {
				    can get() -> int {
				        return 1;
				    }
				}
				obj Other {
				    can get() -> int {
				        return 2;
				    }
				}
				obj Child :Base, Other: {
				    can get() -> int {
				        return super.get();
				    }
				}
				""");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
		Scope base = module.getScope().findScope("Base").orElseThrow();
		Name get = nameAt(module, "get", 13);
		assertThat(get.getSymbol()).isSameAs(base.getSymbols().get("get"));
	}

	@Test
	void missingIncludeIsReported()
	{
		analyze("include:jac missing;\n");

		List<Diagnostic> diagnostics = errorHandler.getDiagnostics(DiagnosticKind.MODULE_NOT_FOUND);
		assertThat(diagnostics).hasSize(1);
		assertThat(diagnostics.get(0).message()).isEqualTo("Module 'missing' not found to include *");
		assertThat(diagnostics.get(0).isError()).isTrue();
	}

	@Test
	void missingPythonImportIsNotReported()
	{
		analyze("import:py numpy;\ninclude:py something;\n");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
	}

	@Test
	void assigningToCallIsInvalidTarget()
	{
		analyze("with entry {\n    foo() = 1;\n}\n");

		assertThat(errorHandler.getDiagnostics(DiagnosticKind.INVALID_ASSIGNMENT_TARGET)).hasSize(1);
	}

	@Test
	void assigningToSelfIsInvalidTarget()
	{
		analyze("obj A {\n    can f() {\n        self = 1;\n    }\n}\n");

		assertThat(errorHandler.has(DiagnosticKind.INVALID_ASSIGNMENT_TARGET)).isTrue();
	}

	@Test
	void tupleTargetsDefineEachName()
	{
		JacModule module = analyze("with entry {\n    (a, b) = (1, 2);\n    print(a, b);\n}\n");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
		assertThat(nameAt(module, "a", 3).getSymbol()).isNotNull();
		assertThat(nameAt(module, "b", 3).getSymbol()).isNotNull();
	}

	@Test
	void walkerStatementsAreTagged()
	{
		JacModule module = analyze("""
				walker W {
				    can go with entry {
				        visit [-->];
				    }
				}
				node N {
				    can go with entry {
				        visit [-->];
				    }
				}
				""");

		List<VisitStmt> visits = module.findAll(VisitStmt.class);
		assertThat(visits).hasSize(2);
		assertThat(visits.get(0).isFromWalker()).isTrue();
		assertThat(visits.get(1).isFromWalker()).isFalse();
	}

	@Test
	void cyclicInheritanceIsReportedOnce()
	{
		analyze("obj A :B: {}\nobj B :A: {}\n");

		assertThat(errorHandler.getDiagnostics(DiagnosticKind.CYCLIC_INHERITANCE)).hasSize(1);
	}

	@Test
	void missingMemberOfKnownScopeIsReported()
	{
		analyze("""
				obj A {
				    has x: int;
				    can f() -> int {
				        return self.z;
				    }
				}
				""");

		List<Diagnostic> diagnostics = errorHandler.getDiagnostics(DiagnosticKind.UNRESOLVED_ATTRIBUTE);
		assertThat(diagnostics).hasSize(1);
		assertThat(diagnostics.get(0).message()).isEqualTo("'A' has no member 'z'");
		assertThat(diagnostics.get(0).isError()).isFalse();
	}

	@Test
	void missingMemberBehindUnknownBaseIsNotReported()
	{
		analyze("""
				obj A :Unknown: {
				    can f() -> int {
				        return self.z;
				    }
				}
				""");

		assertThat(errorHandler.has(DiagnosticKind.UNRESOLVED_ATTRIBUTE)).isFalse();
		assertThat(errorHandler.getDiagnostics(DiagnosticKind.UNRESOLVED_NAME))
				.extracting(Diagnostic::message)
				.containsExactly("Name 'Unknown' is not defined");
	}

	@Test
	void builtinsAreNotReported()
	{
		analyze("with entry {\n    print(len([1]), undefined_thing);\n}\n");

		assertThat(errorHandler.getDiagnostics(DiagnosticKind.UNRESOLVED_NAME))
				.extracting(Diagnostic::message)
				.containsExactly("Name 'undefined_thing' is not defined");
		assertThat(errorHandler.hasErrors()).isFalse();
	}

	@Test
	void outOfLineAbilityIsLinkedToDeclaration()
	{
		JacModule module = analyze("""
				obj A {
				    has x: int;
				    can f() -> int;
				}
				:obj:A:can:f() -> int {
				    return self.x;
				}
				""");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
		Ability f = module.findAll(Ability.class).get(0);
		assertThat(f.getDefinition()).isNotNull();
		Symbol x = module.getScope().findScope("A").orElseThrow().getSymbols().get("x");
		assertThat(x.getUses()).hasSize(1);
	}

	@Test
	void importedItemExposesMembersOfItsTarget()
	{
		ErrorHandler libErrors = new ErrorHandler("lib");
		JacModule lib = new JacSourceParser(libErrors).parse("obj Base {\n    has y: int;\n}\n");
		new SemanticAnalyzer(libErrors, registry).analyze(lib);
		registry.register(lib);

		JacModule module = analyze("""
				import:jac from lib { Base }
				with entry {
				    b = Base.y;
				}
				""");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
		Scope baseScope = lib.getScope().findScope("Base").orElseThrow();
		Symbol local = module.getScope().getSymbols().get("Base");
		assertThat(local.getKind()).isEqualTo(SymbolKind.MOD_VAR);
		assertThat(local.getMemberScope()).isSameAs(baseScope);
		assertThat(module.findAll(ModuleItem.class).get(0).getSymbol()).isSameAs(local);
		assertThat(nameAt(module, "Base", 3).getSymbol()).isSameAs(local);
		assertThat(nameAt(module, "y", 3).getSymbol()).isSameAs(baseScope.getSymbols().get("y"));
		assertThat(lib.getScope().getSymbols().get("Base").getUses()).hasSize(1);
	}

	@Test
	void aliasedImportedItemExposesMembersOfItsTarget()
	{
		ErrorHandler libErrors = new ErrorHandler("lib");
		JacModule lib = new JacSourceParser(libErrors).parse("obj Base {\n    has y: int;\n}\n");
		new SemanticAnalyzer(libErrors, registry).analyze(lib);
		registry.register(lib);

		JacModule module = analyze("""
				import:jac from lib { Base as B }
				with entry {
				    b = B.y;
				}
				""");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
		Scope baseScope = lib.getScope().findScope("Base").orElseThrow();
		assertThat(module.getScope().getSymbols()).containsKey("B").doesNotContainKey("Base");
		assertThat(nameAt(module, "y", 3).getSymbol()).isSameAs(baseScope.getSymbols().get("y"));
	}

	@Test
	void forLoopTargetsAreDefinedInLoopScope()
	{
		JacModule module = analyze("""
				with entry {
				    for i, item in enumerate([1, 2]) {
				        print(i, item);
				    }
				}
				""");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
		assertBoundIn(module, "i", InForStmt.class);
		assertBoundIn(module, "item", InForStmt.class);
	}

	@Test
	void comprehensionTargetsAreDefinedBeforeOutput()
	{
		JacModule module = analyze("""
				with entry {
				    xs = [1, 2];
				    doubled = [a * 2 for a in xs if a > 0];
				    table = {"a": 1};
				    flipped = {v: k for k, v in table.items()};
				}
				""");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
		assertBoundIn(module, "a", ListCompr.class);
		assertBoundIn(module, "k", DictCompr.class);
		assertBoundIn(module, "v", DictCompr.class);
		assertThat(module.getScope().lookup("a")).isEmpty();
	}

	@Test
	void exceptNameIsDefinedInHandler()
	{
		JacModule module = analyze("""
				with entry {
				    try {
				        risky = 1 / 0;
				    } except ZeroDivisionError as err {
				        print(err);
				    }
				}
				""");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
		Symbol err = assertBoundIn(module, "err", Except.class);
		assertThat(err.getUses()).containsExactly(nameAt(module, "err", 5));
	}

	@Test
	void withAliasIsDefinedInWithScope()
	{
		JacModule module = analyze("""
				with entry {
				    with open("data.txt") as fh {
				        print(fh);
				    }
				}
				""");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
		assertBoundIn(module, "fh", WithStmt.class);
	}

	@Test
	void matchCapturesAreDefinedInCaseScope()
	{
		JacModule module = analyze("""
				with entry {
				    value = [1, 2, 3];
				    match value {
				        case [first, *rest]:
				            print(first, rest);
				        case 0 as zero:
				            print(zero);
				    }
				}
				""");

		assertThat(errorHandler.getDiagnostics()).isEmpty();
		assertBoundIn(module, "first", MatchCase.class);
		assertBoundIn(module, "rest", MatchCase.class);
		assertBoundIn(module, "zero", MatchCase.class);
	}

	@Test
	void deleteFlagsFinalNameOfEachTarget()
	{
		JacModule module = analyze("""
				obj Holder {
				    has c: int = 0;
				}
				with entry {
				    a = 1;
				    b = Holder();
				    del a, b.c;
				}
				""");

		assertThat(nameAt(module, "a", 7).isDeleted()).isTrue();
		assertThat(nameAt(module, "c", 7).isDeleted()).isTrue();
		assertThat(nameAt(module, "b", 7).isDeleted()).isFalse();
		assertThat(nameAt(module, "a", 5).isDeleted()).isFalse();
		assertThat(nameAt(module, "a", 7).getSymbol()).isSameAs(nameAt(module, "a", 5).getSymbol());
	}
}
