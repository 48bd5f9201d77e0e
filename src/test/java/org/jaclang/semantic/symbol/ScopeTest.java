package org.jaclang.semantic.symbol;

import org.jaclang.ast.Name;
import org.jaclang.ast.SourceLocation;
import org.jaclang.ast.declarations.JacModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScopeTest
{
	private JacModule owner;
	private Scope root;

	@BeforeEach
	void setUp()
	{
		owner = new JacModule(List.of(), "main", null, List.of());
		root = new Scope("main", owner, null);
	}

	private static Name name(String value, int line)
	{
		return new Name("NAME", value, new SourceLocation(line, 1, line, value.length()));
	}

	@Test
	void defineCreatesSymbolAndLinksDeclaration()
	{
		Name x = name("x", 1);

		Symbol symbol = root.define(x, AccessModifier.PUBLIC, null);

		assertThat(symbol.getName()).isEqualTo("x");
		assertThat(symbol.getKind()).isEqualTo(SymbolKind.VARIABLE);
		assertThat(symbol.getOwner()).isSameAs(root);
		assertThat(symbol.getDeclarationLine()).isEqualTo(1);
		assertThat(x.getSymbol()).isSameAs(symbol);
		assertThat(root.getSymbols()).containsOnlyKeys("x");
	}

	@Test
	void redefiningPlainNameAddsDeclarationSite()
	{
		Symbol first = root.define(name("x", 1), AccessModifier.PUBLIC, null);
		Name again = name("x", 4);

		Symbol second = root.define(again, AccessModifier.PUBLIC, null);

		assertThat(second).isSameAs(first);
		assertThat(first.getAdditionalDecls()).containsExactly(again);
		assertThat(again.getSymbol()).isSameAs(first);
	}

	@Test
	void redefiningSingleDeclarationKindThrows()
	{
		root.define(name("limit", 1), AccessModifier.PUBLIC, "global var");

		assertThatThrownBy(() -> root.define(name("limit", 2), AccessModifier.PUBLIC, "global var"))
				.isInstanceOf(DuplicateDefinitionException.class)
				.hasMessageContaining("limit");
	}

	@Test
	void lookupWalksUpToAncestorsButLookupLocalDoesNot()
	{
		Symbol x = root.define(name("x", 1), AccessModifier.PUBLIC, null);
		Scope child = root.pushChildScope("IfStmt", owner);
		Scope grandChild = child.pushChildScope("WhileStmt", owner);

		assertThat(grandChild.lookup("x")).containsSame(x);
		assertThat(grandChild.lookupLocal("x")).isEmpty();
		assertThat(root.findScope("IfStmt")).containsSame(child);
	}

	@Test
	void innerDeclarationShadowsOuterOne()
	{
		root.define(name("x", 1), AccessModifier.PUBLIC, null);
		Scope child = root.pushChildScope("IfStmt", owner);
		Symbol inner = child.define(name("x", 3), AccessModifier.PUBLIC, null);

		assertThat(child.lookup("x")).containsSame(inner);
	}

	@Test
	void ownSymbolsComeBeforeImplementationsAndBases()
	{
		Scope arch = root.pushChildScope("A", owner);
		Scope impl = root.pushChildScope("A", owner);
		Scope base = root.pushChildScope("Base", owner);
		arch.linkImplementation(impl);
		arch.inheritFrom(base);

		Symbol fromBase = base.define(name("m", 1), AccessModifier.PUBLIC, null);
		assertThat(arch.lookupLocal("m")).containsSame(fromBase);

		Symbol fromImpl = impl.define(name("m", 2), AccessModifier.PUBLIC, null);
		assertThat(arch.lookupLocal("m")).containsSame(fromImpl);

		Symbol own = arch.define(name("m", 3), AccessModifier.PUBLIC, null);
		assertThat(arch.lookupLocal("m")).containsSame(own);
	}

	@Test
	void earlierBaseWinsOverLaterBase()
	{
		Scope arch = root.pushChildScope("C", owner);
		Scope first = root.pushChildScope("A", owner);
		Scope second = root.pushChildScope("B", owner);
		Symbol fromFirst = first.define(name("m", 1), AccessModifier.PUBLIC, null);
		second.define(name("m", 2), AccessModifier.PUBLIC, null);

		arch.inheritFrom(List.of(first, second));

		assertThat(arch.getInherited()).containsExactly(first, second);
		assertThat(arch.lookupLocal("m")).containsSame(fromFirst);
	}

	@Test
	void inheritFromRefusesCycles()
	{
		Scope a = root.pushChildScope("A", owner);
		Scope b = root.pushChildScope("B", owner);
		Scope c = root.pushChildScope("C", owner);

		assertThat(a.inheritFrom(a)).isFalse();
		assertThat(b.inheritFrom(a)).isTrue();
		assertThat(c.inheritFrom(b)).isTrue();
		assertThat(a.inheritFrom(c)).isFalse();

		assertThat(c.inheritsFrom(a)).isTrue();
		assertThat(a.getInherited()).isEmpty();
	}

	@Test
	void chainLookupResolvesMembersAndRecordsUsesOnce()
	{
		Scope pointScope = root.pushChildScope("Point", owner);
		Symbol p = root.define(name("p", 1), AccessModifier.PUBLIC, null);
		p.setMemberScope(pointScope);
		Symbol x = pointScope.define(name("x", 2), AccessModifier.PUBLIC, null);
		List<Name> chain = List.of(name("p", 5), name("x", 5));

		ChainResolution first = root.chainLookup(chain);
		ChainResolution second = root.chainLookup(chain);

		assertThat(first.isComplete()).isTrue();
		assertThat(first.symbols()).containsExactly(p, x);
		assertThat(second.symbols()).containsExactly(p, x);
		assertThat(p.getUses()).containsExactly(chain.get(0));
		assertThat(x.getUses()).containsExactly(chain.get(1));
		assertThat(chain.get(1).getSymbol()).isSameAs(x);
	}

	@Test
	void chainLookupReportsMissingMemberScope()
	{
		Scope pointScope = root.pushChildScope("Point", owner);
		root.define(name("p", 1), AccessModifier.PUBLIC, null).setMemberScope(pointScope);

		ChainResolution resolution = root.chainLookup(List.of(name("p", 3), name("z", 3)));

		assertThat(resolution.isComplete()).isFalse();
		assertThat(resolution.firstUnresolved()).isEqualTo(1);
		assertThat(resolution.failedScope()).isSameAs(pointScope);
		assertThat(resolution.get(1)).isNull();
	}

	@Test
	void chainLookupStopsQuietlyAtSymbolWithoutMembers()
	{
		root.define(name("n", 1), AccessModifier.PUBLIC, null);

		ChainResolution resolution = root.chainLookup(List.of(name("n", 2), name("real", 2)));

		assertThat(resolution.firstUnresolved()).isEqualTo(1);
		assertThat(resolution.failedScope()).isNull();
	}

	@Test
	void chainDefineDeclaresLastSegmentInMemberScope()
	{
		Scope pointScope = root.pushChildScope("Point", owner);
		root.define(name("p", 1), AccessModifier.PUBLIC, null).setMemberScope(pointScope);

		ChainResolution resolution = root.chainDefine(List.of(name("p", 2), name("y", 2)));

		assertThat(resolution.isComplete()).isTrue();
		assertThat(pointScope.getSymbols()).containsKey("y");
		assertThat(root.getSymbols()).doesNotContainKey("y");
	}

	@Test
	void absorbCopiesOnlyNonPrivateSymbols()
	{
		Scope other = new Scope("base", owner, null);
		other.define(name("shared", 1), AccessModifier.PUBLIC, null);
		other.define(name("hidden", 2), AccessModifier.PRIVATE, null);
		Symbol mine = root.define(name("shared", 1), AccessModifier.PUBLIC, null);

		root.absorb(other);

		assertThat(root.getSymbols()).containsOnlyKeys("shared");
		assertThat(root.getSymbols().get("shared")).isSameAs(mine);
	}

	@Test
	void opaqueBaseIsVisibleThroughInheritance()
	{
		Scope a = root.pushChildScope("A", owner);
		Scope b = root.pushChildScope("B", owner);
		b.inheritFrom(a);
		assertThat(b.hasOpaqueBases()).isFalse();

		a.markOpaqueBases();

		assertThat(b.hasOpaqueBases()).isTrue();
	}
}
