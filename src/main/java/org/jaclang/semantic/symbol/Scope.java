package org.jaclang.semantic.symbol;

import org.jaclang.ast.AstNode;
import org.jaclang.ast.AstSymbolNode;
import org.jaclang.ast.declarations.Ability;
import org.jaclang.ast.declarations.Architype;
import org.jaclang.ast.declarations.EnumDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A lexical region and its symbols. Scopes form a tree rooted at the module scope;
 * a scope owns its children and refers back to its parent and to the node that
 * introduced it.
 * <p>
 * Besides its own symbols a scope sees the symbols of linked implementation scopes
 * (the body of an out-of-line definition and its declaration see each other) and of
 * inherited base scopes, in that order.
 */
public class Scope
{
	private final String name;
	private final AstNode owner;
	private final Scope parent;
	private final List<Scope> children = new ArrayList<>();
	private final Map<String, Symbol> symbols = new LinkedHashMap<>();
	private final List<Scope> implementations = new ArrayList<>();
	private final List<Scope> inherited = new ArrayList<>();
	private boolean opaqueBases;

	public Scope(String name, AstNode owner, Scope parent)
	{
		this.name = name;
		this.owner = owner;
		this.parent = parent;
	}

	public Scope pushChildScope(String name, AstNode owner)
	{
		Scope child = new Scope(name, owner, this);
		children.add(child);
		return child;
	}

	public Optional<Scope> findScope(String name)
	{
		return children.stream().filter(s -> s.name.equals(name)).findFirst();
	}

	public Symbol define(AstSymbolNode node, AccessModifier access, String singleDecl)
	{
		return define(node, SymbolKind.of(node), access, singleDecl);
	}

	/**
	 * Declares {@code node} here. A new name creates a symbol; a known name gains an
	 * additional declaration site, unless both the existing symbol and the new
	 * declaration are single-declaration kinds and neither is a forward declaration.
	 *
	 * @param singleDecl label of a single-declaration kind, or null
	 * @throws DuplicateDefinitionException when the name may not be declared again
	 */
	public Symbol define(AstSymbolNode node, SymbolKind kind, AccessModifier access, String singleDecl)
	{
		String symName = node.getSymName();
		Symbol existing = symbols.get(symName);
		if (existing != null && existing.getOwner() == this)
		{
			if (singleDecl != null && existing.getSingleDecl() != null
					&& !isForwardDecl(existing.getDeclaration()) && !isForwardDecl(node))
			{
				throw new DuplicateDefinitionException(existing, node, singleDecl);
			}
			existing.addDeclaration(node);
			node.setSymbol(existing);
			return existing;
		}
		// Absent, or absorbed from another module: a local declaration shadows it.
		Symbol symbol = new Symbol(symName, kind, access, node, singleDecl, this);
		symbols.put(symName, symbol);
		node.setSymbol(symbol);
		return symbol;
	}

	private static boolean isForwardDecl(AstSymbolNode node)
	{
		if (node instanceof Ability ability)
		{
			return ability.isForwardDecl();
		}
		if (node instanceof Architype arch)
		{
			return arch.getBody() == null;
		}
		if (node instanceof EnumDecl enumDecl)
		{
			return enumDecl.getBody() == null;
		}
		return false;
	}

	/**
	 * Lexical lookup: this scope, then every ancestor up to the module root.
	 */
	public Optional<Symbol> lookup(String name)
	{
		Scope current = this;
		while (current != null)
		{
			Optional<Symbol> found = current.lookupLocal(name);
			if (found.isPresent())
			{
				return found;
			}
			current = current.parent;
		}
		return Optional.empty();
	}

	/**
	 * Own symbols, then linked implementation scopes, then inherited scopes (earlier
	 * bases first). Ancestors are not searched.
	 */
	public Optional<Symbol> lookupLocal(String name)
	{
		return lookupLocal(name, Collections.newSetFromMap(new IdentityHashMap<>()));
	}

	private Optional<Symbol> lookupLocal(String name, Set<Scope> visited)
	{
		if (!visited.add(this))
		{
			return Optional.empty();
		}
		Symbol own = symbols.get(name);
		if (own != null)
		{
			return Optional.of(own);
		}
		for (Scope impl : implementations)
		{
			Optional<Symbol> found = impl.lookupLocal(name, visited);
			if (found.isPresent())
			{
				return found;
			}
		}
		for (Scope base : inherited)
		{
			Optional<Symbol> found = base.lookupLocal(name, visited);
			if (found.isPresent())
			{
				return found;
			}
		}
		return Optional.empty();
	}

	/**
	 * Resolves a dotted chain: the head lexically, each later segment in the member
	 * scope of the previous symbol. Every resolved segment gets its symbol link and is
	 * recorded as a use. Resolution stops quietly at a symbol without a member scope.
	 */
	public ChainResolution chainLookup(List<? extends AstSymbolNode> chain)
	{
		List<Symbol> resolved = new ArrayList<>(Collections.nCopies(chain.size(), (Symbol) null));
		Scope memberScope = null;
		for (int i = 0; i < chain.size(); i++)
		{
			AstSymbolNode segment = chain.get(i);
			Optional<Symbol> found = i == 0 ? lookup(segment.getSymName()) : memberScope.lookupLocal(segment.getSymName());
			if (found.isEmpty())
			{
				return new ChainResolution(resolved, i, memberScope);
			}
			Symbol symbol = found.get();
			symbol.addUse(segment);
			segment.setSymbol(symbol);
			resolved.set(i, symbol);
			if (i < chain.size() - 1)
			{
				memberScope = symbol.getMemberScope();
				if (memberScope == null)
				{
					return new ChainResolution(resolved, i + 1, null);
				}
			}
		}
		return new ChainResolution(resolved, -1, null);
	}

	/**
	 * Like {@link #chainLookup} for all but the last segment, which is then defined in
	 * the member scope reached. A single segment is defined in this scope.
	 */
	public ChainResolution chainDefine(List<? extends AstSymbolNode> chain)
	{
		AstSymbolNode last = chain.get(chain.size() - 1);
		if (chain.size() == 1)
		{
			Symbol symbol = define(last, AccessModifier.PUBLIC, null);
			return new ChainResolution(List.of(symbol), -1, null);
		}
		ChainResolution head = chainLookup(chain.subList(0, chain.size() - 1));
		List<Symbol> resolved = new ArrayList<>(head.symbols());
		if (!head.isComplete() || head.last().getMemberScope() == null)
		{
			resolved.add(null);
			return new ChainResolution(resolved, head.isComplete() ? chain.size() - 1 : head.firstUnresolved(), head.failedScope());
		}
		resolved.add(head.last().getMemberScope().define(last, AccessModifier.PUBLIC, null));
		return new ChainResolution(resolved, -1, null);
	}

	/**
	 * Makes the symbols of {@code base} visible here, after own symbols and after bases
	 * inherited earlier. A base that already sees this scope through its own
	 * inheritance is refused.
	 *
	 * @return false when the base was refused because it would close a cycle
	 */
	public boolean inheritFrom(Scope base)
	{
		if (base == this || base.inheritsFrom(this))
		{
			return false;
		}
		if (!inherited.contains(base))
		{
			inherited.add(base);
		}
		return true;
	}

	public void inheritFrom(List<Scope> bases)
	{
		for (Scope base : bases)
		{
			inheritFrom(base);
		}
	}

	/**
	 * True when this scope sees {@code other} through inheritance, directly or transitively.
	 */
	public boolean inheritsFrom(Scope other)
	{
		for (Scope base : inherited)
		{
			if (base == other || base.inheritsFrom(other))
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * Joins a declaration scope and the scope of its out-of-line definition so each
	 * sees the other's symbols.
	 */
	public void linkImplementation(Scope impl)
	{
		if (impl == this)
		{
			return;
		}
		if (!implementations.contains(impl))
		{
			implementations.add(impl);
		}
		if (!impl.implementations.contains(this))
		{
			impl.implementations.add(this);
		}
	}

	/**
	 * Copies every non-private symbol of {@code other} into this scope, keeping names
	 * already declared here.
	 */
	public void absorb(Scope other)
	{
		for (Symbol symbol : other.symbols.values())
		{
			if (symbol.getAccess() != AccessModifier.PRIVATE)
			{
				symbols.putIfAbsent(symbol.getName(), symbol);
			}
		}
	}

	/**
	 * Marks that some base of this scope could not be resolved, so a missing member
	 * may still exist at run time.
	 */
	public void markOpaqueBases()
	{
		this.opaqueBases = true;
	}

	/**
	 * True when this scope, a linked implementation or any inherited base has an
	 * unresolved base.
	 */
	public boolean hasOpaqueBases()
	{
		return hasOpaqueBases(Collections.newSetFromMap(new IdentityHashMap<>()));
	}

	private boolean hasOpaqueBases(Set<Scope> visited)
	{
		if (!visited.add(this))
		{
			return false;
		}
		if (opaqueBases)
		{
			return true;
		}
		for (Scope impl : implementations)
		{
			if (impl.hasOpaqueBases(visited))
			{
				return true;
			}
		}
		for (Scope base : inherited)
		{
			if (base.hasOpaqueBases(visited))
			{
				return true;
			}
		}
		return false;
	}

	public String getName()
	{
		return name;
	}

	public AstNode getOwner()
	{
		return owner;
	}

	public Scope getParent()
	{
		return parent;
	}

	public List<Scope> getChildren()
	{
		return Collections.unmodifiableList(children);
	}

	/**
	 * Symbols in insertion order, absorbed ones included.
	 */
	public Map<String, Symbol> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}

	public List<Scope> getInherited()
	{
		return Collections.unmodifiableList(inherited);
	}

	public List<Scope> getImplementations()
	{
		return Collections.unmodifiableList(implementations);
	}

	@Override
	public String toString()
	{
		return "Scope(" + name + ")";
	}
}
