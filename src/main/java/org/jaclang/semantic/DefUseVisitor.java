package org.jaclang.semantic;

import org.jaclang.ast.*;
import org.jaclang.ast.declarations.*;
import org.jaclang.ast.expressions.*;
import org.jaclang.ast.patterns.*;
import org.jaclang.ast.statements.*;
import org.jaclang.semantic.symbol.*;
import org.jaclang.util.Debug;
import org.jaclang.util.DiagnosticKind;
import org.jaclang.util.ErrorHandler;
import org.jaclang.util.InternalCompilerError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Second semantic pass, run on a tree the {@link SymbolTableBuilder} has scoped.
 * <p>
 * Before walking the tree it absorbs {@code include}d modules, links out-of-line
 * definitions to their declarations and resolves architype inheritance. The walk then
 * declares the names only an expression can introduce (assignment, loop, comprehension,
 * except, with and match targets) and links every reference to its symbol. Walker
 * statements are tagged last.
 */
public class DefUseVisitor extends AstBaseVisitor<Void>
{
	private final ErrorHandler errorHandler;
	private final ModuleResolver moduleResolver;

	// Architypes whose bases are resolved or being resolved
	private final Set<AstNode> inheritance = Collections.newSetFromMap(new IdentityHashMap<>());

	public DefUseVisitor(ErrorHandler errorHandler, ModuleResolver moduleResolver)
	{
		this.errorHandler = errorHandler;
		this.moduleResolver = moduleResolver;
	}

	public void resolve(JacModule module)
	{
		if (module.getScope() == null)
		{
			throw new InternalCompilerError("Module '" + module.getName() + "' was not scoped before def/use", module);
		}
		Debug.logDebug("Resolving imports of '" + module.getName() + "'...");
		resolveImports(module);
		Debug.logDebug("Linking out-of-line definitions...");
		linkDefinitions(module);
		Debug.logDebug("Resolving inheritance...");
		for (AstNode arch : module.findAll(AstNode.class))
		{
			if (arch instanceof Architype || arch instanceof EnumDecl)
			{
				resolveInheritance(arch);
			}
		}
		Debug.logDebug("Resolving definitions and uses...");
		visit(module);
		Debug.logDebug("Tagging walker statements...");
		for (Architype arch : module.findAll(Architype.class))
		{
			if (arch.isWalker())
			{
				tagWalker(arch);
			}
		}
	}

	// ---------------------------------------------------------------------------
	// Imports
	// ---------------------------------------------------------------------------

	private void resolveImports(JacModule module)
	{
		for (Import imp : module.findAll(Import.class))
		{
			if (!imp.isJac())
			{
				continue;
			}
			if (imp.isAbsorb())
			{
				ModulePath path = imp.getPaths().get(0);
				Optional<JacModule> target = findModule(path);
				if (target.isEmpty())
				{
					errorHandler.logError(imp, DiagnosticKind.MODULE_NOT_FOUND, "Module '" + path.getDotPath() + "' not found to include *");
					continue;
				}
				imp.getScope().absorb(target.get().getScope());
			}
			else if (imp.getFromLoc() != null)
			{
				findModule(imp.getFromLoc()).ifPresent(target -> linkImportedItems(imp, target));
			}
			else
			{
				for (ModulePath path : imp.getPaths())
				{
					Optional<JacModule> target = findModule(path);
					if (target.isPresent() && path.getSymbol() != null)
					{
						path.getSymbol().setMemberScope(target.get().getScope());
					}
				}
			}
		}
	}

	private Optional<JacModule> findModule(ModulePath path)
	{
		Optional<JacModule> target = moduleResolver.resolve(path.getDotPath()).filter(m -> m.getScope() != null);
		target.ifPresent(path::setSubModule);
		return target;
	}

	/**
	 * Gives each imported item the member scope of the symbol it names in the target module.
	 * The item keeps its own local symbol; the target symbol only records the use.
	 */
	private void linkImportedItems(Import imp, JacModule target)
	{
		for (ModuleItem item : imp.getItems().getItems())
		{
			Symbol local = item.getSymbol();
			Optional<Symbol> found = target.getScope().lookupLocal(item.getName().getSymName());
			if (found.isPresent() && local != null && found.get().getAccess() != AccessModifier.PRIVATE)
			{
				found.get().addUse(item.getName());
				local.setMemberScope(found.get().getMemberScope());
				if (item.getAlias() != null)
				{
					// with an alias the local symbol hangs off the alias, the imported name points across
					item.getName().setSymbol(found.get());
				}
			}
		}
	}

	// ---------------------------------------------------------------------------
	// Out-of-line definitions
	// ---------------------------------------------------------------------------

	private void linkDefinitions(JacModule module)
	{
		for (OutOfLineDef def : module.findAll(OutOfLineDef.class))
		{
			List<AstSymbolNode> chain = def.getTarget().getNames();
			ChainResolution resolution = def.getScope().getParent().chainLookup(chain);
			if (!resolution.isComplete())
			{
				reportChain(resolution, chain);
				continue;
			}
			Symbol declared = resolution.last();
			AstNode decl = declared.getDeclNode();
			if (def instanceof ArchDef archDef && decl instanceof Architype arch)
			{
				arch.setDefinition(archDef);
				linkScopes(def, decl, declared.getMemberScope());
			}
			else if (def instanceof ArchDef archDef && decl instanceof EnumDecl enumDecl)
			{
				enumDecl.setDefinition(archDef);
				linkScopes(def, decl, declared.getMemberScope());
			}
			else if (def instanceof AbilityDef abilityDef && decl instanceof Ability ability)
			{
				ability.setDefinition(abilityDef);
				linkScopes(def, decl, ability.getScope());
			}
			else
			{
				Debug.logDebug("Out-of-line definition " + def.getSymName() + " names a " + declared.getKind() + ", not linked");
			}
		}
	}

	private static void linkScopes(OutOfLineDef def, AstNode decl, Scope declScope)
	{
		def.setDeclaration(decl);
		if (declScope != null)
		{
			declScope.linkImplementation(def.getScope());
		}
	}

	// ---------------------------------------------------------------------------
	// Inheritance
	// ---------------------------------------------------------------------------

	private void resolveInheritance(AstNode arch)
	{
		if (!inheritance.add(arch))
		{
			return;
		}
		SubNodeList<AstNode> bases = arch instanceof Architype a ? a.getBaseClasses() : ((EnumDecl) arch).getBaseClasses();
		Scope scope = arch.getScope();
		List<Scope> resolvedBases = new ArrayList<>();
		if (bases != null)
		{
			for (AstNode base : bases.getItems())
			{
				Scope baseScope = resolveBase(scope.getParent(), base);
				if (baseScope == null)
				{
					scope.markOpaqueBases();
					continue;
				}
				AstNode baseOwner = baseScope.getOwner();
				if (baseOwner instanceof Architype || baseOwner instanceof EnumDecl)
				{
					resolveInheritance(baseOwner);
				}
				if (scope.inheritFrom(baseScope))
				{
					resolvedBases.add(baseScope);
				}
				else
				{
					errorHandler.logError(base, DiagnosticKind.CYCLIC_INHERITANCE,
							"'" + scope.getName() + "' cannot inherit from '" + baseScope.getName() + "', it would inherit from itself");
				}
			}
		}
		if (!resolvedBases.isEmpty())
		{
			bindSuper(arch, resolvedBases.get(0));
		}
	}

	/**
	 * Resolves one entry of a base list, recording the reference as a use.
	 *
	 * @return the member scope of the base, or null when it is unknown
	 */
	private Scope resolveBase(Scope outer, AstNode base)
	{
		if (base instanceof Name name)
		{
			Optional<Symbol> symbol = outer.lookup(name.getSymName());
			if (symbol.isEmpty())
			{
				reportUnresolved(name);
				return null;
			}
			symbol.get().addUse(name);
			name.setSymbol(symbol.get());
			return symbol.get().getMemberScope();
		}
		if (base instanceof AtomTrailer trailer && !trailer.asAttrList().isEmpty())
		{
			List<AstSymbolNode> chain = trailer.asAttrList();
			ChainResolution resolution = outer.chainLookup(chain);
			reportChain(resolution, chain);
			return resolution.isComplete() ? resolution.last().getMemberScope() : null;
		}
		visit(base);
		return null;
	}

	/**
	 * Points {@code super} in every method of the architype, including methods added by
	 * its out-of-line definition, at the first base.
	 */
	private static void bindSuper(AstNode arch, Scope firstBase)
	{
		List<AstNode> owners = new ArrayList<>();
		owners.add(arch);
		if (arch instanceof Architype a && a.getDefinition() != null)
		{
			owners.add(a.getDefinition());
		}
		for (AstNode owner : owners)
		{
			for (Ability ability : owner.findAll(Ability.class))
			{
				if (ability.getOwnerArch() == owner)
				{
					Symbol superSymbol = ability.getScope().getSymbols().get("super");
					if (superSymbol != null && superSymbol.getKind() == SymbolKind.SUPER)
					{
						superSymbol.setMemberScope(firstBase);
					}
				}
			}
		}
	}

	// ---------------------------------------------------------------------------
	// Walker tagging
	// ---------------------------------------------------------------------------

	private static void tagWalker(Architype walker)
	{
		List<AstNode> roots = new ArrayList<>();
		roots.add(walker);
		if (walker.getDefinition() != null)
		{
			roots.add(walker.getDefinition());
		}
		for (AstNode root : List.copyOf(roots))
		{
			for (Ability ability : root.findAll(Ability.class))
			{
				if (ability.getDefinition() != null)
				{
					roots.add(ability.getDefinition());
				}
			}
		}
		for (AstNode root : roots)
		{
			for (AstNode node : root.findAll(AstNode.class))
			{
				if (node instanceof WalkerNode walkerNode)
				{
					walkerNode.setFromWalker(true);
				}
			}
		}
	}

	// ---------------------------------------------------------------------------
	// Resolution helpers
	// ---------------------------------------------------------------------------

	private void resolveUse(AstSymbolNode node, Scope scope)
	{
		Optional<Symbol> symbol = scope.lookup(node.getSymName());
		if (symbol.isPresent())
		{
			symbol.get().addUse(node);
			node.setSymbol(symbol.get());
		}
		else if (!(node instanceof Literal))
		{
			reportUnresolved((AstNode) node);
		}
	}

	private void reportUnresolved(AstNode node)
	{
		String name = ((AstSymbolNode) node).getSymName();
		if (!BuiltInNames.isBuiltin(name))
		{
			errorHandler.logError(node, DiagnosticKind.UNRESOLVED_NAME, "Name '" + name + "' is not defined");
		}
	}

	/**
	 * Reports where a chain stopped. A missing head is an unresolved name; a member
	 * missing from a known scope whose bases are all known is an unresolved attribute.
	 * Stopping at a symbol with no member scope is not reported.
	 */
	private void reportChain(ChainResolution resolution, List<? extends AstSymbolNode> chain)
	{
		if (resolution.isComplete())
		{
			return;
		}
		int index = resolution.firstUnresolved();
		AstSymbolNode segment = chain.get(index);
		if (index == 0)
		{
			reportUnresolved((AstNode) segment);
		}
		else if (resolution.failedScope() != null && !resolution.failedScope().hasOpaqueBases())
		{
			errorHandler.logError((AstNode) segment, DiagnosticKind.UNRESOLVED_ATTRIBUTE,
					"'" + resolution.failedScope().getName() + "' has no member '" + segment.getSymName() + "'");
		}
	}

	/**
	 * Declares the names bound by an assignment-like target.
	 */
	private void defineTarget(AstNode target)
	{
		if (target instanceof SpecialVarRef)
		{
			invalidTarget(target);
		}
		else if (target instanceof Name name)
		{
			if (name.getSymbol() == null)
			{
				name.getScope().define(name, AccessModifier.PUBLIC, null);
			}
		}
		else if (target instanceof AtomTrailer trailer)
		{
			List<AstSymbolNode> chain = trailer.asAttrList();
			if (chain.isEmpty())
			{
				// obj[i] or call().x: the parts are plain uses
				visit(trailer);
				return;
			}
			reportChain(trailer.getScope().chainDefine(chain), chain);
		}
		else if (target instanceof TupleVal || target instanceof ListVal)
		{
			for (AstNode item : ((CollectionVal<?>) target).getValues().getItems())
			{
				defineTarget(item);
			}
		}
		else if (target instanceof AtomUnit unit)
		{
			defineTarget(unit.getValue());
		}
		else if (target instanceof UnaryExpr unary && unary.getOp().is("*"))
		{
			defineTarget(unary.getOperand());
		}
		else
		{
			invalidTarget(target);
		}
	}

	private void invalidTarget(AstNode target)
	{
		errorHandler.logError(target, DiagnosticKind.INVALID_ASSIGNMENT_TARGET,
				"Cannot assign to " + target.getClass().getSimpleName());
	}

	private void visitAll(AstNode... nodes)
	{
		for (AstNode node : nodes)
		{
			if (node != null)
			{
				visit(node);
			}
		}
	}

	private void visitAll(List<? extends AstNode> nodes)
	{
		for (AstNode node : nodes)
		{
			visit(node);
		}
	}

	/**
	 * True for names that are not references: declared names, module paths, the
	 * language tag of an import, keyword argument keys, and the segments of a dotted
	 * chain (resolved together with the chain).
	 */
	private static boolean isReference(Name name)
	{
		AstNode parent = name.getParent();
		if (parent instanceof AstSymbolNode symbolNode && symbolNode.getNameSpec() == name)
		{
			return false;
		}
		if (parent instanceof AtomTrailer trailer && trailer.isAttr())
		{
			return false;
		}
		return !(parent instanceof ModulePath || parent instanceof ModuleItem || parent instanceof KWPair
				|| parent instanceof MatchKVPair || parent instanceof ArchRef);
	}

	// ---------------------------------------------------------------------------
	// Declarations
	// ---------------------------------------------------------------------------

	@Override
	public Void visitImport(Import node)
	{
		return null;
	}

	@Override
	public Void visitModuleCode(ModuleCode node)
	{
		return visit(node.getBody());
	}

	@Override
	public Void visitArchitype(Architype node)
	{
		// Bases were resolved with the inheritance.
		return node.getBody() != null ? visit(node.getBody()) : null;
	}

	@Override
	public Void visitEnumDecl(EnumDecl node)
	{
		return node.getBody() != null ? visit(node.getBody()) : null;
	}

	@Override
	public Void visitArchDef(ArchDef node)
	{
		return visit(node.getBody());
	}

	@Override
	public Void visitAbilityDef(AbilityDef node)
	{
		visitAll(node.getSignature(), node.getBody());
		return null;
	}

	@Override
	public Void visitTestBlock(TestBlock node)
	{
		return visit(node.getBody());
	}

	// ---------------------------------------------------------------------------
	// Definitions
	// ---------------------------------------------------------------------------

	@Override
	public Void visitAssignment(Assignment node)
	{
		visitAll(node.getTypeTag(), node.getValue());
		for (AstNode target : node.getTargets())
		{
			if (node.isAugmented())
			{
				visit(target);
			}
			else
			{
				defineTarget(target);
			}
		}
		return null;
	}

	@Override
	public Void visitInForStmt(InForStmt node)
	{
		visit(node.getCollection());
		defineTarget(node.getTarget());
		return visit(node.getBody());
	}

	@Override
	public Void visitInnerCompr(InnerCompr node)
	{
		visit(node.getCollection());
		defineTarget(node.getTarget());
		visitAll(node.getConditions());
		return null;
	}

	private Void visitComprehension(Comprehension node)
	{
		visitAll(node.getCompr());
		return visit(node.getOut());
	}

	@Override
	public Void visitListCompr(ListCompr node)
	{
		return visitComprehension(node);
	}

	@Override
	public Void visitSetCompr(SetCompr node)
	{
		return visitComprehension(node);
	}

	@Override
	public Void visitGenCompr(GenCompr node)
	{
		return visitComprehension(node);
	}

	@Override
	public Void visitDictCompr(DictCompr node)
	{
		return visitComprehension(node);
	}

	@Override
	public Void visitExcept(Except node)
	{
		if (node.getName() != null)
		{
			defineTarget(node.getName());
		}
		visitAll(node.getExType(), node.getBody());
		return null;
	}

	@Override
	public Void visitExprAsItem(ExprAsItem node)
	{
		visit(node.getExpr());
		if (node.getAlias() != null)
		{
			defineTarget(node.getAlias());
		}
		return null;
	}

	@Override
	public Void visitMatchAs(MatchAs node)
	{
		visitAll(node.getPattern());
		defineTarget(node.getName());
		return null;
	}

	@Override
	public Void visitMatchStar(MatchStar node)
	{
		if (!node.getName().getSymName().equals("_"))
		{
			defineTarget(node.getName());
		}
		return null;
	}

	@Override
	public Void visitDeleteStmt(DeleteStmt node)
	{
		visitChildren(node);
		for (AstNode target : node.getTargets().getItems())
		{
			if (target instanceof Name name)
			{
				name.markDeleted();
			}
			else if (target instanceof AtomTrailer trailer && !trailer.asAttrList().isEmpty())
			{
				List<AstSymbolNode> chain = trailer.asAttrList();
				((Name) chain.get(chain.size() - 1)).markDeleted();
			}
		}
		return null;
	}

	// ---------------------------------------------------------------------------
	// Uses
	// ---------------------------------------------------------------------------

	@Override
	public Void visitName(Name node)
	{
		if (node.getSymbol() == null && isReference(node))
		{
			resolveUse(node, node.getScope());
		}
		return null;
	}

	@Override
	public Void visitSpecialVarRef(SpecialVarRef node)
	{
		return visitName(node);
	}

	@Override
	public Void visitBuiltinType(BuiltinType node)
	{
		return visitName(node);
	}

	@Override
	public Void visitLiteral(Literal node)
	{
		resolveUse(node, node.getScope());
		return null;
	}

	@Override
	public Void visitStringLiteral(StringLiteral node)
	{
		return visitLiteral(node);
	}

	@Override
	public Void visitAtomTrailer(AtomTrailer node)
	{
		boolean innerSegment = node.getParent() instanceof AtomTrailer outer && outer.isAttr() && outer.getTarget() == node;
		List<AstSymbolNode> chain = node.asAttrList();
		if (!chain.isEmpty() && !innerSegment)
		{
			reportChain(node.getScope().chainLookup(chain), chain);
		}
		return visitChildren(node);
	}
}
