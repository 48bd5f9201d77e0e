package org.jaclang.semantic;

import org.jaclang.ast.*;
import org.jaclang.ast.declarations.*;
import org.jaclang.ast.expressions.*;
import org.jaclang.ast.statements.*;
import org.jaclang.semantic.symbol.*;
import org.jaclang.util.Debug;
import org.jaclang.util.DiagnosticKind;
import org.jaclang.util.ErrorHandler;
import org.jaclang.util.InternalCompilerError;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * First semantic pass. Builds the scope tree of a module, records on every node the
 * innermost scope it sits in, and declares the names whose position in the tree is
 * enough to place them: globals, imports, architypes, enums, abilities, out-of-line
 * definitions, parameters, has vars, enum members, implicit {@code self}/{@code super}
 * and test helpers. Declarations are hoisted, so a later use in the same scope sees them.
 */
public class SymbolTableBuilder extends AstBaseVisitor<Void>
{
	private final ErrorHandler errorHandler;
	private final Deque<Scope> scopeStack = new ArrayDeque<>();
	private Scope root;

	public SymbolTableBuilder(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	/**
	 * Runs the pass over a module.
	 *
	 * @return the module's root scope
	 */
	public Scope build(JacModule module)
	{
		visit(module);
		if (!scopeStack.isEmpty())
		{
			throw new InternalCompilerError("Scope stack not empty after leaving module, top is " + scopeStack.peek(), module);
		}
		return root;
	}

	public Scope getRoot()
	{
		return root;
	}

	private Scope currentScope()
	{
		Scope scope = scopeStack.peek();
		if (scope == null)
		{
			throw new InternalCompilerError("No open scope", SourceLocation.UNKNOWN);
		}
		return scope;
	}

	private Scope pushScope(String name, AstNode owner)
	{
		Scope scope;
		if (scopeStack.isEmpty())
		{
			if (owner.getParent() != null || root != null)
			{
				throw new InternalCompilerError("Only a module may open the root scope, got " + owner.getClass().getSimpleName(), owner);
			}
			scope = new Scope(name, owner, null);
			root = scope;
		}
		else
		{
			scope = currentScope().pushChildScope(name, owner);
		}
		owner.setScope(scope);
		scopeStack.push(scope);
		return scope;
	}

	private void popScope(AstNode owner)
	{
		if (scopeStack.isEmpty())
		{
			throw new InternalCompilerError("Cannot pop scope, the scope stack is empty", owner);
		}
		Scope scope = scopeStack.pop();
		if (scope.getOwner() != owner)
		{
			throw new InternalCompilerError("Leaving " + owner.getClass().getSimpleName() + " but the open scope belongs to " + scope.getName(), owner);
		}
	}

	/**
	 * Opens a scope named after the node kind and visits the node inside it.
	 */
	private Void scoped(AstNode node)
	{
		pushScope(node.getClass().getSimpleName(), node);
		visitChildren(node);
		popScope(node);
		return null;
	}

	private Symbol define(Scope scope, AstSymbolNode node, AccessModifier access, String singleDecl)
	{
		try
		{
			return scope.define(node, access, singleDecl);
		}
		catch (DuplicateDefinitionException e)
		{
			errorHandler.logError(e.getDuplicateNode(), DiagnosticKind.DUPLICATE_DEFINITION, e.getMessage());
			return e.getExisting();
		}
	}

	/**
	 * Attaches every kid to the current scope before visiting it. Scope-introducing
	 * kids replace this with their own scope when they open it.
	 */
	@Override
	public Void visitChildren(AstNode node)
	{
		for (AstNode kid : node.getKids())
		{
			kid.setScope(currentScope());
			kid.accept(this);
		}
		return null;
	}

	// ---------------------------------------------------------------------------
	// Module level
	// ---------------------------------------------------------------------------

	@Override
	public Void visitModule(JacModule node)
	{
		Debug.logDebug("Building scopes for module '" + node.getName() + "'...");
		pushScope(node.getName(), node);
		visitChildren(node);
		popScope(node);
		return null;
	}

	@Override
	public Void visitGlobalVars(GlobalVars node)
	{
		visitChildren(node);
		AccessModifier access = AccessModifier.of(node.getAccess());
		for (Assignment assignment : node.getAssignments())
		{
			for (AstNode target : assignment.getTargets())
			{
				if (!(target instanceof Name name))
				{
					throw new InternalCompilerError("Expected a name as global var target", target);
				}
				define(currentScope(), name, access, "global var");
			}
		}
		return null;
	}

	@Override
	public Void visitImport(Import node)
	{
		visitChildren(node);
		if (node.isAbsorb())
		{
			// Resolved against the target module in the def/use pass.
			return null;
		}
		if (node.getItems() != null)
		{
			for (ModuleItem item : node.getItems().getItems())
			{
				define(currentScope(), item, AccessModifier.PUBLIC, "import item");
			}
			return null;
		}
		for (ModulePath path : node.getPaths())
		{
			define(currentScope(), path, AccessModifier.PUBLIC, path.getAlias() != null ? "import" : null);
		}
		return null;
	}

	// ---------------------------------------------------------------------------
	// Architypes, abilities, enums
	// ---------------------------------------------------------------------------

	@Override
	public Void visitArchitype(Architype node)
	{
		Symbol symbol = define(currentScope(), node, AccessModifier.of(node.getAccess()), "architype");
		Scope body = pushScope(node.getSymName(), node);
		if (node.getBody() != null || symbol.getMemberScope() == null)
		{
			symbol.setMemberScope(body);
		}
		visitChildren(node);
		popScope(node);
		return null;
	}

	@Override
	public Void visitEnumDecl(EnumDecl node)
	{
		Symbol symbol = define(currentScope(), node, AccessModifier.of(node.getAccess()), "enum");
		Scope body = pushScope(node.getSymName(), node);
		if (node.getBody() != null || symbol.getMemberScope() == null)
		{
			symbol.setMemberScope(body);
		}
		visitChildren(node);
		popScope(node);
		return null;
	}

	@Override
	public Void visitEnumMember(EnumMember node)
	{
		visitChildren(node);
		define(currentScope(), node, AccessModifier.PUBLIC, null);
		return null;
	}

	@Override
	public Void visitArchDef(ArchDef node)
	{
		return visitOutOfLineDef(node, "arch def");
	}

	@Override
	public Void visitAbilityDef(AbilityDef node)
	{
		return visitOutOfLineDef(node, "ability def");
	}

	private Void visitOutOfLineDef(OutOfLineDef node, String label)
	{
		Symbol symbol = define(currentScope(), node, AccessModifier.PUBLIC, label);
		Scope body = pushScope(node.getSymName(), node);
		symbol.setMemberScope(body);
		visitChildren(node);
		popScope(node);
		return null;
	}

	@Override
	public Void visitAbility(Ability node)
	{
		define(currentScope(), node, AccessModifier.of(node.getAccess()), "ability");
		Scope body = pushScope(node.getSymName(), node);
		if (node.isMethod())
		{
			Name self = Name.stub(node, "self");
			self.setScope(body);
			Symbol selfSymbol = body.define(self, SymbolKind.SELF, AccessModifier.PUBLIC, null);
			selfSymbol.setMemberScope(node.getOwnerArch().getScope());

			// Its member scope is the first base, known once inheritance is resolved.
			Name superStub = Name.stub(node, "super");
			superStub.setScope(body);
			body.define(superStub, SymbolKind.SUPER, AccessModifier.PUBLIC, null);
		}
		visitChildren(node);
		popScope(node);
		return null;
	}

	@Override
	public Void visitParamVar(ParamVar node)
	{
		visitChildren(node);
		define(currentScope(), node, AccessModifier.PUBLIC, "parameter");
		return null;
	}

	@Override
	public Void visitHasVar(HasVar node)
	{
		ArchHas has = node.getOwnerHas();
		if (has == null)
		{
			throw new InternalCompilerError("Has var '" + node.getSymName() + "' is not inside a has statement", node);
		}
		visitChildren(node);
		define(currentScope(), node, AccessModifier.of(has.getAccess()), "has var");
		return null;
	}

	@Override
	public Void visitTestBlock(TestBlock node)
	{
		define(currentScope(), node, AccessModifier.PUBLIC, "test");
		Scope body = pushScope(node.getSymName(), node);
		BuiltInNames.defineTestHelpers(node, body);
		visitChildren(node);
		popScope(node);
		return null;
	}

	// ---------------------------------------------------------------------------
	// Scope-introducing statements and expressions
	// ---------------------------------------------------------------------------

	@Override
	public Void visitIfStmt(IfStmt node)
	{
		return scoped(node);
	}

	@Override
	public Void visitElseIf(ElseIf node)
	{
		return scoped(node);
	}

	@Override
	public Void visitElseStmt(ElseStmt node)
	{
		return scoped(node);
	}

	@Override
	public Void visitWhileStmt(WhileStmt node)
	{
		return scoped(node);
	}

	@Override
	public Void visitInForStmt(InForStmt node)
	{
		return scoped(node);
	}

	@Override
	public Void visitIterForStmt(IterForStmt node)
	{
		return scoped(node);
	}

	@Override
	public Void visitTryStmt(TryStmt node)
	{
		return scoped(node);
	}

	@Override
	public Void visitExcept(Except node)
	{
		return scoped(node);
	}

	@Override
	public Void visitFinallyStmt(FinallyStmt node)
	{
		return scoped(node);
	}

	@Override
	public Void visitWithStmt(WithStmt node)
	{
		return scoped(node);
	}

	@Override
	public Void visitMatchCase(MatchCase node)
	{
		return scoped(node);
	}

	@Override
	public Void visitLambdaExpr(LambdaExpr node)
	{
		return scoped(node);
	}

	@Override
	public Void visitListCompr(ListCompr node)
	{
		return scoped(node);
	}

	@Override
	public Void visitSetCompr(SetCompr node)
	{
		return scoped(node);
	}

	@Override
	public Void visitGenCompr(GenCompr node)
	{
		return scoped(node);
	}

	@Override
	public Void visitDictCompr(DictCompr node)
	{
		return scoped(node);
	}
}
