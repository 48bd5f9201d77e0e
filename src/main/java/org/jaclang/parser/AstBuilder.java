package org.jaclang.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.jaclang.ast.*;
import org.jaclang.ast.declarations.*;
import org.jaclang.ast.expressions.*;
import org.jaclang.ast.patterns.*;
import org.jaclang.ast.statements.*;
import org.jaclang.util.InternalCompilerError;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts the ANTLR parse tree of one module into the AST. Every node keeps all of
 * its tokens as kids so that the formatter can regenerate the source from the tree
 * alone. Single-child grammar rules (precedence levels, alternatives) collapse into
 * their child.
 */
public class AstBuilder extends JacBaseVisitor<AstNode>
{
	// Helper rules whose children belong directly to the enclosing list.
	private static final Set<Class<? extends ParserRuleContext>> FLATTENED = Set.of(
			JacParser.ExprListContext.class,
			JacParser.KvPairListContext.class,
			JacParser.BaseListContext.class,
			JacParser.SubscriptListContext.class);

	private final String moduleName;
	private int anonymousTests;

	public AstBuilder(String moduleName)
	{
		this.moduleName = moduleName;
	}

	/**
	 * Children of one context converted in order, with a lookup from each parse tree
	 * child to the node built for it.
	 */
	private final class Kids
	{
		private final List<AstNode> nodes = new ArrayList<>();
		private final Map<ParseTree, AstNode> byTree = new IdentityHashMap<>();

		private Kids(ParserRuleContext ctx)
		{
			if (ctx.children == null)
			{
				return;
			}
			for (ParseTree child : ctx.children)
			{
				if (child instanceof TerminalNode terminal && terminal.getSymbol().getType() == JacParser.EOF)
				{
					continue;
				}
				AstNode node = child instanceof TerminalNode leaf ? token(leaf) : visit(child);
				if (node != null)
				{
					nodes.add(node);
					byTree.put(child, node);
				}
			}
		}

		@SuppressWarnings("unchecked")
		private <T extends AstNode> T get(ParseTree tree)
		{
			return tree == null ? null : (T) byTree.get(tree);
		}

		private <T extends AstNode> List<T> all(List<? extends ParseTree> trees)
		{
			List<T> result = new ArrayList<>();
			for (ParseTree tree : trees)
			{
				T node = get(tree);
				result.add(node);
			}
			return result;
		}
	}

	private Token token(TerminalNode node)
	{
		org.antlr.v4.runtime.Token symbol = node.getSymbol();
		String kind = JacParser.VOCABULARY.getSymbolicName(symbol.getType());
		String text = symbol.getText();
		SourceLocation location = locationOf(symbol);
		return switch (symbol.getType())
		{
			case JacParser.NAME, JacParser.KWESC_NAME -> new Name(kind, text, location);
			case JacParser.KW_SELF, JacParser.KW_SUPER, JacParser.KW_HERE, JacParser.KW_ROOT, JacParser.KW_VISITOR ->
					new SpecialVarRef(kind, text, location);
			case JacParser.TYP_INT, JacParser.TYP_FLOAT, JacParser.TYP_STR, JacParser.TYP_BOOL, JacParser.TYP_BYTES,
					JacParser.TYP_LIST, JacParser.TYP_TUPLE, JacParser.TYP_SET, JacParser.TYP_DICT, JacParser.TYP_TYPE,
					JacParser.TYP_ANY -> new BuiltinType(kind, text, location);
			case JacParser.INT -> new IntLiteral(kind, text, location);
			case JacParser.FLOAT -> new FloatLiteral(kind, text, location);
			case JacParser.STRING -> new StringLiteral(kind, text, location);
			case JacParser.KW_TRUE, JacParser.KW_FALSE -> new BoolLiteral(kind, text, location);
			case JacParser.KW_NONE -> new NullLiteral(kind, text, location);
			case JacParser.ELLIPSIS -> new EllipsisLiteral(kind, text, location);
			default -> new Token(kind, text, location);
		};
	}

	/**
	 * Location of a token, including the end of tokens that span lines.
	 */
	static SourceLocation locationOf(org.antlr.v4.runtime.Token symbol)
	{
		String text = symbol.getText();
		int line = symbol.getLine();
		int column = symbol.getCharPositionInLine() + 1;
		int newlines = 0;
		int lastBreak = -1;
		for (int i = 0; i < text.length(); i++)
		{
			if (text.charAt(i) == '\n')
			{
				newlines++;
				lastBreak = i;
			}
		}
		if (newlines == 0)
		{
			return new SourceLocation(line, column, line, column + Math.max(text.length(), 1) - 1);
		}
		return new SourceLocation(line, column, line + newlines, text.length() - lastBreak - 1);
	}

	@Override
	public AstNode visitTerminal(TerminalNode node)
	{
		return token(node);
	}

	/**
	 * Builds a list node from a context whose kids are items, separators and brackets.
	 * Items are every kid that is not bare punctuation.
	 */
	private <T extends AstNode> SubNodeList<T> flatList(ParserRuleContext ctx)
	{
		List<AstNode> kids = new ArrayList<>();
		collectFlat(ctx, kids);
		return listOf(kids);
	}

	private void collectFlat(ParserRuleContext ctx, List<AstNode> kids)
	{
		if (ctx.children == null)
		{
			return;
		}
		for (ParseTree child : ctx.children)
		{
			if (child instanceof TerminalNode terminal)
			{
				kids.add(token(terminal));
			}
			else if (FLATTENED.contains(child.getClass()))
			{
				collectFlat((ParserRuleContext) child, kids);
			}
			else
			{
				kids.add(visit(child));
			}
		}
	}

	@SuppressWarnings("unchecked")
	private static <T extends AstNode> SubNodeList<T> listOf(List<AstNode> kids)
	{
		List<T> items = new ArrayList<>();
		for (AstNode kid : kids)
		{
			if (kid.getClass() != Token.class)
			{
				items.add((T) kid);
			}
		}
		return new SubNodeList<>(kids, items);
	}

	// ---------------------------------------------------------------------------
	// Module level
	// ---------------------------------------------------------------------------

	@Override
	public AstNode visitModuleUnit(JacParser.ModuleUnitContext ctx)
	{
		Kids k = new Kids(ctx);
		StringLiteral docstring = k.get(ctx.STRING());
		List<AstNode> body = k.all(ctx.element());
		return new JacModule(k.nodes, moduleName, docstring, body);
	}

	@Override
	public AstNode visitAccessTag(JacParser.AccessTagContext ctx)
	{
		Kids k = new Kids(ctx);
		return new SubTag<>(k.nodes, (Token) k.nodes.get(1));
	}

	@Override
	public AstNode visitLangTag(JacParser.LangTagContext ctx)
	{
		Kids k = new Kids(ctx);
		return new SubTag<>(k.nodes, (Name) k.get(ctx.named()));
	}

	@Override
	public AstNode visitTypeTag(JacParser.TypeTagContext ctx)
	{
		Kids k = new Kids(ctx);
		return new SubTag<>(k.nodes, k.get(ctx.expression()));
	}

	@Override
	public AstNode visitGlobalVars(JacParser.GlobalVarsContext ctx)
	{
		Kids k = new Kids(ctx);
		return new GlobalVars(k.nodes, k.get(ctx.accessTag()), k.all(ctx.assignment()));
	}

	@Override
	public AstNode visitImportStmt(JacParser.ImportStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		SubTag<Name> lang = k.get(ctx.langTag());
		if (ctx.KW_INCLUDE() != null)
		{
			return new Import(k.nodes, lang, null, null, List.of((ModulePath) k.get(ctx.modulePath())), true);
		}
		if (ctx.KW_FROM() != null)
		{
			return new Import(k.nodes, lang, k.get(ctx.modulePath()), k.get(ctx.importItems()), List.of(), false);
		}
		SubNodeList<ModulePath> paths = k.get(ctx.modulePathList());
		return new Import(k.nodes, lang, null, null, paths.getItems(), false);
	}

	@Override
	public AstNode visitModulePathList(JacParser.ModulePathListContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitModulePath(JacParser.ModulePathContext ctx)
	{
		Kids k = new Kids(ctx);
		List<Name> names = k.all(ctx.named());
		Name alias = null;
		if (ctx.KW_AS() != null)
		{
			alias = names.remove(names.size() - 1);
		}
		int level = 0;
		for (AstNode node : k.nodes)
		{
			if (node instanceof Token token && token.is(".") && level == k.nodes.indexOf(node))
			{
				level++;
			}
		}
		return new ModulePath(k.nodes, names, alias, level);
	}

	@Override
	public AstNode visitImportItems(JacParser.ImportItemsContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitImportItem(JacParser.ImportItemContext ctx)
	{
		Kids k = new Kids(ctx);
		List<Name> names = k.all(ctx.named());
		return new ModuleItem(k.nodes, names.get(0), names.size() > 1 ? names.get(1) : null);
	}

	// ---------------------------------------------------------------------------
	// Architypes, abilities, enums
	// ---------------------------------------------------------------------------

	@Override
	public AstNode visitArchitype(JacParser.ArchitypeContext ctx)
	{
		Kids k = new Kids(ctx);
		Token kind = k.get(ctx.archKind());
		return new Architype(k.nodes, Architype.ArchType.fromKeyword(kind.getValue()), k.get(ctx.accessTag()),
				k.get(ctx.named()), k.get(ctx.inheritedArchs()), k.get(ctx.archBlock()));
	}

	@Override
	public AstNode visitInheritedArchs(JacParser.InheritedArchsContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitArchBlock(JacParser.ArchBlockContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitHasStmt(JacParser.HasStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new ArchHas(k.nodes, ctx.KW_STATIC() != null, k.get(ctx.accessTag()), k.get(ctx.hasVarList()));
	}

	@Override
	public AstNode visitHasVarList(JacParser.HasVarListContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitHasVar(JacParser.HasVarContext ctx)
	{
		Kids k = new Kids(ctx);
		return new HasVar(k.nodes, k.get(ctx.named()), k.get(ctx.typeTag()), k.get(ctx.expression()));
	}

	@Override
	public AstNode visitAbility(JacParser.AbilityContext ctx)
	{
		Kids k = new Kids(ctx);
		AstNode signature = ctx.funcSignature() != null ? k.get(ctx.funcSignature()) : k.get(ctx.eventSignature());
		return new Ability(k.nodes, ctx.KW_STATIC() != null, k.get(ctx.accessTag()), k.get(ctx.named()),
				signature, k.get(ctx.codeBlock()));
	}

	@Override
	public AstNode visitFuncSignature(JacParser.FuncSignatureContext ctx)
	{
		Kids k = new Kids(ctx);
		SubNodeList<ParamVar> params = null;
		if (ctx.LPAREN() != null)
		{
			params = ctx.paramList() != null ? k.get(ctx.paramList()) : new SubNodeList<>(List.of(), List.of());
		}
		return new FuncSignature(k.nodes, params, k.get(ctx.expression()));
	}

	@Override
	public AstNode visitEventSignature(JacParser.EventSignatureContext ctx)
	{
		Kids k = new Kids(ctx);
		TerminalNode event = ctx.KW_ENTRY() != null ? ctx.KW_ENTRY() : ctx.KW_EXIT();
		int eventIndex = event.getSymbol().getTokenIndex();
		AstNode archTag = null;
		AstNode returnType = null;
		for (JacParser.ExpressionContext expr : ctx.expression())
		{
			if (expr.getStart().getTokenIndex() < eventIndex)
			{
				archTag = k.get(expr);
			}
			else
			{
				returnType = k.get(expr);
			}
		}
		return new EventSignature(k.nodes, archTag, k.get(event), returnType);
	}

	@Override
	public AstNode visitParamList(JacParser.ParamListContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitParamVar(JacParser.ParamVarContext ctx)
	{
		Kids k = new Kids(ctx);
		TerminalNode unpack = ctx.STAR_MUL() != null ? ctx.STAR_MUL() : ctx.STAR_POW();
		return new ParamVar(k.nodes, k.get(unpack), k.get(ctx.named()), k.get(ctx.typeTag()), k.get(ctx.expression()));
	}

	@Override
	public AstNode visitArchDef(JacParser.ArchDefContext ctx)
	{
		Kids k = new Kids(ctx);
		return new ArchDef(k.nodes, k.get(ctx.archRefChain()), k.get(ctx.archBlock()));
	}

	@Override
	public AstNode visitAbilityDef(JacParser.AbilityDefContext ctx)
	{
		Kids k = new Kids(ctx);
		AstNode signature = ctx.funcSignature() != null ? k.get(ctx.funcSignature()) : k.get(ctx.eventSignature());
		return new AbilityDef(k.nodes, k.get(ctx.abilityRefChain()), signature, k.get(ctx.codeBlock()));
	}

	@Override
	public AstNode visitArchRefChain(JacParser.ArchRefChainContext ctx)
	{
		Kids k = new Kids(ctx);
		return new ArchRefChain(k.nodes, k.all(ctx.archRef()));
	}

	@Override
	public AstNode visitAbilityRefChain(JacParser.AbilityRefChainContext ctx)
	{
		Kids k = new Kids(ctx);
		List<ArchRef> archs = k.all(ctx.archRef());
		archs.add(k.get(ctx.abilityRef()));
		return new ArchRefChain(k.nodes, archs);
	}

	@Override
	public AstNode visitArchRef(JacParser.ArchRefContext ctx)
	{
		Kids k = new Kids(ctx);
		return new ArchRef(k.nodes, k.get(ctx.archRefKind()), k.get(ctx.named()));
	}

	@Override
	public AstNode visitAbilityRef(JacParser.AbilityRefContext ctx)
	{
		Kids k = new Kids(ctx);
		return new ArchRef(k.nodes, k.get(ctx.KW_CAN()), k.get(ctx.named()));
	}

	@Override
	public AstNode visitEnumDecl(JacParser.EnumDeclContext ctx)
	{
		Kids k = new Kids(ctx);
		return new EnumDecl(k.nodes, k.get(ctx.accessTag()), k.get(ctx.named()), k.get(ctx.inheritedArchs()),
				k.get(ctx.enumBlock()));
	}

	@Override
	public AstNode visitEnumBlock(JacParser.EnumBlockContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitEnumMember(JacParser.EnumMemberContext ctx)
	{
		Kids k = new Kids(ctx);
		return new EnumMember(k.nodes, k.get(ctx.named()), k.get(ctx.expression()));
	}

	@Override
	public AstNode visitTestBlock(JacParser.TestBlockContext ctx)
	{
		Kids k = new Kids(ctx);
		Name name = k.get(ctx.named());
		return new TestBlock(k.nodes, name, k.get(ctx.codeBlock()), name == null ? anonymousTests++ : -1);
	}

	@Override
	public AstNode visitModuleCode(JacParser.ModuleCodeContext ctx)
	{
		Kids k = new Kids(ctx);
		return new ModuleCode(k.nodes, k.get(ctx.langTag()), k.get(ctx.codeBlock()));
	}

	// ---------------------------------------------------------------------------
	// Statements
	// ---------------------------------------------------------------------------

	@Override
	public AstNode visitCodeBlock(JacParser.CodeBlockContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitIfStmt(JacParser.IfStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		AstNode elseBody = ctx.elifStmt() != null ? k.get(ctx.elifStmt()) : k.get(ctx.elseStmt());
		return new IfStmt(k.nodes, k.get(ctx.expression()), k.get(ctx.codeBlock()), elseBody);
	}

	@Override
	public AstNode visitElifStmt(JacParser.ElifStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		AstNode elseBody = ctx.elifStmt() != null ? k.get(ctx.elifStmt()) : k.get(ctx.elseStmt());
		return new ElseIf(k.nodes, k.get(ctx.expression()), k.get(ctx.codeBlock()), elseBody);
	}

	@Override
	public AstNode visitElseStmt(JacParser.ElseStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new ElseStmt(k.nodes, k.get(ctx.codeBlock()));
	}

	@Override
	public AstNode visitWhileStmt(JacParser.WhileStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new WhileStmt(k.nodes, k.get(ctx.expression()), k.get(ctx.codeBlock()));
	}

	@Override
	public AstNode visitIterForStmt(JacParser.IterForStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new IterForStmt(k.nodes, k.get(ctx.assignment(0)), k.get(ctx.expression()), k.get(ctx.assignment(1)),
				k.get(ctx.codeBlock()));
	}

	@Override
	public AstNode visitInForStmt(JacParser.InForStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new InForStmt(k.nodes, k.get(ctx.forTarget()), k.get(ctx.expression()), k.get(ctx.codeBlock()));
	}

	@Override
	public AstNode visitForTarget(JacParser.ForTargetContext ctx)
	{
		if (ctx.atomicChain().size() == 1)
		{
			return visit(ctx.atomicChain(0));
		}
		return new TupleVal(flatList(ctx));
	}

	@Override
	public AstNode visitTryStmt(JacParser.TryStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new TryStmt(k.nodes, k.get(ctx.codeBlock()), k.all(ctx.exceptClause()), k.get(ctx.elseStmt()),
				k.get(ctx.finallyStmt()));
	}

	@Override
	public AstNode visitExceptClause(JacParser.ExceptClauseContext ctx)
	{
		Kids k = new Kids(ctx);
		return new Except(k.nodes, k.get(ctx.expression()), k.get(ctx.named()), k.get(ctx.codeBlock()));
	}

	@Override
	public AstNode visitFinallyStmt(JacParser.FinallyStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new FinallyStmt(k.nodes, k.get(ctx.codeBlock()));
	}

	@Override
	public AstNode visitWithStmt(JacParser.WithStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new WithStmt(k.nodes, k.get(ctx.exprAsItemList()), k.get(ctx.codeBlock()));
	}

	@Override
	public AstNode visitExprAsItemList(JacParser.ExprAsItemListContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitExprAsItem(JacParser.ExprAsItemContext ctx)
	{
		Kids k = new Kids(ctx);
		AstNode alias = ctx.expression().size() > 1 ? k.get(ctx.expression(1)) : null;
		return new ExprAsItem(k.nodes, k.get(ctx.expression(0)), alias);
	}

	@Override
	public AstNode visitMatchStmt(JacParser.MatchStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new MatchStmt(k.nodes, k.get(ctx.expression()), k.get(ctx.matchCaseBlock()));
	}

	@Override
	public AstNode visitMatchCaseBlock(JacParser.MatchCaseBlockContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitMatchCase(JacParser.MatchCaseContext ctx)
	{
		Kids k = new Kids(ctx);
		return new MatchCase(k.nodes, k.get(ctx.pattern()), k.get(ctx.expression()), k.get(ctx.caseBody()));
	}

	@Override
	public AstNode visitCaseBody(JacParser.CaseBodyContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitReturnStmt(JacParser.ReturnStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new ReturnStmt(k.nodes, k.get(ctx.expression()));
	}

	@Override
	public AstNode visitYieldStmt(JacParser.YieldStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new YieldStmt(k.nodes, k.get(ctx.expression()), ctx.KW_FROM() != null);
	}

	@Override
	public AstNode visitRaiseStmt(JacParser.RaiseStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		List<AstNode> exprs = k.all(ctx.expression());
		return new RaiseStmt(k.nodes, exprs.isEmpty() ? null : exprs.get(0), exprs.size() > 1 ? exprs.get(1) : null);
	}

	@Override
	public AstNode visitAssertStmt(JacParser.AssertStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		List<AstNode> exprs = k.all(ctx.expression());
		return new AssertStmt(k.nodes, exprs.get(0), exprs.size() > 1 ? exprs.get(1) : null);
	}

	@Override
	public AstNode visitCtrlStmt(JacParser.CtrlStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new CtrlStmt(k.nodes, (Token) k.nodes.get(0));
	}

	@Override
	public AstNode visitDeleteStmt(JacParser.DeleteStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new DeleteStmt(k.nodes, k.get(ctx.exprList()));
	}

	@Override
	public AstNode visitExprList(JacParser.ExprListContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitReportStmt(JacParser.ReportStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new ReportStmt(k.nodes, k.get(ctx.expression()));
	}

	@Override
	public AstNode visitVisitStmt(JacParser.VisitStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new VisitStmt(k.nodes, k.get(ctx.expression()), k.get(ctx.elseStmt()));
	}

	@Override
	public AstNode visitIgnoreStmt(JacParser.IgnoreStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new IgnoreStmt(k.nodes, k.get(ctx.expression()));
	}

	@Override
	public AstNode visitDisengageStmt(JacParser.DisengageStmtContext ctx)
	{
		return new DisengageStmt(new Kids(ctx).nodes);
	}

	@Override
	public AstNode visitGlobalStmt(JacParser.GlobalStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new GlobalStmt(k.nodes, k.get(ctx.nameList()), ctx.NONLOCAL_OP() != null);
	}

	@Override
	public AstNode visitNameList(JacParser.NameListContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitAssignmentStmt(JacParser.AssignmentStmtContext ctx)
	{
		Assignment inner = (Assignment) visit(ctx.assignment());
		List<AstNode> kids = new ArrayList<>(inner.getKids());
		kids.add(token(ctx.SEMI()));
		return new Assignment(kids, inner.getTargets(), inner.getValue(), inner.getTypeTag(), inner.getAugOp(), inner.isLet());
	}

	@Override
	public AstNode visitAssignment(JacParser.AssignmentContext ctx)
	{
		Kids k = new Kids(ctx);
		List<AstNode> exprs = k.all(ctx.expression());
		boolean isLet = ctx.KW_LET() != null;
		if (ctx.typeTag() != null)
		{
			return new Assignment(k.nodes, List.of(exprs.get(0)), exprs.size() > 1 ? exprs.get(1) : null,
					k.get(ctx.typeTag()), null, isLet);
		}
		if (ctx.augOp() != null)
		{
			return new Assignment(k.nodes, List.of(exprs.get(0)), exprs.get(1), null, k.get(ctx.augOp()), isLet);
		}
		return new Assignment(k.nodes, exprs.subList(0, exprs.size() - 1), exprs.get(exprs.size() - 1), null, null, isLet);
	}

	@Override
	public AstNode visitExprStmt(JacParser.ExprStmtContext ctx)
	{
		Kids k = new Kids(ctx);
		return new ExprStmt(k.nodes, k.get(ctx.expression()));
	}

	// ---------------------------------------------------------------------------
	// Match patterns
	// ---------------------------------------------------------------------------

	@Override
	public AstNode visitPattern(JacParser.PatternContext ctx)
	{
		if (ctx.KW_AS() == null)
		{
			return visit(ctx.orPattern());
		}
		Kids k = new Kids(ctx);
		return new MatchAs(k.nodes, k.get(ctx.named()), k.get(ctx.orPattern()));
	}

	@Override
	public AstNode visitOrPattern(JacParser.OrPatternContext ctx)
	{
		if (ctx.closedPattern().size() == 1)
		{
			return visit(ctx.closedPattern(0));
		}
		Kids k = new Kids(ctx);
		return new MatchOr(k.nodes, k.all(ctx.closedPattern()));
	}

	@Override
	public AstNode visitLiteralPattern(JacParser.LiteralPatternContext ctx)
	{
		Kids k = new Kids(ctx);
		AstNode value = k.nodes.get(k.nodes.size() - 1);
		if (ctx.MINUS() != null)
		{
			Token minus = k.get(ctx.MINUS());
			value = new UnaryExpr(List.of(minus, value), minus, value);
		}
		return new MatchValue(List.of(value), value);
	}

	@Override
	public AstNode visitSingletonPattern(JacParser.SingletonPatternContext ctx)
	{
		Kids k = new Kids(ctx);
		return new MatchSingleton(k.nodes, (Token) k.nodes.get(0));
	}

	@Override
	public AstNode visitCapturePattern(JacParser.CapturePatternContext ctx)
	{
		Kids k = new Kids(ctx);
		Name name = k.get(ctx.named());
		if (name.getSymName().equals("_"))
		{
			return new MatchWild(k.nodes);
		}
		return new MatchAs(k.nodes, name, null);
	}

	@Override
	public AstNode visitValuePattern(JacParser.ValuePatternContext ctx)
	{
		AstNode chain = dottedChain(new Kids(ctx).nodes);
		return new MatchValue(List.of(chain), chain);
	}

	@Override
	public AstNode visitClassPattern(JacParser.ClassPatternContext ctx)
	{
		Kids k = new Kids(ctx);
		int open = 0;
		while (!(k.nodes.get(open) instanceof Token token && token.is("(")))
		{
			open++;
		}
		AstNode name = dottedChain(k.nodes.subList(0, open));
		List<AstNode> kids = new ArrayList<>();
		kids.add(name);
		List<AstNode> args = new ArrayList<>();
		for (AstNode node : k.nodes.subList(open, k.nodes.size()))
		{
			if (node instanceof SubNodeList<?> list)
			{
				kids.addAll(list.getKids());
				args.addAll(list.getItems());
			}
			else
			{
				kids.add(node);
			}
		}
		return new MatchArch(kids, name, args);
	}

	/**
	 * Folds {@code a . b . c} into nested attribute trailers.
	 */
	private static AstNode dottedChain(List<AstNode> parts)
	{
		AstNode chain = parts.get(0);
		for (int i = 1; i + 1 < parts.size(); i += 2)
		{
			AstNode dot = parts.get(i);
			AstNode name = parts.get(i + 1);
			chain = new AtomTrailer(List.of(chain, dot, name), chain, name, true);
		}
		return chain;
	}

	@Override
	public AstNode visitPatternArgs(JacParser.PatternArgsContext ctx)
	{
		return flatList(ctx);
	}

	@Override
	public AstNode visitPatternArg(JacParser.PatternArgContext ctx)
	{
		if (ctx.named() == null)
		{
			return visit(ctx.pattern());
		}
		Kids k = new Kids(ctx);
		return new MatchKVPair(k.nodes, k.get(ctx.named()), k.get(ctx.pattern()));
	}

	@Override
	public AstNode visitSequencePattern(JacParser.SequencePatternContext ctx)
	{
		Kids k = new Kids(ctx);
		return new MatchSequence(k.nodes, k.all(ctx.pattern()));
	}

	@Override
	public AstNode visitStarPattern(JacParser.StarPatternContext ctx)
	{
		Kids k = new Kids(ctx);
		return new MatchStar(k.nodes, k.get(ctx.named()));
	}

	// ---------------------------------------------------------------------------
	// Expressions
	// ---------------------------------------------------------------------------

	@Override
	public AstNode visitLambdaExpr(JacParser.LambdaExprContext ctx)
	{
		Kids k = new Kids(ctx);
		List<AstNode> exprs = k.all(ctx.expression());
		AstNode returnType = ctx.RETURN_HINT() != null ? exprs.get(0) : null;
		return new LambdaExpr(k.nodes, k.get(ctx.paramList()), returnType, exprs.get(exprs.size() - 1));
	}

	@Override
	public AstNode visitTernaryExpr(JacParser.TernaryExprContext ctx)
	{
		if (ctx.KW_IF() == null)
		{
			return visit(ctx.orExpr(0));
		}
		Kids k = new Kids(ctx);
		return new IfElseExpr(k.nodes, k.get(ctx.orExpr(0)), k.get(ctx.orExpr(1)), k.get(ctx.expression()));
	}

	@Override
	public AstNode visitOrExpr(JacParser.OrExprContext ctx)
	{
		return boolChain(ctx);
	}

	@Override
	public AstNode visitAndExpr(JacParser.AndExprContext ctx)
	{
		return boolChain(ctx);
	}

	private AstNode boolChain(ParserRuleContext ctx)
	{
		if (ctx.getChildCount() == 1)
		{
			return visit(ctx.getChild(0));
		}
		Kids k = new Kids(ctx);
		List<AstNode> values = new ArrayList<>();
		for (int i = 0; i < k.nodes.size(); i += 2)
		{
			values.add(k.nodes.get(i));
		}
		return new BoolExpr(k.nodes, (Token) k.nodes.get(1), values);
	}

	@Override
	public AstNode visitNotExpr(JacParser.NotExprContext ctx)
	{
		if (ctx.KW_NOT() == null)
		{
			return visit(ctx.compareExpr());
		}
		Kids k = new Kids(ctx);
		return new UnaryExpr(k.nodes, k.get(ctx.KW_NOT()), k.get(ctx.notExpr()));
	}

	@Override
	public AstNode visitCompareExpr(JacParser.CompareExprContext ctx)
	{
		if (ctx.getChildCount() == 1)
		{
			return visit(ctx.getChild(0));
		}
		List<AstNode> kids = new ArrayList<>();
		List<String> ops = new ArrayList<>();
		List<AstNode> rights = new ArrayList<>();
		AstNode left = null;
		for (ParseTree child : ctx.children)
		{
			if (child instanceof JacParser.CompOpContext op)
			{
				List<String> words = new ArrayList<>();
				for (ParseTree part : op.children)
				{
					Token token = token((TerminalNode) part);
					kids.add(token);
					words.add(token.getValue());
				}
				ops.add(String.join(" ", words));
			}
			else
			{
				AstNode operand = visit(child);
				kids.add(operand);
				if (left == null)
				{
					left = operand;
				}
				else
				{
					rights.add(operand);
				}
			}
		}
		return new CompareExpr(kids, left, ops, rights);
	}

	@Override
	public AstNode visitConnectExpr(JacParser.ConnectExprContext ctx)
	{
		return leftAssoc(ctx);
	}

	@Override
	public AstNode visitBitOrExpr(JacParser.BitOrExprContext ctx)
	{
		return leftAssoc(ctx);
	}

	@Override
	public AstNode visitBitXorExpr(JacParser.BitXorExprContext ctx)
	{
		return leftAssoc(ctx);
	}

	@Override
	public AstNode visitBitAndExpr(JacParser.BitAndExprContext ctx)
	{
		return leftAssoc(ctx);
	}

	@Override
	public AstNode visitShiftExpr(JacParser.ShiftExprContext ctx)
	{
		return leftAssoc(ctx);
	}

	@Override
	public AstNode visitArithExpr(JacParser.ArithExprContext ctx)
	{
		return leftAssoc(ctx);
	}

	@Override
	public AstNode visitTermExpr(JacParser.TermExprContext ctx)
	{
		return leftAssoc(ctx);
	}

	/**
	 * {@code a op b op c} as {@code (a op b) op c}. Operators given by a helper rule
	 * (such as {@code connectOp}) collapse into their token.
	 */
	private AstNode leftAssoc(ParserRuleContext ctx)
	{
		AstNode node = visit(ctx.getChild(0));
		for (int i = 1; i + 1 < ctx.getChildCount(); i += 2)
		{
			Token op = (Token) visit(ctx.getChild(i));
			AstNode right = visit(ctx.getChild(i + 1));
			node = new BinaryExpr(List.of(node, op, right), node, op, right);
		}
		return node;
	}

	@Override
	public AstNode visitFactorExpr(JacParser.FactorExprContext ctx)
	{
		if (ctx.powerExpr() != null)
		{
			return visit(ctx.powerExpr());
		}
		Kids k = new Kids(ctx);
		return new UnaryExpr(k.nodes, (Token) k.nodes.get(0), k.get(ctx.factorExpr()));
	}

	@Override
	public AstNode visitPowerExpr(JacParser.PowerExprContext ctx)
	{
		if (ctx.factorExpr() == null)
		{
			return visit(ctx.atomicChain());
		}
		Kids k = new Kids(ctx);
		return new BinaryExpr(k.nodes, k.get(ctx.atomicChain()), k.get(ctx.STAR_POW()), k.get(ctx.factorExpr()));
	}

	@Override
	public AstNode visitAtomicChain(JacParser.AtomicChainContext ctx)
	{
		AstNode node = visit(ctx.atom());
		for (JacParser.TrailerContext trailer : ctx.trailer())
		{
			node = applyTrailer(node, trailer);
		}
		return node;
	}

	private AstNode applyTrailer(AstNode target, JacParser.TrailerContext ctx)
	{
		if (ctx.DOT() != null)
		{
			Token dot = token(ctx.DOT());
			AstNode name = visit(ctx.named());
			return new AtomTrailer(List.of(target, dot, name), target, name, true);
		}
		if (ctx.callArgs() != null)
		{
			SubNodeList<AstNode> params = flatList(ctx.callArgs());
			return new FuncCall(List.of(target, params), target, params);
		}
		SubNodeList<AstNode> indices = flatList(ctx);
		IndexSlice index = new IndexSlice(indices.getKids(), indices.getItems());
		return new AtomTrailer(List.of(target, index), target, index, false);
	}

	@Override
	public AstNode visitTrailer(JacParser.TrailerContext ctx)
	{
		throw new InternalCompilerError("Trailer visited outside of its chain", locationOf(ctx.getStart()));
	}

	@Override
	public AstNode visitCallArg(JacParser.CallArgContext ctx)
	{
		if (ctx.named() != null)
		{
			Kids k = new Kids(ctx);
			return new KWPair(k.nodes, k.get(ctx.named()), k.get(ctx.expression()));
		}
		if (ctx.STAR_MUL() != null || ctx.STAR_POW() != null)
		{
			Kids k = new Kids(ctx);
			return new UnaryExpr(k.nodes, (Token) k.nodes.get(0), k.get(ctx.expression()));
		}
		return visit(ctx.expression());
	}

	@Override
	public AstNode visitSubscript(JacParser.SubscriptContext ctx)
	{
		if (ctx.COLON().isEmpty())
		{
			return visit(ctx.expression(0));
		}
		Kids k = new Kids(ctx);
		AstNode[] parts = new AstNode[3];
		int colons = 0;
		for (AstNode node : k.nodes)
		{
			if (node.getClass() == Token.class && ((Token) node).is(":"))
			{
				colons++;
			}
			else
			{
				parts[colons] = node;
			}
		}
		return new Slice(k.nodes, parts[0], parts[1], parts[2]);
	}

	@Override
	public AstNode visitMultiString(JacParser.MultiStringContext ctx)
	{
		Kids k = new Kids(ctx);
		if (k.nodes.size() == 1)
		{
			return k.nodes.get(0);
		}
		return new MultiString(k.nodes, k.all(ctx.STRING()));
	}

	@Override
	public AstNode visitParenAtom(JacParser.ParenAtomContext ctx)
	{
		Kids k = new Kids(ctx);
		return new AtomUnit(k.nodes, k.get(ctx.expression()));
	}

	@Override
	public AstNode visitTupleVal(JacParser.TupleValContext ctx)
	{
		return new TupleVal(flatList(ctx));
	}

	@Override
	public AstNode visitListVal(JacParser.ListValContext ctx)
	{
		return new ListVal(flatList(ctx));
	}

	@Override
	public AstNode visitSetVal(JacParser.SetValContext ctx)
	{
		return new SetVal(flatList(ctx));
	}

	@Override
	public AstNode visitDictVal(JacParser.DictValContext ctx)
	{
		return new DictVal(flatList(ctx));
	}

	@Override
	public AstNode visitKvPair(JacParser.KvPairContext ctx)
	{
		Kids k = new Kids(ctx);
		if (ctx.STAR_POW() != null)
		{
			return new KVPair(k.nodes, null, k.get(ctx.expression(0)));
		}
		return new KVPair(k.nodes, k.get(ctx.expression(0)), k.get(ctx.expression(1)));
	}

	@Override
	public AstNode visitListCompr(JacParser.ListComprContext ctx)
	{
		Kids k = new Kids(ctx);
		return new ListCompr(k.nodes, k.get(ctx.expression()), k.all(ctx.innerCompr()));
	}

	@Override
	public AstNode visitSetCompr(JacParser.SetComprContext ctx)
	{
		Kids k = new Kids(ctx);
		return new SetCompr(k.nodes, k.get(ctx.expression()), k.all(ctx.innerCompr()));
	}

	@Override
	public AstNode visitGenCompr(JacParser.GenComprContext ctx)
	{
		Kids k = new Kids(ctx);
		return new GenCompr(k.nodes, k.get(ctx.expression()), k.all(ctx.innerCompr()));
	}

	@Override
	public AstNode visitDictCompr(JacParser.DictComprContext ctx)
	{
		Kids k = new Kids(ctx);
		return new DictCompr(k.nodes, k.get(ctx.kvPair()), k.all(ctx.innerCompr()));
	}

	@Override
	public AstNode visitInnerCompr(JacParser.InnerComprContext ctx)
	{
		Kids k = new Kids(ctx);
		List<AstNode> exprs = k.all(ctx.orExpr());
		return new InnerCompr(k.nodes, k.get(ctx.forTarget()), exprs.get(0), exprs.subList(1, exprs.size()));
	}

	@Override
	public AstNode visitEdgeRef(JacParser.EdgeRefContext ctx)
	{
		Kids k = new Kids(ctx);
		return new EdgeOpRef(k.nodes, k.get(ctx.edgeOp()));
	}
}
