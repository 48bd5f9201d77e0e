package org.jaclang.codegen;

import org.jaclang.ast.*;
import org.jaclang.ast.declarations.*;
import org.jaclang.ast.expressions.*;
import org.jaclang.ast.patterns.*;
import org.jaclang.ast.statements.*;
import org.jaclang.util.CompilerSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Formatter pass. Walks the tree post-order: every kid is formatted before its parent,
 * and each node's {@code generatedText} is composed from the text of its kids. The
 * module's text is the canonical rendering of the whole source file.
 * <p>
 * Layout rules:
 * <ul>
 * <li>calls, list/set/dict displays and import item lists longer than the wrap width
 * are broken into one comma-terminated item per line</li>
 * <li>{@code and}/{@code or} chains longer than the wrap width break before each
 * operator</li>
 * <li>assignments longer than twice the wrap width whose value is an arithmetic chain
 * break before each {@code + - * /}</li>
 * <li>source gaps between statements collapse to a single blank line</li>
 * </ul>
 * Comments sitting inside a statement's expressions are moved after the statement.
 */
public class FormatVisitor extends AstBaseVisitor<String>
{
	private static final Set<String> ARITHMETIC_OPS = Set.of("+", "-", "*", "/");

	private final int wrapWidth;
	private final String indentUnit;

	// Text already on the line before leadNode, counted when leadNode is measured
	private AstNode leadNode;
	private int lead;

	public FormatVisitor(CompilerSettings settings)
	{
		this(settings.getWrapWidth(), settings.getIndentSize());
	}

	public FormatVisitor(int wrapWidth, int indentSize)
	{
		this.wrapWidth = wrapWidth;
		this.indentUnit = " ".repeat(indentSize);
	}

	// ---------------------------------------------------------------------------
	// Helpers
	// ---------------------------------------------------------------------------

	private void formatKids(AstNode node)
	{
		for (AstNode kid : node.getKids())
		{
			kid.accept(this);
		}
	}

	private String emit(AstNode node, String text)
	{
		node.setGeneratedText(text);
		return text;
	}

	private static String text(AstNode node)
	{
		if (node == null || node.getGeneratedText() == null)
		{
			return "";
		}
		return node.getGeneratedText();
	}

	private static List<String> texts(List<? extends AstNode> nodes)
	{
		List<String> result = new ArrayList<>(nodes.size());
		for (AstNode node : nodes)
		{
			result.add(text(node));
		}
		return result;
	}

	private TextEmitter newEmitter()
	{
		return new TextEmitter(indentUnit);
	}

	/**
	 * {@code open + items + close} on one line when it fits, otherwise the brackets on
	 * their own lines around one comma-terminated item per line.
	 *
	 * @param pad Padding inside the brackets on the single-line form.
	 */
	private String bracketed(AstNode node, String open, String close, List<String> items, String pad)
	{
		if (items.isEmpty())
		{
			return open + close;
		}
		String single = open + pad + String.join(", ", items) + pad + close;
		int reserved = node == leadNode ? lead : 0;
		if (single.length() + reserved <= wrapWidth && !single.contains("\n"))
		{
			return single;
		}
		TextEmitter emitter = newEmitter();
		emitter.line(open);
		emitter.indent();
		for (String item : items)
		{
			emitter.line(item + ",");
		}
		emitter.dedent();
		emitter.line(close);
		return emitter.build();
	}

	/**
	 * Formats a bracketed value again, counting the head in front of it against the
	 * wrap width, when {@code head + value} does not fit on one line.
	 */
	private void fitAfter(String head, AstNode value)
	{
		String single = head + text(value);
		if (single.length() > wrapWidth && !single.contains("\n")
				&& (value instanceof ListVal || value instanceof SetVal || value instanceof DictVal || value instanceof FuncCall))
		{
			AstNode outerNode = leadNode;
			int outerLead = lead;
			leadNode = value;
			lead = head.length();
			try
			{
				value.accept(this);
			}
			finally
			{
				leadNode = outerNode;
				lead = outerLead;
			}
		}
	}

	private static String suffix(String before, AstNode node)
	{
		return node == null ? "" : before + text(node);
	}

	private static boolean endsWithSemicolon(AstNode node)
	{
		for (AstNode kid : node.getKids())
		{
			if (kid.getClass() == Token.class && ((Token) kid).is(";"))
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * The statement list a node owns, i.e. the list that is laid out one entry per line.
	 */
	private static SubNodeList<?> statementListOf(AstNode node)
	{
		if (node instanceof Architype arch)
		{
			return arch.getBody();
		}
		if (node instanceof EnumDecl enumDecl)
		{
			return enumDecl.getBody();
		}
		if (node instanceof OutOfLineDef def)
		{
			return def.getBody();
		}
		if (node instanceof Ability ability)
		{
			return ability.getBody();
		}
		if (node instanceof TestBlock test)
		{
			return test.getBody();
		}
		if (node instanceof ModuleCode code)
		{
			return code.getBody();
		}
		if (node instanceof IfStmt ifStmt)
		{
			return ifStmt.getBody();
		}
		if (node instanceof ElseStmt elseStmt)
		{
			return elseStmt.getBody();
		}
		if (node instanceof WhileStmt whileStmt)
		{
			return whileStmt.getBody();
		}
		if (node instanceof IterForStmt iterFor)
		{
			return iterFor.getBody();
		}
		if (node instanceof InForStmt inFor)
		{
			return inFor.getBody();
		}
		if (node instanceof TryStmt tryStmt)
		{
			return tryStmt.getBody();
		}
		if (node instanceof Except except)
		{
			return except.getBody();
		}
		if (node instanceof FinallyStmt finallyStmt)
		{
			return finallyStmt.getBody();
		}
		if (node instanceof WithStmt withStmt)
		{
			return withStmt.getBody();
		}
		if (node instanceof MatchStmt match)
		{
			return match.getCases();
		}
		if (node instanceof MatchCase matchCase)
		{
			return matchCase.getBody();
		}
		return null;
	}

	private static boolean isStatementList(SubNodeList<?> list)
	{
		return list.getParent() != null && statementListOf(list.getParent()) == list;
	}

	/**
	 * Comments that ended up inside a statement rather than between statements, rendered
	 * to follow it on its last line. Comments of nested blocks stay with those blocks.
	 */
	private static String trailingComments(AstNode statement)
	{
		StringBuilder sb = new StringBuilder();
		collectComments(statement, sb);
		return sb.toString();
	}

	private static void collectComments(AstNode node, StringBuilder sb)
	{
		for (AstNode kid : node.getKids())
		{
			if (kid instanceof CommentToken comment)
			{
				// a case header renders its own comments
				if (!(node instanceof MatchCase))
				{
					sb.append(' ').append(comment.getValue());
				}
			}
			else if (!(kid instanceof SubNodeList<?> list && isStatementList(list)))
			{
				collectComments(kid, sb);
			}
		}
	}

	/**
	 * Entries of a statement list: statements, members and comments, without brackets
	 * and separators.
	 */
	private static List<AstNode> entries(List<AstNode> kids)
	{
		List<AstNode> entries = new ArrayList<>();
		for (AstNode kid : kids)
		{
			if (kid.getClass() != Token.class)
			{
				entries.add(kid);
			}
		}
		return entries;
	}

	private boolean needsBlankLine(AstNode previous, AstNode next, boolean archBody)
	{
		if (previous instanceof StringLiteral && previous.getParent() instanceof JacModule)
		{
			// Module docstring
			return true;
		}
		SourceLocation before = previous.getLocation();
		SourceLocation after = next.getLocation();
		if (before.isKnown() && after.isKnown() && after.firstLine() - before.lastLine() > 1)
		{
			return true;
		}
		if (archBody && !(previous instanceof CommentToken) && !(next instanceof CommentToken))
		{
			if (previous instanceof ArchHas && !(next instanceof ArchHas))
			{
				return true;
			}
			return previous instanceof Ability && next instanceof Ability;
		}
		return false;
	}

	/**
	 * Writes statement-list entries one per line.
	 *
	 * @param previous  Entry already written before the first one, or null.
	 * @param separator Appended to every entry but the last non-comment one, or null.
	 */
	private void emitEntries(TextEmitter emitter, List<AstNode> entries, AstNode previous, boolean archBody, String separator)
	{
		int lastCode = -1;
		for (int i = 0; i < entries.size(); i++)
		{
			if (!(entries.get(i) instanceof CommentToken))
			{
				lastCode = i;
			}
		}

		for (int i = 0; i < entries.size(); i++)
		{
			AstNode entry = entries.get(i);
			if (entry instanceof CommentToken comment)
			{
				if (comment.isInline())
				{
					emitter.appendToLastLine(" " + comment.getValue());
				}
				else
				{
					if (previous != null && needsBlankLine(previous, entry, archBody))
					{
						emitter.blankLine();
					}
					emitter.line(comment.getValue());
				}
				previous = entry;
				continue;
			}

			if (previous != null && needsBlankLine(previous, entry, archBody))
			{
				emitter.blankLine();
			}
			String line = text(entry);
			if (separator != null && i < lastCode)
			{
				line += separator;
			}
			emitter.line(line + trailingComments(entry));
			previous = entry;
		}
	}

	private String block(SubNodeList<?> list, boolean archBody, String separator)
	{
		List<AstNode> entries = entries(list.getKids());
		if (entries.isEmpty())
		{
			return "{}";
		}
		TextEmitter emitter = newEmitter();
		emitter.line("{");
		emitter.indent();
		emitEntries(emitter, entries, null, archBody, separator);
		emitter.dedent();
		emitter.line("}");
		return emitter.build();
	}

	private static String bodyOrSemi(SubNodeList<?> body)
	{
		return body != null ? " " + text(body) : ";";
	}

	private static String accessOf(SubTag<?> access)
	{
		return access != null ? text(access) : "";
	}

	private static String inherited(SubNodeList<AstNode> bases)
	{
		if (bases == null || bases.getItems().isEmpty())
		{
			return "";
		}
		return " :" + String.join(", ", texts(bases.getItems())) + ":";
	}

	private static String signatureOf(AstNode signature)
	{
		if (signature == null)
		{
			return "";
		}
		boolean parenthesized = signature instanceof FuncSignature func && func.getParams() != null;
		return (parenthesized ? "" : " ") + text(signature);
	}

	/**
	 * Splits a multi-line triple-quoted string into triple-quoted segments, each but
	 * the last ending in a {@code \n} escape, one per line.
	 */
	private static Optional<String> splitIntoSegments(StringLiteral literal)
	{
		String prefix = literal.getPrefix();
		if (!literal.isTripleQuoted() || !literal.isMultiLine() || prefix.toLowerCase().contains("r"))
		{
			return Optional.empty();
		}
		String value = literal.getValue();
		String quote = value.substring(prefix.length(), prefix.length() + 3);
		String body = value.substring(prefix.length() + 3, value.length() - 3);
		String[] lines = body.split("\n", -1);

		List<String> segments = new ArrayList<>();
		for (int i = 0; i < lines.length; i++)
		{
			String line = lines[i];
			boolean last = i == lines.length - 1;
			if (line.endsWith("\\") || line.endsWith("\r") || (last && line.endsWith(quote.substring(0, 1))))
			{
				return Optional.empty();
			}
			if (last && line.isEmpty())
			{
				continue;
			}
			segments.add(prefix + quote + line + (last ? "" : "\\n") + quote);
		}
		return Optional.of(String.join("\n", segments));
	}

	private String breakArithmetic(AstNode value)
	{
		List<String> tail = new ArrayList<>();
		AstNode current = value;
		while (current instanceof BinaryExpr binary && ARITHMETIC_OPS.contains(binary.getOp().getValue()))
		{
			tail.add(0, binary.getOp().getValue() + " " + text(binary.getRight()));
			current = binary.getLeft();
		}
		TextEmitter emitter = newEmitter();
		emitter.line(text(current));
		emitter.indent();
		for (String part : tail)
		{
			emitter.line(part);
		}
		return emitter.build();
	}

	// ---------------------------------------------------------------------------
	// Tokens and generic nodes
	// ---------------------------------------------------------------------------

	/**
	 * Tokens print their source text; any other node without a dedicated rule is the
	 * space-joined text of its kids.
	 */
	@Override
	public String visitChildren(AstNode node)
	{
		if (node instanceof Token token)
		{
			return emit(node, token.getValue());
		}
		formatKids(node);
		List<String> parts = new ArrayList<>();
		for (AstNode kid : node.getKids())
		{
			if (!(kid instanceof CommentToken))
			{
				parts.add(text(kid));
			}
		}
		return emit(node, String.join(" ", parts));
	}

	/**
	 * Continuation lines of a multi-line string are left-stripped; the enclosing
	 * emitters indent them to the string's depth.
	 */
	@Override
	public String visitStringLiteral(StringLiteral node)
	{
		if (!node.isMultiLine())
		{
			return emit(node, node.getValue());
		}
		String[] lines = node.getValue().split("\n", -1);
		StringBuilder sb = new StringBuilder(lines[0]);
		for (int i = 1; i < lines.length; i++)
		{
			sb.append('\n').append(lines[i].stripLeading());
		}
		return emit(node, sb.toString());
	}

	@Override
	public String visitSubNodeList(SubNodeList<?> node)
	{
		formatKids(node);
		if (!isStatementList(node))
		{
			String open = node.getOpen().map(Token::getValue).orElse("");
			String close = node.getClose().map(Token::getValue).orElse("");
			return emit(node, open + String.join(", ", texts(node.getItems())) + close);
		}

		AstNode owner = node.getParent();
		if (owner instanceof EnumDecl)
		{
			return emit(node, block(node, false, ","));
		}
		if (owner instanceof MatchCase)
		{
			// Case bodies have no braces.
			TextEmitter emitter = newEmitter();
			emitter.indent();
			emitEntries(emitter, entries(node.getKids()), null, false, null);
			return emit(node, emitter.build());
		}
		boolean archBody = owner instanceof Architype || owner instanceof ArchDef;
		return emit(node, block(node, archBody, null));
	}

	@Override
	public String visitSubTag(SubTag<?> node)
	{
		formatKids(node);
		return emit(node, ":" + text(node.getTag()));
	}

	// ---------------------------------------------------------------------------
	// Module level
	// ---------------------------------------------------------------------------

	@Override
	public String visitModule(JacModule node)
	{
		formatKids(node);
		TextEmitter emitter = newEmitter();
		StringLiteral docstring = node.getDocstring();
		List<AstNode> entries = new ArrayList<>();
		for (AstNode kid : node.getKids())
		{
			if (kid != docstring)
			{
				entries.add(kid);
			}
		}
		if (docstring != null)
		{
			emitter.line(docstring.getValue());
		}
		emitEntries(emitter, entries, docstring, false, null);
		return emit(node, emitter.isEmpty() ? "" : emitter.build() + "\n");
	}

	@Override
	public String visitGlobalVars(GlobalVars node)
	{
		formatKids(node);
		return emit(node, "glob" + accessOf(node.getAccess()) + " " + String.join(", ", texts(node.getAssignments())) + ";");
	}

	@Override
	public String visitImport(Import node)
	{
		formatKids(node);
		String lang = accessOf(node.getLang());
		if (node.isAbsorb())
		{
			return emit(node, "include" + lang + " " + text(node.getPaths().get(0)) + ";");
		}
		if (node.getItems() != null)
		{
			List<String> items = texts(node.getItems().getItems());
			return emit(node, "import" + lang + " from " + text(node.getFromLoc()) + " " + bracketed(node, "{", "}", items, " "));
		}
		return emit(node, "import" + lang + " " + String.join(", ", texts(node.getPaths())) + ";");
	}

	@Override
	public String visitModulePath(ModulePath node)
	{
		formatKids(node);
		return emit(node, ".".repeat(node.getLevel()) + String.join(".", texts(node.getPath())) + suffix(" as ", node.getAlias()));
	}

	@Override
	public String visitModuleItem(ModuleItem node)
	{
		formatKids(node);
		return emit(node, text(node.getName()) + suffix(" as ", node.getAlias()));
	}

	@Override
	public String visitModuleCode(ModuleCode node)
	{
		formatKids(node);
		return emit(node, "with entry" + accessOf(node.getEntryName()) + " " + text(node.getBody()));
	}

	@Override
	public String visitTestBlock(TestBlock node)
	{
		formatKids(node);
		return emit(node, "test" + suffix(" ", node.getName()) + " " + text(node.getBody()));
	}

	// ---------------------------------------------------------------------------
	// Architypes, abilities, enums
	// ---------------------------------------------------------------------------

	@Override
	public String visitArchitype(Architype node)
	{
		formatKids(node);
		String kind = node.getArchType().name().toLowerCase();
		return emit(node, kind + accessOf(node.getAccess()) + " " + text(node.getName())
				+ inherited(node.getBaseClasses()) + bodyOrSemi(node.getBody()));
	}

	@Override
	public String visitEnumDecl(EnumDecl node)
	{
		formatKids(node);
		return emit(node, "enum" + accessOf(node.getAccess()) + " " + text(node.getName())
				+ inherited(node.getBaseClasses()) + bodyOrSemi(node.getBody()));
	}

	@Override
	public String visitEnumMember(EnumMember node)
	{
		formatKids(node);
		return emit(node, text(node.getName()) + suffix(" = ", node.getValue()));
	}

	@Override
	public String visitArchHas(ArchHas node)
	{
		formatKids(node);
		String prefix = node.isStatic() ? "static has" : "has";
		return emit(node, prefix + accessOf(node.getAccess()) + " " + String.join(", ", texts(node.getVars().getItems())) + ";");
	}

	@Override
	public String visitHasVar(HasVar node)
	{
		formatKids(node);
		return emit(node, text(node.getName()) + ": " + text(node.getTypeTag().getTag()) + suffix(" = ", node.getValue()));
	}

	@Override
	public String visitAbility(Ability node)
	{
		formatKids(node);
		String prefix = node.isStatic() ? "static can" : "can";
		return emit(node, prefix + accessOf(node.getAccess()) + " " + text(node.getName())
				+ signatureOf(node.getSignature()) + bodyOrSemi(node.getBody()));
	}

	@Override
	public String visitFuncSignature(FuncSignature node)
	{
		formatKids(node);
		StringBuilder sb = new StringBuilder();
		if (node.getParams() != null)
		{
			sb.append('(').append(String.join(", ", texts(node.getParams().getItems()))).append(')');
		}
		if (node.getReturnType() != null)
		{
			sb.append(sb.length() > 0 ? " -> " : "-> ").append(text(node.getReturnType()));
		}
		return emit(node, sb.toString());
	}

	@Override
	public String visitEventSignature(EventSignature node)
	{
		formatKids(node);
		String archTag = node.getArchTag() != null ? text(node.getArchTag()) + " " : "";
		return emit(node, "with " + archTag + text(node.getEvent()) + suffix(" -> ", node.getReturnType()));
	}

	@Override
	public String visitParamVar(ParamVar node)
	{
		formatKids(node);
		String unpack = node.getUnpack() != null ? text(node.getUnpack()) : "";
		String typeTag = node.getTypeTag() != null ? ": " + text(node.getTypeTag().getTag()) : "";
		return emit(node, unpack + text(node.getName()) + typeTag + suffix(" = ", node.getValue()));
	}

	@Override
	public String visitArchRef(ArchRef node)
	{
		formatKids(node);
		return emit(node, ":" + text(node.getKind()) + ":" + text(node.getName()));
	}

	@Override
	public String visitArchRefChain(ArchRefChain node)
	{
		formatKids(node);
		StringBuilder sb = new StringBuilder();
		for (AstNode kid : node.getKids())
		{
			if (kid instanceof ArchRef)
			{
				sb.append(text(kid));
			}
		}
		return emit(node, sb.toString());
	}

	@Override
	public String visitArchDef(ArchDef node)
	{
		formatKids(node);
		return emit(node, text(node.getTarget()) + " " + text(node.getBody()));
	}

	@Override
	public String visitAbilityDef(AbilityDef node)
	{
		formatKids(node);
		return emit(node, text(node.getTarget()) + signatureOf(node.getSignature()) + " " + text(node.getBody()));
	}

	// ---------------------------------------------------------------------------
	// Statements
	// ---------------------------------------------------------------------------

	@Override
	public String visitIfStmt(IfStmt node)
	{
		formatKids(node);
		return emit(node, "if " + ifTail(node));
	}

	@Override
	public String visitElseIf(ElseIf node)
	{
		formatKids(node);
		return emit(node, "elif " + ifTail(node));
	}

	private static String ifTail(IfStmt node)
	{
		return text(node.getCondition()) + " " + text(node.getBody()) + suffix(" ", node.getElseBody());
	}

	@Override
	public String visitElseStmt(ElseStmt node)
	{
		formatKids(node);
		return emit(node, "else " + text(node.getBody()));
	}

	@Override
	public String visitWhileStmt(WhileStmt node)
	{
		formatKids(node);
		return emit(node, "while " + text(node.getCondition()) + " " + text(node.getBody()));
	}

	@Override
	public String visitIterForStmt(IterForStmt node)
	{
		formatKids(node);
		return emit(node, "for " + text(node.getIter()) + " to " + text(node.getCondition())
				+ " by " + text(node.getCount()) + " " + text(node.getBody()));
	}

	@Override
	public String visitInForStmt(InForStmt node)
	{
		formatKids(node);
		return emit(node, "for " + text(node.getTarget()) + " in " + text(node.getCollection()) + " " + text(node.getBody()));
	}

	@Override
	public String visitTryStmt(TryStmt node)
	{
		formatKids(node);
		StringBuilder sb = new StringBuilder("try ").append(text(node.getBody()));
		for (Except except : node.getExcepts())
		{
			sb.append(' ').append(text(except));
		}
		sb.append(suffix(" ", node.getElseBody()));
		sb.append(suffix(" ", node.getFinallyBody()));
		return emit(node, sb.toString());
	}

	@Override
	public String visitExcept(Except node)
	{
		formatKids(node);
		String clause = "except";
		if (node.getExType() != null)
		{
			clause += " " + text(node.getExType()) + suffix(" as ", node.getName());
		}
		return emit(node, clause + " " + text(node.getBody()));
	}

	@Override
	public String visitFinallyStmt(FinallyStmt node)
	{
		formatKids(node);
		return emit(node, "finally " + text(node.getBody()));
	}

	@Override
	public String visitWithStmt(WithStmt node)
	{
		formatKids(node);
		return emit(node, "with " + String.join(", ", texts(node.getItems().getItems())) + " " + text(node.getBody()));
	}

	@Override
	public String visitExprAsItem(ExprAsItem node)
	{
		formatKids(node);
		return emit(node, text(node.getExpr()) + suffix(" as ", node.getAlias()));
	}

	@Override
	public String visitMatchStmt(MatchStmt node)
	{
		formatKids(node);
		return emit(node, "match " + text(node.getTarget()) + " " + text(node.getCases()));
	}

	@Override
	public String visitMatchCase(MatchCase node)
	{
		formatKids(node);
		TextEmitter emitter = newEmitter();
		emitter.line("case " + text(node.getPattern()) + suffix(" if ", node.getGuard()) + ":");
		// Comments between the header and the first statement stay at the top of the case
		for (AstNode kid : node.getKids())
		{
			if (kid instanceof CommentToken comment)
			{
				if (comment.isInline())
				{
					emitter.appendToLastLine(" " + comment.getValue());
				}
				else
				{
					emitter.indent().line(comment.getValue()).dedent();
				}
			}
		}
		emitter.line(text(node.getBody()));
		return emit(node, emitter.build());
	}

	@Override
	public String visitReturnStmt(ReturnStmt node)
	{
		formatKids(node);
		return emit(node, "return" + suffix(" ", node.getExpr()) + ";");
	}

	@Override
	public String visitYieldStmt(YieldStmt node)
	{
		formatKids(node);
		return emit(node, "yield" + (node.isFrom() ? " from" : "") + suffix(" ", node.getExpr()) + ";");
	}

	@Override
	public String visitRaiseStmt(RaiseStmt node)
	{
		formatKids(node);
		return emit(node, "raise" + suffix(" ", node.getCause()) + suffix(" from ", node.getFrom()) + ";");
	}

	@Override
	public String visitAssertStmt(AssertStmt node)
	{
		formatKids(node);
		return emit(node, "assert " + text(node.getCondition()) + suffix(", ", node.getMessage()) + ";");
	}

	@Override
	public String visitCtrlStmt(CtrlStmt node)
	{
		formatKids(node);
		return emit(node, text(node.getCtrl()) + ";");
	}

	@Override
	public String visitDeleteStmt(DeleteStmt node)
	{
		formatKids(node);
		return emit(node, "del " + String.join(", ", texts(node.getTargets().getItems())) + ";");
	}

	@Override
	public String visitReportStmt(ReportStmt node)
	{
		formatKids(node);
		return emit(node, "report " + text(node.getExpr()) + ";");
	}

	@Override
	public String visitVisitStmt(VisitStmt node)
	{
		formatKids(node);
		String tail = node.getElseBody() != null ? " " + text(node.getElseBody()) : ";";
		return emit(node, "visit " + text(node.getTarget()) + tail);
	}

	@Override
	public String visitIgnoreStmt(IgnoreStmt node)
	{
		formatKids(node);
		return emit(node, "ignore " + text(node.getTarget()) + ";");
	}

	@Override
	public String visitDisengageStmt(DisengageStmt node)
	{
		formatKids(node);
		return emit(node, "disengage;");
	}

	@Override
	public String visitGlobalStmt(GlobalStmt node)
	{
		formatKids(node);
		String op = node.isNonlocal() ? ":nl: " : ":g: ";
		return emit(node, op + String.join(", ", texts(node.getNames().getItems())) + ";");
	}

	@Override
	public String visitAssignment(Assignment node)
	{
		formatKids(node);
		String prefix;
		if (node.isAugmented())
		{
			prefix = text(node.getTargets().get(0)) + " " + text(node.getAugOp()) + " ";
		}
		else if (node.getTypeTag() != null)
		{
			prefix = text(node.getTargets().get(0)) + ": " + text(node.getTypeTag().getTag());
			prefix += node.getValue() != null ? " = " : "";
		}
		else
		{
			prefix = (node.isLet() ? "let " : "") + String.join(" = ", texts(node.getTargets())) + " = ";
		}

		if (node.getValue() != null)
		{
			fitAfter(prefix, node.getValue());
		}
		String value = text(node.getValue());
		String single = prefix + value;
		if (single.length() > 2 * wrapWidth && !single.contains("\n")
				&& node.getValue() instanceof BinaryExpr binary && ARITHMETIC_OPS.contains(binary.getOp().getValue()))
		{
			value = breakArithmetic(binary);
		}
		return emit(node, prefix + value + (endsWithSemicolon(node) ? ";" : ""));
	}

	@Override
	public String visitExprStmt(ExprStmt node)
	{
		formatKids(node);
		AstNode expr = node.getExpr();
		String body = text(expr);
		if (expr instanceof StringLiteral literal)
		{
			body = splitIntoSegments(literal).orElse(body);
		}
		else if (expr instanceof MultiString multi)
		{
			body = String.join("\n", texts(multi.getStrings()));
		}
		return emit(node, body + ";");
	}

	// ---------------------------------------------------------------------------
	// Expressions
	// ---------------------------------------------------------------------------

	@Override
	public String visitBinaryExpr(BinaryExpr node)
	{
		formatKids(node);
		return emit(node, text(node.getLeft()) + " " + text(node.getOp()) + " " + text(node.getRight()));
	}

	@Override
	public String visitBoolExpr(BoolExpr node)
	{
		formatKids(node);
		String op = text(node.getOp());
		List<String> values = texts(node.getValues());
		String single = String.join(" " + op + " ", values);
		if (single.length() <= wrapWidth)
		{
			return emit(node, single);
		}
		TextEmitter emitter = newEmitter();
		emitter.line(values.get(0));
		emitter.indent();
		for (String value : values.subList(1, values.size()))
		{
			emitter.line(op + " " + value);
		}
		return emit(node, emitter.build());
	}

	@Override
	public String visitCompareExpr(CompareExpr node)
	{
		formatKids(node);
		StringBuilder sb = new StringBuilder(text(node.getLeft()));
		for (int i = 0; i < node.getOps().size(); i++)
		{
			sb.append(' ').append(node.getOps().get(i)).append(' ').append(text(node.getRights().get(i)));
		}
		return emit(node, sb.toString());
	}

	@Override
	public String visitUnaryExpr(UnaryExpr node)
	{
		formatKids(node);
		String op = text(node.getOp());
		return emit(node, (op.equals("not") ? "not " : op) + text(node.getOperand()));
	}

	@Override
	public String visitIfElseExpr(IfElseExpr node)
	{
		formatKids(node);
		return emit(node, text(node.getValue()) + " if " + text(node.getCondition()) + " else " + text(node.getElseValue()));
	}

	@Override
	public String visitLambdaExpr(LambdaExpr node)
	{
		formatKids(node);
		StringBuilder sb = new StringBuilder("with ");
		if (node.getParams() != null && !node.getParams().getItems().isEmpty())
		{
			sb.append(String.join(", ", texts(node.getParams().getItems()))).append(' ');
		}
		if (node.getReturnType() != null)
		{
			sb.append("-> ").append(text(node.getReturnType())).append(' ');
		}
		return emit(node, sb.append("can ").append(text(node.getBody())).toString());
	}

	@Override
	public String visitAtomTrailer(AtomTrailer node)
	{
		formatKids(node);
		String joiner = node.isAttr() ? "." : "";
		return emit(node, text(node.getTarget()) + joiner + text(node.getRight()));
	}

	@Override
	public String visitIndexSlice(IndexSlice node)
	{
		formatKids(node);
		return emit(node, "[" + String.join(", ", texts(node.getIndices())) + "]");
	}

	@Override
	public String visitSlice(Slice node)
	{
		formatKids(node);
		return emit(node, text(node.getStart()) + ":" + text(node.getStop()) + suffix(":", node.getStep()));
	}

	@Override
	public String visitFuncCall(FuncCall node)
	{
		formatKids(node);
		return emit(node, text(node.getTarget()) + bracketed(node, "(", ")", texts(node.getParams().getItems()), ""));
	}

	@Override
	public String visitKWPair(KWPair node)
	{
		formatKids(node);
		String head = text(node.getKey()) + "=";
		fitAfter(head, node.getValue());
		return emit(node, head + text(node.getValue()));
	}

	@Override
	public String visitAtomUnit(AtomUnit node)
	{
		formatKids(node);
		return emit(node, "(" + text(node.getValue()) + ")");
	}

	@Override
	public String visitListVal(ListVal node)
	{
		formatKids(node);
		return emit(node, bracketed(node, "[", "]", texts(node.getValues().getItems()), ""));
	}

	@Override
	public String visitSetVal(SetVal node)
	{
		formatKids(node);
		return emit(node, bracketed(node, "{", "}", texts(node.getValues().getItems()), ""));
	}

	@Override
	public String visitDictVal(DictVal node)
	{
		formatKids(node);
		return emit(node, bracketed(node, "{", "}", texts(node.getValues().getItems()), ""));
	}

	@Override
	public String visitKVPair(KVPair node)
	{
		formatKids(node);
		if (node.getKey() == null)
		{
			return emit(node, "**" + text(node.getValue()));
		}
		String head = text(node.getKey()) + ": ";
		fitAfter(head, node.getValue());
		return emit(node, head + text(node.getValue()));
	}

	@Override
	public String visitTupleVal(TupleVal node)
	{
		formatKids(node);
		List<String> items = texts(node.getValues().getItems());
		String joined = String.join(", ", items);
		if (!node.isParenthesized())
		{
			return emit(node, joined);
		}
		return emit(node, "(" + joined + (items.size() == 1 ? "," : "") + ")");
	}

	@Override
	public String visitMultiString(MultiString node)
	{
		formatKids(node);
		return emit(node, String.join(" ", texts(node.getStrings())));
	}

	@Override
	public String visitEdgeOpRef(EdgeOpRef node)
	{
		formatKids(node);
		return emit(node, "[" + text(node.getEdgeDir()) + "]");
	}

	@Override
	public String visitListCompr(ListCompr node)
	{
		return emit(node, "[" + comprehension(node) + "]");
	}

	@Override
	public String visitSetCompr(SetCompr node)
	{
		return emit(node, "{" + comprehension(node) + "}");
	}

	@Override
	public String visitDictCompr(DictCompr node)
	{
		return emit(node, "{" + comprehension(node) + "}");
	}

	@Override
	public String visitGenCompr(GenCompr node)
	{
		return emit(node, "(" + comprehension(node) + ")");
	}

	private String comprehension(Comprehension node)
	{
		formatKids(node);
		return text(node.getOut()) + " " + String.join(" ", texts(node.getCompr()));
	}

	@Override
	public String visitInnerCompr(InnerCompr node)
	{
		formatKids(node);
		StringBuilder sb = new StringBuilder("for ").append(text(node.getTarget()))
				.append(" in ").append(text(node.getCollection()));
		for (AstNode condition : node.getConditions())
		{
			sb.append(" if ").append(text(condition));
		}
		return emit(node, sb.toString());
	}

	// ---------------------------------------------------------------------------
	// Match patterns
	// ---------------------------------------------------------------------------

	@Override
	public String visitMatchValue(MatchValue node)
	{
		formatKids(node);
		return emit(node, text(node.getValue()));
	}

	@Override
	public String visitMatchSingleton(MatchSingleton node)
	{
		formatKids(node);
		return emit(node, text(node.getValue()));
	}

	@Override
	public String visitMatchWild(MatchWild node)
	{
		formatKids(node);
		return emit(node, "_");
	}

	@Override
	public String visitMatchAs(MatchAs node)
	{
		formatKids(node);
		if (node.getPattern() == null)
		{
			return emit(node, text(node.getName()));
		}
		return emit(node, text(node.getPattern()) + " as " + text(node.getName()));
	}

	@Override
	public String visitMatchOr(MatchOr node)
	{
		formatKids(node);
		return emit(node, String.join(" | ", texts(node.getPatterns())));
	}

	@Override
	public String visitMatchSequence(MatchSequence node)
	{
		formatKids(node);
		return emit(node, "[" + String.join(", ", texts(node.getValues())) + "]");
	}

	@Override
	public String visitMatchStar(MatchStar node)
	{
		formatKids(node);
		return emit(node, "*" + text(node.getName()));
	}

	@Override
	public String visitMatchArch(MatchArch node)
	{
		formatKids(node);
		return emit(node, text(node.getName()) + "(" + String.join(", ", texts(node.getArgs())) + ")");
	}

	@Override
	public String visitMatchKVPair(MatchKVPair node)
	{
		formatKids(node);
		return emit(node, text(node.getKey()) + "=" + text(node.getValue()));
	}
}
