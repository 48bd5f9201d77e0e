package org.jaclang.parser;

import org.antlr.v4.runtime.CommonTokenStream;
import org.jaclang.ast.AstNode;
import org.jaclang.ast.CommentToken;
import org.jaclang.ast.SourceLocation;
import org.jaclang.ast.Token;
import org.jaclang.ast.declarations.JacModule;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves the comments the lexer put on the hidden channel into the tree. Each comment
 * becomes a kid of the innermost node whose span contains it, placed between the
 * kids it sits between in the source.
 */
public class CommentAttacher
{
	private final CommonTokenStream tokens;

	public CommentAttacher(CommonTokenStream tokens)
	{
		this.tokens = tokens;
	}

	public List<CommentToken> collectComments()
	{
		List<CommentToken> comments = new ArrayList<>();
		int lastCodeLine = 0;
		tokens.fill();
		for (org.antlr.v4.runtime.Token token : tokens.getTokens())
		{
			if (token.getType() == org.antlr.v4.runtime.Token.EOF)
			{
				break;
			}
			SourceLocation location = AstBuilder.locationOf(token);
			if (token.getChannel() == org.antlr.v4.runtime.Token.HIDDEN_CHANNEL)
			{
				String kind = JacParser.VOCABULARY.getSymbolicName(token.getType());
				comments.add(new CommentToken(kind, token.getText(), location, lastCodeLine == location.firstLine()));
			}
			else
			{
				lastCodeLine = location.lastLine();
			}
		}
		return comments;
	}

	public void attach(JacModule module)
	{
		for (CommentToken comment : collectComments())
		{
			insert(module, comment);
		}
	}

	private static void insert(AstNode root, CommentToken comment)
	{
		SourceLocation at = comment.getLocation();
		AstNode node = root;
		boolean descended = true;
		while (descended)
		{
			descended = false;
			for (AstNode kid : node.getKids())
			{
				if (kid instanceof Token)
				{
					continue;
				}
				SourceLocation span = kid.getLocation();
				if (span.isKnown() && isBefore(span.firstLine(), span.firstColumn(), at)
						&& isBefore(at, span.lastLine(), span.lastColumn()))
				{
					node = kid;
					descended = true;
					break;
				}
			}
		}
		List<AstNode> kids = node.getKids();
		int index = kids.size();
		for (int i = 0; i < kids.size(); i++)
		{
			SourceLocation span = kids.get(i).getLocation();
			if (span.isKnown() && isBefore(at, span.firstLine(), span.firstColumn()))
			{
				index = i;
				break;
			}
		}
		node.insertKid(index, comment);
	}

	private static boolean isBefore(int line, int column, SourceLocation other)
	{
		return line < other.firstLine() || (line == other.firstLine() && column < other.firstColumn());
	}

	private static boolean isBefore(SourceLocation location, int line, int column)
	{
		return location.firstLine() < line || (location.firstLine() == line && location.firstColumn() < column);
	}
}
