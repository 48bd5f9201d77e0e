package org.jaclang.ast;

/**
 * Statements and expressions whose meaning depends on walker traversal. They are
 * flagged when they sit inside a walker or one of its out-of-line abilities.
 */
public interface WalkerNode
{
	boolean isFromWalker();

	void setFromWalker(boolean fromWalker);
}
