package org.jaclang.ast;

import org.jaclang.ast.declarations.*;
import org.jaclang.ast.expressions.*;
import org.jaclang.ast.patterns.*;
import org.jaclang.ast.statements.*;

/**
 * Visits every kid in source order and returns {@link #defaultResult()}. Comment
 * tokens are visited like any other kid.
 */
public abstract class AstBaseVisitor<R> implements AstVisitor<R>
{
	public R visit(AstNode node)
	{
		return node.accept(this);
	}

	public R visitChildren(AstNode node)
	{
		R result = defaultResult();
		for (AstNode kid : node.getKids())
		{
			result = aggregateResult(result, kid.accept(this));
		}
		return result;
	}

	protected R defaultResult()
	{
		return null;
	}

	protected R aggregateResult(R aggregate, R nextResult)
	{
		return nextResult;
	}

	@Override
	public R visitBuiltinType(BuiltinType node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitCommentToken(CommentToken node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitLiteral(Literal node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitName(Name node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitSpecialVarRef(SpecialVarRef node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitStringLiteral(StringLiteral node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitSubNodeList(SubNodeList<?> node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitSubTag(SubTag<?> node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitToken(Token node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitAbility(Ability node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitAbilityDef(AbilityDef node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitArchDef(ArchDef node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitArchHas(ArchHas node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitArchRef(ArchRef node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitArchRefChain(ArchRefChain node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitArchitype(Architype node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitEnumDecl(EnumDecl node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitEnumMember(EnumMember node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitEventSignature(EventSignature node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitFuncSignature(FuncSignature node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitGlobalVars(GlobalVars node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitHasVar(HasVar node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitImport(Import node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitModule(JacModule node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitModuleCode(ModuleCode node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitModuleItem(ModuleItem node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitModulePath(ModulePath node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitParamVar(ParamVar node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitTestBlock(TestBlock node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitAtomTrailer(AtomTrailer node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitAtomUnit(AtomUnit node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitBinaryExpr(BinaryExpr node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitBoolExpr(BoolExpr node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitCompareExpr(CompareExpr node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitDictCompr(DictCompr node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitDictVal(DictVal node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitEdgeOpRef(EdgeOpRef node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitFuncCall(FuncCall node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitGenCompr(GenCompr node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitIfElseExpr(IfElseExpr node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitIndexSlice(IndexSlice node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitInnerCompr(InnerCompr node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitKVPair(KVPair node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitKWPair(KWPair node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitLambdaExpr(LambdaExpr node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitListCompr(ListCompr node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitListVal(ListVal node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitMultiString(MultiString node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitSetCompr(SetCompr node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitSetVal(SetVal node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitSlice(Slice node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitTupleVal(TupleVal node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitUnaryExpr(UnaryExpr node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitMatchArch(MatchArch node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitMatchAs(MatchAs node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitMatchKVPair(MatchKVPair node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitMatchOr(MatchOr node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitMatchSequence(MatchSequence node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitMatchSingleton(MatchSingleton node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitMatchStar(MatchStar node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitMatchValue(MatchValue node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitMatchWild(MatchWild node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitAssertStmt(AssertStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitAssignment(Assignment node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitCtrlStmt(CtrlStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitDeleteStmt(DeleteStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitDisengageStmt(DisengageStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitElseIf(ElseIf node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitElseStmt(ElseStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitExcept(Except node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitExprAsItem(ExprAsItem node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitExprStmt(ExprStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitFinallyStmt(FinallyStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitGlobalStmt(GlobalStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitIfStmt(IfStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitIgnoreStmt(IgnoreStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitInForStmt(InForStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitIterForStmt(IterForStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitMatchCase(MatchCase node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitMatchStmt(MatchStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitRaiseStmt(RaiseStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitReportStmt(ReportStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitReturnStmt(ReturnStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitTryStmt(TryStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitVisitStmt(VisitStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitWhileStmt(WhileStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitWithStmt(WithStmt node)
	{
		return visitChildren(node);
	}

	@Override
	public R visitYieldStmt(YieldStmt node)
	{
		return visitChildren(node);
	}
}
