package org.jaclang.ast;

import org.jaclang.ast.declarations.*;
import org.jaclang.ast.expressions.*;
import org.jaclang.ast.patterns.*;
import org.jaclang.ast.statements.*;

/**
 * One handler per node variant. Passes extend {@link AstBaseVisitor} and override
 * the variants they care about.
 */
public interface AstVisitor<R>
{
	// Tokens and lists
	R visitBuiltinType(BuiltinType node);
	R visitCommentToken(CommentToken node);
	R visitLiteral(Literal node);
	R visitName(Name node);
	R visitSpecialVarRef(SpecialVarRef node);
	R visitStringLiteral(StringLiteral node);
	R visitSubNodeList(SubNodeList<?> node);
	R visitSubTag(SubTag<?> node);
	R visitToken(Token node);

	// Declarations
	R visitAbility(Ability node);
	R visitAbilityDef(AbilityDef node);
	R visitArchDef(ArchDef node);
	R visitArchHas(ArchHas node);
	R visitArchRef(ArchRef node);
	R visitArchRefChain(ArchRefChain node);
	R visitArchitype(Architype node);
	R visitEnumDecl(EnumDecl node);
	R visitEnumMember(EnumMember node);
	R visitEventSignature(EventSignature node);
	R visitFuncSignature(FuncSignature node);
	R visitGlobalVars(GlobalVars node);
	R visitHasVar(HasVar node);
	R visitImport(Import node);
	R visitModule(JacModule node);
	R visitModuleCode(ModuleCode node);
	R visitModuleItem(ModuleItem node);
	R visitModulePath(ModulePath node);
	R visitParamVar(ParamVar node);
	R visitTestBlock(TestBlock node);

	// Expressions
	R visitAtomTrailer(AtomTrailer node);
	R visitAtomUnit(AtomUnit node);
	R visitBinaryExpr(BinaryExpr node);
	R visitBoolExpr(BoolExpr node);
	R visitCompareExpr(CompareExpr node);
	R visitDictCompr(DictCompr node);
	R visitDictVal(DictVal node);
	R visitEdgeOpRef(EdgeOpRef node);
	R visitFuncCall(FuncCall node);
	R visitGenCompr(GenCompr node);
	R visitIfElseExpr(IfElseExpr node);
	R visitIndexSlice(IndexSlice node);
	R visitInnerCompr(InnerCompr node);
	R visitKVPair(KVPair node);
	R visitKWPair(KWPair node);
	R visitLambdaExpr(LambdaExpr node);
	R visitListCompr(ListCompr node);
	R visitListVal(ListVal node);
	R visitMultiString(MultiString node);
	R visitSetCompr(SetCompr node);
	R visitSetVal(SetVal node);
	R visitSlice(Slice node);
	R visitTupleVal(TupleVal node);
	R visitUnaryExpr(UnaryExpr node);

	// Match patterns
	R visitMatchArch(MatchArch node);
	R visitMatchAs(MatchAs node);
	R visitMatchKVPair(MatchKVPair node);
	R visitMatchOr(MatchOr node);
	R visitMatchSequence(MatchSequence node);
	R visitMatchSingleton(MatchSingleton node);
	R visitMatchStar(MatchStar node);
	R visitMatchValue(MatchValue node);
	R visitMatchWild(MatchWild node);

	// Statements
	R visitAssertStmt(AssertStmt node);
	R visitAssignment(Assignment node);
	R visitCtrlStmt(CtrlStmt node);
	R visitDeleteStmt(DeleteStmt node);
	R visitDisengageStmt(DisengageStmt node);
	R visitElseIf(ElseIf node);
	R visitElseStmt(ElseStmt node);
	R visitExcept(Except node);
	R visitExprAsItem(ExprAsItem node);
	R visitExprStmt(ExprStmt node);
	R visitFinallyStmt(FinallyStmt node);
	R visitGlobalStmt(GlobalStmt node);
	R visitIfStmt(IfStmt node);
	R visitIgnoreStmt(IgnoreStmt node);
	R visitInForStmt(InForStmt node);
	R visitIterForStmt(IterForStmt node);
	R visitMatchCase(MatchCase node);
	R visitMatchStmt(MatchStmt node);
	R visitRaiseStmt(RaiseStmt node);
	R visitReportStmt(ReportStmt node);
	R visitReturnStmt(ReturnStmt node);
	R visitTryStmt(TryStmt node);
	R visitVisitStmt(VisitStmt node);
	R visitWhileStmt(WhileStmt node);
	R visitWithStmt(WithStmt node);
	R visitYieldStmt(YieldStmt node);
}
