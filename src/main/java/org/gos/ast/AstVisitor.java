package org.gos.ast;

/**
 * One method per {@link AstNode} variant, so adding a variant breaks every walker at compile time.
 */
public interface AstVisitor<R>
{
	R visitModule(AstNode.Module node);

	R visitComment(AstNode.Comment node);

	R visitSymbol(AstNode.Symbol node);

	R visitStringLiteral(AstNode.StringLiteral node);

	R visitMultiLineStringLiteral(AstNode.MultiLineStringLiteral node);

	R visitNumberLiteral(AstNode.NumberLiteral node);

	R visitFloatLiteral(AstNode.FloatLiteral node);

	R visitBoolLiteral(AstNode.BoolLiteral node);

	R visitDateTimeLiteral(AstNode.DateTimeLiteral node);

	R visitDateLiteral(AstNode.DateLiteral node);

	R visitNullLiteral(AstNode.NullLiteral node);

	R visitDictStatement(AstNode.DictStatement node);

	R visitDictItem(AstNode.DictItem node);

	R visitListStatement(AstNode.ListStatement node);

	R visitTupleStatement(AstNode.TupleStatement node);

	R visitSetStatement(AstNode.SetStatement node);

	R visitImport(AstNode.Import node);

	R visitImportItem(AstNode.ImportItem node);

	R visitAttrDef(AstNode.AttrDef node);

	R visitRefDef(AstNode.RefDef node);

	R visitVarDef(AstNode.VarDef node);

	R visitGraphDef(AstNode.GraphDef node);

	R visitNodeDef(AstNode.NodeDef node);

	R visitNodeBlock(AstNode.NodeBlock node);

	R visitRefGraphBlock(AstNode.RefGraphBlock node);

	R visitNodeInputTuple(AstNode.NodeInputTuple node);

	R visitNodeInputKeyDef(AstNode.NodeInputKeyDef node);

	R visitNodeInputKeyItem(AstNode.NodeInputKeyItem node);

	R visitNodeAttr(AstNode.NodeAttr node);

	R visitConditionDef(AstNode.ConditionDef node);

	R visitConditionBlock(AstNode.ConditionBlock node);

	R visitConditionStatement(AstNode.ConditionStatement node);

	R visitForLoopBlock(AstNode.ForLoopBlock node);

	R visitOpDef(AstNode.OpDef node);

	R visitOpMeta(AstNode.OpMeta node);

	R visitOpInput(AstNode.OpInput node);

	R visitOpOutput(AstNode.OpOutput node);

	R visitOpConfig(AstNode.OpConfig node);

	R visitOpSpec(AstNode.OpSpec node);

	R visitOpSpecItem(AstNode.OpSpecItem node);

	R visitClosedInterval(AstNode.ClosedInterval node);

	R visitMixInterval(AstNode.MixInterval node);
}
