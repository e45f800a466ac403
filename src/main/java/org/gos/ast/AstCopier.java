package org.gos.ast;

import org.gos.ast.AstNode.*;
import org.gos.ast.AstNode.Module;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural deep copy of a syntax tree. Spans and symbol kinds are copied too, so the copy
 * can be re-tagged or re-positioned without touching the original.
 */
public final class AstCopier implements AstVisitor<AstNode>
{
	private static final AstCopier INSTANCE = new AstCopier();

	private AstCopier()
	{
	}

	@SuppressWarnings("unchecked")
	public static <T extends AstNode> T copy(T node)
	{
		return node == null ? null : (T) node.accept(INSTANCE);
	}

	private static <T extends AstNode> List<T> copyAll(List<T> nodes)
	{
		List<T> copies = new ArrayList<>(nodes.size());
		for (T node : nodes)
		{
			copies.add(copy(node));
		}
		return copies;
	}

	@Override
	public AstNode visitModule(Module node)
	{
		return new Module(node.position().copy(), copyAll(node.children()));
	}

	@Override
	public AstNode visitComment(Comment node)
	{
		return new Comment(node.position().copy(), node.value());
	}

	@Override
	public AstNode visitSymbol(Symbol node)
	{
		return new Symbol(node.position().copy(), node.name(), node.kind());
	}

	@Override
	public AstNode visitStringLiteral(StringLiteral node)
	{
		return new StringLiteral(node.position().copy(), node.value(), node.raw());
	}

	@Override
	public AstNode visitMultiLineStringLiteral(MultiLineStringLiteral node)
	{
		return new MultiLineStringLiteral(node.position().copy(), node.value(), node.raw());
	}

	@Override
	public AstNode visitNumberLiteral(NumberLiteral node)
	{
		return new NumberLiteral(node.position().copy(), node.raw(), node.value());
	}

	@Override
	public AstNode visitFloatLiteral(FloatLiteral node)
	{
		return new FloatLiteral(node.position().copy(), node.raw(), node.value());
	}

	@Override
	public AstNode visitBoolLiteral(BoolLiteral node)
	{
		return new BoolLiteral(node.position().copy(), node.raw(), node.value());
	}

	@Override
	public AstNode visitDateTimeLiteral(DateTimeLiteral node)
	{
		return new DateTimeLiteral(node.position().copy(), node.raw(), node.value());
	}

	@Override
	public AstNode visitDateLiteral(DateLiteral node)
	{
		return new DateLiteral(node.position().copy(), node.value());
	}

	@Override
	public AstNode visitNullLiteral(NullLiteral node)
	{
		return new NullLiteral(node.position().copy());
	}

	@Override
	public AstNode visitDictStatement(DictStatement node)
	{
		return new DictStatement(node.position().copy(), copyAll(node.items()));
	}

	@Override
	public AstNode visitDictItem(DictItem node)
	{
		return new DictItem(node.position().copy(), copy(node.key()), copy(node.value()));
	}

	@Override
	public AstNode visitListStatement(ListStatement node)
	{
		return new ListStatement(node.position().copy(), copyAll(node.items()));
	}

	@Override
	public AstNode visitTupleStatement(TupleStatement node)
	{
		return new TupleStatement(node.position().copy(), copyAll(node.items()));
	}

	@Override
	public AstNode visitSetStatement(SetStatement node)
	{
		return new SetStatement(node.position().copy(), copyAll(node.items()));
	}

	@Override
	public AstNode visitImport(Import node)
	{
		return new Import(node.position().copy(), copyAll(node.items()));
	}

	@Override
	public AstNode visitImportItem(ImportItem node)
	{
		return new ImportItem(node.position().copy(), copy(node.path()), copy(node.alias()));
	}

	@Override
	public AstNode visitAttrDef(AttrDef node)
	{
		return new AttrDef(node.position().copy(), copy(node.name()), copy(node.value()),
				copy(node.condition()), copy(node.elseValue()));
	}

	@Override
	public AstNode visitRefDef(RefDef node)
	{
		return new RefDef(node.position().copy(), copy(node.name()), copy(node.value()),
				copy(node.condition()), copy(node.defaultValue()));
	}

	@Override
	public AstNode visitVarDef(VarDef node)
	{
		return new VarDef(node.position().copy(), copyAll(node.children()), copy(node.alias()));
	}

	@Override
	public AstNode visitGraphDef(GraphDef node)
	{
		return new GraphDef(node.position().copy(), copyAll(node.children()), copy(node.alias()),
				copy(node.version()), copy(node.templateGraph()), copy(node.templateVersion()));
	}

	@Override
	public AstNode visitNodeDef(NodeDef node)
	{
		return new NodeDef(node.position().copy(), copyAll(node.outputs()), copy(node.value()));
	}

	@Override
	public AstNode visitNodeBlock(NodeBlock node)
	{
		return new NodeBlock(node.position().copy(), copy(node.name()), copy(node.inputs()), copyAll(node.attrs()));
	}

	@Override
	public AstNode visitRefGraphBlock(RefGraphBlock node)
	{
		return new RefGraphBlock(node.position().copy(), copy(node.refName()), copy(node.inputs()), copyAll(node.attrs()));
	}

	@Override
	public AstNode visitNodeInputTuple(NodeInputTuple node)
	{
		return new NodeInputTuple(node.position().copy(), copyAll(node.items()));
	}

	@Override
	public AstNode visitNodeInputKeyDef(NodeInputKeyDef node)
	{
		return new NodeInputKeyDef(node.position().copy(), copyAll(node.items()));
	}

	@Override
	public AstNode visitNodeInputKeyItem(NodeInputKeyItem node)
	{
		return new NodeInputKeyItem(node.position().copy(), copy(node.key()), copy(node.value()));
	}

	@Override
	public AstNode visitNodeAttr(NodeAttr node)
	{
		return new NodeAttr(node.position().copy(), copy(node.name()), copyAll(node.args()));
	}

	@Override
	public AstNode visitConditionDef(ConditionDef node)
	{
		return new ConditionDef(node.position().copy(), copyAll(node.outputs()), copy(node.value()));
	}

	@Override
	public AstNode visitConditionBlock(ConditionBlock node)
	{
		return new ConditionBlock(node.position().copy(), copy(node.condition()),
				copy(node.trueBranch()), copy(node.falseBranch()));
	}

	@Override
	public AstNode visitConditionStatement(ConditionStatement node)
	{
		return new ConditionStatement(node.position().copy(), copy(node.left()), copy(node.right()), node.operator());
	}

	@Override
	public AstNode visitForLoopBlock(ForLoopBlock node)
	{
		return new ForLoopBlock(node.position().copy(), copy(node.inputs()), copyAll(node.outputs()),
				copy(node.node()), copy(node.condition()));
	}

	@Override
	public AstNode visitOpDef(OpDef node)
	{
		return new OpDef(node.position().copy(), copyAll(node.children()), copy(node.alias()), node.version());
	}

	@Override
	public AstNode visitOpMeta(OpMeta node)
	{
		return new OpMeta(node.position().copy(), copyAll(node.children()));
	}

	@Override
	public AstNode visitOpInput(OpInput node)
	{
		return new OpInput(node.position().copy(), copyAll(node.children()));
	}

	@Override
	public AstNode visitOpOutput(OpOutput node)
	{
		return new OpOutput(node.position().copy(), copyAll(node.children()));
	}

	@Override
	public AstNode visitOpConfig(OpConfig node)
	{
		return new OpConfig(node.position().copy(), copyAll(node.children()));
	}

	@Override
	public AstNode visitOpSpec(OpSpec node)
	{
		return new OpSpec(node.position().copy(), copy(node.name()), copyAll(node.items()));
	}

	@Override
	public AstNode visitOpSpecItem(OpSpecItem node)
	{
		return new OpSpecItem(node.position().copy(), node.name(), copy(node.value()));
	}

	@Override
	public AstNode visitClosedInterval(ClosedInterval node)
	{
		return new ClosedInterval(node.position().copy(), copy(node.ge()), copy(node.le()));
	}

	@Override
	public AstNode visitMixInterval(MixInterval node)
	{
		return new MixInterval(node.position().copy(), copy(node.ge()), copy(node.gt()), copy(node.le()), copy(node.lt()));
	}
}
