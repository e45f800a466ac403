package org.gos.ast;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Closed set of GOS syntax tree nodes.
 * <p>
 * Every node owns exactly one {@link Position} and its children; nothing is shared between
 * parents. Apart from the span and {@link Symbol#setKind(SymbolKind)} the tree is immutable.
 * Optional children are {@code null}, child lists are never {@code null}.
 */
public sealed interface AstNode
{
	Position position();

	<R> R accept(AstVisitor<R> visitor);

	// --- Root and trivia ---

	record Module(Position position, List<AstNode> children) implements AstNode
	{
		public Module
		{
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitModule(this);
		}
	}

	/**
	 * A comment with its markers ({@code #}, {@code //} or {@code /* *}{@code /}) kept in {@code value}.
	 */
	record Comment(Position position, String value) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitComment(this);
		}
	}

	/**
	 * An identifier. The kind is filled in by whoever builds the tree and is the only
	 * field besides the span that may change afterwards.
	 */
	final class Symbol implements AstNode
	{
		private final Position position;
		private final String name;
		private SymbolKind kind;

		public Symbol(Position position, String name, SymbolKind kind)
		{
			this.position = Objects.requireNonNull(position);
			this.name = Objects.requireNonNull(name);
			this.kind = kind == null ? SymbolKind.UNKNOWN : kind;
		}

		public Symbol(Position position, String name)
		{
			this(position, name, SymbolKind.UNKNOWN);
		}

		@Override
		public Position position()
		{
			return position;
		}

		public String name()
		{
			return name;
		}

		public SymbolKind kind()
		{
			return kind;
		}

		public void setKind(SymbolKind kind)
		{
			this.kind = Objects.requireNonNull(kind);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitSymbol(this);
		}

		@Override
		public boolean equals(Object o)
		{
			if (this == o)
			{
				return true;
			}
			if (!(o instanceof Symbol other))
			{
				return false;
			}
			return name.equals(other.name) && kind == other.kind && position.equals(other.position);
		}

		@Override
		public int hashCode()
		{
			return Objects.hash(name, kind, position);
		}

		@Override
		public String toString()
		{
			return "Symbol[" + name + ", " + kind + "]";
		}
	}

	// --- Literals ---

	/**
	 * @param value unescaped text
	 * @param raw   the literal as written, quotes included; {@code null} for built nodes
	 */
	record StringLiteral(Position position, String value, String raw) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitStringLiteral(this);
		}
	}

	record MultiLineStringLiteral(Position position, String value, String raw) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitMultiLineStringLiteral(this);
		}
	}

	record NumberLiteral(Position position, String raw, long value) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitNumberLiteral(this);
		}
	}

	record FloatLiteral(Position position, String raw, double value) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitFloatLiteral(this);
		}
	}

	record BoolLiteral(Position position, String raw, boolean value) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitBoolLiteral(this);
		}
	}

	/**
	 * Deprecated {@code datetime("...")} literal, superseded by {@link DateLiteral}.
	 */
	record DateTimeLiteral(Position position, String raw, LocalDateTime value) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitDateTimeLiteral(this);
		}
	}

	/**
	 * {@code date("...")}; the value is the quoted text, unparsed.
	 */
	record DateLiteral(Position position, String value) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitDateLiteral(this);
		}
	}

	record NullLiteral(Position position) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitNullLiteral(this);
		}
	}

	// --- Collections ---

	record DictStatement(Position position, List<DictItem> items) implements AstNode
	{
		public DictStatement
		{
			items = List.copyOf(items);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitDictStatement(this);
		}
	}

	record DictItem(Position position, AstNode key, AstNode value) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitDictItem(this);
		}
	}

	record ListStatement(Position position, List<AstNode> items) implements AstNode
	{
		public ListStatement
		{
			items = List.copyOf(items);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitListStatement(this);
		}
	}

	record TupleStatement(Position position, List<AstNode> items) implements AstNode
	{
		public TupleStatement
		{
			items = List.copyOf(items);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitTupleStatement(this);
		}
	}

	record SetStatement(Position position, List<AstNode> items) implements AstNode
	{
		public SetStatement
		{
			items = List.copyOf(items);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitSetStatement(this);
		}
	}

	// --- Top level definitions ---

	record Import(Position position, List<ImportItem> items) implements AstNode
	{
		public Import
		{
			items = List.copyOf(items);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitImport(this);
		}
	}

	record ImportItem(Position position, Symbol path, Symbol alias) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitImportItem(this);
		}
	}

	/**
	 * {@code name = value [if condition [else elseValue]];}. Inside a graph the value may also be
	 * a node call, which makes the attribute an implicit single-output node.
	 */
	record AttrDef(Position position, Symbol name, AstNode value, AstNode condition, AstNode elseValue) implements AstNode
	{
		public AttrDef(Position position, Symbol name, AstNode value)
		{
			this(position, name, value, null, null);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitAttrDef(this);
		}
	}

	/**
	 * {@code name = other.attr [if condition] [or default];}
	 */
	record RefDef(Position position, Symbol name, Symbol value, AstNode condition, AstNode defaultValue) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitRefDef(this);
		}
	}

	record VarDef(Position position, List<AstNode> children, Symbol alias) implements AstNode
	{
		public VarDef
		{
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitVarDef(this);
		}
	}

	record GraphDef(Position position, List<AstNode> children, Symbol alias, AstNode version,
					Symbol templateGraph, AstNode templateVersion) implements AstNode
	{
		public GraphDef
		{
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitGraphDef(this);
		}
	}

	// --- Nodes ---

	/**
	 * @param value a {@link NodeBlock}, {@link RefGraphBlock} or {@link ForLoopBlock}
	 */
	record NodeDef(Position position, List<Symbol> outputs, AstNode value) implements AstNode
	{
		public NodeDef
		{
			outputs = List.copyOf(outputs);
			if (!(value instanceof NodeBlock || value instanceof RefGraphBlock || value instanceof ForLoopBlock))
			{
				throw new IllegalArgumentException("Node definition needs a call or a loop, got " + value);
			}
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitNodeDef(this);
		}
	}

	/**
	 * @param inputs a {@link NodeInputTuple}, a {@link NodeInputKeyDef} or {@code null}
	 */
	record NodeBlock(Position position, Symbol name, AstNode inputs, List<NodeAttr> attrs) implements AstNode
	{
		public NodeBlock
		{
			attrs = attrs == null ? List.of() : List.copyOf(attrs);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitNodeBlock(this);
		}
	}

	record RefGraphBlock(Position position, Symbol refName, AstNode inputs, List<NodeAttr> attrs) implements AstNode
	{
		public RefGraphBlock
		{
			attrs = attrs == null ? List.of() : List.copyOf(attrs);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitRefGraphBlock(this);
		}
	}

	record NodeInputTuple(Position position, List<AstNode> items) implements AstNode
	{
		public NodeInputTuple
		{
			items = List.copyOf(items);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitNodeInputTuple(this);
		}
	}

	record NodeInputKeyDef(Position position, List<NodeInputKeyItem> items) implements AstNode
	{
		public NodeInputKeyDef
		{
			items = List.copyOf(items);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitNodeInputKeyDef(this);
		}
	}

	record NodeInputKeyItem(Position position, Symbol key, AstNode value) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitNodeInputKeyItem(this);
		}
	}

	/**
	 * One {@code .name(args)} link of an attribute chain. Arguments are plain values or
	 * {@link NodeInputKeyItem} pairs.
	 */
	record NodeAttr(Position position, Symbol name, List<AstNode> args) implements AstNode
	{
		public NodeAttr
		{
			args = List.copyOf(args);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitNodeAttr(this);
		}
	}

	record ConditionDef(Position position, List<Symbol> outputs, ConditionBlock value) implements AstNode
	{
		public ConditionDef
		{
			outputs = List.copyOf(outputs);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitConditionDef(this);
		}
	}

	/**
	 * {@code condition ? trueBranch : falseBranch}. The condition is a {@link ConditionStatement},
	 * a {@link NodeBlock} or a plain value; branches are node calls or nested condition blocks.
	 */
	record ConditionBlock(Position position, AstNode condition, AstNode trueBranch, AstNode falseBranch) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitConditionBlock(this);
		}
	}

	record ConditionStatement(Position position, AstNode left, AstNode right, String operator) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitConditionStatement(this);
		}
	}

	/**
	 * {@code [node for outputs in inputs [if condition]]}
	 */
	record ForLoopBlock(Position position, Symbol inputs, List<Symbol> outputs, NodeBlock node, AstNode condition) implements AstNode
	{
		public ForLoopBlock
		{
			outputs = List.copyOf(outputs);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitForLoopBlock(this);
		}
	}

	// --- Operations ---

	record OpDef(Position position, List<AstNode> children, Symbol alias, String version) implements AstNode
	{
		public OpDef
		{
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitOpDef(this);
		}
	}

	record OpMeta(Position position, List<AstNode> children) implements AstNode
	{
		public OpMeta
		{
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitOpMeta(this);
		}
	}

	record OpInput(Position position, List<AstNode> children) implements AstNode
	{
		public OpInput
		{
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitOpInput(this);
		}
	}

	record OpOutput(Position position, List<AstNode> children) implements AstNode
	{
		public OpOutput
		{
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitOpOutput(this);
		}
	}

	record OpConfig(Position position, List<AstNode> children) implements AstNode
	{
		public OpConfig
		{
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitOpConfig(this);
		}
	}

	record OpSpec(Position position, Symbol name, List<OpSpecItem> items) implements AstNode
	{
		public OpSpec
		{
			items = items == null ? List.of() : List.copyOf(items);
		}

		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitOpSpec(this);
		}
	}

	record OpSpecItem(Position position, String name, AstNode value) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitOpSpecItem(this);
		}
	}

	/**
	 * {@code [ge, le]}; either bound may be open-ended.
	 */
	record ClosedInterval(Position position, NumberLiteral ge, NumberLiteral le) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitClosedInterval(this);
		}
	}

	/**
	 * An interval with at least one open end, e.g. {@code (0, 10]}. At most one of ge/gt and one of le/lt is set.
	 */
	record MixInterval(Position position, NumberLiteral ge, NumberLiteral gt, NumberLiteral le, NumberLiteral lt) implements AstNode
	{
		@Override
		public <R> R accept(AstVisitor<R> visitor)
		{
			return visitor.visitMixInterval(this);
		}
	}
}
