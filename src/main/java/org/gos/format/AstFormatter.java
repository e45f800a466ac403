package org.gos.format;

import org.gos.ast.AstNode;
import org.gos.ast.AstNode.*;
import org.gos.ast.AstNode.Module;
import org.gos.ast.AstVisitor;
import org.gos.printer.SourceWriter;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a syntax tree as source text through a {@link SourceWriter}.
 * <p>
 * Statements start on a fresh line at the current nesting level; values are written where the
 * cursor is. Collections that overflow the column budget are broken open one item per line,
 * node inputs and chained attributes wrap the way the decompiler wraps them.
 */
class AstFormatter implements AstVisitor<Void>
{
	private final SourceWriter out;
	private int level;

	AstFormatter(SourceWriter out)
	{
		this.out = out;
	}

	/**
	 * Single-line rendering of {@code node}, used to measure candidates and for condition text.
	 */
	static String inline(AstNode node)
	{
		SourceWriter writer = SourceWriter.singleLine();
		node.accept(new AstFormatter(writer));
		return writer.toString();
	}

	private static List<String> inlineAll(List<? extends AstNode> nodes)
	{
		List<String> rendered = new ArrayList<>(nodes.size());
		nodes.forEach(node -> rendered.add(inline(node)));
		return rendered;
	}

	static String quote(String text)
	{
		StringBuilder sb = new StringBuilder("'");
		for (int i = 0; i < text.length(); i++)
		{
			char c = text.charAt(i);
			switch (c)
			{
				case '\\' -> sb.append("\\\\");
				case '\'' -> sb.append("\\'");
				case '\n' -> sb.append("\\n");
				case '\t' -> sb.append("\\t");
				case '\r' -> sb.append("\\r");
				default -> sb.append(c);
			}
		}
		return sb.append('\'').toString();
	}

	// --- Statement lists ---

	/**
	 * One statement per line. A comment that starts on the line the previous statement ends on
	 * stays on that line; block statements get a blank line above unless a comment sits there.
	 */
	private void writeStatements(List<AstNode> children)
	{
		AstNode previous = null;
		boolean commented = false;
		for (AstNode child : children)
		{
			if (previous != null)
			{
				if (child instanceof Comment comment && !(previous instanceof Comment) && !commented
						&& comment.position().getLine() == previous.position().getEndLine())
				{
					out.write(" " + comment.value());
					commented = true;
					continue;
				}
				if (isBlock(child) && !(previous instanceof Comment))
				{
					out.write('\n');
				}
				out.line(level);
			}
			child.accept(this);
			previous = child;
			commented = false;
		}
	}

	private static boolean isBlock(AstNode node)
	{
		return node instanceof VarDef || node instanceof GraphDef || node instanceof OpDef;
	}

	private void writeBlock(String header, List<AstNode> children)
	{
		out.write(header + " {");
		if (!children.isEmpty())
		{
			level++;
			out.line(level);
			writeStatements(children);
			level--;
			out.line(level);
		}
		out.write("}");
	}

	@Override
	public Void visitModule(Module node)
	{
		writeStatements(node.children());
		if (!out.isEmpty())
		{
			out.write('\n');
		}
		return null;
	}

	@Override
	public Void visitComment(Comment node)
	{
		out.write(node.value());
		return null;
	}

	@Override
	public Void visitImport(Import node)
	{
		out.write("import " + String.join(", ", inlineAll(node.items())) + ";");
		return null;
	}

	@Override
	public Void visitImportItem(ImportItem node)
	{
		out.write(node.path().name());
		if (node.alias() != null)
		{
			out.write(" as " + node.alias().name());
		}
		return null;
	}

	@Override
	public Void visitAttrDef(AttrDef node)
	{
		out.write(node.name().name() + " = ");
		node.value().accept(this);
		if (node.condition() != null)
		{
			out.write(" if ");
			node.condition().accept(this);
			if (node.elseValue() != null)
			{
				out.write(" else ");
				node.elseValue().accept(this);
			}
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visitRefDef(RefDef node)
	{
		out.write(node.name().name() + " = " + node.value().name());
		if (node.condition() != null)
		{
			out.write(" if ");
			node.condition().accept(this);
		}
		if (node.defaultValue() != null)
		{
			out.write(" or ");
			node.defaultValue().accept(this);
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visitVarDef(VarDef node)
	{
		writeBlock("var", node.children());
		if (node.alias() != null)
		{
			out.write(" as " + node.alias().name());
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visitGraphDef(GraphDef node)
	{
		String header = "graph";
		if (node.templateGraph() != null)
		{
			header += " : " + node.templateGraph().name();
			if (node.templateVersion() != null)
			{
				header += ".version(" + inline(node.templateVersion()) + ")";
			}
		}
		writeBlock(header, node.children());
		if (node.alias() != null)
		{
			out.write(" as " + node.alias().name());
			if (node.version() != null)
			{
				out.write(".version(" + inline(node.version()) + ")");
			}
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visitOpDef(OpDef node)
	{
		writeBlock("op", node.children());
		if (node.alias() != null)
		{
			out.write(" as " + node.alias().name());
			if (node.version() != null)
			{
				out.write(".version(" + quote(node.version()) + ")");
			}
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visitOpMeta(OpMeta node)
	{
		writeBlock("meta", node.children());
		out.write(";");
		return null;
	}

	@Override
	public Void visitOpInput(OpInput node)
	{
		writeBlock("input", node.children());
		out.write(";");
		return null;
	}

	@Override
	public Void visitOpOutput(OpOutput node)
	{
		writeBlock("output", node.children());
		out.write(";");
		return null;
	}

	@Override
	public Void visitOpConfig(OpConfig node)
	{
		writeBlock("config", node.children());
		out.write(";");
		return null;
	}

	/**
	 * {@code name: dtype;} when the dtype is all there is, else {@code name: (k=v, ...);}.
	 */
	@Override
	public Void visitOpSpec(OpSpec node)
	{
		List<OpSpecItem> items = node.items();
		if (items.isEmpty())
		{
			throw new FormatException("Op spec " + node.name().name() + " has no items");
		}
		out.write(node.name().name() + ": ");
		if (items.size() == 1 && items.get(0).name().equals("dtype"))
		{
			items.get(0).value().accept(this);
		}
		else
		{
			out.write("(");
			out.writeList(inlineAll(items), ", ");
			out.write(")");
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visitOpSpecItem(OpSpecItem node)
	{
		out.write(node.name() + "=");
		node.value().accept(this);
		return null;
	}

	@Override
	public Void visitClosedInterval(ClosedInterval node)
	{
		out.write("[" + raw(node.ge()) + ", " + raw(node.le()) + "]");
		return null;
	}

	@Override
	public Void visitMixInterval(MixInterval node)
	{
		String left = node.ge() != null ? "[" + raw(node.ge()) : "(" + raw(node.gt());
		String right = node.le() != null ? raw(node.le()) + "]" : raw(node.lt()) + ")";
		out.write(left + ", " + right);
		return null;
	}

	private static String raw(NumberLiteral bound)
	{
		if (bound == null)
		{
			return "";
		}
		return bound.raw() != null ? bound.raw() : Long.toString(bound.value());
	}

	// --- Nodes ---

	@Override
	public Void visitNodeDef(NodeDef node)
	{
		writeOutputs(node.outputs());
		node.value().accept(this);
		out.write(";");
		return null;
	}

	@Override
	public Void visitConditionDef(ConditionDef node)
	{
		writeOutputs(node.outputs());
		node.value().accept(this);
		out.write(";");
		return null;
	}

	private void writeOutputs(List<Symbol> outputs)
	{
		List<String> names = new ArrayList<>();
		outputs.forEach(output -> names.add(output.name()));
		out.write(String.join(", ", names) + " = ");
	}

	@Override
	public Void visitNodeBlock(NodeBlock node)
	{
		writeCall(node.name().name(), node.inputs(), node.attrs());
		return null;
	}

	@Override
	public Void visitRefGraphBlock(RefGraphBlock node)
	{
		writeCall("ref(" + node.refName().name() + ")", node.inputs(), node.attrs());
		return null;
	}

	private void writeCall(String head, AstNode inputs, List<NodeAttr> attrs)
	{
		out.write(head + "(");
		if (inputs != null)
		{
			inputs.accept(this);
		}
		out.write(")");
		for (NodeAttr attr : attrs)
		{
			out.writeWrapped(inline(attr), level + 1);
		}
	}

	@Override
	public Void visitNodeInputTuple(NodeInputTuple node)
	{
		out.writeList(inlineAll(node.items()), ", ");
		return null;
	}

	@Override
	public Void visitNodeInputKeyDef(NodeInputKeyDef node)
	{
		out.writeList(inlineAll(node.items()), ", ");
		return null;
	}

	@Override
	public Void visitNodeInputKeyItem(NodeInputKeyItem node)
	{
		out.write(node.key().name() + "=");
		node.value().accept(this);
		return null;
	}

	@Override
	public Void visitNodeAttr(NodeAttr node)
	{
		out.write("." + node.name().name() + "(");
		out.writeList(inlineAll(node.args()), ", ");
		out.write(")");
		return null;
	}

	@Override
	public Void visitConditionBlock(ConditionBlock node)
	{
		node.condition().accept(this);
		out.write(" ? ");
		node.trueBranch().accept(this);
		out.writeWrapped(" : ", level + 1);
		node.falseBranch().accept(this);
		return null;
	}

	@Override
	public Void visitConditionStatement(ConditionStatement node)
	{
		node.left().accept(this);
		out.write(" " + node.operator() + " ");
		node.right().accept(this);
		return null;
	}

	@Override
	public Void visitForLoopBlock(ForLoopBlock node)
	{
		out.write("[");
		node.node().accept(this);
		List<String> outputs = new ArrayList<>();
		node.outputs().forEach(output -> outputs.add(output.name()));
		out.writeWrapped(" for " + String.join(", ", outputs) + " in " + node.inputs().name(), level + 1);
		if (node.condition() != null)
		{
			out.writeWrapped(" if " + inline(node.condition()), level + 1);
		}
		out.write("]");
		return null;
	}

	// --- Values ---

	@Override
	public Void visitSymbol(Symbol node)
	{
		out.write(node.name());
		return null;
	}

	@Override
	public Void visitStringLiteral(StringLiteral node)
	{
		out.write(node.raw() != null ? node.raw() : quote(node.value()));
		return null;
	}

	@Override
	public Void visitMultiLineStringLiteral(MultiLineStringLiteral node)
	{
		out.write(node.raw() != null ? node.raw() : "\"\"\"" + node.value() + "\"\"\"");
		return null;
	}

	@Override
	public Void visitNumberLiteral(NumberLiteral node)
	{
		out.write(raw(node));
		return null;
	}

	@Override
	public Void visitFloatLiteral(FloatLiteral node)
	{
		out.write(node.raw() != null ? node.raw() : Double.toString(node.value()));
		return null;
	}

	@Override
	public Void visitBoolLiteral(BoolLiteral node)
	{
		out.write(node.raw() != null ? node.raw() : Boolean.toString(node.value()));
		return null;
	}

	@Override
	public Void visitDateTimeLiteral(DateTimeLiteral node)
	{
		out.write(node.raw() != null ? node.raw() : "datetime(" + quote(node.value().toString()) + ")");
		return null;
	}

	@Override
	public Void visitDateLiteral(DateLiteral node)
	{
		out.write("date(" + quote(node.value()) + ")");
		return null;
	}

	@Override
	public Void visitNullLiteral(NullLiteral node)
	{
		out.write("null");
		return null;
	}

	@Override
	public Void visitListStatement(ListStatement node)
	{
		writeItems("[", node.items(), "]");
		return null;
	}

	@Override
	public Void visitTupleStatement(TupleStatement node)
	{
		writeItems("(", node.items(), ")");
		return null;
	}

	@Override
	public Void visitSetStatement(SetStatement node)
	{
		writeItems("{", node.items(), "}");
		return null;
	}

	@Override
	public Void visitDictStatement(DictStatement node)
	{
		writeItems("{", node.items(), "}");
		return null;
	}

	@Override
	public Void visitDictItem(DictItem node)
	{
		node.key().accept(this);
		out.write(": ");
		node.value().accept(this);
		return null;
	}

	/**
	 * The single-line form when it fits, otherwise one item per line one level in from the
	 * opening bracket, with the closing bracket under the opening one.
	 */
	private void writeItems(String open, List<? extends AstNode> items, String close)
	{
		String candidate = open + String.join(", ", inlineAll(items)) + close;
		if (items.isEmpty() || out.fits(candidate.length()))
		{
			out.write(candidate);
			return;
		}
		int openCol = out.column();
		int itemCol = openCol + out.getIndentWidth();
		out.write(open);
		for (int i = 0; i < items.size(); i++)
		{
			out.breakAt(itemCol);
			items.get(i).accept(this);
			if (i < items.size() - 1)
			{
				out.write(",");
			}
		}
		out.breakAt(openCol);
		out.write(close);
	}
}
