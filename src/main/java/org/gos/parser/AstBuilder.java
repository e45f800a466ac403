package org.gos.parser;

import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.gos.ast.AstNode;
import org.gos.ast.AstNode.*;
import org.gos.ast.AstNode.Module;
import org.gos.ast.Position;
import org.gos.ast.SymbolKind;
import org.gos.error.DeprecatedFeatureException;
import org.gos.error.DuplicateDefinitionException;
import org.gos.error.InvalidValueException;
import org.gos.error.SyntaxException;
import org.gos.error.UnsupportedFeatureException;
import org.gos.util.Debug;
import org.gos.util.ErrorHandler;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks the ANTLR parse tree and produces the typed syntax tree.
 * <p>
 * Besides the structural mapping the builder tags every {@link Symbol} with the {@link SymbolKind}
 * of the position it was read from, computes spans (statements end before their {@code ;}),
 * and re-attaches comments from the hidden channel as siblings inside the statement list that
 * encloses them.
 */
public class AstBuilder extends GosBaseVisitor<AstNode>
{
	private static final String VERSION_SUFFIX = ".version";
	private static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private final CommonTokenStream tokens;
	private final ErrorHandler errorHandler;

	// comment tokens already placed in some statement list
	private final Set<Integer> attachedComments = new HashSet<>();

	private final Set<String> graphAliases = new HashSet<>();
	private final Set<String> opAliases = new HashSet<>();
	private final Set<String> importAliases = new HashSet<>();

	public AstBuilder(CommonTokenStream tokens, ErrorHandler errorHandler)
	{
		this.tokens = tokens;
		this.errorHandler = errorHandler;
	}

	// --- Statements ---

	@Override
	public AstNode visitModule(GosParser.ModuleContext ctx)
	{
		List<AstNode> children = new ArrayList<>();
		List<ParserRuleContext> contexts = new ArrayList<>();
		for (GosParser.StatementContext statement : ctx.statement())
		{
			children.add(visit(statement));
			contexts.add(statement);
		}
		List<AstNode> withComments = attachComments(children, contexts, -1, tokens.size());
		Position position = withComments.isEmpty() ? Position.synthetic() : span(withComments);
		Debug.logDebug("Built module with " + withComments.size() + " top-level entries");
		return new Module(position, withComments);
	}

	@Override
	public AstNode visitStatement(GosParser.StatementContext ctx)
	{
		return visit(ctx.getChild(0));
	}

	@Override
	public AstNode visitImportStmt(GosParser.ImportStmtContext ctx)
	{
		List<ImportItem> items = new ArrayList<>();
		for (GosParser.ImportItemContext itemCtx : ctx.importItem())
		{
			Symbol path = symbol(itemCtx.name(0), SymbolKind.IMPORT_NAME);
			Symbol alias = itemCtx.name().size() > 1 ? symbol(itemCtx.name(1), SymbolKind.IMPORT_AS_NAME) : null;
			if (alias != null && !importAliases.add(alias.name()))
			{
				throw DuplicateDefinitionException.importAlias(alias.name(), alias.position().getLine(), alias.position().getStartCol());
			}
			items.add(new ImportItem(position(itemCtx), path, alias));
		}
		return new Import(position(ctx), items);
	}

	@Override
	public AstNode visitVarDef(GosParser.VarDefContext ctx)
	{
		List<AstNode> children = new ArrayList<>();
		List<ParserRuleContext> contexts = new ArrayList<>();
		for (GosParser.AttrStmtContext attr : ctx.attrStmt())
		{
			for (AstNode node : attrStatement(attr, SymbolKind.VAR_ATTR))
			{
				children.add(node);
				contexts.add(attr);
			}
		}
		Symbol alias = null;
		if (ctx.aliasClause() != null)
		{
			alias = aliasSymbol(ctx.aliasClause().name(), ctx.aliasClause().versionArg() != null, SymbolKind.VAR_AS_NAME);
		}
		return new VarDef(position(ctx), body(children, contexts, ctx.lb, ctx.rb), alias);
	}

	@Override
	public AstNode visitGraphDef(GosParser.GraphDefContext ctx)
	{
		List<AstNode> children = new ArrayList<>();
		List<ParserRuleContext> contexts = new ArrayList<>();
		for (GosParser.GraphItemContext item : ctx.graphItem())
		{
			if (item.nodeDef() != null)
			{
				children.add(visit(item.nodeDef()));
				contexts.add(item);
				continue;
			}
			for (AstNode node : attrStatement(item.attrStmt(), SymbolKind.GRAPH_PROPERTY))
			{
				children.add(node);
				contexts.add(item);
			}
		}

		Symbol template = null;
		AstNode templateVersion = null;
		if (ctx.name() != null)
		{
			template = aliasSymbol(ctx.name(), ctx.versionArg() != null, SymbolKind.GRAPH_TEMPLATE);
			templateVersion = ctx.versionArg() != null ? visit(ctx.versionArg().value()) : null;
		}

		Symbol alias = null;
		AstNode version = null;
		if (ctx.aliasClause() != null)
		{
			GosParser.AliasClauseContext clause = ctx.aliasClause();
			alias = aliasSymbol(clause.name(), clause.versionArg() != null, SymbolKind.GRAPH_AS_NAME);
			version = clause.versionArg() != null ? visit(clause.versionArg().value()) : null;
			if (!graphAliases.add(alias.name()))
			{
				throw DuplicateDefinitionException.graphAlias(alias.name(), alias.position().getLine(), alias.position().getStartCol());
			}
		}
		return new GraphDef(position(ctx), body(children, contexts, ctx.lb, ctx.rb), alias, version, template, templateVersion);
	}

	@Override
	public AstNode visitOpDef(GosParser.OpDefContext ctx)
	{
		List<AstNode> children = new ArrayList<>();
		List<ParserRuleContext> contexts = new ArrayList<>();
		for (GosParser.OpItemContext item : ctx.opItem())
		{
			children.add(item.graphDef() != null ? visit(item.graphDef()) : visit(item.opSection()));
			contexts.add(item);
		}

		Symbol alias = null;
		String version = null;
		if (ctx.aliasClause() != null)
		{
			GosParser.AliasClauseContext clause = ctx.aliasClause();
			alias = aliasSymbol(clause.name(), clause.versionArg() != null, SymbolKind.OP_AS_NAME);
			version = clause.versionArg() != null ? text(visit(clause.versionArg().value())) : null;
			if (!opAliases.add(alias.name()))
			{
				throw DuplicateDefinitionException.opAlias(alias.name(), alias.position().getLine(), alias.position().getStartCol());
			}
		}
		return new OpDef(position(ctx), body(children, contexts, ctx.lb, ctx.rb), alias, version);
	}

	@Override
	public AstNode visitOpSection(GosParser.OpSectionContext ctx)
	{
		String section = ctx.name().getText();
		SymbolKind kind = switch (section)
		{
			case "meta" -> SymbolKind.OP_META_ATTR;
			case "input" -> SymbolKind.OP_INPUT_ATTR;
			case "output" -> SymbolKind.OP_OUTPUT_ATTR;
			case "config" -> SymbolKind.OP_CONFIG_ATTR;
			default -> throw syntaxError(ctx.name(), "unknown op section '" + section + "', expected meta, input, output or config");
		};

		List<AstNode> children = new ArrayList<>();
		List<ParserRuleContext> contexts = new ArrayList<>();
		for (GosParser.SectionItemContext item : ctx.sectionItem())
		{
			if (kind == SymbolKind.OP_META_ATTR)
			{
				if (item.attrStmt() == null)
				{
					throw syntaxError(item, "op meta only holds attributes");
				}
				for (AstNode node : attrStatement(item.attrStmt(), kind))
				{
					children.add(node);
					contexts.add(item);
				}
			}
			else
			{
				if (item.opSpec() == null)
				{
					throw syntaxError(item, "op " + section + " only holds specs of the form name: (...)");
				}
				children.add(opSpec(item.opSpec(), kind));
				contexts.add(item);
			}
		}

		List<AstNode> body = body(children, contexts, ctx.lb, ctx.rb);
		Position position = position(ctx);
		return switch (section)
		{
			case "meta" -> new OpMeta(position, body);
			case "input" -> new OpInput(position, body);
			case "output" -> new OpOutput(position, body);
			default -> new OpConfig(position, body);
		};
	}

	/**
	 * One attribute statement; {@code a = 1, b = 2;} expands to several definitions.
	 */
	private List<AstNode> attrStatement(GosParser.AttrStmtContext ctx, SymbolKind kind)
	{
		if (ctx instanceof GosParser.RefAttrContext ref)
		{
			Symbol name = symbol(ref.name(0), kind);
			Symbol value = symbol(ref.name(1), SymbolKind.VAR_REF);
			AstNode condition = ref.condition() != null ? visit(ref.condition()) : null;
			return List.of(new RefDef(position(ref), name, value, condition, visit(ref.value())));
		}
		if (ctx instanceof GosParser.SingleAttrContext single)
		{
			Symbol name = symbol(single.name(), kind);
			AstNode value = single.attrValue().call() != null ? visit(single.attrValue().call()) : visit(single.attrValue().value());
			AstNode condition = single.condition() != null ? visit(single.condition()) : null;
			AstNode elseValue = single.value() != null ? visit(single.value()) : null;
			return List.of(new AttrDef(position(single), name, value, condition, elseValue));
		}
		GosParser.AttrLineContext line = (GosParser.AttrLineContext) ctx;
		List<AstNode> attrs = new ArrayList<>();
		for (int i = 0; i < line.name().size(); i++)
		{
			Symbol name = symbol(line.name(i), kind);
			AstNode value = visit(line.value(i));
			Position position = new Position(name.position().getLine(), value.position().getEndLine(),
					name.position().getStartCol(), value.position().getEndCol());
			attrs.add(new AttrDef(position, name, value));
		}
		return attrs;
	}

	// --- Nodes ---

	@Override
	public AstNode visitNodeDef(GosParser.NodeDefContext ctx)
	{
		List<Symbol> outputs = new ArrayList<>();
		ctx.name().forEach(name -> outputs.add(symbol(name, SymbolKind.NODE_OUTPUT)));
		GosParser.NodeValueContext value = ctx.nodeValue();
		if (value.conditional() != null)
		{
			return new ConditionDef(position(ctx), outputs, (ConditionBlock) visit(value.conditional()));
		}
		if (value.forLoop() != null)
		{
			return new NodeDef(position(ctx), outputs, visit(value.forLoop()));
		}
		return new NodeDef(position(ctx), outputs, visit(value.call()));
	}

	@Override
	public AstNode visitOpCall(GosParser.OpCallContext ctx)
	{
		Symbol name = symbol(ctx.name(), SymbolKind.NODE_NAME);
		return new NodeBlock(position(ctx), name, nodeInputs(ctx.nodeInputs()), nodeAttrs(ctx.nodeAttr()));
	}

	@Override
	public AstNode visitRefCall(GosParser.RefCallContext ctx)
	{
		Symbol refName = symbol(ctx.name(), SymbolKind.REF_GRAPH_NAME);
		return new RefGraphBlock(position(ctx), refName, nodeInputs(ctx.nodeInputs()), nodeAttrs(ctx.nodeAttr()));
	}

	/**
	 * All positional or all keyed; {@code null} for an empty argument list.
	 */
	private AstNode nodeInputs(GosParser.NodeInputsContext ctx)
	{
		if (ctx == null)
		{
			return null;
		}
		List<AstNode> positional = new ArrayList<>();
		List<NodeInputKeyItem> keyed = new ArrayList<>();
		for (GosParser.NodeInputContext input : ctx.nodeInput())
		{
			if (input instanceof GosParser.KeyInputContext key)
			{
				keyed.add(new NodeInputKeyItem(position(key), symbol(key.name(), SymbolKind.NODE_INPUT_KEY), tagged(visit(key.value()), SymbolKind.NODE_INPUT)));
			}
			else
			{
				positional.add(tagged(visit(((GosParser.PositionalInputContext) input).value()), SymbolKind.NODE_INPUT));
			}
		}
		if (!positional.isEmpty() && !keyed.isEmpty())
		{
			throw syntaxError(ctx, "cannot mix positional and keyword node inputs");
		}
		return keyed.isEmpty() ? new NodeInputTuple(position(ctx), positional) : new NodeInputKeyDef(position(ctx), keyed);
	}

	private List<NodeAttr> nodeAttrs(List<GosParser.NodeAttrContext> contexts)
	{
		List<NodeAttr> attrs = new ArrayList<>();
		for (GosParser.NodeAttrContext ctx : contexts)
		{
			Symbol name = symbol(ctx.name(), SymbolKind.NODE_ATTR_NAME);
			SymbolKind argKind = switch (name.name())
			{
				case "depend" -> SymbolKind.NODE_DEPEND;
				case "as" -> SymbolKind.NODE_AS_NAME;
				case "property" -> SymbolKind.NODE_PROPERTY;
				default -> SymbolKind.NODE_ATTR;
			};
			List<AstNode> args = new ArrayList<>();
			for (GosParser.AttrArgContext arg : ctx.attrArg())
			{
				if (arg instanceof GosParser.KeyAttrArgContext key)
				{
					args.add(new NodeInputKeyItem(position(key), symbol(key.name(), argKind), visit(key.value())));
				}
				else
				{
					args.add(tagged(visit(((GosParser.PlainAttrArgContext) arg).value()), argKind));
				}
			}
			// the leading '.' belongs to the attribute
			attrs.add(new NodeAttr(position(ctx), name, args));
		}
		return attrs;
	}

	@Override
	public AstNode visitForLoop(GosParser.ForLoopContext ctx)
	{
		AstNode call = visit(ctx.call());
		if (!(call instanceof NodeBlock node))
		{
			throw new UnsupportedFeatureException("reference graph call in a for loop",
					call.position().getLine(), call.position().getStartCol());
		}
		List<GosParser.NameContext> names = ctx.name();
		List<Symbol> outputs = new ArrayList<>();
		for (int i = 0; i < names.size() - 1; i++)
		{
			outputs.add(symbol(names.get(i), SymbolKind.FOR_LOOP_OUTPUTS));
		}
		Symbol inputs = symbol(names.get(names.size() - 1), SymbolKind.FOR_LOOP_INPUTS);
		AstNode condition = ctx.condition() != null ? visit(ctx.condition()) : null;
		return new ForLoopBlock(position(ctx), inputs, outputs, node, condition);
	}

	@Override
	public AstNode visitConditional(GosParser.ConditionalContext ctx)
	{
		return new ConditionBlock(position(ctx), visit(ctx.condition()), visit(ctx.branch(0)), visit(ctx.branch(1)));
	}

	@Override
	public AstNode visitBranch(GosParser.BranchContext ctx)
	{
		return ctx.conditional() != null ? visit(ctx.conditional()) : visit(ctx.call());
	}

	@Override
	public AstNode visitCondition(GosParser.ConditionContext ctx)
	{
		if (ctx.call() != null)
		{
			return visit(ctx.call());
		}
		if (ctx.COMPARE() != null)
		{
			return new ConditionStatement(position(ctx), visit(ctx.value(0)), visit(ctx.value(1)), ctx.COMPARE().getText());
		}
		return visit(ctx.value(0));
	}

	// --- Op specs ---

	private OpSpec opSpec(GosParser.OpSpecContext ctx, SymbolKind kind)
	{
		if (ctx instanceof GosParser.ShortSpecContext shortSpec)
		{
			AstNode dtype = tagged(visit(shortSpec.value()), SymbolKind.OP_SPEC_DTYPE);
			OpSpecItem item = new OpSpecItem(position(shortSpec.value()), "dtype", dtype);
			return new OpSpec(position(ctx), symbol(shortSpec.name(), kind), List.of(item));
		}
		GosParser.FullSpecContext full = (GosParser.FullSpecContext) ctx;
		List<OpSpecItem> items = new ArrayList<>();
		for (GosParser.SpecItemContext itemCtx : full.specItem())
		{
			String name = itemCtx.name().getText();
			AstNode value;
			if (itemCtx.interval() != null)
			{
				value = interval(itemCtx.interval(), name);
			}
			else
			{
				value = visit(itemCtx.value());
				if (name.equals("dtype"))
				{
					tagged(value, SymbolKind.OP_SPEC_DTYPE);
				}
			}
			items.add(new OpSpecItem(position(itemCtx), name, value));
		}
		return new OpSpec(position(ctx), symbol(full.name(), kind), items);
	}

	/**
	 * {@code [a, b]}, {@code (a, b]}, {@code [, b]}... Only {@code length} and {@code range} take
	 * intervals; elsewhere the same text is an ordinary list or tuple of integers.
	 */
	private AstNode interval(GosParser.IntervalContext ctx, String itemName)
	{
		NumberLiteral lower = ctx.lower != null ? number(ctx.lower) : null;
		NumberLiteral upper = ctx.upper != null ? number(ctx.upper) : null;
		boolean openLeft = ctx.open.getText().equals("(");
		boolean openRight = ctx.close.getText().equals(")");

		if (!itemName.equals("length") && !itemName.equals("range"))
		{
			if (lower == null || upper == null)
			{
				throw new InvalidValueException("empty element in '" + itemName + "'", ctx.start.getLine(), ctx.start.getCharPositionInLine() + 1);
			}
			if (openLeft != openRight)
			{
				throw syntaxError(ctx, "unbalanced brackets in '" + itemName + "'");
			}
			List<AstNode> items = List.of(lower, upper);
			return openLeft ? new TupleStatement(position(ctx), items) : new ListStatement(position(ctx), items);
		}

		if (!openLeft && !openRight)
		{
			return new ClosedInterval(position(ctx), lower, upper);
		}
		return new MixInterval(position(ctx),
				openLeft ? null : lower, openLeft ? lower : null,
				openRight ? null : upper, openRight ? upper : null);
	}

	// --- Values ---

	@Override
	public AstNode visitStringValue(GosParser.StringValueContext ctx)
	{
		String raw = ctx.STRING().getText();
		return new StringLiteral(position(ctx), unescape(raw.substring(1, raw.length() - 1)), raw);
	}

	@Override
	public AstNode visitMultiLineStringValue(GosParser.MultiLineStringValueContext ctx)
	{
		String raw = ctx.MLSTRING().getText();
		return new MultiLineStringLiteral(position(ctx), raw.substring(3, raw.length() - 3), raw);
	}

	@Override
	public AstNode visitIntValue(GosParser.IntValueContext ctx)
	{
		return number(ctx.INT().getSymbol());
	}

	@Override
	public AstNode visitFloatValue(GosParser.FloatValueContext ctx)
	{
		String raw = ctx.FLOAT().getText();
		return new FloatLiteral(position(ctx), raw, Double.parseDouble(raw));
	}

	@Override
	public AstNode visitBoolValue(GosParser.BoolValueContext ctx)
	{
		return new BoolLiteral(position(ctx), ctx.getText(), ctx.TRUE() != null);
	}

	@Override
	public AstNode visitNullValue(GosParser.NullValueContext ctx)
	{
		return new NullLiteral(position(ctx));
	}

	@Override
	public AstNode visitDateValue(GosParser.DateValueContext ctx)
	{
		String raw = ctx.STRING().getText();
		return new DateLiteral(position(ctx), unescape(raw.substring(1, raw.length() - 1)));
	}

	@Override
	public AstNode visitDateTimeValue(GosParser.DateTimeValueContext ctx)
	{
		int line = ctx.start.getLine();
		int column = ctx.start.getCharPositionInLine() + 1;
		errorHandler.logWarning(DeprecatedFeatureException.datetimeLiteral(line, column));

		String raw = ctx.STRING().getText();
		String text = raw.substring(1, raw.length() - 1);
		try
		{
			LocalDateTime value = text.contains("T") ? LocalDateTime.parse(text) : LocalDateTime.parse(text, DATETIME_FORMAT);
			return new DateTimeLiteral(position(ctx), ctx.getText(), value);
		}
		catch (DateTimeParseException e)
		{
			throw new InvalidValueException("datetime '" + text + "' is not yyyy-MM-dd HH:mm:ss", line, column);
		}
	}

	@Override
	public AstNode visitSymbolValue(GosParser.SymbolValueContext ctx)
	{
		return symbol(ctx.name(), SymbolKind.UNKNOWN);
	}

	@Override
	public AstNode visitListValue(GosParser.ListValueContext ctx)
	{
		return new ListStatement(position(ctx), values(ctx.value()));
	}

	@Override
	public AstNode visitTupleValue(GosParser.TupleValueContext ctx)
	{
		return new TupleStatement(position(ctx), values(ctx.value()));
	}

	@Override
	public AstNode visitSetValue(GosParser.SetValueContext ctx)
	{
		return new SetStatement(position(ctx), values(ctx.value()));
	}

	@Override
	public AstNode visitDictValue(GosParser.DictValueContext ctx)
	{
		List<DictItem> items = new ArrayList<>();
		for (GosParser.DictItemContext item : ctx.dictItem())
		{
			items.add(new DictItem(position(item), visit(item.value(0)), visit(item.value(1))));
		}
		return new DictStatement(position(ctx), items);
	}

	private List<AstNode> values(List<GosParser.ValueContext> contexts)
	{
		List<AstNode> values = new ArrayList<>();
		contexts.forEach(value -> values.add(visit(value)));
		return values;
	}

	private NumberLiteral number(Token token)
	{
		String raw = token.getText();
		int line = token.getLine();
		int column = token.getCharPositionInLine() + 1;
		try
		{
			return new NumberLiteral(Position.of(line, column, column + raw.length()), raw, Long.parseLong(raw));
		}
		catch (NumberFormatException e)
		{
			throw new InvalidValueException("integer " + raw + " does not fit in 64 bits", line, column);
		}
	}

	static String unescape(String text)
	{
		if (text.indexOf('\\') < 0)
		{
			return text;
		}
		StringBuilder sb = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++)
		{
			char c = text.charAt(i);
			if (c != '\\' || i + 1 >= text.length())
			{
				sb.append(c);
				continue;
			}
			char next = text.charAt(++i);
			switch (next)
			{
				case 'n' -> sb.append('\n');
				case 't' -> sb.append('\t');
				case 'r' -> sb.append('\r');
				default -> sb.append(next);
			}
		}
		return sb.toString();
	}

	/**
	 * Plain text of a version argument: {@code '1.0.0'}, {@code 1.0} or a bare name.
	 */
	private static String text(AstNode value)
	{
		if (value instanceof StringLiteral s)
		{
			return s.value();
		}
		if (value instanceof NumberLiteral n)
		{
			return n.raw();
		}
		if (value instanceof FloatLiteral f)
		{
			return f.raw();
		}
		if (value instanceof Symbol s)
		{
			return s.name();
		}
		throw new InvalidValueException("version must be a string", value.position().getLine(), value.position().getStartCol());
	}

	// --- Symbols and spans ---

	private Symbol symbol(GosParser.NameContext ctx, SymbolKind kind)
	{
		return new Symbol(position(ctx), ctx.getText(), kind);
	}

	/**
	 * {@code name} or, when a version argument follows, {@code name.version} with the suffix cut off.
	 */
	private Symbol aliasSymbol(GosParser.NameContext ctx, boolean versioned, SymbolKind kind)
	{
		String text = ctx.getText();
		if (!versioned)
		{
			return new Symbol(position(ctx), text, kind);
		}
		if (!text.endsWith(VERSION_SUFFIX) || text.length() == VERSION_SUFFIX.length())
		{
			throw syntaxError(ctx, "expected '" + text + VERSION_SUFFIX + "(...)'");
		}
		String name = text.substring(0, text.length() - VERSION_SUFFIX.length());
		int line = ctx.start.getLine();
		int column = ctx.start.getCharPositionInLine() + 1;
		return new Symbol(Position.of(line, column, column + name.length()), name, kind);
	}

	private static AstNode tagged(AstNode value, SymbolKind kind)
	{
		if (value instanceof Symbol symbol && symbol.kind() == SymbolKind.UNKNOWN)
		{
			symbol.setKind(kind);
		}
		return value;
	}

	private Position position(ParserRuleContext ctx)
	{
		Token stop = ctx.getStop();
		if (stop != null && stop != ctx.getStart() && ";".equals(stop.getText()))
		{
			stop = previousDefault(stop.getTokenIndex());
		}
		return position(ctx.getStart(), stop == null ? ctx.getStart() : stop);
	}

	private static Position position(Token start, Token stop)
	{
		String text = stop.getText();
		int newlines = 0;
		int lastNewline = -1;
		for (int i = 0; i < text.length(); i++)
		{
			if (text.charAt(i) == '\n')
			{
				newlines++;
				lastNewline = i;
			}
		}
		int endLine = stop.getLine() + newlines;
		int endCol = newlines == 0 ? stop.getCharPositionInLine() + 1 + text.length() : text.length() - lastNewline;
		return new Position(start.getLine(), endLine, start.getCharPositionInLine() + 1, endCol);
	}

	private Token previousDefault(int index)
	{
		for (int i = index - 1; i >= 0; i--)
		{
			Token token = tokens.get(i);
			if (token.getChannel() == Token.DEFAULT_CHANNEL)
			{
				return token;
			}
		}
		return null;
	}

	private static Position span(List<AstNode> nodes)
	{
		Position first = nodes.get(0).position();
		Position last = nodes.get(0).position();
		for (AstNode node : nodes)
		{
			Position p = node.position();
			if (p.getLine() < first.getLine() || (p.getLine() == first.getLine() && p.getStartCol() < first.getStartCol()))
			{
				first = p;
			}
			if (p.getEndLine() > last.getEndLine() || (p.getEndLine() == last.getEndLine() && p.getEndCol() > last.getEndCol()))
			{
				last = p;
			}
		}
		return new Position(first.getLine(), last.getEndLine(), first.getStartCol(), last.getEndCol());
	}

	// --- Comments ---

	private List<AstNode> body(List<AstNode> children, List<ParserRuleContext> contexts, Token open, Token close)
	{
		return attachComments(children, contexts, open.getTokenIndex(), close.getTokenIndex());
	}

	/**
	 * Merges the not yet placed comments strictly between {@code from} and {@code to} into
	 * {@code children}. A comment inside a child's own tokens (say between {@code }} and
	 * {@code as}) lands right after that child.
	 */
	private List<AstNode> attachComments(List<AstNode> children, List<ParserRuleContext> contexts, int from, int to)
	{
		record Entry(int primary, int secondary, AstNode node)
		{
		}

		List<Entry> entries = new ArrayList<>();
		for (int i = 0; i < children.size(); i++)
		{
			entries.add(new Entry(contexts.get(i).getStart().getTokenIndex(), i, children.get(i)));
		}

		for (int index = from + 1; index < to; index++)
		{
			Token token = tokens.get(index);
			if (token.getChannel() != Token.HIDDEN_CHANNEL || attachedComments.contains(index))
			{
				continue;
			}
			attachedComments.add(index);
			int primary = index;
			for (ParserRuleContext ctx : contexts)
			{
				if (index > ctx.getStart().getTokenIndex() && index < ctx.getStop().getTokenIndex())
				{
					primary = ctx.getStop().getTokenIndex();
					break;
				}
			}
			Comment comment = new Comment(position(token, token), token.getText());
			entries.add(new Entry(primary, children.size() + index, comment));
		}

		entries.sort(Comparator.comparingInt(Entry::primary).thenComparingInt(Entry::secondary));
		List<AstNode> merged = new ArrayList<>(entries.size());
		entries.forEach(entry -> merged.add(entry.node()));
		return merged;
	}

	private SyntaxException syntaxError(ParserRuleContext ctx, String detail)
	{
		return new SyntaxException(ctx.getStart().getLine(), ctx.getStart().getCharPositionInLine() + 1, detail);
	}
}
