package org.gos.compiler;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.gos.ast.AstNode;
import org.gos.ast.AstNode.*;
import org.gos.error.UnsupportedFeatureException;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Converts value nodes (literals, symbols, collections and intervals) to IR values.
 */
public final class ValueConverter
{
	private static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private ValueConverter()
	{
	}

	/**
	 * @throws UnsupportedFeatureException for a node that does not denote a value
	 */
	public static JsonElement convert(AstNode node)
	{
		if (node instanceof StringLiteral s)
		{
			return new JsonPrimitive(s.value());
		}
		if (node instanceof MultiLineStringLiteral s)
		{
			return new JsonPrimitive(s.value());
		}
		if (node instanceof NumberLiteral n)
		{
			return new JsonPrimitive(n.value());
		}
		if (node instanceof FloatLiteral f)
		{
			return Double.isFinite(f.value()) ? new JsonPrimitive(f.value()) : JsonNull.INSTANCE;
		}
		if (node instanceof BoolLiteral b)
		{
			return new JsonPrimitive(b.value());
		}
		if (node instanceof NullLiteral)
		{
			return JsonNull.INSTANCE;
		}
		if (node instanceof DateLiteral d)
		{
			return new JsonPrimitive(d.value());
		}
		if (node instanceof DateTimeLiteral d)
		{
			return new JsonPrimitive(d.value().format(DATETIME_FORMAT));
		}
		if (node instanceof Symbol s)
		{
			return new JsonPrimitive(s.name());
		}
		if (node instanceof ListStatement l)
		{
			return convertAll(l.items());
		}
		if (node instanceof TupleStatement t)
		{
			return convertAll(t.items());
		}
		if (node instanceof SetStatement s)
		{
			return convertAll(s.items());
		}
		if (node instanceof DictStatement d)
		{
			JsonObject object = new JsonObject();
			for (DictItem item : d.items())
			{
				object.add(keyOf(convert(item.key())), convert(item.value()));
			}
			return object;
		}
		if (node instanceof ClosedInterval c)
		{
			JsonObject object = new JsonObject();
			addBound(object, "ge", c.ge());
			addBound(object, "le", c.le());
			return object;
		}
		if (node instanceof MixInterval m)
		{
			JsonObject object = new JsonObject();
			addBound(object, "ge", m.ge());
			addBound(object, "gt", m.gt());
			addBound(object, "le", m.le());
			addBound(object, "lt", m.lt());
			return object;
		}
		throw new UnsupportedFeatureException(describe(node) + " as a value",
				node.position().getLine(), node.position().getStartCol());
	}

	/**
	 * Plain string form of a value node, for fields the IR stores as text (versions, aliases).
	 */
	public static String asText(AstNode node)
	{
		if (node == null)
		{
			return null;
		}
		if (node instanceof NumberLiteral n)
		{
			return n.raw();
		}
		if (node instanceof FloatLiteral f)
		{
			return f.raw();
		}
		JsonElement value = convert(node);
		return value.isJsonPrimitive() ? value.getAsString() : value.toString();
	}

	static String describe(AstNode node)
	{
		return node.getClass().getSimpleName();
	}

	private static JsonArray convertAll(List<AstNode> items)
	{
		JsonArray array = new JsonArray();
		for (AstNode item : items)
		{
			array.add(convert(item));
		}
		return array;
	}

	private static String keyOf(JsonElement key)
	{
		if (key.isJsonPrimitive() && key.getAsJsonPrimitive().isString())
		{
			return key.getAsString();
		}
		return key.toString();
	}

	private static void addBound(JsonObject target, String name, NumberLiteral bound)
	{
		if (bound != null)
		{
			target.addProperty(name, bound.value());
		}
	}
}
