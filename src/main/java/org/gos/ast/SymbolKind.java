package org.gos.ast;

/**
 * Grammar position an identifier was read from. Metadata only; it never changes the shape of the tree.
 */
public enum SymbolKind
{
	UNKNOWN,
	IMPORT_NAME,
	IMPORT_AS_NAME,
	VAR_ATTR,
	VAR_AS_NAME,
	VAR_REF,
	GRAPH_PROPERTY,
	GRAPH_AS_NAME,
	REF_GRAPH_NAME,
	GRAPH_TEMPLATE,
	NODE_NAME,
	NODE_OUTPUT,
	NODE_INPUT,
	NODE_DEPEND,
	NODE_PROPERTY,
	NODE_ATTR,
	NODE_AS_NAME,
	OP_AS_NAME,
	OP_META_ATTR,
	OP_INPUT_ATTR,
	OP_OUTPUT_ATTR,
	OP_CONFIG_ATTR,
	NODE_ATTR_NAME,
	NODE_INPUT_KEY,
	OP_SPEC_DTYPE,
	FOR_LOOP_INPUTS,
	FOR_LOOP_OUTPUTS
}
