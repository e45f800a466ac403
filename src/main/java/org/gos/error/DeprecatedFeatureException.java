package org.gos.error;

/**
 * Raised for syntax that is still accepted but scheduled for removal. The parser records
 * these as warnings rather than throwing them.
 */
public final class DeprecatedFeatureException extends GosException
{
	private final String feature;
	private final String suggestion;

	public DeprecatedFeatureException(String feature, int line, int column, String suggestion)
	{
		super(String.format("Deprecated feature: %s at line %d, column %d. %s", feature, line, column, suggestion), line, column);
		this.feature = feature;
		this.suggestion = suggestion;
	}

	public static DeprecatedFeatureException datetimeLiteral(int line, int column)
	{
		return new DeprecatedFeatureException("datetime literal", line, column,
				"Please use date(\"2025-01-01 00:00:00\") to specify dates");
	}

	public String getFeature()
	{
		return feature;
	}

	public String getSuggestion()
	{
		return suggestion;
	}
}
