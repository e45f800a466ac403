package org.gos.error;

public final class UnsupportedFeatureException extends GosException
{
	private final String feature;

	public UnsupportedFeatureException(String feature, int line, int column)
	{
		super(String.format("Unsupported feature: %s at line %d, column %d", feature, line, column), line, column);
		this.feature = feature;
	}

	public String getFeature()
	{
		return feature;
	}
}
