package org.gos.decompiler;

import org.gos.util.Debug;

import java.util.regex.Pattern;

public final class Identifiers
{
	private static final Pattern VALID_IDENTIFIER = Pattern.compile("^[a-zA-Z_\\-$%@][a-zA-Z_\\-$%@.0-9]*$");
	private static final Pattern VALID_VERSION = Pattern.compile("^[0-9]+\\.[0-9]+\\.[0-9]+$");

	private Identifiers()
	{
	}

	public static boolean isIdentifier(String value)
	{
		return value != null && VALID_IDENTIFIER.matcher(value).matches();
	}

	/**
	 * @return {@code value} unchanged
	 * @throws DecompileException when {@code value} is not a valid identifier
	 */
	public static String checkId(String value)
	{
		if (!isIdentifier(value))
		{
			throw new DecompileException("Invalid identifier: " + value);
		}
		return value;
	}

	/**
	 * Versions are expected as {@code major.minor.patch}, but any string is accepted.
	 */
	public static String checkVersion(String value)
	{
		if (!VALID_VERSION.matcher(value).matches())
		{
			Debug.logDebug("Version '" + value + "' is not in major.minor.patch form, keeping it as is.");
		}
		return value;
	}
}
