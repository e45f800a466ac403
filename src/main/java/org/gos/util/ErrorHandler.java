package org.gos.util;

import org.gos.error.GosException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one parse. Every entry is logged as it arrives; callers decide
 * when the collection turns into a failure through {@link #throwIfErrors()}.
 */
public class ErrorHandler
{
	private final List<GosException> errors = new ArrayList<>();
	private final List<GosException> warnings = new ArrayList<>();

	public void logError(GosException error)
	{
		Debug.logError("[Error] " + error.getMessage());
		errors.add(error);
	}

	public void logWarning(GosException warning)
	{
		Debug.logWarning("[Warning] " + warning.getMessage());
		warnings.add(warning);
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public boolean hasWarnings()
	{
		return !warnings.isEmpty();
	}

	public boolean isEmpty()
	{
		return errors.isEmpty() && warnings.isEmpty();
	}

	public List<GosException> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}

	public List<GosException> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}

	/**
	 * Throws the first collected error. Later errors are usually fallout of the first one.
	 */
	public void throwIfErrors()
	{
		if (!errors.isEmpty())
		{
			throw errors.get(0);
		}
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		if (!errors.isEmpty())
		{
			sb.append("Errors:\n");
			errors.forEach(e -> sb.append("  ").append(e.getMessage()).append('\n'));
		}
		if (!warnings.isEmpty())
		{
			sb.append("Warnings:\n");
			warnings.forEach(w -> sb.append("  ").append(w.getMessage()).append('\n'));
		}
		return sb.toString();
	}
}
