package org.gos.error;

import java.io.IOException;

public final class GosIoException extends GosException
{
	public GosIoException(String detail, IOException cause)
	{
		super("IO error: " + detail, cause);
	}
}
