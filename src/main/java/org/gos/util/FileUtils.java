package org.gos.util;

import org.gos.error.GosIoException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileUtils
{
	public static String read(Path filePath)
	{
		try
		{
			return Files.readString(filePath, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			throw new GosIoException("Failed to read file " + filePath + ": " + e.getMessage(), e);
		}
	}

	public static void write(Path filePath, String content)
	{
		try
		{
			Path parent = filePath.toAbsolutePath().getParent();
			if (parent != null)
			{
				Files.createDirectories(parent);
			}
			Files.writeString(filePath, content, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			throw new GosIoException("Failed to write file " + filePath + ": " + e.getMessage(), e);
		}
	}
}
