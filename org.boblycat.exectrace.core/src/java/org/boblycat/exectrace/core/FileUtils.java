package org.boblycat.exectrace.core;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

/**
 *
 * Created: Feb 26, 2010
 *
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 *
 * @author: karltk@boblycat.org
 */
public class FileUtils {

	private static boolean ensureExistsAndReadable(File file) {
		return file.isFile() && file.canRead();
	}

	public static byte[] loadBytes(String fileName) throws ExecTraceException, IOException {
		final File file = new File(fileName);
		if(!ensureExistsAndReadable(file)) {
			throw new ExecTraceException(String.format("File %s does not exist or is not readable", fileName));
		}
		return Files.readAllBytes(file.toPath());
	}
}
