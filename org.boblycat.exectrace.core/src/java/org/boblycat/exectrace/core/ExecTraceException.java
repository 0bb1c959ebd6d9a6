package org.boblycat.exectrace.core;

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
public class ExecTraceException extends Exception {

	private static final long serialVersionUID = -6914128473302265117L;

	public ExecTraceException(String msg) {
		super(msg);
	}

	public ExecTraceException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
