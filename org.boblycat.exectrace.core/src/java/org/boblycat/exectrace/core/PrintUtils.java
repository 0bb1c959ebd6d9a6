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
public class PrintUtils {

	public static String toHex(long value) {
		return "0x" + Long.toHexString(value);
	}

	/** Four digit upper case address, as used for labels. */
	public static String toAddress(long address) {
		return String.format("%04X", address);
	}

	public static String toByte(int value) {
		return String.format("0x%02X", value & 0xFF);
	}

	public static String toHexList(Iterable<Long> addresses) {
		final StringBuilder sb = new StringBuilder("[");
		for(Long address : addresses) {
			if(sb.length() > 1) {
				sb.append(", ");
			}
			sb.append(toHex(address));
		}
		return sb.append(']').toString();
	}
}
