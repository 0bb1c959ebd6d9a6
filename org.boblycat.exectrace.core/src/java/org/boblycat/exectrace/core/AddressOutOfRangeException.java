package org.boblycat.exectrace.core;

/**
 * Raised when a fetch reaches past the end of the image.
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public class AddressOutOfRangeException extends ExecTraceException {

    private static final long serialVersionUID = -4461273381537718906L;

    private final long address;
    private final long bank;

    public AddressOutOfRangeException(long address, long bank, int length) {
        super(String.format("Fetch at %s (bank %s) is outside the %d byte image",
                            PrintUtils.toHex(address), PrintUtils.toHex(bank), length));
        this.address = address;
        this.bank = bank;
    }

    public long getAddress() { return address; }
    public long getBank() { return bank; }
}
