package org.boblycat.exectrace.core;

import java.io.IOException;

/**
 * Read-only view of a ROM image. Addresses are relative to the bank:
 * the byte for address <code>a</code> lives at <code>bank + a</code>
 * in the raw data.
 * <p/>
 * Created: Mar 19, 2010
 * <p/>
 * Part of ExecTrace.
 * Copyright (c) 2010, Karl Trygve Kalleberg, Ole André Vadla Ravnås
 * Licensed under the GNU General Public License, v3
 *
 * @author: karltk@boblycat.org
 */
public class BinaryCodeChunk {

    private final long bank;
    private final byte[] rawData;

    public BinaryCodeChunk(long bank, byte[] rawData) {
        if(bank < 0) {
            throw new IllegalArgumentException("Negative bank offset: " + bank);
        }
        this.bank = bank;
        this.rawData = rawData;
    }

    public BinaryCodeChunk(byte[] rawData) {
        this(0, rawData);
    }

    public static BinaryCodeChunk load(String fileName, long bank) throws ExecTraceException, IOException {
        return new BinaryCodeChunk(bank, FileUtils.loadBytes(fileName));
    }

    /**
     * @return the unsigned byte at <code>address</code>
     */
    public int fetch(long address) throws AddressOutOfRangeException {
        if(!contains(address)) {
            throw new AddressOutOfRangeException(address, bank, rawData.length);
        }
        return rawData[(int)(bank + address)] & 0xFF;
    }

    public boolean contains(long address) {
        return address >= 0 && address < rawData.length - bank;
    }

    public long getBank() { return bank; }
    public int length() { return rawData.length; }

    /** Number of addressable bytes once the bank is applied. */
    public long size() { return Math.max(0, rawData.length - bank); }
}
