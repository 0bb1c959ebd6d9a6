package org.boblycat.exectrace.core.disassembler;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

public class DisassemblerFactory {

	private static Map<String, Disassembler> knownDisassemblers = new TreeMap<String, Disassembler>();

	public static synchronized void addDisassembler(Disassembler newDisasm) {
		knownDisassemblers.put(newDisasm.getName(), newDisasm);
	}

	/**
	 * @return the disassembler registered for <code>machine</code>, or null
	 */
	public static synchronized Disassembler create(String machine) {
		return knownDisassemblers.get(machine);
	}

	public static synchronized Set<String> knownMachines() {
		return new TreeMap<String, Disassembler>(knownDisassemblers).keySet();
	}
}
