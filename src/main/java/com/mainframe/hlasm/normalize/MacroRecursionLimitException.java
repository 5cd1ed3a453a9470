package com.mainframe.hlasm.normalize;

/**
 * Raised when nested macro expansion goes deeper than the configured ceiling.
 */
public class MacroRecursionLimitException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String macroName;
	private final int limit;

	public MacroRecursionLimitException(String macroName, int limit) {
		super("Macro expansion of " + macroName + " exceeds nesting limit of " + limit);
		this.macroName = macroName;
		this.limit = limit;
	}

	public String getMacroName() {
		return macroName;
	}

	public int getLimit() {
		return limit;
	}
}
