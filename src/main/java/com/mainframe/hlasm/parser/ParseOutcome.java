package com.mainframe.hlasm.parser;

import com.mainframe.hlasm.model.ParsedInstruction;

import lombok.Value;

/**
 * Either a fully parsed instruction or a degraded best-effort fallback for a malformed line.
 */
@Value
public class ParseOutcome {
    ParsedInstruction instruction;
    /** Null for a full parse. */
    String degradationReason;

    public static ParseOutcome parsed(ParsedInstruction instruction) {
        return new ParseOutcome(instruction, null);
    }

    public static ParseOutcome degraded(ParsedInstruction instruction, String reason) {
        return new ParseOutcome(instruction, reason);
    }

    public boolean isDegraded() {
        return degradationReason != null;
    }
}
