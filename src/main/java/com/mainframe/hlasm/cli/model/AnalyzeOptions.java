package com.mainframe.hlasm.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import lombok.Setter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the chunker command. No validation, no execution
 * logic, no printing.
 */
@Getter
@Setter
public class AnalyzeOptions {

	@Parameters(index = "0", paramLabel = "SOURCE", description = "HLASM source file to analyse")
	private Path source;

	@Option(names = { "--copybook-dir",
			"-c" }, description = "Directory containing <NAME>_Assembler_Copybook.txt macro definitions")
	private Path copybookDir;

	@Option(names = { "--external-dir",
			"-e" }, description = "Directory searched for called programs (recursive mode, defaults to the source's directory)")
	private Path externalDir;

	@Option(names = { "--recursive", "-r" }, description = "Follow CALL/LINK/XCTL/BAL/BAS targets into other files")
	private boolean recursive;

	@Option(names = { "--max-macro-depth" }, defaultValue = "16", description = "Macro expansion nesting ceiling (default: 16)")
	private int maxMacroDepth = 16;

	@Option(names = { "--encoding" }, defaultValue = "UTF-8", description = "Source character set (default: UTF-8)")
	private String encoding = "UTF-8";

	@Option(names = { "--verbose", "-v" }, description = "Log per-line detail")
	private boolean verbose;
}
