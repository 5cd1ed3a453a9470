package com.mainframe.hlasm.cli.validation;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.mainframe.hlasm.cli.exception.InvalidAnalyzeOptionsException;
import com.mainframe.hlasm.cli.model.AnalyzeOptions;
import com.mainframe.hlasm.cli.model.ValidatedAnalyzeOptions;

public class AnalyzeOptionsValidator {

	public ValidatedAnalyzeOptions validate(AnalyzeOptions o) {
		List<String> errors = new ArrayList<>();

		Path source = null;
		if (o.getSource() == null) {
			errors.add("Source file is required.");
		} else if (!Files.isRegularFile(o.getSource())) {
			errors.add("Source file does not exist or is not a file: " + o.getSource());
		} else {
			source = o.getSource().toAbsolutePath().normalize();
		}

		if (o.getCopybookDir() != null && !existsDirectory(o.getCopybookDir())) {
			errors.add("Copybook directory does not exist or is not a directory: " + o.getCopybookDir());
		}

		Path searchDir = null;
		if (o.getExternalDir() != null && !o.isRecursive()) {
			errors.add("--external-dir only applies to recursive analysis (--recursive / -r).");
		} else if (o.getExternalDir() != null && !existsDirectory(o.getExternalDir())) {
			errors.add("External directory does not exist or is not a directory: " + o.getExternalDir());
		} else if (o.isRecursive()) {
			searchDir = o.getExternalDir() != null ? o.getExternalDir()
					: (source != null ? source.getParent() : null);
		}

		if (o.getMaxMacroDepth() < 1) {
			errors.add("Macro depth must be >= 1. Got: " + o.getMaxMacroDepth());
		}

		Charset charset = parseCharset(o.getEncoding(), errors);

		if (!errors.isEmpty()) {
			throw new InvalidAnalyzeOptionsException(errors);
		}

		return new ValidatedAnalyzeOptions(source, o.getCopybookDir(), searchDir, charset);
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static Charset parseCharset(String name, List<String> errors) {
		if (name == null || name.isBlank()) {
			return StandardCharsets.UTF_8;
		}
		try {
			return Charset.forName(name.trim());
		} catch (IllegalArgumentException e) {
			errors.add("Unsupported encoding: " + name);
			return StandardCharsets.UTF_8;
		}
	}
}
