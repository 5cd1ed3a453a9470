package com.mainframe.hlasm.cli.exception;

import java.util.List;

import lombok.Getter;

/**
 * The analyze command line cannot be run as given. Holds one message per problem found.
 */
@Getter
public class InvalidAnalyzeOptionsException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    public InvalidAnalyzeOptionsException(List<String> problems) {
        super(problems.size() + " invalid analyze option(s): " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
