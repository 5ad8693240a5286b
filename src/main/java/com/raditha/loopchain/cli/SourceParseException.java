package com.raditha.loopchain.cli;

import com.github.javaparser.Problem;

import java.nio.file.Path;
import java.util.List;

/**
 * The source file given on the command line is not valid Java.
 */
public class SourceParseException extends RuntimeException {

    public SourceParseException(Path source, List<Problem> problems) {
        super("Cannot parse " + source + ": " + (problems.isEmpty()
                ? "no compilation unit"
                : problems.get(0).getVerboseMessage()));
    }
}
