package com.raditha.loopchain.cli;

/**
 * JSON view of a conversion printed with {@code --json}.
 *
 * @param file           the converted file
 * @param line           line of the loop
 * @param operation      presentation of the operation, for example {@code indexOfFirst{}}
 * @param chainCallCount number of chained calls in the replacement
 * @param replacement    source of the call chain
 * @param mode           {@code dry-run} or {@code apply}
 * @param applied        whether the file was written
 * @param diff           unified diff of the change
 */
public record ConversionReport(
        String file,
        int line,
        String operation,
        int chainCallCount,
        String replacement,
        String mode,
        boolean applied,
        String diff) {
}
