package com.layoutparser.generator.synthesis;

/**
 * Creates the provider used for one record. Records may run in parallel, so each gets its own.
 */
@FunctionalInterface
public interface CandidateProviderFactory {

    CandidateContentProvider forRecord(int recordIndex);
}
