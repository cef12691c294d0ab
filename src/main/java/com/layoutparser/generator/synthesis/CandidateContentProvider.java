package com.layoutparser.generator.synthesis;

/**
 * Produces candidate text for a line. The result is validated before it is accepted.
 */
public interface CandidateContentProvider {

    String generate(LineRequest request);
}
