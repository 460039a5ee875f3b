package com.oracle.lats.evaluation;

/**
 * Cheap well-formedness check for code snippets embedded in thoughts.
 */
@FunctionalInterface
public interface SnippetSyntaxChecker {

    boolean isWellFormed(String language, String code);
}
