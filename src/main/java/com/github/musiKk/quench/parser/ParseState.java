package com.github.musiKk.quench.parser;

import com.github.musiKk.quench.syntax.SyntaxTree;

/**
 * Text and tree of one document at one version.
 *
 * @param text             the full document text
 * @param tree             the tree parsed from {@code text}
 * @param reusedStatements how many top-level statements the producing parse
 *                         adopted from the previous tree
 */
public record ParseState(String text, SyntaxTree tree, int reusedStatements) {}
