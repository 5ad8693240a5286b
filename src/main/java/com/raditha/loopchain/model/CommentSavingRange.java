package com.raditha.loopchain.model;

import com.github.javaparser.ast.stmt.Statement;

/**
 * Sibling statements whose comments must survive a conversion, first and last inclusive.
 */
public record CommentSavingRange(Statement first, Statement last) {
}
