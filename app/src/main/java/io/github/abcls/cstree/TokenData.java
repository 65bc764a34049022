package io.github.abcls.cstree;

import io.github.abcls.parser.TT;

/** Payload of a leaf node. {@code line} and {@code column} are 0-based, -1 for tokens created by an edit. */
public record TokenData(String lexeme, TT tokenType, int line, int column) {}
