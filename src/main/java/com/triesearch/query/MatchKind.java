package com.triesearch.query;

/**
 * 建议来源。
 */
public enum MatchKind {
    EXACT,
    COMPLETION,
    SUBMATCH,
    CORRECTION,
    NONE
}
