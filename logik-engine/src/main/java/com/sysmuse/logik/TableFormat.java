package com.sysmuse.logik;

/**
 * Output formats for a rendered truth table:
 * TEXT: fixed-width columns separated by '|'
 * LATEX: a LaTeX math-mode array
 * JSON: the structure written by {@link TruthTableJsonExporter}
 */
public enum TableFormat {
    TEXT,
    LATEX,
    JSON
}
