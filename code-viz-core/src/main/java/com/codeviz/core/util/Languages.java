package com.codeviz.core.util;

/**
 * Constants for supported language identifiers.
 * <p>
 * These tags appear in {@code FileMetrics.language()} and are the keys of the
 * parser registry.
 * </p>
 */
public final class Languages {
    /** Language identifier for TypeScript. */
    public static final String TYPESCRIPT = "typescript";

    /** Language identifier for TypeScript with JSX. */
    public static final String TSX = "tsx";

    /** Language identifier for JavaScript (including JSX). */
    public static final String JAVASCRIPT = "javascript";

    /** Language identifier for Rust. */
    public static final String RUST = "rust";

    /** Language identifier for Python. */
    public static final String PYTHON = "python";

    /** Language identifier for Go. */
    public static final String GO = "go";

    /** Language identifier for C and C++ sources and headers. */
    public static final String CPP = "cpp";

    /** Language identifier for Java. */
    public static final String JAVA = "java";

    private Languages() {
        // Prevent instantiation
    }
}
