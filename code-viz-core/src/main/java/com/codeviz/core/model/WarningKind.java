package com.codeviz.core.model;

/**
 * Reason a file was skipped or degraded during analysis.
 */
public enum WarningKind {
    /** The file or directory could not be accessed. */
    PERMISSION_DENIED,

    /** The file exceeds the configured size ceiling. */
    FILE_TOO_LARGE,

    /** Any other I/O failure while listing, reading or statting a file. */
    IO_ERROR,

    /** The file content is not valid UTF-8. */
    UNREADABLE_ENCODING,

    /** No parser is registered for the file's language. */
    UNSUPPORTED_LANGUAGE,

    /** The parsing engine could not produce a syntax tree. */
    PARSE_FAILURE,

    /** Processing the file exceeded the per-file time limit. */
    TIMEOUT,

    /** Reading or writing the metrics cache failed; the file was still measured. */
    CACHE_FAILURE
}
