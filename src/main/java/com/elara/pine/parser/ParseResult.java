package com.elara.pine.parser;

import java.util.Collections;
import java.util.List;

/** Best-effort program plus every syntax error collected while producing it. */
public final class ParseResult {
    private final Program program;
    private final List<ParseError> errors;

    ParseResult(Program program, List<ParseError> errors) {
        this.program = program;
        this.errors = Collections.unmodifiableList(errors);
    }

    public Program program() { return program; }
    public List<ParseError> errors() { return errors; }
    public boolean hasErrors() { return !errors.isEmpty(); }
}
