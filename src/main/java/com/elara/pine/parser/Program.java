package com.elara.pine.parser;

import java.util.Collections;
import java.util.List;

/** AST root. {@code version} comes from the {@code //@version=N} pragma and defaults to 5. */
public final class Program {
    public static final int DEFAULT_VERSION = 5;

    public final List<Statement.Stmt> body;
    public final int version;

    public Program(List<Statement.Stmt> body, int version) {
        this.body = Collections.unmodifiableList(body);
        this.version = version;
    }

    public boolean isEmpty() {
        return body.isEmpty();
    }
}
