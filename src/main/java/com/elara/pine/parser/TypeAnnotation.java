package com.elara.pine.parser;

import java.util.Collections;
import java.util.List;

/** Declared type such as {@code float}, {@code array<int>} or {@code map<string, float>}. */
public final class TypeAnnotation {
    public final String name;
    public final List<TypeAnnotation> arguments;

    public TypeAnnotation(String name, List<TypeAnnotation> arguments) {
        this.name = name;
        this.arguments = (arguments == null) ? Collections.emptyList() : Collections.unmodifiableList(arguments);
    }

    @Override
    public String toString() {
        if (arguments.isEmpty()) return name;
        StringBuilder sb = new StringBuilder(name).append('<');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(arguments.get(i));
        }
        return sb.append('>').toString();
    }
}
