package com.stylefixer.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A method with its parameter types, in declaration order.
 */
public final class MethodSymbol implements Symbol {
    private final String name;
    private final List<TypeSymbol> parameterTypes;

    public MethodSymbol(String name, List<TypeSymbol> parameterTypes) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameterTypes = Collections.unmodifiableList(new ArrayList<>(parameterTypes));
    }

    public static MethodSymbol of(String name, TypeSymbol... parameterTypes) {
        return new MethodSymbol(name, List.of(parameterTypes));
    }

    @Override
    public String getName() {
        return name;
    }

    public List<TypeSymbol> getParameterTypes() {
        return parameterTypes;
    }

    @Override
    public String toString() {
        return name + parameterTypes.toString().replace('[', '(').replace(']', ')');
    }
}
