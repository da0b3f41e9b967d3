package com.stylefixer.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named type, possibly constructed from a generic definition.
 *
 * <p>{@code Expression<Func<int, bool>>} is a constructed type whose original definition is the
 * unparameterized {@code Expression<T>}. Definitions compare by name and arity.
 */
public final class TypeSymbol implements Symbol {
    private final String name;
    private final int arity;
    private final List<TypeSymbol> typeArguments;
    private final TypeSymbol originalDefinition;

    private TypeSymbol(String name, int arity, List<TypeSymbol> typeArguments, TypeSymbol originalDefinition) {
        this.name = Objects.requireNonNull(name, "name");
        this.arity = arity;
        this.typeArguments = typeArguments;
        this.originalDefinition = originalDefinition;
    }

    /**
     * Creates a type definition with {@code arity} type parameters.
     */
    public static TypeSymbol definition(String name, int arity) {
        return new TypeSymbol(name, arity, Collections.emptyList(), null);
    }

    public static TypeSymbol named(String name) {
        return definition(name, 0);
    }

    /**
     * Constructs this generic definition with concrete type arguments.
     */
    public TypeSymbol construct(TypeSymbol... arguments) {
        if (originalDefinition != null) {
            throw new IllegalStateException(this + " is already constructed");
        }
        if (arguments.length != arity) {
            throw new IllegalArgumentException(name + " expects " + arity + " type arguments, got " + arguments.length);
        }
        return new TypeSymbol(name, arity, Collections.unmodifiableList(new ArrayList<>(List.of(arguments))), this);
    }

    @Override
    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    public List<TypeSymbol> getTypeArguments() {
        return typeArguments;
    }

    /**
     * The unparameterized definition; a definition is its own original definition.
     */
    public TypeSymbol getOriginalDefinition() {
        return originalDefinition == null ? this : originalDefinition;
    }

    public boolean isConstructed() {
        return originalDefinition != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TypeSymbol)) {
            return false;
        }
        TypeSymbol other = (TypeSymbol) o;
        return arity == other.arity && name.equals(other.name) && typeArguments.equals(other.typeArguments)
                && isConstructed() == other.isConstructed();
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arity, typeArguments);
    }

    @Override
    public String toString() {
        if (arity == 0) {
            return name;
        }
        if (typeArguments.isEmpty()) {
            return name + "`" + arity;
        }
        StringBuilder sb = new StringBuilder(name).append('<');
        for (int i = 0; i < typeArguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(typeArguments.get(i));
        }
        return sb.append('>').toString();
    }
}
