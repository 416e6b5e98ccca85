package org.finos.legend.indent.ast;

import java.util.List;
import java.util.Objects;

/**
 * Output of the identifier classifier.
 */
public sealed interface Ident
        permits Ident.GlobalTag, Ident.PrivateTag, Ident.Access, Ident.AccessorFunction, Ident.Malformed {

    /** {@code Foo} */
    record GlobalTag(String name) implements Ident {
    }

    /** {@code @Foo} */
    record PrivateTag(String name) implements Ident {
    }

    /**
     * {@code foo}, {@code foo.bar.baz} or {@code Module.Sub.foo.bar}.
     *
     * @param moduleName dotted module path, empty when unqualified
     * @param parts      the value name followed by accessed field names
     */
    record Access(String moduleName, List<String> parts) implements Ident {
        public Access {
            Objects.requireNonNull(moduleName, "Module name cannot be null");
            parts = List.copyOf(parts);
            if (parts.isEmpty()) {
                throw new IllegalArgumentException("Access needs at least one part");
            }
        }
    }

    /** {@code .foo}, holding {@code foo} */
    record AccessorFunction(String field) implements Ident {
    }

    record Malformed(String text, BadIdent problem) implements Ident {
    }
}
