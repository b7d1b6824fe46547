package com.github.musiKk.quench.compiler;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Names that bypass mangling and resolve to fixed runtime bindings.
 */
final class SpecialForms {

    static final String IDENTIFIER_PREFIX = "$";

    private static final Map<String, Output.Expression> FORMS = Map.of(
            "print", new Output.MemberAccess(new Output.NameExpression("console"), "log"),
            // process.argv starts with the runtime and the script path
            "args", new Output.FunctionEvaluation(
                    new Output.MemberAccess(new Output.NameExpression(Compiler.COLLECTIONS_NAMESPACE), "List"),
                    List.of(new Output.FunctionEvaluation(
                            new Output.MemberAccess(new Output.MemberAccess(new Output.NameExpression("process"), "argv"), "slice"),
                            List.of(new Output.NumberExpression(2))))));

    private SpecialForms() {
    }

    static Optional<Output.Expression> lookup(String name) {
        return Optional.ofNullable(FORMS.get(name));
    }

    static String mangle(String name) {
        return IDENTIFIER_PREFIX + name;
    }

    static Output.Expression resolve(String name) {
        return lookup(name).orElseGet(() -> new Output.NameExpression(mangle(name)));
    }
}
