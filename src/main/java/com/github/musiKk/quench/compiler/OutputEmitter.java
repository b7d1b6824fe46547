package com.github.musiKk.quench.compiler;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Serializes an {@link Output.Module} as JavaScript source, two spaces per
 * indentation level.
 */
class OutputEmitter {

    private final Writer writer;
    private int indent = 0;

    OutputEmitter(Writer writer) {
        this.writer = writer;
    }

    static String emitToString(Output.Module module) {
        var writer = new StringWriter();
        new OutputEmitter(writer).emit(module);
        return writer.toString();
    }

    void emit(Output.Module module) {
        module.body().forEach(this::emitStatement);
    }

    void emitStatement(Output.Statement statement) {
        if (statement instanceof Output.Import i) {
            emitLineNl("import * as " + i.namespace() + " from " + quote(i.module()) + ";", true);
        } else if (statement instanceof Output.ConstDeclaration cd) {
            emitLine("const " + cd.name() + " = ", true);
            emitExpression(cd.right());
            emitLineNl(";", false);
        } else if (statement instanceof Output.ExpressionStatement es) {
            emitLine("", true);
            emitExpression(es.expression());
            emitLineNl(";", false);
        } else if (statement instanceof Output.Return r) {
            emitLine("return ", true);
            emitExpression(r.retval());
            emitLineNl(";", false);
        } else {
            throw new IllegalStateException("not implemented: " + statement);
        }
    }

    void emitExpression(Output.Expression expression) {
        if (expression instanceof Output.NumberExpression n) {
            emit(Long.toString(n.l()));
        } else if (expression instanceof Output.StringLiteral s) {
            emit(quote(s.s()));
        } else if (expression instanceof Output.Boolean b) {
            emit(String.valueOf(b.b()));
        } else if (expression instanceof Output.Null) {
            emit("null");
        } else if (expression instanceof Output.NameExpression n) {
            emit(n.name());
        } else if (expression instanceof Output.MemberAccess ma) {
            emitOperand(ma.target());
            emit("." + ma.property());
        } else if (expression instanceof Output.FunctionEvaluation fe) {
            emitOperand(fe.callee());
            emit("(");
            emitCommaSeparated(fe.arguments());
            emit(")");
        } else if (expression instanceof Output.ArrayExpression ae) {
            emit("[");
            emitCommaSeparated(ae.elements());
            emit("]");
        } else if (expression instanceof Output.ArrowFunction af) {
            emit("(" + String.join(", ", af.parameters()) + ") => ");
            emitExpression(af.body());
        } else if (expression instanceof Output.BlockFunction bf) {
            emitLineNl("(" + String.join(", ", bf.parameters()) + ") => {", false);
            indent();
            bf.body().forEach(this::emitStatement);
            outdent();
            emitLine("}", true);
        } else {
            throw new IllegalStateException("not implemented: " + expression);
        }
    }

    // callees and member targets that JavaScript would otherwise misread
    private void emitOperand(Output.Expression expression) {
        boolean parenthesize = expression instanceof Output.ArrowFunction
                || expression instanceof Output.BlockFunction
                || expression instanceof Output.NumberExpression;
        if (parenthesize) {
            emit("(");
        }
        emitExpression(expression);
        if (parenthesize) {
            emit(")");
        }
    }

    /**
     * Double-quoted JavaScript literal whose value is exactly {@code value}.
     */
    static String quote(String value) {
        var sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\u2028' -> sb.append("\\u2028");
                case '\u2029' -> sb.append("\\u2029");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private void emitCommaSeparated(List<Output.Expression> expressions) {
        for (int i = 0; i < expressions.size(); i++) {
            if (i > 0) {
                emit(", ");
            }
            emitExpression(expressions.get(i));
        }
    }

    void indent() {
        indent++;
    }

    void outdent() {
        indent--;
    }

    void emitLineNl(String line, boolean doIndent) {
        emitLine(line, doIndent);
        emit("\n");
    }

    void emitLine(String line, boolean doIndent) {
        for (int i = 0; i < indent && doIndent; i++) {
            emit("  ");
        }
        emit(line);
    }

    void emit(String text) {
        try {
            writer.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
