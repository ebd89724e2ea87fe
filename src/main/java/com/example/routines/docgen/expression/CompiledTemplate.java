package com.example.routines.docgen.expression;

import com.example.routines.docgen.util.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A template string split into literal text and {@code {{ }}} expressions.
 */
public final class CompiledTemplate {
    static final String OPEN = "{{";
    static final String CLOSE = "}}";

    /** Exactly one of {@code text}/{@code expression} is set. */
    private static final class Part {
        final String text;
        final ExpressionNode expression;

        Part(String text, ExpressionNode expression) {
            this.text = text;
            this.expression = expression;
        }
    }

    private final List<Part> parts;

    private CompiledTemplate(List<Part> parts) {
        this.parts = Collections.unmodifiableList(parts);
    }

    public static CompiledTemplate compile(String source) throws ExpressionException {
        if (source.contains("{%") || source.contains("{#")) {
            throw new ExpressionException("Statements and comments are not supported");
        }
        List<Part> parts = new ArrayList<>();
        int pos = 0;
        while (pos < source.length()) {
            int open = source.indexOf(OPEN, pos);
            if (open < 0) {
                parts.add(new Part(source.substring(pos), null));
                break;
            }
            if (open > pos) {
                parts.add(new Part(source.substring(pos, open), null));
            }
            int close = source.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                throw new ExpressionException("Unclosed '{{' at " + open);
            }
            String body = source.substring(open + OPEN.length(), close);
            parts.add(new Part(null, new ExpressionParser(body).parse()));
            pos = close + CLOSE.length();
        }
        return new CompiledTemplate(parts);
    }

    public String render(Map<String, Object> data) throws ExpressionException {
        StringBuilder out = new StringBuilder();
        for (Part part : parts) {
            if (part.expression == null) {
                out.append(part.text);
            } else {
                out.append(Values.asString(part.expression.evaluate(data)));
            }
        }
        return out.toString();
    }
}
