package org.openscad.cst.antlr4;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.openscad.cst.CstNode;
import org.openscad.cst.CstPoint;
import org.openscad.cst.CstTypes;

/**
 * {@link CstNode} view over an ANTLR parse tree.
 * <p>
 * Rule contexts are named nodes typed by their rule name, or by their alternative label when the
 * rule labels its alternatives. Tokens are anonymous nodes typed by their literal text
 * ({@code "("}, {@code "module"}) or by their lower-cased token name ({@code "number"}).
 * Element labels of the grammar ({@code name=identifier}) become field names.
 * <p>
 * The whole view is built eagerly, so a wrapped tree can be read from several threads.
 */
public final class AntlrCstNode implements CstNode {

    private static final String CONTEXT_SUFFIX = "Context";

    private static final ClassValue<Map<String, Field>> LABEL_FIELDS = new ClassValue<>() {
        @Override
        protected Map<String, Field> computeValue(Class<?> type) {
            Map<String, Field> labels = new LinkedHashMap<>();
            for (Field field : type.getFields()) {
                if (Modifier.isStatic(field.getModifiers())
                        || field.getDeclaringClass().isAssignableFrom(ParserRuleContext.class)) {
                    continue;
                }
                if (Token.class.isAssignableFrom(field.getType())
                        || ParserRuleContext.class.isAssignableFrom(field.getType())) {
                    labels.put(field.getName(), field);
                }
            }
            return Collections.unmodifiableMap(labels);
        }
    };

    private final ParseTree tree;
    private final String type;
    private final String text;
    private final boolean named;
    private final boolean error;
    private final boolean missing;
    private final boolean hasError;
    private final List<CstNode> children;
    private final List<CstNode> namedChildren;
    private final Map<String, CstNode> fields;
    private final CstPoint startPoint;
    private final CstPoint endPoint;

    private AntlrCstNode(ParseTree tree, String[] ruleNames, Vocabulary vocabulary) {
        this.tree = tree;

        List<CstNode> kids = new ArrayList<>();
        List<CstNode> namedKids = new ArrayList<>();
        boolean anyError = false;
        for (int i = 0; i < tree.getChildCount(); i++) {
            ParseTree child = tree.getChild(i);
            if (child instanceof TerminalNode terminal && terminal.getSymbol().getType() == Token.EOF) {
                continue;
            }
            AntlrCstNode wrapped = new AntlrCstNode(child, ruleNames, vocabulary);
            kids.add(wrapped);
            if (wrapped.isNamed()) {
                namedKids.add(wrapped);
            }
            anyError |= wrapped.hasError();
        }
        this.children = Collections.unmodifiableList(kids);
        this.namedChildren = Collections.unmodifiableList(namedKids);

        if (tree instanceof ParserRuleContext ctx) {
            this.type = ruleType(ctx, ruleNames);
            this.named = true;
            this.error = false;
            this.missing = false;
            this.text = ruleText(ctx);
            this.startPoint = startOf(ctx.getStart());
            this.endPoint = isEmpty(ctx) ? startPoint : endOf(ctx.getStop());
            this.fields = collectFields(ctx, kids);
            this.hasError = anyError || ctx.exception != null;
        } else {
            Token token = ((TerminalNode) tree).getSymbol();
            boolean conjured = token.getTokenIndex() < 0;
            if (tree instanceof ErrorNode && !conjured) {
                this.type = CstTypes.ERROR;
                this.named = true;
                this.error = true;
            } else {
                this.type = tokenType(token, vocabulary);
                this.named = false;
                this.error = false;
            }
            this.missing = tree instanceof ErrorNode && conjured;
            this.text = missing ? "" : token.getText();
            this.startPoint = startOf(token);
            this.endPoint = missing ? startPoint : endOf(token);
            this.fields = Map.of();
            this.hasError = error || missing;
        }
    }

    /**
     * Wraps a parse tree produced by {@code parser}.
     */
    public static AntlrCstNode wrap(ParseTree tree, Parser parser) {
        return new AntlrCstNode(tree, parser.getRuleNames(), parser.getVocabulary());
    }

    private static String ruleType(ParserRuleContext ctx, String[] ruleNames) {
        Class<?> contextClass = ctx.getClass();
        if (contextClass.getSuperclass() == ParserRuleContext.class) {
            return ruleNames[ctx.getRuleIndex()];
        }
        // labeled alternative, e.g. Binary_expressionContext
        String simpleName = contextClass.getSimpleName();
        String label = simpleName.endsWith(CONTEXT_SUFFIX)
                ? simpleName.substring(0, simpleName.length() - CONTEXT_SUFFIX.length())
                : simpleName;
        return Character.toLowerCase(label.charAt(0)) + label.substring(1);
    }

    private static String tokenType(Token token, Vocabulary vocabulary) {
        String literal = vocabulary.getLiteralName(token.getType());
        if (literal != null && literal.length() >= 2) {
            return literal.substring(1, literal.length() - 1);
        }
        String symbolic = vocabulary.getSymbolicName(token.getType());
        return symbolic != null ? symbolic.toLowerCase(Locale.ROOT) : token.getText();
    }

    private static boolean isEmpty(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        return start == null || stop == null || stop.getStopIndex() < start.getStartIndex();
    }

    private static String ruleText(ParserRuleContext ctx) {
        if (isEmpty(ctx)) {
            return "";
        }
        Token start = ctx.getStart();
        return start.getInputStream().getText(Interval.of(start.getStartIndex(), ctx.getStop().getStopIndex()));
    }

    private static CstPoint startOf(Token token) {
        if (token == null) {
            return CstPoint.ORIGIN;
        }
        return new CstPoint(Math.max(0, token.getLine() - 1), Math.max(0, token.getCharPositionInLine()),
                token.getStartIndex());
    }

    private static CstPoint endOf(Token token) {
        if (token.getType() == Token.EOF) {
            return startOf(token);
        }
        String tokenText = token.getText() == null ? "" : token.getText();
        int row = Math.max(0, token.getLine() - 1);
        int column = Math.max(0, token.getCharPositionInLine());
        int lastNewline = tokenText.lastIndexOf('\n');
        if (lastNewline < 0) {
            column += tokenText.length();
        } else {
            row += (int) tokenText.chars().filter(c -> c == '\n').count();
            column = tokenText.length() - lastNewline - 1;
        }
        int offset = token.getStopIndex() < 0 ? -1 : token.getStopIndex() + 1;
        return new CstPoint(row, column, offset);
    }

    private static Map<String, CstNode> collectFields(ParserRuleContext ctx, List<CstNode> kids) {
        Map<String, Field> labels = LABEL_FIELDS.get(ctx.getClass());
        if (labels.isEmpty()) {
            return Map.of();
        }
        Map<String, CstNode> result = new LinkedHashMap<>();
        for (Map.Entry<String, Field> label : labels.entrySet()) {
            Object value;
            try {
                value = label.getValue().get(ctx);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot read label '" + label.getKey() + "' of "
                        + ctx.getClass().getName(), e);
            }
            if (value == null) {
                continue;
            }
            for (CstNode kid : kids) {
                ParseTree kidTree = ((AntlrCstNode) kid).tree;
                boolean matches = value instanceof Token
                        ? kidTree instanceof TerminalNode terminal && terminal.getSymbol() == value
                        : kidTree == value;
                if (matches) {
                    result.put(label.getKey(), kid);
                    break;
                }
            }
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public boolean isError() {
        return error;
    }

    @Override
    public boolean isMissing() {
        return missing;
    }

    @Override
    public boolean hasError() {
        return hasError;
    }

    @Override
    public List<CstNode> children() {
        return children;
    }

    @Override
    public List<CstNode> namedChildren() {
        return namedChildren;
    }

    @Override
    public Optional<CstNode> childForFieldName(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    @Override
    public CstPoint startPoint() {
        return startPoint;
    }

    @Override
    public CstPoint endPoint() {
        return endPoint;
    }

    @Override
    public String toString() {
        return type + "[" + text + "]";
    }
}
