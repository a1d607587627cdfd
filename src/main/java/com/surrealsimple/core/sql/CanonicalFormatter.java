package com.surrealsimple.core.sql;

import com.surrealsimple.core.sql.grammar.SurrealQLLexer;
import com.surrealsimple.core.sql.grammar.SurrealQLParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Prints a parsed statement back as text in one normalised layout:
 * keywords upper-case, single spaces between tokens, no comments,
 * objects as {@code { key: value }}, record ids, calls and graph paths tight.
 */
final class CanonicalFormatter {

    private CanonicalFormatter() {
    }

    static String format(ParserRuleContext statement) {
        List<TerminalNode> terminals = new ArrayList<>();
        collect(statement, terminals);

        StringBuilder out = new StringBuilder();
        TerminalNode previous = null;
        for (TerminalNode terminal : terminals) {
            if (previous != null && spaced(previous, terminal)) {
                out.append(' ');
            }
            out.append(render(terminal));
            previous = terminal;
        }
        return out.toString();
    }

    private static void collect(ParseTree node, List<TerminalNode> out) {
        if (node instanceof TerminalNode) {
            TerminalNode terminal = (TerminalNode) node;
            if (terminal.getSymbol().getType() != Token.EOF) {
                out.add(terminal);
            }
            return;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            collect(node.getChild(i), out);
        }
    }

    private static String render(TerminalNode node) {
        Token token = node.getSymbol();
        String text = token.getText();
        ParseTree parent = node.getParent();

        // Words used as names keep the caller's spelling.
        if (parent instanceof SurrealQLParser.IdentContext
                || parent instanceof SurrealQLParser.KeywordContext
                || parent instanceof SurrealQLParser.FieldKeywordContext) {
            return text;
        }
        int type = token.getType();
        if (type == SurrealQLLexer.TRUE || type == SurrealQLLexer.FALSE) {
            return text.toLowerCase(Locale.ROOT);
        }
        if (isKeyword(type, text)) {
            return text.toUpperCase(Locale.ROOT);
        }
        return text;
    }

    private static boolean isKeyword(int type, String text) {
        String symbolic = SurrealQLLexer.VOCABULARY.getSymbolicName(type);
        return symbolic != null && symbolic.equalsIgnoreCase(text);
    }

    private static boolean spaced(TerminalNode previous, TerminalNode next) {
        if (type(previous) == SurrealQLLexer.LBRACE && type(next) == SurrealQLLexer.RBRACE) {
            return false;
        }
        return !gluesRight(previous) && !gluesLeft(next);
    }

    /** True when nothing may separate this token from the one after it. */
    private static boolean gluesRight(TerminalNode node) {
        ParseTree parent = node.getParent();
        switch (type(node)) {
            case SurrealQLLexer.LPAREN:
            case SurrealQLLexer.LBRACKET:
            case SurrealQLLexer.DOT:
            case SurrealQLLexer.DOUBLE_COLON:
            case SurrealQLLexer.ARROW_RIGHT:
            case SurrealQLLexer.ARROW_LEFT:
            case SurrealQLLexer.ARROW_BOTH:
                return true;
            case SurrealQLLexer.COLON:
                return parent instanceof SurrealQLParser.RecordIdContext;
            case SurrealQLLexer.BANG:
            case SurrealQLLexer.MINUS:
                return parent instanceof SurrealQLParser.UnaryContext;
            case SurrealQLLexer.LT:
                return parent instanceof SurrealQLParser.CastContext;
            default:
                return false;
        }
    }

    /** True when nothing may separate this token from the one before it. */
    private static boolean gluesLeft(TerminalNode node) {
        ParseTree parent = node.getParent();
        switch (type(node)) {
            case SurrealQLLexer.COMMA:
            case SurrealQLLexer.RPAREN:
            case SurrealQLLexer.RBRACKET:
            case SurrealQLLexer.DOT:
            case SurrealQLLexer.DOUBLE_COLON:
            case SurrealQLLexer.COLON:
                return true;
            case SurrealQLLexer.LPAREN:
                return parent instanceof SurrealQLParser.FunctionCallContext
                    || parent instanceof SurrealQLParser.OrderItemContext;
            case SurrealQLLexer.LBRACKET:
                return parent instanceof SurrealQLParser.PartContext;
            case SurrealQLLexer.GT:
                return parent instanceof SurrealQLParser.CastContext;
            case SurrealQLLexer.ARROW_RIGHT:
            case SurrealQLLexer.ARROW_LEFT:
            case SurrealQLLexer.ARROW_BOTH:
                return parent instanceof SurrealQLParser.RelateStatementContext
                    || (parent instanceof SurrealQLParser.GraphStepContext
                        && parent.getParent() instanceof SurrealQLParser.PartContext);
            default:
                return false;
        }
    }

    private static int type(TerminalNode node) {
        return node.getSymbol().getType();
    }
}
