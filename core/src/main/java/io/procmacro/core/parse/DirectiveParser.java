package io.procmacro.core.parse;

import io.procmacro.core.error.DirectiveParseException;
import io.procmacro.core.expr.Expr;
import io.procmacro.core.model.ParsedProcedure;
import io.procmacro.core.model.Row;
import io.procmacro.core.model.SyntaxNode;
import io.procmacro.core.model.Table;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses authored procedure text into a {@link ParsedProcedure}: a tree of {@link SyntaxNode}s plus
 * the global table store.
 *
 * <p>Directive lines start with {@code @}; every other line is a literal step. Block directives
 * ({@code @FOR}, {@code @IF}) are tracked on an explicit stack so that mismatched or unclosed blocks
 * report the line that opened them. Tables may only contain {@code @ROW} lines, blank lines and
 * {@code @#} comments.
 *
 * <p>Parsing is fail-fast: the first structural problem throws {@link DirectiveParseException} and no
 * tree is produced. Instances are stateless; each {@link #parse} call uses its own working state.
 */
public final class DirectiveParser {

    private static final Logger LOG = LoggerFactory.getLogger(DirectiveParser.class);

    private static final String IDENT = "([A-Za-z_][A-Za-z0-9_]*)";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Pattern KEYWORD = Pattern.compile("@([A-Za-z]*)");
    private static final Pattern LET = Pattern.compile("@LET\\s+" + IDENT + "\\s*=(.*)", FLAGS);
    private static final Pattern TABLE = Pattern.compile("@TABLE\\s+" + IDENT, FLAGS);
    private static final Pattern ROW = Pattern.compile("@ROW\\s+" + IDENT + "(?:\\s+(.*))?", FLAGS);
    private static final Pattern ALLOC_MANUAL =
            Pattern.compile("@ALLOC\\s+" + IDENT + "\\s+START\\s*=(.+?)\\s+COUNT\\s*=(.+)", FLAGS);
    private static final Pattern ALLOC_AUTO = Pattern.compile("@ALLOC\\s+" + IDENT + "\\s*=(.*)", FLAGS);
    private static final Pattern FOR =
            Pattern.compile("@FOR\\s+" + IDENT + "(?:\\s*,\\s*" + IDENT + ")?\\s+IN\\s+(.+)", FLAGS);
    private static final Pattern IF = Pattern.compile("@IF\\s+(.+)", FLAGS);
    private static final Pattern BARE_IDENT = Pattern.compile(IDENT);

    /** Parses newline-separated text. */
    public ParsedProcedure parse(String source, String text) {
        return parse(source, List.of(text.split("\n", -1)));
    }

    /**
     * Parses authored lines.
     *
     * @param source display name used in logs and reports
     * @param lines  authored lines; a trailing {@code \r} on each is ignored
     * @throws DirectiveParseException on the first structural error
     */
    public ParsedProcedure parse(String source, List<String> lines) {
        ParseState state = new ParseState();
        for (int i = 0; i < lines.size(); i++) {
            String raw = lines.get(i);
            if (raw.endsWith("\r")) {
                raw = raw.substring(0, raw.length() - 1);
            }
            parseLine(state, raw, i + 1);
        }
        state.finish();
        ParsedProcedure parsed = new ParsedProcedure(source, state.root, state.tables);
        LOG.debug(
                "procedure.parsed source={} lines={} nodes={} tables={}",
                source,
                lines.size(),
                parsed.nodes().size(),
                parsed.tables().size());
        return parsed;
    }

    private void parseLine(ParseState state, String raw, int line) {
        String trimmed = raw.strip();
        if (trimmed.startsWith("@#")) {
            return;
        }
        if (state.openTable != null) {
            parseTableLine(state, trimmed, line);
            return;
        }
        if (!trimmed.startsWith("@")) {
            String text = trimmed.isEmpty() ? "" : raw;
            state.append(new SyntaxNode.Step(line, StepTemplateParser.parse(text, line)));
            return;
        }
        String keyword = keywordOf(trimmed);
        switch (keyword) {
            case "LET" -> parseLet(state, trimmed, line);
            case "TABLE" -> openTable(state, trimmed, line);
            case "ROW" -> throw rowOutsideTable(state, trimmed, line);
            case "ENDTABLE" -> throw new DirectiveParseException("@ENDTABLE without matching @TABLE", line);
            case "ALLOC" -> parseAlloc(state, trimmed, line);
            case "FOR" -> parseFor(state, trimmed, line);
            case "IF" -> parseIf(state, trimmed, line);
            case "ELSE" -> parseElse(state, trimmed, line);
            case "ENDFOR" -> closeBlock(state, trimmed, line, BlockKind.FOR);
            case "ENDIF" -> closeBlock(state, trimmed, line, BlockKind.IF);
            default -> throw new DirectiveParseException("unknown directive '" + firstWord(trimmed) + "'", line);
        }
    }

    // --- tables ---

    private void openTable(ParseState state, String trimmed, int line) {
        Matcher m = TABLE.matcher(trimmed);
        if (!m.matches()) {
            throw new DirectiveParseException("malformed @TABLE, expected '@TABLE NAME'", line);
        }
        String name = m.group(1);
        Integer declaredAt = state.tableLines.get(name);
        if (declaredAt != null) {
            throw new DirectiveParseException(
                    "table '" + name + "' is already declared at line " + declaredAt, line);
        }
        state.tableLines.put(name, line);
        state.openTable = new OpenTable(name, line);
    }

    private void parseTableLine(ParseState state, String trimmed, int line) {
        OpenTable table = state.openTable;
        if (trimmed.isEmpty()) {
            return;
        }
        String keyword = trimmed.startsWith("@") ? keywordOf(trimmed) : "";
        if (keyword.equals("ROW")) {
            Matcher m = ROW.matcher(trimmed);
            if (!m.matches()) {
                throw new DirectiveParseException("malformed @ROW, expected '@ROW NAME key=value ...'", line);
            }
            String name = m.group(1);
            if (!name.equals(table.name)) {
                throw new DirectiveParseException(
                        "@ROW for table '" + name + "' inside @TABLE '" + table.name + "' opened at line "
                                + table.line,
                        line);
            }
            String cells = m.group(2) == null ? "" : m.group(2);
            table.rows.add(RowCellParser.parse(cells, line));
        } else if (keyword.equals("ENDTABLE")) {
            requireNoArguments(trimmed, "@ENDTABLE", line);
            state.tables.put(table.name, new Table(table.name, table.rows, table.line));
            state.append(new SyntaxNode.TableDef(table.line, table.name));
            state.openTable = null;
        } else {
            String what = trimmed.startsWith("@") ? "'" + firstWord(trimmed) + "'" : "a step line";
            throw new DirectiveParseException(
                    what + " crosses the boundary of @TABLE '" + table.name + "' opened at line " + table.line
                            + " (only @ROW lines may appear inside a table)",
                    line);
        }
    }

    private DirectiveParseException rowOutsideTable(ParseState state, String trimmed, int line) {
        Matcher m = ROW.matcher(trimmed);
        if (!m.matches()) {
            return new DirectiveParseException("malformed @ROW, expected '@ROW NAME key=value ...'", line);
        }
        String name = m.group(1);
        Integer declaredAt = state.tableLines.get(name);
        if (declaredAt == null) {
            return new DirectiveParseException("@ROW for undeclared table '" + name + "'", line);
        }
        return new DirectiveParseException(
                "@ROW for table '" + name + "' which was already closed (declared at line " + declaredAt + ")",
                line);
    }

    // --- simple directives ---

    private void parseLet(ParseState state, String trimmed, int line) {
        Matcher m = LET.matcher(trimmed);
        if (!m.matches()) {
            throw new DirectiveParseException("malformed @LET, expected '@LET NAME = expr'", line);
        }
        state.append(new SyntaxNode.LetBind(line, m.group(1), ExpressionParser.parse(m.group(2), line)));
    }

    private void parseAlloc(ParseState state, String trimmed, int line) {
        Matcher manual = ALLOC_MANUAL.matcher(trimmed);
        if (manual.matches()) {
            Expr start = ExpressionParser.parse(manual.group(2), line);
            Expr count = ExpressionParser.parse(manual.group(3), line);
            state.append(new SyntaxNode.Alloc(line, manual.group(1), start, count));
            return;
        }
        Matcher auto = ALLOC_AUTO.matcher(trimmed);
        if (auto.matches()) {
            state.append(new SyntaxNode.Alloc(line, auto.group(1), null, ExpressionParser.parse(auto.group(2), line)));
            return;
        }
        throw new DirectiveParseException(
                "malformed @ALLOC, expected '@ALLOC NAME = count' or '@ALLOC NAME START=expr COUNT=expr'", line);
    }

    // --- blocks ---

    private void parseFor(ParseState state, String trimmed, int line) {
        Matcher m = FOR.matcher(trimmed);
        if (!m.matches()) {
            throw new DirectiveParseException(
                    "malformed @FOR, expected '@FOR i,row IN TABLE', '@FOR row IN TABLE' or '@FOR i IN lo..hi'",
                    line);
        }
        String first = m.group(1);
        String second = m.group(2);
        String target = m.group(3).strip();
        if (second != null) {
            if (first.equals(second)) {
                throw new DirectiveParseException("@FOR index and row variables are both named '" + first + "'", line);
            }
            requireTableName(target, line);
            state.push(new Block(BlockKind.FOR, line, body -> new SyntaxNode.ForTable(line, first, second, target, body)));
            return;
        }
        int dots = indexOfRange(target);
        if (dots >= 0) {
            Expr lo = ExpressionParser.parse(target.substring(0, dots), line);
            Expr hi = ExpressionParser.parse(target.substring(dots + 2), line);
            state.push(new Block(BlockKind.FOR, line, body -> new SyntaxNode.ForRange(line, first, lo, hi, body)));
            return;
        }
        requireTableName(target, line);
        state.push(new Block(BlockKind.FOR, line, body -> new SyntaxNode.ForTable(line, null, first, target, body)));
    }

    private void parseIf(ParseState state, String trimmed, int line) {
        Matcher m = IF.matcher(trimmed);
        if (!m.matches()) {
            throw new DirectiveParseException("malformed @IF, expected '@IF expr'", line);
        }
        Expr condition = ExpressionParser.parse(m.group(1), line);
        Block block = new Block(BlockKind.IF, line, null);
        block.closer = body -> new SyntaxNode.If(line, condition, body, block.elseBody);
        state.push(block);
    }

    private void parseElse(ParseState state, String trimmed, int line) {
        requireNoArguments(trimmed, "@ELSE", line);
        Block top = state.blocks.peek();
        if (top == null || top.kind != BlockKind.IF) {
            throw new DirectiveParseException(
                    top == null
                            ? "@ELSE without matching @IF"
                            : "@ELSE does not match @FOR opened at line " + top.line,
                    line);
        }
        if (top.inElse) {
            throw new DirectiveParseException("second @ELSE for @IF opened at line " + top.line, line);
        }
        top.inElse = true;
    }

    private void closeBlock(ParseState state, String trimmed, int line, BlockKind kind) {
        String directive = "@END" + kind.name();
        requireNoArguments(trimmed, directive, line);
        Block top = state.blocks.peek();
        if (top == null) {
            throw new DirectiveParseException(directive + " without matching @" + kind.name(), line);
        }
        if (top.kind != kind) {
            throw new DirectiveParseException(
                    directive + " does not match @" + top.kind.name() + " opened at line " + top.line, line);
        }
        state.blocks.pop();
        state.append(top.closer.close(top.body));
    }

    // --- helpers ---

    private static String keywordOf(String trimmed) {
        Matcher m = KEYWORD.matcher(trimmed);
        return m.lookingAt() ? m.group(1).toUpperCase(Locale.ROOT) : "";
    }

    private static String firstWord(String trimmed) {
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end);
    }

    private static void requireNoArguments(String trimmed, String directive, int line) {
        if (!trimmed.equalsIgnoreCase(directive)) {
            throw new DirectiveParseException(directive + " takes no arguments", line);
        }
    }

    private static void requireTableName(String target, int line) {
        if (!BARE_IDENT.matcher(target).matches()) {
            throw new DirectiveParseException(
                    "@FOR target '" + target + "' is neither a table name nor a lo..hi range", line);
        }
    }

    /** Index of the first {@code ..} outside quotes, or -1. */
    private static int indexOfRange(String text) {
        char quote = 0;
        for (int i = 0; i + 1 < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '.' && text.charAt(i + 1) == '.') {
                return i;
            }
        }
        return -1;
    }

    private enum BlockKind {
        FOR,
        IF
    }

    @FunctionalInterface
    private interface BlockCloser {
        SyntaxNode close(List<SyntaxNode> body);
    }

    private static final class Block {
        final BlockKind kind;
        final int line;
        final List<SyntaxNode> body = new ArrayList<>();
        final List<SyntaxNode> elseBody = new ArrayList<>();
        BlockCloser closer;
        boolean inElse;

        Block(BlockKind kind, int line, BlockCloser closer) {
            this.kind = kind;
            this.line = line;
            this.closer = closer;
        }

        List<SyntaxNode> target() {
            return inElse ? elseBody : body;
        }
    }

    private static final class OpenTable {
        final String name;
        final int line;
        final List<Row> rows = new ArrayList<>();

        OpenTable(String name, int line) {
            this.name = name;
            this.line = line;
        }
    }

    private static final class ParseState {
        final List<SyntaxNode> root = new ArrayList<>();
        final Deque<Block> blocks = new ArrayDeque<>();
        final Map<String, Table> tables = new LinkedHashMap<>();
        final Map<String, Integer> tableLines = new LinkedHashMap<>();
        OpenTable openTable;

        void append(SyntaxNode node) {
            Block top = blocks.peek();
            if (top == null) {
                root.add(node);
            } else {
                top.target().add(node);
            }
        }

        void push(Block block) {
            blocks.push(block);
        }

        void finish() {
            if (openTable != null) {
                throw new DirectiveParseException(
                        "@TABLE '" + openTable.name + "' is never closed (missing @ENDTABLE)", openTable.line);
            }
            Block top = blocks.peek();
            if (top != null) {
                throw new DirectiveParseException(
                        "@" + top.kind.name() + " is never closed (missing @END" + top.kind.name() + ")", top.line);
            }
        }
    }
}
