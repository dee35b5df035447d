package dev.contractgate.core.check.source;

import dev.contractgate.core.exception.SourceParseException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Python adapter built on logical lines and indentation.
 * <p>
 * Produces the same node shapes as the Python AST for the constructs the metrics use:
 * <ul>
 *   <li>{@code elif} is a branch nested in the preceding branch</li>
 *   <li>{@code except} handlers are children of their {@code try}</li>
 *   <li>{@code else} and {@code finally} bodies belong to the statement they close</li>
 * </ul>
 * String contents and comments are blanked before expressions are scanned.
 */
public class PythonSourceAdapter implements SourceAdapter {

    private static final Set<String> CLAUSES = Set.of("elif", "else", "except", "finally");

    private static final Set<String> NOT_CALLABLE = Set.of(
            "if", "elif", "while", "for", "and", "or", "not", "in", "is", "return", "yield", "assert",
            "with", "except", "lambda", "await", "del", "raise", "from", "import", "as", "else", "async",
            "def", "class", "global", "nonlocal", "pass", "case", "match");

    private static final Pattern CALL = Pattern.compile("(?<![\\w.])([A-Za-z_][\\w.]*)\\s*\\(");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");
    private static final Pattern TYPE_CHECKING_GUARD = Pattern.compile("^if\\s+(typing\\.)?TYPE_CHECKING\\s*:.*");

    @Override
    public SourceLanguage language() {
        return SourceLanguage.PYTHON;
    }

    @Override
    public SourceUnit parse(String path, String content) {
        String normalized = content.replace("\r\n", "\n").replace('\r', '\n');
        List<LogicalLine> logicalLines = new Lexer(normalized).run();
        String moduleName = moduleName(path);

        SyntaxNode root = SyntaxNode.named(NodeKind.MODULE, moduleName, 1);
        List<ImportRef> imports = new ArrayList<>();
        Deque<Block> stack = new ArrayDeque<>();
        String packageName = path.endsWith("__init__.py") ? moduleName : parentOf(moduleName);

        for (LogicalLine line : logicalLines) {
            String text = line.text();
            List<String> words = leadingWords(text);
            String keyword = words.isEmpty() ? "" : words.get(0);
            if (keyword.equals("async") && words.size() > 1) {
                keyword = words.get(1);
            }

            SyntaxNode created = null;
            SyntaxNode expressionTarget = root;

            if (CLAUSES.contains(keyword)) {
                while (!stack.isEmpty() && stack.peek().indent() > line.indent()) {
                    stack.pop();
                }
                if (stack.isEmpty() || stack.peek().indent() != line.indent()) {
                    throw new SourceParseException("Unexpected '" + keyword + "' clause", line.startLine());
                }
                Block previous = stack.pop();
                boolean typeChecking = anyTypeChecking(stack);
                switch (keyword) {
                    case "elif" -> {
                        created = previous.node().addChild(SyntaxNode.of(NodeKind.BRANCH, line.startLine()));
                        stack.push(new Block(line.indent(), created, created, typeChecking || isGuard(text)));
                        expressionTarget = created;
                    }
                    case "except" -> {
                        SyntaxNode owner = previous.owner();
                        created = owner.addChild(SyntaxNode.of(NodeKind.EXCEPTION_HANDLER, line.startLine()));
                        stack.push(new Block(line.indent(), created, owner, typeChecking));
                        expressionTarget = created;
                    }
                    default -> {
                        // else / finally: the body belongs to the statement being closed
                        SyntaxNode target = previous.node().getKind() == NodeKind.EXCEPTION_HANDLER
                                || keyword.equals("finally") ? previous.owner() : previous.node();
                        stack.push(new Block(line.indent(), target, previous.owner(), typeChecking));
                        expressionTarget = target;
                    }
                }
            } else {
                while (!stack.isEmpty() && stack.peek().indent() >= line.indent()) {
                    stack.pop();
                }
                SyntaxNode parent = stack.isEmpty() ? root : stack.peek().node();
                boolean typeChecking = anyTypeChecking(stack);

                switch (keyword) {
                    case "def" -> created = parent.addChild(function(text, line, parent.getKind() == NodeKind.CLASS));
                    case "class" -> created = parent.addChild(SyntaxNode.named(NodeKind.CLASS, nameAfter(text, "class"), line.startLine()));
                    case "if" -> created = parent.addChild(SyntaxNode.of(NodeKind.BRANCH, line.startLine()));
                    case "for", "while" -> created = parent.addChild(SyntaxNode.of(NodeKind.LOOP, line.startLine()));
                    case "try" -> created = parent.addChild(SyntaxNode.of(NodeKind.TRY, line.startLine()));
                    case "with" -> created = parent.addChild(SyntaxNode.of(NodeKind.CONTEXT, line.startLine()));
                    case "assert" -> parent.addChild(SyntaxNode.of(NodeKind.ASSERT, line.startLine()));
                    case "import" -> imports.addAll(plainImports(text, line.startLine(), typeChecking));
                    case "from" -> {
                        if (text.matches("^from\\s+\\S+\\s+import\\b.*")) {
                            imports.add(fromImport(text, line.startLine(), typeChecking, packageName));
                        }
                    }
                    default -> {
                    }
                }
                if (created != null) {
                    boolean guard = keyword.equals("if") && isGuard(text);
                    stack.push(new Block(line.indent(), created, created, typeChecking || guard));
                }
                expressionTarget = created != null ? created : parent;
            }

            if (!keyword.equals("def") && !keyword.equals("class")) {
                scanExpressions(text, expressionTarget, line.startLine());
            }
            if (created != null) {
                created.extendTo(line.endLine());
            }
            for (Block block : stack) {
                block.node().extendTo(line.endLine());
                block.owner().extendTo(line.endLine());
            }
            root.extendTo(line.endLine());
        }

        List<String> lines = Arrays.asList(normalized.split("\n", -1));
        return new SourceUnit(path, SourceLanguage.PYTHON, moduleName, root, imports, lines);
    }

    /**
     * Dotted module name of a repository-relative path; a leading {@code src/} is dropped.
     */
    static String moduleName(String path) {
        String p = path.startsWith("src/") ? path.substring(4) : path;
        if (p.endsWith(".py")) {
            p = p.substring(0, p.length() - 3);
        }
        if (p.endsWith("/__init__")) {
            p = p.substring(0, p.length() - "/__init__".length());
        }
        return p.replace('/', '.');
    }

    private static SyntaxNode function(String text, LogicalLine line, boolean method) {
        String name = nameAfter(text, "def");
        List<String> parameters = new ArrayList<>();
        int open = text.indexOf('(');
        int close = open < 0 ? -1 : matchingParen(text, open);
        if (open >= 0 && close > open) {
            for (String part : splitTopLevel(text.substring(open + 1, close))) {
                String param = part.trim();
                if (param.isEmpty() || param.equals("*") || param.equals("/")) {
                    continue;
                }
                param = param.replaceFirst("^\\*{1,2}", "");
                param = param.split("[:=]", 2)[0].trim();
                parameters.add(param);
            }
        }
        if (!parameters.isEmpty() && (parameters.get(0).equals("self") || parameters.get(0).equals("cls"))) {
            parameters.remove(0);
        }
        return SyntaxNode.function(name, line.startLine(), line.endLine(), parameters,
                method && name.equals("__init__"));
    }

    private static void scanExpressions(String text, SyntaxNode target, int line) {
        int booleanOperators = 0;
        int conditionals = 0;
        int comprehensionClauses = 0;
        Deque<Boolean> brackets = new ArrayDeque<>();
        boolean first = true;

        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                brackets.push(false);
            } else if ((c == ')' || c == ']' || c == '}') && !brackets.isEmpty()) {
                brackets.pop();
            } else if (Character.isLetter(c) || c == '_') {
                Matcher m = IDENTIFIER.matcher(text);
                m.find(i);
                String word = m.group();
                boolean attribute = i > 0 && text.charAt(i - 1) == '.';
                i = m.end();
                if (first && (word.equals("async") || word.equals("if") || word.equals("elif")
                        || word.equals("while") || word.equals("for") || word.equals("with"))) {
                    first = word.equals("async");
                    continue;
                }
                first = false;
                if (attribute) {
                    continue;
                }
                switch (word) {
                    case "and", "or" -> booleanOperators++;
                    case "for" -> {
                        if (!brackets.isEmpty()) {
                            comprehensionClauses++;
                            brackets.pop();
                            brackets.push(true);
                        }
                    }
                    case "if" -> {
                        boolean filter = !brackets.isEmpty() && brackets.peek();
                        if (!filter) {
                            conditionals++;
                        }
                    }
                    default -> {
                    }
                }
                continue;
            } else if (!Character.isWhitespace(c)) {
                first = false;
            }
            i++;
        }

        if (booleanOperators > 0) {
            target.addChild(SyntaxNode.weighted(NodeKind.BOOLEAN_OPERATION, line, booleanOperators + 1));
        }
        for (int k = 0; k < conditionals; k++) {
            target.addChild(SyntaxNode.of(NodeKind.CONDITIONAL_EXPRESSION, line));
        }
        if (comprehensionClauses > 0) {
            target.addChild(SyntaxNode.weighted(NodeKind.COMPREHENSION, line, comprehensionClauses));
        }

        Matcher call = CALL.matcher(text);
        while (call.find()) {
            String name = call.group(1);
            if (!NOT_CALLABLE.contains(name) && !name.endsWith(".")) {
                target.addChild(SyntaxNode.named(NodeKind.CALL, name, line));
            }
        }
    }

    private static List<ImportRef> plainImports(String text, int line, boolean typeChecking) {
        List<ImportRef> result = new ArrayList<>();
        for (String part : text.substring("import".length()).split(",")) {
            String module = part.trim().split("\\s+as\\s+")[0].trim();
            if (!module.isEmpty()) {
                result.add(new ImportRef(module, List.of(), line, typeChecking));
            }
        }
        return result;
    }

    private static ImportRef fromImport(String text, int line, boolean typeChecking, String packageName) {
        String rest = text.substring("from".length()).trim();
        int importAt = rest.indexOf(" import");
        String source = rest.substring(0, importAt).trim();
        String namesPart = rest.substring(importAt + " import".length()).trim()
                .replace("(", "").replace(")", "");

        List<String> names = new ArrayList<>();
        for (String part : namesPart.split(",")) {
            String name = part.trim().split("\\s+as\\s+")[0].trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }

        int level = 0;
        while (level < source.length() && source.charAt(level) == '.') {
            level++;
        }
        String module = source.substring(level);
        if (level > 0) {
            String base = packageName;
            for (int k = 1; k < level; k++) {
                base = parentOf(base);
            }
            module = base.isEmpty() ? module : module.isEmpty() ? base : base + "." + module;
        }
        return new ImportRef(module, names, line, typeChecking);
    }

    private static boolean isGuard(String text) {
        return TYPE_CHECKING_GUARD.matcher(text).matches();
    }

    private static boolean anyTypeChecking(Deque<Block> stack) {
        return stack.stream().anyMatch(Block::typeChecking);
    }

    private static String parentOf(String module) {
        int dot = module.lastIndexOf('.');
        return dot < 0 ? "" : module.substring(0, dot);
    }

    private static String nameAfter(String text, String keyword) {
        Matcher m = Pattern.compile("\\b" + keyword + "\\s+([A-Za-z_]\\w*)").matcher(text);
        return m.find() ? m.group(1) : "<anonymous>";
    }

    private static List<String> leadingWords(String text) {
        List<String> words = new ArrayList<>();
        Matcher m = Pattern.compile("^([A-Za-z_]\\w*)(?:\\s+([A-Za-z_]\\w*))?").matcher(text);
        if (m.find()) {
            words.add(m.group(1));
            if (m.group(2) != null) {
                words.add(m.group(2));
            }
        }
        return words;
    }

    private static int matchingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (char c : text.toCharArray()) {
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            }
            if (c == ',' && depth == 0) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    private record Block(int indent, SyntaxNode node, SyntaxNode owner, boolean typeChecking) {
    }

    record LogicalLine(String text, int startLine, int endLine, int indent) {
    }

    /**
     * Splits source into logical lines with comments removed and string literals blanked.
     */
    static final class Lexer {

        private final String content;
        private final List<LogicalLine> lines = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();
        private int pos;
        private int line = 1;
        private int startLine = 1;
        private int indent;
        private int depth;

        Lexer(String content) {
            this.content = content;
        }

        List<LogicalLine> run() {
            boolean atLineStart = true;
            while (pos < content.length()) {
                if (atLineStart) {
                    readIndent();
                    atLineStart = false;
                    continue;
                }
                char c = content.charAt(pos);
                if (c == '#') {
                    while (pos < content.length() && content.charAt(pos) != '\n') {
                        pos++;
                    }
                } else if (c == '\\' && pos + 1 < content.length() && content.charAt(pos + 1) == '\n') {
                    text.append(' ');
                    line++;
                    pos += 2;
                } else if (c == '"' || c == '\'') {
                    skipString(c);
                    text.append("\"\"");
                } else if (c == '\n') {
                    pos++;
                    if (depth > 0) {
                        text.append(' ');
                        line++;
                    } else {
                        flush(line);
                        line++;
                        atLineStart = true;
                    }
                } else {
                    if (c == '(' || c == '[' || c == '{') {
                        depth++;
                    } else if (c == ')' || c == ']' || c == '}') {
                        depth = Math.max(0, depth - 1);
                    }
                    text.append(c);
                    pos++;
                }
            }
            if (depth > 0) {
                throw new SourceParseException("Unclosed bracket at end of file", startLine);
            }
            flush(line);
            return lines;
        }

        private void readIndent() {
            int column = 0;
            while (pos < content.length()) {
                char c = content.charAt(pos);
                if (c == ' ') {
                    column++;
                } else if (c == '\t') {
                    column = (column / 8 + 1) * 8;
                } else if (c != '\f') {
                    break;
                }
                pos++;
            }
            indent = column;
            startLine = line;
        }

        private void skipString(char quote) {
            int begin = line;
            boolean triple = content.startsWith(String.valueOf(quote).repeat(3), pos);
            pos += triple ? 3 : 1;
            while (pos < content.length()) {
                char c = content.charAt(pos);
                if (c == '\\') {
                    if (pos + 1 < content.length() && content.charAt(pos + 1) == '\n') {
                        line++;
                    }
                    pos += 2;
                    continue;
                }
                if (triple && content.startsWith(String.valueOf(quote).repeat(3), pos)) {
                    pos += 3;
                    return;
                }
                if (!triple && c == quote) {
                    pos++;
                    return;
                }
                if (c == '\n') {
                    if (!triple) {
                        throw new SourceParseException("Unterminated string literal", begin);
                    }
                    line++;
                }
                pos++;
            }
            throw new SourceParseException("Unterminated string literal", begin);
        }

        private void flush(int endLine) {
            String logical = text.toString().trim();
            if (!logical.isEmpty()) {
                lines.add(new LogicalLine(logical, startLine, endLine, indent));
            }
            text.setLength(0);
        }
    }
}
