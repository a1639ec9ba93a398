package aurum.lexer;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Patterns are tried in order and the first match wins, so two-character operators
// stay ahead of their one-character prefixes.
public class Lexer {

    private record Rule(Pattern pattern, TokenType type) {
        Rule(String regex, TokenType type) {
            this(Pattern.compile(regex), type);
        }
    }

    private static final List<Rule> rules = List.of(
            // comments
            new Rule("//.*", TokenType.COMMENT),
            new Rule("/\\*.*?\\*/", TokenType.COMMENT),

            // numbers
            new Rule("\\d+\\.\\d+", TokenType.FLOAT_LITERAL),
            new Rule("\\d+", TokenType.INT_LITERAL),

            // strings
            new Rule("\"([^\"\\\\]|\\\\.)*\"", TokenType.STRING_LITERAL),
            new Rule("'([^'\\\\]|\\\\.)*'", TokenType.STRING_LITERAL),

            // two-character operators
            new Rule("->", TokenType.ARROW),
            new Rule("==", TokenType.EQ),
            new Rule("!=", TokenType.NEQ),
            new Rule("<=", TokenType.LE),
            new Rule(">=", TokenType.GE),

            // one-character operators
            new Rule("\\+", TokenType.PLUS),
            new Rule("-", TokenType.MINUS),
            new Rule("\\*", TokenType.STAR),
            new Rule("/", TokenType.SLASH),
            new Rule("%", TokenType.PERCENT),
            new Rule("=", TokenType.ASSIGN),
            new Rule("<", TokenType.LT),
            new Rule(">", TokenType.GT),

            // delimiters
            new Rule("\\(", TokenType.LPAREN),
            new Rule("\\)", TokenType.RPAREN),
            new Rule("\\{", TokenType.LBRACE),
            new Rule("\\}", TokenType.RBRACE),
            new Rule("\\[", TokenType.LBRACKET),
            new Rule("\\]", TokenType.RBRACKET),
            new Rule(";", TokenType.SEMICOLON),
            new Rule(",", TokenType.COMMA),
            new Rule("\\.", TokenType.DOT),

            // identifiers, reclassified against the keyword table
            new Rule("[a-zA-Z_][a-zA-Z0-9_]*", TokenType.IDENTIFIER),

            new Rule("[ \\t\\r]+", TokenType.WHITESPACE)
    );

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("int", TokenType.INT),
            Map.entry("float", TokenType.FLOAT),
            Map.entry("string", TokenType.STRING),
            Map.entry("bool", TokenType.BOOL),
            Map.entry("void", TokenType.VOID),
            Map.entry("if", TokenType.IF),
            Map.entry("elif", TokenType.ELIF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("while", TokenType.WHILE),
            Map.entry("for", TokenType.FOR),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("return", TokenType.RETURN),
            Map.entry("func", TokenType.FUNC),
            Map.entry("main", TokenType.MAIN),
            Map.entry("read", TokenType.READ),
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT),
            Map.entry("true", TokenType.BOOL_LITERAL),
            Map.entry("false", TokenType.BOOL_LITERAL)
    );

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        tokens.clear();
        String[] lines = source.split("\n", -1);

        for (int i = 0; i < lines.length; i++) {
            tokenizeLine(lines[i], i + 1);
        }

        String last = lines[lines.length - 1];
        add(TokenType.EOF, "", lines.length, last.length() + 1);
        return List.copyOf(tokens);
    }

    private void tokenizeLine(String line, int lineNo) {
        int pos = 0;
        while (pos < line.length()) {
            int end = -1;
            for (Rule rule : rules) {
                Matcher m = rule.pattern().matcher(line);
                m.region(pos, line.length());
                if (!m.lookingAt()) continue;

                String text = m.group();
                TokenType type = rule.type();
                if (type == TokenType.IDENTIFIER) {
                    type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
                }
                if (type != TokenType.WHITESPACE && type != TokenType.COMMENT) {
                    add(type, text, lineNo, pos + 1);
                }
                end = m.end();
                break;
            }

            if (end == -1) {
                throw new LexerException("Unexpected character: '" + line.charAt(pos) + "'", lineNo, pos + 1);
            }
            pos = end;
        }
    }

    private void add(TokenType type, String lexeme, int line, int col) {
        tokens.add(new Token(type, lexeme, line, col));
    }
}
