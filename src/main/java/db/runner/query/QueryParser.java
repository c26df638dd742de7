package db.runner.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parser for the pipeline form:
 *   FROM <source> [SELECT <c1,c2,...> | TAKE <n> | ORDERBY <col> | COUNTBY <col> | JOIN <source> <col>]...
 * Tokens are separated by whitespace. Keywords are case-sensitive and may not be used as arguments.
 * Error messages name the 1-based position of the offending clause token.
 */
public class QueryParser {
    static final Set<String> KEYWORDS = Set.of("FROM", "SELECT", "TAKE", "ORDERBY", "COUNTBY", "JOIN");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");

    public List<Step> parse(String query) {
        List<String> tokens = tokenize(query);
        if (tokens.isEmpty()) throw new QueryParseException("No query entered", 0);
        if (!tokens.get(0).equals("FROM")) throw new QueryParseException("Missing data source", 1);

        List<Step> steps = new ArrayList<>();
        int i = 0;
        while (i < tokens.size()) {
            String keyword = tokens.get(i);
            int pos = i + 1;
            if (!KEYWORDS.contains(keyword)) {
                throw new QueryParseException("Invalid input at token " + pos, pos);
            }
            if (keyword.equals("FROM") && i > 0) {
                throw new QueryParseException("Unexpected FROM at token " + pos, pos);
            }
            if (keyword.equals("JOIN")) {
                String source = argument(tokens, i + 1);
                String column = argument(tokens, i + 2);
                if (source == null || column == null) {
                    throw new QueryParseException("Missing JOIN argument at token " + pos, pos);
                }
                steps.add(new JoinStep(source, column));
                i += 3;
                continue;
            }
            String arg = argument(tokens, i + 1);
            if (arg == null) throw new QueryParseException("Missing " + keyword + " argument at token " + pos, pos);
            steps.add(switch (keyword) {
                case "FROM" -> new SourceStep(arg);
                case "SELECT" -> new ProjectStep(parseColumns(arg, pos));
                case "TAKE" -> new LimitStep(parseCount(arg, pos));
                case "ORDERBY" -> new SortStep(arg);
                case "COUNTBY" -> new GroupCountStep(arg);
                default -> throw new IllegalStateException("Unhandled keyword: " + keyword);
            });
            i += 2;
        }
        return steps;
    }

    private List<String> tokenize(String query) {
        if (query == null) return List.of();
        String trimmed = query.trim();
        if (trimmed.isEmpty()) return List.of();
        return List.of(WHITESPACE.split(trimmed));
    }

    // Argument token at index, or null when missing or a keyword
    private String argument(List<String> tokens, int index) {
        if (index >= tokens.size()) return null;
        String t = tokens.get(index);
        return KEYWORDS.contains(t) ? null : t;
    }

    private List<String> parseColumns(String raw, int pos) {
        List<String> columns = new ArrayList<>();
        for (String c : raw.split(",", -1)) {
            if (c.isEmpty()) throw new QueryParseException("Empty column name in SELECT at token " + pos, pos);
            columns.add(c);
        }
        return columns;
    }

    private int parseCount(String raw, int pos) {
        if (!INTEGER.matcher(raw).matches()) {
            throw new QueryParseException("TAKE requires integer input at token " + pos, pos);
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new QueryParseException("TAKE requires integer input at token " + pos, pos);
        }
    }
}
