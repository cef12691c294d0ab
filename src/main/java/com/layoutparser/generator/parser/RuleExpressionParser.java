package com.layoutparser.generator.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.model.Rule;
import com.layoutparser.generator.model.expression.Concat;
import com.layoutparser.generator.model.expression.ConfigLookup;
import com.layoutparser.generator.model.expression.RuleArgument;
import com.layoutparser.generator.model.expression.RuleAssignment;
import com.layoutparser.generator.model.expression.RuleExpression;
import com.layoutparser.generator.model.expression.SourceReference;
import com.layoutparser.generator.model.expression.UnknownFunction;

/**
 * Parser for rule content.
 *
 * Statements are separated by {@code ;}. Supported forms:
 * - Function: T.infNFe/ide/cUF = GetConfig("cUF")
 * - Concat: T.infNFe/@Id = Concat("NFe", I.chave/chNFe)
 * - Copy: T.infNFe/ide/nNF = I.LINHA000/numero
 * - Reverse copy: I.LINHA000/numero = T.infNFe/ide/nNF
 */
public class RuleExpressionParser {
    private static final Logger log = LoggerFactory.getLogger(RuleExpressionParser.class);

    private static final Pattern CDATA_MARKERS = Pattern.compile("<!\\[CDATA\\[|\\]\\]>");
    private static final Pattern REGION_MARKERS = Pattern.compile("(?m)^\\s*#(?:end)?region\\b.*$");
    private static final Pattern LINE_COMMENTS = Pattern.compile("(?m)^\\s*//.*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern REVERSE_COPY = Pattern.compile(
            "^I\\.([^/\\s]+)/([^\\s=]+)\\s*=\\s*T\\.(\\S+)$");
    private static final Pattern FUNCTION_ASSIGNMENT = Pattern.compile(
            "^(?:T\\.)?([A-Za-z_@][^\\s=]*)\\s*=\\s*([A-Za-z_][\\w.]*)\\s*\\((.*)\\)$");
    private static final Pattern COPY_ASSIGNMENT = Pattern.compile(
            "^(?:T\\.)?([A-Za-z_@][^\\s=]*)\\s*=\\s*I\\.([^/\\s]+)/(\\S+)$");
    private static final Pattern SOURCE_ARGUMENT = Pattern.compile("^I\\.([^/\\s]+)/(\\S+)$");

    private static final Set<String> CONFIG_FUNCTIONS = Set.of("getconfig", "getconfigvalue", "config", "configvalue");
    private static final Set<String> CONCAT_FUNCTIONS = Set.of("concat", "string.concat", "strconcat");

    public RuleParseResult parse(List<Rule> rules) {
        RuleParseResult result = new RuleParseResult();

        for (Rule rule : rules.stream().sorted((a, b) -> Integer.compare(a.getSequence(), b.getSequence())).toList()) {
            String content = normalize(rule.getContent());
            if (content.isEmpty()) {
                continue;
            }

            int statementNum = 0;
            for (String statement : splitOutsideQuotes(content, ';')) {
                String trimmed = statement.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                statementNum++;
                try {
                    RuleAssignment assignment = parseStatement(trimmed, rule.getSequence(), result);
                    if (!result.addAssignment(assignment)) {
                        log.debug("Duplicate target {} in rule {}, keeping the first", assignment.getTargetPath(), rule.getName());
                    }
                } catch (IllegalArgumentException e) {
                    result.addWarning("Rule " + rule.getName() + " statement " + statementNum + ": " + e.getMessage());
                    log.warn("Failed to parse rule {} statement {}: {}", rule.getName(), statementNum, e.getMessage());
                }
            }
        }

        return result;
    }

    /**
     * Strips known begin/end markers and collapses whitespace.
     */
    String normalize(String content) {
        if (content == null) {
            return "";
        }
        String text = CDATA_MARKERS.matcher(content).replaceAll("");
        text = REGION_MARKERS.matcher(text).replaceAll("");
        text = LINE_COMMENTS.matcher(text).replaceAll("");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    private RuleAssignment parseStatement(String statement, int sequence, RuleParseResult result) {
        Matcher reverse = REVERSE_COPY.matcher(statement);
        if (reverse.matches()) {
            return new RuleAssignment(reverse.group(3), new SourceReference(reverse.group(1), reverse.group(2)), sequence);
        }

        Matcher copy = COPY_ASSIGNMENT.matcher(statement);
        if (copy.matches()) {
            return new RuleAssignment(copy.group(1), new SourceReference(copy.group(2), copy.group(3)), sequence);
        }

        Matcher function = FUNCTION_ASSIGNMENT.matcher(statement);
        if (function.matches()) {
            String target = function.group(1);
            RuleExpression expression = parseFunction(function.group(2), function.group(3), statement, target, result);
            log.debug("Parsed rule assignment: {} = {}", target, expression);
            return new RuleAssignment(target, expression, sequence);
        }

        throw new IllegalArgumentException("Invalid assignment format: " + statement);
    }

    private RuleExpression parseFunction(String name, String rawArgs, String statement, String target,
            RuleParseResult result) {
        List<RuleArgument> args = parseArguments(rawArgs);
        String key = name.toLowerCase(Locale.ROOT);

        if (CONFIG_FUNCTIONS.contains(key) && args.size() == 1) {
            return new ConfigLookup(args.get(0).getValue());
        }
        if (CONCAT_FUNCTIONS.contains(key)) {
            if (args.size() == 2) {
                return new Concat(args.get(0), args.get(1));
            }
            result.addWarning("Concat for " + target + " expects two arguments, got " + args.size());
        }
        return new UnknownFunction(name, statement);
    }

    private List<RuleArgument> parseArguments(String rawArgs) {
        List<RuleArgument> args = new ArrayList<>();
        if (rawArgs == null || rawArgs.isBlank()) {
            return args;
        }
        for (String raw : splitOutsideQuotes(rawArgs, ',')) {
            String arg = raw.trim();
            if (arg.length() >= 2 && isQuote(arg.charAt(0)) && arg.charAt(arg.length() - 1) == arg.charAt(0)) {
                args.add(RuleArgument.literal(arg.substring(1, arg.length() - 1)));
                continue;
            }
            Matcher source = SOURCE_ARGUMENT.matcher(arg);
            if (source.matches()) {
                args.add(RuleArgument.source(source.group(1) + "/" + source.group(2)));
            } else {
                args.add(RuleArgument.literal(arg));
            }
        }
        return args;
    }

    private static List<String> splitOutsideQuotes(String text, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (char c : text.toCharArray()) {
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                current.append(c);
            } else if (isQuote(c)) {
                quote = c;
                current.append(c);
            } else if (c == separator) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
