package work.lcod.liquid.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.lcod.liquid.ast.ArgumentExpression;
import work.lcod.liquid.ast.AssignStatement;
import work.lcod.liquid.ast.BinaryExpression;
import work.lcod.liquid.ast.BinaryOperator;
import work.lcod.liquid.ast.BreakStatement;
import work.lcod.liquid.ast.CaptureStatement;
import work.lcod.liquid.ast.CommentStatement;
import work.lcod.liquid.ast.ContinueStatement;
import work.lcod.liquid.ast.ElseIfBranch;
import work.lcod.liquid.ast.Expression;
import work.lcod.liquid.ast.FilterExpression;
import work.lcod.liquid.ast.ForStatement;
import work.lcod.liquid.ast.FunctionCallSegment;
import work.lcod.liquid.ast.IdentifierSegment;
import work.lcod.liquid.ast.IfStatement;
import work.lcod.liquid.ast.IndexerSegment;
import work.lcod.liquid.ast.LiteralExpression;
import work.lcod.liquid.ast.MacroParameter;
import work.lcod.liquid.ast.MacroStatement;
import work.lcod.liquid.ast.MemberExpression;
import work.lcod.liquid.ast.MemberSegment;
import work.lcod.liquid.ast.OutputStatement;
import work.lcod.liquid.ast.RangeExpression;
import work.lcod.liquid.ast.Statement;
import work.lcod.liquid.ast.TextSpanStatement;
import work.lcod.liquid.flow.MalformedTemplateException;
import work.lcod.liquid.runtime.InterpretedTemplate;
import work.lcod.liquid.values.BlankValue;
import work.lcod.liquid.values.EmptyValue;
import work.lcod.liquid.values.NilValue;
import work.lcod.liquid.values.Value;
import work.lcod.liquid.values.Values;

/**
 * Reads template trees from YAML or JSON documents holding a {@code template} list of
 * statements.
 */
public final class TemplateLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private TemplateLoader() {}

    public static InterpretedTemplate loadFromFile(Path path) {
        var mapper = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
        try (var in = Files.newInputStream(path)) {
            return parse(mapper.readTree(in));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read template: " + path, ex);
        }
    }

    public static InterpretedTemplate load(InputStream in) {
        try {
            return parse(YAML_MAPPER.readTree(in));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read template", ex);
        }
    }

    public static InterpretedTemplate parse(String document) {
        try {
            return parse(YAML_MAPPER.readTree(document));
        } catch (IOException ex) {
            throw new MalformedTemplateException("Invalid template document: " + ex.getMessage());
        }
    }

    private static InterpretedTemplate parse(JsonNode root) {
        if (root == null || !root.hasNonNull("template")) {
            throw new MalformedTemplateException("Template document must contain a 'template' list");
        }
        return new InterpretedTemplate(statements(root.get("template"), "template"));
    }

    private static List<Statement> statements(JsonNode node, String where) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new MalformedTemplateException(where + " must be a list of statements");
        }
        var list = new ArrayList<Statement>();
        for (var item : node) {
            list.add(statement(item));
        }
        return list;
    }

    private static Statement statement(JsonNode node) {
        if (node.isTextual()) {
            return switch (node.asText()) {
                case "break" -> BreakStatement.INSTANCE;
                case "continue" -> ContinueStatement.INSTANCE;
                default -> throw new MalformedTemplateException("Unknown statement: " + node.asText());
            };
        }
        var entry = single(node, "statement");
        var key = entry.getKey();
        var body = entry.getValue();
        return switch (key) {
            case "text" -> text(body);
            case "output" -> new OutputStatement(expression(body));
            case "for" -> forLoop(body);
            case "if" -> ifStatement(body);
            case "macro" -> macro(body);
            case "assign" -> new AssignStatement(requiredText(body, "name", key), expression(required(body, "value", key)));
            case "capture" -> new CaptureStatement(requiredText(body, "name", key), statements(body.get("body"), key));
            case "comment" -> new CommentStatement(body.isTextual() ? body.asText() : "");
            case "break" -> BreakStatement.INSTANCE;
            case "continue" -> ContinueStatement.INSTANCE;
            default -> throw new MalformedTemplateException("Unknown statement: " + key);
        };
    }

    private static TextSpanStatement text(JsonNode node) {
        if (node.isTextual()) {
            return new TextSpanStatement(node.asText());
        }
        if (!node.isObject()) {
            throw new MalformedTemplateException("text must be a string or an object");
        }
        return new TextSpanStatement(
            requiredText(node, "value", "text"),
            node.path("stripLeft").asBoolean(false),
            node.path("stripRight").asBoolean(false)
        );
    }

    private static ForStatement forLoop(JsonNode node) {
        return new ForStatement(
            requiredText(node, "var", "for"),
            expression(required(node, "in", "for")),
            statements(node.get("body"), "for"),
            statements(node.get("else"), "for"),
            optionalExpression(node.get("limit")),
            optionalExpression(node.get("offset")),
            node.path("reversed").asBoolean(false)
        );
    }

    private static IfStatement ifStatement(JsonNode node) {
        var branches = new ArrayList<ElseIfBranch>();
        var elseIfs = node.get("elseif");
        if (elseIfs != null && elseIfs.isArray()) {
            for (var branch : elseIfs) {
                branches.add(new ElseIfBranch(
                    expression(required(branch, "condition", "elseif")),
                    statements(branch.get("body"), "elseif")
                ));
            }
        }
        return new IfStatement(
            expression(required(node, "condition", "if")),
            statements(node.get("body"), "if"),
            branches,
            statements(node.get("else"), "if")
        );
    }

    private static MacroStatement macro(JsonNode node) {
        var parameters = new ArrayList<MacroParameter>();
        var declared = node.get("parameters");
        if (declared != null && declared.isArray()) {
            for (var parameter : declared) {
                if (parameter.isTextual()) {
                    parameters.add(MacroParameter.of(parameter.asText()));
                } else {
                    parameters.add(new MacroParameter(
                        requiredText(parameter, "name", "macro parameter"),
                        optionalExpression(parameter.get("default"))
                    ));
                }
            }
        }
        return new MacroStatement(requiredText(node, "name", "macro"), parameters, statements(node.get("body"), "macro"));
    }

    private static Expression optionalExpression(JsonNode node) {
        return node == null || node.isNull() ? null : expression(node);
    }

    private static Expression expression(JsonNode node) {
        var entry = single(node, "expression");
        var key = entry.getKey();
        var body = entry.getValue();
        return switch (key) {
            case "literal" -> new LiteralExpression(literal(body));
            case "nil" -> new LiteralExpression(NilValue.INSTANCE);
            case "blank" -> new LiteralExpression(BlankValue.INSTANCE);
            case "empty" -> new LiteralExpression(EmptyValue.INSTANCE);
            case "member" -> member(body);
            case "range" -> new RangeExpression(expression(required(body, "from", key)), expression(required(body, "to", key)));
            case "filter" -> new FilterExpression(
                expression(required(body, "input", key)),
                requiredText(body, "name", key),
                arguments(body.get("args"))
            );
            case "binary" -> binary(body);
            default -> throw new MalformedTemplateException("Unknown expression: " + key);
        };
    }

    private static BinaryExpression binary(JsonNode node) {
        var symbol = requiredText(node, "op", "binary");
        BinaryOperator operator;
        try {
            operator = BinaryOperator.from(symbol);
        } catch (IllegalArgumentException ex) {
            throw new MalformedTemplateException(ex.getMessage());
        }
        boolean strict = node.has("strict") ? node.get("strict").asBoolean() : BinaryOperator.isStrictSymbol(symbol);
        return new BinaryExpression(
            operator,
            expression(required(node, "left", "binary")),
            expression(required(node, "right", "binary")),
            strict
        );
    }

    private static MemberExpression member(JsonNode node) {
        var segments = new ArrayList<MemberSegment>();
        if (node.isTextual()) {
            for (var part : node.asText().split("\\.")) {
                if (part.isEmpty()) {
                    throw new MalformedTemplateException("Empty member segment in '" + node.asText() + "'");
                }
                segments.add(new IdentifierSegment(part));
            }
            return new MemberExpression(segments);
        }
        if (!node.isArray()) {
            throw new MalformedTemplateException("member must be a dotted string or a list of segments");
        }
        for (var segment : node) {
            if (segment.isTextual()) {
                segments.add(new IdentifierSegment(segment.asText()));
                continue;
            }
            var entry = single(segment, "member segment");
            switch (entry.getKey()) {
                case "index" -> segments.add(new IndexerSegment(expression(entry.getValue())));
                case "call" -> segments.add(new FunctionCallSegment(arguments(entry.getValue())));
                default -> throw new MalformedTemplateException("Unknown member segment: " + entry.getKey());
            }
        }
        return new MemberExpression(segments);
    }

    private static List<ArgumentExpression> arguments(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new MalformedTemplateException("arguments must be a list");
        }
        var arguments = new ArrayList<ArgumentExpression>();
        for (var argument : node) {
            if (argument.isObject() && argument.has("name") && argument.has("value")) {
                arguments.add(ArgumentExpression.named(argument.get("name").asText(), expression(argument.get("value"))));
            } else {
                arguments.add(ArgumentExpression.positional(expression(argument)));
            }
        }
        return arguments;
    }

    private static Value literal(JsonNode node) {
        return Values.create(convertNode(node), null);
    }

    private static Object convertNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    private static Map.Entry<String, JsonNode> single(JsonNode node, String what) {
        if (node == null || !node.isObject() || node.size() != 1) {
            throw new MalformedTemplateException("A " + what + " must be an object with exactly one key: " + node);
        }
        return node.fields().next();
    }

    private static JsonNode required(JsonNode node, String field, String owner) {
        if (node == null || !node.hasNonNull(field)) {
            throw new MalformedTemplateException(owner + " requires '" + field + "'");
        }
        return node.get(field);
    }

    private static String requiredText(JsonNode node, String field, String owner) {
        return required(node, field, owner).asText();
    }
}
