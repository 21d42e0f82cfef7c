package org.refactor.flowchart.ast;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.refactor.flowchart.ast.Expression.*;
import org.refactor.flowchart.ast.Statement.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 读取 JSON 形式的语法树（Python ast 的 JSON 转储：每个节点带 "_type" 和标准字段名），
 * 转成 {@link Module}。
 * <p>
 * 不认识的语句变成 {@link Unsupported}，不认识的表达式变成 {@link Raw}；
 * 只有 JSON 本身损坏或结构缺失时才抛 {@link SyntaxTreeException}。
 */
public class SyntaxTreeReader {

    private static final Logger log = LoggerFactory.getLogger(SyntaxTreeReader.class);

    private static final Map<String, String> OPERATORS = Map.ofEntries(
            Map.entry("Add", "+"), Map.entry("Sub", "-"), Map.entry("Mult", "*"),
            Map.entry("MatMult", "@"), Map.entry("Div", "/"), Map.entry("FloorDiv", "//"),
            Map.entry("Mod", "%"), Map.entry("Pow", "**"), Map.entry("LShift", "<<"),
            Map.entry("RShift", ">>"), Map.entry("BitOr", "|"), Map.entry("BitXor", "^"),
            Map.entry("BitAnd", "&"),
            Map.entry("Eq", "=="), Map.entry("NotEq", "!="), Map.entry("Lt", "<"),
            Map.entry("LtE", "<="), Map.entry("Gt", ">"), Map.entry("GtE", ">="),
            Map.entry("Is", "is"), Map.entry("IsNot", "is not"), Map.entry("In", "in"),
            Map.entry("NotIn", "not in"),
            Map.entry("And", "and"), Map.entry("Or", "or"),
            Map.entry("Not", "not"), Map.entry("USub", "-"), Map.entry("UAdd", "+"),
            Map.entry("Invert", "~")
    );

    public Module read(String json) throws SyntaxTreeException {
        if (json == null || json.isBlank()) {
            throw new SyntaxTreeException("Empty syntax tree");
        }
        try {
            return readModule(JsonParser.parseString(json));
        } catch (JsonParseException | IllegalStateException e) {
            throw new SyntaxTreeException("Malformed syntax tree JSON: " + e.getMessage(), e);
        }
    }

    public Module read(Reader reader) throws SyntaxTreeException, IOException {
        try {
            return readModule(JsonParser.parseReader(reader));
        } catch (JsonParseException | IllegalStateException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new SyntaxTreeException("Malformed syntax tree JSON: " + e.getMessage(), e);
        }
    }

    private Module readModule(JsonElement root) throws SyntaxTreeException {
        if (root == null || !root.isJsonObject()) {
            throw new SyntaxTreeException("Syntax tree root must be a JSON object");
        }
        JsonObject object = root.getAsJsonObject();
        String type = typeOf(object);
        if (!"Module".equals(type)) {
            throw new SyntaxTreeException("Syntax tree root must be a Module, got " + type);
        }
        Module module = new Module(statements(object, "body"));
        log.debug("Read module with {} top-level statements", module.body().size());
        return module;
    }

    // ===== 语句 =====

    private List<Statement> statements(JsonObject parent, String field) throws SyntaxTreeException {
        List<Statement> result = new ArrayList<>();
        for (JsonObject child : objects(parent, field)) {
            Statement statement = statement(child);
            if (statement != null) {
                result.add(statement);
            }
        }
        return result;
    }

    private Statement statement(JsonObject node) throws SyntaxTreeException {
        String type = typeOf(node);
        int line = intField(node, "lineno");
        switch (type) {
            case "If":
                return new If(line, expression(node, "test"), statements(node, "body"), statements(node, "orelse"));
            case "For":
            case "AsyncFor":
                return new For(line, expression(node, "target"), expression(node, "iter"),
                        statements(node, "body"), statements(node, "orelse"));
            case "While":
                return new While(line, expression(node, "test"), statements(node, "body"), statements(node, "orelse"));
            case "FunctionDef":
            case "AsyncFunctionDef":
                return new FunctionDef(line, string(node, "name", "<anonymous>"), params(node), statements(node, "body"));
            case "ClassDef":
                return new ClassDef(line, string(node, "name", "<anonymous>"), expressions(node, "bases"),
                        statements(node, "body"));
            case "Assign":
                return new Assign(line, expressions(node, "targets"), expressionOrRaw(node, "value"));
            case "AnnAssign":
                if (isNull(node, "value")) {
                    return new ExpressionStatement(line, expressionOrRaw(node, "target"));
                }
                return new Assign(line, List.of(expressionOrRaw(node, "target")), expressionOrRaw(node, "value"));
            case "AugAssign":
                return new AugAssign(line, expressionOrRaw(node, "target"), operator(node, "op"),
                        expressionOrRaw(node, "value"));
            case "Expr":
                return new ExpressionStatement(line, expressionOrRaw(node, "value"));
            case "Return":
                return new Return(line, expression(node, "value"));
            case "Break":
                return new Break(line);
            case "Continue":
                return new Continue(line);
            case "Try":
            case "TryStar":
                return new Try(line, statements(node, "body"), handlers(node), statements(node, "orelse"),
                        statements(node, "finalbody"));
            case "Raise":
                return new Raise(line, expression(node, "exc"), expression(node, "cause"));
            case "With":
            case "AsyncWith":
                return new With(line, withItems(node), statements(node, "body"));
            case "Assert":
                return new Assert(line, expressionOrRaw(node, "test"), expression(node, "msg"));
            case "Pass":
                return new Pass(line);
            case "Import":
                return new Import(line, aliases(node));
            case "ImportFrom":
                return new ImportFrom(line, string(node, "module", null), aliases(node));
            default:
                log.debug("Unsupported statement type {} at line {}", type, line);
                return new Unsupported(line, type);
        }
    }

    private List<String> params(JsonObject functionNode) throws SyntaxTreeException {
        List<String> params = new ArrayList<>();
        JsonElement args = functionNode.get("args");
        if (args == null || !args.isJsonObject()) {
            return params;
        }
        JsonObject arguments = args.getAsJsonObject();
        for (String field : List.of("posonlyargs", "args")) {
            for (JsonObject arg : objects(arguments, field)) {
                params.add(string(arg, "arg", "_"));
            }
        }
        return params;
    }

    private List<ExceptHandler> handlers(JsonObject tryNode) throws SyntaxTreeException {
        List<ExceptHandler> handlers = new ArrayList<>();
        for (JsonObject handler : objects(tryNode, "handlers")) {
            handlers.add(new ExceptHandler(expression(handler, "type"), string(handler, "name", null),
                    statements(handler, "body")));
        }
        return handlers;
    }

    private List<WithItem> withItems(JsonObject withNode) throws SyntaxTreeException {
        List<WithItem> items = new ArrayList<>();
        for (JsonObject item : objects(withNode, "items")) {
            items.add(new WithItem(expressionOrRaw(item, "context_expr"), expression(item, "optional_vars")));
        }
        return items;
    }

    private List<ImportAlias> aliases(JsonObject importNode) throws SyntaxTreeException {
        List<ImportAlias> aliases = new ArrayList<>();
        for (JsonObject alias : objects(importNode, "names")) {
            aliases.add(new ImportAlias(string(alias, "name", "*"), string(alias, "asname", null)));
        }
        return aliases;
    }

    // ===== 表达式 =====

    private Expression expression(JsonObject parent, String field) throws SyntaxTreeException {
        JsonElement element = parent.get(field);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonObject()) {
            throw new SyntaxTreeException("Field '" + field + "' must be an AST object");
        }
        return expression(element.getAsJsonObject());
    }

    private Expression expressionOrRaw(JsonObject parent, String field) throws SyntaxTreeException {
        Expression expression = expression(parent, field);
        return expression != null ? expression : new Raw("");
    }

    private List<Expression> expressions(JsonObject parent, String field) throws SyntaxTreeException {
        List<Expression> result = new ArrayList<>();
        for (JsonObject child : objects(parent, field)) {
            result.add(expression(child));
        }
        return result;
    }

    private Expression expression(JsonObject node) throws SyntaxTreeException {
        String type = typeOf(node);
        switch (type) {
            case "Name":
                return new Name(string(node, "id", "_"));
            case "Attribute":
                return new Attribute(expressionOrRaw(node, "value"), string(node, "attr", "_"));
            case "Call":
                return new Call(expressionOrRaw(node, "func"), expressions(node, "args"), keywords(node));
            case "Constant":
                return new Constant(constant(node.get("value")));
            case "BinOp":
                return new BinaryOp(expressionOrRaw(node, "left"), operator(node, "op"), expressionOrRaw(node, "right"));
            case "BoolOp":
                return new BoolOp(operator(node, "op"), expressions(node, "values"));
            case "UnaryOp":
                return new UnaryOp(operator(node, "op"), expressionOrRaw(node, "operand"));
            case "Compare":
                return new Compare(expressionOrRaw(node, "left"), operators(node, "ops"), expressions(node, "comparators"));
            case "Subscript":
                return new Subscript(expressionOrRaw(node, "value"), expressionOrRaw(node, "slice"));
            case "List":
                return new Collection(CollectionKind.LIST, expressions(node, "elts"));
            case "Tuple":
                return new Collection(CollectionKind.TUPLE, expressions(node, "elts"));
            case "Set":
                return new Collection(CollectionKind.SET, expressions(node, "elts"));
            case "Dict":
                return new DictLiteral(nullableExpressions(node, "keys"), expressions(node, "values"));
            case "Lambda":
                return new Lambda(params(node), expressionOrRaw(node, "body"));
            case "ListComp":
                return comprehension(node, ComprehensionKind.LIST);
            case "SetComp":
                return comprehension(node, ComprehensionKind.SET);
            case "GeneratorExp":
                return comprehension(node, ComprehensionKind.GENERATOR);
            case "DictComp":
                return new Comprehension(ComprehensionKind.DICT, expressionOrRaw(node, "key"),
                        expressionOrRaw(node, "value"), generators(node));
            case "JoinedStr":
                return new FormattedString(expressions(node, "values"));
            case "FormattedValue":
                return new FormattedValue(expressionOrRaw(node, "value"));
            case "IfExp":
                return new Conditional(expressionOrRaw(node, "test"), expressionOrRaw(node, "body"),
                        expressionOrRaw(node, "orelse"));
            case "Starred":
                return new Starred(expressionOrRaw(node, "value"));
            default:
                return new Raw(string(node, "source", "<" + type + ">"));
        }
    }

    private Comprehension comprehension(JsonObject node, ComprehensionKind kind) throws SyntaxTreeException {
        return new Comprehension(kind, null, expressionOrRaw(node, "elt"), generators(node));
    }

    private List<Generator> generators(JsonObject node) throws SyntaxTreeException {
        List<Generator> generators = new ArrayList<>();
        for (JsonObject generator : objects(node, "generators")) {
            generators.add(new Generator(expressionOrRaw(generator, "target"), expressionOrRaw(generator, "iter"),
                    expressions(generator, "ifs")));
        }
        return generators;
    }

    private List<Keyword> keywords(JsonObject call) throws SyntaxTreeException {
        List<Keyword> keywords = new ArrayList<>();
        for (JsonObject keyword : objects(call, "keywords")) {
            keywords.add(new Keyword(string(keyword, "arg", null), expressionOrRaw(keyword, "value")));
        }
        return keywords;
    }

    private List<Expression> nullableExpressions(JsonObject parent, String field) throws SyntaxTreeException {
        List<Expression> result = new ArrayList<>();
        JsonArray array = array(parent, field);
        for (JsonElement element : array) {
            if (element.isJsonNull()) {
                result.add(null);
            } else if (element.isJsonObject()) {
                result.add(expression(element.getAsJsonObject()));
            } else {
                throw new SyntaxTreeException("Field '" + field + "' must contain AST objects");
            }
        }
        return result;
    }

    private List<String> operators(JsonObject node, String field) throws SyntaxTreeException {
        List<String> operators = new ArrayList<>();
        for (JsonObject op : objects(node, field)) {
            operators.add(OPERATORS.getOrDefault(typeOf(op), typeOf(op)));
        }
        return operators;
    }

    private String operator(JsonObject node, String field) throws SyntaxTreeException {
        JsonElement element = node.get(field);
        if (element == null || !element.isJsonObject()) {
            return "?";
        }
        String type = typeOf(element.getAsJsonObject());
        return OPERATORS.getOrDefault(type, type);
    }

    private static Object constant(JsonElement value) {
        if (value == null || value.isJsonNull()) {
            return null;
        }
        if (!value.isJsonPrimitive()) {
            return value.toString();
        }
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            BigDecimal number = primitive.getAsBigDecimal();
            String text = primitive.getAsString();
            if (text.contains(".") || text.contains("e") || text.contains("E")) {
                return number.doubleValue();
            }
            BigInteger integer = number.toBigInteger();
            return integer.bitLength() < 64 ? (Object) integer.longValue() : integer;
        }
        return primitive.getAsString();
    }

    // ===== JSON 辅助 =====

    private static String typeOf(JsonObject node) throws SyntaxTreeException {
        JsonElement type = node.get("_type");
        if (type == null || !type.isJsonPrimitive()) {
            throw new SyntaxTreeException("AST node without _type: " + abbreviate(node));
        }
        return type.getAsString();
    }

    private static List<JsonObject> objects(JsonObject parent, String field) throws SyntaxTreeException {
        List<JsonObject> result = new ArrayList<>();
        for (JsonElement element : array(parent, field)) {
            if (!element.isJsonObject()) {
                throw new SyntaxTreeException("Field '" + field + "' must contain AST objects");
            }
            result.add(element.getAsJsonObject());
        }
        return result;
    }

    private static JsonArray array(JsonObject parent, String field) throws SyntaxTreeException {
        JsonElement element = parent.get(field);
        if (element == null || element.isJsonNull()) {
            return new JsonArray();
        }
        if (!element.isJsonArray()) {
            throw new SyntaxTreeException("Field '" + field + "' must be an array");
        }
        return element.getAsJsonArray();
    }

    private static boolean isNull(JsonObject node, String field) {
        JsonElement element = node.get(field);
        return element == null || element.isJsonNull();
    }

    private static String string(JsonObject node, String field, String fallback) {
        JsonElement element = node.get(field);
        return element != null && element.isJsonPrimitive() ? element.getAsString() : fallback;
    }

    private static int intField(JsonObject node, String field) {
        JsonElement element = node.get(field);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            return 0;
        }
        return element.getAsInt();
    }

    private static String abbreviate(JsonObject node) {
        return abbreviate(node, JsonElement::toString);
    }

    private static <T> String abbreviate(T value, Function<T, String> toText) {
        String text = toText.apply(value);
        return text.length() > 60 ? text.substring(0, 57) + "..." : text;
    }
}
