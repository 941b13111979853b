package org.zeno.compiler.backend;

import org.zeno.compiler.diagnostics.Messages;
import org.zeno.compiler.frontend.lexer.StringEscapes;
import org.zeno.compiler.frontend.module.NativeFunction;
import org.zeno.compiler.frontend.module.StandardLibrary;
import org.zeno.compiler.frontend.parser.ast.AssignmentStatement;
import org.zeno.compiler.frontend.parser.ast.BinaryExpression;
import org.zeno.compiler.frontend.parser.ast.BinaryOperator;
import org.zeno.compiler.frontend.parser.ast.Block;
import org.zeno.compiler.frontend.parser.ast.BooleanLiteral;
import org.zeno.compiler.frontend.parser.ast.Expression;
import org.zeno.compiler.frontend.parser.ast.ExpressionStatement;
import org.zeno.compiler.frontend.parser.ast.FloatLiteral;
import org.zeno.compiler.frontend.parser.ast.FunctionCall;
import org.zeno.compiler.frontend.parser.ast.FunctionDefinition;
import org.zeno.compiler.frontend.parser.ast.Identifier;
import org.zeno.compiler.frontend.parser.ast.IfStatement;
import org.zeno.compiler.frontend.parser.ast.ImportStatement;
import org.zeno.compiler.frontend.parser.ast.IntegerLiteral;
import org.zeno.compiler.frontend.parser.ast.LetDeclaration;
import org.zeno.compiler.frontend.parser.ast.Parameter;
import org.zeno.compiler.frontend.parser.ast.Precedence;
import org.zeno.compiler.frontend.parser.ast.ReturnStatement;
import org.zeno.compiler.frontend.parser.ast.Statement;
import org.zeno.compiler.frontend.parser.ast.StringLiteral;
import org.zeno.compiler.frontend.parser.ast.UnaryExpression;
import org.zeno.compiler.frontend.parser.ast.UnaryOperator;
import org.zeno.compiler.frontend.parser.ast.WhileStatement;
import org.zeno.compiler.frontend.semantics.SemanticAnalyzer;
import org.zeno.compiler.frontend.semantics.Symbol;
import org.zeno.compiler.frontend.semantics.SymbolTable;
import org.zeno.compiler.model.Token;
import org.zeno.compiler.model.ZenoType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates the functions and top-level statements of one Zeno file into Java class members.
 * The callable names visible in the file (its own functions and its imports) are resolved by
 * {@link JavaGenerator} beforehand.
 */
final class UnitGenerator {

    static final String RUNTIME_CLASS = "ZenoRuntime";
    static final String MAIN_ARGUMENTS = "programArguments$";

    /**
     * A translated expression.
     *
     * @param text The Java source text.
     * @param type The statically known Zeno type, or {@link ZenoType#UNRESOLVED}.
     * @param constant The value when javac treats the text as a constant expression, otherwise null.
     */
    record Code(String text, ZenoType type, Object constant) {

        Code(String text, ZenoType type) {
            this(text, type, null);
        }
    }

    /**
     * A translated condition.
     *
     * @param text     The Java boolean expression.
     * @param constant The value of the condition when javac treats it as a constant expression,
     *                 otherwise null.
     */
    private record Condition(String text, Boolean constant) {}

    private final List<Statement> topLevel;
    private final List<FunctionDefinition> functions;
    private final Map<String, CallTarget> callables;
    private final Map<Symbol, Object> constants = new HashMap<>();

    private SymbolTable symbols;
    private FunctionDefinition currentFunction;
    private boolean inMain;
    private int discarded;

    UnitGenerator(List<Statement> statements, Map<String, CallTarget> callables) {
        this.callables = callables;
        this.topLevel = new ArrayList<>();
        this.functions = new ArrayList<>();
        for (Statement statement : statements) {
            if (statement instanceof FunctionDefinition fn) {
                functions.add(fn);
            } else if (!(statement instanceof ImportStatement)) {
                topLevel.add(statement);
            }
        }
    }

    /**
     * Emits the members of the program's entry class: every function as a static method and a
     * {@code main} method that runs the top-level statements followed by the body of the Zeno
     * {@code main} function, if there is one.
     */
    void emitEntryMembers(CodeWriter out) {
        boolean hasMain = false;
        for (FunctionDefinition fn : functions) {
            out.blank();
            if ("main".equals(fn.name().text())) {
                hasMain = true;
                emitMain(out, fn);
            } else {
                emitFunction(out, fn);
            }
        }
        if (!hasMain) {
            out.blank();
            emitMain(out, null);
        }
    }

    /**
     * Emits the members of an imported module's class. Top-level statements run in a static
     * initializer when the module is first used.
     */
    void emitModuleMembers(CodeWriter out) {
        if (!topLevel.isEmpty()) {
            out.blank();
            out.line("static {");
            out.indent();
            beginScope(null, false);
            for (Statement statement : topLevel) {
                if (!statement(out, statement)) {
                    throw new GenerationException(Messages.ENDLESS_INITIALIZER, statement.token());
                }
            }
            out.dedent();
            out.line("}");
        }
        for (FunctionDefinition fn : functions) {
            out.blank();
            emitFunction(out, fn);
        }
    }

    // === Functions ===

    private void emitFunction(CodeWriter out, FunctionDefinition fn) {
        beginScope(fn, false);
        List<String> params = new ArrayList<>();
        for (Parameter parameter : fn.parameters()) {
            ZenoType type = JavaTypes.resolve(parameter.type());
            String javaType = JavaTypes.javaName(type) + (parameter.variadic() ? "..." : "");
            params.add(javaType + " " + JavaNames.identifier(parameter.name().text()));
            defineLocal(new Symbol(parameter.name(), Symbol.Kind.PARAMETER,
                    parameter.variadic() ? ZenoType.UNRESOLVED : type, false));
        }
        String returnType = fn.returnType() == null ? "void" : JavaTypes.javaName(JavaTypes.resolve(fn.returnType()));
        String visibility = fn.isPublic() ? "public" : "private";

        out.line(visibility + " static " + returnType + " " + JavaNames.identifier(fn.name().text())
                + "(" + String.join(", ", params) + ") {");
        out.indent();
        if (body(out, fn.body()) && fn.returnType() != null) {
            throw new GenerationException(Messages.MISSING_RETURN, fn.name(), fn.name().text());
        }
        out.dedent();
        out.line("}");
    }

    private void emitMain(CodeWriter out, FunctionDefinition fn) {
        if (fn != null && !fn.parameters().isEmpty()) {
            throw new GenerationException(Messages.MAIN_PARAMETERS, fn.name());
        }
        beginScope(fn, true);
        out.line("public static void main(String[] " + MAIN_ARGUMENTS + ") {");
        out.indent();
        boolean completes = statements(out, topLevel);
        if (fn != null) {
            body(completes ? out : new CodeWriter(0), fn.body());
        }
        out.dedent();
        out.line("}");
    }

    private void beginScope(FunctionDefinition fn, boolean main) {
        symbols = new SymbolTable();
        symbols.enterScope();
        currentFunction = fn;
        inMain = main;
    }

    /**
     * @return whether control can reach the end of the block.
     */
    private boolean body(CodeWriter out, Block block) {
        symbols.enterScope();
        boolean completes = statements(out, block.statements());
        symbols.leaveScope();
        return completes;
    }

    /**
     * Emits statements up to the first one that cannot complete normally. The unreachable rest
     * is still checked but not emitted, since javac rejects unreachable statements.
     */
    private boolean statements(CodeWriter out, List<Statement> statements) {
        boolean completes = true;
        for (Statement statement : statements) {
            boolean reachable = completes;
            completes = statement(reachable ? out : new CodeWriter(0), statement) && reachable;
        }
        return completes;
    }

    // === Statements ===

    /**
     * @return whether control can continue after the statement, following the reachability
     *         rules javac applies to the emitted code.
     */
    private boolean statement(CodeWriter out, Statement statement) {
        if (statement instanceof LetDeclaration let) {
            let(out, let);
        } else if (statement instanceof AssignmentStatement assign) {
            assignment(out, assign);
        } else if (statement instanceof ReturnStatement ret) {
            returnStatement(out, ret);
            return false;
        } else if (statement instanceof ExpressionStatement expr) {
            if (!(expr.expression() instanceof FunctionCall call)) {
                throw new GenerationException(Messages.UNUSED_EXPRESSION, expr.token());
            }
            out.line(call(call).text() + ";");
        } else if (statement instanceof IfStatement ifs) {
            boolean completes = ifStatement(out, ifs, "if");
            out.line("}");
            return completes;
        } else if (statement instanceof WhileStatement loop) {
            return whileStatement(out, loop);
        } else if (statement instanceof Block block) {
            out.line("{");
            out.indent();
            boolean completes = body(out, block);
            out.dedent();
            out.line("}");
            return completes;
        } else if (statement instanceof FunctionDefinition fn) {
            throw new GenerationException(Messages.NESTED_DECLARATION, fn.token(), "fn");
        } else if (statement instanceof ImportStatement imp) {
            throw new GenerationException(Messages.NESTED_DECLARATION, imp.token(), "import");
        }
        return true;
    }

    private void let(CodeWriter out, LetDeclaration let) {
        ZenoType declared = JavaTypes.resolve(let.type());
        Code value = expression(let.value());
        String modifier = let.mutable() ? "" : "final ";

        if ("_".equals(let.name().text())) {
            out.line(modifier + "var _discard" + (++discarded) + " = " + value.text() + ";");
            return;
        }

        ZenoType type = declared != ZenoType.UNRESOLVED ? declared : value.type();
        Symbol symbol = new Symbol(let.name(), Symbol.Kind.VARIABLE, type, let.mutable());
        defineLocal(symbol);
        if (!let.mutable() && value.constant() != null) {
            // A final primitive initialized from a constant is a constant variable to javac.
            Object constant = type == ZenoType.FLOAT && value.constant() instanceof Long l
                    ? (Object) l.doubleValue() : value.constant();
            if (type.isPrimitive()) {
                constants.put(symbol, constant);
            }
        }
        out.line(modifier + JavaTypes.javaName(type) + " " + JavaNames.identifier(let.name().text())
                + " = " + coerce(value, type) + ";");
    }

    private void assignment(CodeWriter out, AssignmentStatement assign) {
        String name = assign.name().text();
        Symbol target = symbols.resolve(name)
                .orElseThrow(() -> new GenerationException(Messages.ASSIGN_TO_UNDECLARED, assign.name(), name));
        if (target.kind() != Symbol.Kind.VARIABLE || !target.mutable()) {
            throw new GenerationException(Messages.ASSIGN_TO_IMMUTABLE, assign.name(), name);
        }
        Code value = expression(assign.value());
        out.line(JavaNames.identifier(name) + " = " + coerce(value, target.type()) + ";");
    }

    private void returnStatement(CodeWriter out, ReturnStatement ret) {
        if (!inMain && currentFunction == null) {
            throw new GenerationException(Messages.NESTED_DECLARATION, ret.token(), "return");
        }
        if (ret.value() == null) {
            out.line("return;");
            return;
        }
        Code value = expression(ret.value());
        if (inMain) {
            // A value returned from main becomes the process exit code.
            out.line(RUNTIME_CLASS + ".exit(" + value.text() + ");");
            return;
        }
        if (currentFunction.returnType() == null) {
            throw new GenerationException(Messages.RETURN_TYPE_REQUIRED, ret.token(), currentFunction.name().text());
        }
        out.line("return " + coerce(value, JavaTypes.resolve(currentFunction.returnType())) + ";");
    }

    private boolean ifStatement(CodeWriter out, IfStatement ifs, String keyword) {
        out.line(keyword + " (" + condition(ifs.condition()).text() + ") {");
        out.indent();
        boolean completes = body(out, ifs.consequence());
        out.dedent();
        if (ifs.alternative() instanceof IfStatement nested) {
            return ifStatement(out, nested, "} else if") || completes;
        } else if (ifs.alternative() instanceof Block block) {
            out.line("} else {");
            out.indent();
            completes |= body(out, block);
            out.dedent();
            return completes;
        }
        return true;
    }

    /**
     * A loop on a constant true condition never finishes, as Zeno has no {@code break}. A loop
     * on a constant false condition is dropped because javac rejects its unreachable body.
     */
    private boolean whileStatement(CodeWriter out, WhileStatement loop) {
        Condition condition = condition(loop.condition());
        if (Boolean.FALSE.equals(condition.constant())) {
            body(new CodeWriter(0), loop.body());
            return true;
        }
        out.line("while (" + condition.text() + ") {");
        out.indent();
        body(out, loop.body());
        out.dedent();
        out.line("}");
        return !Boolean.TRUE.equals(condition.constant());
    }

    /**
     * Converts a condition to a Java boolean expression. Numbers are true when non-zero and
     * strings when non-empty; dynamic values are tested by the runtime.
     */
    private Condition condition(Expression expression) {
        Code code = expression(expression);
        return switch (code.type()) {
            case INT -> new Condition(code.text() + " != 0L",
                    code.constant() instanceof Long l ? l != 0L : null);
            case FLOAT -> new Condition(code.text() + " != 0.0",
                    code.constant() instanceof Double d ? d != 0.0 : null);
            case STRING -> new Condition("!" + grouped(expression, code.text()) + ".isEmpty()", null);
            case ANY -> new Condition(RUNTIME_CLASS + ".truthy(" + code.text() + ")", null);
            default -> new Condition(code.text(), code.constant() instanceof Boolean b ? b : null);
        };
    }

    private void defineLocal(Symbol symbol) {
        Optional<Symbol> existing = symbols.resolve(symbol.text());
        if (existing.isPresent() && existing.get().isLocal()) {
            throw new GenerationException(Messages.DUPLICATE_VARIABLE, symbol.name(), symbol.text());
        }
        symbols.define(symbol);
    }

    // === Expressions ===

    Code expression(Expression expression) {
        if (expression instanceof Identifier id) {
            Symbol symbol = symbols.resolve(id.name())
                    .filter(Symbol::isLocal)
                    .orElseThrow(() -> new GenerationException(Messages.UNDEFINED_IDENTIFIER, id.token(), id.name()));
            return new Code(JavaNames.identifier(id.name()), symbol.type(), constants.get(symbol));
        } else if (expression instanceof IntegerLiteral i) {
            return new Code(i.value() + "L", ZenoType.INT, i.value());
        } else if (expression instanceof FloatLiteral f) {
            return new Code(Double.toString(f.value()), ZenoType.FLOAT, f.value());
        } else if (expression instanceof StringLiteral s) {
            return new Code(StringEscapes.toJavaLiteral(s.value()), ZenoType.STRING);
        } else if (expression instanceof BooleanLiteral b) {
            return new Code(Boolean.toString(b.value()), ZenoType.BOOL, b.value());
        } else if (expression instanceof UnaryExpression unary) {
            return unary(unary);
        } else if (expression instanceof BinaryExpression binary) {
            return binary(binary);
        } else if (expression instanceof FunctionCall call) {
            Code result = call(call);
            if (resolveCall(call.callee()).returnType() == null) {
                throw new GenerationException(Messages.VOID_CALL_VALUE, call.callee(), call.name());
            }
            return result;
        }
        throw new IllegalStateException("Unhandled expression: " + expression.getClass().getSimpleName());
    }

    private Code unary(UnaryExpression unary) {
        Code operand = expression(unary.operand());
        boolean group = unary.operand() instanceof BinaryExpression || unary.operand() instanceof UnaryExpression;
        String text = unary.operator().symbol() + (group ? "(" + operand.text() + ")" : operand.text());
        ZenoType type = unary.operator() == UnaryOperator.NOT ? ZenoType.BOOL : operand.type();
        return new Code(text, type, ConstantFolder.unary(unary.operator(), operand.constant()));
    }

    private Code binary(BinaryExpression binary) {
        BinaryOperator operator = binary.operator();
        Code left = expression(binary.left());
        Code right = expression(binary.right());

        if ((operator == BinaryOperator.EQ || operator == BinaryOperator.NOT_EQ)
                && !(left.type().isPrimitive() && right.type().isPrimitive())) {
            String negation = operator == BinaryOperator.NOT_EQ ? "!" : "";
            return new Code(negation + "java.util.Objects.equals(" + left.text() + ", " + right.text() + ")", ZenoType.BOOL);
        }
        if (operator.precedence() == Precedence.COMPARISON
                && left.type() == ZenoType.STRING && right.type() == ZenoType.STRING) {
            return new Code(grouped(binary.left(), left.text()) + ".compareTo(" + right.text() + ") "
                    + operator.symbol() + " 0", ZenoType.BOOL);
        }

        String leftText = operator.requiresGrouping(binary.left(), false) ? "(" + left.text() + ")" : left.text();
        String rightText = operator.requiresGrouping(binary.right(), true) ? "(" + right.text() + ")" : right.text();
        return new Code(leftText + " " + operator.symbol() + " " + rightText, resultType(operator, left.type(), right.type()),
                ConstantFolder.binary(operator, left.constant(), right.constant()));
    }

    private static ZenoType resultType(BinaryOperator operator, ZenoType left, ZenoType right) {
        if (operator.isComparison() || operator.isLogical()) {
            return ZenoType.BOOL;
        }
        if (operator == BinaryOperator.ADD && (left == ZenoType.STRING || right == ZenoType.STRING)) {
            return ZenoType.STRING;
        }
        if (left == ZenoType.FLOAT && (right == ZenoType.FLOAT || right == ZenoType.INT)
                || right == ZenoType.FLOAT && left == ZenoType.INT) {
            return ZenoType.FLOAT;
        }
        if (left == ZenoType.INT && right == ZenoType.INT) {
            return ZenoType.INT;
        }
        return ZenoType.UNRESOLVED;
    }

    private Code call(FunctionCall call) {
        String name = call.name();
        CallTarget target = resolveCall(call.callee());
        int count = call.arguments().size();

        if (count < target.requiredArgs() || (!target.variadic() && count > target.requiredArgs())) {
            if (target.variadic() && target.requiredArgs() == 1 && count == 0) {
                throw new GenerationException(Messages.REQUIRES_ARGUMENT, call.callee(), name);
            }
            throw new GenerationException(Messages.ARGUMENT_COUNT, call.callee(), name, target.requiredArgs(), count);
        }

        List<String> arguments = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Code argument = expression(call.arguments().get(i));
            int typeIndex = Math.min(i, Math.max(target.parameterTypes().size() - 1, 0));
            arguments.add(coerce(argument, target.parameterType(typeIndex)));
        }
        ZenoType type = target.returnType() == null ? ZenoType.UNRESOLVED : target.returnType();
        return new Code(target.javaName() + "(" + String.join(", ", arguments) + ")", type);
    }

    private CallTarget resolveCall(Token callee) {
        String name = callee.text();
        CallTarget target = callables.get(name);
        if (target != null) {
            return target;
        }
        if (name.startsWith(SemanticAnalyzer.NATIVE_PREFIX)) {
            Optional<NativeFunction> primitive =
                    StandardLibrary.primitive(name.substring(SemanticAnalyzer.NATIVE_PREFIX.length()));
            if (primitive.isPresent()) {
                return nativeTarget(primitive.get());
            }
        }
        throw new GenerationException(Messages.UNDEFINED_FUNCTION, callee, name);
    }

    static CallTarget nativeTarget(NativeFunction function) {
        return new CallTarget(RUNTIME_CLASS + "." + function.bridgeMethod(), List.of(),
                function.requiredArgs(), function.variadic(), function.returnType());
    }

    private static String coerce(Code code, ZenoType target) {
        if (target == ZenoType.ANY && code.type() != ZenoType.ANY) {
            return "JsonValue.of(" + code.text() + ")";
        }
        return code.text();
    }

    private static String grouped(Expression expression, String text) {
        return expression instanceof BinaryExpression || expression instanceof UnaryExpression ? "(" + text + ")" : text;
    }
}
