package org.pragmatica.minilang.tree;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MiniLang abstract syntax tree.
 *
 * <p>Nodes are immutable and own their children exclusively; lists are copied on
 * construction. Constructors reject shapes the grammar can never produce, so a tree that
 * exists is well-formed.
 */
public sealed interface AstNode {

    /**
     * Source range this node was parsed from.
     */
    SourceSpan span();

    <R> R accept(AstVisitor<R> visitor);

    // === Groupings ===

    /**
     * Arithmetic expression.
     */
    sealed interface Expr extends AstNode {}

    /**
     * Boolean-producing node used as a condition or boolean value.
     */
    sealed interface Condition extends AstNode {}

    /**
     * Anything that may appear at the top level of a program.
     */
    sealed interface Statement extends AstNode {}

    // === Program ===

    /**
     * Top-level statements in source order.
     */
    record Program(SourceSpan span, List<Statement> statements) implements AstNode {
        public Program {
            statements = List.copyOf(statements);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitProgram(this);
        }
    }

    // === Expressions ===

    /**
     * Atomic operand: identifier, number or boolean literal.
     */
    record Final(SourceSpan span, Kind kind, String text) implements Expr {
        public enum Kind {
            IDENT,
            NUMBER,
            TRUE,
            FALSE
        }

        public Final {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(text, "text");
        }

        public boolean isIdentifier() {
            return kind == Kind.IDENT;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitFinal(this);
        }
    }

    /**
     * Number literal written with an explicit sign: {@code +5}, {@code -5}.
     */
    record SignedNumber(SourceSpan span, Sign sign, String text) implements Expr {
        public enum Sign {
            PLUS("+"),
            MINUS("-");

            private final String symbol;

            Sign(String symbol) {
                this.symbol = symbol;
            }

            public String symbol() {
                return symbol;
            }
        }

        public SignedNumber {
            Objects.requireNonNull(sign, "sign");
            Objects.requireNonNull(text, "text");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitSignedNumber(this);
        }
    }

    /**
     * Negation of a parenthesized expression: {@code -(a + b)}.
     */
    record NegExpr(SourceSpan span, Expr operand) implements Expr {
        public NegExpr {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitNegExpr(this);
        }
    }

    /**
     * Post-increment or post-decrement of a variable. Valid both as a statement and
     * inside an expression.
     */
    record UnaryOp(SourceSpan span, String identifier, Operator operator) implements Expr, Statement {
        public enum Operator {
            INCREMENT("++"),
            DECREMENT("--");

            private final String symbol;

            Operator(String symbol) {
                this.symbol = symbol;
            }

            public String symbol() {
                return symbol;
            }
        }

        public UnaryOp {
            Objects.requireNonNull(identifier, "identifier");
            Objects.requireNonNull(operator, "operator");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    /**
     * Arithmetic binary operation.
     */
    record BinaryOp(SourceSpan span, Operator operator, Expr left, Expr right) implements Expr {
        public enum Operator {
            ADD("+"),
            SUB("-"),
            MUL("*"),
            DIV("/"),
            MOD("%"),
            POW("^");

            private final String symbol;

            Operator(String symbol) {
                this.symbol = symbol;
            }

            public String symbol() {
                return symbol;
            }
        }

        public BinaryOp {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    // === Conditions ===

    /**
     * Relational test between two expressions, or a bare {@code true}, {@code false} or
     * identifier used as a condition.
     *
     * <p>Operands are present exactly when the operator is relational. For relational
     * comparisons {@code text} is the operator symbol, otherwise the literal or identifier.
     */
    record Comparison(SourceSpan span,
                      Operator operator,
                      Optional<Expr> left,
                      Optional<Expr> right,
                      String text) implements Condition {
        public enum Operator {
            EQUAL("==", true),
            NOT_EQUAL("!=", true),
            GT(">", true),
            LT("<", true),
            GE(">=", true),
            LE("<=", true),
            LITERAL_TRUE("true", false),
            LITERAL_FALSE("false", false),
            IDENT_REF("", false);

            private final String symbol;
            private final boolean relational;

            Operator(String symbol, boolean relational) {
                this.symbol = symbol;
                this.relational = relational;
            }

            public String symbol() {
                return symbol;
            }

            public boolean isRelational() {
                return relational;
            }
        }

        public Comparison {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(text, "text");
            if (operator.isRelational() != (left.isPresent() && right.isPresent())) {
                throw new IllegalArgumentException(
                    "Operands must be present exactly for relational operators, got " + operator);
            }
            if (left.isPresent() != right.isPresent()) {
                throw new IllegalArgumentException("Comparison needs both operands or none");
            }
        }

        public static Comparison relational(SourceSpan span, Operator operator, Expr left, Expr right) {
            return new Comparison(span, operator, Optional.of(left), Optional.of(right), operator.symbol());
        }

        public static Comparison atom(SourceSpan span, Operator operator, String text) {
            return new Comparison(span, operator, Optional.empty(), Optional.empty(), text);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitComparison(this);
        }
    }

    /**
     * Conjunction or disjunction. Both operators share one precedence level.
     */
    record LogicalExpr(SourceSpan span, Operator operator, Condition left, Condition right) implements Condition {
        public enum Operator {
            AND("&&"),
            OR("||");

            private final String symbol;

            Operator(String symbol) {
                this.symbol = symbol;
            }

            public String symbol() {
                return symbol;
            }
        }

        public LogicalExpr {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    // === Statements ===

    /**
     * {@code int}/{@code bool} declaration of one or more variables with optional
     * initializers, one per name. {@code int} initializers are {@link Expr}s,
     * {@code bool} initializers are {@link Condition}s.
     */
    record Declaration(SourceSpan span, Type type, List<String> names, List<AstNode> initializers)
        implements Statement {
        public enum Type {
            INT("int"),
            BOOL("bool");

            private final String keyword;

            Type(String keyword) {
                this.keyword = keyword;
            }

            public String keyword() {
                return keyword;
            }
        }

        public Declaration {
            Objects.requireNonNull(type, "type");
            names = List.copyOf(names);
            initializers = List.copyOf(initializers);
            if (names.isEmpty()) {
                throw new IllegalArgumentException("Declaration needs at least one name");
            }
            if (new HashSet<>(names).size() != names.size()) {
                throw new IllegalArgumentException("Duplicate name in declaration: " + names);
            }
            if (!initializers.isEmpty() && initializers.size() != names.size()) {
                throw new IllegalArgumentException(
                    names.size() + " names but " + initializers.size() + " initializers");
            }
            for (var initializer : initializers) {
                var matches = type == Type.INT
                              ? initializer instanceof Expr
                              : initializer instanceof Condition;
                if (!matches) {
                    throw new IllegalArgumentException(
                        "Initializer " + initializer.getClass().getSimpleName() + " does not fit " + type.keyword());
                }
            }
        }

        public boolean hasInitializers() {
            return !initializers.isEmpty();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitDeclaration(this);
        }
    }

    /**
     * Assignment to a variable. Exactly one right-hand side is present; compound
     * operators only take the arithmetic one.
     */
    record Assignment(SourceSpan span,
                      Final target,
                      Operator operator,
                      Optional<Expr> value,
                      Optional<Condition> condition) implements Statement {
        public enum Operator {
            ASSIGN("="),
            ADD_ASSIGN("+="),
            SUB_ASSIGN("-="),
            MUL_ASSIGN("*="),
            DIV_ASSIGN("/=");

            private final String symbol;

            Operator(String symbol) {
                this.symbol = symbol;
            }

            public String symbol() {
                return symbol;
            }

            public boolean isCompound() {
                return this != ASSIGN;
            }
        }

        public Assignment {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(operator, "operator");
            if (!target.isIdentifier()) {
                throw new IllegalArgumentException("Assignment target must be an identifier, got " + target.kind());
            }
            if (value.isPresent() == condition.isPresent()) {
                throw new IllegalArgumentException("Assignment needs exactly one right-hand side");
            }
            if (operator.isCompound() && condition.isPresent()) {
                throw new IllegalArgumentException(operator.symbol() + " takes an arithmetic right-hand side");
            }
        }

        public static Assignment arithmetic(SourceSpan span, Final target, Operator operator, Expr value) {
            return new Assignment(span, target, operator, Optional.of(value), Optional.empty());
        }

        public static Assignment bool(SourceSpan span, Final target, Condition condition) {
            return new Assignment(span, target, Operator.ASSIGN, Optional.empty(), Optional.of(condition));
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitAssignment(this);
        }
    }

    /**
     * One {@code elif} arm of an {@link IfStmt}.
     */
    record ElifClause(SourceSpan span, Condition condition, List<Assignment> body) implements AstNode {
        public ElifClause {
            Objects.requireNonNull(condition, "condition");
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitElifClause(this);
        }
    }

    /**
     * {@code if}/{@code elif}/{@code else} chain. An absent {@code else} leaves
     * {@code elseBranch} empty.
     */
    record IfStmt(SourceSpan span,
                  Condition condition,
                  List<Assignment> thenBranch,
                  List<ElifClause> elifClauses,
                  List<Assignment> elseBranch) implements Statement {
        public IfStmt {
            Objects.requireNonNull(condition, "condition");
            thenBranch = List.copyOf(thenBranch);
            elifClauses = List.copyOf(elifClauses);
            elseBranch = List.copyOf(elseBranch);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitIfStmt(this);
        }
    }

    /**
     * Pre-test loop.
     */
    record WhileStmt(SourceSpan span, Condition condition, List<Assignment> body) implements Statement {
        public WhileStmt {
            Objects.requireNonNull(condition, "condition");
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitWhileStmt(this);
        }
    }

    /**
     * Counted loop: {@code for (init; condition; step): begin ... end}.
     */
    record ForStmt(SourceSpan span,
                   Assignment init,
                   Condition condition,
                   Assignment step,
                   List<Assignment> body) implements Statement {
        public ForStmt {
            Objects.requireNonNull(init, "init");
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(step, "step");
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitForStmt(this);
        }
    }

    /**
     * Output statement.
     */
    record PrintStmt(SourceSpan span, Expr expression) implements Statement {
        public PrintStmt {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitPrintStmt(this);
        }
    }
}
