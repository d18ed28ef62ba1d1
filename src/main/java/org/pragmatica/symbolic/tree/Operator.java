package org.pragmatica.symbolic.tree;

/**
 * Closed set of operator and function kinds an {@link Node.Operation} can carry.
 */
public enum Operator {
    ADD("Add", "+", Category.BINARY, 1, true, true),
    SUBTRACT("Subtract", "-", Category.BINARY, 1, true, false),
    MULTIPLY("Multiply", "*", Category.BINARY, 2, true, true),
    DIVIDE("Divide", "/", Category.BINARY, 2, true, false),
    POWER("Power", "^", Category.BINARY, 3, false, true),

    NEGATE("Negate", "-", Category.PREFIX, 2.5, true, false),

    SIN("Sine", "sin"),
    COS("Cosine", "cos"),
    TAN("Tangent", "tan"),
    SEC("Secant", "sec"),
    COT("Cotangent", "cot"),
    CSC("Cosecant", "csc"),
    LN("Ln", "ln"),
    SQRT("Sqrt", "sqrt"),
    ABS("Abs", "abs"),
    SIGN("Sign", "sign"),
    ARCSIN("Arcsin", "arcsin");

    /**
     * Grammatical role of the symbol.
     */
    public enum Category {
        PREFIX(1, 1),
        BINARY(2, 2),
        FUNCTION(1, 1);

        private final int minArgs;
        private final int maxArgs;

        Category(int minArgs, int maxArgs) {
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
        }
    }

    private final String displayName;
    private final String symbol;
    private final Category category;
    private final double precedence;
    private final boolean leftAssociative;
    private final boolean rightAssociative;

    Operator(String displayName, String symbol) {
        this(displayName, symbol, Category.FUNCTION, 0, false, false);
    }

    Operator(String displayName,
             String symbol,
             Category category,
             double precedence,
             boolean leftAssociative,
             boolean rightAssociative) {
        this.displayName = displayName;
        this.symbol = symbol;
        this.category = category;
        this.precedence = precedence;
        this.leftAssociative = leftAssociative;
        this.rightAssociative = rightAssociative;
    }

    public String displayName() {
        return displayName;
    }

    public String symbol() {
        return symbol;
    }

    public Category category() {
        return category;
    }

    /**
     * Binding strength; meaningful for prefix and binary operators only.
     */
    public double precedence() {
        return precedence;
    }

    public boolean leftAssociative() {
        return leftAssociative;
    }

    public boolean rightAssociative() {
        return rightAssociative;
    }

    /**
     * True when equal-precedence chains of this operator group to the right.
     */
    public boolean exclusivelyRightAssociative() {
        return rightAssociative && !leftAssociative;
    }

    public int minArgs() {
        return category.minArgs;
    }

    public int maxArgs() {
        return category.maxArgs;
    }

    public boolean isOperator() {
        return category != Category.FUNCTION;
    }
}
