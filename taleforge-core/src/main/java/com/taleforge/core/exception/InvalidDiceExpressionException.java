package com.taleforge.core.exception;

/**
 * Thrown when a dice expression cannot be parsed or is out of range.
 */
public class InvalidDiceExpressionException extends TaleforgeException {

    public static final String ERROR_CODE = "INVALID_DICE_EXPRESSION";

    private final String expression;

    public InvalidDiceExpressionException(String expression, String reason) {
        super(ERROR_CODE, String.format(
            "Invalid dice expression '%s': %s",
            expression, reason
        ));
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
