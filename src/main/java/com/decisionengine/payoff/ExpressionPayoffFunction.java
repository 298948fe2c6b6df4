package com.decisionengine.payoff;

import com.decisionengine.exception.BusinessException;
import com.decisionengine.exception.ErrorCode;
import lombok.Getter;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

/**
 * Payoff declared as a SpEL expression, used by tree definitions that arrive as data
 * (REST requests) and therefore cannot carry Java code.
 *
 * <p>The expression sees three variables: {@code #values}, {@code #probabilities} and
 * {@code #branches}, keyed by variable name. Example for a sealed-bid terminal:
 * <pre>
 * #values['bid'] &lt; #values['compbid'] ? #values['bid'] - #values['cost'] : 0
 * </pre>
 *
 * <p>Evaluation uses a read-only {@link SimpleEvaluationContext}: no type references,
 * constructors or bean lookups are available to the expression.
 */
@Getter
public class ExpressionPayoffFunction implements PayoffFunction {

    private static final ExpressionParser PARSER = new SpelExpressionParser();

    private final String source;
    private final Expression expression;

    public ExpressionPayoffFunction(String source) {
        this.source = source;
        try {
            this.expression = PARSER.parseExpression(source);
        } catch (ParseException e) {
            throw new BusinessException(
                    ErrorCode.MALFORMED_DECLARATION, "Invalid payoff expression '" + source + "': " + e.getMessage(), e);
        }
    }

    @Override
    public double evaluate(PayoffContext context) {
        EvaluationContext evaluationContext =
                SimpleEvaluationContext.forReadOnlyDataBinding().build();
        evaluationContext.setVariable("values", context.getValues());
        evaluationContext.setVariable("probabilities", context.getProbabilities());
        evaluationContext.setVariable("branches", context.getBranches());
        try {
            Number result = expression.getValue(evaluationContext, Number.class);
            if (result == null) {
                throw new BusinessException("Payoff expression '" + source + "' evaluated to null");
            }
            return result.doubleValue();
        } catch (EvaluationException e) {
            throw new BusinessException(
                    ErrorCode.INVALID_ARGUMENT, "Payoff expression '" + source + "' failed: " + e.getMessage(), e);
        }
    }
}
