package work.lcod.liquid.compiler;

import java.util.Objects;
import work.lcod.liquid.values.Value;
import work.lcod.liquid.values.Values;

/**
 * Result of lowering one expression: a compile-time constant, an ordinary value evaluator, or a
 * raw model read with its static type.
 */
final class LoweredExpression {
    enum Form {
        CONSTANT,
        VALUE,
        MODEL
    }

    private final Form form;
    private final Value constant;
    private final ValueEvaluator value;
    private final ModelEvaluator model;
    private final Class<?> type;
    private final Class<?> elementType;

    private LoweredExpression(Form form, Value constant, ValueEvaluator value, ModelEvaluator model, Class<?> type, Class<?> elementType) {
        this.form = form;
        this.constant = constant;
        this.value = value;
        this.model = model;
        this.type = type;
        this.elementType = elementType;
    }

    static LoweredExpression constant(Value constant) {
        return new LoweredExpression(Form.CONSTANT, Objects.requireNonNull(constant, "constant"), null, null, null, null);
    }

    static LoweredExpression value(ValueEvaluator value) {
        return new LoweredExpression(Form.VALUE, null, Objects.requireNonNull(value, "value"), null, null, null);
    }

    static LoweredExpression model(ModelEvaluator model, Class<?> type, Class<?> elementType) {
        return new LoweredExpression(Form.MODEL, null, null, Objects.requireNonNull(model, "model"), type, elementType);
    }

    Form form() {
        return form;
    }

    boolean isConstant() {
        return form == Form.CONSTANT;
    }

    Value constantValue() {
        return constant;
    }

    ModelEvaluator modelEvaluator() {
        return model;
    }

    Class<?> type() {
        return type;
    }

    Class<?> elementType() {
        return elementType;
    }

    /**
     * This expression as a value evaluator; model reads are wrapped when evaluated.
     */
    ValueEvaluator asValue() {
        return switch (form) {
            case CONSTANT -> {
                var completed = Values.completed(constant);
                yield frame -> completed;
            }
            case VALUE -> value;
            case MODEL -> frame -> Values.completed(Values.create(model.read(frame), frame.context().options()));
        };
    }
}
