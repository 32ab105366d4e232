package work.lcod.liquid.compiler;

import work.lcod.liquid.values.Value;

/**
 * What the compiler statically knows about a name.
 */
record Symbol(Kind kind, int slot, Class<?> type, Class<?> elementType, Value constant) {
    enum Kind {
        MODEL_LOCAL,
        VALUE_LOCAL,
        STATIC_CONSTANT,
        MACRO
    }

    static Symbol modelLocal(int slot, Class<?> type, Class<?> elementType) {
        return new Symbol(Kind.MODEL_LOCAL, slot, type, elementType, null);
    }

    static Symbol valueLocal() {
        return new Symbol(Kind.VALUE_LOCAL, -1, null, null, null);
    }

    static Symbol staticConstant(Value constant) {
        return new Symbol(Kind.STATIC_CONSTANT, -1, null, null, constant);
    }

    static Symbol macro(int slot) {
        return new Symbol(Kind.MACRO, slot, null, null, null);
    }
}
