package work.lcod.liquid.compiler;

import java.util.HashMap;
import java.util.Map;

/**
 * Immutable symbol table threaded through the lowering recursion. Adding a name returns a new
 * scope, so bindings made inside a body never leak to the enclosing one.
 */
final class LoweringScope {
    static final LoweringScope ROOT = new LoweringScope(Map.of());

    private final Map<String, Symbol> symbols;

    private LoweringScope(Map<String, Symbol> symbols) {
        this.symbols = symbols;
    }

    Symbol lookup(String name) {
        return symbols.get(name);
    }

    LoweringScope with(String name, Symbol symbol) {
        var copy = new HashMap<>(symbols);
        copy.put(name, symbol);
        return new LoweringScope(Map.copyOf(copy));
    }

    /**
     * Scope seen by a macro body: only static constants survive, since raw slots and macro
     * references are tied to the defining frame.
     */
    LoweringScope forMacro() {
        var copy = new HashMap<String, Symbol>();
        for (var entry : symbols.entrySet()) {
            if (entry.getValue().kind() == Symbol.Kind.STATIC_CONSTANT) {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        return new LoweringScope(Map.copyOf(copy));
    }
}
