package work.lcod.liquid.compiler;

import java.util.List;

record LoweredRoutine(List<CompiledStatement> statements, int slotCount, int macroCount, CompilationStatistics statistics) {}
