package work.lcod.liquid.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * Sequencing helpers for future-based evaluation. Already completed futures are consumed in a
 * plain loop so long bodies and loops do not grow the stack; only a pending future switches to
 * a continuation.
 */
public final class AsyncFlow {
    private static final CompletableFuture<Completion> NORMAL = CompletableFuture.completedFuture(Completion.NORMAL);

    private AsyncFlow() {}

    public static CompletableFuture<Completion> normal() {
        return NORMAL;
    }

    public static CompletableFuture<Completion> completedWith(Completion completion) {
        return completion == Completion.NORMAL ? NORMAL : CompletableFuture.completedFuture(completion);
    }

    /**
     * Runs a supplier, turning a synchronous throw into a failed future.
     */
    public static <T> CompletableFuture<T> guard(Supplier<CompletableFuture<T>> action) {
        try {
            return action.get();
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    /**
     * Runs {@code count} statements in order, stopping at the first non-normal completion which
     * is returned to the caller.
     */
    public static CompletableFuture<Completion> sequence(int count, IntFunction<CompletableFuture<Completion>> statement) {
        return sequenceFrom(0, count, statement);
    }

    private static CompletableFuture<Completion> sequenceFrom(int start, int count, IntFunction<CompletableFuture<Completion>> statement) {
        for (int index = start; index < count; index++) {
            CompletableFuture<Completion> pending;
            try {
                pending = statement.apply(index);
            } catch (RuntimeException ex) {
                return CompletableFuture.failedFuture(ex);
            }
            if (isCompletedNormally(pending)) {
                var completion = pending.join();
                if (completion != Completion.NORMAL) {
                    return completedWith(completion);
                }
                continue;
            }
            int next = index + 1;
            return pending.thenCompose(completion -> completion != Completion.NORMAL
                ? completedWith(completion)
                : sequenceFrom(next, count, statement));
        }
        return NORMAL;
    }

    /**
     * Runs a loop body {@code count} times. {@link Completion#BREAK} stops the loop,
     * {@link Completion#CONTINUE} moves to the next iteration; the loop itself completes normally.
     */
    public static CompletableFuture<Completion> loop(int count, IntFunction<CompletableFuture<Completion>> iteration) {
        return loopFrom(0, count, iteration);
    }

    private static CompletableFuture<Completion> loopFrom(int start, int count, IntFunction<CompletableFuture<Completion>> iteration) {
        for (int index = start; index < count; index++) {
            CompletableFuture<Completion> pending;
            try {
                pending = iteration.apply(index);
            } catch (RuntimeException ex) {
                return CompletableFuture.failedFuture(ex);
            }
            if (isCompletedNormally(pending)) {
                if (pending.join() == Completion.BREAK) {
                    return NORMAL;
                }
                continue;
            }
            int next = index + 1;
            return pending.thenCompose(completion -> completion == Completion.BREAK
                ? NORMAL
                : loopFrom(next, count, iteration));
        }
        return NORMAL;
    }

    /**
     * Evaluates {@code count} producers strictly one after the other and collects their results.
     */
    public static <T> CompletableFuture<List<T>> collect(int count, IntFunction<CompletableFuture<T>> producer) {
        return collectFrom(0, count, producer, new ArrayList<>(count));
    }

    private static <T> CompletableFuture<List<T>> collectFrom(int start, int count, IntFunction<CompletableFuture<T>> producer, List<T> results) {
        for (int index = start; index < count; index++) {
            CompletableFuture<T> pending;
            try {
                pending = producer.apply(index);
            } catch (RuntimeException ex) {
                return CompletableFuture.failedFuture(ex);
            }
            if (isCompletedNormally(pending)) {
                results.add(pending.join());
                continue;
            }
            int next = index + 1;
            return pending.thenCompose(value -> {
                results.add(value);
                return collectFrom(next, count, producer, results);
            });
        }
        return CompletableFuture.completedFuture(results);
    }

    public static boolean isCompletedNormally(CompletableFuture<?> future) {
        return future.isDone() && !future.isCompletedExceptionally();
    }

    /**
     * Strips the {@link CompletionException} wrapper added by future chains.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Waits for a render future and rethrows its failure unwrapped.
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            var cause = unwrap(ex);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw ex;
        }
    }
}
