package work.lcod.liquid.runtime;

import java.util.Locale;
import java.util.Objects;
import work.lcod.liquid.text.TrimmingPolicy;

/**
 * Render configuration shared by every context built from it.
 */
public record TemplateOptions(
    FilterRegistry filters,
    MemberAccessStrategy memberAccessStrategy,
    TrimmingPolicy trimming,
    Locale locale,
    long maxSteps,
    int maxRecursion
) {
    public static final int DEFAULT_MAX_RECURSION = 100;

    public TemplateOptions {
        Objects.requireNonNull(filters, "filters");
        Objects.requireNonNull(memberAccessStrategy, "memberAccessStrategy");
        trimming = trimming == null ? TrimmingPolicy.NONE : trimming;
        locale = locale == null ? Locale.ROOT : locale;
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be >= 0");
        }
        if (maxRecursion < 0) {
            throw new IllegalArgumentException("maxRecursion must be >= 0");
        }
    }

    public static TemplateOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .filters(filters)
            .memberAccessStrategy(memberAccessStrategy)
            .trimming(trimming)
            .locale(locale)
            .maxSteps(maxSteps)
            .maxRecursion(maxRecursion);
    }

    public static final class Builder {
        private FilterRegistry filters;
        private MemberAccessStrategy memberAccessStrategy;
        private TrimmingPolicy trimming = TrimmingPolicy.NONE;
        private Locale locale = Locale.ROOT;
        private long maxSteps;
        private int maxRecursion = DEFAULT_MAX_RECURSION;

        public Builder filters(FilterRegistry filters) {
            this.filters = filters;
            return this;
        }

        public Builder memberAccessStrategy(MemberAccessStrategy memberAccessStrategy) {
            this.memberAccessStrategy = memberAccessStrategy;
            return this;
        }

        public Builder trimming(TrimmingPolicy trimming) {
            this.trimming = trimming;
            return this;
        }

        public Builder locale(Locale locale) {
            this.locale = locale;
            return this;
        }

        /**
         * Step ceiling; zero means unlimited.
         */
        public Builder maxSteps(long maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        /**
         * Deepest scope nesting allowed; zero means unlimited.
         */
        public Builder maxRecursion(int maxRecursion) {
            this.maxRecursion = maxRecursion;
            return this;
        }

        public TemplateOptions build() {
            return new TemplateOptions(
                filters == null ? FilterRegistries.create() : filters,
                memberAccessStrategy == null ? new DefaultMemberAccessStrategy() : memberAccessStrategy,
                trimming,
                locale,
                maxSteps,
                maxRecursion
            );
        }
    }
}
