package io.github.cyfko.proplogic.core.config;

import java.util.Objects;

/**
 * Central configuration object aggregating the policies of a
 * {@link io.github.cyfko.proplogic.core.PropositionalLogicEngine}.
 * <p>
 * A builder keeps construction fluent; every policy left unset keeps its {@code defaults()} preset.
 * </p>
 *
 * <pre>{@code
 * EngineConfig config = EngineConfig.builder()
 *     .parserPolicy(ParserPolicy.strict())
 *     .tablePolicy(TablePolicy.strict())
 *     .build();
 * }</pre>
 */
public final class EngineConfig {

    private final ParserPolicy parserPolicy;
    private final CachePolicy cachePolicy;
    private final TablePolicy tablePolicy;
    private final RecorderPolicy recorderPolicy;

    private EngineConfig(Builder builder) {
        this.parserPolicy = builder.parserPolicy;
        this.cachePolicy = builder.cachePolicy;
        this.tablePolicy = builder.tablePolicy;
        this.recorderPolicy = builder.recorderPolicy;
    }

    public static Builder builder() { return new Builder(); }

    public static EngineConfig defaults() { return builder().build(); }

    public ParserPolicy getParserPolicy() { return parserPolicy; }
    public CachePolicy getCachePolicy() { return cachePolicy; }
    public TablePolicy getTablePolicy() { return tablePolicy; }
    public RecorderPolicy getRecorderPolicy() { return recorderPolicy; }

    public static final class Builder {
        private ParserPolicy parserPolicy = ParserPolicy.defaults();
        private CachePolicy cachePolicy = CachePolicy.defaults();
        private TablePolicy tablePolicy = TablePolicy.defaults();
        private RecorderPolicy recorderPolicy = RecorderPolicy.defaults();

        private Builder() {}

        public Builder parserPolicy(ParserPolicy policy) {
            this.parserPolicy = Objects.requireNonNull(policy, "parserPolicy");
            return this;
        }

        public Builder cachePolicy(CachePolicy policy) {
            this.cachePolicy = Objects.requireNonNull(policy, "cachePolicy");
            return this;
        }

        public Builder tablePolicy(TablePolicy policy) {
            this.tablePolicy = Objects.requireNonNull(policy, "tablePolicy");
            return this;
        }

        public Builder recorderPolicy(RecorderPolicy policy) {
            this.recorderPolicy = Objects.requireNonNull(policy, "recorderPolicy");
            return this;
        }

        public EngineConfig build() { return new EngineConfig(this); }
    }
}
