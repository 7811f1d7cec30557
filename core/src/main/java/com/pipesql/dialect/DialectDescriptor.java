package com.pipesql.dialect;

import com.pipesql.rq.JoinSide;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable capability profile of a SQL dialect.
 *
 * <p>The generator consults the descriptor for everything that differs
 * between dialects: identifier quoting, whether CTEs and window functions
 * exist, how limits are written, which joins are available and how a few
 * operators are spelled. A construct the descriptor rules out is reported as
 * an unsupported construct rather than emitted.
 *
 * <p>Built-in profiles live in {@link Dialect}; custom ones are created with
 * {@link #builder(String)}:
 * <pre>
 *   DialectDescriptor legacy = DialectDescriptor.builder("legacy")
 *       .supportsCte(false)
 *       .supportsWindowFunctions(false)
 *       .build();
 * </pre>
 */
public final class DialectDescriptor {

    private final String name;
    private final String identifierQuoteStart;
    private final String identifierQuoteEnd;
    private final boolean supportsCte;
    private final boolean supportsWindowFunctions;
    private final LimitStyle limitStyle;
    private final String limitForOffsetOnly;
    private final Set<JoinSide> joinSides;
    private final String starExcludeKeyword;
    private final String regexMatchTemplate;
    private final String intDivTemplate;

    private DialectDescriptor(Builder builder) {
        this.name = builder.name;
        this.identifierQuoteStart = builder.identifierQuoteStart;
        this.identifierQuoteEnd = builder.identifierQuoteEnd;
        this.supportsCte = builder.supportsCte;
        this.supportsWindowFunctions = builder.supportsWindowFunctions;
        this.limitStyle = builder.limitStyle;
        this.limitForOffsetOnly = builder.limitForOffsetOnly;
        this.joinSides = Set.copyOf(builder.joinSides);
        this.starExcludeKeyword = builder.starExcludeKeyword;
        this.regexMatchTemplate = builder.regexMatchTemplate;
        this.intDivTemplate = builder.intDivTemplate;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Returns a builder initialised with this descriptor's settings.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(name)
            .identifierQuotes(identifierQuoteStart, identifierQuoteEnd)
            .supportsCte(supportsCte)
            .supportsWindowFunctions(supportsWindowFunctions)
            .limitStyle(limitStyle)
            .limitForOffsetOnly(limitForOffsetOnly)
            .starExcludeKeyword(starExcludeKeyword)
            .regexMatchTemplate(regexMatchTemplate)
            .intDivTemplate(intDivTemplate);
        builder.joinSides = EnumSet.copyOf(joinSides);
        return builder;
    }

    public String name() {
        return name;
    }

    public String identifierQuoteStart() {
        return identifierQuoteStart;
    }

    public String identifierQuoteEnd() {
        return identifierQuoteEnd;
    }

    public boolean supportsCte() {
        return supportsCte;
    }

    public boolean supportsWindowFunctions() {
        return supportsWindowFunctions;
    }

    public LimitStyle limitStyle() {
        return limitStyle;
    }

    public boolean supportsOffset() {
        return limitStyle != LimitStyle.LIMIT_ONLY;
    }

    /**
     * Returns the LIMIT value to write when only an offset is wanted, or null
     * when {@code OFFSET} may appear on its own.
     */
    public String limitForOffsetOnly() {
        return limitForOffsetOnly;
    }

    public boolean supportsJoin(JoinSide side) {
        return joinSides.contains(side);
    }

    /**
     * Returns the keyword that removes columns from {@code *} (such as
     * {@code EXCLUDE} or {@code EXCEPT}), or null when unsupported.
     */
    public String starExcludeKeyword() {
        return starExcludeKeyword;
    }

    /**
     * Returns a format string with two {@code %s} slots (value, pattern) for
     * regular-expression matching, or null when unsupported.
     */
    public String regexMatchTemplate() {
        return regexMatchTemplate;
    }

    /**
     * Returns a format string with two {@code %s} slots for integer division.
     */
    public String intDivTemplate() {
        return intDivTemplate;
    }

    @Override
    public String toString() {
        return "DialectDescriptor(" + name + ")";
    }

    /**
     * Builder with the settings of the generic dialect as defaults.
     */
    public static final class Builder {
        private final String name;
        private String identifierQuoteStart = "\"";
        private String identifierQuoteEnd = "\"";
        private boolean supportsCte = true;
        private boolean supportsWindowFunctions = true;
        private LimitStyle limitStyle = LimitStyle.LIMIT_OFFSET;
        private String limitForOffsetOnly;
        private Set<JoinSide> joinSides = EnumSet.allOf(JoinSide.class);
        private String starExcludeKeyword;
        private String regexMatchTemplate;
        private String intDivTemplate = "FLOOR(%s / %s)";

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        public Builder identifierQuotes(String start, String end) {
            this.identifierQuoteStart = Objects.requireNonNull(start, "start must not be null");
            this.identifierQuoteEnd = Objects.requireNonNull(end, "end must not be null");
            return this;
        }

        public Builder supportsCte(boolean value) {
            this.supportsCte = value;
            return this;
        }

        public Builder supportsWindowFunctions(boolean value) {
            this.supportsWindowFunctions = value;
            return this;
        }

        public Builder limitStyle(LimitStyle style) {
            this.limitStyle = Objects.requireNonNull(style, "style must not be null");
            return this;
        }

        public Builder limitForOffsetOnly(String value) {
            this.limitForOffsetOnly = value;
            return this;
        }

        public Builder joinSides(JoinSide first, JoinSide... rest) {
            this.joinSides = EnumSet.of(first, rest);
            return this;
        }

        public Builder starExcludeKeyword(String keyword) {
            this.starExcludeKeyword = keyword;
            return this;
        }

        public Builder regexMatchTemplate(String template) {
            this.regexMatchTemplate = template;
            return this;
        }

        public Builder intDivTemplate(String template) {
            this.intDivTemplate = Objects.requireNonNull(template, "template must not be null");
            return this;
        }

        public DialectDescriptor build() {
            return new DialectDescriptor(this);
        }
    }
}
