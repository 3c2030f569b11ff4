package io.creditx.core.rule;

import io.creditx.core.feature.Feature;
import io.creditx.core.feature.FeatureSet;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Reason text with `{placeholder}` tokens bound to extracted features.
///
/// A token is either a {@link Feature#key()} or the fixed `{weight}` token, which renders the
/// signed contribution of the rule (`+25`, `-0.15`). Tokens are parsed once at construction;
/// binding them to known features is checked at reload time by the config validator.
///
/// Numbers render with at most four decimals and no trailing zeros: `0.85`, `45`, `+60`.
///
/// @implNote Immutable and thread-safe.
public final class ReasonTemplate {

    /// Token rendering the signed rule contribution.
    public static final String WEIGHT_TOKEN = "weight";

    private static final Pattern TEMPLATE_PATTERN = Pattern.compile("\\{([^}]+)}");

    private final String source;
    private final List<String> placeholders;

    private ReasonTemplate(String source) {
        this.source = Objects.requireNonNull(source, "template must not be null");
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TEMPLATE_PATTERN.matcher(source);
        while (matcher.find()) {
            tokens.add(matcher.group(1).trim());
        }
        this.placeholders = List.copyOf(tokens);
    }

    /// Parses a reason template.
    ///
    /// @param source template text, not null
    /// @return parsed template, never null
    public static ReasonTemplate of(String source) {
        return new ReasonTemplate(source);
    }

    /// Returns the template text as configured.
    ///
    /// @return source text, never null
    public String source() {
        return source;
    }

    /// Returns placeholder tokens in order of appearance.
    ///
    /// @return unmodifiable token list, never null
    public List<String> placeholders() {
        return placeholders;
    }

    /// Renders the reason for a firing rule.
    ///
    /// @param features features of the scored record, not null
    /// @param contribution signed contribution of the rule
    /// @return rendered reason, never null
    public String render(FeatureSet features, double contribution) {
        if (placeholders.isEmpty()) {
            return source;
        }
        Matcher matcher = TEMPLATE_PATTERN.matcher(source);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String token = matcher.group(1).trim();
            String replacement;
            if (WEIGHT_TOKEN.equals(token)) {
                replacement = formatSigned(contribution);
            } else {
                replacement =
                        Feature.fromKey(token)
                                .map(features::value)
                                .map(ReasonTemplate::formatValue)
                                .orElse(matcher.group());
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    /// Formats a number with at most four decimals and no trailing zeros.
    ///
    /// @param value number to format
    /// @return formatted number, never null
    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value)
                .setScale(4, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
    }

    /// Formats a number with an explicit sign: `+15`, `-0.1`, `+0`.
    ///
    /// @param value number to format
    /// @return signed formatted number, never null
    public static String formatSigned(double value) {
        String formatted = formatNumber(value);
        return formatted.startsWith("-") ? formatted : "+" + formatted;
    }

    private static String formatValue(Object value) {
        if (value instanceof Double number) {
            return formatNumber(number);
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ReasonTemplate other && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
