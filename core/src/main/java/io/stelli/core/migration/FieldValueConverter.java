package io.stelli.core.migration;

import io.stelli.core.model.FieldType;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Best-effort conversion of a stored value when its field changes type. Conversions without a
 * sensible mapping return {@code null}, which leaves the field unanswered.
 *
 * <table>
 *   <tr><th>from</th><th>to</th><th>result</th></tr>
 *   <tr><td>text</td><td>number</td><td>parsed {@link Double}, or null</td></tr>
 *   <tr><td>text</td><td>yes-no</td><td>yes/true/1 → true, no/false/0 → false, else null</td></tr>
 *   <tr><td>text</td><td>dropdown, date</td><td>the text</td></tr>
 *   <tr><td>text, dropdown</td><td>multi-select</td><td>single-element list</td></tr>
 *   <tr><td>number</td><td>text</td><td>plain decimal string</td></tr>
 *   <tr><td>yes-no</td><td>text</td><td>"Yes" / "No"</td></tr>
 *   <tr><td>date</td><td>text</td><td>the ISO string</td></tr>
 *   <tr><td>multi-select</td><td>dropdown</td><td>first element</td></tr>
 * </table>
 */
public final class FieldValueConverter {

    private static final Set<String> TRUE_WORDS = Set.of("yes", "true", "1");
    private static final Set<String> FALSE_WORDS = Set.of("no", "false", "0");

    private FieldValueConverter() {}

    public static Object convert(Object value, FieldType from, FieldType to) {
        if (value == null) {
            return null;
        }
        if (from == to) {
            return value;
        }
        return switch (from) {
            case TEXT -> fromText(String.valueOf(value), to);
            case NUMBER -> to == FieldType.TEXT && value instanceof Number number ? plain(number) : null;
            case YES_NO -> to == FieldType.TEXT && value instanceof Boolean answer ? (answer ? "Yes" : "No") : null;
            case DATE -> to == FieldType.TEXT ? String.valueOf(value) : null;
            case DROPDOWN -> to == FieldType.MULTI_SELECT ? List.of(String.valueOf(value)) : null;
            case MULTI_SELECT -> to == FieldType.DROPDOWN ? firstOf(value) : null;
            case RATING, PHOTOS -> null;
        };
    }

    private static Object fromText(String text, FieldType to) {
        return switch (to) {
            case NUMBER -> {
                try {
                    yield Double.parseDouble(text.trim());
                } catch (NumberFormatException e) {
                    yield null;
                }
            }
            case YES_NO -> {
                String word = text.trim().toLowerCase(Locale.ROOT);
                yield TRUE_WORDS.contains(word) ? Boolean.TRUE : FALSE_WORDS.contains(word) ? Boolean.FALSE : null;
            }
            case DROPDOWN, DATE -> text;
            case MULTI_SELECT -> List.of(text);
            case TEXT, RATING, PHOTOS -> null;
        };
    }

    private static String plain(Number number) {
        return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
    }

    private static Object firstOf(Object value) {
        if (value instanceof Collection<?> items) {
            return items.isEmpty() ? null : String.valueOf(items.iterator().next());
        }
        return String.valueOf(value);
    }
}
