package com.botwire.dispatch.filter;

import com.botwire.common.errors.ConfigurationException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds and parses structured callback data such as {@code "product:buy:42"}: a prefix followed
 * by named parts, joined with a separator.
 * <pre>{@code
 * CallbackData products = CallbackData.of("product", "action", "id");
 * InlineKeyboardButton buy = InlineKeyboardButton.callback("Buy", products.create("buy", 42));
 * bot.onCallbackQuery(handler, Filters.callbackData(products.filter(Map.of("action", "buy"))));
 * }</pre>
 */
public final class CallbackData {

    public static final String DEFAULT_SEPARATOR = ":";
    /** Platform limit for a button's callback data, in UTF-8 bytes. */
    public static final int MAX_BYTES = 64;
    /** Key under which {@link #parse} returns the prefix. */
    public static final String PREFIX_KEY = "@";

    private final String prefix;
    private final String separator;
    private final List<String> parts;

    /**
     * @throws IllegalArgumentException if the prefix is empty or contains the separator
     */
    public CallbackData(String prefix, String separator, List<String> parts) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(separator, "separator");
        if (prefix.isEmpty())
            throw new IllegalArgumentException("Prefix can't be empty");
        if (separator.isEmpty())
            throw new IllegalArgumentException("Separator can't be empty");
        if (prefix.contains(separator))
            throw new IllegalArgumentException("Separator '" + separator + "' can't be used in prefix");
        this.prefix = prefix;
        this.separator = separator;
        this.parts = List.copyOf(parts);
    }

    public static CallbackData of(String prefix, String... parts) {
        return new CallbackData(prefix, DEFAULT_SEPARATOR, List.of(parts));
    }

    public String getPrefix() {
        return prefix;
    }

    public List<String> getParts() {
        return parts;
    }

    // =========================================================================
    // Encoding
    // =========================================================================

    /**
     * Callback data from part values in declaration order.
     *
     * @throws IllegalArgumentException on a missing, extra or null value, a value containing the
     *                                  separator, or a result longer than {@value #MAX_BYTES} bytes
     */
    public String create(Object... values) {
        if (values.length > parts.size())
            throw new IllegalArgumentException("Too many values: expected " + parts.size() + ", got " + values.length);
        List<String> out = new ArrayList<>(parts.size() + 1);
        out.add(prefix);
        for (int i = 0; i < parts.size(); i++) {
            Object value = i < values.length ? values[i] : null;
            out.add(checkValue(parts.get(i), value));
        }
        return join(out);
    }

    /**
     * Callback data from part values by name.
     *
     * @throws IllegalArgumentException as {@link #create(Object...)}, or for a name that is not a part
     */
    public String create(Map<String, ?> values) {
        for (String name : values.keySet()) {
            if (!parts.contains(name))
                throw new IllegalArgumentException("Unknown part '" + name + "'; parts are " + parts);
        }
        List<String> out = new ArrayList<>(parts.size() + 1);
        out.add(prefix);
        for (String part : parts) {
            out.add(checkValue(part, values.get(part)));
        }
        return join(out);
    }

    private String checkValue(String part, Object value) {
        if (value == null)
            throw new IllegalArgumentException("Value for '" + part + "' was not passed");
        String text = String.valueOf(value);
        if (text.contains(separator))
            throw new IllegalArgumentException("Value for '" + part + "' contains the separator '" + separator + "'");
        return text;
    }

    private String join(List<String> values) {
        String data = String.join(separator, values);
        if (data.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES)
            throw new IllegalArgumentException("Callback data is longer than " + MAX_BYTES + " bytes: " + data);
        return data;
    }

    // =========================================================================
    // Decoding
    // =========================================================================

    /**
     * Part values by name, plus the prefix under {@value #PREFIX_KEY}.
     *
     * @throws IllegalArgumentException if the data has another prefix or the wrong number of parts
     */
    public Map<String, String> parse(String data) {
        return tryParse(data).orElseThrow(() -> new IllegalArgumentException(
                "Callback data '" + data + "' does not match " + prefix + separator + String.join(separator, parts)));
    }

    /**
     * Like {@link #parse}, empty instead of throwing.
     */
    public Optional<Map<String, String>> tryParse(String data) {
        if (data == null)
            return Optional.empty();
        String[] values = data.split(Pattern.quote(separator), -1);
        if (!prefix.equals(values[0]) || values.length - 1 != parts.size())
            return Optional.empty();
        Map<String, String> result = new LinkedHashMap<>();
        result.put(PREFIX_KEY, values[0]);
        for (int i = 0; i < parts.size(); i++) {
            result.put(parts.get(i), values[i + 1]);
        }
        return Optional.of(result);
    }

    // =========================================================================
    // Filtering
    // =========================================================================

    /** Matches any callback query whose data this factory can parse. */
    public CallbackDataFilter filter() {
        return new CallbackDataFilter(this, Map.of());
    }

    /**
     * Matches callback data whose parts equal the given values. A collection value accepts any of its
     * elements. Values are compared as strings.
     *
     * @throws ConfigurationException for a name that is not a part
     */
    public CallbackDataFilter filter(Map<String, ?> config) {
        Map<String, Set<String>> accepted = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : config.entrySet()) {
            if (!parts.contains(e.getKey()))
                throw new ConfigurationException("Invalid field name '" + e.getKey() + "'; parts are " + parts);
            Set<String> values = new LinkedHashSet<>();
            if (e.getValue() instanceof Collection<?> many) {
                many.forEach(v -> values.add(String.valueOf(v)));
            } else {
                values.add(String.valueOf(e.getValue()));
            }
            accepted.put(e.getKey(), Set.copyOf(values));
        }
        return new CallbackDataFilter(this, accepted);
    }

    @Override
    public String toString() {
        return "CallbackData(" + prefix + separator + String.join(separator, parts) + ")";
    }
}
