package com.botwire.dispatch.filter;

import com.botwire.api.types.UpdateKind;
import com.botwire.common.errors.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Filter name to factory. Starts with the built-ins ({@code content_types}, {@code commands},
 * {@code regexp}, {@code chat_types}, {@code func}); custom filters are added by name.
 */
@Slf4j
public class FilterRegistry {

    private static final Set<String> BUILTIN_NAMES = Set.of(
            Filters.CONTENT_TYPES, Filters.COMMANDS, Filters.REGEXP, Filters.CHAT_TYPES, Filters.FUNC);

    private final Map<String, FilterFactory> factories = new ConcurrentHashMap<>();

    public FilterRegistry() {
        factories.put(Filters.CONTENT_TYPES, BuiltinFilters::contentTypes);
        factories.put(Filters.COMMANDS, BuiltinFilters::commands);
        factories.put(Filters.REGEXP, BuiltinFilters::regexp);
        factories.put(Filters.CHAT_TYPES, BuiltinFilters::chatTypes);
        factories.put(Filters.FUNC, BuiltinFilters::func);
    }

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * Register a filter factory. A later registration under the same name replaces the earlier one.
     *
     * @throws ConfigurationException if {@code name} is a built-in
     */
    public void registerFilter(String name, FilterFactory factory) {
        Objects.requireNonNull(factory, "factory");
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("filter name must not be blank");
        }
        if (BUILTIN_NAMES.contains(name)) {
            throw new ConfigurationException("cannot replace built-in filter '" + name + "'");
        }
        if (factories.put(name, factory) != null) {
            log.debug("Replaced filter '{}'", name);
        }
    }

    /**
     * The registration argument must be a Boolean; the filter matches when
     * {@link SimpleCustomFilter#check} returns it.
     */
    public void registerCustomFilter(SimpleCustomFilter filter) {
        registerFilter(filter.key(), (kind, argument) -> {
            if (!(argument instanceof Boolean expected)) {
                throw new ConfigurationException(filter.key() + ": expected true or false, got "
                        + BuiltinFilters.describe(argument));
            }
            return update -> filter.check(update) == expected;
        });
    }

    public void registerCustomFilter(AdvancedCustomFilter filter) {
        registerFilter(filter.key(), (kind, argument) -> {
            if (argument == null) {
                throw new ConfigurationException(filter.key() + ": an argument is required");
            }
            filter.validate(argument);
            return update -> filter.check(update, argument);
        });
    }

    public boolean hasFilter(String name) {
        return factories.containsKey(name);
    }

    public Set<String> filterNames() {
        return Set.copyOf(factories.keySet());
    }

    // =========================================================================
    // Resolution
    // =========================================================================

    /**
     * @throws ConfigurationException for an unknown name or an argument the factory rejects
     */
    public ResolvedFilter resolve(UpdateKind kind, FilterSpec spec) {
        FilterFactory factory = factories.get(spec.name());
        if (factory == null) {
            throw new ConfigurationException("unknown filter '" + spec.name() + "'; register it before use");
        }
        UpdateFilter predicate = factory.create(kind, spec.argument());
        if (predicate == null) {
            throw new ConfigurationException("filter '" + spec.name() + "' produced no predicate");
        }
        return new ResolvedFilter(spec, predicate);
    }

    public List<ResolvedFilter> resolveAll(UpdateKind kind, List<FilterSpec> specs) {
        List<ResolvedFilter> resolved = new ArrayList<>(specs.size());
        for (FilterSpec spec : specs) {
            resolved.add(resolve(kind, spec));
        }
        return List.copyOf(resolved);
    }
}
