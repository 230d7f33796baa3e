package io.fieldledger.core.conflict;

import io.fieldledger.core.EventKind;
import io.fieldledger.core.payload.CounterDelta;
import io.fieldledger.core.payload.MembershipChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.LineNumberReader;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Which {@link ConflictPolicy} governs each {@link EventKind}. Data, not code: loaded from
 * {@code conflict-policies.properties} and checked in full before anything is resolved.
 */
public final class ConflictPolicyTable {
    private static final Logger log = LoggerFactory.getLogger(ConflictPolicyTable.class);

    public static final String RESOURCE = "/conflict-policies.properties";

    private final Map<EventKind, PolicyBinding> bindings;
    private final Map<String, MergeFunction> functions;

    private ConflictPolicyTable(Map<EventKind, PolicyBinding> bindings, Map<String, MergeFunction> functions) {
        this.bindings = bindings;
        this.functions = functions;
    }

    /** The bundled table with the built-in merge functions. */
    public static ConflictPolicyTable defaults() {
        try (var in = ConflictPolicyTable.class.getResourceAsStream(RESOURCE)) {
            if (in == null) throw new PolicyConfigurationException(RESOURCE + " not found on classpath");
            return load(in, List.of(new SingleActiveAssignment()));
        } catch (IOException e) {
            throw new PolicyConfigurationException("cannot read " + RESOURCE, e);
        }
    }

    /**
     * Parse {@code kind=POLICY} / {@code kind=DOMAIN:function} lines.
     * Duplicates are detected here, which {@link java.util.Properties} would hide.
     *
     * @throws PolicyConfigurationException on a missing, unknown or duplicated kind, an
     *         unknown policy, an unregistered merge function, or a CRDT kind whose payload
     *         has no commutative merge
     */
    public static ConflictPolicyTable load(InputStream in, Collection<? extends MergeFunction> mergeFunctions) throws IOException {
        var entries = new HashMap<String, String>();
        var reader = new LineNumberReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            line = line.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            int eq = line.indexOf('=');
            if (eq < 0) throw new PolicyConfigurationException("line " + reader.getLineNumber() + ": expected kind=POLICY");
            var key = line.substring(0, eq).strip();
            if (entries.put(key, line.substring(eq + 1).strip()) != null) {
                throw new PolicyConfigurationException("line " + reader.getLineNumber() + ": duplicate kind " + key);
            }
        }
        return of(entries, mergeFunctions);
    }

    public static ConflictPolicyTable of(Map<String, String> entries, Collection<? extends MergeFunction> mergeFunctions) {
        return build(entries, mergeFunctions, true);
    }

    /** Table for some kinds only; resolving any other kind throws {@link UnconfiguredPolicyException}. */
    public static ConflictPolicyTable partial(Map<String, String> entries, Collection<? extends MergeFunction> mergeFunctions) {
        return build(entries, mergeFunctions, false);
    }

    private static ConflictPolicyTable build(Map<String, String> entries, Collection<? extends MergeFunction> mergeFunctions,
                                             boolean complete) {
        var functions = new HashMap<String, MergeFunction>();
        for (var fn : mergeFunctions) {
            if (functions.put(fn.name(), fn) != null) {
                throw new PolicyConfigurationException("merge function registered twice: " + fn.name());
            }
        }

        var bindings = new EnumMap<EventKind, PolicyBinding>(EventKind.class);
        entries.forEach((wire, value) -> {
            EventKind kind;
            try {
                kind = EventKind.fromWire(wire);
            } catch (RuntimeException e) {
                throw new PolicyConfigurationException("unknown event kind '" + wire + "'", e);
            }
            bindings.put(kind, parse(kind, value, functions));
        });

        Set<EventKind> missing = new HashSet<>(Set.of(EventKind.values()));
        missing.removeAll(bindings.keySet());
        if (complete && !missing.isEmpty()) {
            throw new PolicyConfigurationException("no policy for " + missing.stream().map(EventKind::wireName).sorted().toList());
        }
        log.debug("Loaded conflict policies for {} kinds", bindings.size());
        return new ConflictPolicyTable(Map.copyOf(bindings), Map.copyOf(functions));
    }

    private static PolicyBinding parse(EventKind kind, String value, Map<String, MergeFunction> functions) {
        var parts = value.split(":", 2);
        ConflictPolicy policy;
        try {
            policy = ConflictPolicy.valueOf(parts[0].strip());
        } catch (IllegalArgumentException e) {
            throw new PolicyConfigurationException(kind.wireName() + ": unknown policy '" + parts[0] + "'", e);
        }
        String fn = parts.length > 1 ? parts[1].strip() : null;
        switch (policy) {
            case DOMAIN -> {
                if (fn == null || fn.isEmpty()) {
                    throw new PolicyConfigurationException(kind.wireName() + ": DOMAIN needs a merge function name");
                }
                if (!functions.containsKey(fn)) {
                    throw new PolicyConfigurationException(kind.wireName() + ": merge function '" + fn + "' is not registered");
                }
            }
            case CRDT -> {
                var type = kind.payloadType();
                if (!CounterDelta.class.isAssignableFrom(type) && !MembershipChange.class.isAssignableFrom(type)) {
                    throw new PolicyConfigurationException(kind.wireName() + ": payload has no commutative merge");
                }
            }
            default -> {
                if (fn != null) throw new PolicyConfigurationException(kind.wireName() + ": only DOMAIN takes a function name");
            }
        }
        return new PolicyBinding(kind, policy, fn);
    }

    /** @throws UnconfiguredPolicyException when the kind has no row */
    public PolicyBinding bindingFor(EventKind kind) {
        var binding = bindings.get(kind);
        if (binding == null) throw new UnconfiguredPolicyException(kind);
        return binding;
    }

    public ConflictPolicy policyFor(EventKind kind) {
        return bindingFor(kind).policy();
    }

    public Optional<MergeFunction> mergeFunction(EventKind kind) {
        var binding = bindingFor(kind);
        return binding.mergeFunction() == null ? Optional.empty() : Optional.ofNullable(functions.get(binding.mergeFunction()));
    }
}
