package com.agentbridge.orchestrator.registry;

import com.agentbridge.orchestrator.adapter.AdapterCapability;
import com.agentbridge.orchestrator.adapter.ProtocolAdapter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicitly constructed registry of protocol adapters.
 *
 * <p>One instance per orchestrator; nothing here is static, so several
 * isolated registries can live side by side (tests, tenants). Registration
 * goes through {@link #register}; {@link com.agentbridge.orchestrator.config.AdapterBootstrap}
 * feeds it every adapter bean at startup.
 *
 * <p>Usage statistics are a running mean plus a counter per adapter, and the
 * same per protocol pair in the {@link CompatibilityMatrix}.
 */
public class AdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

    private record Registration(ProtocolAdapter adapter, int priority, boolean enabled) {
        Registration withEnabled(boolean value) { return new Registration(adapter, priority, value); }
    }

    private final Map<String, Registration>  adapters      = new ConcurrentHashMap<>();
    private final Map<String, Set<String>>   byCapability  = new ConcurrentHashMap<>();
    private final Map<String, AdapterUsage>  usage         = new ConcurrentHashMap<>();
    private final CompatibilityMatrix        compatibility = new CompatibilityMatrix();
    private final MeterRegistry              meterRegistry;

    public AdapterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    /**
     * Register an adapter under its manifest protocol id. An existing
     * registration is replaced only by one of equal or higher priority.
     *
     * @return true if the adapter is now the one registered for its protocol id
     */
    public boolean register(ProtocolAdapter adapter, RegistrationOptions options) {
        String protocolId = adapter.protocolId();
        Registration candidate = new Registration(adapter, options.priority(), options.enabled());

        Registration winner = adapters.merge(protocolId, candidate,
                (existing, incoming) -> incoming.priority() >= existing.priority() ? incoming : existing);
        if (winner != candidate) {
            log.warn("Ignoring adapter '{}' v{} (priority {}): already registered with priority {}",
                    protocolId, adapter.manifest().version(), options.priority(), winner.priority());
            return false;
        }

        reindex(protocolId, adapter);
        meterRegistry.counter("agentbridge.adapter.registrations", "protocol", protocolId).increment();
        log.info("Registered adapter '{}' v{} priority={} enabled={} capabilities={}",
                protocolId, adapter.manifest().version(), options.priority(), options.enabled(),
                adapter.getCapabilities().stream().map(AdapterCapability::name).toList());
        return true;
    }

    public boolean register(ProtocolAdapter adapter) {
        return register(adapter, RegistrationOptions.defaults());
    }

    /** Remove an adapter together with its capability index entries and usage figures. */
    public boolean unregister(String protocolId) {
        Registration removed = adapters.remove(protocolId);
        if (removed == null) return false;
        byCapability.values().forEach(ids -> ids.remove(protocolId));
        byCapability.values().removeIf(Set::isEmpty);
        usage.remove(protocolId);
        compatibility.removeProtocol(protocolId);
        log.info("Unregistered adapter '{}'", protocolId);
        return true;
    }

    public void setEnabled(String protocolId, boolean enabled) {
        Registration updated = adapters.computeIfPresent(protocolId, (id, r) -> r.withEnabled(enabled));
        if (updated == null) {
            throw new IllegalArgumentException("No adapter registered for protocol '" + protocolId + "'");
        }
        log.info("Adapter '{}' {}", protocolId, enabled ? "enabled" : "disabled");
    }

    private void reindex(String protocolId, ProtocolAdapter adapter) {
        byCapability.values().forEach(ids -> ids.remove(protocolId));
        for (AdapterCapability capability : adapter.getCapabilities()) {
            byCapability.computeIfAbsent(capability.name(), k -> ConcurrentHashMap.newKeySet()).add(protocolId);
        }
        byCapability.values().removeIf(Set::isEmpty);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /** Empty when nothing is registered under {@code protocolId} or it is disabled. */
    public Optional<ProtocolAdapter> getAdapter(String protocolId) {
        Registration r = adapters.get(protocolId);
        return r != null && r.enabled() ? Optional.of(r.adapter()) : Optional.empty();
    }

    /** The registered adapter whether or not it is enabled; used by management views. */
    public Optional<ProtocolAdapter> registered(String protocolId) {
        return Optional.ofNullable(adapters.get(protocolId)).map(Registration::adapter);
    }

    /** Enabled protocol ids declaring {@code capability}, highest priority first. */
    public List<String> findByCapability(String capability) {
        Set<String> ids = byCapability.getOrDefault(capability, Set.of());
        return ids.stream()
                .map(id -> Map.entry(id, adapters.get(id)))
                .filter(e -> e.getValue() != null && e.getValue().enabled())
                .sorted(Comparator.comparingInt((Map.Entry<String, Registration> e) -> e.getValue().priority())
                        .reversed()
                        .thenComparing(Map.Entry::getKey))
                .map(Map.Entry::getKey)
                .toList();
    }

    public boolean canTranslate(String sourceProtocol, String targetProtocol) {
        return getAdapter(sourceProtocol).isPresent() && getAdapter(targetProtocol).isPresent();
    }

    /** Registered protocol ids, enabled or not (sorted). */
    public List<String> protocolIds() {
        return adapters.keySet().stream().sorted().toList();
    }

    public boolean isEnabled(String protocolId) {
        Registration r = adapters.get(protocolId);
        return r != null && r.enabled();
    }

    public int priorityOf(String protocolId) {
        Registration r = adapters.get(protocolId);
        if (r == null) throw new IllegalArgumentException("No adapter registered for protocol '" + protocolId + "'");
        return r.priority();
    }

    // ------------------------------------------------------------------
    // Usage
    // ------------------------------------------------------------------

    public void recordUsage(String protocolId, double fidelity) {
        usage.merge(protocolId, AdapterUsage.NONE.record(fidelity), (old, ignored) -> old.record(fidelity));
    }

    public void recordPair(String sourceProtocol, String targetProtocol, double fidelity) {
        compatibility.record(sourceProtocol, targetProtocol, fidelity);
    }

    public AdapterUsage usage(String protocolId) {
        return usage.getOrDefault(protocolId, AdapterUsage.NONE);
    }

    public CompatibilityMatrix compatibility() {
        return compatibility;
    }
}
