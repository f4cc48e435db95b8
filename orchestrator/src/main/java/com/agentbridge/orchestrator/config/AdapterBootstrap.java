package com.agentbridge.orchestrator.config;

import com.agentbridge.orchestrator.adapter.ProtocolAdapter;
import com.agentbridge.orchestrator.registry.AdapterRegistry;
import com.agentbridge.orchestrator.registry.RegistrationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Registers every {@link ProtocolAdapter} bean with the registry at startup.
 * Adding a protocol only requires declaring its adapter as a {@code @Component}.
 *
 * <pre>
 *   agentbridge.adapters.{protocolId}.priority   default 0
 *   agentbridge.adapters.disabled                comma-separated protocol ids
 * </pre>
 */
@Component
public class AdapterBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdapterBootstrap.class);

    private final AdapterRegistry       registry;
    private final List<ProtocolAdapter> adapters;
    private final Environment           environment;
    private final Set<String>           disabled;

    public AdapterBootstrap(AdapterRegistry registry,
                            List<ProtocolAdapter> adapters,
                            Environment environment,
                            @Value("${agentbridge.adapters.disabled:}") Set<String> disabled) {
        this.registry    = registry;
        this.adapters    = adapters;
        this.environment = environment;
        this.disabled    = disabled;
    }

    @Override
    public void run(ApplicationArguments args) {
        registerAll();
    }

    void registerAll() {
        for (ProtocolAdapter adapter : adapters) {
            String id = adapter.protocolId();
            int priority = environment.getProperty("agentbridge.adapters." + id + ".priority", Integer.class, 0);
            registry.register(adapter, new RegistrationOptions(priority, !disabled.contains(id)));
        }
        log.info("Adapter registry ready: {}", registry.protocolIds());
    }
}
