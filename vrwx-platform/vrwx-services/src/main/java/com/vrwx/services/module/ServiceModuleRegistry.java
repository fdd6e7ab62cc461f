package com.vrwx.services.module;

import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.ServiceType;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup of scoring modules by service type, wire id or service type hash.
 */
public class ServiceModuleRegistry {

    private final Map<ServiceType, ServiceModule> modules = new ConcurrentHashMap<>();

    public ServiceModuleRegistry(Clock clock) {
        register(new InspectionModule(clock));
        register(new PatrolModule(clock));
        register(new DeliveryModule(clock));
    }

    public ServiceModuleRegistry() {
        this(Clock.systemUTC());
    }

    /**
     * Registers a module, replacing any module for the same service type.
     */
    public void register(ServiceModule module) {
        if (module == null) {
            throw new IllegalArgumentException("Module cannot be null");
        }
        modules.put(module.id(), module);
    }

    public Optional<ServiceModule> find(ServiceType type) {
        return Optional.ofNullable(modules.get(type));
    }

    public ServiceModule getModule(ServiceType type) {
        return find(type).orElseThrow(() -> new IllegalArgumentException("Unknown service type: " + type));
    }

    public ServiceModule getModule(String id) {
        ServiceType type = ServiceType.fromId(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown service type: " + id));
        return getModule(type);
    }

    public Optional<ServiceModule> findByHash(Bytes32 typeHash) {
        return ServiceType.fromHash(typeHash).flatMap(this::find);
    }

    public boolean isSupported(String id) {
        return ServiceType.fromId(id).map(modules::containsKey).orElse(false);
    }

    public Set<ServiceType> supportedTypes() {
        return Collections.unmodifiableSet(EnumSet.copyOf(modules.keySet()));
    }

    public Optional<ServiceDefinition> definition(ServiceType type) {
        return find(type).map(ServiceModule::definition);
    }

    /**
     * Definitions of every registered service, in service type order.
     */
    public List<ServiceDefinition> definitions() {
        List<ServiceDefinition> definitions = new ArrayList<>();
        for (ServiceType type : ServiceType.values()) {
            find(type).ifPresent(m -> definitions.add(m.definition()));
        }
        return definitions;
    }
}
