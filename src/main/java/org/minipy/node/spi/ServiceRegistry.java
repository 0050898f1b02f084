package org.minipy.node.spi;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A small, type-safe container for the shared services controllers depend on, such as
 * the analyzer and the report writer.
 */
public final class ServiceRegistry {

    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    /**
     * Registers a service instance with the registry.
     *
     * @param type     The class type under which to register the service. This is typically an interface.
     * @param instance The singleton instance of the service.
     * @param <T>      The type of the service.
     * @throws IllegalArgumentException if a service for the given type is already registered.
     */
    public <T> void register(final Class<T> type, final T instance) {
        if (services.putIfAbsent(type, instance) != null) {
            throw new IllegalArgumentException("Service of type " + type.getName() + " is already registered.");
        }
    }

    /**
     * Retrieves a service instance from the registry.
     *
     * @param type The class type of the service to retrieve.
     * @param <T>  The type of the service.
     * @return The service instance.
     * @throws IllegalArgumentException if no service for the given type is found.
     */
    public <T> T get(final Class<T> type) {
        final Object instance = services.get(type);
        if (instance == null) {
            throw new IllegalArgumentException("No service registered for type " + type.getName());
        }
        return type.cast(instance);
    }

    /**
     * Checks if a service of the given type is already registered.
     *
     * @param type The class type to check.
     * @return true if a service is registered, false otherwise.
     */
    public boolean hasService(final Class<?> type) {
        return services.containsKey(type);
    }
}
