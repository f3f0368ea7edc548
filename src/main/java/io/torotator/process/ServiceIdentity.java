package io.torotator.process;

import java.util.Map;

public record ServiceIdentity(
        String service,
        int port
) {
    public ServiceIdentity {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service name cannot be empty");
        }
    }

    public Map<String, String> logContext() {
        return Map.of("service", service, "port", Integer.toString(port));
    }

    @Override
    public String toString() {
        return service + ":" + port;
    }
}
