package com.ammann.glycemia.health;

import com.ammann.glycemia.registry.IndexRegistry;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness health check reporting the application as alive together with the number of
 * registered glycemic indices.
 */
@Liveness
public class LivenessCheck implements HealthCheck
{

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.named("alive")
                .withData("indices", IndexRegistry.names().size())
                .up()
                .build();
    }

}
