package br.edu.ifba.federated.shared;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import redis.clients.jedis.JedisPooled;

import java.net.URI;

/**
 * CDI producer for the pooled Redis client shared by the ledger, the notification
 * channel and the FalkorDB graph adapter.
 *
 * <p>Example configuration:</p>
 * <pre>
 * federated.redis.url=redis://localhost:6379
 * </pre>
 */
@ApplicationScoped
public class RedisConnectionProvider {

    private static final Logger LOG = Logger.getLogger(RedisConnectionProvider.class);

    @ConfigProperty(name = "federated.redis.url", defaultValue = "redis://localhost:6379")
    String redisUrl;

    @Produces
    @Singleton
    public JedisPooled produceJedis() {
        LOG.infof("Connecting to Redis at %s", redisUrl);
        return new JedisPooled(URI.create(redisUrl));
    }

    void closeJedis(@Disposes final JedisPooled jedis) {
        LOG.info("Closing Redis connection pool");
        jedis.close();
    }
}
