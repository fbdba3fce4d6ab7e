package br.edu.ifba.federated.ingestion;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.Properties;

/**
 * Builds the Kafka clients of the ingestion queue.
 *
 * <p>The producer is a shared singleton. Consumers are created on demand because a
 * {@link KafkaConsumer} must stay on the thread that polls it.</p>
 *
 * <pre>
 * federated.kafka.bootstrap-servers=localhost:9092
 * federated.kafka.group-id=enterprise_worker
 * </pre>
 */
@ApplicationScoped
public class KafkaClientFactory {

    private static final Logger LOG = Logger.getLogger(KafkaClientFactory.class);

    // One job per poll; a job can run for minutes
    private static final int MAX_POLL_RECORDS = 1;
    private static final int MAX_POLL_INTERVAL_MS = 3_600_000;

    @ConfigProperty(name = "federated.kafka.bootstrap-servers", defaultValue = "localhost:9092")
    String bootstrapServers;

    @ConfigProperty(name = "federated.kafka.group-id", defaultValue = "enterprise_worker")
    String groupId;

    public Consumer<String, String> createConsumer() {
        final Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, MAX_POLL_RECORDS);
        props.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, MAX_POLL_INTERVAL_MS);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        LOG.infof("Creating Kafka consumer for group %s at %s", groupId, bootstrapServers);
        return new KafkaConsumer<>(props);
    }

    @Produces
    @Singleton
    public Producer<String, String> produceProducer() {
        final Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        LOG.infof("Creating Kafka producer at %s", bootstrapServers);
        return new KafkaProducer<>(props);
    }

    void closeProducer(@Disposes final Producer<String, String> producer) {
        producer.close();
    }
}
