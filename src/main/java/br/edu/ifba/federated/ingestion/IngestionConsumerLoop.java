package br.edu.ifba.federated.ingestion;

import br.edu.ifba.federated.shared.RecoveryEventLogger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Single sequential consumer of the ingestion topic.
 *
 * <p>Each record is processed to the end before its offset is committed, so a crash
 * mid-job causes redelivery. Records that do not decode to a valid job are logged,
 * dropped and committed. If the loop itself fails it is restarted after a delay.</p>
 */
@ApplicationScoped
public class IngestionConsumerLoop {

    private static final Logger LOG = Logger.getLogger(IngestionConsumerLoop.class);
    private static final String OPERATION = "ingestion-consumer";

    private final Supplier<Consumer<String, String>> consumerFactory;
    private final IngestionWorker worker;
    private final ObjectMapper objectMapper;
    private final RecoveryEventLogger recoveryLogger;
    private final String topic;
    private final Duration pollTimeout;
    private final Duration restartDelay;
    private final boolean enabled;

    private volatile boolean running = false;
    private volatile Consumer<String, String> activeConsumer;
    private Thread thread;

    @Inject
    public IngestionConsumerLoop(
            final KafkaClientFactory clientFactory,
            final IngestionWorker worker,
            final ObjectMapper objectMapper,
            final RecoveryEventLogger recoveryLogger,
            @ConfigProperty(name = "federated.kafka.topic", defaultValue = "doc_ingest") final String topic,
            @ConfigProperty(name = "federated.kafka.poll-timeout-ms", defaultValue = "1000") final long pollTimeoutMs,
            @ConfigProperty(name = "federated.kafka.restart-delay-ms", defaultValue = "5000") final long restartDelayMs,
            @ConfigProperty(name = "federated.kafka.worker.enabled", defaultValue = "true") final boolean enabled) {
        this(clientFactory::createConsumer, worker, objectMapper, recoveryLogger, topic,
            Duration.ofMillis(pollTimeoutMs), Duration.ofMillis(restartDelayMs), enabled);
    }

    public IngestionConsumerLoop(
            final Supplier<Consumer<String, String>> consumerFactory,
            final IngestionWorker worker,
            final ObjectMapper objectMapper,
            final RecoveryEventLogger recoveryLogger,
            final String topic,
            final Duration pollTimeout,
            final Duration restartDelay,
            final boolean enabled) {
        this.consumerFactory = consumerFactory;
        this.worker = worker;
        this.objectMapper = objectMapper;
        this.recoveryLogger = recoveryLogger;
        this.topic = topic;
        this.pollTimeout = pollTimeout;
        this.restartDelay = restartDelay;
        this.enabled = enabled;
    }

    void onStart(@Observes final StartupEvent event) {
        if (!enabled) {
            LOG.info("Ingestion worker disabled");
            return;
        }
        start();
    }

    void onStop(@Observes final ShutdownEvent event) {
        stop();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this::run, OPERATION);
        thread.setDaemon(true);
        thread.start();
        LOG.infof("Ingestion worker listening on topic %s", topic);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        final Consumer<String, String> consumer = activeConsumer;
        if (consumer != null) {
            consumer.wakeup();
        }
        if (thread != null) {
            try {
                thread.join(restartDelay.toMillis() + pollTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Ingestion worker stopped");
    }

    public boolean isRunning() {
        return running;
    }

    void run() {
        int restarts = 0;
        while (running) {
            try (Consumer<String, String> consumer = consumerFactory.get()) {
                activeConsumer = consumer;
                consumer.subscribe(List.of(topic));
                while (running) {
                    pollOnce(consumer);
                }
            } catch (WakeupException e) {
                if (!running) {
                    break;
                }
                restarts++;
                recoveryLogger.logRestart(OPERATION, restarts, e);
            } catch (RuntimeException e) {
                if (!running) {
                    break;
                }
                restarts++;
                LOG.errorf(e, "Ingestion consumer crashed");
                recoveryLogger.logRestart(OPERATION, restarts, e);
                if (!sleep(restartDelay)) {
                    break;
                }
            } finally {
                activeConsumer = null;
            }
        }
    }

    /**
     * Polls once and processes every record returned, committing after each.
     *
     * @return number of records handled
     */
    int pollOnce(final Consumer<String, String> consumer) {
        final ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
        int handled = 0;
        for (ConsumerRecord<String, String> record : records) {
            handle(record);
            consumer.commitSync(Map.of(
                new TopicPartition(record.topic(), record.partition()),
                new OffsetAndMetadata(record.offset() + 1)));
            handled++;
        }
        return handled;
    }

    void handle(final ConsumerRecord<String, String> record) {
        final IngestionJob job;
        try {
            if (record.value() == null) {
                throw new IngestionValidationException("empty message");
            }
            job = objectMapper.readValue(record.value(), IngestionJob.class).validate();
        } catch (JsonProcessingException | IngestionValidationException e) {
            LOG.warnf("Dropping message at %s-%d@%d: %s",
                record.topic(), record.partition(), record.offset(), e.getMessage());
            return;
        }
        final JobOutcome outcome = worker.process(job);
        LOG.debugf("Job %s finished with %s", job.path(), outcome);
    }

    private static boolean sleep(final Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
