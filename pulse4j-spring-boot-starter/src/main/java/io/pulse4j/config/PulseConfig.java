package io.pulse4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.Orchestrator;
import io.pulse4j.QueueJobHandler;
import io.pulse4j.core.QueueJobHandlerRegistry;
import io.pulse4j.internal.DefaultOrchestrator;
import io.pulse4j.internal.Slf4jActivityMonitor;
import io.pulse4j.internal.handlers.CampaignJobHandler;
import io.pulse4j.internal.handlers.CleanupJobHandler;
import io.pulse4j.internal.handlers.EmailJobHandler;
import io.pulse4j.internal.mongo.MongoJobStore;
import io.pulse4j.spi.ActivityMonitor;
import io.pulse4j.spi.CampaignSource;
import io.pulse4j.spi.ContentGenerator;
import io.pulse4j.spi.DeliveryService;
import io.pulse4j.spi.EmailSender;
import io.pulse4j.spi.JobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Spring Boot auto-configuration entrypoint for pulse4j.
 *
 * <p>The orchestrator is only created when the application provides a {@link ContentGenerator}
 * and a {@link DeliveryService}. The e-mail and campaign handlers follow their collaborators.
 */
@AutoConfiguration
@ConditionalOnClass({Orchestrator.class, MongoTemplate.class})
@EnableConfigurationProperties(PulseProperties.class)
@ConditionalOnProperty(prefix = "pulse", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PulseConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock pulseClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    public MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
        return new MongoJobStore(mongoTemplate, objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    protected PulseMongoIndexConfig pulseMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new PulseMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(ActivityMonitor.class)
    public Slf4jActivityMonitor slf4jActivityMonitor() {
        return new Slf4jActivityMonitor();
    }

    @Bean
    @ConditionalOnBean(EmailSender.class)
    @ConditionalOnMissingBean
    public EmailJobHandler emailJobHandler(EmailSender sender) {
        return new EmailJobHandler(sender);
    }

    @Bean
    @ConditionalOnBean(CampaignSource.class)
    @ConditionalOnMissingBean
    public CampaignJobHandler campaignJobHandler(CampaignSource campaigns, JobStore store) {
        return new CampaignJobHandler(campaigns, store);
    }

    @Bean
    @ConditionalOnMissingBean
    public CleanupJobHandler cleanupJobHandler(JobStore store, Clock clock) {
        return new CleanupJobHandler(store, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueJobHandlerRegistry queueJobHandlerRegistry(ObjectProvider<QueueJobHandler<?>> handlersProvider) {
        List<QueueJobHandler<?>> handlers = handlersProvider.orderedStream().collect(Collectors.toList());
        return new QueueJobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnBean({ContentGenerator.class, DeliveryService.class})
    @ConditionalOnMissingBean
    public Orchestrator orchestrator(PulseProperties props,
                                     JobStore store,
                                     ContentGenerator generator,
                                     DeliveryService delivery,
                                     ActivityMonitor monitor,
                                     QueueJobHandlerRegistry registry,
                                     ObjectMapper om,
                                     Clock clock) {
        return new DefaultOrchestrator(props, store, generator, delivery, monitor, registry, om, clock);
    }

    @Bean
    @ConditionalOnBean({ContentGenerator.class, DeliveryService.class})
    @ConditionalOnMissingBean
    public PulseLifecycle pulseLifecycle(Orchestrator orchestrator) {
        return new PulseLifecycle(orchestrator);
    }

    @Bean
    @ConditionalOnProperty(prefix = "pulse", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton pulseIndexesInitializer(PulseMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
