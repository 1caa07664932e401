package io.remind4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.remind4j.Reminders;
import io.remind4j.core.ScheduleStore;
import io.remind4j.delivery.DeliveryClient;
import io.remind4j.delivery.ExponentialBackoff;
import io.remind4j.delivery.MessagingApi;
import io.remind4j.delivery.RetryingDeliveryClient;
import io.remind4j.internal.DefaultReminders;
import io.remind4j.internal.mongo.MongoScheduleStore;
import io.remind4j.letta.LettaMessagingApi;
import io.remind4j.recipient.RecipientDirectory;
import io.remind4j.recipient.RecipientResolver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for the reminder engine.
 */
@AutoConfiguration
@ConditionalOnClass({Reminders.class, MongoTemplate.class})
@EnableConfigurationProperties(RemindProperties.class)
@ConditionalOnProperty(prefix = "remind", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RemindAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ScheduleStore scheduleStore(MongoTemplate mongoTemplate) {
        return new MongoScheduleStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected RemindMongoIndexConfig remindMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new RemindMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(MessagingApi.class)
    public LettaMessagingApi lettaMessagingApi(RemindProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        return new LettaMessagingApi(props.getLetta().toSettings(), objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryClient deliveryClient(RemindProperties props, MessagingApi messagingApi) {
        RemindProperties.Delivery d = props.getDelivery();
        return new RetryingDeliveryClient(messagingApi, d.getMaxAttempts(),
                new ExponentialBackoff(d.getBaseDelay(), d.getMaxDelay()));
    }

    @Bean
    @ConditionalOnMissingBean
    public RecipientResolver recipientResolver(RemindProperties props, ObjectProvider<RecipientDirectory> directory) {
        return new RecipientResolver(props.getDefaultRecipientId(), directory.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public Reminders reminders(RemindProperties props, ScheduleStore store, DeliveryClient deliveryClient,
                               ObjectProvider<RecipientDirectory> directory) {
        return new DefaultReminders(store, deliveryClient, props.toOptions(), Clock.systemUTC(),
                directory.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public RemindLifecycle remindLifecycle(RemindProperties props, Reminders reminders) {
        return new RemindLifecycle(reminders, props.isAutoStart());
    }

    @Bean
    @ConditionalOnProperty(prefix = "remind", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton remindIndexesInitializer(RemindMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
