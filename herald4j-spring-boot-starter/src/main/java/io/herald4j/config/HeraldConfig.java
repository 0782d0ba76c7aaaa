package io.herald4j.config;

import io.herald4j.ChatTransport;
import io.herald4j.JobStore;
import io.herald4j.MessageScheduler;
import io.herald4j.conversation.ConversationRegistry;
import io.herald4j.conversation.ScheduleCommandHandler;
import io.herald4j.internal.SchedulingEngine;
import io.herald4j.internal.mongo.MongoJobStore;
import io.herald4j.telegram.TelegramBotApiTransport;
import io.herald4j.telegram.TelegramUpdatePoller;
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

/**
 * Spring Boot auto-configuration entrypoint for the message scheduler.
 *
 * <p>The store is always configured. The scheduler, the command handler and the lifecycle need a
 * {@link ChatTransport} bean, either the Telegram one or one supplied by the application.
 */
@AutoConfiguration
@ConditionalOnClass({MessageScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "herald", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HeraldConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock heraldClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    public MongoJobStore mongoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public HeraldMongoIndexConfig heraldMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new HeraldMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(MessageScheduler.class)
    @ConditionalOnBean(ChatTransport.class)
    public SchedulingEngine messageScheduler(SchedulerProperties props, JobStore jobStore, ChatTransport transport, Clock clock) {
        return new SchedulingEngine(props, jobStore, transport, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConversationRegistry conversationRegistry(SchedulerProperties props, Clock clock) {
        return new ConversationRegistry(props.getConversationTtl(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ChatTransport.class)
    public ScheduleCommandHandler scheduleCommandHandler(MessageScheduler scheduler,
                                                         ChatTransport transport,
                                                         ConversationRegistry conversations,
                                                         Clock clock) {
        return new ScheduleCommandHandler(scheduler, transport, conversations, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TelegramBotApiTransport.class)
    @ConditionalOnProperty(prefix = "herald.telegram", name = "polling-enabled", havingValue = "true", matchIfMissing = true)
    public TelegramUpdatePoller telegramUpdatePoller(TelegramBotApiTransport transport,
                                                     ScheduleCommandHandler handler,
                                                     TelegramProperties telegramProperties) {
        return new TelegramUpdatePoller(transport, handler, telegramProperties.getPollTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ChatTransport.class)
    public HeraldLifecycle heraldLifecycle(MessageScheduler scheduler, ObjectProvider<TelegramUpdatePoller> poller) {
        return new HeraldLifecycle(scheduler, poller.getIfAvailable());
    }

    @Bean
    @ConditionalOnProperty(prefix = "herald", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton heraldIndexesInitializer(HeraldMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
