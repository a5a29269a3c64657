package io.webtimer4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.webtimer4j.NotificationDispatcher;
import io.webtimer4j.RequestExecutor;
import io.webtimer4j.WebTimer;
import io.webtimer4j.core.Schedule;
import io.webtimer4j.history.HistoryStore;
import io.webtimer4j.history.InMemoryHistoryStore;
import io.webtimer4j.internal.DefaultWebTimer;
import io.webtimer4j.internal.http.OkHttpRequestExecutor;
import io.webtimer4j.internal.mongo.MongoHistoryStore;
import io.webtimer4j.internal.udp.NotificationPayloadMapper;
import io.webtimer4j.internal.udp.UdpNotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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

/**
 * Spring Boot auto-configuration entrypoint for WebTimer components.
 *
 * <p>History goes to MongoDB when a {@link MongoTemplate} bean exists, otherwise to an in-memory store.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@ConditionalOnClass(WebTimer.class)
@EnableConfigurationProperties(WebTimerProperties.class)
@ConditionalOnProperty(prefix = "webtimer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WebTimerConfig {
    private static final Logger log = LoggerFactory.getLogger(WebTimerConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public HistoryStore webTimerHistoryStore(WebTimerProperties props, ObjectProvider<MongoTemplate> mongoTemplate) {
        MongoTemplate template = mongoTemplate.getIfAvailable();
        if (template == null) {
            log.info("No MongoTemplate available; request history is kept in memory");
            return new InMemoryHistoryStore();
        }
        return new MongoHistoryStore(template, props.getHistory().getCollection());
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestExecutor webTimerRequestExecutor(WebTimerProperties props, ObjectProvider<ObjectMapper> om) {
        return new OkHttpRequestExecutor(props.getHttp(), om.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher webTimerNotificationDispatcher(WebTimerProperties props, ObjectProvider<ObjectMapper> om) {
        NotificationPayloadMapper mapper = new NotificationPayloadMapper(
                om.getIfAvailable(ObjectMapper::new), props.getApplicationName(), props.getApplicationVersion());
        return new UdpNotificationDispatcher(mapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public WebTimer webTimer(WebTimerProperties props,
                             RequestExecutor executor,
                             HistoryStore historyStore,
                             NotificationDispatcher dispatcher) {
        WebTimer webTimer = new DefaultWebTimer(props, executor, historyStore, dispatcher);
        for (WebTimerProperties.ScheduleDefinition definition : props.getSchedules()) {
            Schedule schedule = definition.toSchedule(props.getDefaultTimezone());
            webTimer.addSchedule(schedule);
        }
        return webTimer;
    }

    @Bean
    @ConditionalOnMissingBean
    public WebTimerLifecycle webTimerLifecycle(WebTimer webTimer, WebTimerProperties props) {
        return new WebTimerLifecycle(webTimer, props.isAutoStart());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MongoTemplate.class)
    protected WebTimerMongoIndexConfig webTimerMongoIndexConfig(MongoTemplate mongoTemplate, WebTimerProperties props) {
        return new WebTimerMongoIndexConfig(mongoTemplate, props.getHistory().getCollection());
    }

    @Bean
    @ConditionalOnProperty(prefix = "webtimer.history", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton webTimerIndexesInitializer(ObjectProvider<WebTimerMongoIndexConfig> indexConfig) {
        return () -> indexConfig.ifAvailable(WebTimerMongoIndexConfig::ensureIndexes);
    }
}
