package io.herald4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.herald4j.ChatTransport;
import io.herald4j.telegram.TelegramBotApiTransport;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Telegram transport, active once {@code herald.telegram.bot-token} is set.
 * An application-provided {@link ChatTransport} takes precedence.
 */
@AutoConfiguration(before = HeraldConfig.class)
@ConditionalOnClass({TelegramBotApiTransport.class, RestTemplate.class})
@EnableConfigurationProperties(TelegramProperties.class)
@ConditionalOnProperty(prefix = "herald", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HeraldTelegramConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    @Bean
    @ConditionalOnMissingBean(ChatTransport.class)
    @ConditionalOnProperty(prefix = "herald.telegram", name = "bot-token")
    public TelegramBotApiTransport telegramTransport(TelegramProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(CONNECT_TIMEOUT);
        // long polls hold the request open for pollTimeout
        requestFactory.setReadTimeout(props.getPollTimeout().plus(CONNECT_TIMEOUT));

        return new TelegramBotApiTransport(
                new RestTemplate(requestFactory),
                objectMapper.getIfAvailable(ObjectMapper::new),
                props.getApiUrl(),
                props.getBotToken()
        );
    }
}
