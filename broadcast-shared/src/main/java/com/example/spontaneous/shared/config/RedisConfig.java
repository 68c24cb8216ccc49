package com.example.spontaneous.shared.config;

import com.example.spontaneous.shared.dto.BroadcastResponse;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.util.List;

@Configuration
@ConditionalOnProperty(prefix = "broadcast.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisConfig {

    @Bean
    public RedisTemplate<String, List<BroadcastResponse>> activeBroadcastsRedisTemplate(RedisConnectionFactory connectionFactory, ObjectMapper objectMapper) {
        RedisTemplate<String, List<BroadcastResponse>> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        JavaType type = objectMapper.getTypeFactory().constructCollectionType(List.class, BroadcastResponse.class);
        Jackson2JsonRedisSerializer<List<BroadcastResponse>> serializer = new Jackson2JsonRedisSerializer<>(objectMapper, type);

        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(serializer);
        return template;
    }
}
