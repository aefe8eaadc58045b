package org.newslens.qa.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.newslens.cache.CacheKeyGenerator;
import org.newslens.cache.InMemoryResponseCache;
import org.newslens.cache.RedisResponseCache;
import org.newslens.cache.ResponseCache;
import org.newslens.client.CompletionClient;
import org.newslens.client.NewsDatabaseClient;
import org.newslens.client.NewsVectorSearchClient;
import org.newslens.client.UpstreamCallExecutor;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Central Spring configuration for the question answering infrastructure.
 *
 * <p>Wires the upstream clients (completion, vector search, relational store)
 * behind one timeout-enforcing executor, and selects the response cache
 * implementation from {@code qa.cache.type}.</p>
 */
@Configuration
public class QaAppConfig {

    // ----------------------------------------------------------------------
    // Executors
    // ----------------------------------------------------------------------

    @Bean(name = "upstreamCallTaskExecutor")
    public ThreadPoolTaskExecutor upstreamCallTaskExecutor(QaProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getTimeouts().getPoolSize());
        executor.setMaxPoolSize(props.getTimeouts().getPoolSize());
        executor.setQueueCapacity(props.getTimeouts().getQueueCapacity());
        executor.setThreadNamePrefix("upstream-call-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public UpstreamCallExecutor upstreamCallExecutor(
            @Qualifier("upstreamCallTaskExecutor") ThreadPoolTaskExecutor upstreamCallTaskExecutor) {
        return new UpstreamCallExecutor(upstreamCallTaskExecutor.getThreadPoolExecutor());
    }

    @Bean(name = "batchAnswerExecutor")
    public ThreadPoolTaskExecutor batchAnswerExecutor(QaProperties props) {
        QaProperties.Batch batch = props.getBatch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(batch.getPoolSize());
        executor.setMaxPoolSize(batch.getPoolSize());
        executor.setQueueCapacity(batch.getQueueCapacity());
        executor.setThreadNamePrefix("batch-answer-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(batch.getAwaitTermination().toMillis());
        executor.initialize();
        return executor;
    }

    /**
     * Runtime options switching OpenAI into JSON-object response mode.
     * Model name and temperature still come from {@code spring.ai.openai.chat.options.*}.
     */
    @Bean
    public ChatOptions jsonObjectChatOptions() {
        return OpenAiChatOptions.builder()
                .responseFormat(ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build())
                .build();
    }

    @Bean
    public CompletionClient completionClient(ChatModel chatModel,
                                             ChatOptions jsonObjectChatOptions,
                                             UpstreamCallExecutor upstreamCallExecutor,
                                             QaProperties props) {
        return new CompletionClient(chatModel, jsonObjectChatOptions, upstreamCallExecutor,
                props.getTimeouts().getCompletion());
    }

    @Bean
    public NewsVectorSearchClient newsVectorSearchClient(VectorStore vectorStore,
                                                         UpstreamCallExecutor upstreamCallExecutor,
                                                         QaProperties props) {
        return new NewsVectorSearchClient(vectorStore, upstreamCallExecutor,
                props.getTimeouts().getVectorSearch(), props.getMinScore());
    }

    /**
     * Uses its own {@link JdbcTemplate} because the client sets a row cap and a
     * query timeout on it.
     */
    @Bean
    public NewsDatabaseClient newsDatabaseClient(DataSource dataSource,
                                                 UpstreamCallExecutor upstreamCallExecutor,
                                                 QaProperties props) {
        QaProperties.Statistics statistics = props.getStatistics();
        return new NewsDatabaseClient(new JdbcTemplate(dataSource), upstreamCallExecutor,
                props.getTimeouts().getDatabase(), statistics.getMaxRows(),
                statistics.getSchemaCacheTtl(), Clock.systemUTC());
    }

    // ----------------------------------------------------------------------
    // Response cache
    // ----------------------------------------------------------------------

    @Bean
    public CacheKeyGenerator cacheKeyGenerator(QaProperties props) {
        return new CacheKeyGenerator(props.getCache().getPrefix());
    }

    @Bean
    @ConditionalOnProperty(prefix = "qa.cache", name = "type", havingValue = "redis", matchIfMissing = true)
    public ResponseCache redisResponseCache(StringRedisTemplate redisTemplate,
                                            ObjectMapper objectMapper,
                                            CacheKeyGenerator cacheKeyGenerator) {
        return new RedisResponseCache(redisTemplate, objectMapper, cacheKeyGenerator);
    }

    @Bean
    @ConditionalOnProperty(prefix = "qa.cache", name = "type", havingValue = "memory")
    public ResponseCache inMemoryResponseCache(CacheKeyGenerator cacheKeyGenerator) {
        return new InMemoryResponseCache(cacheKeyGenerator);
    }
}
