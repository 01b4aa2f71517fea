package com.avatarflow.pipeline.config;

import com.avatarflow.pipeline.generation.GenerationProvider;
import com.avatarflow.pipeline.generation.HttpGenerationProvider;
import com.avatarflow.pipeline.repository.ContentArtifactRepository;
import com.avatarflow.pipeline.repository.GenerationBatchRepository;
import com.avatarflow.pipeline.repository.PlatformAccountHealthRepository;
import com.avatarflow.pipeline.repository.PlatformAccountRepository;
import com.avatarflow.pipeline.repository.ScheduledPostRepository;
import com.avatarflow.pipeline.safety.ModerationSafetyGate;
import com.avatarflow.pipeline.safety.SafetyGate;
import com.avatarflow.pipeline.scheduling.DispatchLock;
import com.avatarflow.pipeline.scheduling.LocalDispatchLock;
import com.avatarflow.pipeline.scheduling.RedisDispatchLock;
import com.avatarflow.pipeline.store.ContentStore;
import com.avatarflow.pipeline.store.InMemoryContentStore;
import com.avatarflow.pipeline.store.JpaContentStore;
import com.avatarflow.platform.connector.PlatformPublisher;
import com.avatarflow.platform.connector.PublisherRegistry;
import com.avatarflow.platform.connector.http.HttpPlatformPublisher;
import com.avatarflow.platform.connector.memory.InMemoryPlatformPublisher;
import com.avatarflow.platform.connector.model.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Wires the pipeline's pluggable parts: store, dispatch lock, external adapters and the
 * generation worker pool.
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random slotJitterRandom() {
        return new Random();
    }

    /**
     * Worker pool shared by all running batches. Queue is unbounded so a large batch is never
     * rejected outright.
     */
    @Bean("generationExecutor")
    public ThreadPoolTaskExecutor generationExecutor(PipelineProperties properties) {
        int poolSize = Math.max(1, properties.getGeneration().getWorkerPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("generation-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    // ---- Store ----

    @Bean
    @ConditionalOnProperty(name = "pipeline.store.type", havingValue = "memory", matchIfMissing = true)
    public ContentStore inMemoryContentStore() {
        log.info("Using in-memory content store; state is lost on restart");
        return new InMemoryContentStore();
    }

    @Bean
    @ConditionalOnProperty(name = "pipeline.store.type", havingValue = "jpa")
    public ContentStore jpaContentStore(ContentArtifactRepository artifactRepository,
                                        GenerationBatchRepository batchRepository,
                                        ScheduledPostRepository postRepository,
                                        PlatformAccountRepository accountRepository,
                                        PlatformAccountHealthRepository healthRepository) {
        log.info("Using JPA content store");
        return new JpaContentStore(artifactRepository, batchRepository, postRepository,
                accountRepository, healthRepository);
    }

    // ---- Dispatch lock ----

    @Bean
    @ConditionalOnProperty(name = "pipeline.dispatch.lock", havingValue = "local", matchIfMissing = true)
    public DispatchLock localDispatchLock() {
        return new LocalDispatchLock();
    }

    @Bean
    @ConditionalOnProperty(name = "pipeline.dispatch.lock", havingValue = "redis")
    public DispatchLock redisDispatchLock(StringRedisTemplate redisTemplate, PipelineProperties properties) {
        log.info("Dispatch ticks coordinated through Redis, lease {}", properties.getDispatch().getLockLease());
        return new RedisDispatchLock(redisTemplate, properties.getDispatch().getLockLease());
    }

    // ---- External adapters ----

    @Bean
    public GenerationProvider generationProvider(ObjectProvider<WebClient.Builder> webClientBuilder,
                                                 PipelineProperties properties) {
        return new HttpGenerationProvider(builder(webClientBuilder), properties.getGeneration().getProviderUrl());
    }

    @Bean
    public SafetyGate safetyGate(ObjectProvider<WebClient.Builder> webClientBuilder, PipelineProperties properties) {
        PipelineProperties.Safety safety = properties.getSafety();
        return new ModerationSafetyGate(builder(webClientBuilder), safety.getModerationUrl(), safety.getApiKey(),
                safety.getModerationModel(), safety.getTimeout());
    }

    @Bean
    public PublisherRegistry publisherRegistry(ObjectProvider<WebClient.Builder> webClientBuilder,
                                               PipelineProperties properties) {
        List<PlatformPublisher> publishers = new ArrayList<>();
        for (Platform platform : Platform.values()) {
            String url = properties.getConnectorUrls().get(platform);
            if (url == null || url.isBlank()) {
                log.warn("No connector URL for {}; posts are published to the in-memory adapter",
                        platform.getDisplayName());
                publishers.add(new InMemoryPlatformPublisher(platform));
            } else {
                log.info("Publishing {} through connector at {}", platform.getDisplayName(), url);
                publishers.add(new HttpPlatformPublisher(platform, builder(webClientBuilder), url));
            }
        }
        return new PublisherRegistry(publishers);
    }

    private static WebClient.Builder builder(ObjectProvider<WebClient.Builder> webClientBuilder) {
        // The auto-configured builder is a prototype, so each adapter gets its own copy
        return webClientBuilder.getIfAvailable(WebClient::builder);
    }
}
