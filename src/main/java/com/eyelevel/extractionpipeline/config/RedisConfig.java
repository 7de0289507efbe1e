package com.eyelevel.extractionpipeline.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

/**
 * Redis beans used by the job queue. Only active when the Redis job store is selected.
 */
@Configuration
@ConditionalOnProperty(name = "app.pipeline.queue.store", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    /**
     * Guarded field update of a job hash. Applies the given field/value pairs only when the hash exists
     * and its current status matches the expected one ("*" accepts any status). Returns 1 when applied.
     *
     * @return the compiled script definition.
     */
    @Bean
    public RedisScript<Long> jobFieldUpdateScript() {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource("scripts/update-job-fields.lua")));
        script.setResultType(Long.class);
        return script;
    }
}
