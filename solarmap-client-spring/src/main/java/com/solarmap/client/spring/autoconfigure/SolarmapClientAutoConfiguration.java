package com.solarmap.client.spring.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.solarmap.client.api.TaskScheduler;
import com.solarmap.client.core.RequestExecutor;
import com.solarmap.client.core.ResponseDecoder;
import com.solarmap.client.core.cache.InMemoryResponseCache;
import com.solarmap.client.core.cache.ResponseCache;
import com.solarmap.client.core.schedule.ExecutorTaskScheduler;
import com.solarmap.client.sensors.SensorDataClient;
import com.solarmap.client.transport.HttpTransport;
import com.solarmap.client.transport.jdkhttp.JdkHttpTransport;
import com.solarmap.client.transport.okhttp.OkHttpTransport;
import com.solarmap.series.TimeBucketAggregator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires a {@link SensorDataClient}, preferring OkHttp when it is on the classpath. */
@AutoConfiguration
@EnableConfigurationProperties(SolarmapClientProperties.class)
public class SolarmapClientAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(OkHttpTransport.class)
    static class OkHttpTransportConfig {
        @Bean
        @ConditionalOnMissingBean(HttpTransport.class)
        public HttpTransport okHttpTransport() {
            return new OkHttpTransport();
        }
    }

    @Bean
    @ConditionalOnMissingBean(HttpTransport.class)
    public HttpTransport jdkHttpTransport() {
        return new JdkHttpTransport();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskScheduler solarmapTaskScheduler() {
        return new ExecutorTaskScheduler();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseCache solarmapResponseCache() {
        return new InMemoryResponseCache();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseDecoder solarmapResponseDecoder(ObjectProvider<ObjectMapper> objectMapper) {
        return new ResponseDecoder(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestExecutor solarmapRequestExecutor(
            HttpTransport transport, ResponseCache cache, TaskScheduler scheduler, ResponseDecoder decoder) {
        return new RequestExecutor(transport, cache, scheduler, decoder);
    }

    @Bean
    @ConditionalOnMissingBean
    public TimeBucketAggregator timeBucketAggregator(SolarmapClientProperties properties) {
        return properties.getZone() != null
                ? new TimeBucketAggregator(properties.getZone())
                : new TimeBucketAggregator();
    }

    @Bean
    @ConditionalOnMissingBean
    public SensorDataClient sensorDataClient(
            RequestExecutor executor, TimeBucketAggregator aggregator, SolarmapClientProperties properties) {
        return new SensorDataClient(executor, aggregator, properties.toSettings());
    }
}
