package com.sensor.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AerospikeConfig {

    public static final String SET_SENSOR_WINDOWS = "sensor_windows";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:sensors}")
    private String namespace;

    @Value("${aerospike.total-timeout-ms:3000}")
    private int totalTimeoutMs;

    @Value("${aerospike.socket-timeout-ms:1000}")
    private int socketTimeoutMs;

    @Value("${aerospike.max-retries:2}")
    private int maxRetries;

    @Value("${aerospike.sleep-between-retries-ms:50}")
    private int sleepBetweenRetriesMs;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 300;
        clientPolicy.timeout = 5000;
        // Start even when the node is briefly unreachable at boot
        clientPolicy.failIfNotConnected = false;

        clientPolicy.readPolicyDefault.totalTimeout = totalTimeoutMs;
        clientPolicy.readPolicyDefault.socketTimeout = socketTimeoutMs;

        clientPolicy.writePolicyDefault.totalTimeout = totalTimeoutMs;
        clientPolicy.writePolicyDefault.socketTimeout = socketTimeoutMs;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
        // Append+trim is not idempotent, a blind client-side resend could double-append
        policy.maxRetries = 0;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
        policy.maxRetries = maxRetries;
        policy.sleepBetweenRetries = sleepBetweenRetriesMs;
        return policy;
    }

    @Bean
    public ScanPolicy defaultScanPolicy() {
        ScanPolicy policy = new ScanPolicy();
        policy.concurrentNodes = true;
        policy.includeBinData = true;
        policy.totalTimeout = totalTimeoutMs * 10;
        policy.socketTimeout = socketTimeoutMs * 10;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
