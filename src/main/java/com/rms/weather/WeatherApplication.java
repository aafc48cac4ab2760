package com.rms.weather;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.cassandra.CassandraAutoConfiguration;

/**
 * Station observation service: consumes observations from JetStream, stores
 * them in Cassandra and answers quorum-consistent station queries over HTTP.
 *
 * <p>The {@code CqlSession} is created by {@code CassandraSessionConfig}, only
 * when the Cassandra store is selected.</p>
 */
@SpringBootApplication(exclude = CassandraAutoConfiguration.class)
public class WeatherApplication {

    public static void main(String[] args) {
        SpringApplication.run(WeatherApplication.class, args);
    }
}
