package org.tabbit.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.tabbit.runner.RoundManager;
import org.tabbit.runner.TournamentLocks;
import org.tabbit.runner.TournamentRegistry;
import org.tabbit.store.JsonFileTournamentRepository;
import org.tabbit.store.ObjectMapperFactory;
import org.tabbit.store.TournamentRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;

/**
 * Main application class for the Tabbit server.
 * Serves the tournament API and pushes round events over STOMP.
 */
@SpringBootApplication
public class TabbitServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TabbitServerApplication.class, args);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.create();
    }

    @Bean
    public TournamentRepository tournamentRepository(
            @Value("${tabbit.data-dir:./data}") String dataDir,
            ObjectMapper objectMapper) {
        return new JsonFileTournamentRepository(Path.of(dataDir), objectMapper);
    }

    @Bean
    public TournamentLocks tournamentLocks(@Value("${tabbit.lock-stripes:64}") int stripes) {
        return new TournamentLocks(stripes);
    }

    @Bean
    public TournamentRegistry tournamentRegistry(TournamentRepository repository, TournamentLocks locks) {
        return new TournamentRegistry(repository, locks);
    }

    @Bean
    public RoundManager roundManager(TournamentRepository repository, TournamentLocks locks,
                                     RoundEventPublisher publisher) {
        return new RoundManager(repository, locks, publisher);
    }
}
