package org.tabbit.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tabbit.model.RoundRecord;
import org.tabbit.model.Tournament;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores each tournament as a directory holding tournament.json and one round-NN.json per round.
 * Files are written atomically to prevent partial writes.
 */
public class JsonFileTournamentRepository implements TournamentRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTournamentRepository.class);

    private static final String TOURNAMENT_FILE = "tournament.json";
    private static final Pattern ROUND_FILE = Pattern.compile("round-(\\d+)\\.json");

    private final Path dataDir;
    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;

    public JsonFileTournamentRepository(Path dataDir, ObjectMapper objectMapper) {
        this.dataDir = dataDir;
        this.objectMapper = objectMapper;
        this.writer = ObjectMapperFactory.prettyWriter(objectMapper);
    }

    @Override
    public List<Tournament> listTournaments() {
        List<Tournament> result = new ArrayList<>();
        if (!Files.isDirectory(dataDir)) {
            return result;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataDir)) {
            for (Path entry : stream) {
                Path metaPath = entry.resolve(TOURNAMENT_FILE);
                if (Files.isDirectory(entry) && Files.exists(metaPath)) {
                    result.add(objectMapper.readValue(metaPath.toFile(), Tournament.class));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list tournaments in " + dataDir, e);
        }
        result.sort(Comparator.comparing(Tournament::id));
        return result;
    }

    @Override
    public Optional<Tournament> findTournament(String tournamentId) {
        Path metaPath = tournamentDir(tournamentId).resolve(TOURNAMENT_FILE);
        if (!Files.exists(metaPath)) {
            return Optional.empty();
        }
        return Optional.of(read(metaPath, Tournament.class));
    }

    @Override
    public void saveTournament(Tournament tournament) {
        write(tournamentDir(tournament.id()), TOURNAMENT_FILE, tournament);
    }

    @Override
    public List<RoundRecord> findRounds(String tournamentId) {
        Path dir = tournamentDir(tournamentId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.list(dir)) {
            return paths
                .filter(p -> ROUND_FILE.matcher(p.getFileName().toString()).matches())
                .sorted(Comparator.comparingInt(JsonFileTournamentRepository::roundNumber))
                .map(p -> read(p, RoundRecord.class))
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list rounds of " + tournamentId, e);
        }
    }

    @Override
    public Optional<RoundRecord> findRound(String tournamentId, int sequence) {
        Path roundPath = tournamentDir(tournamentId).resolve(roundFileName(sequence));
        if (!Files.exists(roundPath)) {
            return Optional.empty();
        }
        return Optional.of(read(roundPath, RoundRecord.class));
    }

    @Override
    public void saveRound(String tournamentId, RoundRecord round) {
        Path dir = tournamentDir(tournamentId);
        if (!Files.exists(dir.resolve(TOURNAMENT_FILE))) {
            throw new TournamentNotFoundException("Tournament not found: " + tournamentId);
        }
        write(dir, roundFileName(round.sequence()), round);
    }

    @Override
    public void deleteTournament(String tournamentId) {
        Path dir = tournamentDir(tournamentId);
        if (!Files.exists(dir.resolve(TOURNAMENT_FILE))) {
            throw new TournamentNotFoundException("Tournament not found: " + tournamentId);
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + dir, e);
        }
        log.debug("Deleted {}", dir);
    }

    @Override
    public void deleteRound(String tournamentId, int sequence) {
        Path roundPath = tournamentDir(tournamentId).resolve(roundFileName(sequence));
        try {
            if (!Files.deleteIfExists(roundPath)) {
                throw new TournamentNotFoundException(
                    "Round " + sequence + " not found in tournament " + tournamentId);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + roundPath, e);
        }
        log.debug("Deleted {}", roundPath);
    }

    private Path tournamentDir(String tournamentId) {
        validateName(tournamentId);
        return dataDir.resolve(tournamentId);
    }

    private <T> T read(Path path, Class<T> type) {
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    private void write(Path dir, String filename, Object value) {
        Path target = dir.resolve(filename);
        Path temp = dir.resolve(filename + ".tmp");
        try {
            Files.createDirectories(dir);
            writer.writeValue(temp.toFile(), value);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        log.debug("Wrote {}", target);
    }

    static String roundFileName(int sequence) {
        return String.format("round-%02d.json", sequence);
    }

    private static int roundNumber(Path path) {
        Matcher matcher = ROUND_FILE.matcher(path.getFileName().toString());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a round file: " + path);
        }
        return Integer.parseInt(matcher.group(1));
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new TournamentNotFoundException("Invalid tournament id: " + name);
        }
    }
}
