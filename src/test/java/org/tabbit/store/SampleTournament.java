package org.tabbit.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Copies the sample tournament fixture (four teams, round 1 completed) into a data directory.
 */
public final class SampleTournament {

    public static final String ID = "sample";

    private SampleTournament() {}

    public static Path copyTo(Path dataDir) throws IOException {
        Path dir = Files.createDirectories(dataDir.resolve(ID));
        for (String file : new String[] {"tournament.json", "round-01.json"}) {
            try (InputStream in = SampleTournament.class.getResourceAsStream("/sample-tournament/" + file)) {
                if (in == null) {
                    throw new IOException("Missing fixture " + file);
                }
                Files.copy(in, dir.resolve(file));
            }
        }
        return dir;
    }
}
