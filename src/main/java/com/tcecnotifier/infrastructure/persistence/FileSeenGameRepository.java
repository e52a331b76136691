package com.tcecnotifier.infrastructure.persistence;

import com.tcecnotifier.domain.model.PgnGame;
import com.tcecnotifier.domain.ports.SeenGameRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Seen-games store backed by an append-only text file.
 *
 * Each line holds the identity hash of one announced game as an unsigned
 * decimal number. The file is read fully on load and only ever appended to.
 * Appends are written synchronously, so a game is on disk once {@link #add} returns.
 */
public class FileSeenGameRepository implements SeenGameRepository, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(FileSeenGameRepository.class);

    private final Set<Long> state;
    private final BufferedWriter writer;

    private FileSeenGameRepository(Set<Long> state, BufferedWriter writer) {
        this.state = state;
        this.writer = writer;
    }

    /**
     * Loads the store, creating an empty state file if there is none.
     *
     * @throws SeenGameStoreException if a line is not a game hash
     * @throws IOException if the file cannot be read or opened for appending
     */
    public static FileSeenGameRepository load(Path stateFile) throws IOException {
        Path parent = stateFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (Files.notExists(stateFile)) {
            Files.createFile(stateFile);
        }

        List<String> lines = Files.readAllLines(stateFile, StandardCharsets.UTF_8);
        Set<Long> state = new HashSet<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                state.add(Long.parseUnsignedLong(line));
            } catch (NumberFormatException e) {
                throw new SeenGameStoreException(
                    "Bad state file " + stateFile + " at line " + (i + 1) + ": '" + line + "'", e);
            }
        }

        BufferedWriter writer = Files.newBufferedWriter(stateFile, StandardCharsets.UTF_8,
            StandardOpenOption.WRITE, StandardOpenOption.APPEND, StandardOpenOption.DSYNC);

        logger.info("Loaded {} seen games from {}", state.size(), stateFile);
        return new FileSeenGameRepository(state, writer);
    }

    @Override
    public synchronized boolean contains(PgnGame game) {
        return state.contains(game.identityHash());
    }

    @Override
    public synchronized void add(PgnGame game) throws IOException {
        long hash = game.identityHash();
        state.add(hash);

        writer.write(Long.toUnsignedString(hash));
        writer.newLine();
        writer.flush();
    }

    @Override
    public synchronized int size() {
        return state.size();
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
